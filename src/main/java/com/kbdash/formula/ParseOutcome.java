package com.kbdash.formula;

import org.eclipse.collections.api.list.ImmutableList;

/**
 * Everything one parse of a formula produces. Immutable; equal formulas give equal
 * outcomes.
 *
 * @param aggregations leaf aggregations in order of first appearance
 * @param pipelineOps  full-reference operations in order of first appearance
 * @param rawAst       arithmetic tree before identifier substitution
 * @param sourceText   the formula as given
 * @param isLiteral    true when the formula is a lone number; {@code rawAst} is then a
 *                     {@link FormulaNode.Literal}
 */
public record ParseOutcome(
        ImmutableList<AggregationRef> aggregations,
        ImmutableList<PipelineRef> pipelineOps,
        FormulaNode rawAst,
        String sourceText,
        boolean isLiteral) {

    public Number literalValue() {
        if (!isLiteral) {
            throw new IllegalStateException("Formula is not a literal: " + sourceText);
        }
        return ((FormulaNode.Literal) rawAst).value().numberValue();
    }
}
