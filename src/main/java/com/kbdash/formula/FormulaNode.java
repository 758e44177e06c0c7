package com.kbdash.formula;

import com.kbdash.formula.grammar.Operator;
import com.kbdash.json.JsonNode;
import org.eclipse.collections.api.list.ImmutableList;

public sealed interface FormulaNode {
    record Literal(JsonNode.JsonNumber value) implements FormulaNode {}
    record Variable(String name) implements FormulaNode {}
    record AggregationLeaf(int index) implements FormulaNode {}
    record PipelineLeaf(int index) implements FormulaNode {}
    record BinaryOp(Operator operator, FormulaNode left, FormulaNode right) implements FormulaNode {}
    record Call(String name, ImmutableList<FormulaNode> args) implements FormulaNode {}
}
