package com.kbdash.formula;

import com.kbdash.json.JsonNode;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.primitive.IntObjectMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.primitive.IntObjectMaps;

/**
 * Turns a parsed formula into the {@code tinymathAST} Lens stores on a formula column,
 * with each aggregation and pipeline leaf replaced by the identifier of the helper
 * column the caller built for it.
 *
 * <p>Operators and math calls become {@code {"type": "function", "name": ..., "args": [...]}}.
 * A leaf whose index has no identifier becomes a placeholder such as {@code unknown_agg_2}.
 */
public class TinymathAstBuilder {

    public JsonNode substitute(ParseOutcome outcome, IntObjectMap<String> aggregationIds) {
        return substitute(outcome, aggregationIds, IntObjectMaps.immutable.empty());
    }

    public JsonNode substitute(ParseOutcome outcome, IntObjectMap<String> aggregationIds, IntObjectMap<String> pipelineIds) {
        if (outcome.isLiteral()) {
            return ((FormulaNode.Literal) outcome.rawAst()).value();
        }
        return toJson(outcome.rawAst(), aggregationIds, pipelineIds);
    }

    private JsonNode toJson(FormulaNode node, IntObjectMap<String> aggregationIds, IntObjectMap<String> pipelineIds) {
        if (node instanceof FormulaNode.Literal literal) {
            return literal.value();
        }
        if (node instanceof FormulaNode.Variable variable) {
            return new JsonNode.JsonString(variable.name());
        }
        if (node instanceof FormulaNode.AggregationLeaf leaf) {
            return new JsonNode.JsonString(aggregationIds.getIfAbsent(leaf.index(), () -> "unknown_agg_" + leaf.index()));
        }
        if (node instanceof FormulaNode.PipelineLeaf leaf) {
            return new JsonNode.JsonString(pipelineIds.getIfAbsent(leaf.index(), () -> "unknown_fullref_" + leaf.index()));
        }
        if (node instanceof FormulaNode.BinaryOp binary) {
            return function(binary.operator().functionName(), Lists.mutable.with(
                    toJson(binary.left(), aggregationIds, pipelineIds),
                    toJson(binary.right(), aggregationIds, pipelineIds)));
        }

        FormulaNode.Call call = (FormulaNode.Call) node;
        MutableList<JsonNode> args = Lists.mutable.empty();
        for (FormulaNode arg : call.args()) {
            args.add(toJson(arg, aggregationIds, pipelineIds));
        }
        return function(call.name(), args);
    }

    private static JsonNode.JsonObject function(String name, MutableList<JsonNode> args) {
        return JsonNode.JsonObject.empty()
                .with("type", "function")
                .with("name", name)
                .with("args", new JsonNode.JsonArray(args));
    }
}
