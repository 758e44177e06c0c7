package com.kbdash.output;

import com.kbdash.formula.AggregationRef;
import com.kbdash.formula.ParseOutcome;
import com.kbdash.formula.PipelineRef;
import com.kbdash.json.JsonNode;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

// Absent optional attributes are left out rather than written as null
public final class OutcomeReport {
    private OutcomeReport() {
    }

    public static JsonNode.JsonObject toJson(ParseOutcome outcome) {
        MutableList<JsonNode> aggregations = Lists.mutable.empty();
        outcome.aggregations().forEachWithIndex((ref, index) -> aggregations.add(aggregation(ref, index)));

        MutableList<JsonNode> pipelineOps = Lists.mutable.empty();
        outcome.pipelineOps().forEachWithIndex((ref, index) -> pipelineOps.add(pipeline(ref, index)));

        return JsonNode.JsonObject.empty()
                .with("formula", outcome.sourceText())
                .with("literal", new JsonNode.JsonBoolean(outcome.isLiteral()))
                .with("aggregations", new JsonNode.JsonArray(aggregations))
                .with("pipelineOps", new JsonNode.JsonArray(pipelineOps));
    }

    private static JsonNode aggregation(AggregationRef ref, int index) {
        JsonNode.JsonObject json = JsonNode.JsonObject.empty()
                .with("index", JsonNode.JsonNumber.of(index))
                .with("name", ref.writtenName())
                .with("operationType", ref.operationType());
        json = withOptional(json, "field", ref.field());
        json = withOptional(json, "filter", ref.filter());
        if (ref.filterLanguage() != null) {
            json = json.with("filterLanguage", ref.filterLanguage().queryLanguage());
        }
        if (ref.percentile() != null) {
            json = json.with("percentile", JsonNode.JsonNumber.of(ref.percentile()));
        }
        json = withOptional(json, "shift", ref.timeShift());
        json = withOptional(json, "reducedTimeRange", ref.reducedTimeRange());
        return withSpan(json, ref.span().start(), ref.span().end(), ref.matchedText());
    }

    private static JsonNode pipeline(PipelineRef ref, int index) {
        JsonNode.JsonObject json = JsonNode.JsonObject.empty()
                .with("index", JsonNode.JsonNumber.of(index))
                .with("name", ref.writtenName())
                .with("operationType", ref.operationType())
                .with("innerIndex", JsonNode.JsonNumber.of(ref.innerIndex()));
        if (ref.window() != null) {
            json = json.with("window", JsonNode.JsonNumber.of(ref.window()));
        }
        json = withOptional(json, "unit", ref.unit());
        return withSpan(json, ref.span().start(), ref.span().end(), ref.matchedText());
    }

    private static JsonNode.JsonObject withOptional(JsonNode.JsonObject json, String key, String value) {
        return value == null ? json : json.with(key, value);
    }

    private static JsonNode.JsonObject withSpan(JsonNode.JsonObject json, int start, int end, String text) {
        return json
                .with("start", JsonNode.JsonNumber.of(start))
                .with("end", JsonNode.JsonNumber.of(end))
                .with("text", text);
    }
}
