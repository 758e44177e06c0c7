package com.kbdash.formula;

import com.kbdash.formula.grammar.FormulaParser;
import com.kbdash.formula.grammar.Operator;
import com.kbdash.json.JsonNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvFileSource;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Reference extraction for Lens formulas: which aggregations and pipeline operations a
 * formula needs, in what order, with which arguments.
 */
public class ReferenceExtractorTest {

    private final FormulaParser parser = new FormulaParser();
    private final ReferenceExtractor extractor = new ReferenceExtractor(FunctionCatalog.standard());

    private ParseOutcome parse(String formula) {
        return extractor.extract(parser.parse(formula), formula);
    }

    private AggregationRef onlyAggregation(ParseOutcome outcome) {
        assertEquals(1, outcome.aggregations().size(), "Expected exactly one aggregation");
        return outcome.aggregations().getOnly();
    }

    // ============================================================
    // Literals
    // ============================================================

    @Test
    public void testIntegerLiteral() {
        ParseOutcome outcome = parse("42");
        assertTrue(outcome.aggregations().isEmpty());
        assertTrue(outcome.pipelineOps().isEmpty());
        assertTrue(outcome.isLiteral());
        assertEquals(new FormulaNode.Literal(JsonNode.JsonNumber.of(42L)), outcome.rawAst());
        assertEquals(42L, outcome.literalValue());
    }

    @Test
    public void testFloatLiteral() {
        ParseOutcome outcome = parse("3.14");
        assertTrue(outcome.isLiteral());
        assertEquals(3.14, outcome.literalValue());
    }

    @Test
    public void testArithmeticOnLiteralsIsNotALiteral() {
        ParseOutcome outcome = parse("1 + 2");
        assertFalse(outcome.isLiteral());
        assertTrue(outcome.aggregations().isEmpty());
        assertThrows(IllegalStateException.class, outcome::literalValue);
    }

    @Test
    public void testBareFieldIsNotALiteral() {
        ParseOutcome outcome = parse("bytes");
        assertFalse(outcome.isLiteral());
        assertEquals(new FormulaNode.Variable("bytes"), outcome.rawAst());
    }

    // ============================================================
    // Aggregations
    // ============================================================

    @Test
    public void testCountWithoutField() {
        ParseOutcome outcome = parse("count()");
        AggregationRef count = onlyAggregation(outcome);
        assertEquals("count", count.writtenName());
        assertEquals(FunctionKind.COUNT, count.operationKind());
        assertEquals("count", count.operationType());
        assertNull(count.field());
        assertNull(count.filter());
        assertNull(count.filterLanguage());
        assertEquals(new Span(0, 7), count.span());
        assertEquals("count()", count.matchedText());
        assertFalse(outcome.isLiteral());
        assertEquals(new FormulaNode.AggregationLeaf(0), outcome.rawAst());
    }

    @Test
    public void testAvgAlias() {
        AggregationRef avg = onlyAggregation(parse("avg(field='cpu.usage')"));
        assertEquals("avg", avg.writtenName());
        assertEquals(FunctionKind.AVERAGE, avg.operationKind());
        assertEquals("average", avg.operationType());
        assertEquals("cpu.usage", avg.field());
    }

    @Test
    public void testWrittenNameKeepsCase() {
        AggregationRef sum = onlyAggregation(parse("SUM(bytes)"));
        assertEquals("SUM", sum.writtenName());
        assertEquals(FunctionKind.SUM, sum.operationKind());
    }

    @ParameterizedTest
    @CsvSource({
            "unique_count(client.ip), UNIQUE_COUNT",
            "unique(client.ip), UNIQUE_COUNT",
            "distinct_count(client.ip), UNIQUE_COUNT",
            "median(bytes), MEDIAN",
            "last_value(host.name), LAST_VALUE",
            "standard_deviation(bytes), STANDARD_DEVIATION",
            "max(bytes), MAX",
            "min(bytes), MIN"
    })
    public void testAggregationKinds(String formula, FunctionKind expected) {
        assertEquals(expected, onlyAggregation(parse(formula)).operationKind());
    }

    @Test
    public void testPositionalField() {
        assertEquals("response.time", onlyAggregation(parse("average(response.time)")).field());
    }

    @Test
    public void testQuotedPositionalField() {
        assertEquals("my field", onlyAggregation(parse("sum('my field')")).field());
    }

    @Test
    public void testNamedFieldWinsWhenGivenAfterPositional() {
        assertEquals("b", onlyAggregation(parse("sum(a, field='b')")).field());
    }

    @Test
    public void testKqlFilter() {
        AggregationRef count = onlyAggregation(parse("count(kql=\"status:200\")"));
        assertEquals("status:200", count.filter());
        assertEquals(FilterLanguage.KQL, count.filterLanguage());
        assertNull(count.field());
    }

    @Test
    public void testLuceneFilter() {
        AggregationRef count = onlyAggregation(parse("count(lucene='status:[400 TO 499]')"));
        assertEquals("status:[400 TO 499]", count.filter());
        assertEquals(FilterLanguage.LUCENE, count.filterLanguage());
    }

    @Test
    public void testFieldAndFilterTogether() {
        AggregationRef sum = onlyAggregation(parse("sum(field='bytes', kql='status:success')"));
        assertEquals("bytes", sum.field());
        assertEquals("status:success", sum.filter());
    }

    @Test
    public void testNamedPercentile() {
        AggregationRef percentile = onlyAggregation(parse("percentile(field='latency', percentile=95)"));
        assertEquals(FunctionKind.PERCENTILE, percentile.operationKind());
        assertEquals("latency", percentile.field());
        assertEquals(95.0, percentile.percentile().doubleValue());
    }

    @Test
    public void testPositionalPercentile() {
        AggregationRef percentile = onlyAggregation(parse("percentile(latency, 99.9)"));
        assertEquals("latency", percentile.field());
        assertEquals(99.9, percentile.percentile().doubleValue());
    }

    @Test
    public void testQuotedPercentileIsReadAsNumber() {
        assertEquals(50.0, onlyAggregation(parse("percentile(bytes, percentile='50')")).percentile().doubleValue());
    }

    @Test
    public void testPercentileRank() {
        AggregationRef rank = onlyAggregation(parse("percentile_rank(field='bytes', percentile=1000)"));
        assertEquals(FunctionKind.PERCENTILE_RANK, rank.operationKind());
        assertEquals(1000.0, rank.percentile().doubleValue());
    }

    @Test
    public void testTimeShift() {
        AggregationRef sum = onlyAggregation(parse("sum(bytes, shift='1d')"));
        assertEquals("bytes", sum.field());
        assertEquals("1d", sum.timeShift());
    }

    @Test
    public void testFilterAndShiftTogether() {
        AggregationRef count = onlyAggregation(parse("count(kql='status:error', shift='1w')"));
        assertEquals("status:error", count.filter());
        assertEquals("1w", count.timeShift());
    }

    @Test
    public void testReducedTimeRange() {
        AggregationRef average = onlyAggregation(parse("average(response.time, reducedTimeRange='5m')"));
        assertEquals("response.time", average.field());
        assertEquals("5m", average.reducedTimeRange());
        assertNull(average.timeShift());
    }

    @Test
    public void testYearOverYear() {
        ParseOutcome outcome = parse("sum(revenue) - sum(revenue, shift='1y')");
        assertEquals(2, outcome.aggregations().size());
        assertNull(outcome.aggregations().get(0).timeShift());
        assertEquals("1y", outcome.aggregations().get(1).timeShift());
    }

    // ============================================================
    // Ordering, spans and duplicates
    // ============================================================

    @Test
    public void testAggregationsInSourceOrder() {
        ParseOutcome outcome = parse("(max(field='response.time') - min(field='response.time')) / average(field='response.time')");
        assertEquals(3, outcome.aggregations().size());
        assertEquals(FunctionKind.MAX, outcome.aggregations().get(0).operationKind());
        assertEquals(FunctionKind.MIN, outcome.aggregations().get(1).operationKind());
        assertEquals(FunctionKind.AVERAGE, outcome.aggregations().get(2).operationKind());
        assertTrue(outcome.aggregations().allSatisfy(ref -> "response.time".equals(ref.field())));
    }

    @Test
    public void testSpansAndMatchedText() {
        String formula = "count(kql=\"status:error\") / count()";
        ParseOutcome outcome = parse(formula);
        AggregationRef errors = outcome.aggregations().get(0);
        AggregationRef all = outcome.aggregations().get(1);

        assertEquals(new Span(0, 25), errors.span());
        assertEquals("count(kql=\"status:error\")", errors.matchedText());
        assertEquals(new Span(28, 35), all.span());
        assertEquals("count()", all.matchedText());
        assertEquals(all.matchedText(), all.span().slice(formula));
    }

    @Test
    public void testIdenticalCallsAreNotDeduplicated() {
        ParseOutcome outcome = parse("sum(bytes) / sum(bytes)");
        assertEquals(2, outcome.aggregations().size());
        assertEquals(new FormulaNode.BinaryOp(Operator.DIVIDE,
                new FormulaNode.AggregationLeaf(0), new FormulaNode.AggregationLeaf(1)), outcome.rawAst());
    }

    @Test
    public void testIfelseConditionYieldsTwoAggregations() {
        // Regression pin: the condition's count() and the branch's sum(bytes)
        ParseOutcome outcome = parse("ifelse(count() > 100, sum(bytes), 0)");
        assertEquals(2, outcome.aggregations().size());
        assertEquals(FunctionKind.COUNT, outcome.aggregations().get(0).operationKind());
        assertEquals(FunctionKind.SUM, outcome.aggregations().get(1).operationKind());
        assertEquals("bytes", outcome.aggregations().get(1).field());
    }

    @Test
    public void testMathFunctionsOnlyRecurse() {
        ParseOutcome outcome = parse("round(abs(sum(profit) - sum(cost)))");
        assertEquals(2, outcome.aggregations().size());
        assertTrue(outcome.pipelineOps().isEmpty());

        FormulaNode.Call round = (FormulaNode.Call) outcome.rawAst();
        assertEquals("round", round.name());
        FormulaNode.Call abs = (FormulaNode.Call) round.args().getOnly();
        assertEquals("abs", abs.name());
        assertEquals(new FormulaNode.BinaryOp(Operator.SUBTRACT,
                new FormulaNode.AggregationLeaf(0), new FormulaNode.AggregationLeaf(1)), abs.args().getOnly());
    }

    @Test
    public void testUnknownFunctionIsTreatedAsMath() {
        ParseOutcome outcome = parse("my_func(count(), 2)");
        assertEquals(1, outcome.aggregations().size());
        assertEquals("my_func", ((FormulaNode.Call) outcome.rawAst()).name());
    }

    // ============================================================
    // Pipeline operations
    // ============================================================

    @Test
    public void testCounterRate() {
        ParseOutcome outcome = parse("counter_rate(max(postgresql.operations))");

        AggregationRef max = onlyAggregation(outcome);
        assertEquals(FunctionKind.MAX, max.operationKind());
        assertEquals("postgresql.operations", max.field());

        PipelineRef rate = outcome.pipelineOps().getOnly();
        assertEquals("counter_rate", rate.writtenName());
        assertEquals(FunctionKind.COUNTER_RATE, rate.operationKind());
        assertEquals(0, rate.innerIndex());
        assertEquals("counter_rate(max(postgresql.operations))", rate.matchedText());
        assertEquals(new FormulaNode.PipelineLeaf(0), outcome.rawAst());
    }

    @Test
    public void testDerivativeAliasesDifferences() {
        ParseOutcome outcome = parse("derivative(sum(bytes))");

        AggregationRef sum = onlyAggregation(outcome);
        assertEquals(FunctionKind.SUM, sum.operationKind());
        assertEquals("bytes", sum.field());

        PipelineRef derivative = outcome.pipelineOps().getOnly();
        assertEquals("derivative", derivative.writtenName());
        assertEquals(FunctionKind.DIFFERENCES, derivative.operationKind());
        assertEquals("differences", derivative.operationType());
        assertEquals(0, derivative.innerIndex());
    }

    @Test
    public void testMultipleCounterRates() {
        ParseOutcome outcome = parse("counter_rate(max(in.bytes)) + counter_rate(max(out.bytes))");
        assertEquals(2, outcome.aggregations().size());
        assertEquals("in.bytes", outcome.aggregations().get(0).field());
        assertEquals("out.bytes", outcome.aggregations().get(1).field());

        assertEquals(2, outcome.pipelineOps().size());
        assertEquals(0, outcome.pipelineOps().get(0).innerIndex());
        assertEquals(1, outcome.pipelineOps().get(1).innerIndex());
        assertEquals(new FormulaNode.BinaryOp(Operator.ADD,
                new FormulaNode.PipelineLeaf(0), new FormulaNode.PipelineLeaf(1)), outcome.rawAst());
    }

    @Test
    public void testMovingAverageWindow() {
        ParseOutcome outcome = parse("moving_average(average(field='response.time'), window=5)");
        PipelineRef movingAverage = outcome.pipelineOps().getOnly();
        assertEquals(FunctionKind.MOVING_AVERAGE, movingAverage.operationKind());
        assertEquals(5, movingAverage.window().intValue());
        assertEquals(0, movingAverage.innerIndex());
    }

    @Test
    public void testPipelineWithoutWindow() {
        PipelineRef cumulativeSum = parse("cumulative_sum(count())").pipelineOps().getOnly();
        assertNull(cumulativeSum.window());
        assertNull(cumulativeSum.unit());
    }

    @Test
    public void testTimeScaleUnit() {
        ParseOutcome outcome = parse("time_scale(sum(bytes), unit='s')");
        PipelineRef timeScale = outcome.pipelineOps().getOnly();
        assertEquals(FunctionKind.TIME_SCALE, timeScale.operationKind());
        assertEquals("s", timeScale.unit());
        assertEquals(0, timeScale.innerIndex());
    }

    @Test
    public void testNormalizeUnitAroundNestedPipeline() {
        ParseOutcome outcome = parse("normalize(counter_rate(max(bytes)), unit='h')");
        assertEquals(2, outcome.pipelineOps().size());
        PipelineRef normalize = outcome.pipelineOps().get(1);
        assertEquals(FunctionKind.NORMALIZE, normalize.operationKind());
        assertEquals("h", normalize.unit());
        assertNull(outcome.pipelineOps().get(0).unit());
    }

    @Test
    public void testUnrecognisedArgumentsAreSkipped() {
        AggregationRef sum = onlyAggregation(parse("sum(bytes, colour='red')"));
        assertEquals("bytes", sum.field());

        PipelineRef rate = parse("counter_rate(max(bytes), format='bits')").pipelineOps().getOnly();
        assertEquals(0, rate.innerIndex());
    }

    @Test
    public void testNestedPipelineResolvesToInnermostAggregation() {
        ParseOutcome outcome = parse("time_scale(counter_rate(max(bytes)))");
        assertEquals(1, outcome.aggregations().size());
        assertEquals(2, outcome.pipelineOps().size());
        assertEquals(FunctionKind.COUNTER_RATE, outcome.pipelineOps().get(0).operationKind());
        assertEquals(FunctionKind.TIME_SCALE, outcome.pipelineOps().get(1).operationKind());
        assertEquals(0, outcome.pipelineOps().get(1).innerIndex());
        assertEquals(new FormulaNode.PipelineLeaf(1), outcome.rawAst());
    }

    @Test
    public void testPipelineInsideArithmeticKeepsIndices() {
        ParseOutcome outcome = parse("count() + overall_sum(sum(field='bytes'))");
        assertEquals(2, outcome.aggregations().size());
        assertEquals(FunctionKind.OVERALL_SUM, outcome.pipelineOps().getOnly().operationKind());
        assertEquals(1, outcome.pipelineOps().getOnly().innerIndex());
    }

    @Test
    public void testInnerIndicesAlwaysInRange() {
        ParseOutcome outcome = parse("normalize(sum(a)) + differences(max(b)) - cumulative_sum(count(kql='x')) * counter_rate(min(c))");
        assertEquals(4, outcome.aggregations().size());
        assertEquals(4, outcome.pipelineOps().size());
        outcome.pipelineOps().forEachWithIndex((ref, index) -> {
            assertEquals(index, ref.innerIndex());
            assertTrue(ref.innerIndex() < outcome.aggregations().size());
        });
    }

    // ============================================================
    // Argument errors
    // ============================================================

    @ParameterizedTest
    @ValueSource(strings = {
            "counter_rate(5)",
            "counter_rate(bytes)",
            "counter_rate()",
            "counter_rate(max(a), max(b))",
            "sum(a, b)",
            "sum(a + b)",
            "count(5)",
            "sum(bytes, unit='s')",
            "sum(bytes, window=3)",
            "moving_average(sum(bytes), kql='x')",
            "moving_average(sum(bytes), window=2.5)",
            "percentile(bytes, percentile='high')",
            "abs(count(), field='x')"
    })
    public void testArgumentErrors(String formula) {
        assertThrows(FormulaSyntaxException.class, () -> parse(formula));
    }

    @Test
    public void testPipelineWithoutAggregationReportsArgumentPosition() {
        FormulaSyntaxException e = assertThrows(FormulaSyntaxException.class, () -> parse("counter_rate(bytes)"));
        assertEquals(13, e.position());
        assertEquals("'counter_rate' must wrap an aggregation", e.reason());
    }

    @Test
    public void testMisplacedArgumentReportsArgumentPosition() {
        FormulaSyntaxException e = assertThrows(FormulaSyntaxException.class, () -> parse("sum(bytes, window=3)"));
        assertEquals(11, e.position());
        assertEquals("Argument 'window' is not accepted by 'sum'", e.reason());
    }

    // ============================================================
    // Library of real dashboard formulas
    // ============================================================

    @ParameterizedTest
    @CsvFileSource(resources = "/formulas/lens-formulas.csv")
    public void testDashboardFormulas(String formula, int aggregations, int pipelineOps) {
        ParseOutcome outcome = parse(formula);
        assertEquals(aggregations, outcome.aggregations().size());
        assertEquals(pipelineOps, outcome.pipelineOps().size());
        assertEquals(formula, outcome.sourceText());
        outcome.pipelineOps().each(ref -> assertTrue(ref.innerIndex() >= 0 && ref.innerIndex() < aggregations));
        outcome.aggregations().each(ref -> assertEquals(ref.matchedText(), ref.span().slice(formula)));
    }
}
