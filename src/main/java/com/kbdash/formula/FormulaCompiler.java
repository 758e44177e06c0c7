package com.kbdash.formula;

import com.kbdash.formula.grammar.Expression;
import com.kbdash.formula.grammar.FormulaParser;
import com.kbdash.json.JsonNode;
import org.eclipse.collections.api.map.primitive.IntObjectMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Entry point for compiling Lens formulas. Parsing is a pure function of the formula
 * text, so outcomes are memoized by text in a bounded cache; failed parses are not
 * cached. Instances are safe for concurrent use.
 */
public class FormulaCompiler {
    public static final String CACHE_CAPACITY_PROPERTY = "kbformula.cache.capacity";
    public static final int DEFAULT_CACHE_CAPACITY = 1024;

    private static final Logger logger = LoggerFactory.getLogger(FormulaCompiler.class);

    private static final FormulaCompiler SHARED = new FormulaCompiler(
            FunctionCatalog.standard(), Integer.getInteger(CACHE_CAPACITY_PROPERTY, DEFAULT_CACHE_CAPACITY));

    private final FormulaParser parser = new FormulaParser();
    private final ReferenceExtractor extractor;
    private final TinymathAstBuilder astBuilder = new TinymathAstBuilder();
    private final ConcurrentMap<String, ParseOutcome> cache = new ConcurrentHashMap<>();
    private final int cacheCapacity;

    /**
     * @param cacheCapacity maximum number of memoized outcomes; 0 disables caching
     */
    public FormulaCompiler(FunctionCatalog catalog, int cacheCapacity) {
        if (cacheCapacity < 0) {
            throw new IllegalArgumentException("Cache capacity must not be negative: " + cacheCapacity);
        }
        this.extractor = new ReferenceExtractor(catalog);
        this.cacheCapacity = cacheCapacity;
    }

    public FormulaCompiler() {
        this(FunctionCatalog.standard(), DEFAULT_CACHE_CAPACITY);
    }

    /**
     * Process-wide compiler using the standard catalog. The cache capacity comes from the
     * {@value #CACHE_CAPACITY_PROPERTY} system property when set.
     */
    public static FormulaCompiler shared() {
        return SHARED;
    }

    /**
     * Parses a formula into its aggregation references, pipeline operations and raw AST.
     *
     * @throws FormulaSyntaxException if the formula is malformed
     */
    public ParseOutcome parse(String formula) {
        if (cacheCapacity == 0 || formula == null) {
            return compile(formula);
        }

        ParseOutcome cached = cache.get(formula);
        if (cached != null) {
            logger.debug("Formula cache hit: {}", formula);
            return cached;
        }

        ParseOutcome outcome = compile(formula);
        // Cleared wholesale once full
        if (cache.size() >= cacheCapacity) {
            logger.debug("Formula cache reached {} entries, clearing", cacheCapacity);
            cache.clear();
        }
        ParseOutcome previous = cache.putIfAbsent(formula, outcome);
        return previous != null ? previous : outcome;
    }

    /**
     * Builds the tinymath AST for a parsed formula, replacing aggregation leaves with the
     * identifiers in {@code aggregationIds}.
     */
    public JsonNode substitute(ParseOutcome outcome, IntObjectMap<String> aggregationIds) {
        return astBuilder.substitute(outcome, aggregationIds);
    }

    /**
     * As {@link #substitute(ParseOutcome, IntObjectMap)}, also replacing pipeline leaves
     * with the identifiers in {@code pipelineIds}.
     */
    public JsonNode substitute(ParseOutcome outcome, IntObjectMap<String> aggregationIds, IntObjectMap<String> pipelineIds) {
        return astBuilder.substitute(outcome, aggregationIds, pipelineIds);
    }

    int cachedFormulaCount() {
        return cache.size();
    }

    private ParseOutcome compile(String formula) {
        Expression expression = parser.parse(formula);
        ParseOutcome outcome = extractor.extract(expression, formula);
        logger.debug("Parsed formula '{}': {} aggregation(s), {} pipeline operation(s)",
                formula, outcome.aggregations().size(), outcome.pipelineOps().size());
        return outcome;
    }
}
