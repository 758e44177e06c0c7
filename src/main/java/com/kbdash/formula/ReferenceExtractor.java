package com.kbdash.formula;

import com.kbdash.formula.grammar.Expression;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// Operands are visited before the call that uses them; identical calls are recorded separately
public class ReferenceExtractor {
    private static final Logger logger = LoggerFactory.getLogger(ReferenceExtractor.class);

    private final FunctionCatalog catalog;

    public ReferenceExtractor(FunctionCatalog catalog) {
        this.catalog = catalog;
    }

    public ParseOutcome extract(Expression root, String formula) {
        Walk walk = new Walk(formula);
        FormulaNode ast = walk.visit(root);

        boolean literal = ast instanceof FormulaNode.Literal
                && walk.aggregations.isEmpty()
                && walk.pipelineOps.isEmpty();

        return new ParseOutcome(
                walk.aggregations.toImmutable(),
                walk.pipelineOps.toImmutable(),
                ast,
                formula,
                literal);
    }

    private final class Walk {
        private final String formula;
        private final MutableList<AggregationRef> aggregations = Lists.mutable.empty();
        private final MutableList<PipelineRef> pipelineOps = Lists.mutable.empty();

        Walk(String formula) {
            this.formula = formula;
        }

        FormulaNode visit(Expression expression) {
            if (expression instanceof Expression.NumberLiteral number) {
                return new FormulaNode.Literal(number.value());
            }
            if (expression instanceof Expression.Text text) {
                return new FormulaNode.Variable(text.value());
            }
            if (expression instanceof Expression.Binary binary) {
                FormulaNode left = visit(binary.left());
                FormulaNode right = visit(binary.right());
                return new FormulaNode.BinaryOp(binary.operator(), left, right);
            }

            Expression.FunctionCall call = (Expression.FunctionCall) expression;
            FunctionKind kind = catalog.kindOf(call.name());
            if (kind == null) {
                return math(call);
            }
            return switch (kind.category()) {
                case AGGREGATION -> aggregation(call, kind);
                case PIPELINE -> pipeline(call, kind);
                case MATH -> math(call);
            };
        }

        private FormulaNode aggregation(Expression.FunctionCall call, FunctionKind kind) {
            String field = null;
            String filter = null;
            FilterLanguage filterLanguage = null;
            Double percentile = null;
            String timeShift = null;
            String reducedTimeRange = null;

            for (Expression.Argument argument : call.arguments()) {
                if (argument instanceof Expression.Named named) {
                    ArgumentKey key = acceptedKey(named, call, FunctionCategory.AGGREGATION);
                    if (key == null) {
                        continue;
                    }
                    switch (key) {
                        case FIELD -> field = key.stringValue(named.value());
                        case KQL -> {
                            filter = key.stringValue(named.value());
                            filterLanguage = FilterLanguage.KQL;
                        }
                        case LUCENE -> {
                            filter = key.stringValue(named.value());
                            filterLanguage = FilterLanguage.LUCENE;
                        }
                        case PERCENTILE -> percentile = key.numberValue(named.value(), formula);
                        case SHIFT -> timeShift = key.stringValue(named.value());
                        case REDUCED_TIME_RANGE -> reducedTimeRange = key.stringValue(named.value());
                        default -> throw notAccepted(named, call);
                    }
                    continue;
                }

                Expression value = ((Expression.Positional) argument).value();
                if (value instanceof Expression.Text text) {
                    if (field != null) {
                        throw new FormulaSyntaxException(
                                "'" + call.name() + "' takes a single field", value.start(), formula);
                    }
                    field = text.value();
                } else if (value instanceof Expression.NumberLiteral number
                        && kind.takesPercentile() && percentile == null) {
                    percentile = number.value().numberValue().doubleValue();
                } else {
                    throw new FormulaSyntaxException(
                            "'" + call.name() + "' expects a field name", value.start(), formula);
                }
            }

            Span span = new Span(call.start(), call.end());
            aggregations.add(new AggregationRef(
                    call.name(),
                    kind,
                    field,
                    filter,
                    filterLanguage,
                    percentile,
                    timeShift,
                    reducedTimeRange,
                    span,
                    span.slice(formula)));
            return new FormulaNode.AggregationLeaf(aggregations.size() - 1);
        }

        private FormulaNode pipeline(Expression.FunctionCall call, FunctionKind kind) {
            Integer window = null;
            String unit = null;
            MutableList<Expression> positional = Lists.mutable.empty();

            for (Expression.Argument argument : call.arguments()) {
                if (argument instanceof Expression.Named named) {
                    ArgumentKey key = acceptedKey(named, call, FunctionCategory.PIPELINE);
                    if (key == ArgumentKey.WINDOW) {
                        window = key.integerValue(named.value(), formula);
                    } else if (key == ArgumentKey.UNIT) {
                        unit = key.stringValue(named.value());
                    }
                } else {
                    positional.add(((Expression.Positional) argument).value());
                }
            }

            if (positional.size() != 1) {
                throw new FormulaSyntaxException(
                        "'" + call.name() + "' takes exactly one aggregation argument", call.start(), formula);
            }

            FormulaNode inner = visit(positional.getOnly());
            int innerIndex = firstAggregationIndex(inner);
            if (innerIndex < 0) {
                throw new FormulaSyntaxException(
                        "'" + call.name() + "' must wrap an aggregation", positional.getOnly().start(), formula);
            }

            Span span = new Span(call.start(), call.end());
            pipelineOps.add(new PipelineRef(call.name(), kind, innerIndex, window, unit, span, span.slice(formula)));
            return new FormulaNode.PipelineLeaf(pipelineOps.size() - 1);
        }

        private FormulaNode math(Expression.FunctionCall call) {
            if (!catalog.isKnownMathFunction(call.name())) {
                logger.debug("Treating unknown function '{}' as a math function", call.name());
            }

            MutableList<FormulaNode> args = Lists.mutable.empty();
            for (Expression.Argument argument : call.arguments()) {
                if (argument instanceof Expression.Named named) {
                    throw new FormulaSyntaxException(
                            "Math function '" + call.name() + "' does not accept named argument '" + named.key() + "'",
                            named.start(), formula);
                }
                args.add(visit(((Expression.Positional) argument).value()));
            }
            return new FormulaNode.Call(call.name(), args.toImmutable());
        }

        // A nested pipeline resolves to the aggregation it wraps
        private int firstAggregationIndex(FormulaNode node) {
            if (node instanceof FormulaNode.AggregationLeaf leaf) {
                return leaf.index();
            }
            if (node instanceof FormulaNode.PipelineLeaf leaf) {
                return pipelineOps.get(leaf.index()).innerIndex();
            }
            if (node instanceof FormulaNode.BinaryOp binary) {
                int left = firstAggregationIndex(binary.left());
                return left >= 0 ? left : firstAggregationIndex(binary.right());
            }
            if (node instanceof FormulaNode.Call call) {
                for (FormulaNode arg : call.args()) {
                    int index = firstAggregationIndex(arg);
                    if (index >= 0) {
                        return index;
                    }
                }
            }
            return -1;
        }

        // Null for keys this extractor does not read; they are skipped
        private ArgumentKey acceptedKey(Expression.Named named, Expression.FunctionCall call, FunctionCategory category) {
            ArgumentKey key = ArgumentKey.fromKeyword(named.key());
            if (key == null) {
                logger.debug("Ignoring argument '{}' of '{}'", named.key(), call.name());
                return null;
            }
            if (key.acceptedBy() != category) {
                throw notAccepted(named, call);
            }
            return key;
        }

        private FormulaSyntaxException notAccepted(Expression.Named named, Expression.FunctionCall call) {
            return new FormulaSyntaxException(
                    "Argument '" + named.key() + "' is not accepted by '" + call.name() + "'", named.start(), formula);
        }
    }
}
