package com.kbdash.formula;

import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.impl.factory.Maps;
import org.eclipse.collections.impl.factory.Sets;

import java.util.Locale;

public final class FunctionCatalog {
    private static final FunctionCatalog STANDARD = new FunctionCatalog(standardAliases(), standardMathFunctions());

    private final ImmutableMap<String, FunctionKind> kindsByName;
    private final ImmutableSet<String> mathFunctions;

    private FunctionCatalog(ImmutableMap<String, FunctionKind> kindsByName, ImmutableSet<String> mathFunctions) {
        this.kindsByName = kindsByName;
        this.mathFunctions = mathFunctions;
    }

    public static FunctionCatalog standard() {
        return STANDARD;
    }

    public FunctionCatalog withAlias(String name, FunctionKind kind) {
        return new FunctionCatalog(kindsByName.newWithKeyValue(normalize(name), kind), mathFunctions);
    }

    // Null for math functions
    public FunctionKind kindOf(String writtenName) {
        return kindsByName.get(normalize(writtenName));
    }

    public FunctionCategory categoryOf(String writtenName) {
        FunctionKind kind = kindOf(writtenName);
        return kind == null ? FunctionCategory.MATH : kind.category();
    }

    // Informational only; unlisted names still parse as math calls
    public boolean isKnownMathFunction(String writtenName) {
        return mathFunctions.contains(normalize(writtenName));
    }

    private static String normalize(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    private static ImmutableMap<String, FunctionKind> standardAliases() {
        MutableMap<String, FunctionKind> aliases = Maps.mutable.empty();
        for (FunctionKind kind : FunctionKind.values()) {
            aliases.put(kind.operationType(), kind);
        }
        aliases.put("avg", FunctionKind.AVERAGE);
        aliases.put("unique", FunctionKind.UNIQUE_COUNT);
        aliases.put("distinct_count", FunctionKind.UNIQUE_COUNT);
        aliases.put("derivative", FunctionKind.DIFFERENCES);
        return aliases.toImmutable();
    }

    private static ImmutableSet<String> standardMathFunctions() {
        return Sets.immutable.with(
                "abs", "sqrt", "cbrt", "cube", "square", "pow", "ceil", "floor", "round", "log", "exp",
                "clamp", "mod", "ifelse", "pick_max", "pick_min", "defaults",
                "add", "subtract", "multiply", "divide", "gt", "lt", "gte", "lte", "eq");
    }
}
