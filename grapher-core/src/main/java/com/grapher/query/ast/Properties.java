package com.grapher.query.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;

/** Helpers for property maps in patterns. */
final class Properties {

    private Properties() {
        throw new AssertionError("No instances");
    }

    static Map<String, Expr> copyOf(final Map<String, Expr> properties) {
        if (properties == null || properties.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    static String render(final Map<String, Expr> properties) {
        StringJoiner joiner = new StringJoiner(", ", "{", "}");
        properties.forEach((key, value) ->
            joiner.add(new Variable(key) + ": " + value));
        return joiner.toString();
    }
}
