package com.grapher.query;

import com.grapher.graph.Node;
import com.grapher.query.ast.Expr;
import com.grapher.query.ast.IntegerLiteral;
import com.grapher.query.ast.NodePattern;
import com.grapher.query.ast.StrLiteral;
import com.grapher.query.ast.Variable;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Map;

/**
 * Compares pattern literals with stored property values.
 *
 * <p>An integer literal is compared with a stored value by trying, in
 * order: integral types, {@link BigInteger}, floating point truncated
 * toward zero, and a string parsed as a base-10 integer. A value that has
 * an interpretation but a different number is simply unequal. A value with
 * no numeric interpretation at all, such as a boolean or a collection,
 * cannot be compared and fails the query.</p>
 *
 * <p>A string literal equals a stored value whose string form is the same
 * text.</p>
 */
public final class PropertyMatcher {

    private PropertyMatcher() {
        throw new AssertionError("No instances");
    }

    /**
     * Checks a node against a node pattern's labels and properties.
     *
     * @param pattern the pattern
     * @param node the candidate
     * @return true if the node carries every label and property
     * @throws QueryExecutionException if a property cannot be compared
     */
    public static boolean matches(final NodePattern pattern, final Node node)
            throws QueryExecutionException {
        if (!node.labels().containsAll(pattern.labels())) {
            return false;
        }
        for (Map.Entry<String, Expr> entry : pattern.properties().entrySet()) {
            if (!matches(entry.getValue(), node.property(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Compares one literal with one stored value.
     *
     * @param expected the literal from the query
     * @param stored the stored value, null when the property is absent
     * @return true if equal under the coercion rules
     * @throws QueryExecutionException if the literal kind is unsupported
     *     or the value cannot be coerced
     */
    public static boolean matches(final Expr expected, final Object stored)
            throws QueryExecutionException {
        if (expected instanceof Variable variable) {
            throw new QueryExecutionException("unsupported property value: "
                + "variable " + variable.name());
        } else if (expected instanceof StrLiteral str) {
            return stored != null && str.value().equals(String.valueOf(stored));
        } else if (expected instanceof IntegerLiteral integer) {
            return stored != null && matchesInteger(integer.value(), stored);
        }
        throw new IllegalStateException("unknown expression " + expected);
    }

    private static boolean matchesInteger(final long expected,
                                          final Object stored)
            throws QueryExecutionException {
        if (stored instanceof Long || stored instanceof Integer
                || stored instanceof Short || stored instanceof Byte) {
            return ((Number) stored).longValue() == expected;
        }
        if (stored instanceof BigInteger big) {
            return big.equals(BigInteger.valueOf(expected));
        }
        if (stored instanceof Double || stored instanceof Float) {
            double value = ((Number) stored).doubleValue();
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                return false;
            }
            return truncate(new BigDecimal(value), expected);
        }
        if (stored instanceof BigDecimal decimal) {
            return truncate(decimal, expected);
        }
        if (stored instanceof String text) {
            try {
                return Long.parseLong(text.strip()) == expected;
            } catch (NumberFormatException e) {
                return false;
            }
        }
        throw new QueryExecutionException("cannot compare integer "
            + expected + " with " + stored.getClass().getSimpleName()
            + " value " + stored);
    }

    private static boolean truncate(final BigDecimal value,
                                    final long expected) {
        return value.toBigInteger().equals(BigInteger.valueOf(expected));
    }
}
