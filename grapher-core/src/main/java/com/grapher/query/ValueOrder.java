package com.grapher.query;

import com.grapher.graph.Node;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Comparator;
import java.util.List;

/**
 * Total order over result values used by ORDER BY: nulls, then numbers,
 * then strings, then nodes by id, then paths, then anything else by its
 * string form.
 */
enum ValueOrder implements Comparator<Object> {
    INSTANCE;

    @Override
    public int compare(final Object left, final Object right) {
        int rank = Integer.compare(rank(left), rank(right));
        if (rank != 0) {
            return rank;
        }
        if (left == null) {
            return 0;
        } else if (left instanceof Number number) {
            return compareNumbers(number, (Number) right);
        } else if (left instanceof String text) {
            return text.compareTo((String) right);
        } else if (left instanceof Node node) {
            return node.id().compareTo(((Node) right).id());
        } else if (left instanceof List<?> list) {
            return compareLists(list, (List<?>) right);
        }
        return String.valueOf(left).compareTo(String.valueOf(right));
    }

    private static int rank(final Object value) {
        if (value == null) {
            return 0;
        } else if (value instanceof Number) {
            return 1;
        } else if (value instanceof String) {
            return 2;
        } else if (value instanceof Node) {
            return 3;
        } else if (value instanceof List) {
            return 4;
        }
        return 5;
    }

    private static int compareNumbers(final Number left, final Number right) {
        if (isIntegral(left) && isIntegral(right)) {
            return Long.compare(left.longValue(), right.longValue());
        }
        return toDecimal(left).compareTo(toDecimal(right));
    }

    private static boolean isIntegral(final Number value) {
        return value instanceof Long || value instanceof Integer
            || value instanceof Short || value instanceof Byte;
    }

    private static BigDecimal toDecimal(final Number value) {
        if (value instanceof BigDecimal decimal) {
            return decimal;
        } else if (value instanceof BigInteger big) {
            return new BigDecimal(big);
        } else if (isIntegral(value)) {
            return BigDecimal.valueOf(value.longValue());
        }
        double d = value.doubleValue();
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            // Out-of-range values sort past every finite number.
            return BigDecimal.valueOf(Double.MAX_VALUE).multiply(
                BigDecimal.valueOf(Double.isNaN(d) || d > 0 ? 2 : -2));
        }
        return new BigDecimal(d);
    }

    private static int compareLists(final List<?> left, final List<?> right) {
        int size = Math.min(left.size(), right.size());
        for (int i = 0; i < size; i++) {
            int result = INSTANCE.compare(left.get(i), right.get(i));
            if (result != 0) {
                return result;
            }
        }
        return Integer.compare(left.size(), right.size());
    }
}
