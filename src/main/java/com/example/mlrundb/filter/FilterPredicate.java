package com.example.mlrundb.filter;

import lombok.Value;

import java.util.Map;

/**
 * One clause of a filter expression. {@code value} is a {@link String}, a {@link Long},
 * a {@link Double}, or {@code null} for {@link FilterOperator#EXISTS}.
 */
@Value
public class FilterPredicate {

    String attribute;
    FilterOperator operator;
    Object value;

    /** Inequality also holds when the attribute is missing. */
    public boolean test(Map<String, Object> attributes) {
        Object actual = attributes.get(attribute);
        switch (operator) {
            case EXISTS:
                return attributes.containsKey(attribute);
            case NE:
                return actual == null || !equalTo(actual);
            case EQ:
                return actual != null && equalTo(actual);
            case GT:
            case GE:
            case LT:
            case LE:
                Integer cmp = compare(actual);
                return cmp != null && holds(cmp);
            case CONTAINS:
                return actual instanceof String s && s.contains((String) value);
            case STARTS:
                return actual instanceof String s && s.startsWith((String) value);
            case ENDS:
                return actual instanceof String s && s.endsWith((String) value);
            default:
                throw new IllegalStateException("Unhandled operator " + operator);
        }
    }

    private boolean equalTo(Object actual) {
        if (actual instanceof Number a && value instanceof Number v) {
            return Double.compare(a.doubleValue(), v.doubleValue()) == 0;
        }
        return actual.equals(value);
    }

    /** Sign of {@code actual - value}, or null when the two sides are not comparable. */
    private Integer compare(Object actual) {
        if (actual instanceof Long a && value instanceof Long v) {
            return Long.compare(a, v);
        }
        if (actual instanceof Number a && value instanceof Number v) {
            return Double.compare(a.doubleValue(), v.doubleValue());
        }
        if (actual instanceof String a && value instanceof String v) {
            return a.compareTo(v);
        }
        return null;
    }

    private boolean holds(int cmp) {
        switch (operator) {
            case GT:
                return cmp > 0;
            case GE:
                return cmp >= 0;
            case LT:
                return cmp < 0;
            default:
                return cmp <= 0;
        }
    }

    @Override
    public String toString() {
        switch (operator) {
            case EXISTS:
                return "exists(" + attribute + ")";
            case CONTAINS:
            case STARTS:
            case ENDS:
                return operator.name().toLowerCase() + "(" + attribute + ", " + literal() + ")";
            default:
                return attribute + " " + symbol() + " " + literal();
        }
    }

    private String literal() {
        return value instanceof String s ? FilterExpressionBuilder.quote(s) : String.valueOf(value);
    }

    private String symbol() {
        switch (operator) {
            case EQ:
                return "==";
            case NE:
                return "!=";
            case GT:
                return ">";
            case GE:
                return ">=";
            case LT:
                return "<";
            default:
                return "<=";
        }
    }
}
