package com.example.mlrundb.filter;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/** Parsed conjunction of {@link FilterPredicate}s. An empty expression matches every item. */
public final class FilterExpression {

    private static final FilterExpression MATCH_ALL = new FilterExpression(List.of());

    private final List<FilterPredicate> predicates;

    FilterExpression(List<FilterPredicate> predicates) {
        this.predicates = List.copyOf(predicates);
    }

    public static FilterExpression matchAll() {
        return MATCH_ALL;
    }

    public static FilterExpression parse(String expression) {
        return new FilterExpressionParser(expression).parse();
    }

    public List<FilterPredicate> getPredicates() {
        return predicates;
    }

    public boolean test(Map<String, Object> attributes) {
        for (FilterPredicate predicate : predicates) {
            if (!predicate.test(attributes)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return predicates.stream().map(FilterPredicate::toString).collect(Collectors.joining(FilterExpressionBuilder.AND));
    }
}
