package com.example.mlrundb.filter;

import com.example.mlrundb.error.FilterSyntaxException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Recursive-descent parser for the filter grammar produced by
 * {@link FilterExpressionBuilder}:
 *
 * <pre>
 * expression := clause ( AND clause )*
 * clause     := function '(' attribute [ ',' literal ] ')'
 *             | attribute operator literal
 * function   := exists | contains | starts | ends
 * operator   := == | = | != | &gt; | &gt;= | &lt; | &lt;=
 * literal    := "double quoted" | 'single quoted' | number
 * </pre>
 */
final class FilterExpressionParser {

    private final String input;
    private int pos;

    FilterExpressionParser(String input) {
        this.input = input == null ? "" : input;
    }

    FilterExpression parse() {
        skipWhitespace();
        if (atEnd()) {
            return FilterExpression.matchAll();
        }
        List<FilterPredicate> predicates = new ArrayList<>();
        predicates.add(clause());
        skipWhitespace();
        while (!atEnd()) {
            String keyword = identifier();
            if (!"AND".equalsIgnoreCase(keyword)) {
                throw new FilterSyntaxException("Expected AND but found '" + keyword + "'", pos);
            }
            predicates.add(clause());
            skipWhitespace();
        }
        return new FilterExpression(predicates);
    }

    private FilterPredicate clause() {
        String word = identifier();
        skipWhitespace();
        if (peek() == '(') {
            return function(word);
        }
        FilterOperator operator = operator();
        return new FilterPredicate(word, operator, literal());
    }

    private FilterPredicate function(String name) {
        FilterOperator operator;
        switch (name.toLowerCase(Locale.ROOT)) {
            case "exists":
                operator = FilterOperator.EXISTS;
                break;
            case "contains":
                operator = FilterOperator.CONTAINS;
                break;
            case "starts":
                operator = FilterOperator.STARTS;
                break;
            case "ends":
                operator = FilterOperator.ENDS;
                break;
            default:
                throw new FilterSyntaxException("Unknown function '" + name + "'", pos);
        }
        expect('(');
        String attribute = identifier();
        Object value = null;
        skipWhitespace();
        if (operator != FilterOperator.EXISTS) {
            expect(',');
            value = literal();
            if (!(value instanceof String)) {
                throw new FilterSyntaxException(name + "() needs a string argument", pos);
            }
        }
        expect(')');
        return new FilterPredicate(attribute, operator, value);
    }

    private FilterOperator operator() {
        skipWhitespace();
        char c = peek();
        char next = pos + 1 < input.length() ? input.charAt(pos + 1) : 0;
        switch (c) {
            case '=':
                pos += next == '=' ? 2 : 1;
                return FilterOperator.EQ;
            case '!':
                if (next == '=') {
                    pos += 2;
                    return FilterOperator.NE;
                }
                break;
            case '>':
                pos += next == '=' ? 2 : 1;
                return next == '=' ? FilterOperator.GE : FilterOperator.GT;
            case '<':
                pos += next == '=' ? 2 : 1;
                return next == '=' ? FilterOperator.LE : FilterOperator.LT;
            default:
                break;
        }
        throw new FilterSyntaxException("Expected comparison operator", pos);
    }

    private Object literal() {
        skipWhitespace();
        char c = peek();
        if (c == '"' || c == '\'') {
            return quoted(c);
        }
        int start = pos;
        if (c == '-' || c == '+') {
            pos++;
        }
        boolean decimal = false;
        while (!atEnd() && (Character.isDigit(peek()) || peek() == '.' || peek() == 'e' || peek() == 'E')) {
            decimal |= !Character.isDigit(peek());
            pos++;
        }
        String number = input.substring(start, pos);
        try {
            return decimal ? (Object) Double.parseDouble(number) : (Object) Long.parseLong(number);
        } catch (NumberFormatException e) {
            throw new FilterSyntaxException("Expected literal but found '" + number + "'", start);
        }
    }

    private String quoted(char quote) {
        int start = pos++;
        StringBuilder sb = new StringBuilder();
        while (!atEnd()) {
            char c = input.charAt(pos++);
            if (c == quote) {
                return sb.toString();
            }
            if (c == '\\' && !atEnd()) {
                c = input.charAt(pos++);
            }
            sb.append(c);
        }
        throw new FilterSyntaxException("Unterminated string literal", start);
    }

    private String identifier() {
        skipWhitespace();
        int start = pos;
        while (!atEnd() && (Character.isLetterOrDigit(peek()) || peek() == '_')) {
            pos++;
        }
        if (start == pos) {
            throw new FilterSyntaxException("Expected attribute name", pos);
        }
        return input.substring(start, pos);
    }

    private void expect(char c) {
        skipWhitespace();
        if (peek() != c) {
            throw new FilterSyntaxException("Expected '" + c + "'", pos);
        }
        pos++;
    }

    private char peek() {
        return atEnd() ? 0 : input.charAt(pos);
    }

    private boolean atEnd() {
        return pos >= input.length();
    }

    private void skipWhitespace() {
        while (!atEnd() && Character.isWhitespace(input.charAt(pos))) {
            pos++;
        }
    }
}
