package com.example.mlrundb.filter;

import com.example.mlrundb.encode.AttributeNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds backend filter expressions for run and artifact queries.
 *
 * <p>The result is a conjunction of clauses joined with {@code AND}; inputs that are
 * {@code null} or empty contribute no clause, and an empty string means "match all".
 * Attribute names go through {@link AttributeNames#sanitize} so they line up with what
 * the encoder wrote.
 */
@Component
public class FilterExpressionBuilder {

    private static final Logger logger = LoggerFactory.getLogger(FilterExpressionBuilder.class);

    /** {@code key~=value}, {@code key!=value} or {@code key=value}; the key is the shortest prefix. */
    private static final Pattern LABEL = Pattern.compile("(.+?)(~=|!=|=)(.*)", Pattern.DOTALL);

    static final String AND = " AND ";
    static final String RUN_LABEL_PREFIX = "metadata.labels";
    static final String ARTIFACT_LABEL_PREFIX = "labels";

    public String runFilter(List<String> labels, String name, String state, long lastUpdateAfter) {
        List<String> clauses = new ArrayList<>();
        if (hasText(name)) {
            clauses.add(AttributeNames.RUN_NAME + " == " + quote(name));
        }
        if (hasText(state)) {
            clauses.add(AttributeNames.RUN_STATE + " == " + quote(state));
        }
        addLabelClauses(clauses, RUN_LABEL_PREFIX, labels);
        if (lastUpdateAfter > 0) {
            clauses.add(AttributeNames.RUN_LAST_UPDATE_EPOCH + " > " + lastUpdateAfter);
        }
        String filter = String.join(AND, clauses);
        logger.debug("Run filter: {}", filter);
        return filter;
    }

    /**
     * @param tag matched as a suffix of the item name, which tells tag records
     *            ({@code key.tag}) apart from uid records; {@code null} or empty for any
     */
    public String artifactFilter(List<String> labels, String name, String tag) {
        List<String> clauses = new ArrayList<>();
        if (hasText(name)) {
            clauses.add(AttributeNames.ARTIFACT_NAME + " == " + quote(name));
        }
        if (hasText(tag)) {
            clauses.add("ends(" + AttributeNames.ITEM_NAME + ", " + quote(tag) + ")");
        }
        addLabelClauses(clauses, ARTIFACT_LABEL_PREFIX, labels);
        String filter = String.join(AND, clauses);
        logger.debug("Artifact filter: {}", filter);
        return filter;
    }

    /**
     * Translates one label token. A token without an operator tests that the label
     * exists.
     */
    public String labelClause(String labelPrefix, String token) {
        String prefix = hasText(labelPrefix) ? labelPrefix + "." : "";
        Matcher m = LABEL.matcher(token);
        if (!m.matches()) {
            return "exists(" + AttributeNames.sanitize(prefix + token) + ")";
        }
        String attribute = AttributeNames.sanitize(prefix + m.group(1));
        String value = quote(m.group(3));
        switch (m.group(2)) {
            case "~=":
                return "contains(" + attribute + ", " + value + ")";
            case "!=":
                return attribute + " != " + value;
            default:
                return attribute + " == " + value;
        }
    }

    private void addLabelClauses(List<String> clauses, String prefix, List<String> labels) {
        if (labels == null) {
            return;
        }
        for (String label : labels) {
            if (hasText(label)) {
                clauses.add(labelClause(prefix, label));
            }
        }
    }

    /** Double-quoted literal with {@code \} and {@code "} escaped. */
    public static String quote(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '"' || c == '\\') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.append('"').toString();
    }

    private static boolean hasText(String s) {
        return s != null && !s.isEmpty();
    }
}
