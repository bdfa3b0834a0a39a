package com.span.tracing.graph;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Inlines {@code $name} parameters into a Cypher query as literals.
 *
 * <p>Placeholders are resolved in a single pass, so a substituted value that
 * itself contains {@code $something} is never expanded again, and {@code $s1}
 * never clobbers {@code $s10}. Placeholders without a matching parameter are
 * left untouched.</p>
 */
public final class CypherParameters {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$([A-Za-z_][A-Za-z0-9_]*)");

    private CypherParameters() {
        // Utility class
    }

    public static String bind(String query, Map<String, Object> params) {
        if (params == null || params.isEmpty()) {
            return query;
        }
        Matcher matcher = PLACEHOLDER.matcher(query);
        StringBuilder out = new StringBuilder(query.length() + 64);
        while (matcher.find()) {
            String key = matcher.group(1);
            String replacement = params.containsKey(key) ? literal(params.get(key)) : matcher.group();
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    static String literal(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof List<?> list) {
            StringBuilder sb = new StringBuilder("[");
            for (int i = 0; i < list.size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append(literal(list.get(i)));
            }
            return sb.append(']').toString();
        }
        return quote(value.toString());
    }

    private static String quote(String value) {
        return "'" + value.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }
}
