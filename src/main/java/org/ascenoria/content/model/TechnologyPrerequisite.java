package org.ascenoria.content.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A research tree edge: {@code from} must be researched before {@code to}.
 * <p>
 * Edges have no id of their own; they merge on the ordered pair of endpoints.
 *
 * @param from The prerequisite technology id.
 * @param to   The dependent technology id.
 */
public record TechnologyPrerequisite(
        @JsonProperty(value = "from", required = true) String from,
        @JsonProperty(value = "to", required = true) String to
) implements ContentRecord {

    /** Separator between the endpoints in the composite key. */
    public static final String KEY_SEPARATOR = "->";

    @Override
    public String key() {
        return keyOf(from, to);
    }

    /**
     * Builds the composite key of an edge. Backslashes and {@code '>'} inside an endpoint are
     * escaped, so the only unescaped {@code '>'} is the separator's and distinct pairs never
     * share a key.
     *
     * @param from The prerequisite technology id.
     * @param to   The dependent technology id.
     * @return The key, e.g. {@code tech_a->tech_b}.
     */
    public static String keyOf(final String from, final String to) {
        return escape(from) + KEY_SEPARATOR + escape(to);
    }

    private static String escape(final String endpoint) {
        if (endpoint.indexOf('\\') < 0 && endpoint.indexOf('>') < 0) {
            return endpoint;
        }
        final StringBuilder sb = new StringBuilder(endpoint.length() + 4);
        for (int i = 0; i < endpoint.length(); i++) {
            final char c = endpoint.charAt(i);
            if (c == '\\' || c == '>') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
