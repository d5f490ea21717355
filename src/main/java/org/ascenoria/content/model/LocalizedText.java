package org.ascenoria.content.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Display text with one value per locale.
 * <p>
 * In content files the value is either a plain string, taken as English, or a table
 * mapping locale codes to strings. English is mandatory and must not be blank.
 */
public final class LocalizedText {

    /** The locale that every localized text must provide. */
    public static final String ENGLISH = "en";

    private final SortedMap<String, String> values;

    private LocalizedText(final SortedMap<String, String> values) {
        this.values = Collections.unmodifiableSortedMap(values);
    }

    /**
     * Creates an English-only text.
     *
     * @param english The English value.
     * @return The localized text.
     * @throws IllegalArgumentException if the value is null or blank.
     */
    public static LocalizedText of(final String english) {
        return of(Map.of(ENGLISH, english == null ? "" : english));
    }

    /**
     * Creates a text from a locale table.
     *
     * @param values Locale code to value.
     * @return The localized text.
     * @throws IllegalArgumentException if the English value is missing or blank.
     */
    public static LocalizedText of(final Map<String, String> values) {
        final String english = values.get(ENGLISH);
        if (english == null || english.isBlank()) {
            throw new IllegalArgumentException("English ('" + ENGLISH + "') text is required");
        }
        return new LocalizedText(new TreeMap<>(values));
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    static LocalizedText fromJson(final JsonNode node) {
        if (node.isTextual()) {
            return of(node.textValue());
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException("expected a string or a table of locale strings, got " + node.getNodeType());
        }
        final TreeMap<String, String> values = new TreeMap<>();
        final Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            final Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isTextual()) {
                throw new IllegalArgumentException("locale '" + field.getKey() + "' must map to a string");
            }
            values.put(field.getKey(), field.getValue().textValue());
        }
        return of(values);
    }

    /**
     * Returns the text for a locale, falling back to English when the locale is absent or blank.
     *
     * @param locale The locale code, e.g. {@code "ru"}.
     * @return The resolved text.
     */
    public String get(final String locale) {
        final String value = values.get(locale);
        return value == null || value.isBlank() ? values.get(ENGLISH) : value;
    }

    /**
     * @return The English text.
     */
    public String english() {
        return values.get(ENGLISH);
    }

    /**
     * @param locale The locale code.
     * @return {@code true} if a non-blank value exists for the locale.
     */
    public boolean has(final String locale) {
        final String value = values.get(locale);
        return value != null && !value.isBlank();
    }

    /**
     * @return The locales present, in sorted order.
     */
    public Set<String> locales() {
        return values.keySet();
    }

    /**
     * @return An unmodifiable view of all values, sorted by locale.
     */
    public Map<String, String> asMap() {
        return values;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LocalizedText)) {
            return false;
        }
        return values.equals(((LocalizedText) o).values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
