package org.ascenoria.content.model;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class LocalizedTextTest {

    @Test
    void plainStringIsEnglish() {
        LocalizedText text = LocalizedText.of("Housing");

        assertThat(text.english()).isEqualTo("Housing");
        assertThat(text.locales()).containsExactly("en");
    }

    @Test
    void fallsBackToEnglishForAbsentOrBlankLocale() {
        LocalizedText text = LocalizedText.of(Map.of("en", "Housing", "ru", "Жилой блок", "de", " "));

        assertThat(text.get("ru")).isEqualTo("Жилой блок");
        assertThat(text.get("de")).isEqualTo("Housing");
        assertThat(text.get("fr")).isEqualTo("Housing");
        assertThat(text.has("de")).isFalse();
        assertThat(text.has("ru")).isTrue();
    }

    @Test
    void englishIsRequired() {
        assertThatThrownBy(() -> LocalizedText.of(Map.of("ru", "Жилой блок")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'en'");
        assertThatThrownBy(() -> LocalizedText.of("  "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void equalityIgnoresConstructionOrder() {
        LocalizedText a = LocalizedText.of(Map.of("en", "A", "ru", "Б"));
        LocalizedText b = LocalizedText.of(Map.of("ru", "Б", "en", "A"));

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
    }
}
