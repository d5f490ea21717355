package org.ascenoria.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ContentSettingsTest {

    private static Config withDefaults(String overrides) {
        return ConfigFactory.parseString(overrides)
                .withFallback(ConfigFactory.parseResources("reference.conf"))
                .resolve();
    }

    @Test
    void readsContentBlock() {
        // given
        Config config = withDefaults("""
                content {
                  base-path = "/srv/data"
                  mods-path = "/srv/mods"
                  locales = ["en"]
                  hot-reload { debounce = 1s, queue-capacity = 8 }
                }
                """);

        // when
        ContentSettings settings = ContentSettings.fromConfig(config);

        // then
        assertThat(settings.basePath()).isEqualTo(Path.of("/srv/data"));
        assertThat(settings.modsPath()).isEqualTo(Path.of("/srv/mods"));
        assertThat(settings.supportedSchemaVersion()).isEqualTo(1);
        assertThat(settings.locales()).containsExactly("en");
        assertThat(settings.hotReload().enabled()).isTrue();
        assertThat(settings.hotReload().debounce()).isEqualTo(Duration.ofSeconds(1));
        assertThat(settings.hotReload().queueCapacity()).isEqualTo(8);
        assertThat(settings.hotReload().pollInterval()).isEqualTo(Duration.ofMillis(50));
    }

    @Test
    void rejectsWrongType() {
        Config config = withDefaults("content.supported-schema-version = \"one\"");

        assertThatThrownBy(() -> ContentSettings.fromConfig(config)).isInstanceOf(ConfigException.WrongType.class);
    }

    @Test
    void rejectsOutOfRangeValues() {
        assertThatThrownBy(() -> ContentSettings.fromConfig(withDefaults("content.supported-schema-version = 0")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("supported-schema-version");
        assertThatThrownBy(() -> ContentSettings.fromConfig(withDefaults("content.hot-reload.queue-capacity = 0")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("queue-capacity");
    }

    @Test
    void withPathsKeepsEverythingElse() {
        ContentSettings settings = ContentSettings.fromConfig(withDefaults(""));

        ContentSettings moved = settings.withPaths(Path.of("a"), Path.of("b"));

        assertThat(moved.basePath()).isEqualTo(Path.of("a"));
        assertThat(moved.modsPath()).isEqualTo(Path.of("b"));
        assertThat(moved.locales()).isEqualTo(settings.locales());
        assertThat(moved.hotReload()).isEqualTo(settings.hotReload());
    }
}
