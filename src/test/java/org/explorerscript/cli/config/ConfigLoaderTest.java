package org.explorerscript.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.explorerscript.decompiler.DecompilerOptions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ConfigLoader}: system properties over the {@code --config} file over
 * {@code reference.conf}.
 */
@Tag("unit")
class ConfigLoaderTest {

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("explorerscript.decompiler.collect-foreign-labels");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("Without a file the reference defaults apply")
    void resolve_withoutFileUsesDefaults() {
        Config config = ConfigLoader.resolve(null);

        assertThat(DecompilerOptions.fromConfig(config)).isEqualTo(DecompilerOptions.defaults());
        assertThat(config.hasPath("logging.level")).isTrue();
    }

    @Test
    @DisplayName("The file overrides defaults and keeps the rest")
    void resolve_fileOverridesDefaults() {
        Config config = ConfigLoader.resolve(testResource("config/no-placement.conf"));

        assertThat(config.getBoolean("explorerscript.decompiler.place-labels")).isFalse();
        assertThat(config.getBoolean("explorerscript.decompiler.collect-foreign-labels")).isTrue();
    }

    @Test
    @DisplayName("System property should override file configuration")
    void resolve_systemPropertyOverridesFile() {
        System.setProperty("explorerscript.decompiler.collect-foreign-labels", "false");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.resolve(testResource("config/no-placement.conf"));

        assertThat(config.getBoolean("explorerscript.decompiler.collect-foreign-labels")).isFalse();
        assertThat(config.getBoolean("explorerscript.decompiler.place-labels")).isFalse();
    }

    @Test
    @DisplayName("A missing file is rejected")
    void resolve_missingFileFails() {
        File missing = new File("does-not-exist/explorerscript.conf");

        assertThatThrownBy(() -> ConfigLoader.resolve(missing))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Configuration file not found");
    }

    private File testResource(String name) {
        URL url = getClass().getClassLoader().getResource(name);
        assertThat(url).as("test resource %s", name).isNotNull();
        try {
            return new File(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }
}
