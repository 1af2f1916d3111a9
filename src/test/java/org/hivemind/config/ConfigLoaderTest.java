package org.hivemind.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;

import org.hivemind.test.utils.LogCapture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import ch.qos.logback.classic.Level;

/**
 * Tests the layering and file discovery of {@link ConfigLoader}. Every result is the
 * {@code hivemind} block, so keys are read without the root prefix.
 */
@Tag("unit")
class ConfigLoaderTest {

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("hivemind.ai.max-pathfinds-per-tick");
        System.clearProperty(ConfigLoader.FILE_PROPERTY);
        ConfigFactory.invalidateCaches();
    }

    private static void setProperty(String key, String value) {
        System.setProperty(key, value);
        ConfigFactory.invalidateCaches();
    }

    @Test
    void withoutFileTheReferenceBlockIsReturned() {
        Config settings = ConfigLoader.load();

        assertThat(settings.getString("ai.algorithm")).isEqualTo("flowfield");
        assertThat(settings.getInt("ai.max-agent-updates-per-tick")).isEqualTo(50);
        assertThat(settings.getInt("spatial.cell-size")).isEqualTo(100);
        assertThat(settings.hasPath("ai.strategy-class")).isFalse();
    }

    @Test
    void fileIsLayeredOverTheDefaults() {
        Config settings = ConfigLoader.load(testResource("test-config.conf"));

        assertThat(settings.getString("ai.algorithm")).isEqualTo("astar");
        assertThat(settings.getInt("ai.max-pathfinds-per-tick")).isEqualTo(4);
        assertThat(settings.getInt("ai.search.max-nodes")).isEqualTo(250);
        assertThat(settings.getInt("ai.search.cell-size")).isEqualTo(20);
        assertThat(settings.getInt("spatial.cell-size")).isEqualTo(64);
        assertThat(settings.getInt("spatial.world-bounds.max-x")).isEqualTo(5000);
    }

    @Test
    void hostOverridesBeatTheFileButNotSystemProperties() {
        Config overrides = ConfigFactory.parseString("ai.max-pathfinds-per-tick = 9");

        Config settings = ConfigLoader.load(testResource("test-config.conf"), overrides);
        assertThat(settings.getInt("ai.max-pathfinds-per-tick")).isEqualTo(9);
        assertThat(settings.getString("ai.algorithm")).isEqualTo("astar");

        setProperty("hivemind.ai.max-pathfinds-per-tick", "7");
        assertThat(ConfigLoader.load(testResource("test-config.conf"), overrides).getInt("ai.max-pathfinds-per-tick"))
                .isEqualTo(7);
    }

    @Test
    void substitutionsSeeOverriddenValues() {
        setProperty("hivemind.ai.max-pathfinds-per-tick", "6");

        Config settings = ConfigLoader.load(testResource("references-config.conf"));

        assertThat(settings.getInt("ai.max-agent-updates-per-tick")).isEqualTo(6);
        assertThat(settings.getInt("ai.waypoint-spacing")).isEqualTo(100);
    }

    @Test
    void missingExplicitFileIsRejected(@TempDir Path dir) {
        File missing = dir.resolve("absent.conf").toFile();

        assertThatThrownBy(() -> ConfigLoader.load(missing))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("absent.conf");
    }

    @Test
    void systemPropertyNamesTheFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("custom.conf");
        Files.writeString(file, "hivemind.ai.algorithm = navmesh\n");
        setProperty(ConfigLoader.FILE_PROPERTY, file.toString());

        try (LogCapture log = LogCapture.of(ConfigLoader.class)) {
            Config settings = ConfigLoader.load();

            assertThat(settings.getString("ai.algorithm")).isEqualTo("navmesh");
            assertThat(log.messages(Level.INFO)).singleElement().asString().contains("custom.conf");
        }
    }

    @Test
    void missingFileNamedBySystemPropertyIsRejected(@TempDir Path dir) {
        setProperty(ConfigLoader.FILE_PROPERTY, dir.resolve("gone.conf").toString());

        assertThatThrownBy(ConfigLoader::load)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(ConfigLoader.FILE_PROPERTY)
                .hasMessageContaining("gone.conf");
    }

    private File testResource(String name) {
        URL url = getClass().getResource(name);
        assertThat(url).as("test resource %s", name).isNotNull();
        try {
            return new File(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid test resource URI: " + url, e);
        }
    }
}
