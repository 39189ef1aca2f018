package org.oxygen.cli.config;

import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import picocli.CommandLine.Help.Ansi;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class CompilerConfigTest {

    @Test
    @Tag("unit")
    void testReferenceDefaults() {
        // Act
        CompilerConfig config = CompilerConfig.fromConfig(ConfigFactory.defaultReference());

        // Assert
        assertThat(config.sourceExtension()).isEqualTo("o2");
        assertThat(config.color()).isEqualTo(Ansi.AUTO);
        assertThat(config.isSourceFile("examples/basic.o2")).isTrue();
        assertThat(config.isSourceFile("basic.o")).isFalse();
    }

    @Test
    @Tag("unit")
    void testOverrides() {
        // Act
        CompilerConfig config = CompilerConfig.fromConfig(ConfigFactory.parseString(
                "oxygen { source-extension = ox, diagnostics.color = OFF }"));

        // Assert
        assertThat(config.sourceExtension()).isEqualTo("ox");
        assertThat(config.color()).isEqualTo(Ansi.OFF);
    }

    @Test
    @Tag("unit")
    void testInvalidValuesAreRejected() {
        assertThatThrownBy(() -> CompilerConfig.fromConfig(ConfigFactory.parseString(
                "oxygen { source-extension = \".o2\", diagnostics.color = OFF }")))
                .isInstanceOf(ConfigException.BadValue.class);
        assertThatThrownBy(() -> CompilerConfig.fromConfig(ConfigFactory.parseString(
                "oxygen { source-extension = o2, diagnostics.color = purple }")))
                .isInstanceOf(ConfigException.BadValue.class);
    }
}
