package org.texweaver;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.texweaver.api.LatexException;
import org.texweaver.api.MacroErrorKind;
import org.texweaver.api.MacroException;
import org.texweaver.api.ParseException;
import org.texweaver.config.LoggingConfigurator;
import org.texweaver.demacro.DemacroEngine;
import org.texweaver.demacro.MacroSpec;
import org.texweaver.frontend.parser.ast.Document;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Contains unit tests for the {@link TexWeaver} entry point.
 * These are unit tests and do not require external resources.
 */
public class TexWeaverTest {

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
    }

    private static Config config(String overrides) {
        return ConfigFactory.parseString(overrides)
                .withFallback(ConfigFactory.parseResources("reference.conf"))
                .resolve();
    }

    /**
     * Verifies that the default parse reproduces its input.
     * This is a unit test for the entry point.
     */
    @Test
    @Tag("unit")
    void testParseDefault() throws ParseException {
        // Arrange
        String source = "\\section{Intro} Some $x$ text.% note\n";

        // Act
        Document document = TexWeaver.parseDefault(source);

        // Assert
        assertThat(document.render()).isEqualTo(source);
    }

    /**
     * Verifies that options are taken from the configuration.
     * This is a unit test for the entry point.
     */
    @Test
    @Tag("unit")
    void testOptionsFromConfig() throws LatexException {
        // Arrange
        TexWeaver weaver = TexWeaver.fromConfig(config(
                "texweaver.parser.math-comments = false\ntexweaver.demacro.max-depth = 3\nlogging.default-level = ERROR"));

        // Act
        Document document = weaver.parse("$50%$");

        // Assert
        assertThat(weaver.parserOptions().mathComments()).isFalse();
        assertThat(weaver.demacroOptions().maxDepth()).isEqualTo(3);
        assertThat(document.render()).isEqualTo("$50%$");
    }

    /**
     * Verifies that a configuration without the library sections falls back to defaults.
     */
    @Test
    @Tag("unit")
    void testMissingSectionsUseDefaults() {
        // Act
        TexWeaver weaver = TexWeaver.fromConfig(ConfigFactory.empty());

        // Assert
        assertThat(weaver.parserOptions().mathComments()).isTrue();
        assertThat(weaver.demacroOptions().maxDepth()).isEqualTo(64);
    }

    /**
     * Verifies that engines created by the entry point use its depth limit.
     * This is a unit test for the entry point.
     */
    @Test
    @Tag("unit")
    void testEngineUsesConfiguredDepth() throws LatexException {
        // Arrange
        TexWeaver weaver = TexWeaver.fromConfig(config("texweaver.demacro.max-depth = 3\nlogging.default-level = ERROR"));
        DemacroEngine engine = weaver.newDemacroEngine();
        engine.addMacros(Map.of("grow", MacroSpec.of("x\\grow")));
        Document document = weaver.parse("\\grow");

        // Act
        MacroException e = catchThrowableOfType(() -> engine.demacro(document), MacroException.class);

        // Assert
        assertThat(e.getKind()).isEqualTo(MacroErrorKind.DEPTH_LIMIT_EXCEEDED);
    }

    /**
     * Verifies that structural errors surface as parse exceptions.
     */
    @Test
    @Tag("unit")
    void testParseError() {
        assertThatThrownBy(() -> TexWeaver.parseDefault("\\begin{a}"))
                .isInstanceOf(ParseException.class)
                .isInstanceOf(LatexException.class);
    }
}
