package org.texweaver;

import com.typesafe.config.Config;
import org.texweaver.api.ParseException;
import org.texweaver.config.ConfigLoader;
import org.texweaver.config.LoggingConfigurator;
import org.texweaver.demacro.DemacroEngine;
import org.texweaver.demacro.DemacroOptions;
import org.texweaver.frontend.parser.Parser;
import org.texweaver.frontend.parser.ParserOptions;
import org.texweaver.frontend.parser.ast.Document;

/**
 * The entry point of the library: parses LaTeX into a lossless tree and creates
 * de-macro engines with consistent options.
 * <pre>
 * TexWeaver weaver = TexWeaver.create();
 * Document document = weaver.parse(source);
 * DemacroEngine engine = weaver.newDemacroEngine();
 * String expanded = engine.demacro(document).render();
 * </pre>
 */
public final class TexWeaver {

    private static final String PARSER_PATH = "texweaver.parser";
    private static final String DEMACRO_PATH = "texweaver.demacro";

    private final ParserOptions parserOptions;
    private final DemacroOptions demacroOptions;

    private TexWeaver(ParserOptions parserOptions, DemacroOptions demacroOptions) {
        this.parserOptions = parserOptions;
        this.demacroOptions = demacroOptions;
    }

    /**
     * Parses LaTeX with default options.
     * @param source The LaTeX source.
     * @return The document.
     * @throws ParseException if the source is structurally malformed.
     */
    public static Document parseDefault(String source) throws ParseException {
        return Parser.parse(source, ParserOptions.DEFAULT);
    }

    /**
     * Creates an instance from the configuration found by {@link ConfigLoader#load()}.
     * @return The instance.
     */
    public static TexWeaver create() {
        return fromConfig(ConfigLoader.load());
    }

    /**
     * Creates an instance from a configuration and applies its logging settings.
     * @param config A configuration with the {@code texweaver} and {@code logging} sections;
     *               missing keys keep their defaults.
     * @return The instance.
     */
    public static TexWeaver fromConfig(Config config) {
        LoggingConfigurator.configure(config);
        ParserOptions parserOptions = config.hasPath(PARSER_PATH)
                ? ParserOptions.fromConfig(config.getConfig(PARSER_PATH))
                : ParserOptions.DEFAULT;
        DemacroOptions demacroOptions = config.hasPath(DEMACRO_PATH)
                ? DemacroOptions.fromConfig(config.getConfig(DEMACRO_PATH))
                : DemacroOptions.DEFAULT;
        return new TexWeaver(parserOptions, demacroOptions);
    }

    /**
     * Parses LaTeX with this instance's options.
     * @param source The LaTeX source.
     * @return The document.
     * @throws ParseException if the source is structurally malformed.
     */
    public Document parse(String source) throws ParseException {
        return Parser.parse(source, parserOptions);
    }

    /**
     * @return A new engine with an empty macro table and this instance's options.
     */
    public DemacroEngine newDemacroEngine() {
        return new DemacroEngine(demacroOptions, parserOptions);
    }

    /**
     * @return The parser options.
     */
    public ParserOptions parserOptions() {
        return parserOptions;
    }

    /**
     * @return The de-macro options.
     */
    public DemacroOptions demacroOptions() {
        return demacroOptions;
    }
}
