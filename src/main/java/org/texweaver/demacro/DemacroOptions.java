package org.texweaver.demacro;

import com.typesafe.config.Config;

/**
 * Options of the {@link DemacroEngine}.
 *
 * @param maxDepth How many expansions may be nested before expansion is aborted.
 */
public record DemacroOptions(int maxDepth) {

    /** The default options. */
    public static final DemacroOptions DEFAULT = new DemacroOptions(64);

    private static final String MAX_DEPTH_KEY = "max-depth";

    public DemacroOptions {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("max-depth must be positive, was " + maxDepth);
        }
    }

    /**
     * Reads the options from the {@code texweaver.demacro} section of a configuration.
     * @param demacroConfig The section.
     * @return The options; missing keys keep their defaults.
     */
    public static DemacroOptions fromConfig(Config demacroConfig) {
        int maxDepth = demacroConfig.hasPath(MAX_DEPTH_KEY)
                ? demacroConfig.getInt(MAX_DEPTH_KEY)
                : DEFAULT.maxDepth();
        return new DemacroOptions(maxDepth);
    }
}
