package org.texweaver.demacro;

import java.util.Objects;
import java.util.Optional;

/**
 * A custom environment given as source text, for {@link DemacroEngine#addEnvironments(java.util.Map)}.
 *
 * @param begin The LaTeX code that replaces {@code \begin{name}}, with placeholders.
 * @param end The LaTeX code that replaces {@code \end{name}}.
 * @param args The number of parameters of the begin code.
 * @param optionalDefault The default of the optional first parameter, if it has one.
 */
public record EnvironmentSpec(String begin, String end, int args, Optional<String> optionalDefault) {

    public EnvironmentSpec {
        Objects.requireNonNull(begin, "begin");
        Objects.requireNonNull(end, "end");
        optionalDefault = optionalDefault == null ? Optional.empty() : optionalDefault;
    }

    /**
     * @param begin The begin code.
     * @param end The end code.
     * @return A spec without parameters.
     */
    public static EnvironmentSpec of(String begin, String end) {
        return new EnvironmentSpec(begin, end, 0, Optional.empty());
    }

    /**
     * @param begin The begin code.
     * @param end The end code.
     * @param args The number of parameters.
     * @return The spec.
     */
    public static EnvironmentSpec of(String begin, String end, int args) {
        return new EnvironmentSpec(begin, end, args, Optional.empty());
    }
}
