package org.texweaver.demacro;

import java.util.Objects;
import java.util.Optional;

/**
 * A macro given as source text, for {@link DemacroEngine#addMacros(java.util.Map)}.
 *
 * @param body The LaTeX body with {@code #1}..{@code #9} placeholders.
 * @param args The number of parameters.
 * @param optionalDefault The default of the optional first parameter, if it has one.
 */
public record MacroSpec(String body, int args, Optional<String> optionalDefault) {

    public MacroSpec {
        Objects.requireNonNull(body, "body");
        optionalDefault = optionalDefault == null ? Optional.empty() : optionalDefault;
    }

    /**
     * @param body The body of a macro without parameters.
     * @return The spec.
     */
    public static MacroSpec of(String body) {
        return new MacroSpec(body, 0, Optional.empty());
    }

    /**
     * @param body The body.
     * @param args The number of parameters.
     * @return The spec.
     */
    public static MacroSpec of(String body, int args) {
        return new MacroSpec(body, args, Optional.empty());
    }

    /**
     * @param body The body.
     * @param args The number of parameters, including the optional first one.
     * @param optionalDefault The default of the first parameter.
     * @return The spec.
     */
    public static MacroSpec withDefault(String body, int args, String optionalDefault) {
        return new MacroSpec(body, args, Optional.of(optionalDefault));
    }
}
