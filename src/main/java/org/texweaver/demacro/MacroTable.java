package org.texweaver.demacro;

import org.texweaver.frontend.parser.CommandSignature;
import org.texweaver.frontend.parser.CommandSignatures;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The macro and environment definitions known to a {@link DemacroEngine}. Definition
 * handlers write to it, the expander reads from it. Later registrations replace earlier ones.
 */
public class MacroTable {

    private final Map<String, MacroDefinition> macros;
    private final Map<String, EnvironmentDefinition> environments;

    /**
     * Creates an empty table.
     */
    public MacroTable() {
        this(new HashMap<>(), new HashMap<>());
    }

    private MacroTable(Map<String, MacroDefinition> macros, Map<String, EnvironmentDefinition> environments) {
        this.macros = macros;
        this.environments = environments;
    }

    /**
     * Registers a macro, replacing any macro of the same name.
     * @param macro The definition.
     */
    public void registerMacro(MacroDefinition macro) {
        macros.put(macro.name(), macro);
    }

    /**
     * @param name The command name without backslash.
     * @return The definition, if one is registered.
     */
    public Optional<MacroDefinition> getMacro(String name) {
        return Optional.ofNullable(macros.get(name));
    }

    /**
     * Registers an environment, replacing any environment of the same name.
     * @param environment The definition.
     */
    public void registerEnvironment(EnvironmentDefinition environment) {
        environments.put(environment.name(), environment);
    }

    /**
     * @param name The environment name.
     * @return The definition, if one is registered.
     */
    public Optional<EnvironmentDefinition> getEnvironment(String name) {
        return Optional.ofNullable(environments.get(name));
    }

    /**
     * @return An independent copy that can be modified without affecting this table.
     */
    public MacroTable copy() {
        return new MacroTable(new HashMap<>(macros), new HashMap<>(environments));
    }

    /**
     * Describes the registered macros and environments in terms the parser understands:
     * the number of {...} groups each one takes.
     * @return The signatures.
     */
    public CommandSignatures signatures() {
        CommandSignatures signatures = CommandSignatures.EMPTY;
        for (MacroDefinition macro : macros.values()) {
            signatures = signatures.withCommand(macro.name(), CommandSignature.of(macro.mandatoryArity()));
        }
        for (EnvironmentDefinition environment : environments.values()) {
            signatures = signatures.withEnvironment(environment.name(), environment.mandatoryArity());
        }
        return signatures;
    }

    /**
     * @return The number of registered macros and environments.
     */
    public int size() {
        return macros.size() + environments.size();
    }
}
