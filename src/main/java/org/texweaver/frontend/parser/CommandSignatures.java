package org.texweaver.frontend.parser;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * An immutable table of command and environment arities consulted by the {@link Parser}.
 * Commands that are not listed capture no mandatory arguments, so groups that follow
 * them stay sibling nodes.
 */
public final class CommandSignatures {

    /** A table without any entries. */
    public static final CommandSignatures EMPTY = new CommandSignatures(Map.of(), Map.of());

    private static final CommandSignatures BUILT_IN = EMPTY
            .withCommand("newcommand", new CommandSignature(2, true))
            .withCommand("renewcommand", new CommandSignature(2, true))
            .withCommand("providecommand", new CommandSignature(2, true))
            .withCommand("newenvironment", new CommandSignature(3, true))
            .withCommand("renewenvironment", new CommandSignature(3, true));

    private final Map<String, CommandSignature> commands;
    private final Map<String, Integer> environments;

    private CommandSignatures(Map<String, CommandSignature> commands, Map<String, Integer> environments) {
        this.commands = Map.copyOf(commands);
        this.environments = Map.copyOf(environments);
    }

    /**
     * Returns the signatures of the definition commands (\newcommand, \newenvironment and their
     * variants), which the macro expander relies on.
     * @return The built-in table.
     */
    public static CommandSignatures builtIn() {
        return BUILT_IN;
    }

    /**
     * Returns a copy of this table with one more command signature.
     * @param name The command name without backslash.
     * @param signature The signature.
     * @return The extended table.
     */
    public CommandSignatures withCommand(String name, CommandSignature signature) {
        Map<String, CommandSignature> copy = new HashMap<>(commands);
        copy.put(name, signature);
        return new CommandSignatures(copy, environments);
    }

    /**
     * Returns a copy of this table with one more environment arity.
     * @param name The environment name.
     * @param mandatoryArguments The number of groups after \begin{name} that are arguments.
     * @return The extended table.
     */
    public CommandSignatures withEnvironment(String name, int mandatoryArguments) {
        Map<String, Integer> copy = new HashMap<>(environments);
        copy.put(name, mandatoryArguments);
        return new CommandSignatures(commands, copy);
    }

    /**
     * Combines two tables; entries of {@code other} win.
     * @param other The table to overlay.
     * @return The combined table.
     */
    public CommandSignatures merge(CommandSignatures other) {
        Map<String, CommandSignature> mergedCommands = new HashMap<>(commands);
        mergedCommands.putAll(other.commands);
        Map<String, Integer> mergedEnvironments = new HashMap<>(environments);
        mergedEnvironments.putAll(other.environments);
        return new CommandSignatures(mergedCommands, mergedEnvironments);
    }

    /**
     * @param name The command name without backslash.
     * @return The signature if the command is registered.
     */
    public Optional<CommandSignature> command(String name) {
        return Optional.ofNullable(commands.get(name));
    }

    /**
     * @param name The environment name.
     * @return The number of mandatory arguments if the environment is registered.
     */
    public Optional<Integer> environment(String name) {
        return Optional.ofNullable(environments.get(name));
    }
}
