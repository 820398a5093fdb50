package org.texweaver.demacro;

import org.texweaver.api.MacroErrorKind;
import org.texweaver.api.MacroException;
import org.texweaver.api.ParseException;
import org.texweaver.diagnostics.DiagnosticsEngine;
import org.texweaver.frontend.parser.CommandSignatures;
import org.texweaver.frontend.parser.Parser;
import org.texweaver.frontend.parser.ParserOptions;
import org.texweaver.frontend.parser.ast.Node;
import org.texweaver.frontend.parser.ast.Nodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Replaces user-defined macros and environments by their expansions ("de-macro").
 * <p>
 * The engine owns a {@link MacroTable}. Definitions found in documents and definitions
 * added through the {@code add*} methods accumulate across calls; the last registration
 * of a name wins. A {@link #demacro(Node)} call that fails leaves the table unchanged.
 * <p>
 * An engine is not thread-safe; use one engine per macro scope.
 */
public class DemacroEngine {

    private static final Logger LOG = LoggerFactory.getLogger(DemacroEngine.class);

    private final DemacroOptions options;
    private final ParserOptions parserOptions;
    private final DefinitionHandlerRegistry registry = DefinitionHandlerRegistry.initialize();
    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();
    private MacroTable table = new MacroTable();

    /**
     * Creates an engine with default options.
     */
    public DemacroEngine() {
        this(DemacroOptions.DEFAULT, ParserOptions.DEFAULT);
    }

    /**
     * Creates an engine.
     * @param options The expansion limits.
     * @param parserOptions The options used to parse bodies given as text.
     */
    public DemacroEngine(DemacroOptions options, ParserOptions parserOptions) {
        this.options = options;
        this.parserOptions = parserOptions;
    }

    /**
     * Adds macros given as LaTeX text. Either all of them are added or, if one is
     * malformed, none.
     *
     * @param macros The macros by command name (without backslash).
     * @throws MacroException with {@link MacroErrorKind#MALFORMED_DEFINITION} if a body does not
     *                        parse, the argument count is out of range or a placeholder exceeds it.
     */
    public void addMacros(Map<String, MacroSpec> macros) throws MacroException {
        List<MacroDefinition> definitions = new ArrayList<>();
        for (Map.Entry<String, MacroSpec> entry : macros.entrySet()) {
            String name = checkName(entry.getKey());
            MacroSpec spec = entry.getValue();
            DefinitionSyntax.checkArity(spec.args(), null);
            Optional<List<Node>> defaultArgument = parseDefault(name, spec.args(), spec.optionalDefault());
            List<Node> body = parse(spec.body(), "\\" + name);
            DefinitionSyntax.checkPlaceholders(body, spec.args(), null);
            definitions.add(new MacroDefinition(name, spec.args(), defaultArgument, new MacroBody.Template(body)));
        }
        for (MacroDefinition definition : definitions) {
            table.registerMacro(definition);
            LOG.debug("Added macro \\{} with {} arguments", definition.name(), definition.arity());
        }
    }

    /**
     * Adds environments given as LaTeX text. Either all of them are added or none.
     *
     * @param environments The environments by name.
     * @throws MacroException with {@link MacroErrorKind#MALFORMED_DEFINITION} if a code part
     *                        does not parse or the argument count is out of range.
     */
    public void addEnvironments(Map<String, EnvironmentSpec> environments) throws MacroException {
        List<EnvironmentDefinition> definitions = new ArrayList<>();
        for (Map.Entry<String, EnvironmentSpec> entry : environments.entrySet()) {
            String name = checkName(entry.getKey());
            EnvironmentSpec spec = entry.getValue();
            DefinitionSyntax.checkArity(spec.args(), null);
            Optional<List<Node>> defaultArgument = parseDefault(name, spec.args(), spec.optionalDefault());
            List<Node> begin = parse(spec.begin(), "environment " + name);
            List<Node> end = parse(spec.end(), "environment " + name);
            DefinitionSyntax.checkPlaceholders(begin, spec.args(), null);
            DefinitionSyntax.checkPlaceholders(end, 0, null);
            definitions.add(new EnvironmentDefinition(name, spec.args(), defaultArgument, begin, end));
        }
        for (EnvironmentDefinition definition : definitions) {
            table.registerEnvironment(definition);
            LOG.debug("Added environment {} with {} arguments", definition.name(), definition.arity());
        }
    }

    /**
     * Adds a macro whose expansion is computed by Java code.
     *
     * @param name The command name without backslash.
     * @param args The number of parameters.
     * @param body The function producing the expansion.
     * @throws MacroException with {@link MacroErrorKind#MALFORMED_DEFINITION} if the count is out of range.
     */
    public void addMacro(String name, int args, MacroFunction body) throws MacroException {
        checkName(name);
        DefinitionSyntax.checkArity(args, null);
        table.registerMacro(new MacroDefinition(name, args, Optional.empty(), new MacroBody.Computed(body)));
        LOG.debug("Added computed macro \\{} with {} arguments", name, args);
    }

    /**
     * Describes the known macros and environments for the parser, so that their {...}
     * arguments are captured as arguments instead of sibling groups.
     * @return The signatures, to be passed to {@link ParserOptions#withSignatures(CommandSignatures)}.
     */
    public CommandSignatures signatures() {
        return table.signatures();
    }

    /**
     * De-macros a tree: definitions are registered and removed, invocations of known macros
     * and environments are replaced by their expansions, recursively. Nodes outside
     * invocations are kept as they are.
     *
     * @param root The tree; it is not modified.
     * @return The expanded tree.
     * @throws MacroException if an invocation lacks arguments, expansion does not terminate
     *                        within the configured depth, or a definition is malformed.
     */
    public Node demacro(Node root) throws MacroException {
        MacroTable working = table.copy();
        DiagnosticsEngine callDiagnostics = new DiagnosticsEngine();
        Node result = Nodes.fixWhitespace(new MacroExpander(working, callDiagnostics, registry, options).expand(root));
        table = working;
        diagnostics.absorb(callDiagnostics);
        LOG.debug("De-macroed tree, {} definitions known", table.size());
        return result;
    }

    /**
     * @return The non-fatal findings of all successful calls, e.g. redefinitions.
     */
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    /**
     * @return A copy of the current definitions.
     */
    public MacroTable getMacroTable() {
        return table.copy();
    }

    private Optional<List<Node>> parseDefault(String name, int args, Optional<String> text) throws MacroException {
        if (text.isEmpty()) {
            return Optional.empty();
        }
        if (args == 0) {
            throw DefinitionSyntax.malformed(name + " has a default but no arguments", null);
        }
        return Optional.of(DefinitionSyntax.unwrapSingleGroup(parse(text.get(), name)));
    }

    private List<Node> parse(String text, String what) throws MacroException {
        try {
            return Parser.parseTemplate(text, parserOptions);
        } catch (ParseException e) {
            throw new MacroException(MacroErrorKind.MALFORMED_DEFINITION,
                    "Body of " + what + " does not parse: " + e.getMessage(), e);
        }
    }

    private static String checkName(String name) throws MacroException {
        if (name == null || name.isEmpty()) {
            throw DefinitionSyntax.malformed("Macro and environment names must not be empty", null);
        }
        return name;
    }
}
