package org.texweaver.demacro;

import org.texweaver.api.MacroErrorKind;
import org.texweaver.api.MacroException;
import org.texweaver.diagnostics.DiagnosticsEngine;
import org.texweaver.frontend.parser.EnvironmentFolder;
import org.texweaver.frontend.parser.ast.Argument;
import org.texweaver.frontend.parser.ast.Command;
import org.texweaver.frontend.parser.ast.Document;
import org.texweaver.frontend.parser.ast.Environment;
import org.texweaver.frontend.parser.ast.Group;
import org.texweaver.frontend.parser.ast.Node;
import org.texweaver.frontend.parser.ast.Nodes;
import org.texweaver.frontend.parser.ast.Text;
import org.texweaver.frontend.render.Renderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Expands macros and custom environments in one tree. It works on each sibling list like
 * a token stream: definitions are registered and removed, invocations are replaced by their
 * expansion together with the siblings they consume, and scanning resumes at the call site
 * so that the expansion itself is expanded.
 * <p>
 * An expander is used for a single call and writes definitions to the table it is given.
 */
final class MacroExpander {

    private static final Logger LOG = LoggerFactory.getLogger(MacroExpander.class);

    private final MacroTable table;
    private final DiagnosticsEngine diagnostics;
    private final DefinitionHandlerRegistry registry;
    private final int maxDepth;

    /**
     * The parameters bound for one invocation.
     *
     * @param arguments One node list per parameter.
     * @param consumed The number of following siblings that supplied arguments.
     * @param leftovers Captured arguments the macro does not use, to be emitted after the expansion.
     */
    private record Binding(List<List<Node>> arguments, int consumed, List<Node> leftovers) {

        String render() {
            StringBuilder sb = new StringBuilder();
            for (List<Node> argument : arguments) {
                sb.append('{').append(Renderer.render(argument)).append('}');
            }
            return sb.toString();
        }
    }

    MacroExpander(MacroTable table, DiagnosticsEngine diagnostics,
                  DefinitionHandlerRegistry registry, DemacroOptions options) {
        this.table = table;
        this.diagnostics = diagnostics;
        this.registry = registry;
        this.maxDepth = options.maxDepth();
    }

    /**
     * Expands a tree.
     * @param root The root. A document stays a document; any other root whose expansion is
     *             not a single node is wrapped in a document.
     * @return The expanded tree; the root itself if nothing was expanded.
     * @throws MacroException if an invocation cannot be expanded.
     */
    Node expand(Node root) throws MacroException {
        if (root instanceof Document document) {
            List<Node> children = expandList(document.children(), 0);
            return children == document.children()
                    ? document
                    : document.reconstructWithChildLists(List.of(children));
        }
        List<Node> single = List.of(root);
        List<Node> result = expandList(single, 0);
        if (result == single) {
            return root;
        }
        return result.size() == 1 ? result.get(0) : Document.of(result);
    }

    private List<Node> expandList(List<Node> nodes, int depth) throws MacroException {
        List<Node> work = new ArrayList<>(nodes);
        Map<Node, Integer> depths = new IdentityHashMap<>();
        Set<String> seenAtCursor = new HashSet<>();
        Deque<Command> openBegins = new ArrayDeque<>();
        boolean changed = false;
        int i = 0;
        while (i < work.size()) {
            Node node = work.get(i);
            int nodeDepth = depths.getOrDefault(node, depth);

            if (node instanceof Command command) {
                Optional<IDefinitionHandler> handler = registry.get(command.name());
                if (handler.isPresent()) {
                    handler.get().define(command, table, diagnostics);
                    work.remove(i);
                    seenAtCursor.clear();
                    changed = true;
                    continue;
                }
                Optional<MacroDefinition> macro = table.getMacro(command.name());
                if (macro.isPresent()) {
                    expandMacro(command, macro.get(), work, i, nodeDepth, depths, seenAtCursor);
                    changed = true;
                    continue;
                }
                Optional<EnvironmentDefinition> flat = flatCustomEnvironment(command);
                if (flat.isPresent()) {
                    expandFlatEnvironment(command, flat.get(), work, i, nodeDepth, depths, seenAtCursor, openBegins);
                    changed = true;
                    continue;
                }
            } else if (node instanceof Environment environment) {
                Optional<EnvironmentDefinition> definition = table.getEnvironment(environment.name());
                if (definition.isPresent()) {
                    expandEnvironment(environment, definition.get(), work, i, nodeDepth, depths, seenAtCursor);
                    changed = true;
                    continue;
                }
            }

            Node expanded = descend(node, nodeDepth);
            if (expanded != node) {
                work.set(i, expanded);
                changed = true;
            }
            i++;
            seenAtCursor.clear();
        }
        if (!openBegins.isEmpty()) {
            Command begin = openBegins.pop();
            throw error(MacroErrorKind.UNTERMINATED_ENVIRONMENT,
                    "\\begin{" + EnvironmentFolder.environmentName(begin).get() + "} is never closed", begin);
        }
        return changed ? work : nodes;
    }

    private void expandMacro(Command command, MacroDefinition macro, List<Node> work, int index, int depth,
                             Map<Node, Integer> depths, Set<String> seenAtCursor) throws MacroException {
        Binding binding = bind(command, command.arguments(), macro.arity(), macro.defaultArgument(),
                work, index + 1, "\\" + command.name());
        String key = "\\" + command.name() + binding.render();
        checkCycle(seenAtCursor, key, command);
        int newDepth = checkDepth(depth, command);

        List<Node> result = new ArrayList<>(instantiate(macro, binding.arguments()));
        result.addAll(binding.leftovers());
        LOG.trace("Expanding {} at depth {}", key, newDepth);
        splice(work, index, 1 + binding.consumed(), result, depths, newDepth);
        if (result.isEmpty()) {
            seenAtCursor.clear();
        }
    }

    private void expandEnvironment(Environment environment, EnvironmentDefinition definition, List<Node> work,
                                   int index, int depth, Map<Node, Integer> depths,
                                   Set<String> seenAtCursor) throws MacroException {
        String what = "environment " + environment.name();
        Binding binding = bind(environment, environment.arguments(), definition.arity(),
                definition.defaultArgument(), environment.body(), 0, what);
        String key = "\\begin{" + environment.name() + "}" + binding.render();
        checkCycle(seenAtCursor, key, environment);
        int newDepth = checkDepth(depth, environment);

        List<Node> body = environment.body().subList(binding.consumed(), environment.body().size());
        List<Node> expandedBody = expandList(body, depth);

        List<Node> result = new ArrayList<>(TemplateSubstitution.substitute(definition.begin(), binding.arguments()));
        result.addAll(binding.leftovers());
        result.addAll(expandedBody);
        result.addAll(TemplateSubstitution.substitute(definition.end(), List.of()));
        LOG.trace("Expanding {} at depth {}", key, newDepth);
        splice(work, index, 1, result, depths, newDepth);
        if (result.isEmpty()) {
            seenAtCursor.clear();
        }
    }

    /**
     * Expands a \begin or \end of a custom environment that was left flat because its partner
     * comes from another expansion. A \begin takes its arguments from the siblings that follow;
     * the body in between is expanded by the ongoing scan.
     */
    private void expandFlatEnvironment(Command command, EnvironmentDefinition definition, List<Node> work,
                                       int index, int depth, Map<Node, Integer> depths, Set<String> seenAtCursor,
                                       Deque<Command> openBegins) throws MacroException {
        String name = EnvironmentFolder.environmentName(command).get();
        List<Node> result;
        int consumed = 0;
        String key;
        if (command.name().equals("begin")) {
            List<Argument> captured = command.arguments().subList(1, command.arguments().size());
            Binding binding = bind(command, captured, definition.arity(), definition.defaultArgument(),
                    work, index + 1, "environment " + name);
            key = "\\begin{" + name + "}" + binding.render();
            checkCycle(seenAtCursor, key, command);
            result = new ArrayList<>(TemplateSubstitution.substitute(definition.begin(), binding.arguments()));
            result.addAll(binding.leftovers());
            consumed = binding.consumed();
            openBegins.push(command);
        } else {
            if (openBegins.isEmpty() || !EnvironmentFolder.environmentName(openBegins.peek()).get().equals(name)) {
                throw error(MacroErrorKind.UNTERMINATED_ENVIRONMENT,
                        "\\end{" + name + "} has no matching \\begin", command);
            }
            openBegins.pop();
            key = "\\end{" + name + "}";
            checkCycle(seenAtCursor, key, command);
            result = new ArrayList<>(TemplateSubstitution.substitute(definition.end(), List.of()));
        }
        int newDepth = checkDepth(depth, command);
        LOG.trace("Expanding {} at depth {}", key, newDepth);
        splice(work, index, 1 + consumed, result, depths, newDepth);
        if (result.isEmpty()) {
            seenAtCursor.clear();
        }
    }

    /**
     * Binds the parameters of an invocation: the optional first parameter from the first
     * captured [...] argument or the default, then captured mandatory arguments, then
     * groups that follow, skipping blank text and comments.
     */
    private Binding bind(Node invocation, List<Argument> captured, int arity, Optional<List<Node>> defaultArgument,
                         List<Node> following, int from, String what) throws MacroException {
        List<List<Node>> arguments = new ArrayList<>();
        List<Argument> unused = new ArrayList<>();
        boolean optionalTaken = false;
        if (arity > 0 && defaultArgument.isPresent()) {
            for (Argument argument : captured) {
                if (argument.kind() == Argument.Kind.OPTIONAL) {
                    arguments.add(DefinitionSyntax.unwrapSingleGroup(argument.children()));
                    optionalTaken = true;
                    break;
                }
            }
            if (!optionalTaken) {
                arguments.add(defaultArgument.get());
            }
        }
        boolean skippedOptional = false;
        for (Argument argument : captured) {
            if (argument.kind() == Argument.Kind.OPTIONAL) {
                if (optionalTaken && !skippedOptional) {
                    skippedOptional = true;
                } else {
                    unused.add(argument);
                }
            } else if (arguments.size() < arity) {
                arguments.add(argument.children());
            } else {
                unused.add(argument);
            }
        }

        int next = from;
        int consumed = 0;
        while (arguments.size() < arity) {
            while (next < following.size() && Nodes.isBlank(following.get(next))) {
                next++;
            }
            if (next < following.size() && following.get(next) instanceof Group group) {
                arguments.add(group.children());
                next++;
                consumed = next - from;
            } else {
                throw error(MacroErrorKind.MISSING_ARGUMENT,
                        what + " expects " + arity + " arguments but found " + arguments.size(), invocation);
            }
        }
        return new Binding(arguments, consumed, leftovers(unused));
    }

    private static List<Node> leftovers(List<Argument> unused) {
        List<Node> nodes = new ArrayList<>();
        for (Argument argument : unused) {
            switch (argument.kind()) {
                case OPTIONAL:
                    nodes.add(Text.of(argument.leading() + "["));
                    nodes.addAll(argument.children());
                    nodes.add(Text.of("]"));
                    break;
                case MANDATORY:
                    if (!argument.leading().isEmpty()) {
                        nodes.add(Text.of(argument.leading()));
                    }
                    nodes.add(Group.of(argument.children()));
                    break;
                default:
                    nodes.add(Text.of(argument.leading()));
                    nodes.addAll(argument.children());
                    break;
            }
        }
        return nodes;
    }

    private static List<Node> instantiate(MacroDefinition macro, List<List<Node>> arguments) throws MacroException {
        MacroBody body = macro.body();
        if (body instanceof MacroBody.Template template) {
            return TemplateSubstitution.substitute(template.nodes(), arguments);
        }
        List<List<Node>> copies = new ArrayList<>(arguments.size());
        for (List<Node> argument : arguments) {
            copies.add(Nodes.deepCopy(argument));
        }
        List<Node> result = ((MacroBody.Computed) body).function().expand(Collections.unmodifiableList(copies));
        return Nodes.deepCopy(result);
    }

    /**
     * Replaces {@code count} nodes at {@code index} with the expansion, then folds flat
     * \begin/\end pairs from the call site on so that the rescan sees whole environments.
     */
    private static void splice(List<Node> work, int index, int count, List<Node> result,
                               Map<Node, Integer> depths, int newDepth) {
        work.subList(index, index + count).clear();
        work.addAll(index, result);
        for (Node node : result) {
            depths.put(node, newDepth);
        }
        List<Node> tail = new ArrayList<>(work.subList(index, work.size()));
        List<Node> folded = EnvironmentFolder.fold(tail);
        if (folded == tail) {
            return;
        }
        Set<Node> before = Collections.newSetFromMap(new IdentityHashMap<>());
        before.addAll(tail);
        for (Node node : folded) {
            if (!before.contains(node)) {
                depths.put(node, newDepth);
            }
        }
        work.subList(index, work.size()).clear();
        work.addAll(folded);
    }

    private Node descend(Node node, int depth) throws MacroException {
        List<List<Node>> lists = node.childLists();
        if (lists.isEmpty()) {
            return node;
        }
        List<List<Node>> expanded = new ArrayList<>(lists.size());
        boolean changed = false;
        for (List<Node> list : lists) {
            List<Node> result = expandList(list, depth);
            changed |= result != list;
            expanded.add(result);
        }
        return changed ? node.reconstructWithChildLists(expanded) : node;
    }

    private Optional<EnvironmentDefinition> flatCustomEnvironment(Command command) {
        if (!command.name().equals("begin") && !command.name().equals("end")) {
            return Optional.empty();
        }
        Optional<String> name = EnvironmentFolder.environmentName(command);
        return name.isPresent() ? table.getEnvironment(name.get()) : Optional.empty();
    }

    private static void checkCycle(Set<String> seenAtCursor, String key, Node at) throws MacroException {
        if (!seenAtCursor.add(key)) {
            throw error(MacroErrorKind.EXPANSION_CYCLE, key + " expands to itself", at);
        }
    }

    private int checkDepth(int depth, Node at) throws MacroException {
        int newDepth = depth + 1;
        if (newDepth > maxDepth) {
            throw error(MacroErrorKind.DEPTH_LIMIT_EXCEEDED,
                    "Expansion nested deeper than " + maxDepth + " levels", at);
        }
        return newDepth;
    }

    private static MacroException error(MacroErrorKind kind, String message, Node at) {
        if (at.span().isPresent()) {
            return new MacroException(kind, message, at.span().get().position());
        }
        return new MacroException(kind, message);
    }
}
