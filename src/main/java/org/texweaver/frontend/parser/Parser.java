package org.texweaver.frontend.parser;

import org.texweaver.api.ParseErrorKind;
import org.texweaver.api.ParseException;
import org.texweaver.frontend.lexer.Lexer;
import org.texweaver.frontend.lexer.Token;
import org.texweaver.frontend.lexer.TokenType;
import org.texweaver.frontend.parser.ast.Argument;
import org.texweaver.frontend.parser.ast.Command;
import org.texweaver.frontend.parser.ast.Comment;
import org.texweaver.frontend.parser.ast.Document;
import org.texweaver.frontend.parser.ast.Environment;
import org.texweaver.frontend.parser.ast.Group;
import org.texweaver.frontend.parser.ast.MathKind;
import org.texweaver.frontend.parser.ast.MathSpan;
import org.texweaver.frontend.parser.ast.Node;
import org.texweaver.frontend.parser.ast.Placeholder;
import org.texweaver.frontend.parser.ast.SourceSpan;
import org.texweaver.frontend.parser.ast.Text;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * The recursive-descent parser for LaTeX. It consumes the tokens of the
 * {@link Lexer} and produces a lossless {@link Document}: every token ends up in
 * exactly one node, so rendering the tree reproduces the input.
 * <p>
 * A parser instance is single-use.
 */
public class Parser {

    private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

    private static final Pattern BLANK_LINE = Pattern.compile("\\n[ \\t\\r]*\\n");
    private static final CommandSignature NO_ARGUMENTS = CommandSignature.of(0);

    private final List<Token> tokens;
    private final ParserOptions options;
    private int current = 0;
    private int templateDepth = 0;
    // Token indexes of template openers already known to have no partner.
    private final Set<Integer> unbalancedOpeners = new HashSet<>();

    private enum Context { DOCUMENT, GROUP, OPTIONAL, ENVIRONMENT, MATH }

    /**
     * What the sequence being parsed is nested in, and which token ends it.
     */
    private record Scope(Context context, Token opener, String environment, MathKind math) {

        static Scope of(Context context, Token opener) {
            return new Scope(context, opener, null, null);
        }

        static Scope environment(Token begin, String name) {
            return new Scope(Context.ENVIRONMENT, begin, name, null);
        }

        static Scope math(Token opener, MathKind kind) {
            return new Scope(Context.MATH, opener, null, kind);
        }

        boolean isMath(MathKind kind) {
            return context == Context.MATH && math == kind;
        }
    }

    /**
     * Constructs a new Parser.
     * @param tokens The tokens to parse, terminated by {@link TokenType#END_OF_FILE}.
     * @param options The options; their signatures decide which groups are arguments.
     */
    public Parser(List<Token> tokens, ParserOptions options) {
        this.tokens = tokens;
        this.options = options;
    }

    /**
     * Tokenizes and parses a source text.
     * @param source The LaTeX source.
     * @param options The parser options.
     * @return The document.
     * @throws ParseException if the source is structurally malformed.
     */
    public static Document parse(String source, ParserOptions options) throws ParseException {
        return new Parser(new Lexer(source, options).scanTokens(), options).parse();
    }

    /**
     * Parses a macro body with default options. See {@link #parseTemplate(String, ParserOptions)}.
     * @param text The body text.
     * @return The body nodes.
     * @throws ParseException if the body is malformed beyond what template mode tolerates.
     */
    public static List<Node> parseTemplate(String text) throws ParseException {
        return parseTemplate(text, ParserOptions.DEFAULT);
    }

    /**
     * Parses a macro body in template mode: \begin, \end, \[, \], \( and \) that do not
     * balance become plain commands. Flat \begin and \end commands that pair up after all
     * are folded back into environments.
     *
     * @param text The body text.
     * @param options The parser options.
     * @return The body nodes.
     * @throws ParseException if the body is malformed beyond what template mode tolerates.
     */
    public static List<Node> parseTemplate(String text, ParserOptions options) throws ParseException {
        Parser parser = new Parser(new Lexer(text, options).scanTokens(), options);
        parser.templateDepth = 1;
        List<Node> nodes = parser.sequence(Scope.of(Context.DOCUMENT, null));
        return EnvironmentFolder.fold(nodes);
    }

    /**
     * Parses the entire token stream.
     * @return The document, spanning the whole input.
     * @throws ParseException if a group, environment or math span is not balanced, or a
     *                        registered command lacks an argument.
     */
    public Document parse() throws ParseException {
        List<Node> children = sequence(Scope.of(Context.DOCUMENT, null));
        Token eof = peek();
        LOG.debug("Parsed {} characters into {} top-level nodes", eof.offset(), children.size());
        return new Document(children, Optional.of(new SourceSpan(0, eof.offset(), 1, 1)));
    }

    /**
     * Parses nodes until the token that closes the given scope, which is left unconsumed.
     *
     * @return The nodes, or null if an optional argument turned out not to be closed by ']'.
     */
    private List<Node> sequence(Scope scope) throws ParseException {
        List<Node> nodes = new ArrayList<>();
        int demotedOptionals = 0;
        while (true) {
            Token token = peek();
            switch (token.type()) {
                case END_OF_FILE:
                    if (scope.context() == Context.DOCUMENT) return nodes;
                    if (scope.context() == Context.OPTIONAL) return null;
                    throw unterminated(scope);
                case END_GROUP:
                    if (scope.context() == Context.GROUP) return nodes;
                    if (scope.context() == Context.OPTIONAL) return null;
                    if (scope.context() == Context.DOCUMENT) {
                        throw new ParseException(ParseErrorKind.UNBALANCED_GROUP,
                                "Unexpected '}' without matching '{'", token.position());
                    }
                    throw unterminated(scope);
                case BEGIN_OPTIONAL:
                    // Not captured by a command, so it is plain text, and so is its partner.
                    demotedOptionals++;
                    appendText(nodes, advance());
                    break;
                case END_OPTIONAL:
                    if (demotedOptionals > 0) {
                        demotedOptionals--;
                    } else if (scope.context() == Context.OPTIONAL) {
                        return nodes;
                    }
                    appendText(nodes, advance());
                    break;
                case TEXT, WHITESPACE:
                    appendText(nodes, advance());
                    break;
                case COMMENT:
                    nodes.add(comment(advance()));
                    break;
                case PARAMETER:
                    nodes.add(placeholder(advance()));
                    break;
                case BEGIN_GROUP:
                    nodes.add(group());
                    break;
                case MATH_SHIFT:
                    if (scope.isMath(MathKind.INLINE)) return nodes;
                    nodes.add(math(MathKind.INLINE));
                    break;
                case DISPLAY_MATH_SHIFT:
                    if (scope.isMath(MathKind.DISPLAY)) return nodes;
                    nodes.add(math(MathKind.DISPLAY));
                    break;
                case BEGIN_DISPLAY_MATH:
                    nodes.add(bracketMath(MathKind.BRACKET_DISPLAY));
                    break;
                case BEGIN_INLINE_MATH:
                    nodes.add(bracketMath(MathKind.PAREN_INLINE));
                    break;
                case END_DISPLAY_MATH, END_INLINE_MATH: {
                    MathKind kind = token.type() == TokenType.END_DISPLAY_MATH
                            ? MathKind.BRACKET_DISPLAY
                            : MathKind.PAREN_INLINE;
                    if (scope.isMath(kind)) return nodes;
                    if (scope.context() == Context.OPTIONAL) return null;
                    if (toleratesStrayClosers(scope)) {
                        nodes.add(flatMathCommand(advance()));
                        break;
                    }
                    throw new ParseException(ParseErrorKind.UNBALANCED_MATH,
                            "Unexpected '" + token.text() + "' without matching opener", token.position());
                }
                case COMMAND:
                    if (token.isCommand("end")) {
                        Optional<String> name = peekEnvironmentName();
                        if (scope.context() == Context.ENVIRONMENT && name.isPresent()
                                && name.get().equals(scope.environment())) {
                            return nodes;
                        }
                        if (scope.context() == Context.OPTIONAL) return null;
                        if (toleratesStrayClosers(scope)) {
                            nodes.add(flatEnvironmentCommand(advance()));
                            break;
                        }
                        throw strayEnd(scope, token, name);
                    }
                    if (token.isCommand("begin")) {
                        nodes.add(environment());
                    } else {
                        nodes.add(command());
                    }
                    break;
                default:
                    throw new IllegalStateException("Unhandled token type " + token.type());
            }
        }
    }

    private boolean toleratesStrayClosers(Scope scope) {
        return templateDepth > 0
                && (scope.context() == Context.DOCUMENT || scope.context() == Context.GROUP);
    }

    private ParseException strayEnd(Scope scope, Token token, Optional<String> name) {
        if (name.isEmpty()) {
            return new ParseException(ParseErrorKind.MISSING_MANDATORY_ARGUMENT,
                    "\\end must be followed by an environment name", token.position());
        }
        switch (scope.context()) {
            case ENVIRONMENT:
                return new ParseException(ParseErrorKind.ENVIRONMENT_NAME_MISMATCH,
                        "Expected \\end{" + scope.environment() + "} but found \\end{" + name.get() + "}",
                        token.position());
            case GROUP, MATH:
                return unterminated(scope);
            default:
                return new ParseException(ParseErrorKind.ENVIRONMENT_NAME_MISMATCH,
                        "\\end{" + name.get() + "} without matching \\begin", token.position());
        }
    }

    private ParseException unterminated(Scope scope) {
        Token opener = scope.opener();
        switch (scope.context()) {
            case GROUP:
                return new ParseException(ParseErrorKind.UNBALANCED_GROUP,
                        "Unclosed '{'", opener.position());
            case ENVIRONMENT:
                return new ParseException(ParseErrorKind.UNTERMINATED_ENVIRONMENT,
                        "\\begin{" + scope.environment() + "} is never closed", opener.position());
            case MATH:
                return new ParseException(ParseErrorKind.UNBALANCED_MATH,
                        "Unclosed math delimiter '" + opener.text() + "'", opener.position());
            default:
                throw new IllegalStateException("Scope " + scope.context() + " has no closer");
        }
    }

    private Group group() throws ParseException {
        Token open = advance();
        List<Node> children = sequence(Scope.of(Context.GROUP, open));
        advance();
        return new Group(children, spanFrom(open));
    }

    private MathSpan math(MathKind kind) throws ParseException {
        Token open = advance();
        List<Node> children = sequence(Scope.math(open, kind));
        advance();
        return new MathSpan(kind, children, spanFrom(open));
    }

    private Node bracketMath(MathKind kind) throws ParseException {
        int mark = current;
        if (templateDepth == 0) {
            return math(kind);
        }
        if (unbalancedOpeners.contains(mark)) {
            return flatMathCommand(advance());
        }
        try {
            return math(kind);
        } catch (ParseException e) {
            LOG.trace("Keeping unbalanced '{}' as a command: {}", peekAt(mark).text(), e.getMessage());
            unbalancedOpeners.add(mark);
            current = mark;
            return flatMathCommand(advance());
        }
    }

    /**
     * Parses an environment. In template mode a \begin without partner becomes a plain
     * command; each opener is tried at most once, so the parse stays polynomial in the
     * number of unbalanced openers.
     */
    private Node environment() throws ParseException {
        int mark = current;
        Token begin = advance();
        if (templateDepth == 0) {
            return environmentBody(begin);
        }
        if (unbalancedOpeners.contains(mark)) {
            return flatEnvironmentCommand(begin);
        }
        try {
            return environmentBody(begin);
        } catch (ParseException e) {
            LOG.trace("Keeping unbalanced \\begin as a command: {}", e.getMessage());
            unbalancedOpeners.add(mark);
            current = mark + 1;
            return flatEnvironmentCommand(begin);
        }
    }

    private Environment environmentBody(Token begin) throws ParseException {
        String beginGap = whitespaceGap();
        Optional<String> name = environmentName();
        if (name.isEmpty()) {
            throw new ParseException(ParseErrorKind.MISSING_MANDATORY_ARGUMENT,
                    "\\begin must be followed by an environment name", begin.position());
        }
        int arity = options.signatures().environment(name.get()).orElse(0);
        List<Argument> arguments = arguments(arity, false, begin);
        List<Node> body = sequence(Scope.environment(begin, name.get()));
        advance();
        String endGap = whitespaceGap();
        environmentName();
        return new Environment(name.get(), beginGap, arguments, body, endGap, spanFrom(begin));
    }

    private Command command() throws ParseException {
        Token token = advance();
        boolean starred = false;
        if (check(TokenType.TEXT) && peek().text().equals("*")) {
            advance();
            starred = true;
        }
        CommandSignature signature = options.signatures().command(token.commandName()).orElse(NO_ARGUMENTS);
        List<Argument> arguments = arguments(signature.mandatoryArguments(), signature.templateArguments(), token);
        return new Command(token.commandName(), starred, arguments, spanFrom(token));
    }

    /**
     * Captures the arguments after a command or environment name. Optional arguments are
     * taken while mandatory ones are still due; a command without mandatory arguments
     * takes any run of optional ones.
     * <p>
     * This holds for environments too: {@code \begin{center}[Note]} gets {@code [Note]} as an
     * optional argument even though {@code center} takes none, so filters find it among the
     * environment's arguments rather than at the start of its body. Rendering is unaffected.
     */
    private List<Argument> arguments(int mandatoryCount, boolean template, Token owner) throws ParseException {
        List<Argument> arguments = new ArrayList<>();
        int mandatory = 0;
        while (true) {
            int mark = current;
            String gap = whitespaceGap();
            if (check(TokenType.BEGIN_OPTIONAL) && (mandatory < mandatoryCount || mandatoryCount == 0)) {
                Optional<Argument> optional = optionalArgument(gap, template);
                if (optional.isPresent()) {
                    arguments.add(optional.get());
                    continue;
                }
                current = mark;
                if (mandatory < mandatoryCount && templateDepth == 0) {
                    throw missingArgument(owner);
                }
                break;
            }
            if (mandatory < mandatoryCount) {
                if (templateDepth > 0 && !startsArgument(peek())) {
                    // Inside a macro body the arguments may be supplied by the invocation.
                    current = mark;
                    break;
                }
                arguments.add(mandatoryArgument(gap, template, owner));
                mandatory++;
                continue;
            }
            current = mark;
            break;
        }
        return arguments;
    }

    private Optional<Argument> optionalArgument(String gap, boolean template) throws ParseException {
        Token open = advance();
        List<Node> children;
        if (template) templateDepth++;
        try {
            children = sequence(Scope.of(Context.OPTIONAL, open));
        } finally {
            if (template) templateDepth--;
        }
        if (children == null) {
            return Optional.empty();
        }
        advance();
        return Optional.of(new Argument(Argument.Kind.OPTIONAL, gap, children));
    }

    private Argument mandatoryArgument(String gap, boolean template, Token owner) throws ParseException {
        Token token = peek();
        if (token.type() == TokenType.BEGIN_GROUP) {
            advance();
            List<Node> children;
            if (template) templateDepth++;
            try {
                children = sequence(Scope.of(Context.GROUP, token));
            } finally {
                if (template) templateDepth--;
            }
            advance();
            return new Argument(Argument.Kind.MANDATORY, gap, children);
        }
        if (token.type() == TokenType.COMMAND && !token.isCommand("begin") && !token.isCommand("end")) {
            advance();
            Command bare = new Command(token.commandName(), false, List.of(), spanFrom(token));
            return new Argument(Argument.Kind.BARE, gap, List.of(bare));
        }
        if (token.type() == TokenType.PARAMETER) {
            return new Argument(Argument.Kind.BARE, gap, List.of(placeholder(advance())));
        }
        throw missingArgument(owner);
    }

    private boolean startsArgument(Token token) {
        return token.type() == TokenType.BEGIN_GROUP
                || token.type() == TokenType.PARAMETER
                || (token.type() == TokenType.COMMAND && !token.isCommand("begin") && !token.isCommand("end"));
    }

    private ParseException missingArgument(Token owner) {
        return new ParseException(ParseErrorKind.MISSING_MANDATORY_ARGUMENT,
                "Missing argument for " + owner.text(), owner.position());
    }

    /**
     * Builds a plain command for a \begin or \end (already consumed) that has no partner.
     * Its name group, if any, becomes its first argument.
     */
    private Command flatEnvironmentCommand(Token token) throws ParseException {
        List<Argument> arguments = new ArrayList<>();
        int mark = current;
        String gap = whitespaceGap();
        if (check(TokenType.BEGIN_GROUP)) {
            arguments.add(mandatoryArgument(gap, false, token));
            if (token.isCommand("begin")) {
                arguments.addAll(arguments(0, false, token));
            }
        } else {
            current = mark;
        }
        return new Command(token.commandName(), false, arguments, spanFrom(token));
    }

    private Command flatMathCommand(Token token) {
        return new Command(token.text().substring(1), false, List.of(), spanFrom(token));
    }

    /**
     * Consumes '{name}' where the name is plain text.
     * @return The name, or empty with nothing consumed.
     */
    private Optional<String> environmentName() {
        int mark = current;
        if (!check(TokenType.BEGIN_GROUP)) {
            return Optional.empty();
        }
        advance();
        StringBuilder name = new StringBuilder();
        while (check(TokenType.TEXT) || check(TokenType.WHITESPACE)) {
            name.append(advance().text());
        }
        if (!check(TokenType.END_GROUP) || name.length() == 0) {
            current = mark;
            return Optional.empty();
        }
        advance();
        return Optional.of(name.toString());
    }

    private Optional<String> peekEnvironmentName() {
        int mark = current;
        advance();
        whitespaceGap();
        Optional<String> name = environmentName();
        current = mark;
        return name;
    }

    /**
     * Consumes whitespace between a command and its next argument. A blank line ends the
     * argument list, so such whitespace is left in place.
     */
    private String whitespaceGap() {
        if (check(TokenType.WHITESPACE) && !BLANK_LINE.matcher(peek().text()).find()) {
            return advance().text();
        }
        return "";
    }

    private Comment comment(Token token) {
        String text = token.text();
        int newline = text.indexOf('\n');
        String content = newline < 0 ? text.substring(1) : text.substring(1, newline);
        String trailing = newline < 0 ? "" : text.substring(newline);
        return new Comment(content, trailing, spanFrom(token));
    }

    private Placeholder placeholder(Token token) {
        int hashes = token.text().length() - 1;
        return new Placeholder(hashes, (Integer) token.value(), spanFrom(token));
    }

    private void appendText(List<Node> nodes, Token token) {
        int last = nodes.size() - 1;
        if (last >= 0 && nodes.get(last) instanceof Text previous && previous.span().isPresent()) {
            SourceSpan span = previous.span().get();
            SourceSpan merged = new SourceSpan(span.start(), token.endOffset(), span.line(), span.column());
            nodes.set(last, new Text(previous.text() + token.text(), Optional.of(merged)));
            return;
        }
        nodes.add(new Text(token.text(), spanFrom(token)));
    }

    private Optional<SourceSpan> spanFrom(Token first) {
        return Optional.of(new SourceSpan(first.offset(), previous().endOffset(), first.line(), first.column()));
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        if (peek().type() != TokenType.END_OF_FILE) current++;
        return previous();
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token peekAt(int index) {
        return tokens.get(index);
    }

    private Token previous() {
        return tokens.get(current - 1);
    }
}
