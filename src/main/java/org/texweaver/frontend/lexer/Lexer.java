package org.texweaver.frontend.lexer;

import org.texweaver.frontend.parser.ParserOptions;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * The Lexer is responsible for converting LaTeX source text into a flat
 * sequence of tokens. Every character of the input ends up in exactly one
 * token, so the concatenated token texts reproduce the source.
 * <p>
 * The lexer never fails: anything it cannot classify becomes {@link TokenType#TEXT}.
 */
public class Lexer {

    private final String source;
    private final ParserOptions options;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;

    private int braceDepth = 0;
    private boolean argumentPosition = false;
    private final Deque<Integer> openOptionals = new ArrayDeque<>();
    private final Deque<MathFrame> openMath = new ArrayDeque<>();

    private record MathFrame(TokenType opener, int braceDepth) {}

    /**
     * Creates a new Lexer with default options.
     * @param source The LaTeX source as a single string.
     */
    public Lexer(String source) {
        this(source, ParserOptions.DEFAULT);
    }

    /**
     * Creates a new Lexer.
     * @param source The LaTeX source as a single string.
     * @param options Controls comments in math mode and whether '@' is a letter.
     */
    public Lexer(String source, ParserOptions options) {
        this.source = source;
        this.options = options;
    }

    /**
     * Performs the tokenization of the entire source.
     * @return A list of the recognized tokens, terminated by {@link TokenType#END_OF_FILE}.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            startLine = line;
            startColumn = column;
            scanToken();
        }
        tokens.add(new Token(TokenType.END_OF_FILE, "", null, current, line, column));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '\\': backslash(); break;
            case '{':
                braceDepth++;
                emit(TokenType.BEGIN_GROUP, null, false);
                break;
            case '}':
                braceDepth = Math.max(0, braceDepth - 1);
                emit(TokenType.END_GROUP, null, true);
                break;
            case '[':
                if (argumentPosition) {
                    openOptionals.push(braceDepth);
                    emit(TokenType.BEGIN_OPTIONAL, null, false);
                } else {
                    text();
                }
                break;
            case ']':
                if (closesOptional()) {
                    openOptionals.pop();
                    emit(TokenType.END_OPTIONAL, null, true);
                } else {
                    text();
                }
                break;
            case '%':
                if (!options.mathComments() && !openMath.isEmpty()) {
                    text();
                } else {
                    comment();
                }
                break;
            case '$': dollar(); break;
            case '#': parameter(); break;
            case ' ', '\t', '\r', '\n': whitespace(); break;
            case '*':
                // A star directly after a command keeps the argument position (\section*[..]{..}).
                emit(TokenType.TEXT, null, previousIsCommand());
                break;
            default: text(); break;
        }
    }

    private void backslash() {
        if (isAtEnd()) {
            emit(TokenType.TEXT, null, false);
            return;
        }
        char c = peek();
        if (isLetter(c)) {
            while (!isAtEnd() && isLetter(peek())) advance();
            emit(TokenType.COMMAND, source.substring(start + 1, current), true);
            return;
        }
        advance();
        switch (c) {
            case '%', '{', '}', '$', '#':
                emit(TokenType.TEXT, null, false);
                break;
            case '[':
                openMath.push(new MathFrame(TokenType.BEGIN_DISPLAY_MATH, braceDepth));
                emit(TokenType.BEGIN_DISPLAY_MATH, null, false);
                break;
            case ']':
                popMath(TokenType.BEGIN_DISPLAY_MATH);
                emit(TokenType.END_DISPLAY_MATH, null, false);
                break;
            case '(':
                openMath.push(new MathFrame(TokenType.BEGIN_INLINE_MATH, braceDepth));
                emit(TokenType.BEGIN_INLINE_MATH, null, false);
                break;
            case ')':
                popMath(TokenType.BEGIN_INLINE_MATH);
                emit(TokenType.END_INLINE_MATH, null, false);
                break;
            default:
                emit(TokenType.COMMAND, String.valueOf(c), true);
                break;
        }
    }

    private void dollar() {
        MathFrame top = openMath.peek();
        boolean closesInline = top != null
                && top.opener() == TokenType.MATH_SHIFT
                && top.braceDepth() == braceDepth;
        if (!closesInline && peek() == '$') {
            advance();
            if (top != null && top.opener() == TokenType.DISPLAY_MATH_SHIFT && top.braceDepth() == braceDepth) {
                openMath.pop();
            } else {
                openMath.push(new MathFrame(TokenType.DISPLAY_MATH_SHIFT, braceDepth));
            }
            emit(TokenType.DISPLAY_MATH_SHIFT, null, false);
            return;
        }
        if (closesInline) {
            openMath.pop();
        } else {
            openMath.push(new MathFrame(TokenType.MATH_SHIFT, braceDepth));
        }
        emit(TokenType.MATH_SHIFT, null, false);
    }

    private void popMath(TokenType opener) {
        MathFrame top = openMath.peek();
        if (top != null && top.opener() == opener) {
            openMath.pop();
        }
    }

    private void comment() {
        while (!isAtEnd() && peek() != '\n') advance();
        if (!isAtEnd()) {
            advance();
            while (!isAtEnd() && (peek() == ' ' || peek() == '\t')) advance();
        }
        emit(TokenType.COMMENT, null, false);
    }

    private void parameter() {
        while (peek() == '#') advance();
        char c = peek();
        if (c >= '1' && c <= '9') {
            advance();
            emit(TokenType.PARAMETER, c - '0', false);
        } else {
            emit(TokenType.TEXT, null, false);
        }
    }

    private void whitespace() {
        while (!isAtEnd() && isBlank(peek())) advance();
        // Whitespace between a command and its arguments keeps the argument position.
        emit(TokenType.WHITESPACE, null, argumentPosition);
    }

    private void text() {
        while (!isAtEnd() && isPlainTextChar(peek())) advance();
        emit(TokenType.TEXT, null, false);
    }

    private boolean isPlainTextChar(char c) {
        switch (c) {
            case '\\', '{', '}', '%', '$', '#', '*', ' ', '\t', '\r', '\n':
                return false;
            case ']':
                return !closesOptional();
            default:
                return true;
        }
    }

    private boolean closesOptional() {
        return !openOptionals.isEmpty() && openOptionals.peek() == braceDepth;
    }

    private boolean previousIsCommand() {
        return !tokens.isEmpty() && tokens.get(tokens.size() - 1).type() == TokenType.COMMAND;
    }

    private void emit(TokenType type, Object value, boolean keepsArgumentPosition) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, value, start, startLine, startColumn));
        argumentPosition = keepsArgumentPosition;
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z')
                || (c >= 'A' && c <= 'Z')
                || (c == '@' && options.atLetter());
    }

    private boolean isBlank(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\n';
    }
}
