package io.github.dumbconf.grammar;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Splits dumbconf text into [Token]s.
///
/// Every character of the input lands in exactly one token, so joining the
/// `src` of the returned tokens gives back the input. The list always ends
/// with [Token#EOF].
public final class Tokenizer {

    private static final Logger LOG = Logger.getLogger(Tokenizer.class.getName());

    private final String text;
    private final List<Token> tokens = new ArrayList<>();
    private int pos;

    private Tokenizer(String text) {
        this.text = text;
    }

    /// Tokenizes `text`.
    /// @param text the dumbconf source
    /// @return the tokens, terminated by [Token#EOF]
    /// @throws NullPointerException if text is null
    /// @throws DumbconfParseException if `text` contains a character sequence that is not a token
    public static List<Token> tokenize(String text) {
        Objects.requireNonNull(text, "text must not be null");
        final var result = new Tokenizer(text).run();
        LOG.finer(() -> "Tokenized " + text.length() + " chars into " + result.size() + " tokens");
        return result;
    }

    private List<Token> run() {
        while (pos < text.length()) {
            final char c = text.charAt(pos);
            if (c == '\n') {
                emit(TokenType.NL, pos + 1);
            } else if (c == '\r' && pos + 1 < text.length() && text.charAt(pos + 1) == '\n') {
                emit(TokenType.NL, pos + 2);
            } else if (c == ' ' || c == '\t') {
                readWhitespace();
            } else if (c == '#') {
                readComment();
            } else if (c == ',') {
                emit(TokenType.COMMA, pos + 1);
            } else if (c == ':') {
                emit(TokenType.COLON, pos + 1);
            } else if (c == '{') {
                emit(TokenType.MAP_START, pos + 1);
            } else if (c == '}') {
                emit(TokenType.MAP_END, pos + 1);
            } else if (c == '[') {
                emit(TokenType.LIST_START, pos + 1);
            } else if (c == ']') {
                emit(TokenType.LIST_END, pos + 1);
            } else if (c == '"' || c == '\'') {
                readString(c);
            } else if (c == '_' || isAsciiLetter(c)) {
                readWord();
            } else if (c == '-' || c == '+' || c == '.' || isDigit(c)) {
                readNumber();
            } else {
                throw new DumbconfParseException("Unexpected character", text, pos);
            }
        }
        tokens.add(Token.EOF);
        return List.copyOf(tokens);
    }

    private void emit(TokenType type, int end) {
        tokens.add(new Token(type, text.substring(pos, end)));
        pos = end;
    }

    private void readWhitespace() {
        final boolean lineStart = pos == 0 || text.charAt(pos - 1) == '\n';
        int end = pos;
        while (end < text.length() && (text.charAt(end) == ' ' || text.charAt(end) == '\t')) {
            end++;
        }
        emit(lineStart ? TokenType.INDENT : TokenType.WS, end);
    }

    private void readComment() {
        int end = pos;
        while (end < text.length() && text.charAt(end) != '\n'
                && !(text.charAt(end) == '\r' && end + 1 < text.length() && text.charAt(end + 1) == '\n')) {
            end++;
        }
        emit(TokenType.COMMENT, end);
    }

    private void readString(char quote) {
        int end = pos + 1;
        while (true) {
            if (end >= text.length() || text.charAt(end) == '\n' || text.charAt(end) == '\r') {
                throw new DumbconfParseException("Unterminated string", text, pos);
            }
            final char c = text.charAt(end);
            if (c == '\\') {
                end += 2;
            } else if (c == quote) {
                end++;
                break;
            } else {
                end++;
            }
        }
        final var src = text.substring(pos, end);
        try {
            Primitives.decodeString(src);
        } catch (IllegalArgumentException e) {
            throw new DumbconfParseException("Invalid string literal", text, pos, e);
        }
        emit(TokenType.STRING, end);
    }

    private void readWord() {
        final var m = Primitives.BARE_WORD.matcher(text).region(pos, text.length());
        if (!m.lookingAt()) {
            throw new AssertionError("word start did not match at " + pos);
        }
        final var word = m.group();
        final TokenType type;
        if (Primitives.TRUE_WORDS.contains(word) || Primitives.FALSE_WORDS.contains(word)) {
            type = TokenType.BOOL;
        } else if (Primitives.NULL_WORDS.contains(word)) {
            type = TokenType.NULL;
        } else {
            type = TokenType.BARE_WORD;
        }
        emit(type, m.end());
    }

    private void readNumber() {
        final var floatMatch = Primitives.FLOAT.matcher(text).region(pos, text.length());
        final var intMatch = Primitives.INT.matcher(text).region(pos, text.length());
        final int floatEnd = floatMatch.lookingAt() ? floatMatch.end() : -1;
        final int intEnd = intMatch.lookingAt() ? intMatch.end() : -1;
        if (floatEnd < 0 && intEnd < 0) {
            throw new DumbconfParseException("Invalid number", text, pos);
        }
        final boolean isFloat = floatEnd > intEnd;
        final int end = isFloat ? floatEnd : intEnd;
        if (end < text.length() && isWordChar(text.charAt(end))) {
            throw new DumbconfParseException("Invalid number", text, pos);
        }
        emit(isFloat ? TokenType.FLOAT : TokenType.INT, end);
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isWordChar(char c) {
        return isAsciiLetter(c) || isDigit(c) || c == '_' || c == '-' || c == '.';
    }
}
