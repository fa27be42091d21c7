package io.github.dumbconf.grammar;

import java.util.Objects;

/// An immutable lexical unit holding its exact source text.
///
/// Tokens are the unit of exact-text preservation: concatenating the `src` of
/// every token of a document reproduces the document.
///
/// @param type the token kind
/// @param src the exact source text
public record Token(TokenType type, String src) {

    public static final Token EOF = new Token(TokenType.EOF, "");

    public Token {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(src, "src must not be null");
    }

    /// Returns true when this token's text ends with a line break.
    public boolean endsWithNewline() {
        return src.endsWith("\n");
    }

    public static Token ws(String src) {
        return new Token(TokenType.WS, src);
    }

    public static Token indent(String src) {
        return new Token(TokenType.INDENT, src);
    }

    public static Token nl() {
        return new Token(TokenType.NL, "\n");
    }

    public static Token comma() {
        return new Token(TokenType.COMMA, ",");
    }

    public static Token colon() {
        return new Token(TokenType.COLON, ":");
    }
}
