package io.github.dumbconf.grammar;

/// Kinds of lexical unit produced by [Tokenizer].
public enum TokenType {
    /// Spaces or tabs in the middle of a line.
    WS,
    /// Spaces or tabs at the start of a line.
    INDENT,
    /// A line break, `\n` or `\r\n`.
    NL,
    /// A `#` comment running to the end of the line, newline excluded.
    COMMENT,
    COMMA,
    COLON,
    MAP_START,
    MAP_END,
    LIST_START,
    LIST_END,
    STRING,
    BOOL,
    NULL,
    INT,
    FLOAT,
    /// An unquoted word, only valid as a map key.
    BARE_WORD,
    /// End of input; always the last token and always empty.
    EOF;

    /// Returns true for tokens that carry no value: whitespace, newlines and comments.
    public boolean isTrivia() {
        return this == WS || this == INDENT || this == NL || this == COMMENT;
    }

    /// Returns true for tokens that may start a map key.
    public boolean isKey() {
        return isPrimitive() || this == BARE_WORD;
    }

    /// Returns true for tokens that decode to a primitive value.
    public boolean isPrimitive() {
        return this == STRING || this == BOOL || this == NULL || this == INT || this == FLOAT;
    }
}
