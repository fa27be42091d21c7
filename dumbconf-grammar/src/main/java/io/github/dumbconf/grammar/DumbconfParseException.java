package io.github.dumbconf.grammar;

/// Exception thrown when dumbconf text cannot be tokenized or parsed.
public class DumbconfParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int position;
    private final String source;

    /// Creates a new parse exception with position information.
    /// @param message the error message
    /// @param source the text being parsed
    /// @param position the character offset of the failure
    public DumbconfParseException(String message, String source, int position) {
        super(formatMessage(message, source, position));
        this.position = position;
        this.source = source;
    }

    /// Creates a new parse exception with position information and a cause.
    public DumbconfParseException(String message, String source, int position, Throwable cause) {
        super(formatMessage(message, source, position), cause);
        this.position = position;
        this.source = source;
    }

    /// Returns the character offset where the error occurred.
    public int position() {
        return position;
    }

    /// Returns the text that was being parsed.
    public String source() {
        return source;
    }

    /// Returns the 1-based line of [#position()].
    public int line() {
        int line = 1;
        for (int i = 0; i < position && i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }

    private static String formatMessage(String message, String source, int position) {
        if (source == null || position < 0) {
            return message;
        }
        final var sb = new StringBuilder();
        sb.append(message);
        sb.append(" at position ").append(position);
        if (position < source.length()) {
            sb.append(" (near ").append(describe(source.charAt(position))).append(')');
        } else {
            sb.append(" (at end of input)");
        }
        return sb.toString();
    }

    private static String describe(char c) {
        return switch (c) {
            case '\n' -> "'\\n'";
            case '\r' -> "'\\r'";
            case '\t' -> "'\\t'";
            default -> "'" + c + "'";
        };
    }
}
