package io.github.dumbconf.grammar;

import java.math.BigInteger;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

import io.github.dumbconf.grammar.Ast.PrimitiveKind;

/// Text codec for the atomic values of the language.
///
/// | Kind | Accepted text | Written as |
/// |------|---------------|------------|
/// | string | `'...'` or `"..."` with backslash escapes | `"..."` (or `'...'` when that avoids escaping) |
/// | bool | `TRUE`, `true`, `FALSE`, `false` | `TRUE` / `FALSE` |
/// | null | `NULL`, `null` | `NULL` |
/// | int | decimal, `0x` hex, `0o` octal, `0b` binary, optional sign | decimal |
/// | float | digits with `.` and/or exponent, optional sign | `Double.toString` |
///
/// Ints decode to `Long`, or `BigInteger` outside the `long` range. Floats decode to `Double`.
public final class Primitives {

    static final Pattern BARE_WORD = Pattern.compile("[A-Za-z_][A-Za-z0-9_-]*");

    static final Pattern INT = Pattern.compile(
            "[-+]?(?:0[xX][0-9a-fA-F]+|0[oO][0-7]+|0[bB][01]+|0|[1-9][0-9]*)");

    static final Pattern FLOAT = Pattern.compile(
            "[-+]?(?:[0-9]+\\.[0-9]*(?:[eE][-+]?[0-9]+)?"
                    + "|\\.[0-9]+(?:[eE][-+]?[0-9]+)?"
                    + "|[0-9]+[eE][-+]?[0-9]+)");

    static final Set<String> TRUE_WORDS = Set.of("TRUE", "true");
    static final Set<String> FALSE_WORDS = Set.of("FALSE", "false");
    static final Set<String> NULL_WORDS = Set.of("NULL", "null");

    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private Primitives() {}

    /// Returns true when `s` can be written as an unquoted key.
    ///
    /// Words spelled like a boolean or null are excluded: they would read back
    /// as those values rather than as strings.
    public static boolean isBareWord(String s) {
        Objects.requireNonNull(s, "s must not be null");
        return BARE_WORD.matcher(s).matches()
                && !TRUE_WORDS.contains(s)
                && !FALSE_WORDS.contains(s)
                && !NULL_WORDS.contains(s);
    }

    public static String encodeBool(boolean b) {
        return b ? "TRUE" : "FALSE";
    }

    public static String encodeNull() {
        return "NULL";
    }

    public static String encodeInt(BigInteger i) {
        return i.toString();
    }

    public static String encodeInt(long i) {
        return Long.toString(i);
    }

    /// Encodes a finite double.
    /// @throws IllegalArgumentException for NaN or an infinity, which have no literal form
    public static String encodeFloat(double d) {
        if (!Double.isFinite(d)) {
            throw new IllegalArgumentException("Cannot encode non-finite float: " + d);
        }
        return Double.toString(d);
    }

    /// Encodes a string literal, picking the quote that needs no escaping when possible.
    public static String encodeString(String s) {
        Objects.requireNonNull(s, "s must not be null");
        final char quote = s.indexOf('"') >= 0 && s.indexOf('\'') < 0 ? '\'' : '"';
        final var sb = new StringBuilder(s.length() + 2);
        sb.append(quote);
        for (int i = 0; i < s.length(); i++) {
            final char c = s.charAt(i);
            if (c == quote || c == '\\') {
                sb.append('\\').append(c);
            } else if (c == '\n') {
                sb.append("\\n");
            } else if (c == '\r') {
                sb.append("\\r");
            } else if (c == '\t') {
                sb.append("\\t");
            } else if (c < 0x20 || c == 0x7f) {
                sb.append(String.format("\\u%04x", (int) c));
            } else {
                sb.append(c);
            }
        }
        return sb.append(quote).toString();
    }

    /// Decodes the source text of a primitive token.
    ///
    /// @param kind the primitive kind the text was lexed as
    /// @param src the exact token text
    /// @return the decoded value; `null` for [PrimitiveKind#NULL]
    /// @throws IllegalArgumentException if `src` is not valid text for `kind`
    public static Object decode(PrimitiveKind kind, String src) {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(src, "src must not be null");
        switch (kind) {
            case STRING:
                return decodeString(src);
            case BOOL:
                if (TRUE_WORDS.contains(src)) {
                    return Boolean.TRUE;
                } else if (FALSE_WORDS.contains(src)) {
                    return Boolean.FALSE;
                }
                throw new IllegalArgumentException("Not a boolean: " + src);
            case NULL:
                if (!NULL_WORDS.contains(src)) {
                    throw new IllegalArgumentException("Not a null: " + src);
                }
                return null;
            case INT:
                return decodeInt(src);
            case FLOAT:
                if (!FLOAT.matcher(src).matches()) {
                    throw new IllegalArgumentException("Not a float: " + src);
                }
                return Double.parseDouble(src);
            case BARE_WORD_KEY:
                if (!BARE_WORD.matcher(src).matches()) {
                    throw new IllegalArgumentException("Not a bare word: " + src);
                }
                return src;
            default:
                throw new AssertionError("Unknown primitive kind: " + kind);
        }
    }

    static Number decodeInt(String src) {
        if (!INT.matcher(src).matches()) {
            throw new IllegalArgumentException("Not an int: " + src);
        }
        int pos = 0;
        boolean negative = false;
        if (src.charAt(0) == '-' || src.charAt(0) == '+') {
            negative = src.charAt(0) == '-';
            pos = 1;
        }
        int radix = 10;
        if (src.length() > pos + 1 && src.charAt(pos) == '0') {
            switch (Character.toLowerCase(src.charAt(pos + 1))) {
                case 'x' -> radix = 16;
                case 'o' -> radix = 8;
                case 'b' -> radix = 2;
                default -> { }
            }
            if (radix != 10) {
                pos += 2;
            }
        }
        var value = new BigInteger(src.substring(pos), radix);
        if (negative) {
            value = value.negate();
        }
        if (value.compareTo(LONG_MIN) >= 0 && value.compareTo(LONG_MAX) <= 0) {
            return value.longValue();
        }
        return value;
    }

    static String decodeString(String src) {
        if (src.length() < 2) {
            throw new IllegalArgumentException("Unterminated string: " + src);
        }
        final char quote = src.charAt(0);
        if ((quote != '"' && quote != '\'') || src.charAt(src.length() - 1) != quote) {
            throw new IllegalArgumentException("Not a quoted string: " + src);
        }
        final var sb = new StringBuilder(src.length());
        final int end = src.length() - 1;
        int i = 1;
        while (i < end) {
            final char c = src.charAt(i);
            if (c == quote) {
                throw new IllegalArgumentException("Unescaped quote in string: " + src);
            }
            if (c == '\n' || c == '\r') {
                throw new IllegalArgumentException("Line break in string: " + src);
            }
            if (c != '\\') {
                sb.append(c);
                i++;
                continue;
            }
            if (i + 1 >= end) {
                throw new IllegalArgumentException("Dangling escape in string: " + src);
            }
            final char e = src.charAt(i + 1);
            i += 2;
            switch (e) {
                case '\\' -> sb.append('\\');
                case '\'' -> sb.append('\'');
                case '"' -> sb.append('"');
                case 'n' -> sb.append('\n');
                case 'r' -> sb.append('\r');
                case 't' -> sb.append('\t');
                case 'b' -> sb.append('\b');
                case 'f' -> sb.append('\f');
                case '0' -> sb.append('\0');
                case 'x' -> {
                    sb.appendCodePoint(hex(src, i, 2, end));
                    i += 2;
                }
                case 'u' -> {
                    sb.appendCodePoint(hex(src, i, 4, end));
                    i += 4;
                }
                case 'U' -> {
                    final int cp = hex(src, i, 8, end);
                    if (!Character.isValidCodePoint(cp)) {
                        throw new IllegalArgumentException("Invalid code point escape in string: " + src);
                    }
                    sb.appendCodePoint(cp);
                    i += 8;
                }
                default -> throw new IllegalArgumentException("Invalid escape '\\" + e + "' in string: " + src);
            }
        }
        return sb.toString();
    }

    private static int hex(String src, int from, int digits, int end) {
        if (from + digits > end) {
            throw new IllegalArgumentException("Truncated escape in string: " + src);
        }
        int value = 0;
        for (int i = from; i < from + digits; i++) {
            final int d = Character.digit(src.charAt(i), 16);
            if (d < 0) {
                throw new IllegalArgumentException("Invalid hex digit in string: " + src);
            }
            value = value * 16 + d;
        }
        return value;
    }
}
