package io.github.dumbconf;

import io.github.dumbconf.grammar.Ast.Node;
import io.github.dumbconf.grammar.AstParser;
import io.github.dumbconf.grammar.Primitives;
import io.github.dumbconf.grammar.Token;
import io.github.dumbconf.grammar.TokenType;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;
import java.util.logging.Logger;

/// Turns native Java values into dumbconf tokens under a [Settings] policy.
///
/// | Java value | Written as |
/// |------------|------------|
/// | `String` | quoted string, or a bare word in key position |
/// | `Boolean` | `TRUE` / `FALSE` |
/// | `null` | `NULL` |
/// | `Byte`, `Short`, `Integer`, `Long`, `BigInteger` | int |
/// | `Float`, `Double` | float |
/// | `Map<?, ?>` | map, in iteration order |
/// | `List<?>`, `Object[]` | list |
///
/// Containers are written inline (`{a: 1, b: 2}`) or one item per line with
/// four spaces of indent per level and a comma after every item. The
/// synthesizer never looks at an existing tree; [#toAst] parses its output so
/// callers always get a tree that a parse of real text would have produced.
final class TokenSynthesizer {

    private static final Logger LOG = Logger.getLogger(TokenSynthesizer.class.getName());

    static final String INDENT_UNIT = "    ";

    private static final ContainerStyle<Map.Entry<?, ?>> MAP_STYLE = new ContainerStyle<>(
            new Token(TokenType.MAP_START, "{"),
            new Token(TokenType.MAP_END, "}"),
            TokenSynthesizer::mapItemTokens);

    private static final ContainerStyle<Object> LIST_STYLE = new ContainerStyle<>(
            new Token(TokenType.LIST_START, "["),
            new Token(TokenType.LIST_END, "]"),
            (item, settings) -> toTokens(item, settings, false, false));

    /// Brackets of a container kind and the renderer of one of its items.
    private record ContainerStyle<T>(Token start, Token end, BiFunction<T, Settings, List<Token>> itemTokens) {}

    private TokenSynthesizer() {}

    /// Synthesizes `value` and parses the tokens back into a tree.
    /// @return the root value node of the parsed tokens
    static Node toAst(Object value, Settings settings, boolean topLevelMap) {
        final var tokens = new ArrayList<>(toTokens(value, settings, false, topLevelMap));
        tokens.add(Token.EOF);
        LOG.finer(() -> "Synthesized " + tokens.size() + " tokens for " + describe(value));
        return AstParser.parseFromTokens(tokens).val();
    }

    /// Synthesizes `value` inline with [Settings#DEFAULT].
    static Node toAst(Object value) {
        return toAst(value, Settings.DEFAULT, false);
    }

    /// Renders one value as tokens.
    ///
    /// @param value the value to render
    /// @param settings the formatting policy at this depth
    /// @param key true when the value is a map key
    /// @param topLevelMap true to write a non-empty map braceless; only honoured at depth 0
    /// @throws IllegalArgumentException when `value` has no dumbconf form
    static List<Token> toTokens(Object value, Settings settings, boolean key, boolean topLevelMap) {
        final boolean braceless = topLevelMap && settings.indent() == 0;
        if (value instanceof String s) {
            if (settings.bareKeys() && key && Primitives.isBareWord(s)) {
                return List.of(new Token(TokenType.BARE_WORD, s));
            }
            return List.of(new Token(TokenType.STRING, Primitives.encodeString(s)));
        } else if (value instanceof Boolean b) {
            return List.of(new Token(TokenType.BOOL, Primitives.encodeBool(b)));
        } else if (value == null) {
            return List.of(new Token(TokenType.NULL, Primitives.encodeNull()));
        } else if (value instanceof Byte || value instanceof Short
                || value instanceof Integer || value instanceof Long) {
            return List.of(new Token(TokenType.INT, Primitives.encodeInt(((Number) value).longValue())));
        } else if (value instanceof BigInteger i) {
            return List.of(new Token(TokenType.INT, Primitives.encodeInt(i)));
        } else if (value instanceof Float || value instanceof Double) {
            return List.of(new Token(TokenType.FLOAT, Primitives.encodeFloat(((Number) value).doubleValue())));
        } else if (value instanceof Map<?, ?> map && !map.isEmpty() && braceless) {
            return topLevelMapTokens(map, settings);
        } else if (value instanceof Map<?, ?> map) {
            final List<Map.Entry<?, ?>> entries = new ArrayList<>(map.entrySet());
            return container(entries, settings, MAP_STYLE);
        } else if (value instanceof List<?> list) {
            return container(new ArrayList<Object>(list), settings, LIST_STYLE);
        } else if (value instanceof Object[] array) {
            return container(Arrays.asList(array), settings, LIST_STYLE);
        }
        throw new IllegalArgumentException(value.getClass().getSimpleName() + " is not a recognized type");
    }

    private static <T> List<Token> container(List<T> items, Settings settings, ContainerStyle<T> style) {
        if (settings.indent() < 0
                || items.isEmpty()
                || (settings.inlineSmallContainers() && items.size() < 2)) {
            return inline(items, settings, style);
        }
        return multiline(items, settings, style);
    }

    private static <T> List<Token> inline(List<T> items, Settings settings, ContainerStyle<T> style) {
        final var tokens = new ArrayList<Token>();
        tokens.add(style.start());
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) {
                tokens.add(Token.comma());
                tokens.add(Token.ws(" "));
            }
            tokens.addAll(style.itemTokens().apply(items.get(i), settings));
        }
        tokens.add(style.end());
        return tokens;
    }

    private static <T> List<Token> multiline(List<T> items, Settings settings, ContainerStyle<T> style) {
        final var child = settings.indented();
        final var tokens = new ArrayList<Token>();
        tokens.add(style.start());
        tokens.add(Token.nl());
        for (final var item : items) {
            tokens.add(Token.indent(INDENT_UNIT.repeat(child.indent())));
            tokens.addAll(style.itemTokens().apply(item, child));
            tokens.add(Token.comma());
            tokens.add(Token.nl());
        }
        if (settings.indent() > 0) {
            tokens.add(Token.indent(INDENT_UNIT.repeat(settings.indent())));
        }
        tokens.add(style.end());
        return tokens;
    }

    private static List<Token> mapItemTokens(Map.Entry<?, ?> entry, Settings settings) {
        final var k = entry.getKey();
        if (k instanceof Map || k instanceof List || k instanceof Object[]) {
            throw new IllegalArgumentException("Map keys must be primitives, got " + k.getClass().getSimpleName());
        }
        final var tokens = new ArrayList<Token>();
        tokens.addAll(toTokens(k, settings, true, false));
        tokens.add(Token.colon());
        tokens.add(Token.ws(" "));
        tokens.addAll(toTokens(entry.getValue(), settings, false, false));
        return tokens;
    }

    private static List<Token> topLevelMapTokens(Map<?, ?> map, Settings settings) {
        final var tokens = new ArrayList<Token>();
        for (final var entry : map.entrySet()) {
            tokens.addAll(mapItemTokens(entry, settings));
            tokens.add(Token.nl());
        }
        return tokens;
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
