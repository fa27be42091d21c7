package io.github.dumbconf.grammar;

import java.util.List;
import java.util.Objects;

import io.github.dumbconf.grammar.Ast.*;

/// Flattens a tree back to text by concatenating stored source fragments.
///
/// For any text `s` accepted by [AstParser#parse(String)],
/// `unparse(parse(s)).equals(s)`.
public final class Unparser {

    private Unparser() {}

    public static String unparse(Document document) {
        Objects.requireNonNull(document, "document must not be null");
        final var sb = new StringBuilder();
        append(sb, document.head());
        append(sb, document.val());
        append(sb, document.tail());
        return sb.toString();
    }

    public static String unparse(Node node) {
        Objects.requireNonNull(node, "node must not be null");
        final var sb = new StringBuilder();
        append(sb, node);
        return sb.toString();
    }

    private static void append(StringBuilder sb, Node node) {
        if (node instanceof Primitive primitive) {
            sb.append(primitive.src());
        } else if (node instanceof Container container) {
            append(sb, container.head());
            for (final var item : container.items()) {
                append(sb, item.head());
                if (item.key() != null) {
                    sb.append(item.key().src());
                }
                append(sb, item.separator());
                append(sb, item.val());
                append(sb, item.tail());
            }
            append(sb, container.tail());
        } else {
            throw new AssertionError("Unknown ast: " + node);
        }
    }

    private static void append(StringBuilder sb, List<Token> tokens) {
        for (final var token : tokens) {
            sb.append(token.src());
        }
    }
}
