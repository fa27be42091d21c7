package io.github.dumbconf.grammar;

import java.util.List;
import java.util.Objects;

/// Lossless syntax tree for dumbconf documents.
///
/// Every token of the source is stored somewhere in the tree, so
/// [Unparser#unparse(Document)] gives back the exact input. Values carry their
/// decoded form next to their source text; trivia (whitespace, comments,
/// commas, newlines) is attached to the [Item] it surrounds.
///
/// All nodes are immutable records. Edits build new nodes along one path and
/// share everything else.
///
/// ## Node Types
/// - [Primitive]: a scalar or a bare key, tagged with a [PrimitiveKind]
/// - [MapNode]: a braced map, or the braceless map at the root of a document
/// - [ListNode]: a bracketed list
public interface Ast {

    /// Discriminant for [Primitive] nodes.
    enum PrimitiveKind {
        STRING,
        BOOL,
        NULL,
        INT,
        FLOAT,
        BARE_WORD_KEY
    }

    /// A value in the tree.
    sealed interface Node permits Primitive, Container {}

    /// A scalar with its decoded value and its exact text.
    ///
    /// Two primitives are the same key when their decoded values are equal,
    /// whatever their source text: `'a'`, `"a"` and `a` name one key.
    ///
    /// @param kind the primitive kind
    /// @param val the decoded value; `null` for [PrimitiveKind#NULL]
    /// @param src the exact source text
    record Primitive(PrimitiveKind kind, Object val, String src) implements Node {
        public Primitive {
            Objects.requireNonNull(kind, "kind must not be null");
            Objects.requireNonNull(src, "src must not be null");
        }

        /// Returns true when this primitive names the same key as `other`.
        public boolean sameKey(Primitive other) {
            return Objects.equals(val, other.val);
        }
    }

    /// A map or a list: an opening token run, items, and a closing token run.
    sealed interface Container extends Node permits MapNode, ListNode {

        /// Opening bracket plus trivia up to the end of its line; empty for a braceless map.
        List<Token> head();

        List<Item> items();

        /// Trivia before the closing bracket plus the bracket; empty for a braceless map.
        List<Token> tail();

        /// Returns a copy of this container holding `items`.
        Container withItems(List<Item> items);

        /// True for the braceless root map: one item per line and no brackets.
        default boolean isTopLevelStyle() {
            return head().isEmpty();
        }

        /// True when items are laid out one per line.
        default boolean isMultiline() {
            return isTopLevelStyle() || head().stream().anyMatch(t -> t.type() == TokenType.NL);
        }
    }

    record MapNode(List<Token> head, List<Item> items, List<Token> tail) implements Container {
        public MapNode {
            head = List.copyOf(head);
            items = List.copyOf(items);
            tail = List.copyOf(tail);
        }

        @Override
        public MapNode withItems(List<Item> items) {
            return new MapNode(head, items, tail);
        }
    }

    record ListNode(List<Token> head, List<Item> items, List<Token> tail) implements Container {
        public ListNode {
            head = List.copyOf(head);
            items = List.copyOf(items);
            tail = List.copyOf(tail);
        }

        @Override
        public ListNode withItems(List<Item> items) {
            return new ListNode(head, items, tail);
        }
    }

    /// One entry of a container with the trivia around it.
    ///
    /// @param head trivia before the entry: indentation, blank lines, comment lines above it
    /// @param key the map key; `null` in a list
    /// @param separator the `:` and the spaces around it; empty in a list
    /// @param val the entry value
    /// @param tail trivia after the value: comma, trailing comment, newline
    record Item(List<Token> head, Primitive key, List<Token> separator, Node val, List<Token> tail) {
        public Item {
            Objects.requireNonNull(val, "val must not be null");
            head = List.copyOf(head);
            separator = List.copyOf(separator);
            tail = List.copyOf(tail);
        }

        public Item withVal(Node val) {
            return new Item(head, key, separator, val, tail);
        }

        public Item withKey(Primitive key) {
            return new Item(head, key, separator, val, tail);
        }

        public Item withHead(List<Token> head) {
            return new Item(head, key, separator, val, tail);
        }

        public Item withTail(List<Token> tail) {
            return new Item(head, key, separator, val, tail);
        }

        /// Returns true when the tail closes the line this entry sits on.
        public boolean tailEndsWithNewline() {
            return !tail.isEmpty() && tail.get(tail.size() - 1).endsWithNewline();
        }
    }

    /// A whole file: leading trivia, the root value, trailing trivia.
    record Document(List<Token> head, Node val, List<Token> tail) {
        public Document {
            Objects.requireNonNull(val, "val must not be null");
            head = List.copyOf(head);
            tail = List.copyOf(tail);
        }

        public Document withVal(Node val) {
            return new Document(head, val, tail);
        }
    }
}
