package io.github.dumbconf.grammar;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;

import io.github.dumbconf.grammar.Ast.*;

/// Recursive descent parser from tokens to a lossless [Ast.Document].
///
/// Grammar, informally:
/// ```
/// document  := trivia* (toplevel | value) trivia* EOF
/// toplevel  := (trivia* key sep value WS? COMMENT? (NL | EOF))+
/// value     := primitive | map | list
/// map       := '{' (item (',' item)* ','?)? trivia* '}'
/// list      := '[' (value (',' value)* ','?)? trivia* ']'
/// sep       := WS? ':' WS?
/// ```
/// A document whose first value is a key followed by `:` is a braceless
/// top-level map. Bare words are only accepted as keys.
///
/// Trivia is attached as follows:
/// - a container's head is its opening bracket plus spaces, a comment and one
///   newline on the same line;
/// - an item's head is everything between the previous item and its value
///   (indentation, blank lines, comment lines);
/// - an item's tail is spaces, the comma, spaces, a comment and one newline
///   following its value;
/// - a container's tail is the trivia before its closing bracket plus the bracket.
public final class AstParser {

    private static final Logger LOG = Logger.getLogger(AstParser.class.getName());

    private final List<Token> tokens;
    private final String source;
    private final int[] offsets;
    private int pos;

    private AstParser(List<Token> tokens) {
        this.tokens = tokens;
        this.offsets = new int[tokens.size() + 1];
        final var sb = new StringBuilder();
        for (int i = 0; i < tokens.size(); i++) {
            offsets[i] = sb.length();
            sb.append(tokens.get(i).src());
        }
        offsets[tokens.size()] = sb.length();
        this.source = sb.toString();
    }

    /// Parses dumbconf text.
    /// @param text the source text
    /// @return the lossless document
    /// @throws NullPointerException if text is null
    /// @throws DumbconfParseException if the text is not a valid document
    public static Document parse(String text) {
        Objects.requireNonNull(text, "text must not be null");
        LOG.fine(() -> "Parsing document of " + text.length() + " chars");
        return new AstParser(Tokenizer.tokenize(text)).parseDocument();
    }

    /// Parses an already tokenized document.
    ///
    /// Used to validate token streams that were produced by code rather than
    /// read from text: the result is a tree that satisfies every structural
    /// rule of a parsed document.
    ///
    /// @param tokens the tokens; must end with an [TokenType#EOF] token
    /// @return the lossless document
    /// @throws DumbconfParseException if the tokens do not form a valid document
    public static Document parseFromTokens(List<Token> tokens) {
        Objects.requireNonNull(tokens, "tokens must not be null");
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.EOF) {
            throw new IllegalArgumentException("tokens must end with EOF");
        }
        for (int i = 0; i < tokens.size() - 1; i++) {
            if (tokens.get(i).type() == TokenType.EOF) {
                throw new IllegalArgumentException("EOF token before the end of the token list at index " + i);
            }
        }
        LOG.finer(() -> "Parsing " + tokens.size() + " tokens");
        return new AstParser(List.copyOf(tokens)).parseDocument();
    }

    private Document parseDocument() {
        final var head = readTrivia();
        if (peek() == TokenType.EOF) {
            throw error("Expected a value");
        }
        final Node val = startsTopLevelMap() ? parseTopLevelMap() : parseValue();
        final var tail = readTrivia();
        if (peek() != TokenType.EOF) {
            throw error("Expected end of input");
        }
        return new Document(head, val, tail);
    }

    private boolean startsTopLevelMap() {
        if (!peek().isKey()) {
            return false;
        }
        int i = pos + 1;
        if (tokens.get(i).type() == TokenType.WS) {
            i++;
        }
        return tokens.get(i).type() == TokenType.COLON;
    }

    private MapNode parseTopLevelMap() {
        final var items = new ArrayList<Item>();
        final var keys = new ArrayList<Primitive>();
        while (true) {
            final int mark = pos;
            final List<Token> head = items.isEmpty() ? List.of() : readTrivia();
            if (peek() == TokenType.EOF) {
                // trailing trivia belongs to the document
                pos = mark;
                break;
            }
            final int keyPos = pos;
            final var key = parseKey();
            checkDuplicate(keys, key, keyPos);
            final var separator = parseSeparator();
            final var val = parseValue();
            final var tail = new ArrayList<Token>();
            take(TokenType.WS, tail);
            take(TokenType.COMMENT, tail);
            if (peek() == TokenType.EOF) {
                items.add(new Item(head, key, separator, val, tail));
                break;
            }
            if (peek() != TokenType.NL) {
                throw error("Expected a newline after a top-level item");
            }
            tail.add(next());
            items.add(new Item(head, key, separator, val, tail));
        }
        LOG.finer(() -> "Parsed top-level map with " + items.size() + " items");
        return new MapNode(List.of(), items, List.of());
    }

    private Node parseValue() {
        final var type = peek();
        switch (type) {
            case MAP_START:
                return parseContainer(true);
            case LIST_START:
                return parseContainer(false);
            case STRING:
            case BOOL:
            case NULL:
            case INT:
            case FLOAT:
                return primitive(next(), pos - 1);
            case BARE_WORD:
                throw error("Bare words are only valid as keys; quote the string");
            default:
                throw error("Expected a value");
        }
    }

    private Primitive parseKey() {
        final var type = peek();
        if (type == TokenType.BARE_WORD || type.isPrimitive()) {
            return primitive(next(), pos - 1);
        }
        if (type == TokenType.MAP_START || type == TokenType.LIST_START) {
            throw error("Map keys must be primitives");
        }
        throw error("Expected a key");
    }

    private List<Token> parseSeparator() {
        final var separator = new ArrayList<Token>(3);
        take(TokenType.WS, separator);
        if (peek() != TokenType.COLON) {
            throw error("Expected ':'");
        }
        separator.add(next());
        take(TokenType.WS, separator);
        return separator;
    }

    private Container parseContainer(boolean isMap) {
        final var end = isMap ? TokenType.MAP_END : TokenType.LIST_END;
        final var head = new ArrayList<Token>();
        head.add(next());
        take(TokenType.WS, head);
        take(TokenType.COMMENT, head);
        take(TokenType.NL, head);

        final var items = new ArrayList<Item>();
        final var keys = new ArrayList<Primitive>();
        boolean separated = true;
        while (true) {
            final var itemHead = readTrivia();
            if (peek() == end) {
                itemHead.add(next());
                final Container result = isMap
                        ? new MapNode(head, items, itemHead)
                        : new ListNode(head, items, itemHead);
                LOG.finer(() -> "Parsed " + (isMap ? "map" : "list") + " with " + items.size()
                        + " items, multiline=" + result.isMultiline());
                return result;
            }
            if (peek() == TokenType.EOF) {
                throw error("Expected '" + (isMap ? '}' : ']') + "'");
            }
            if (!separated) {
                throw error("Expected ',' or '" + (isMap ? '}' : ']') + "'");
            }
            Primitive key = null;
            List<Token> separator = List.of();
            if (isMap) {
                final int keyPos = pos;
                key = parseKey();
                checkDuplicate(keys, key, keyPos);
                separator = parseSeparator();
            }
            final var val = parseValue();
            final var tail = new ArrayList<Token>();
            take(TokenType.WS, tail);
            separated = take(TokenType.COMMA, tail);
            if (separated) {
                take(TokenType.WS, tail);
            }
            take(TokenType.COMMENT, tail);
            take(TokenType.NL, tail);
            items.add(new Item(itemHead, key, separator, val, tail));
        }
    }

    private Primitive primitive(Token token, int index) {
        final var kind = switch (token.type()) {
            case STRING -> PrimitiveKind.STRING;
            case BOOL -> PrimitiveKind.BOOL;
            case NULL -> PrimitiveKind.NULL;
            case INT -> PrimitiveKind.INT;
            case FLOAT -> PrimitiveKind.FLOAT;
            case BARE_WORD -> PrimitiveKind.BARE_WORD_KEY;
            default -> throw new AssertionError("Not a primitive token: " + token);
        };
        try {
            return new Primitive(kind, Primitives.decode(kind, token.src()), token.src());
        } catch (IllegalArgumentException e) {
            throw new DumbconfParseException("Invalid " + kind.name().toLowerCase(Locale.ROOT) + " literal",
                    source, offsets[index], e);
        }
    }

    private void checkDuplicate(List<Primitive> keys, Primitive key, int index) {
        for (final var seen : keys) {
            if (seen.sameKey(key)) {
                throw new DumbconfParseException("Duplicate key " + key.src(), source, offsets[index]);
            }
        }
        keys.add(key);
    }

    private List<Token> readTrivia() {
        final var trivia = new ArrayList<Token>();
        while (peek().isTrivia()) {
            trivia.add(next());
        }
        return trivia;
    }

    private boolean take(TokenType type, List<Token> into) {
        if (peek() == type) {
            into.add(next());
            return true;
        }
        return false;
    }

    private TokenType peek() {
        return tokens.get(pos).type();
    }

    private Token next() {
        final var token = tokens.get(pos);
        if (token.type() == TokenType.EOF) {
            throw error("Unexpected end of input");
        }
        pos++;
        return token;
    }

    private DumbconfParseException error(String message) {
        return new DumbconfParseException(message, source, offsets[pos]);
    }
}
