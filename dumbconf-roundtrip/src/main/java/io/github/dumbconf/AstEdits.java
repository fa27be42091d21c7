package io.github.dumbconf;

import io.github.dumbconf.RoundTripException.Reason;
import io.github.dumbconf.grammar.Ast.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Path-addressed reads and edits over a lossless tree.
///
/// A path is a list of map keys and list indices from the document root.
/// Every edit locates the item at the end of the path, computes a new item
/// list for that item's container, and rebuilds only the containers on the
/// path. Siblings off the path are shared with the input, so an edit
/// allocates in proportion to the depth of the path, and the input document
/// is left as it was.
///
/// Edits touch as little text as they can:
/// - a new value replaces only the item's value; its indentation, comma and
///   comments stay;
/// - a new key replaces only the item's key;
/// - a deletion moves commas, newlines or indentation between neighbours so
///   the result still parses and untouched lines keep their layout.
final class AstEdits {

    private static final Logger LOG = Logger.getLogger(AstEdits.class.getName());

    /// Computes the new item list of `parent` after editing the item at `index`.
    @FunctionalInterface
    private interface ItemsEdit {
        List<Item> apply(Container parent, int index, List<Object> path);
    }

    private AstEdits() {}

    /// Finds the position of `key` among the items of `node`.
    ///
    /// @param node the node the path segment is applied to
    /// @param key a map key, or a list index (negative counts from the end)
    /// @param path the full path, for error reporting
    /// @return the item index
    /// @throws RoundTripException with [Reason#NOT_INDEXABLE], [Reason#KEY_NOT_FOUND]
    ///         or [Reason#INDEX_OUT_OF_RANGE]
    static int keyIndex(Node node, Object key, List<Object> path) {
        if (node instanceof MapNode map) {
            final var wanted = NativeValues.normalizeKey(key);
            final var items = map.items();
            for (int i = 0; i < items.size(); i++) {
                if (Objects.equals(items.get(i).key().val(), wanted)) {
                    return i;
                }
            }
            throw new RoundTripException(Reason.KEY_NOT_FOUND, path, "Key not found: " + key);
        } else if (node instanceof ListNode list) {
            final var normalized = NativeValues.normalizeKey(key);
            if (!(normalized instanceof Long index)) {
                throw new RoundTripException(Reason.INDEX_OUT_OF_RANGE, path,
                        "List indices must be integers, got " + key);
            }
            final int size = list.items().size();
            final long i = index < 0 ? index + size : index;
            if (i < 0 || i >= size) {
                throw new RoundTripException(Reason.INDEX_OUT_OF_RANGE, path,
                        "Index " + key + " out of range for list of " + size);
            }
            return (int) i;
        } else if (node instanceof Primitive primitive) {
            throw new RoundTripException(Reason.NOT_INDEXABLE, path,
                    primitive.kind() + " " + primitive.src() + " is not indexable");
        }
        throw new AssertionError("Unknown ast: " + node);
    }

    /// Returns the value node at `path`; the root value for an empty path.
    static Node get(Document document, List<Object> path) {
        var node = document.val();
        for (final var key : path) {
            final int i = keyIndex(node, key, path);
            node = ((Container) node).items().get(i).val();
        }
        return node;
    }

    /// Replaces the value at `path` with a synthesized `value`.
    ///
    /// An empty path replaces the root value. Otherwise only the item's value
    /// changes; its head and tail trivia are kept.
    static Document set(Document document, List<Object> path, Object value) {
        final var replacement = TokenSynthesizer.toAst(value);
        if (path.isEmpty()) {
            LOG.fine(() -> "Replacing document root");
            return document.withVal(replacement);
        }
        LOG.fine(() -> "Setting value at " + path);
        return document.withVal(modifyItems(document.val(), path, 0, (parent, i, p) -> {
            final var items = new ArrayList<>(parent.items());
            items.set(i, items.get(i).withVal(replacement));
            return items;
        }));
    }

    /// Replaces the key of the map item at `path`.
    ///
    /// String keys are written bare when they are bare words.
    ///
    /// @throws RoundTripException with [Reason#EMPTY_PATH], [Reason#NOT_A_MAP],
    ///         [Reason#INVALID_KEY_TYPE] or [Reason#DUPLICATE_KEY]
    static Document setKey(Document document, List<Object> path, Object newKey) {
        if (path.isEmpty()) {
            throw new RoundTripException(Reason.EMPTY_PATH, path, "Index into a map to replace a key");
        }
        LOG.fine(() -> "Replacing key at " + path);
        return document.withVal(modifyItems(document.val(), path, 0, (parent, i, p) -> {
            if (!(parent instanceof MapNode)) {
                throw new RoundTripException(Reason.NOT_A_MAP, p,
                        "Can only replace map keys, not " + parent.getClass().getSimpleName());
            }
            final var key = keyAst(newKey, p);
            final var items = new ArrayList<>(parent.items());
            for (int j = 0; j < items.size(); j++) {
                if (j != i && items.get(j).key().sameKey(key)) {
                    throw new RoundTripException(Reason.DUPLICATE_KEY, p, "Key already present: " + key.src());
                }
            }
            items.set(i, items.get(i).withKey(key));
            return items;
        }));
    }

    /// Removes the item at `path` and repairs the trivia of its neighbours.
    ///
    /// @throws RoundTripException with [Reason#EMPTY_PATH] or
    ///         [Reason#CANNOT_DELETE_LAST_TOP_LEVEL_ITEM], or a lookup reason
    static Document delete(Document document, List<Object> path) {
        if (path.isEmpty()) {
            throw new RoundTripException(Reason.EMPTY_PATH, path, "Cannot delete the document root");
        }
        LOG.fine(() -> "Deleting " + path);
        return document.withVal(modifyItems(document.val(), path, 0, AstEdits::deleteItem));
    }

    private static Node modifyItems(Node node, List<Object> path, int depth, ItemsEdit edit) {
        final var key = path.get(depth);
        final int i = keyIndex(node, key, path);
        final var container = (Container) node;
        final List<Item> newItems;
        if (depth == path.size() - 1) {
            newItems = edit.apply(container, i, path);
        } else {
            newItems = new ArrayList<>(container.items());
            final var target = newItems.get(i);
            newItems.set(i, target.withVal(modifyItems(target.val(), path, depth + 1, edit)));
        }
        return container.withItems(newItems);
    }

    private static List<Item> deleteItem(Container parent, int i, List<Object> path) {
        final var original = parent.items();
        final var removed = original.get(i);
        final var items = new ArrayList<>(original);
        items.remove(i);

        if (parent.isTopLevelStyle() && items.isEmpty()) {
            throw new RoundTripException(Reason.CANNOT_DELETE_LAST_TOP_LEVEL_ITEM, path,
                    "Deleting the last item of a top-level map would leave an invalid document");
        } else if (!parent.isMultiline() && i == original.size() - 1) {
            // the new last item's comma and space now sit before the closing bracket
            if (!items.isEmpty()) {
                final int last = items.size() - 1;
                items.set(last, items.get(last).withTail(List.of()));
            }
        } else if (parent.isMultiline()
                && i > 0
                && removed.head().isEmpty()
                && removed.tailEndsWithNewline()
                && !original.get(i - 1).tailEndsWithNewline()) {
            // the removed item ended a line it shared with the previous item
            items.set(i - 1, items.get(i - 1).withTail(removed.tail()));
        } else if (parent.isMultiline()
                && i + 1 < original.size()
                && !removed.head().isEmpty()
                && !removed.tailEndsWithNewline()) {
            // the next item shared the removed item's line and now starts it
            items.set(i, items.get(i).withHead(removed.head()));
        }
        LOG.finer(() -> "Deleted item " + i + " of " + original.size() + " at " + path);
        return items;
    }

    /// Synthesizes `newKey` as a map key.
    private static Primitive keyAst(Object newKey, List<Object> path) {
        final var candidate = TokenSynthesizer.toAst(newKey);
        if (!(candidate instanceof Primitive)) {
            throw new RoundTripException(Reason.INVALID_KEY_TYPE, path,
                    "Keys must be primitives but got " + candidate.getClass().getSimpleName());
        }
        // a lone bare word is not a document, so the key is parsed inside a one-item map
        final var holder = (MapNode) TokenSynthesizer.toAst(
                Collections.singletonMap(newKey, null), Settings.DEFAULT, false);
        return holder.items().get(0).key();
    }
}
