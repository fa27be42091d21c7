package io.github.dumbconf;

import io.github.dumbconf.grammar.Ast.Document;
import io.github.dumbconf.grammar.Ast.Node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// A path into an editable document.
///
/// Every proxy obtained from one [Dumbconf#loadsRoundtrip(String)] call shares
/// one document. [#get(Object)] returns a proxy for a child path; writes through
/// any of them replace the shared document and are seen by all the others:
/// ```java
/// AstProxy root = Dumbconf.loadsRoundtrip("a: {b: 1, c: 2}\n");
/// AstProxy a = root.get("a");
/// a.set("b", 9);
/// Dumbconf.dumpsRoundtrip(root); // "a: {b: 9, c: 2}\n"
/// ```
/// Paths are resolved when used, so a proxy whose path no longer exists after
/// an edit fails on its next use with [RoundTripException].
///
/// A failed edit leaves the document as it was.
///
/// Proxies are not thread-safe. Reads and writes on proxies of one document
/// must come from a single thread at a time.
public final class AstProxy {

    private static final Logger LOG = Logger.getLogger(AstProxy.class.getName());

    /// The document shared by all proxies of one load.
    static final class Root {
        private Document document;

        Root(Document document) {
            this.document = Objects.requireNonNull(document, "document must not be null");
        }
    }

    private final Root root;
    private final List<Object> path;

    private AstProxy(Root root, List<Object> path) {
        this.root = root;
        this.path = path;
    }

    /// Creates a proxy for the root of `document`.
    static AstProxy of(Document document) {
        return new AstProxy(new Root(document), List.of());
    }

    /// Returns a proxy for the child at `key`.
    ///
    /// The child is looked up immediately, so a missing key fails here rather
    /// than on first use.
    ///
    /// @param key a map key, or a list index (negative counts from the end)
    /// @throws RoundTripException if the child does not exist
    public AstProxy get(Object key) {
        final var childPath = childPath(key);
        AstEdits.get(root.document, childPath);
        return new AstProxy(root, childPath);
    }

    /// Replaces the value at `key` of this container.
    ///
    /// @param key an existing map key or list index
    /// @param value the new value, written on one line
    /// @throws RoundTripException if `key` does not exist
    /// @throws IllegalArgumentException if `value` has no dumbconf form
    public void set(Object key, Object value) {
        update(AstEdits.set(root.document, childPath(key), value));
    }

    /// Deletes the item at `key` of this container.
    ///
    /// @throws RoundTripException if `key` does not exist, or it is the only
    ///         item of a braceless root map
    public void delete(Object key) {
        update(AstEdits.delete(root.document, childPath(key)));
    }

    /// Renames the map item this proxy points at.
    ///
    /// The value and all surrounding text stay. This proxy keeps the old path;
    /// use [#get(Object)] on the parent to reach the renamed item.
    ///
    /// @param newKey the new key; a string, boolean, null or number
    /// @throws RoundTripException if this proxy is the root, its parent is a
    ///         list, `newKey` is a container, or another item already uses `newKey`
    public void replaceKey(Object newKey) {
        update(AstEdits.setKey(root.document, path, newKey));
    }

    /// Replaces the value this proxy points at. At the root this replaces the
    /// whole document value and keeps the leading and trailing comments.
    ///
    /// @throws IllegalArgumentException if `value` has no dumbconf form
    public void replaceValue(Object value) {
        update(AstEdits.set(root.document, path, value));
    }

    /// Returns the value at this path as plain Java values.
    ///
    /// Maps come back as insertion-ordered unmodifiable maps, lists as
    /// unmodifiable lists, ints as `Long` (or `BigInteger`), floats as `Double`.
    public Object nativeValue() {
        return NativeValues.project(node());
    }

    /// Returns the keys and indices from the document root to this proxy.
    public List<Object> path() {
        return path;
    }

    /// Returns the current document shared by this proxy and its relatives.
    Document document() {
        return root.document;
    }

    Node node() {
        return AstEdits.get(root.document, path);
    }

    private void update(Document updated) {
        root.document = updated;
        LOG.finer(() -> "Document updated through proxy at " + path);
    }

    private List<Object> childPath(Object key) {
        // keys may be null, which List.of rejects
        final var childPath = new ArrayList<>(path);
        childPath.add(key);
        return Collections.unmodifiableList(childPath);
    }

    @Override
    public String toString() {
        return "AstProxy" + path;
    }
}
