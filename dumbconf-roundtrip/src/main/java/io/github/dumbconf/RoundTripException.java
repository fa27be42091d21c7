package io.github.dumbconf;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/// Exception thrown when a path-addressed read or edit cannot be applied.
///
/// The document is never modified by an edit that throws.
@SuppressWarnings("serial")
public final class RoundTripException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /// Why an operation was rejected.
    public enum Reason {
        /// A path segment was applied to a primitive value.
        NOT_INDEXABLE,
        /// A map has no item with the requested key.
        KEY_NOT_FOUND,
        /// A list index is not an integer or lies outside the list.
        INDEX_OUT_OF_RANGE,
        /// The edit would leave a braceless root map with no items.
        CANNOT_DELETE_LAST_TOP_LEVEL_ITEM,
        /// A key replacement targeted a list item.
        NOT_A_MAP,
        /// A replacement key is a container.
        INVALID_KEY_TYPE,
        /// A replacement key is already used by another item of the map.
        DUPLICATE_KEY,
        /// The operation needs a non-empty path.
        EMPTY_PATH
    }

    private final Reason reason;
    private final List<Object> path;

    /// Creates a new RoundTripException.
    /// @param reason why the operation was rejected
    /// @param path the path the operation was applied to
    /// @param message the error message
    public RoundTripException(Reason reason, List<Object> path, String message) {
        super(message + " (path " + path + ")");
        this.reason = reason;
        // an ArrayList copy keeps null map keys and stays serializable
        this.path = Collections.unmodifiableList(new ArrayList<>(path));
    }

    public Reason reason() {
        return reason;
    }

    /// Returns the path of the failed operation, as an unmodifiable copy that keeps `null` map keys
    /// and survives serialization.
    public List<Object> path() {
        return path;
    }
}
