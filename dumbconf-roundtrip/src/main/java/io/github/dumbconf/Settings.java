package io.github.dumbconf;

/// Formatting policy used when turning a native value into tokens.
///
/// @param indent `-1` renders every container inline; `0` or more is the
///        nesting depth of the container being rendered multiline
/// @param bareKeys write string keys unquoted when they are bare words
/// @param inlineSmallContainers keep containers with fewer than two items inline
record Settings(int indent, boolean bareKeys, boolean inlineSmallContainers) {

    /// Inline everything, bare keys where possible.
    static final Settings DEFAULT = new Settings(-1, true, true);

    Settings {
        if (indent < -1) {
            throw new IllegalArgumentException("indent must be -1 or more, got " + indent);
        }
    }

    /// Settings for the children of a multiline container: one level deeper.
    /// @throws IllegalStateException when rendering inline (`indent == -1`)
    Settings indented() {
        if (indent < 0) {
            throw new IllegalStateException("inline settings have no nesting depth");
        }
        return new Settings(indent + 1, bareKeys, inlineSmallContainers);
    }
}
