package io.github.dumbconf;

/// Options for [Dumbconf#dumps(Object, DumpOptions)].
///
/// @param indented lay out containers with two or more items one item per line
/// @param bareKeys write string keys unquoted when they are bare words
/// @param topLevelMap write a non-empty root map without braces, one entry per line
/// @param inlineSmallContainers keep containers with fewer than two items on one line
public record DumpOptions(boolean indented, boolean bareKeys, boolean topLevelMap, boolean inlineSmallContainers) {

    public static final DumpOptions DEFAULT = new DumpOptions(true, true, true, true);

    public DumpOptions withIndented(boolean indented) {
        return new DumpOptions(indented, bareKeys, topLevelMap, inlineSmallContainers);
    }

    public DumpOptions withBareKeys(boolean bareKeys) {
        return new DumpOptions(indented, bareKeys, topLevelMap, inlineSmallContainers);
    }

    public DumpOptions withTopLevelMap(boolean topLevelMap) {
        return new DumpOptions(indented, bareKeys, topLevelMap, inlineSmallContainers);
    }

    public DumpOptions withInlineSmallContainers(boolean inlineSmallContainers) {
        return new DumpOptions(indented, bareKeys, topLevelMap, inlineSmallContainers);
    }

    Settings settings() {
        return new Settings(indented ? 0 : -1, bareKeys, inlineSmallContainers);
    }
}
