package io.github.dumbconf;

import io.github.dumbconf.grammar.Ast.ListNode;
import io.github.dumbconf.grammar.Ast.MapNode;
import io.github.dumbconf.grammar.Ast.Node;
import io.github.dumbconf.grammar.Ast.Primitive;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;

/// Projection of a tree onto plain Java values.
///
/// | Node | Java value |
/// |------|------------|
/// | string, bare key | `String` |
/// | bool | `Boolean` |
/// | null | `null` |
/// | int | `Long`, or `BigInteger` outside the `long` range |
/// | float | `Double` |
/// | list | `List<Object>` (unmodifiable) |
/// | map | `Map<Object, Object>` in document order (unmodifiable) |
final class NativeValues {

    private NativeValues() {}

    static Object project(Node node) {
        if (node instanceof Primitive primitive) {
            return primitive.val();
        } else if (node instanceof ListNode list) {
            final var values = new ArrayList<Object>(list.items().size());
            for (final var item : list.items()) {
                values.add(project(item.val()));
            }
            return Collections.unmodifiableList(values);
        } else if (node instanceof MapNode map) {
            final var values = new LinkedHashMap<Object, Object>();
            for (final var item : map.items()) {
                values.put(item.key().val(), project(item.val()));
            }
            return Collections.unmodifiableMap(values);
        }
        throw new AssertionError("Unknown ast: " + node);
    }

    /// Brings a caller-supplied key to the type the parser decodes to, so
    /// `Integer` 1 finds the key written `1`.
    static Object normalizeKey(Object key) {
        if (key instanceof Byte || key instanceof Short || key instanceof Integer) {
            return ((Number) key).longValue();
        } else if (key instanceof Float f) {
            return f.doubleValue();
        } else if (key instanceof BigInteger i && i.bitLength() < Long.SIZE) {
            return i.longValue();
        }
        return key;
    }
}
