package io.github.dumbconf;

import io.github.dumbconf.RoundTripException.Reason;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.*;

class AstProxyTest extends RoundTripLoggingConfig {

    private static final Logger LOG = Logger.getLogger(AstProxyTest.class.getName());

    @Test
    void childViewsShareOneDocument() {
        LOG.info(() -> "TEST: childViewsShareOneDocument");

        final var root = Dumbconf.loadsRoundtrip("a: {b: 1, c: 2}\n");
        final var a = root.get("a");
        a.set("b", 9);

        assertThat(Dumbconf.dumpsRoundtrip(root)).isEqualTo("a: {b: 9, c: 2}\n");
        assertThat(Dumbconf.dumpsRoundtrip(a)).isEqualTo("a: {b: 9, c: 2}\n");
        assertThat(root.get("a").get("b").nativeValue()).isEqualTo(9L);
        assertThat(a.get("b").path()).containsExactly("a", "b");
    }

    @Test
    void writesThroughOneViewAreSeenByAnother() {
        LOG.info(() -> "TEST: writesThroughOneViewAreSeenByAnother");

        final var root = Dumbconf.loadsRoundtrip("list: [1, 2, 3]\nother: 'x'\n");
        final var list = root.get("list");
        final var last = list.get(-1);
        root.set("other", "y");
        list.delete(0);

        assertThat(list.nativeValue()).isEqualTo(List.of(2L, 3L));
        assertThat(last.nativeValue()).isEqualTo(3L);
        assertThat(root.get("other").nativeValue()).isEqualTo("y");
    }

    @Test
    void replaceValueAndReplaceKey() {
        LOG.info(() -> "TEST: replaceValueAndReplaceKey");

        final var root = Dumbconf.loadsRoundtrip("# settings\nname: 'old'  # keep me\n");
        final var name = root.get("name");
        name.replaceValue("new");
        name.replaceKey("title");

        assertThat(Dumbconf.dumpsRoundtrip(root)).isEqualTo("# settings\ntitle: \"new\"  # keep me\n");
        assertThat(root.nativeValue()).isEqualTo(Map.of("title", "new"));
        assertThat(catchThrowableOfType(name::nativeValue, RoundTripException.class).reason())
                .isEqualTo(Reason.KEY_NOT_FOUND);
    }

    @Test
    void replaceValueAtTheRoot() {
        LOG.info(() -> "TEST: replaceValueAtTheRoot");

        final var root = Dumbconf.loadsRoundtrip("# header\n[1, 2]\n# footer\n");
        root.replaceValue(Map.of("k", 1));
        assertThat(Dumbconf.dumpsRoundtrip(root)).isEqualTo("# header\n{k: 1}\n# footer\n");
    }

    @Test
    void failedEditsLeaveTheDocumentUnchanged() {
        LOG.info(() -> "TEST: failedEditsLeaveTheDocumentUnchanged");

        final var text = "only: [1]\n";
        final var root = Dumbconf.loadsRoundtrip(text);

        assertThatThrownBy(() -> root.delete("only"))
                .isInstanceOf(RoundTripException.class)
                .satisfies(e -> assertThat(((RoundTripException) e).reason())
                        .isEqualTo(Reason.CANNOT_DELETE_LAST_TOP_LEVEL_ITEM));
        assertThatThrownBy(() -> root.get("only").replaceKey(List.of()))
                .isInstanceOf(RoundTripException.class);
        assertThatThrownBy(() -> root.get("only").set(0, new Object()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> root.get("missing"))
                .isInstanceOf(RoundTripException.class);
        assertThatThrownBy(() -> root.replaceKey("x"))
                .isInstanceOf(RoundTripException.class);

        assertThat(Dumbconf.dumpsRoundtrip(root)).isEqualTo(text);
    }

    @Test
    void rootPathIsEmpty() {
        LOG.info(() -> "TEST: rootPathIsEmpty");

        final var root = Dumbconf.loadsRoundtrip("{NULL: 1}");
        assertThat(root.path()).isEmpty();
        assertThat(root.get(null).path()).containsExactly((Object) null);
        assertThat(root.get(null).nativeValue()).isEqualTo(1L);
        assertThatThrownBy(() -> root.path().add("x")).isInstanceOf(UnsupportedOperationException.class);
    }
}
