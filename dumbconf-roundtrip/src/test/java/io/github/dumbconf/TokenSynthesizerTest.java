package io.github.dumbconf;

import io.github.dumbconf.grammar.Ast.PrimitiveKind;
import io.github.dumbconf.grammar.Ast.Primitive;
import io.github.dumbconf.grammar.Unparser;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Modifier;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.*;

class TokenSynthesizerTest extends RoundTripLoggingConfig {

    private static final Logger LOG = Logger.getLogger(TokenSynthesizerTest.class.getName());

    private static final Settings DEPTH_0 = new Settings(0, true, true);

    private static String render(Object value, Settings settings, boolean topLevelMap) {
        return Unparser.unparse(TokenSynthesizer.toAst(value, settings, topLevelMap));
    }

    private static Map<Object, Object> map(Object... keysAndValues) {
        final var map = new LinkedHashMap<Object, Object>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            map.put(keysAndValues[i], keysAndValues[i + 1]);
        }
        return map;
    }

    @Test
    void primitives() {
        LOG.info(() -> "TEST: primitives");

        assertThat(TokenSynthesizer.toAst("hi")).isEqualTo(new Primitive(PrimitiveKind.STRING, "hi", "\"hi\""));
        assertThat(TokenSynthesizer.toAst(true)).isEqualTo(new Primitive(PrimitiveKind.BOOL, true, "TRUE"));
        assertThat(TokenSynthesizer.toAst(null)).isEqualTo(new Primitive(PrimitiveKind.NULL, null, "NULL"));
        assertThat(TokenSynthesizer.toAst(7)).isEqualTo(new Primitive(PrimitiveKind.INT, 7L, "7"));
        assertThat(TokenSynthesizer.toAst((short) -3)).isEqualTo(new Primitive(PrimitiveKind.INT, -3L, "-3"));
        assertThat(TokenSynthesizer.toAst(2.5f)).isEqualTo(new Primitive(PrimitiveKind.FLOAT, 2.5, "2.5"));

        final var big = new BigInteger("123456789012345678901234567890");
        assertThat(TokenSynthesizer.toAst(big)).isEqualTo(new Primitive(PrimitiveKind.INT, big, big.toString()));
    }

    @Test
    void stringValuesAreAlwaysQuoted() {
        LOG.info(() -> "TEST: stringValuesAreAlwaysQuoted");

        assertThat(render(List.of("plain", "say \"hi\""), Settings.DEFAULT, false))
                .isEqualTo("[\"plain\", 'say \"hi\"']");
    }

    @Test
    void inlineWhenIndentIsNegative() {
        LOG.info(() -> "TEST: inlineWhenIndentIsNegative");

        assertThat(render(List.of(1, 2, 3), Settings.DEFAULT, false)).isEqualTo("[1, 2, 3]");
        assertThat(render(map("a", 1, "b", List.of(2, 3)), Settings.DEFAULT, false))
                .isEqualTo("{a: 1, b: [2, 3]}");
        assertThat(render(List.of(), Settings.DEFAULT, false)).isEqualTo("[]");
        assertThat(render(Map.of(), Settings.DEFAULT, false)).isEqualTo("{}");
    }

    @Test
    void multilineAtDepthZero() {
        LOG.info(() -> "TEST: multilineAtDepthZero");

        assertThat(render(List.of(1, 2), DEPTH_0, false)).isEqualTo("[\n    1,\n    2,\n]");
    }

    @Test
    void nestedContainersIndentOneLevelDeeper() {
        LOG.info(() -> "TEST: nestedContainersIndentOneLevelDeeper");

        assertThat(render(map("a", List.of(1, 2), "b", 3), DEPTH_0, false))
                .isEqualTo("{\n    a: [\n        1,\n        2,\n    ],\n    b: 3,\n}");
    }

    @Test
    void smallContainersStayInline() {
        LOG.info(() -> "TEST: smallContainersStayInline");

        assertThat(render(List.of(1), DEPTH_0, false)).isEqualTo("[1]");
        assertThat(render(List.of(), DEPTH_0, false)).isEqualTo("[]");
        assertThat(render(List.of(1), new Settings(0, true, false), false)).isEqualTo("[\n    1,\n]");
        assertThat(render(List.of(), new Settings(0, true, false), false)).isEqualTo("[]");
    }

    @Test
    void bareKeysOnlyForBareWords() {
        LOG.info(() -> "TEST: bareKeysOnlyForBareWords");

        final var value = map("plain_key", 1, "with space", 2, "true", 3, "kebab-case", 4);
        assertThat(render(value, Settings.DEFAULT, false))
                .isEqualTo("{plain_key: 1, \"with space\": 2, \"true\": 3, kebab-case: 4}");
        assertThat(render(value, new Settings(-1, false, true), false))
                .isEqualTo("{\"plain_key\": 1, \"with space\": 2, \"true\": 3, \"kebab-case\": 4}");
    }

    @Test
    void primitiveKeysOfOtherKinds() {
        LOG.info(() -> "TEST: primitiveKeysOfOtherKinds");

        assertThat(render(map(1, "a", false, "b", null, "c", 1.5, "d"), Settings.DEFAULT, false))
                .isEqualTo("{1: \"a\", FALSE: \"b\", NULL: \"c\", 1.5: \"d\"}");
    }

    @Test
    void topLevelMapIsBraceless() {
        LOG.info(() -> "TEST: topLevelMapIsBraceless");

        assertThat(render(map("a", 1, "b", map("c", 2)), DEPTH_0, true)).isEqualTo("a: 1\nb: {c: 2}\n");
        assertThat(render(map("a", 1), Settings.DEFAULT, true)).isEqualTo("{a: 1}");
        assertThat(render(Map.of(), DEPTH_0, true)).isEqualTo("{}");
    }

    @Test
    void arraysAreLists() {
        LOG.info(() -> "TEST: arraysAreLists");

        assertThat(render(new Object[]{"x", 1, null}, Settings.DEFAULT, false)).isEqualTo("[\"x\", 1, NULL]");
    }

    @Test
    void unsupportedValuesAreRejected() {
        LOG.info(() -> "TEST: unsupportedValuesAreRejected");

        assertThatThrownBy(() -> TokenSynthesizer.toAst(new Object()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Object is not a recognized type");
        assertThatThrownBy(() -> TokenSynthesizer.toAst(map(List.of(1), 2)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Map keys must be primitives");
        assertThatThrownBy(() -> TokenSynthesizer.toAst(Double.NaN))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void settingsValidation() {
        LOG.info(() -> "TEST: settingsValidation");

        assertThat(DEPTH_0.indented()).isEqualTo(new Settings(1, true, true));
        assertThatThrownBy(Settings.DEFAULT::indented).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> new Settings(-2, true, true)).isInstanceOf(IllegalArgumentException.class);
        assertThat(Modifier.isPublic(Settings.class.getModifiers())).as("Settings is package-private").isFalse();
    }
}
