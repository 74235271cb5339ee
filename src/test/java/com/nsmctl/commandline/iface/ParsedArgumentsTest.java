package com.nsmctl.commandline.iface;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ParsedArgumentsTest {

    @Test
    void testTypedGetters() {
        ParsedArguments values = ParsedArguments.of(
                "port", "5044", "ratio", 2, "stdout", "true", "ids", List.of(1, 3), "host", null);

        assertThat(values.getInteger("port")).isEqualTo(5044);
        assertThat(values.getDouble("ratio")).isEqualTo(2.0d);
        assertThat(values.getBoolean("stdout")).isTrue();
        assertThat(values.getBoolean("missing")).isFalse();
        assertThat(values.getList("ids", Integer.class)).containsExactly(1, 3);
        assertThat(values.getList("host", String.class)).isEmpty();
        assertThat(values.contains("host")).isTrue();
        assertThat(values.getString("host")).isNull();
    }

    @Test
    void testSingleValueReadsAsList() {
        assertThat(ParsedArguments.of("targets", "a:5044").getList("targets", String.class)).containsExactly("a:5044");
    }

    @Test
    void testListElementsAreChecked() {
        ParsedArguments values = ParsedArguments.of("ids", List.of(1, 3));

        assertThatThrownBy(() -> values.getList("ids", String.class)).isInstanceOf(ClassCastException.class);
    }

    @Test
    void testFilterWithAndWithoutKeepOrder() {
        ParsedArguments values = ParsedArguments.of("a", 1, "b", 2, "c", 3);

        assertThat(values.filter(n -> !n.equals("b")).names()).containsExactly("a", "c");
        assertThat(values.with("d", 4).names()).containsExactly("a", "b", "c", "d");
        assertThat(values.without(List.of("a", "c")).asMap()).containsOnlyKeys("b");
        assertThat(values.size()).isEqualTo(3);
    }

    @Test
    void testImmutable() {
        ParsedArguments values = ParsedArguments.of("a", 1);

        assertThatThrownBy(() -> values.asMap().put("b", 2)).isInstanceOf(UnsupportedOperationException.class);
        assertThat(values.with("b", 2)).isNotEqualTo(values);
    }

    @Test
    void testOddPairsRejected() {
        assertThatThrownBy(() -> ParsedArguments.of("a")).isInstanceOf(IllegalArgumentException.class);
    }
}
