package com.nsmctl.commandline.util;

import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import static org.assertj.core.api.Assertions.*;

class ValuesTest {

    static Stream<Arguments> samples() {
        return Stream.of(
                Arguments.of(null, false),
                Arguments.of(false, false),
                Arguments.of(true, true),
                Arguments.of(0, false),
                Arguments.of(0.0d, false),
                Arguments.of(8080, true),
                Arguments.of("", false),
                Arguments.of("10.0.0.5", true),
                Arguments.of(List.of(), false),
                Arguments.of(List.of(1), true),
                Arguments.of(Map.of(), false),
                Arguments.of(new Object(), true));
    }

    @ParameterizedTest
    @MethodSource("samples")
    void testTruthiness(Object value, boolean expected) {
        assertThat(Values.isTruthy(value)).isEqualTo(expected);
        assertThat(Values.isFalsy(value)).isEqualTo(!expected);
    }

    @Test
    void testOrNotAvailable() {
        assertThat(Values.orNotAvailable(null)).isEqualTo("N/A");
        assertThat(Values.orNotAvailable("")).isEqualTo("N/A");
        assertThat(Values.orNotAvailable("redef x;")).isEqualTo("redef x;");
    }
}
