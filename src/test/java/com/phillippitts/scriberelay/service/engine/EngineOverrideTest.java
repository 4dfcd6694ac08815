package com.phillippitts.scriberelay.service.engine;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class EngineOverrideTest {

    @ParameterizedTest
    @CsvSource({"relay, RELAY", "NATIVE, NATIVE", " chunk , CHUNK", "auto, AUTO"})
    void parsesKnownValues(String value, EngineOverride expected) {
        assertThat(EngineOverride.parse(value)).isEqualTo(expected);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"fastest", "  "})
    void unknownValuesReadAsAuto(String value) {
        assertThat(EngineOverride.parse(value)).isEqualTo(EngineOverride.AUTO);
    }

    @ParameterizedTest
    @CsvSource({"RELAY, RELAY", "NATIVE, NATIVE", "CHUNK, CHUNK"})
    void forcedOverridesNameTheirEngine(EngineOverride override, LiveEngine engine) {
        assertThat(override.engine()).contains(engine);
    }
}
