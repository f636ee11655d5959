package com.phillippitts.heartbeat.domain;

import com.phillippitts.heartbeat.exception.InvalidStatusException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HeartbeatStatusTest {

    @ParameterizedTest
    @ValueSource(strings = {"healthy", "HEALTHY", " Healthy "})
    void parsesIgnoringCaseAndWhitespace(String raw) {
        assertThat(HeartbeatStatus.parse(raw)).isEqualTo(HeartbeatStatus.HEALTHY);
    }

    @Test
    void parsesEveryStatusByName() {
        for (HeartbeatStatus s : HeartbeatStatus.values()) {
            assertThat(HeartbeatStatus.parse(s.name().toLowerCase())).isEqualTo(s);
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {"not-a-real-status", "", "   ", "OK"})
    void rejectsUnknownValues(String raw) {
        assertThatThrownBy(() -> HeartbeatStatus.parse(raw))
                .isInstanceOf(InvalidStatusException.class)
                .extracting(e -> ((InvalidStatusException) e).getValue())
                .isEqualTo(raw);
    }

    @Test
    void rejectsNull() {
        assertThatThrownBy(() -> HeartbeatStatus.parse(null)).isInstanceOf(InvalidStatusException.class);
    }
}
