package com.phillippitts.heartbeat.config.properties;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HeartbeatPropertiesTest {

    private final Validator validator = Validation.buildDefaultValidatorFactory().getValidator();

    @Test
    void defaults() {
        HeartbeatProperties props = new HeartbeatProperties();
        assertThat(props.getCheckInterval()).isEqualTo(Duration.ofSeconds(30));
        assertThat(props.getStaleThreshold()).isEqualTo(Duration.ofSeconds(60));
        assertThat(props.getEventHistorySize()).isEqualTo(100);
        assertThat(props.getCollaboratorTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(props.getMonitor().isAutoStart()).isTrue();
        assertThat(validator.validate(props)).isEmpty();
    }

    @Test
    void rejectsNonPositiveDurations() {
        HeartbeatProperties props = new HeartbeatProperties();
        assertThatThrownBy(() -> props.setCheckInterval(Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> props.setStaleThreshold(Duration.ofSeconds(-1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> props.setCollaboratorTimeout(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void historySizeOutOfRangeFailsValidation() {
        HeartbeatProperties props = new HeartbeatProperties();
        props.setEventHistorySize(0);
        assertThat(validator.validate(props)).hasSize(1);

        props.setEventHistorySize(10_001);
        assertThat(validator.validate(props)).hasSize(1);
    }
}
