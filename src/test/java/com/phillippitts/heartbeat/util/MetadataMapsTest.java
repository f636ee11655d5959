package com.phillippitts.heartbeat.util;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MetadataMapsTest {

    @Test
    void snapshotKeepsNullsAndIsReadOnly() {
        Map<String, Object> source = new HashMap<>();
        source.put("owner", null);

        Map<String, Object> copy = MetadataMaps.snapshot(source);
        source.put("late", 1);

        assertThat(copy).containsOnlyKeys("owner").containsEntry("owner", null);
        assertThatThrownBy(() -> copy.put("x", 1)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void nullGivesEmptyMap() {
        assertThat(MetadataMaps.snapshot(null)).isEmpty();
    }
}
