package com.example.Orin.model;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MetadataFilterTest {

    @Test
    void blankValuesImposeNoConstraint() {
        Map<String, String> constraints = new HashMap<>();
        constraints.put("department", " ");
        constraints.put("document_type", null);

        assertThat(MetadataFilter.of(constraints).isEmpty()).isTrue();
        assertThat(MetadataFilter.none().and("department", "").isEmpty()).isTrue();
    }

    @Test
    void unknownKeysAreRejected() {
        assertThatThrownBy(() -> MetadataFilter.of(Map.of("source", "/x")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void everyConstraintMustMatch() {
        MetadataFilter filter = MetadataFilter.none()
                .and("department", "HR")
                .and("document_type", "policy");

        assertThat(filter.matches(Map.of("department", "HR", "document_type", "policy", "source", "/x"))).isTrue();
        assertThat(filter.matches(Map.of("department", "HR"))).isFalse();
        assertThat(filter.matches(Map.of("department", "IT", "document_type", "policy"))).isFalse();
    }

    @Test
    void emptyFilterMatchesEverything() {
        assertThat(MetadataFilter.none().matches(Map.of())).isTrue();
        assertThat(MetadataFilter.none().matches(null)).isTrue();
    }
}
