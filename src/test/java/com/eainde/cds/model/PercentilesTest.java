package com.eainde.cds.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PercentilesTest {

    @Test
    @DisplayName("should order the bounds and floor the midpoint")
    void ofOrdersBounds() {
        Percentiles p = Percentiles.of(701, 600);

        assertThat(p.p25()).isEqualTo(600);
        assertThat(p.p50()).isEqualTo(650);
        assertThat(p.p75()).isEqualTo(701);
    }

    @Test
    @DisplayName("should sum sections component-wise and recompute the midpoint")
    void plus() {
        Percentiles composite = Percentiles.of(600, 700).plus(Percentiles.of(620, 780));

        assertThat(composite).isEqualTo(new Percentiles(1220, 1350, 1480));
    }

    @Test
    @DisplayName("should only be resolved when both bounds are positive")
    void resolved() {
        assertThat(Percentiles.EMPTY.isResolved()).isFalse();
        assertThat(Percentiles.of(0, 700).isResolved()).isFalse();
        assertThat(Percentiles.of(30, 34).isResolved()).isTrue();
    }
}
