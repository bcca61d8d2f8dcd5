package io.botpoll.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class UpdateOffsetTest {

    @Test
    void initialOffsetIsZero() {
        assertThat(UpdateOffset.initial().value()).isZero();
    }

    @Test
    void advancesPastHandledUpdate() {
        UpdateOffset offset = UpdateOffset.initial()
                .advancePast(5)
                .advancePast(6)
                .advancePast(9);

        assertThat(offset.value()).isEqualTo(10);
    }

    @Test
    void neverMovesBackwards() {
        UpdateOffset offset = new UpdateOffset(10);

        assertThat(offset.advancePast(3)).isSameAs(offset);
        assertThat(offset.advancePast(9)).isSameAs(offset);
        assertThat(offset.advancePast(10).value()).isEqualTo(11);
    }

    @Test
    void comparesByValue() {
        assertThat(new UpdateOffset(3)).isEqualTo(new UpdateOffset(3));
        assertThat(new UpdateOffset(3)).isLessThan(new UpdateOffset(4));
        assertThat(new UpdateOffset(42).toString()).isEqualTo("42");
    }
}
