package io.github.yok.qst.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.yok.qst.core.linearalgebra.BasisSetting;
import io.github.yok.qst.core.linearalgebra.Pauli;
import org.junit.jupiter.api.Test;

class QubitConfigTest {

    @Test
    void settingUsesSmallestShotCountOfItsAxes() {
        QubitConfig config = QubitConfig.of(3, 500, 300, 800);

        assertThat(config.shotsFor(BasisSetting.parse("XIZ"))).isEqualTo(500);
        assertThat(config.shotsFor(BasisSetting.parse("XYZ"))).isEqualTo(300);
        assertThat(config.shotsFor(BasisSetting.parse("IIZ"))).isEqualTo(800);
        assertThat(config.shotsFor(Pauli.Y)).isEqualTo(300);
        assertThat(config.dimension()).isEqualTo(8);
        assertThat(config.parameterCount()).isEqualTo(7);
    }

    @Test
    void rejectsInvalidValues() {
        assertThatThrownBy(() -> QubitConfig.of(0, 1, 1, 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> QubitConfig.of(1, 0, 1, 1))
                .isInstanceOf(IllegalArgumentException.class);

        QubitConfig config = QubitConfig.of(2, 10, 10, 10);
        assertThatThrownBy(() -> config.shotsFor(BasisSetting.parse("II")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> config.shotsFor(BasisSetting.parse("X")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> config.shotsFor(Pauli.I))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
