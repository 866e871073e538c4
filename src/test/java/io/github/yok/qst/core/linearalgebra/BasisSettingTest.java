package io.github.yok.qst.core.linearalgebra;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashSet;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class BasisSettingTest {

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 3, 4})
    void enumeratesAllNonIdentitySettings(int n) {
        List<BasisSetting> settings = BasisSetting.nonIdentity(n);

        assertThat(settings).hasSize((1 << (2 * n)) - 1);
        assertThat(new HashSet<>(settings)).hasSameSizeAs(settings);
        assertThat(settings).noneMatch(BasisSetting::isIdentity);
        assertThat(settings).allMatch(s -> s.qubitCount() == n);
    }

    @Test
    void enumerationOrderIsBaseFourWithQubitZeroFirst() {
        List<BasisSetting> settings = BasisSetting.nonIdentity(2);

        assertThat(settings.get(0).label()).isEqualTo("IX");
        assertThat(settings.get(2).label()).isEqualTo("IZ");
        assertThat(settings.get(3).label()).isEqualTo("XI");
        assertThat(settings.get(14).label()).isEqualTo("ZZ");
    }

    @Test
    void parsesLabels() {
        BasisSetting setting = BasisSetting.parse("xYz");

        assertThat(setting.getPaulis()).containsExactly(Pauli.X, Pauli.Y, Pauli.Z);
        assertThat(setting).isEqualTo(BasisSetting.of(Pauli.X, Pauli.Y, Pauli.Z));
        assertThat(setting.toString()).isEqualTo("XYZ");
        assertThat(BasisSetting.parse("II").isIdentity()).isTrue();
        assertThatThrownBy(() -> BasisSetting.parse("XQ"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> BasisSetting.parse(""))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
