package io.github.yok.qst.core.linearalgebra;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.github.yok.qst.core.state.DimensionMismatchException;
import io.github.yok.qst.core.state.HypersphericalStateParameterizer;
import io.github.yok.qst.core.state.QubitOrdering;
import io.github.yok.qst.core.state.StateParameterizer;
import io.github.yok.qst.core.state.StateVector;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import org.ejml.data.ZMatrixRMaj;
import org.ejml.dense.row.CommonOps_ZDRM;
import org.ejml.dense.row.MatrixFeatures_ZDRM;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PauliBasisAlgebraTest {

    private final PauliBasisAlgebra algebra = new PauliBasisAlgebra();

    private final StateParameterizer parameterizer = new HypersphericalStateParameterizer();

    @Test
    @DisplayName("射影子はエルミートかつ冪等")
    void projectorIsHermitianAndIdempotent() {
        for (BasisSetting setting : BasisSetting.nonIdentity(2)) {
            ZMatrixRMaj p = algebra.projectorPlus(setting);
            ZMatrixRMaj pp = new ZMatrixRMaj(4, 4);
            CommonOps_ZDRM.mult(p, p, pp);

            assertThat(MatrixFeatures_ZDRM.isHermitian(p, 1e-12)).as(setting.label()).isTrue();
            assertThat(MatrixFeatures_ZDRM.isIdentical(p, pp, 1e-12)).as(setting.label()).isTrue();
        }
    }

    @Test
    @DisplayName("Y は [[0, -i], [i, 0]]")
    void pauliYHasStandardForm() {
        ZMatrixRMaj y = Pauli.Y.matrix();
        assertThat(y.getImag(0, 1)).isEqualTo(-1.0);
        assertThat(y.getImag(1, 0)).isEqualTo(1.0);
        assertThat(y.getReal(0, 1)).isZero();
    }

    @Test
    @DisplayName("テンソル積は量子ビット 0 を左端の因子とする")
    void tensorOrderFollowsQubitOrdering() {
        // |01⟩: 量子ビット 0 が 0、量子ビット 1 が 1
        StateVector state = StateVector.ofReal(0, 1, 0, 0);

        assertThat(algebra.probabilityPlus(state, BasisSetting.parse("ZI"))).isCloseTo(1.0,
                within(1e-12));
        assertThat(algebra.probabilityPlus(state, BasisSetting.parse("IZ"))).isCloseTo(0.0,
                within(1e-12));
        assertThat(algebra.probabilityPlus(state, BasisSetting.parse("ZZ"))).isCloseTo(0.0,
                within(1e-12));
    }

    @Test
    @DisplayName("|0⟩ は Z で確率 1、|1⟩ は Z で確率 0、|+⟩ は X で確率 1")
    void singleQubitScenarios() {
        StateVector zero = parameterizer.generateState(1, new double[] {0.0}, new double[] {0.0});
        StateVector one =
                parameterizer.generateState(1, new double[] {Math.PI}, new double[] {0.0});
        StateVector plus =
                parameterizer.generateState(1, new double[] {Math.PI / 2}, new double[] {0.0});

        assertThat(algebra.probabilityPlus(zero, BasisSetting.parse("Z"))).isCloseTo(1.0,
                within(1e-12));
        assertThat(algebra.probabilityPlus(one, BasisSetting.parse("Z"))).isCloseTo(0.0,
                within(1e-12));
        assertThat(algebra.probabilityPlus(plus, BasisSetting.parse("X"))).isCloseTo(1.0,
                within(1e-12));
        assertThat(algebra.probabilityPlus(plus, BasisSetting.parse("Y"))).isCloseTo(0.5,
                within(1e-12));
    }

    @Test
    @DisplayName("|+i⟩ は Y で確率 1")
    void plusIStateInYBasis() {
        StateVector plusI = new StateVector(
                new Complex[] {new Complex(Math.sqrt(0.5), 0), new Complex(0, Math.sqrt(0.5))});

        assertThat(algebra.probabilityPlus(plusI, BasisSetting.parse("Y"))).isCloseTo(1.0,
                within(1e-12));
        assertThat(algebra.expectation(plusI, BasisSetting.parse("Y"))).isCloseTo(1.0,
                within(1e-12));
    }

    @Test
    @DisplayName("p+ と p- は [0, 1] に収まり和が 1")
    void probabilitiesAreComplementary() {
        RandomGenerator random = new MersenneTwister(99L);
        for (int trial = 0; trial < 20; trial++) {
            int m = QubitOrdering.parameterCount(3);
            double[] thetas = new double[m];
            double[] phis = new double[m];
            for (int i = 0; i < m; i++) {
                thetas[i] = random.nextDouble() * Math.PI;
                phis[i] = random.nextDouble() * 2 * Math.PI;
            }
            StateVector state = parameterizer.generateState(3, thetas, phis);
            for (String label : new String[] {"XYZ", "IIZ", "YYI", "XXX"}) {
                BasisSetting setting = BasisSetting.parse(label);
                double plus = algebra.probabilityPlus(state, setting);
                double minus = algebra.probabilityMinus(state, setting);
                assertThat(plus).isBetween(0.0, 1.0);
                assertThat(minus).isBetween(0.0, 1.0);
                assertThat(plus + minus).isCloseTo(1.0, within(1e-12));
            }
        }
    }

    @Test
    @DisplayName("許容誤差を超える値も [0, 1] に丸める")
    void clampsOutOfRangeProbabilities() {
        assertThat(algebra.clampProbability(1.0 + 1e-13, 0.0)).isEqualTo(1.0);
        assertThat(algebra.clampProbability(-1e-13, 0.0)).isEqualTo(0.0);
        assertThat(algebra.clampProbability(1.2, 0.3)).isEqualTo(1.0);
        assertThat(algebra.clampProbability(0.4, 0.0)).isEqualTo(0.4);
    }

    @Test
    void rejectsMismatchedQubitCount() {
        assertThatThrownBy(() -> algebra.probabilityPlus(StateVector.ofReal(1, 0),
                BasisSetting.parse("ZZ"))).isInstanceOf(DimensionMismatchException.class);
        assertThatThrownBy(() -> new PauliBasisAlgebra(-1.0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
