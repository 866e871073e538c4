package io.github.yok.qst.core.solver;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.github.yok.qst.core.linearalgebra.BasisSetting;
import io.github.yok.qst.core.linearalgebra.PauliBasisAlgebra;
import io.github.yok.qst.core.measurement.MeasurementSimulator;
import io.github.yok.qst.core.measurement.OutcomeSet;
import io.github.yok.qst.core.model.QubitConfig;
import io.github.yok.qst.core.state.DimensionMismatchException;
import io.github.yok.qst.core.state.HypersphericalStateParameterizer;
import io.github.yok.qst.core.state.ParameterVector;
import io.github.yok.qst.core.state.StateParameterizer;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class NegativeLogLikelihoodTest {

    private final StateParameterizer parameterizer = new HypersphericalStateParameterizer();

    private final PauliBasisAlgebra algebra = new PauliBasisAlgebra();

    @Test
    @DisplayName("|0⟩ に対する値を手計算と照合する")
    void matchesHandComputedValue() {
        Map<BasisSetting, int[]> raw = new LinkedHashMap<>();
        raw.put(BasisSetting.parse("X"), new int[] {1, 1, 1, -1});
        raw.put(BasisSetting.parse("Y"), new int[] {1, -1});
        raw.put(BasisSetting.parse("Z"), new int[] {1, 1, -1});
        QubitConfig config = QubitConfig.of(1, 4, 2, 3);
        NegativeLogLikelihood nll =
                new NegativeLogLikelihood(parameterizer, algebra, new OutcomeSet(raw), config);

        double eps = NegativeLogLikelihood.EPSILON;
        // |0⟩: p(X)=p(Y)=0.5, p(Z)=1
        double expected = -(3 * Math.log(0.5 + eps) + Math.log(0.5 + eps))
                - (Math.log(0.5 + eps) + Math.log(0.5 + eps))
                - (2 * Math.log(1.0 + eps) + Math.log(eps));

        double value = nll.value(new ParameterVector(new double[] {0.0}, new double[] {0.0}));

        assertThat(value).isCloseTo(expected, within(1e-9));
        assertThat(value).isFinite();
        assertThat(nll.value(new double[] {0.0, 0.0})).isEqualTo(value);
    }

    @Test
    @DisplayName("真の角度列の値はランダムな角度列より小さい")
    void trueParametersScoreBetterThanRandomOnes() {
        RandomGenerator random = new MersenneTwister(2024L);
        QubitConfig config = QubitConfig.of(2, 5000, 5000, 5000);
        ParameterVector truth = new ParameterVector(new double[] {1.0, 2.0, 0.7},
                new double[] {0.3, 4.0, 5.5});
        OutcomeSet outcomes = new MeasurementSimulator(algebra)
                .simulateAll(parameterizer.generateState(truth), config, random);
        NegativeLogLikelihood nll = new NegativeLogLikelihood(parameterizer, algebra, outcomes, config);

        double trueValue = nll.value(truth);
        for (int trial = 0; trial < 20; trial++) {
            double[] thetas = new double[3];
            double[] phis = new double[3];
            for (int i = 0; i < 3; i++) {
                thetas[i] = random.nextDouble() * Math.PI;
                phis[i] = random.nextDouble() * 2 * Math.PI;
            }
            assertThat(trueValue).isLessThan(nll.value(new ParameterVector(thetas, phis)));
        }
    }

    @Test
    void requiresOutcomesForEveryNonIdentitySetting() {
        Map<BasisSetting, int[]> raw = new LinkedHashMap<>();
        raw.put(BasisSetting.parse("X"), new int[] {1});
        QubitConfig config = QubitConfig.of(1, 1, 1, 1);

        assertThatThrownBy(() -> new NegativeLogLikelihood(parameterizer, algebra,
                new OutcomeSet(raw), config)).isInstanceOf(IllegalArgumentException.class)
                        .hasMessageContaining("Y");
    }

    @Test
    @DisplayName("角度列の長さが量子ビット数と合わない場合は DimensionMismatchException")
    void rejectsParametersOfTheWrongLength() {
        QubitConfig config = QubitConfig.of(1, 10, 10, 10);
        OutcomeSet outcomes = new MeasurementSimulator(algebra).simulateAll(
                parameterizer.generateState(new ParameterVector(new double[] {0.4},
                        new double[] {0.2})),
                config, new MersenneTwister(2L));
        NegativeLogLikelihood nll =
                new NegativeLogLikelihood(parameterizer, algebra, outcomes, config);

        assertThatThrownBy(() -> nll.value(new ParameterVector(new double[] {0.1, 0.2, 0.3},
                new double[] {0.1, 0.2, 0.3}))).isInstanceOf(DimensionMismatchException.class)
                        .satisfies(e -> {
                            DimensionMismatchException dme = (DimensionMismatchException) e;
                            assertThat(dme.getExpected()).isEqualTo(1);
                            assertThat(dme.getActual()).isEqualTo(3);
                        });
    }
}
