package io.github.yok.qst.core.measurement;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.github.yok.qst.core.linearalgebra.BasisSetting;
import io.github.yok.qst.core.linearalgebra.PauliBasisAlgebra;
import io.github.yok.qst.core.model.QubitConfig;
import io.github.yok.qst.core.state.DimensionMismatchException;
import io.github.yok.qst.core.state.StateVector;
import org.apache.commons.math3.random.MersenneTwister;
import org.junit.jupiter.api.Test;

class MeasurementSimulatorTest {

    private final MeasurementSimulator simulator =
            new MeasurementSimulator(new PauliBasisAlgebra());

    @Test
    void eigenstateGivesDeterministicOutcomes() {
        QubitConfig config = QubitConfig.of(1, 100, 100, 100);
        StateVector zero = StateVector.ofReal(1, 0);

        int[] outcomes =
                simulator.simulate(zero, BasisSetting.parse("Z"), config, new MersenneTwister(1L));

        assertThat(outcomes).hasSize(100).containsOnly(1);
    }

    @Test
    void shotCountIsMinimumOverAxesInSetting() {
        QubitConfig config = QubitConfig.of(2, 40, 70, 90);
        StateVector state = StateVector.ofReal(1, 0, 0, 0);

        OutcomeSet outcomes = simulator.simulateAll(state, config, new MersenneTwister(2L));

        assertThat(outcomes.size()).isEqualTo(15);
        assertThat(outcomes.shots(BasisSetting.parse("XY"))).isEqualTo(40);
        assertThat(outcomes.shots(BasisSetting.parse("YZ"))).isEqualTo(70);
        assertThat(outcomes.shots(BasisSetting.parse("IZ"))).isEqualTo(90);
        assertThat(outcomes.contains(BasisSetting.parse("II"))).isFalse();
    }

    @Test
    void frequenciesFollowTheProbability() {
        QubitConfig config = QubitConfig.of(1, 20000, 20000, 20000);
        // cos(π/8)|0⟩ + sin(π/8)|1⟩: P(Z=+1) = cos²(π/8)
        StateVector state = StateVector.ofReal(Math.cos(Math.PI / 8), Math.sin(Math.PI / 8));

        OutcomeSet outcomes = simulator.simulateAll(state, config, new MersenneTwister(3L));

        double expected = Math.pow(Math.cos(Math.PI / 8), 2);
        BasisSetting z = BasisSetting.parse("Z");
        assertThat((double) outcomes.plusCount(z) / outcomes.shots(z)).isCloseTo(expected,
                within(0.015));
        assertThat(outcomes.empiricalExpectation(z)).isCloseTo(2 * expected - 1, within(0.03));
    }

    @Test
    void sameSeedGivesSameOutcomes() {
        QubitConfig config = QubitConfig.of(1, 50, 50, 50);
        StateVector state = StateVector.ofReal(Math.sqrt(0.5), Math.sqrt(0.5));
        BasisSetting z = BasisSetting.parse("Z");

        assertThat(simulator.simulate(state, z, config, new MersenneTwister(11L)))
                .containsExactly(simulator.simulate(state, z, config, new MersenneTwister(11L)));
    }

    @Test
    void rejectsStateOfDifferentSize() {
        QubitConfig config = QubitConfig.of(2, 10, 10, 10);

        assertThatThrownBy(() -> simulator.simulateAll(StateVector.ofReal(1, 0), config,
                new MersenneTwister(4L))).isInstanceOf(DimensionMismatchException.class);
    }
}
