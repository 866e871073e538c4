package io.github.yok.qst.core.measurement;

import io.github.yok.qst.core.linearalgebra.BasisSetting;
import io.github.yok.qst.core.linearalgebra.PauliBasisAlgebra;
import io.github.yok.qst.core.model.QubitConfig;
import io.github.yok.qst.core.state.DimensionMismatchException;
import io.github.yok.qst.core.state.StateVector;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * 理想的な射影測定を模擬して ±1 の測定結果を生成するクラスです。
 *
 * <p>
 * 基底設定のショット数は、設定に現れる軸のショット数の最小値です。 各ショットは P(+1) = ⟨ψ|P+|ψ⟩ の独立なベルヌーイ試行です。
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public final class MeasurementSimulator {

    /**
     * 測定確率を計算するコンポーネントです。
     */
    private final PauliBasisAlgebra algebra;

    /**
     * 1 つの基底設定について測定結果を生成します。
     *
     * @param state 真の状態です
     * @param setting 基底設定です（すべて I は不可）
     * @param config ショット数の設定です
     * @param random 乱数生成器です
     * @return ±1 の配列です
     * @throws DimensionMismatchException 状態と設定の量子ビット数が一致しない場合に発生します
     */
    public int[] simulate(StateVector state, BasisSetting setting, QubitConfig config,
            RandomGenerator random) {
        if (random == null) {
            throw new IllegalArgumentException("random は null 不可です");
        }
        ensureQubitCount(state, config);
        int shots = config.shotsFor(setting);
        double pPlus = algebra.probabilityPlus(state, setting);

        int[] outcomes = new int[shots];
        for (int k = 0; k < shots; k++) {
            outcomes[k] = random.nextDouble() < pPlus ? 1 : -1;
        }
        return outcomes;
    }

    /**
     * すべて I を除く 4^n - 1 個の基底設定について測定結果を生成します。
     *
     * @param state 真の状態です
     * @param config ショット数の設定です
     * @param random 乱数生成器です
     * @return 測定結果の集合です
     */
    public OutcomeSet simulateAll(StateVector state, QubitConfig config, RandomGenerator random) {
        ensureQubitCount(state, config);
        Map<BasisSetting, int[]> outcomes = new LinkedHashMap<>();
        long totalShots = 0;
        for (BasisSetting setting : BasisSetting.nonIdentity(config.getQubitCount())) {
            int[] values = simulate(state, setting, config, random);
            outcomes.put(setting, values);
            totalShots += values.length;
        }
        log.info("測定の模擬を完了しました。量子ビット数={}、基底設定数={}、総ショット数={}", config.getQubitCount(),
                outcomes.size(), totalShots);
        return new OutcomeSet(outcomes);
    }

    private static void ensureQubitCount(StateVector state, QubitConfig config) {
        if (state == null || config == null) {
            throw new IllegalArgumentException("state/config は null 不可です");
        }
        if (state.qubitCount() != config.getQubitCount()) {
            throw new DimensionMismatchException("状態と設定の量子ビット数が一致しません", config.getQubitCount(),
                    state.qubitCount());
        }
    }
}
