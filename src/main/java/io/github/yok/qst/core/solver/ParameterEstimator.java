package io.github.yok.qst.core.solver;

import io.github.yok.qst.core.measurement.OutcomeSet;
import io.github.yok.qst.core.model.QubitConfig;
import io.github.yok.qst.core.state.ParameterVector;
import lombok.Value;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * 測定結果から状態の角度列を推定するインタフェースです。
 */
public interface ParameterEstimator {

    /**
     * 測定結果から角度列を推定します。
     *
     * @param outcomes 観測された測定結果です
     * @param config 量子ビット数とショット数の設定です
     * @param random 初期点の生成に用いる乱数生成器です
     * @return 推定結果です
     * @throws ConvergenceFailureException 推定に失敗した場合に発生します
     */
    EstimationResult estimate(OutcomeSet outcomes, QubitConfig config, RandomGenerator random);

    /**
     * 推定結果を表すクラスです。
     */
    @Value
    class EstimationResult {

        /**
         * 推定した角度列です。
         */
        ParameterVector parameters;

        /**
         * 推定した角度列での負の対数尤度です。
         */
        double objective;

        /**
         * 実行した試行回数です。
         */
        int attempts;

        /**
         * 成功した試行回数です。
         */
        int succeededAttempts;

        /**
         * 採用した試行の番号です（0 始まり）。
         */
        int bestAttempt;
    }
}
