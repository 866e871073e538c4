package io.github.yok.qst.core.pipeline;

import io.github.yok.qst.core.measurement.OutcomeSet;
import io.github.yok.qst.core.model.QubitConfig;
import io.github.yok.qst.core.reduced.QubitReducedState;
import io.github.yok.qst.core.solver.ParameterEstimator.EstimationResult;
import io.github.yok.qst.core.state.ParameterVector;
import io.github.yok.qst.core.state.StateVector;
import java.util.List;
import lombok.Value;

/**
 * トモグラフィ実行の結果です。
 *
 * <p>
 * 可視化などの外部処理は、角度列、状態ベクトル、忠実度、量子ビットごとの縮約状態をこのクラスから受け取ります。
 * </p>
 */
@Value
public class TomographyResult {

    /**
     * 量子ビット数とショット数の設定です。
     */
    QubitConfig config;

    /**
     * 実行全体の乱数シードです。
     */
    long seed;

    /**
     * 真の角度列です。
     */
    ParameterVector trueParameters;

    /**
     * 推定した角度列です。
     */
    ParameterVector estimatedParameters;

    /**
     * 真の状態です。
     */
    StateVector trueState;

    /**
     * 推定した角度列から再構成した状態です。
     */
    StateVector reconstructedState;

    /**
     * 真の状態と再構成した状態の忠実度です。
     */
    double fidelity;

    /**
     * 模擬した測定結果です。
     */
    OutcomeSet outcomes;

    /**
     * 推定の詳細です。
     */
    EstimationResult estimation;

    /**
     * 真の角度列での負の対数尤度です。
     */
    double trueObjective;

    /**
     * 真の状態の量子ビットごとの縮約状態です。
     */
    List<QubitReducedState> trueReducedStates;

    /**
     * 再構成した状態の量子ビットごとの縮約状態です。
     */
    List<QubitReducedState> reconstructedReducedStates;
}
