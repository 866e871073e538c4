package io.github.yok.qst.core.pipeline;

import com.google.common.base.Preconditions;
import io.github.yok.qst.core.linearalgebra.PauliBasisAlgebra;
import io.github.yok.qst.core.measurement.MeasurementSimulator;
import io.github.yok.qst.core.measurement.OutcomeSet;
import io.github.yok.qst.core.model.QubitConfig;
import io.github.yok.qst.core.reduced.QubitReducedState;
import io.github.yok.qst.core.reduced.ReducedStateExtractor;
import io.github.yok.qst.core.solver.NegativeLogLikelihood;
import io.github.yok.qst.core.solver.ParameterEstimator;
import io.github.yok.qst.core.solver.ParameterEstimator.EstimationResult;
import io.github.yok.qst.core.state.DimensionMismatchException;
import io.github.yok.qst.core.state.FidelityEvaluator;
import io.github.yok.qst.core.state.ParameterVector;
import io.github.yok.qst.core.state.StateParameterizer;
import io.github.yok.qst.core.state.StateVector;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * 真の状態の生成 → 測定の模擬 → 最尤推定 → 忠実度・縮約状態の計算、を順に行うクラスです。
 *
 * <p>
 * 実行ごとにシードから用途別の乱数列（真の状態、測定、推定）を派生させるため、同じ設定とシードからは同じ結果が得られます。
 * このクラスでは再試行を行わず、途中の例外はそのまま呼び出し元へ送出します。
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public final class TomographyPipeline {

    private static final int STREAM_TRUE_STATE = 1;

    private static final int STREAM_MEASUREMENT = 2;

    private static final int STREAM_ESTIMATION = 3;

    private final StateParameterizer parameterizer;

    private final PauliBasisAlgebra algebra;

    private final MeasurementSimulator simulator;

    private final ParameterEstimator estimator;

    private final FidelityEvaluator fidelityEvaluator;

    private final ReducedStateExtractor reducedStateExtractor;

    /**
     * 一様乱数の真の角度列でセッションを生成します。
     *
     * @param config 量子ビット数とショット数の設定です
     * @param seed 乱数シードです
     * @return セッションです
     */
    public TomographySession create(QubitConfig config, long seed) {
        return create(config, seed, null);
    }

    /**
     * セッションを生成します。
     *
     * <p>
     * {@code trueParameters} が null の場合は θ を [0, π]、φ を [0, 2π) の一様乱数で引きます。
     * 角度列の長さはここで検証するため、測定の模擬より前に失敗します。
     * </p>
     *
     * @param config 量子ビット数とショット数の設定です
     * @param seed 乱数シードです
     * @param trueParameters 外部から与える真の角度列です（null 可）
     * @return セッションです
     * @throws DimensionMismatchException 角度列の長さが 2^n - 1 でない場合に発生します
     */
    public TomographySession create(QubitConfig config, long seed, ParameterVector trueParameters) {
        Preconditions.checkNotNull(config, "設定が null です。");
        boolean supplied = trueParameters != null;
        ParameterVector params;
        if (supplied) {
            params = ParameterVector.of(config.getQubitCount(), trueParameters.getThetas(),
                    trueParameters.getPhis());
        } else {
            params = randomParameters(config.parameterCount(), stream(seed, STREAM_TRUE_STATE));
        }
        StateVector trueState = parameterizer.generateState(params);
        return new TomographySession(config, seed, params, trueState, supplied);
    }

    /**
     * セッションを実行します。
     *
     * @param session セッションです
     * @return 実行結果です
     */
    public TomographyResult run(TomographySession session) {
        Preconditions.checkNotNull(session, "セッションが null です。");
        QubitConfig config = session.getConfig();
        long seed = session.getSeed();

        log.info("トモグラフィを開始します。量子ビット数={}、ショット数={}、シード={}、真の状態={}",
                config.getQubitCount(), config.getShotsPerAxis(), seed,
                session.isSuppliedParameters() ? "指定" : "乱数");

        OutcomeSet outcomes = simulator.simulateAll(session.getTrueState(), config,
                stream(seed, STREAM_MEASUREMENT));

        EstimationResult estimation =
                estimator.estimate(outcomes, config, stream(seed, STREAM_ESTIMATION));
        ParameterVector estimated = estimation.getParameters();
        StateVector reconstructed = parameterizer.generateState(estimated);

        double fidelity = fidelityEvaluator.fidelity(session.getTrueState(), reconstructed);
        double trueObjective = new NegativeLogLikelihood(parameterizer, algebra, outcomes, config)
                .value(session.getTrueParameters());

        List<QubitReducedState> trueReduced = reducedStates(session.getTrueState());
        List<QubitReducedState> reconstructedReduced = reducedStates(reconstructed);

        log.info("トモグラフィを終了しました。忠実度={}、負の対数尤度（推定）={}、負の対数尤度（真）={}",
                fmt5(fidelity), fmt5(estimation.getObjective()), fmt5(trueObjective));

        return new TomographyResult(config, seed, session.getTrueParameters(), estimated,
                session.getTrueState(), reconstructed, fidelity, outcomes, estimation,
                trueObjective, trueReduced, reconstructedReduced);
    }

    /**
     * 状態の量子ビットごとの縮約密度行列とブロッホベクトルを返します。
     *
     * @param state 状態です
     * @return 量子ビット順の縮約状態です
     */
    public List<QubitReducedState> reducedStates(StateVector state) {
        return reducedStateExtractor.reducedStates(state);
    }

    /**
     * θ を [0, π]、φ を [0, 2π) の一様乱数で引いた角度列を返します。
     *
     * @param parameterCount 角度列の長さです
     * @param random 乱数生成器です
     * @return 角度列です
     */
    static ParameterVector randomParameters(int parameterCount, RandomGenerator random) {
        double[] thetas = new double[parameterCount];
        double[] phis = new double[parameterCount];
        for (int i = 0; i < parameterCount; i++) {
            thetas[i] = random.nextDouble() * Math.PI;
        }
        for (int i = 0; i < parameterCount; i++) {
            phis[i] = random.nextDouble() * 2.0 * Math.PI;
        }
        return new ParameterVector(thetas, phis);
    }

    /**
     * シードと用途番号から独立した乱数列を派生させます。
     */
    private static RandomGenerator stream(long seed, int streamId) {
        return new MersenneTwister(new int[] {(int) seed, (int) (seed >>> 32), streamId});
    }

    private static String fmt5(double v) {
        return String.format(Locale.ROOT, "%.5f", v);
    }
}
