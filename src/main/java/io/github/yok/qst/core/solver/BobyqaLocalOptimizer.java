package io.github.yok.qst.core.solver;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.analysis.MultivariateFunction;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.SimpleBounds;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.BOBYQAOptimizer;

/**
 * Commons Math の BOBYQA（導関数不要、箱型制約つき）による局所最小化を行うクラスです。
 *
 * <p>
 * 補間点の数は 2d + 1（d は次元）です。 評価回数の上限に達した場合は、それまでに評価した最良点を返します。
 * 目的関数が有限値でない値を返した場合は {@link IllegalStateException} を送出します。
 * 実行スレッドが割り込まれた場合も、次の評価で {@link IllegalStateException} を送出して最適化を打ち切ります。
 * </p>
 */
@Slf4j
@Getter
public final class BobyqaLocalOptimizer implements LocalOptimizer {

    /**
     * 信頼領域の初期半径です。
     */
    private final double initialTrustRegionRadius;

    /**
     * 停止判定に用いる信頼領域の半径です。
     */
    private final double stoppingTrustRegionRadius;

    /**
     * 目的関数の最大評価回数です。
     */
    private final int maxEvaluations;

    /**
     * 局所最適化器を生成します。
     *
     * @param initialTrustRegionRadius 信頼領域の初期半径です（正の値）
     * @param stoppingTrustRegionRadius 停止半径です（正の値、初期半径以下）
     * @param maxEvaluations 最大評価回数です（1 以上）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public BobyqaLocalOptimizer(double initialTrustRegionRadius, double stoppingTrustRegionRadius,
            int maxEvaluations) {
        if (!(initialTrustRegionRadius > 0.0)) {
            throw new IllegalArgumentException(
                    "initialTrustRegionRadius は 0 より大きい必要があります: " + initialTrustRegionRadius);
        }
        if (!(stoppingTrustRegionRadius > 0.0
                && stoppingTrustRegionRadius <= initialTrustRegionRadius)) {
            throw new IllegalArgumentException(
                    "stoppingTrustRegionRadius は (0, initialTrustRegionRadius] が必要です: "
                            + stoppingTrustRegionRadius);
        }
        if (maxEvaluations <= 0) {
            throw new IllegalArgumentException("maxEvaluations は 1 以上が必要です: " + maxEvaluations);
        }
        this.initialTrustRegionRadius = initialTrustRegionRadius;
        this.stoppingTrustRegionRadius = stoppingTrustRegionRadius;
        this.maxEvaluations = maxEvaluations;
    }

    @Override
    public LocalOptimum minimize(MultivariateFunction objective, double[] initialGuess,
            double[] lowerBounds, double[] upperBounds) {
        int dim = initialGuess.length;
        if (lowerBounds.length != dim || upperBounds.length != dim) {
            throw new IllegalArgumentException("初期点と境界の次元が一致しません");
        }
        for (int i = 0; i < dim; i++) {
            if (upperBounds[i] - lowerBounds[i] < 2.0 * initialTrustRegionRadius) {
                throw new IllegalArgumentException("境界の幅が信頼領域の初期半径の 2 倍より狭いです: index=" + i);
            }
        }

        BestPointTracker tracker = new BestPointTracker(objective);
        BOBYQAOptimizer optimizer =
                new BOBYQAOptimizer(2 * dim + 1, initialTrustRegionRadius, stoppingTrustRegionRadius);
        try {
            PointValuePair optimum = optimizer.optimize(new MaxEval(maxEvaluations),
                    new ObjectiveFunction(tracker), GoalType.MINIMIZE,
                    new InitialGuess(initialGuess), new SimpleBounds(lowerBounds, upperBounds));
            return new LocalOptimum(optimum.getPoint(), optimum.getValue(),
                    optimizer.getEvaluations(), false);
        } catch (TooManyEvaluationsException e) {
            if (tracker.bestPoint == null) {
                throw e;
            }
            log.warn("評価回数の上限に達したため、評価済みの最良点を採用します。上限={}、最良値={}", maxEvaluations,
                    tracker.bestValue);
            return new LocalOptimum(tracker.bestPoint, tracker.bestValue, maxEvaluations, true);
        }
    }

    /**
     * 評価済みの最良点を記録し、有限値でない評価と割り込み後の評価を拒否する目的関数のラッパです。
     */
    private static final class BestPointTracker implements MultivariateFunction {

        private final MultivariateFunction delegate;

        private double[] bestPoint;

        private double bestValue = Double.POSITIVE_INFINITY;

        BestPointTracker(MultivariateFunction delegate) {
            this.delegate = delegate;
        }

        @Override
        public double value(double[] point) {
            // BOBYQA 自体は割り込みを見ないため、評価ごとに確認する
            if (Thread.currentThread().isInterrupted()) {
                throw new IllegalStateException("局所最適化が割り込まれました");
            }
            double v = delegate.value(point);
            if (!Double.isFinite(v)) {
                throw new IllegalStateException("目的関数が有限値ではありません: " + v);
            }
            if (v < bestValue) {
                bestValue = v;
                bestPoint = point.clone();
            }
            return v;
        }
    }
}
