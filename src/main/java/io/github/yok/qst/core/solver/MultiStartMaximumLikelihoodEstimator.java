package io.github.yok.qst.core.solver;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.github.yok.qst.core.linearalgebra.PauliBasisAlgebra;
import io.github.yok.qst.core.measurement.OutcomeSet;
import io.github.yok.qst.core.model.QubitConfig;
import io.github.yok.qst.core.solver.LocalOptimizer.LocalOptimum;
import io.github.yok.qst.core.state.DimensionMismatchException;
import io.github.yok.qst.core.state.ParameterVector;
import io.github.yok.qst.core.state.StateParameterizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * 多点スタートの箱型制約つき局所最適化で、負の対数尤度を最小化する角度列を求めるクラスです。
 *
 * <p>
 * 尤度面は非凸（角度から状態への写像が多対一で、確率が三角関数）のため、一様乱数の初期点から独立に局所最適化を繰り返し、
 * 目的関数が最小の試行を採用します。 同値の場合は番号の小さい試行を採用します。
 * </p>
 *
 * <p>
 * 各試行の乱数シードは実行前にまとめて引くため、並列度によらず結果は同じです。 試行は固定サイズのスレッドプールで実行し、
 * 制限時間内に終わらなかった試行は選択から除外します。 すべての試行が失敗した場合に限り
 * {@link ConvergenceFailureException} を送出します。
 * </p>
 */
@Slf4j
@Getter
@RequiredArgsConstructor
public final class MultiStartMaximumLikelihoodEstimator implements ParameterEstimator {

    private static final double TWO_PI = 2.0 * Math.PI;

    /**
     * 打ち切った試行のスレッドが終了するまで待つ時間（秒）です。
     */
    private static final long SHUTDOWN_GRACE_SECONDS = 5L;

    /**
     * 角度列から状態を生成するコンポーネントです。
     */
    private final StateParameterizer parameterizer;

    /**
     * 射影子と確率を計算するコンポーネントです。
     */
    private final PauliBasisAlgebra algebra;

    /**
     * 各試行の局所最適化器です。
     */
    private final LocalOptimizer localOptimizer;

    /**
     * 多点スタートの設定です。
     */
    private final MultiStartSettings settings;

    @Override
    public EstimationResult estimate(OutcomeSet outcomes, QubitConfig config,
            RandomGenerator random) {
        Preconditions.checkNotNull(outcomes, "測定結果が null です。");
        Preconditions.checkNotNull(config, "設定が null です。");
        Preconditions.checkNotNull(random, "乱数生成器が null です。");

        NegativeLogLikelihood objective =
                new NegativeLogLikelihood(parameterizer, algebra, outcomes, config);
        int m = objective.getParameterCount();
        double[] lower = new double[2 * m];
        double[] upper = new double[2 * m];
        for (int i = 0; i < m; i++) {
            upper[i] = Math.PI;
            upper[m + i] = TWO_PI - settings.getPhiUpperMargin();
        }

        int restarts = settings.getRestarts();
        long[] seeds = new long[restarts];
        for (int r = 0; r < restarts; r++) {
            seeds[r] = random.nextLong();
        }

        log.info("最尤推定を開始します。量子ビット数={}、角度数={}、試行回数={}、並列度={}、制限時間={}",
                config.getQubitCount(), 2 * m, restarts, settings.getParallelism(),
                settings.hasTimeout() ? settings.getAttemptTimeout() : "なし");
        long t0 = System.nanoTime();

        List<Callable<LocalOptimum>> tasks = new ArrayList<>(restarts);
        for (int r = 0; r < restarts; r++) {
            long seed = seeds[r];
            tasks.add(() -> localOptimizer.minimize(objective,
                    randomInitialGuess(new MersenneTwister(seed), m, upper), lower, upper));
        }

        List<Future<LocalOptimum>> futures = invokeAll(tasks);

        LocalOptimum best = null;
        int bestIndex = -1;
        int succeeded = 0;
        Throwable lastFailure = null;
        for (int r = 0; r < futures.size(); r++) {
            LocalOptimum optimum;
            try {
                optimum = futures.get(r).get();
            } catch (CancellationException e) {
                log.warn("試行{}は制限時間内に終了しなかったため除外します。", r);
                lastFailure = e;
                continue;
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof DimensionMismatchException) {
                    throw (DimensionMismatchException) cause;
                }
                if (!isNumericalFailure(cause)) {
                    throw new IllegalStateException("試行" + r + "で予期しない例外が発生しました", cause);
                }
                log.warn("試行{}は数値的に失敗しました: {}", r, cause.getMessage());
                lastFailure = cause;
                continue;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("最尤推定が割り込まれました", e);
            }

            if (!Double.isFinite(optimum.getValue())) {
                log.warn("試行{}の目的関数値が有限値ではないため除外します: {}", r, optimum.getValue());
                continue;
            }
            if (!isFinite(optimum.getPoint())) {
                log.warn("試行{}の最適点が有限値ではないため除外します。", r);
                continue;
            }
            succeeded++;
            log.debug("試行{}：目的関数={}、評価回数={}", r, fmt5(optimum.getValue()),
                    optimum.getEvaluations());
            if (best == null || optimum.getValue() < best.getValue()) {
                best = optimum;
                bestIndex = r;
            }
        }

        long elapsedMs = (System.nanoTime() - t0) / 1_000_000L;
        if (best == null) {
            log.warn("最尤推定のすべての試行が失敗しました。試行回数={}、所要時間={}ms", restarts, elapsedMs);
            throw new ConvergenceFailureException(restarts, lastFailure);
        }

        log.info("最尤推定を終了しました。最良試行={}、負の対数尤度={}、成功試行={} / {}、所要時間={}ms", bestIndex,
                fmt5(best.getValue()), succeeded, restarts, elapsedMs);

        return new EstimationResult(ParameterVector.fromPoint(clampInto(best.getPoint(), lower, upper)),
                best.getValue(), restarts, succeeded, bestIndex);
    }

    /**
     * 試行をスレッドプールで実行し、Future の一覧を試行順に返します。
     */
    private List<Future<LocalOptimum>> invokeAll(List<Callable<LocalOptimum>> tasks) {
        ExecutorService executor = Executors.newFixedThreadPool(settings.getParallelism(),
                new ThreadFactoryBuilder().setNameFormat("qst-mle-attempt-%d").setDaemon(true)
                        .build());
        try {
            if (settings.hasTimeout()) {
                return executor.invokeAll(tasks, settings.getAttemptTimeout().toMillis(),
                        TimeUnit.MILLISECONDS);
            }
            return executor.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("最尤推定が割り込まれました", e);
        } finally {
            executor.shutdownNow();
            awaitTermination(executor);
        }
    }

    /**
     * 打ち切った試行のスレッドが終了するまで待ちます。
     */
    private static void awaitTermination(ExecutorService executor) {
        if (Thread.currentThread().isInterrupted()) {
            return;
        }
        try {
            if (!executor.awaitTermination(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                log.warn("{}秒以内に終了しなかった試行があります。", SHUTDOWN_GRACE_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("試行の終了待ちが割り込まれました", e);
        }
    }

    /**
     * 1 試行の失敗として扱う例外かどうかを返します。
     *
     * <p>
     * 数値的な破綻（有限値でない評価、割り込み）と、Commons Math の引数検証
     * （{@code MathIllegalArgumentException} は {@link IllegalArgumentException} のサブクラス）が該当します。
     * </p>
     */
    private static boolean isNumericalFailure(Throwable cause) {
        return cause instanceof IllegalStateException || cause instanceof ArithmeticException
                || cause instanceof IllegalArgumentException;
    }

    private static boolean isFinite(double[] point) {
        if (point == null) {
            return false;
        }
        for (double v : point) {
            if (!Double.isFinite(v)) {
                return false;
            }
        }
        return true;
    }

    /**
     * θ を [0, π]、φ を [0, 2π) の一様乱数で引き、φ を上限 2π - δ 以下に丸めた初期点を返します。
     */
    private static double[] randomInitialGuess(RandomGenerator random, int m, double[] upper) {
        double[] x0 = new double[2 * m];
        for (int i = 0; i < m; i++) {
            x0[i] = random.nextDouble() * Math.PI;
        }
        for (int i = 0; i < m; i++) {
            x0[m + i] = Math.min(random.nextDouble() * TWO_PI, upper[m + i]);
        }
        return x0;
    }

    private static double[] clampInto(double[] point, double[] lower, double[] upper) {
        double[] clamped = point.clone();
        for (int i = 0; i < clamped.length; i++) {
            clamped[i] = Math.min(upper[i], Math.max(lower[i], clamped[i]));
        }
        return clamped;
    }

    private static String fmt5(double v) {
        return String.format(Locale.ROOT, "%.5f", v);
    }
}
