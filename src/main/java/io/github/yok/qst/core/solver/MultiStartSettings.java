package io.github.yok.qst.core.solver;

import java.time.Duration;
import lombok.Value;

/**
 * 多点スタート推定の設定（試行回数、φ 上限の余白、並列度、全試行に対する制限時間）です。
 */
@Value
public class MultiStartSettings {

    /**
     * 既定の試行回数です。
     */
    public static final int DEFAULT_RESTARTS = 50;

    /**
     * 既定の φ 上限の余白 δ です。
     */
    public static final double DEFAULT_PHI_UPPER_MARGIN = 1e-6;

    /**
     * 試行回数です（1 以上）。
     */
    int restarts;

    /**
     * φ の上限を 2π - δ とするための余白 δ です（0 以上、π 未満）。
     */
    double phiUpperMargin;

    /**
     * 並列度です（1 以上）。
     */
    int parallelism;

    /**
     * 全試行に対する制限時間です（{@link Duration#ZERO} は無制限）。
     */
    Duration attemptTimeout;

    /**
     * 設定を生成します。
     *
     * @param restarts 試行回数です
     * @param phiUpperMargin φ 上限の余白です
     * @param parallelism 並列度です
     * @param attemptTimeout 制限時間です（null または 0 は無制限）
     * @throws IllegalArgumentException 値が不正な場合に発生します
     */
    public MultiStartSettings(int restarts, double phiUpperMargin, int parallelism,
            Duration attemptTimeout) {
        if (restarts <= 0) {
            throw new IllegalArgumentException("restarts は 1 以上が必要です: " + restarts);
        }
        if (!(phiUpperMargin >= 0.0 && phiUpperMargin < Math.PI)) {
            throw new IllegalArgumentException("phiUpperMargin は [0, π) が必要です: " + phiUpperMargin);
        }
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism は 1 以上が必要です: " + parallelism);
        }
        if (attemptTimeout != null && attemptTimeout.isNegative()) {
            throw new IllegalArgumentException("attemptTimeout は負にできません: " + attemptTimeout);
        }
        this.restarts = restarts;
        this.phiUpperMargin = phiUpperMargin;
        this.parallelism = parallelism;
        this.attemptTimeout = attemptTimeout == null ? Duration.ZERO : attemptTimeout;
    }

    /**
     * 既定値（50 試行、δ=1e-6、逐次実行、無制限）の設定を返します。
     *
     * @return 設定です
     */
    public static MultiStartSettings defaults() {
        return new MultiStartSettings(DEFAULT_RESTARTS, DEFAULT_PHI_UPPER_MARGIN, 1, Duration.ZERO);
    }

    /**
     * 制限時間が設定されているかどうかを返します。
     *
     * @return 制限時間がある場合 true です
     */
    public boolean hasTimeout() {
        return !attemptTimeout.isZero();
    }
}
