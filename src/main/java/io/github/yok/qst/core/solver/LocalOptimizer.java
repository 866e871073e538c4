package io.github.yok.qst.core.solver;

import lombok.Value;
import org.apache.commons.math3.analysis.MultivariateFunction;

/**
 * 箱型制約つきの局所最小化を行うインタフェースです。
 *
 * <p>
 * 多点スタート推定の 1 試行で使用します。 最適化ライブラリを差し替えやすくするためのインタフェースです。
 * </p>
 */
public interface LocalOptimizer {

    /**
     * 初期点から目的関数を局所最小化します。
     *
     * @param objective 目的関数です
     * @param initialGuess 初期点です（境界内）
     * @param lowerBounds 下限です
     * @param upperBounds 上限です
     * @return 局所最適解です
     * @throws IllegalStateException 数値的に失敗した場合に発生します
     */
    LocalOptimum minimize(MultivariateFunction objective, double[] initialGuess,
            double[] lowerBounds, double[] upperBounds);

    /**
     * 局所最適解を表すクラスです。
     */
    @Value
    class LocalOptimum {

        /**
         * 最適点です。
         */
        double[] point;

        /**
         * 最適点での目的関数値です。
         */
        double value;

        /**
         * 目的関数の評価回数です。
         */
        int evaluations;

        /**
         * 評価回数の上限に達して打ち切ったかどうかです。
         */
        boolean budgetExhausted;
    }
}
