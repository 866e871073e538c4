package io.github.yok.qst.core.state;

import org.apache.commons.math3.complex.Complex;

/**
 * 2 つの純粋状態の忠実度 |⟨ψ1|ψ2⟩|^2 を計算するクラスです。
 *
 * <p>
 * 対称で、大域位相を除いて等しいとき 1、直交するとき 0 になります。 丸め誤差で [0, 1] をわずかに外れた値は端点に丸めます。
 * </p>
 */
public final class FidelityEvaluator {

    /**
     * 忠実度を計算します。
     *
     * @param first 1 つ目の状態です
     * @param second 2 つ目の状態です
     * @return [0, 1] の忠実度です
     * @throws DimensionMismatchException 次元が一致しない場合に発生します
     */
    public double fidelity(StateVector first, StateVector second) {
        if (first == null || second == null) {
            throw new IllegalArgumentException("状態は null 不可です");
        }
        Complex overlap = first.innerProduct(second);
        double f = overlap.getReal() * overlap.getReal()
                + overlap.getImaginary() * overlap.getImaginary();
        return Math.min(1.0, Math.max(0.0, f));
    }
}
