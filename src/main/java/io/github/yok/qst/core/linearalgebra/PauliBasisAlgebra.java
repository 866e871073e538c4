package io.github.yok.qst.core.linearalgebra;

import io.github.yok.qst.core.state.DimensionMismatchException;
import io.github.yok.qst.core.state.StateVector;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.ZMatrixRMaj;
import org.ejml.dense.row.CommonOps_ZDRM;

/**
 * Pauli 積演算子と +1 固有空間への射影子、および測定確率を計算するクラスです。
 *
 * <p>
 * テンソル積は量子ビット 0 を最も左の因子とします（{@link io.github.yok.qst.core.state.QubitOrdering}）。
 * </p>
 *
 * <p>
 * 確率 ⟨ψ|P+|ψ⟩ は理論上実数かつ [0, 1] ですが、丸め誤差を含みます。 虚部の絶対値および [0, 1] からのはみ出しが
 * {@code tolerance} 以下なら黙って丸め、超える場合は警告ログを出したうえで [0, 1] に丸めます。
 * </p>
 */
@Slf4j
public final class PauliBasisAlgebra {

    /**
     * 既定の許容誤差です。
     */
    public static final double DEFAULT_TOLERANCE = 1e-9;

    /**
     * 虚部と範囲外の許容誤差です。
     */
    @Getter
    private final double tolerance;

    /**
     * 既定の許容誤差で生成します。
     */
    public PauliBasisAlgebra() {
        this(DEFAULT_TOLERANCE);
    }

    /**
     * 許容誤差を指定して生成します。
     *
     * @param tolerance 許容誤差です（0 以上）
     * @throws IllegalArgumentException tolerance が負または有限値でない場合に発生します
     */
    public PauliBasisAlgebra(double tolerance) {
        if (!(tolerance >= 0.0) || Double.isInfinite(tolerance)) {
            throw new IllegalArgumentException("tolerance は 0 以上の有限値を指定してください: " + tolerance);
        }
        this.tolerance = tolerance;
    }

    /**
     * 基底設定の Pauli 積 σ_{s0} ⊗ σ_{s1} ⊗ ... を返します。
     *
     * @param setting 基底設定です
     * @return 2^n × 2^n の新しい行列です
     */
    public ZMatrixRMaj observable(BasisSetting setting) {
        if (setting == null) {
            throw new IllegalArgumentException("setting は null 不可です");
        }
        ZMatrixRMaj product = setting.get(0).matrix();
        for (int q = 1; q < setting.qubitCount(); q++) {
            product = kron(product, setting.get(q).matrix());
        }
        return product;
    }

    /**
     * +1 固有空間への射影子 (I + σ)/2 を返します。
     *
     * @param setting 基底設定です
     * @return 2^n × 2^n の新しい行列です
     */
    public ZMatrixRMaj projectorPlus(BasisSetting setting) {
        ZMatrixRMaj sigma = observable(setting);
        ZMatrixRMaj projector = CommonOps_ZDRM.identity(sigma.numRows);
        CommonOps_ZDRM.add(projector, sigma, projector);
        CommonOps_ZDRM.scale(0.5, 0.0, projector);
        return projector;
    }

    /**
     * 測定結果が +1 となる確率 ⟨ψ|P+|ψ⟩ を返します。
     *
     * @param state 状態です
     * @param setting 基底設定です
     * @return [0, 1] の確率です
     * @throws DimensionMismatchException 状態と設定の量子ビット数が一致しない場合に発生します
     */
    public double probabilityPlus(StateVector state, BasisSetting setting) {
        if (state == null) {
            throw new IllegalArgumentException("state は null 不可です");
        }
        if (setting == null) {
            throw new IllegalArgumentException("setting は null 不可です");
        }
        if (state.qubitCount() != setting.qubitCount()) {
            throw new DimensionMismatchException("状態と基底設定の量子ビット数が一致しません", state.qubitCount(),
                    setting.qubitCount());
        }
        return probabilityPlus(projectorPlus(setting), state.toColumn());
    }

    /**
     * 測定結果が -1 となる確率 1 - ⟨ψ|P+|ψ⟩ を返します。
     *
     * @param state 状態です
     * @param setting 基底設定です
     * @return [0, 1] の確率です
     */
    public double probabilityMinus(StateVector state, BasisSetting setting) {
        return 1.0 - probabilityPlus(state, setting);
    }

    /**
     * 期待値 ⟨ψ|σ|ψ⟩ = 2 p+ - 1 を返します。
     *
     * @param state 状態です
     * @param setting 基底設定です
     * @return [-1, 1] の期待値です
     */
    public double expectation(StateVector state, BasisSetting setting) {
        return 2.0 * probabilityPlus(state, setting) - 1.0;
    }

    /**
     * 計算済みの射影子と列ベクトルから ⟨ψ|P+|ψ⟩ を返します。
     *
     * <p>
     * 尤度計算のように同じ射影子を繰り返し使う場合に用います。 引数は変更しません。
     * </p>
     *
     * @param projector 射影子です（2^n × 2^n）
     * @param column 状態の列ベクトルです（2^n × 1）
     * @return [0, 1] の確率です
     */
    public double probabilityPlus(ZMatrixRMaj projector, ZMatrixRMaj column) {
        int dim = column.numRows;
        ZMatrixRMaj projected = new ZMatrixRMaj(dim, 1);
        CommonOps_ZDRM.mult(projector, column, projected);

        double re = 0.0;
        double im = 0.0;
        for (int i = 0; i < dim; i++) {
            double ar = column.getReal(i, 0);
            double ai = column.getImag(i, 0);
            double br = projected.getReal(i, 0);
            double bi = projected.getImag(i, 0);
            re += ar * br + ai * bi;
            im += ar * bi - ai * br;
        }
        return clampProbability(re, im);
    }

    /**
     * 丸め誤差を含む確率を [0, 1] に丸めます。
     *
     * @param re 実部です
     * @param im 虚部です
     * @return [0, 1] の確率です
     */
    double clampProbability(double re, double im) {
        if (Math.abs(im) > tolerance) {
            log.warn("確率の虚部が許容誤差を超えています。虚部={}、許容={}", im, tolerance);
        }
        if (re < -tolerance || re > 1.0 + tolerance) {
            log.warn("確率が [0, 1] の範囲外のため丸めます。値={}、許容={}", re, tolerance);
        }
        if (Double.isNaN(re)) {
            return re;
        }
        return Math.min(1.0, Math.max(0.0, re));
    }

    /**
     * 複素行列のクロネッカー積 a ⊗ b を返します。
     *
     * @param a 左因子です
     * @param b 右因子です
     * @return 新しい行列です
     */
    static ZMatrixRMaj kron(ZMatrixRMaj a, ZMatrixRMaj b) {
        ZMatrixRMaj c = new ZMatrixRMaj(a.numRows * b.numRows, a.numCols * b.numCols);
        for (int i = 0; i < a.numRows; i++) {
            for (int j = 0; j < a.numCols; j++) {
                double ar = a.getReal(i, j);
                double ai = a.getImag(i, j);
                if (ar == 0.0 && ai == 0.0) {
                    continue;
                }
                for (int k = 0; k < b.numRows; k++) {
                    for (int l = 0; l < b.numCols; l++) {
                        double br = b.getReal(k, l);
                        double bi = b.getImag(k, l);
                        c.set(i * b.numRows + k, j * b.numCols + l, ar * br - ai * bi,
                                ar * bi + ai * br);
                    }
                }
            }
        }
        return c;
    }
}
