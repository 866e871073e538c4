package io.github.yok.qst.core.state;

import java.util.Arrays;
import org.apache.commons.math3.complex.Complex;
import org.ejml.data.ZMatrixRMaj;

/**
 * n 量子ビットの純粋状態（長さ 2^n の複素振幅列）を保持する値クラスです。
 *
 * <p>
 * 振幅の並びは {@link QubitOrdering} の規約（量子ビット 0 が最上位ビット）に従います。
 * </p>
 */
public final class StateVector {

    /**
     * 複素振幅の配列です。
     */
    private final Complex[] amplitudes;

    /**
     * 状態ベクトルを生成します。
     *
     * @param amplitudes 複素振幅の配列です（長さ 2^n、n は 1 以上）
     * @throws IllegalArgumentException null 要素を含む、または長さが 2 のべき乗でない場合に発生します
     */
    public StateVector(Complex[] amplitudes) {
        if (amplitudes == null) {
            throw new IllegalArgumentException("amplitudes は null 不可です");
        }
        if (amplitudes.length < 2 || Integer.bitCount(amplitudes.length) != 1) {
            throw new DimensionMismatchException("振幅の数は 2^n（n は 1 以上）である必要があります", -1,
                    amplitudes.length);
        }
        for (int i = 0; i < amplitudes.length; i++) {
            if (amplitudes[i] == null) {
                throw new IllegalArgumentException("amplitudes に null が含まれています: index=" + i);
            }
        }
        this.amplitudes = amplitudes.clone();
    }

    /**
     * 実数振幅から状態ベクトルを生成します（主に既知状態の指定用）。
     *
     * @param realAmplitudes 実数振幅です
     * @return 状態ベクトルです
     */
    public static StateVector ofReal(double... realAmplitudes) {
        Complex[] a = new Complex[realAmplitudes.length];
        for (int i = 0; i < a.length; i++) {
            a[i] = new Complex(realAmplitudes[i], 0.0);
        }
        return new StateVector(a);
    }

    /**
     * 次元 2^n を返します。
     *
     * @return 次元です
     */
    public int dimension() {
        return amplitudes.length;
    }

    /**
     * 量子ビット数を返します。
     *
     * @return 量子ビット数です
     */
    public int qubitCount() {
        return Integer.numberOfTrailingZeros(amplitudes.length);
    }

    /**
     * i 番目の振幅を返します。
     *
     * @param i 計算基底インデックスです
     * @return 振幅です
     */
    public Complex amplitude(int i) {
        return amplitudes[i];
    }

    /**
     * 振幅配列のコピーを返します。
     *
     * @return 振幅配列です
     */
    public Complex[] getAmplitudes() {
        return amplitudes.clone();
    }

    /**
     * ノルム（Σ|a_i|^2 の平方根）を返します。
     *
     * @return ノルムです
     */
    public double norm() {
        double s = 0.0;
        for (Complex a : amplitudes) {
            s += a.getReal() * a.getReal() + a.getImaginary() * a.getImaginary();
        }
        return Math.sqrt(s);
    }

    /**
     * 内積 ⟨this|other⟩ を返します。
     *
     * @param other 相手の状態です
     * @return 内積です
     * @throws DimensionMismatchException 次元が一致しない場合に発生します
     */
    public Complex innerProduct(StateVector other) {
        if (other.dimension() != dimension()) {
            throw new DimensionMismatchException("状態ベクトルの次元が一致しません", dimension(),
                    other.dimension());
        }
        double re = 0.0;
        double im = 0.0;
        for (int i = 0; i < amplitudes.length; i++) {
            Complex a = amplitudes[i];
            Complex b = other.amplitudes[i];
            // conj(a) * b
            re += a.getReal() * b.getReal() + a.getImaginary() * b.getImaginary();
            im += a.getReal() * b.getImaginary() - a.getImaginary() * b.getReal();
        }
        return new Complex(re, im);
    }

    /**
     * EJML の列ベクトル（2^n × 1）に変換します。
     *
     * @return 新しい列ベクトルです
     */
    public ZMatrixRMaj toColumn() {
        ZMatrixRMaj column = new ZMatrixRMaj(amplitudes.length, 1);
        for (int i = 0; i < amplitudes.length; i++) {
            column.set(i, 0, amplitudes[i].getReal(), amplitudes[i].getImaginary());
        }
        return column;
    }

    /**
     * 密度行列 ρ = |ψ⟩⟨ψ| を返します。
     *
     * @return 2^n × 2^n の新しい行列です
     */
    public ZMatrixRMaj densityMatrix() {
        int dim = amplitudes.length;
        ZMatrixRMaj rho = new ZMatrixRMaj(dim, dim);
        for (int i = 0; i < dim; i++) {
            double ar = amplitudes[i].getReal();
            double ai = amplitudes[i].getImaginary();
            for (int j = 0; j < dim; j++) {
                double br = amplitudes[j].getReal();
                double bi = -amplitudes[j].getImaginary();
                rho.set(i, j, ar * br - ai * bi, ar * bi + ai * br);
            }
        }
        return rho;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StateVector)) {
            return false;
        }
        return Arrays.equals(amplitudes, ((StateVector) o).amplitudes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(amplitudes);
    }

    @Override
    public String toString() {
        return "StateVector" + Arrays.toString(amplitudes);
    }
}
