package io.github.yok.qst.core.linearalgebra;

import org.ejml.data.ZMatrixRMaj;

/**
 * 1 量子ビットの Pauli 演算子 I, X, Y, Z です。
 */
public enum Pauli {

    /**
     * 恒等演算子です。
     */
    I(new double[] {1, 0, 0, 0, 0, 0, 1, 0}),

    /**
     * σx です。
     */
    X(new double[] {0, 0, 1, 0, 1, 0, 0, 0}),

    /**
     * σy です。
     */
    Y(new double[] {0, 0, 0, -1, 0, 1, 0, 0}),

    /**
     * σz です。
     */
    Z(new double[] {1, 0, 0, 0, 0, 0, -1, 0});

    /**
     * 2×2 行列の行優先（実部, 虚部 交互）データです。
     */
    private final double[] data;

    Pauli(double[] data) {
        this.data = data;
    }

    /**
     * 2×2 の複素行列を返します。
     *
     * @return 新しい行列です
     */
    public ZMatrixRMaj matrix() {
        return new ZMatrixRMaj(2, 2, true, data.clone());
    }

    /**
     * 恒等演算子かどうかを返します。
     *
     * @return I の場合 true です
     */
    public boolean isIdentity() {
        return this == I;
    }

    /**
     * 記号 1 文字から Pauli 演算子を返します。
     *
     * @param symbol 'I', 'X', 'Y', 'Z'（大文字小文字は区別しません）
     * @return Pauli 演算子です
     * @throws IllegalArgumentException 未知の記号の場合に発生します
     */
    public static Pauli fromSymbol(char symbol) {
        switch (Character.toUpperCase(symbol)) {
            case 'I':
                return I;
            case 'X':
                return X;
            case 'Y':
                return Y;
            case 'Z':
                return Z;
            default:
                throw new IllegalArgumentException("未知の Pauli 記号です: " + symbol);
        }
    }
}
