package io.github.yok.qst.core.state;

/**
 * 量子ビット番号と計算基底インデックスのビット位置の対応（ビッグエンディアン）を定めるクラスです。
 *
 * <p>
 * 量子ビット 0 が計算基底インデックスの最上位ビットに対応します。 n 量子ビットでインデックス {@code k} の量子ビット {@code q} の値は
 * {@code (k >> (n - 1 - q)) & 1} です。 テンソル積も量子ビット 0 を最も左の因子として構成します。
 * </p>
 *
 * <p>
 * 状態ベクトルの振幅の並び、Pauli 演算子のテンソル積、部分トレースはすべてこのクラスの規約に従います。
 * </p>
 */
public final class QubitOrdering {

    /**
     * 扱える量子ビット数の上限です（2^n が int に収まる範囲）。
     */
    public static final int MAX_QUBITS = 30;

    private QubitOrdering() {
    }

    /**
     * ヒルベルト空間の次元 2^n を返します。
     *
     * @param qubitCount 量子ビット数です（1 以上）
     * @return 次元です
     * @throws IllegalArgumentException qubitCount が範囲外の場合に発生します
     */
    public static int dimension(int qubitCount) {
        if (qubitCount < 1 || qubitCount > MAX_QUBITS) {
            throw new IllegalArgumentException(
                    "量子ビット数は 1 以上 " + MAX_QUBITS + " 以下を指定してください: " + qubitCount);
        }
        return 1 << qubitCount;
    }

    /**
     * 角度列の長さ 2^n - 1 を返します。
     *
     * @param qubitCount 量子ビット数です（1 以上）
     * @return 角度列の長さです
     */
    public static int parameterCount(int qubitCount) {
        return dimension(qubitCount) - 1;
    }

    /**
     * 計算基底インデックスにおける、指定量子ビットのビット値を返します。
     *
     * @param index 計算基底インデックスです
     * @param qubit 量子ビット番号です（0 が最上位ビット）
     * @param qubitCount 量子ビット数です
     * @return 0 または 1 です
     */
    public static int bitOf(int index, int qubit, int qubitCount) {
        return (index >> (qubitCount - 1 - qubit)) & 1;
    }

    /**
     * 指定量子ビット以外のビットを取り出したマスク値を返します。
     *
     * @param index 計算基底インデックスです
     * @param qubit 除外する量子ビット番号です
     * @param qubitCount 量子ビット数です
     * @return 指定量子ビットのビットを 0 にしたインデックスです
     */
    public static int withoutQubit(int index, int qubit, int qubitCount) {
        return index & ~(1 << (qubitCount - 1 - qubit));
    }

    /**
     * 角度列の長さから量子ビット数を逆算します。
     *
     * @param parameterCount 角度列の長さです
     * @return 量子ビット数です
     * @throws DimensionMismatchException 長さが 2^n - 1 の形でない場合に発生します
     */
    public static int qubitCountOf(int parameterCount) {
        int dim = parameterCount + 1;
        if (parameterCount < 1 || Integer.bitCount(dim) != 1) {
            throw new DimensionMismatchException("角度列の長さは 2^n - 1 である必要があります", -1,
                    parameterCount);
        }
        return Integer.numberOfTrailingZeros(dim);
    }
}
