package io.github.yok.qst.core.state;

/**
 * 角度列から正規化済みの純粋状態を生成するインタフェースです。
 */
public interface StateParameterizer {

    /**
     * 角度列から状態ベクトルを生成します。
     *
     * @param parameters 角度列です
     * @return ノルム 1 の状態ベクトルです
     */
    StateVector generateState(ParameterVector parameters);

    /**
     * 量子ビット数と θ, φ の配列から状態ベクトルを生成します。
     *
     * @param qubitCount 量子ビット数です
     * @param thetas θ の配列です（長さ 2^n - 1）
     * @param phis φ の配列です（長さ 2^n - 1）
     * @return ノルム 1 の状態ベクトルです
     * @throws DimensionMismatchException 配列長が 2^n - 1 でない場合に発生します
     */
    default StateVector generateState(int qubitCount, double[] thetas, double[] phis) {
        return generateState(ParameterVector.of(qubitCount, thetas, phis));
    }
}
