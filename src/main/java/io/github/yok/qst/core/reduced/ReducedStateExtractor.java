package io.github.yok.qst.core.reduced;

import io.github.yok.qst.core.state.DimensionMismatchException;
import io.github.yok.qst.core.state.QubitOrdering;
import io.github.yok.qst.core.state.StateVector;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.commons.math3.complex.Complex;
import org.ejml.data.ZMatrixRMaj;

/**
 * 部分トレースで 1 量子ビットの縮約密度行列を取り出し、ブロッホベクトルを計算するクラスです。
 *
 * <p>
 * ビット位置は {@link QubitOrdering} の規約（量子ビット 0 が最上位ビット）に従います。
 * </p>
 */
public final class ReducedStateExtractor {

    /**
     * 全体の密度行列から対象量子ビット以外をトレースアウトします。
     *
     * <p>
     * 対象量子ビット以外のビットがすべて一致するインデックス対 (i, j) の要素を、対象ビットの値 (b_i, b_j) の位置に加算します。
     * </p>
     *
     * @param rho 2^n × 2^n の密度行列です
     * @param targetQubit 対象の量子ビット番号です（0 以上 n 未満）
     * @return 2×2 の縮約密度行列です
     * @throws IllegalArgumentException 行列が正方でない、次元が 2 のべき乗でない、または番号が範囲外の場合に発生します
     */
    public ReducedDensityMatrix partialTrace(ZMatrixRMaj rho, int targetQubit) {
        if (rho == null) {
            throw new IllegalArgumentException("rho は null 不可です");
        }
        int dim = rho.numRows;
        if (rho.numCols != dim || dim < 2 || Integer.bitCount(dim) != 1) {
            throw new DimensionMismatchException("密度行列は 2^n × 2^n である必要があります", dim, rho.numCols);
        }
        int n = Integer.numberOfTrailingZeros(dim);
        if (targetQubit < 0 || targetQubit >= n) {
            throw new IllegalArgumentException(
                    "targetQubit は 0 以上 " + n + " 未満を指定してください: " + targetQubit);
        }

        double[][] re = new double[2][2];
        double[][] im = new double[2][2];
        for (int i = 0; i < dim; i++) {
            int restI = QubitOrdering.withoutQubit(i, targetQubit, n);
            int bi = QubitOrdering.bitOf(i, targetQubit, n);
            for (int j = 0; j < dim; j++) {
                if (QubitOrdering.withoutQubit(j, targetQubit, n) != restI) {
                    continue;
                }
                int bj = QubitOrdering.bitOf(j, targetQubit, n);
                re[bi][bj] += rho.getReal(i, j);
                im[bi][bj] += rho.getImag(i, j);
            }
        }
        return new ReducedDensityMatrix(new Complex(re[0][0], im[0][0]),
                new Complex(re[0][1], im[0][1]), new Complex(re[1][0], im[1][0]),
                new Complex(re[1][1], im[1][1]));
    }

    /**
     * 縮約密度行列のブロッホベクトル (2Re ρ01, 2Im ρ10, Re(ρ00 - ρ11)) を返します。
     *
     * @param rho 2×2 の縮約密度行列です
     * @return ブロッホベクトルです
     */
    public BlochVector blochVector(ReducedDensityMatrix rho) {
        if (rho == null) {
            throw new IllegalArgumentException("rho は null 不可です");
        }
        double x = 2.0 * rho.getRho01().getReal();
        double y = 2.0 * rho.getRho10().getImaginary();
        double z = rho.getRho00().getReal() - rho.getRho11().getReal();
        return new BlochVector(x, y, z);
    }

    /**
     * 純粋状態のすべての量子ビットについて縮約状態を返します。
     *
     * @param state 状態です
     * @return 量子ビット順の縮約状態の不変リストです
     */
    public List<QubitReducedState> reducedStates(StateVector state) {
        if (state == null) {
            throw new IllegalArgumentException("state は null 不可です");
        }
        ZMatrixRMaj rho = state.densityMatrix();
        int n = state.qubitCount();
        List<QubitReducedState> states = new ArrayList<>(n);
        for (int q = 0; q < n; q++) {
            ReducedDensityMatrix reduced = partialTrace(rho, q);
            states.add(new QubitReducedState(q, reduced, blochVector(reduced)));
        }
        return Collections.unmodifiableList(states);
    }

    /**
     * 量子ビット数を確認したうえで縮約状態を返します。
     *
     * @param state 状態です
     * @param qubitCount 期待する量子ビット数です
     * @return 量子ビット順の縮約状態の不変リストです
     * @throws DimensionMismatchException 量子ビット数が一致しない場合に発生します
     */
    public List<QubitReducedState> reducedStates(StateVector state, int qubitCount) {
        if (state != null && state.qubitCount() != qubitCount) {
            throw new DimensionMismatchException("状態の量子ビット数が一致しません", qubitCount,
                    state.qubitCount());
        }
        return reducedStates(state);
    }
}
