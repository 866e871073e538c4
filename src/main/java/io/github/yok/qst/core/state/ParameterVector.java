package io.github.yok.qst.core.state;

import java.util.Arrays;
import java.util.Locale;

/**
 * 純粋状態を表す超球座標の角度列（θ 列と φ 列）を保持する値クラスです。
 *
 * <p>
 * n 量子ビットでは θ, φ ともに長さ 2^n - 1 です。 通常 θ は [0, π]、φ は [0, 2π) の範囲を取ります。
 * 配列は防御的にコピーされるため、インスタンスは不変です。
 * </p>
 */
public final class ParameterVector {

    /**
     * θ の配列です。
     */
    private final double[] thetas;

    /**
     * φ の配列です。
     */
    private final double[] phis;

    /**
     * 角度列を生成します。
     *
     * @param thetas θ の配列です
     * @param phis φ の配列です
     * @throws IllegalArgumentException null、または有限値でない要素を含む場合に発生します
     * @throws DimensionMismatchException 長さが一致しない、または 2^n - 1 でない場合に発生します
     */
    public ParameterVector(double[] thetas, double[] phis) {
        if (thetas == null || phis == null) {
            throw new IllegalArgumentException("thetas/phis は null 不可です");
        }
        if (thetas.length != phis.length) {
            throw new DimensionMismatchException("thetas と phis の長さが一致しません", thetas.length,
                    phis.length);
        }
        QubitOrdering.qubitCountOf(thetas.length);
        ensureFinite("thetas", thetas);
        ensureFinite("phis", phis);
        this.thetas = thetas.clone();
        this.phis = phis.clone();
    }

    /**
     * 量子ビット数を指定して角度列を生成します。
     *
     * @param qubitCount 量子ビット数です
     * @param thetas θ の配列です
     * @param phis φ の配列です
     * @return 角度列です
     * @throws DimensionMismatchException 長さが 2^qubitCount - 1 でない場合に発生します
     */
    public static ParameterVector of(int qubitCount, double[] thetas, double[] phis) {
        int expected = QubitOrdering.parameterCount(qubitCount);
        if (thetas == null || phis == null) {
            throw new IllegalArgumentException("thetas/phis は null 不可です");
        }
        if (thetas.length != expected) {
            throw new DimensionMismatchException("thetas の長さが 2^n - 1 と一致しません（n=" + qubitCount + "）",
                    expected, thetas.length);
        }
        if (phis.length != expected) {
            throw new DimensionMismatchException("phis の長さが 2^n - 1 と一致しません（n=" + qubitCount + "）",
                    expected, phis.length);
        }
        return new ParameterVector(thetas, phis);
    }

    /**
     * 最適化用の平坦な点 [θ_0..θ_{m-1}, φ_0..φ_{m-1}] から角度列を復元します。
     *
     * @param point 長さ 2m の配列です
     * @return 角度列です
     * @throws DimensionMismatchException 長さが偶数でない場合に発生します
     */
    public static ParameterVector fromPoint(double[] point) {
        if (point == null || point.length % 2 != 0) {
            throw new DimensionMismatchException("点の長さは偶数である必要があります", -1,
                    point == null ? 0 : point.length);
        }
        int m = point.length / 2;
        return new ParameterVector(Arrays.copyOfRange(point, 0, m),
                Arrays.copyOfRange(point, m, point.length));
    }

    /**
     * 最適化用の平坦な点 [θ..., φ...] を返します。
     *
     * @return 長さ 2m の新しい配列です
     */
    public double[] toPoint() {
        double[] point = new double[thetas.length * 2];
        System.arraycopy(thetas, 0, point, 0, thetas.length);
        System.arraycopy(phis, 0, point, thetas.length, phis.length);
        return point;
    }

    /**
     * θ 配列のコピーを返します。
     *
     * @return θ 配列です
     */
    public double[] getThetas() {
        return thetas.clone();
    }

    /**
     * φ 配列のコピーを返します。
     *
     * @return φ 配列です
     */
    public double[] getPhis() {
        return phis.clone();
    }

    /**
     * i 番目の θ を返します。
     *
     * @param i インデックスです
     * @return θ_i です
     */
    public double theta(int i) {
        return thetas[i];
    }

    /**
     * i 番目の φ を返します。
     *
     * @param i インデックスです
     * @return φ_i です
     */
    public double phi(int i) {
        return phis[i];
    }

    /**
     * 角度列の長さ（2^n - 1）を返します。
     *
     * @return 長さです
     */
    public int size() {
        return thetas.length;
    }

    /**
     * 量子ビット数を返します。
     *
     * @return 量子ビット数です
     */
    public int qubitCount() {
        return QubitOrdering.qubitCountOf(thetas.length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ParameterVector)) {
            return false;
        }
        ParameterVector other = (ParameterVector) o;
        return Arrays.equals(thetas, other.thetas) && Arrays.equals(phis, other.phis);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(thetas) + Arrays.hashCode(phis);
    }

    @Override
    public String toString() {
        return "ParameterVector(thetas=" + format(thetas) + ", phis=" + format(phis) + ")";
    }

    private static String format(double[] values) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < values.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(String.format(Locale.ROOT, "%.5f", values[i]));
        }
        return sb.append(']').toString();
    }

    private static void ensureFinite(String name, double[] values) {
        for (int i = 0; i < values.length; i++) {
            if (!Double.isFinite(values[i])) {
                throw new IllegalArgumentException(
                        name + " は有限値を指定してください: index=" + i + ", value=" + values[i]);
            }
        }
    }
}
