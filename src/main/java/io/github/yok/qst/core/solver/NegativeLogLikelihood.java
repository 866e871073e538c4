package io.github.yok.qst.core.solver;

import io.github.yok.qst.core.linearalgebra.BasisSetting;
import io.github.yok.qst.core.linearalgebra.PauliBasisAlgebra;
import io.github.yok.qst.core.measurement.OutcomeSet;
import io.github.yok.qst.core.model.QubitConfig;
import io.github.yok.qst.core.state.DimensionMismatchException;
import io.github.yok.qst.core.state.ParameterVector;
import io.github.yok.qst.core.state.StateParameterizer;
import io.github.yok.qst.core.state.StateVector;
import java.util.List;
import org.apache.commons.math3.analysis.MultivariateFunction;
import org.ejml.data.ZMatrixRMaj;

/**
 * 角度列に対する負の対数尤度を計算する目的関数です。
 *
 * <p>
 * すべて I を除く各基底設定について
 * {@code -(n+ log(p + ε) + n- log(1 - p + ε))} を加算します（ε = 1e-10）。 射影子と件数は生成時に計算し、
 * 評価ごとに共有状態を書き換えないため、複数スレッドから同時に評価できます。
 * </p>
 */
public final class NegativeLogLikelihood implements MultivariateFunction {

    /**
     * log(0) を避けるための正則化項です。
     */
    public static final double EPSILON = 1e-10;

    private final StateParameterizer parameterizer;

    private final PauliBasisAlgebra algebra;

    private final int parameterCount;

    private final ZMatrixRMaj[] projectors;

    private final int[] plusCounts;

    private final int[] minusCounts;

    /**
     * 目的関数を生成します。
     *
     * @param parameterizer 角度列から状態を生成するコンポーネントです
     * @param algebra 射影子と確率を計算するコンポーネントです
     * @param outcomes 観測された測定結果です
     * @param config 量子ビット数の設定です
     * @throws IllegalArgumentException 測定結果に欠けている基底設定がある場合に発生します
     */
    public NegativeLogLikelihood(StateParameterizer parameterizer, PauliBasisAlgebra algebra,
            OutcomeSet outcomes, QubitConfig config) {
        if (parameterizer == null || algebra == null || outcomes == null || config == null) {
            throw new IllegalArgumentException("引数は null 不可です");
        }
        this.parameterizer = parameterizer;
        this.algebra = algebra;
        this.parameterCount = config.parameterCount();

        List<BasisSetting> settings = BasisSetting.nonIdentity(config.getQubitCount());
        this.projectors = new ZMatrixRMaj[settings.size()];
        this.plusCounts = new int[settings.size()];
        this.minusCounts = new int[settings.size()];
        for (int k = 0; k < settings.size(); k++) {
            BasisSetting setting = settings.get(k);
            if (!outcomes.contains(setting)) {
                throw new IllegalArgumentException("基底設定 " + setting + " の測定結果がありません");
            }
            projectors[k] = algebra.projectorPlus(setting);
            plusCounts[k] = outcomes.plusCount(setting);
            minusCounts[k] = outcomes.minusCount(setting);
        }
    }

    /**
     * 角度列に対する負の対数尤度を返します。
     *
     * @param parameters 角度列です
     * @return 負の対数尤度です
     */
    public double value(ParameterVector parameters) {
        if (parameters.size() != parameterCount) {
            throw new DimensionMismatchException("角度列の長さが一致しません", parameterCount,
                    parameters.size());
        }
        StateVector state = parameterizer.generateState(parameters);
        ZMatrixRMaj column = state.toColumn();

        double total = 0.0;
        for (int k = 0; k < projectors.length; k++) {
            double p = algebra.probabilityPlus(projectors[k], column);
            total -= plusCounts[k] * Math.log(p + EPSILON)
                    + minusCounts[k] * Math.log(1.0 - p + EPSILON);
        }
        return total;
    }

    /**
     * 平坦な点 [θ..., φ...] に対する負の対数尤度を返します。
     *
     * @param point 長さ 2(2^n - 1) の点です
     * @return 負の対数尤度です
     */
    @Override
    public double value(double[] point) {
        return value(ParameterVector.fromPoint(point));
    }

    /**
     * 角度列の長さ 2^n - 1 を返します。
     *
     * @return 長さです
     */
    public int getParameterCount() {
        return parameterCount;
    }
}
