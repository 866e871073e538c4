package io.github.yok.qst.core.reduced;

import lombok.Value;
import org.apache.commons.math3.complex.Complex;

/**
 * 1 量子ビットの縮約密度行列（2×2、エルミート、トレース 1）です。
 *
 * <p>
 * 添字は対象量子ビットのビット値（0, 1）です。
 * </p>
 */
@Value
public class ReducedDensityMatrix {

    Complex rho00;

    Complex rho01;

    Complex rho10;

    Complex rho11;

    /**
     * 要素を返します。
     *
     * @param row 行（0 または 1）です
     * @param col 列（0 または 1）です
     * @return 要素です
     */
    public Complex get(int row, int col) {
        if (row == 0) {
            return col == 0 ? rho00 : rho01;
        }
        return col == 0 ? rho10 : rho11;
    }

    /**
     * トレースを返します。
     *
     * @return トレースです
     */
    public Complex trace() {
        return rho00.add(rho11);
    }

    /**
     * 純度 Tr(ρ^2) を返します。
     *
     * @return 純度です
     */
    public double purity() {
        return rho00.multiply(rho00).add(rho01.multiply(rho10)).add(rho10.multiply(rho01))
                .add(rho11.multiply(rho11)).getReal();
    }
}
