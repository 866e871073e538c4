package io.github.yok.qst.core.reduced;

import lombok.Value;

/**
 * 1 量子ビット状態のブロッホベクトル (x, y, z) です。
 */
@Value
public class BlochVector {

    double x;

    double y;

    double z;

    /**
     * ベクトルの長さを返します（純粋状態で 1、混合状態で 1 未満）。
     *
     * @return 長さです
     */
    public double norm() {
        return Math.sqrt(x * x + y * y + z * z);
    }
}
