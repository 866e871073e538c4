package io.github.yok.qst.core.model;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import io.github.yok.qst.core.linearalgebra.BasisSetting;
import io.github.yok.qst.core.linearalgebra.Pauli;
import io.github.yok.qst.core.state.QubitOrdering;
import java.util.EnumMap;
import java.util.Map;
import lombok.Value;

/**
 * 1 回のトモグラフィ実行の量子ビット数と、軸（X/Y/Z）ごとのショット数を保持するクラスです。
 */
@Value
public class QubitConfig {

    /**
     * 量子ビット数です（1 以上）。
     */
    int qubitCount;

    /**
     * 軸ごとのショット数です（キーは X, Y, Z）。
     */
    ImmutableMap<Pauli, Integer> shotsPerAxis;

    /**
     * 設定を生成します。
     *
     * @param qubitCount 量子ビット数です（1 以上）
     * @param shotsPerAxis 軸ごとのショット数です（X, Y, Z すべて 1 以上）
     * @throws IllegalArgumentException 値が不正な場合に発生します
     */
    public QubitConfig(int qubitCount, Map<Pauli, Integer> shotsPerAxis) {
        Preconditions.checkArgument(qubitCount >= 1, "量子ビット数は 1 以上を指定してください: %s", qubitCount);
        QubitOrdering.dimension(qubitCount);
        Preconditions.checkArgument(shotsPerAxis != null, "shotsPerAxis は null 不可です");
        EnumMap<Pauli, Integer> shots = new EnumMap<>(Pauli.class);
        for (Pauli axis : new Pauli[] {Pauli.X, Pauli.Y, Pauli.Z}) {
            Integer n = shotsPerAxis.get(axis);
            Preconditions.checkArgument(n != null && n >= 1, "%s 軸のショット数は 1 以上を指定してください: %s",
                    axis, n);
            shots.put(axis, n);
        }
        Preconditions.checkArgument(!shotsPerAxis.containsKey(Pauli.I), "I 軸のショット数は指定できません");
        this.qubitCount = qubitCount;
        this.shotsPerAxis = Maps.immutableEnumMap(shots);
    }

    /**
     * 軸ごとのショット数を指定して設定を生成します。
     *
     * @param qubitCount 量子ビット数です
     * @param shotsX X 軸のショット数です
     * @param shotsY Y 軸のショット数です
     * @param shotsZ Z 軸のショット数です
     * @return 設定です
     */
    public static QubitConfig of(int qubitCount, int shotsX, int shotsY, int shotsZ) {
        Map<Pauli, Integer> shots = new EnumMap<>(Pauli.class);
        shots.put(Pauli.X, shotsX);
        shots.put(Pauli.Y, shotsY);
        shots.put(Pauli.Z, shotsZ);
        return new QubitConfig(qubitCount, shots);
    }

    /**
     * 軸のショット数を返します。
     *
     * @param axis 軸（X, Y, Z）です
     * @return ショット数です
     * @throws IllegalArgumentException I が指定された場合に発生します
     */
    public int shotsFor(Pauli axis) {
        Preconditions.checkArgument(axis != null && !axis.isIdentity(), "ショット数は X/Y/Z 軸にのみ定義されます: %s",
                axis);
        return shotsPerAxis.get(axis);
    }

    /**
     * 基底設定に割り当てるショット数（設定に現れる軸のショット数の最小値）を返します。
     *
     * @param setting 基底設定です（すべて I は不可）
     * @return ショット数です
     * @throws IllegalArgumentException 量子ビット数が一致しない、またはすべて I の場合に発生します
     */
    public int shotsFor(BasisSetting setting) {
        Preconditions.checkArgument(setting != null, "setting は null 不可です");
        Preconditions.checkArgument(setting.qubitCount() == qubitCount,
                "基底設定の量子ビット数が一致しません: %s vs %s", setting.qubitCount(), qubitCount);
        int shots = Integer.MAX_VALUE;
        for (Pauli p : setting.getPaulis()) {
            if (!p.isIdentity()) {
                shots = Math.min(shots, shotsPerAxis.get(p));
            }
        }
        Preconditions.checkArgument(shots != Integer.MAX_VALUE, "すべて I の基底設定は測定できません");
        return shots;
    }

    /**
     * ヒルベルト空間の次元 2^n を返します。
     *
     * @return 次元です
     */
    public int dimension() {
        return QubitOrdering.dimension(qubitCount);
    }

    /**
     * 角度列の長さ 2^n - 1 を返します。
     *
     * @return 長さです
     */
    public int parameterCount() {
        return QubitOrdering.parameterCount(qubitCount);
    }
}
