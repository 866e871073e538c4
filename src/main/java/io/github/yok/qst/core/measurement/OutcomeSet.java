package io.github.yok.qst.core.measurement;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import io.github.yok.qst.core.linearalgebra.BasisSetting;
import java.util.Map;
import java.util.Set;

/**
 * 基底設定ごとの ±1 測定結果列を保持するクラスです。
 *
 * <p>
 * 挿入順を保持し、+1 / -1 の件数は生成時に数えておきます。 すべて I の基底設定は含められません。
 * </p>
 */
public final class OutcomeSet {

    /**
     * 基底設定ごとの測定結果列です。
     */
    private final ImmutableMap<BasisSetting, int[]> outcomes;

    /**
     * 基底設定ごとの +1 の件数です。
     */
    private final ImmutableMap<BasisSetting, Integer> plusCounts;

    /**
     * 測定結果の集合を生成します。
     *
     * @param outcomes 基底設定ごとの測定結果列です（要素は +1 または -1）
     * @throws IllegalArgumentException すべて I の設定、または ±1 以外の値を含む場合に発生します
     */
    public OutcomeSet(Map<BasisSetting, int[]> outcomes) {
        Preconditions.checkArgument(outcomes != null, "outcomes は null 不可です");
        ImmutableMap.Builder<BasisSetting, int[]> copy = ImmutableMap.builder();
        ImmutableMap.Builder<BasisSetting, Integer> plus = ImmutableMap.builder();
        for (Map.Entry<BasisSetting, int[]> e : outcomes.entrySet()) {
            BasisSetting setting = e.getKey();
            int[] values = e.getValue();
            Preconditions.checkArgument(!setting.isIdentity(), "すべて I の基底設定は含められません: %s", setting);
            Preconditions.checkArgument(values != null, "測定結果列が null です: %s", setting);
            int nPlus = 0;
            for (int v : values) {
                if (v == 1) {
                    nPlus++;
                } else if (v != -1) {
                    throw new IllegalArgumentException(
                            "測定結果は +1 または -1 である必要があります: setting=" + setting + ", value=" + v);
                }
            }
            copy.put(setting, values.clone());
            plus.put(setting, nPlus);
        }
        this.outcomes = copy.build();
        this.plusCounts = plus.build();
    }

    /**
     * 測定済みの基底設定を返します。
     *
     * @return 挿入順の基底設定です
     */
    public Set<BasisSetting> settings() {
        return outcomes.keySet();
    }

    /**
     * 基底設定を含むかどうかを返します。
     *
     * @param setting 基底設定です
     * @return 含む場合 true です
     */
    public boolean contains(BasisSetting setting) {
        return outcomes.containsKey(setting);
    }

    /**
     * 基底設定の測定結果列のコピーを返します。
     *
     * @param setting 基底設定です
     * @return 測定結果列です
     */
    public int[] outcomes(BasisSetting setting) {
        return require(setting).clone();
    }

    /**
     * ショット数を返します。
     *
     * @param setting 基底設定です
     * @return ショット数です
     */
    public int shots(BasisSetting setting) {
        return require(setting).length;
    }

    /**
     * +1 の件数 n+ を返します。
     *
     * @param setting 基底設定です
     * @return n+ です
     */
    public int plusCount(BasisSetting setting) {
        require(setting);
        return plusCounts.get(setting);
    }

    /**
     * -1 の件数 n- を返します。
     *
     * @param setting 基底設定です
     * @return n- です
     */
    public int minusCount(BasisSetting setting) {
        return shots(setting) - plusCount(setting);
    }

    /**
     * 経験的な期待値 (n+ - n-) / shots を返します。
     *
     * @param setting 基底設定です
     * @return 期待値です（ショット数 0 の場合は 0）
     */
    public double empiricalExpectation(BasisSetting setting) {
        int shots = shots(setting);
        if (shots == 0) {
            return 0.0;
        }
        return (double) (plusCount(setting) - minusCount(setting)) / shots;
    }

    /**
     * 基底設定の数を返します。
     *
     * @return 基底設定の数です
     */
    public int size() {
        return outcomes.size();
    }

    private int[] require(BasisSetting setting) {
        int[] values = outcomes.get(setting);
        if (values == null) {
            throw new IllegalArgumentException("測定結果がありません: " + setting);
        }
        return values;
    }
}
