package io.github.yok.qst.core.linearalgebra;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 各量子ビットに割り当てる Pauli 軸の列（測定基底の設定）です。
 *
 * <p>
 * 要素 0 が量子ビット 0 に対応します。 すべて I の設定は情報を持たないため測定対象から除外されます。
 * </p>
 */
@Getter
@EqualsAndHashCode
public final class BasisSetting {

    /**
     * 量子ビットごとの Pauli 演算子です。
     */
    private final ImmutableList<Pauli> paulis;

    private BasisSetting(List<Pauli> paulis) {
        this.paulis = ImmutableList.copyOf(paulis);
    }

    /**
     * Pauli 演算子の列から設定を生成します。
     *
     * @param paulis Pauli 演算子です（1 個以上）
     * @return 基底設定です
     */
    public static BasisSetting of(Pauli... paulis) {
        Preconditions.checkArgument(paulis != null && paulis.length > 0, "基底設定は 1 量子ビット以上が必要です");
        List<Pauli> list = new ArrayList<>(paulis.length);
        Collections.addAll(list, paulis);
        return new BasisSetting(list);
    }

    /**
     * "XZ" のような文字列から設定を生成します。
     *
     * @param label 記号列です
     * @return 基底設定です
     * @throws IllegalArgumentException 空文字列または未知の記号を含む場合に発生します
     */
    public static BasisSetting parse(String label) {
        Preconditions.checkArgument(label != null && !label.isEmpty(), "基底設定の文字列が空です");
        List<Pauli> list = new ArrayList<>(label.length());
        for (int i = 0; i < label.length(); i++) {
            list.add(Pauli.fromSymbol(label.charAt(i)));
        }
        return new BasisSetting(list);
    }

    /**
     * すべて I を除いた 4^n - 1 個の基底設定を列挙します。
     *
     * <p>
     * I, X, Y, Z を 0..3 とみなした 4 進数の昇順（量子ビット 0 が最上位桁）で並びます。
     * </p>
     *
     * @param qubitCount 量子ビット数です（1 以上）
     * @return 基底設定の不変リストです
     */
    public static List<BasisSetting> nonIdentity(int qubitCount) {
        Preconditions.checkArgument(qubitCount >= 1 && qubitCount <= 15, "量子ビット数が範囲外です: %s",
                qubitCount);
        Pauli[] symbols = Pauli.values();
        int total = 1 << (2 * qubitCount);
        ImmutableList.Builder<BasisSetting> settings = ImmutableList.builder();
        for (int code = 1; code < total; code++) {
            Pauli[] paulis = new Pauli[qubitCount];
            int rest = code;
            for (int q = qubitCount - 1; q >= 0; q--) {
                paulis[q] = symbols[rest & 3];
                rest >>= 2;
            }
            settings.add(of(paulis));
        }
        return settings.build();
    }

    /**
     * 量子ビット数を返します。
     *
     * @return 量子ビット数です
     */
    public int qubitCount() {
        return paulis.size();
    }

    /**
     * 指定量子ビットの Pauli 演算子を返します。
     *
     * @param qubit 量子ビット番号です
     * @return Pauli 演算子です
     */
    public Pauli get(int qubit) {
        return paulis.get(qubit);
    }

    /**
     * すべて I かどうかを返します。
     *
     * @return すべて I の場合 true です
     */
    public boolean isIdentity() {
        for (Pauli p : paulis) {
            if (!p.isIdentity()) {
                return false;
            }
        }
        return true;
    }

    /**
     * "XZ" のような記号列を返します。
     *
     * @return 記号列です
     */
    public String label() {
        StringBuilder sb = new StringBuilder(paulis.size());
        for (Pauli p : paulis) {
            sb.append(p.name());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return label();
    }
}
