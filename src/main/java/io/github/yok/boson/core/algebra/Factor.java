package io.github.yok.boson.core.algebra;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 単一モードに作用する演算子因子（モード番号と種類の組）です。
 *
 * <p>
 * 不変オブジェクトであり、モード番号と種類による構造的な等価性を持ちます。
 * </p>
 */
@Getter
@EqualsAndHashCode
public final class Factor {

    /**
     * モード番号です（0 以上）。
     */
    private final int mode;

    /**
     * 因子の種類です。
     */
    private final FactorKind kind;

    /**
     * 因子を生成します。
     *
     * @param mode モード番号です（0 以上）
     * @param kind 因子の種類です（null 不可）
     * @throws IllegalArgumentException mode が負の場合に発生します
     * @throws NullPointerException kind が null の場合に発生します
     */
    public Factor(int mode, FactorKind kind) {
        checkArgument(mode >= 0, "mode は 0 以上が必要です: %s", mode);
        this.mode = mode;
        this.kind = checkNotNull(kind, "kind は null 不可です");
    }

    public static Factor raise(int mode) {
        return new Factor(mode, FactorKind.RAISE);
    }

    public static Factor lower(int mode) {
        return new Factor(mode, FactorKind.LOWER);
    }

    public static Factor position(int mode) {
        return new Factor(mode, FactorKind.POSITION);
    }

    public static Factor momentum(int mode) {
        return new Factor(mode, FactorKind.MOMENTUM);
    }

    /**
     * エルミート共役の因子を返します。
     *
     * @return 共役因子です
     */
    public Factor adjoint() {
        FactorKind adjointKind = kind.adjoint();
        return adjointKind == kind ? this : new Factor(mode, adjointKind);
    }

    /**
     * 正規順序の観点で、この因子を {@code right} の左に置いてよいかを返します。
     *
     * <p>
     * 種類の順位が小さい方が左、同じ順位ではモード番号が小さい方（同じなら可）が左です。
     * </p>
     *
     * @param right 右隣の因子です
     * @return 入れ替えが不要な場合は true です
     */
    public boolean precedesOrEquals(Factor right) {
        int leftRank = kind.rank();
        int rightRank = right.kind.rank();
        if (leftRank != rightRank) {
            return leftRank < rightRank;
        }
        return mode <= right.mode;
    }

    @Override
    public String toString() {
        return kind.format(mode);
    }
}
