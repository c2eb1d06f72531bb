package io.github.yok.boson.core.algebra;

import static com.google.common.base.Preconditions.checkArgument;
import org.apache.commons.math3.complex.Complex;

/**
 * 演算子が属する交換関係の代数を表す列挙型です。
 *
 * <p>
 * 正規順序化のアルゴリズムは両代数で共通であり、代数ごとに異なるのは 「左側に置く種類（leading）」「右側に置く種類（trailing）」と、 同一モードの隣接ペアを入れ替えたときに生じる縮約項の係数だけです。
 * </p>
 *
 * <ul>
 * <li>{@link #LADDER}: {@code [b_i, b_i†] = 1}</li>
 * <li>{@link #QUADRATURE}: {@code [q_i, p_i] = iħ}</li>
 * </ul>
 */
public enum Algebra {

    /**
     * 生成・消滅演算子（ラダー演算子）の代数です。
     */
    LADDER,

    /**
     * 位置・運動量演算子（直交位相演算子）の代数です。
     */
    QUADRATURE;

    /**
     * 正規順序で左側に置く種類を返します（生成または位置）。
     *
     * @return 左側の種類です
     */
    public FactorKind leadingKind() {
        return this == LADDER ? FactorKind.RAISE : FactorKind.POSITION;
    }

    /**
     * 正規順序で右側に置く種類を返します（消滅または運動量）。
     *
     * @return 右側の種類です
     */
    public FactorKind trailingKind() {
        return this == LADDER ? FactorKind.LOWER : FactorKind.MOMENTUM;
    }

    /**
     * 同一モードの交換子 {@code [trailing_i, leading_i]} の値を返します。
     *
     * <p>
     * 隣接する {@code trailing_i leading_i} を {@code leading_i trailing_i} に入れ替えるとき、 ペアを取り除いた短い項にこの値を掛けたものが加わります。
     * ラダー代数では {@code [b, b†] = 1}、直交位相代数では {@code [p, q] = -iħ} です。
     * </p>
     *
     * @param hbar ħ（正の有限値。ラダー代数では参照しません）
     * @return 交換子の値です
     * @throws IllegalArgumentException hbar が正の有限値でない場合に発生します
     */
    public Complex contraction(double hbar) {
        checkHbar(hbar);
        if (this == LADDER) {
            return Complex.ONE;
        }
        return new Complex(0.0, -hbar);
    }

    /**
     * ħ が正の有限値であることを検証します。
     *
     * @param hbar ħ です
     * @return 検証済みの ħ です
     * @throws IllegalArgumentException hbar が正の有限値でない場合に発生します
     */
    public static double checkHbar(double hbar) {
        checkArgument(Double.isFinite(hbar) && hbar > 0.0, "hbar は正の有限値が必要です: %s", hbar);
        return hbar;
    }
}
