package io.github.yok.boson.core.realization;

import io.github.yok.boson.core.algebra.BosonicOperator;

/**
 * 演算子を打ち切りフォック基底上の有限行列として実現するインタフェースです。
 *
 * <p>
 * 行列の格納方式や数値ライブラリを差し替えやすくするための境界です。
 * </p>
 */
public interface OperatorRealizer {

    /**
     * 演算子の行列表現を構築します。
     *
     * @param operator 演算子です（ラダー代数または直交位相代数）
     * @param basis 打ち切りフォック基底です
     * @return 行列表現です
     * @throws IllegalArgumentException 演算子のモード番号が基底のモード数以上の場合に発生します
     */
    SparseRealization realize(BosonicOperator operator, FockBasis basis);
}
