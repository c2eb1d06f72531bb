package io.github.yok.boson.core.realization;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * モードごとに占有数 {@code 0..N-1} で打ち切ったフォック基底（テンソル積）を表すクラスです。
 *
 * <p>
 * 基底状態 {@code |n_0, n_1, ..., n_{M-1}⟩} のインデックスは基数 N の混合基数表現で、 モード 0 を最上位桁とします。
 * </p>
 *
 * <pre>
 *   index = n_0 * N^{M-1} + n_1 * N^{M-2} + ... + n_{M-1}
 * </pre>
 */
public final class FockBasis {

    /**
     * モードあたりの打ち切り次元 N です（1 以上）。
     */
    private final int truncation;

    /**
     * モード数 M です（1 以上）。
     */
    private final int modeCount;

    /**
     * 基底の次元 N^M です。
     */
    private final int dimension;

    /**
     * フォック基底を生成します。
     *
     * @param truncation モードあたりの打ち切り次元 N です（1 以上）
     * @param modeCount モード数 M です（1 以上）
     * @throws IllegalArgumentException 引数が範囲外、または N^M が int に収まらない場合に発生します
     */
    public FockBasis(int truncation, int modeCount) {
        checkArgument(truncation >= 1, "truncation は 1 以上が必要です: %s", truncation);
        checkArgument(modeCount >= 1, "modeCount は 1 以上が必要です: %s", modeCount);
        this.truncation = truncation;
        this.modeCount = modeCount;
        this.dimension = power(truncation, modeCount);
    }

    public int truncation() {
        return truncation;
    }

    public int modeCount() {
        return modeCount;
    }

    /**
     * 基底の次元 N^M を返します。
     *
     * @return 次元です
     */
    public int dimension() {
        return dimension;
    }

    /**
     * 占有数の配列を基底インデックスに変換します。
     *
     * @param occupations モードごとの占有数です（長さ M、各要素 0 以上 N 未満）
     * @return 基底インデックスです
     * @throws IllegalArgumentException 長さや占有数が範囲外の場合に発生します
     */
    public int indexOf(int[] occupations) {
        checkNotNull(occupations, "occupations は null 不可です");
        checkArgument(occupations.length == modeCount, "occupations の長さが modeCount と一致しません: %s vs %s",
                occupations.length, modeCount);
        int index = 0;
        for (int n : occupations) {
            checkArgument(n >= 0 && n < truncation, "占有数が範囲外です: %s", n);
            index = index * truncation + n;
        }
        return index;
    }

    /**
     * 基底インデックスを占有数の配列に変換します。
     *
     * @param index 基底インデックスです（0 以上 dimension 未満）
     * @return モードごとの占有数です（新しい配列）
     * @throws IllegalArgumentException index が範囲外の場合に発生します
     */
    public int[] occupationsOf(int index) {
        checkArgument(index >= 0 && index < dimension, "index が範囲外です: %s", index);
        int[] occupations = new int[modeCount];
        int rest = index;
        for (int mode = modeCount - 1; mode >= 0; mode--) {
            occupations[mode] = rest % truncation;
            rest /= truncation;
        }
        return occupations;
    }

    private static int power(int base, int exponent) {
        int result = 1;
        for (int i = 0; i < exponent; i++) {
            try {
                result = Math.multiplyExact(result, base);
            } catch (ArithmeticException e) {
                throw new IllegalArgumentException(
                        "基底の次元 " + base + "^" + exponent + " が大きすぎます", e);
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return "FockBasis(truncation=" + truncation + ", modeCount=" + modeCount + ", dimension="
                + dimension + ")";
    }
}
