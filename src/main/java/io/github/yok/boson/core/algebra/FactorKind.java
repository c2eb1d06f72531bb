package io.github.yok.boson.core.algebra;

/**
 * 単一モードに作用する演算子因子の種類を表す列挙型です。
 *
 * <p>
 * 生成・消滅（ラダー代数）と位置・運動量（直交位相代数）の 4 種類を持ちます。 各種類は所属する代数と、正規順序における順位（rank）を持ちます。
 * </p>
 */
public enum FactorKind {

    /**
     * 生成演算子 b† です。
     */
    RAISE("^"),

    /**
     * 消滅演算子 b です。
     */
    LOWER(""),

    /**
     * 位置演算子 q です。
     */
    POSITION("q"),

    /**
     * 運動量演算子 p です。
     */
    MOMENTUM("p");

    /**
     * 表示用の記号です。
     */
    private final String symbol;

    FactorKind(String symbol) {
        this.symbol = symbol;
    }

    /**
     * この種類が属する代数を返します。
     *
     * @return 代数です
     */
    public Algebra algebra() {
        switch (this) {
            case RAISE:
            case LOWER:
                return Algebra.LADDER;
            default:
                return Algebra.QUADRATURE;
        }
    }

    /**
     * 正規順序における順位を返します。
     *
     * <p>
     * 0 が左側（生成・位置）、1 が右側（消滅・運動量）です。
     * </p>
     *
     * @return 順位（0 または 1）です
     */
    public int rank() {
        switch (this) {
            case RAISE:
            case POSITION:
                return 0;
            default:
                return 1;
        }
    }

    /**
     * エルミート共役を取ったときの種類を返します。
     *
     * <p>
     * ラダー代数では生成と消滅が入れ替わり、位置・運動量はそれぞれ自己共役です。
     * </p>
     *
     * @return 共役後の種類です
     */
    public FactorKind adjoint() {
        switch (this) {
            case RAISE:
                return LOWER;
            case LOWER:
                return RAISE;
            default:
                return this;
        }
    }

    /**
     * モード番号付きの表示文字列を返します（例: {@code 0^}, {@code 1}, {@code q0}, {@code p2}）。
     *
     * @param mode モード番号です
     * @return 表示文字列です
     */
    String format(int mode) {
        if (algebra() == Algebra.LADDER) {
            return mode + symbol;
        }
        return symbol + mode;
    }
}
