package io.github.yok.boson.core.weyl;

import lombok.Value;

/**
 * 単一モードの位相空間単項式 {@code q^m p^n} の指数の組です。
 */
@Value
public class ModeExponents {

    /**
     * 位置 q の指数 m です（0 以上）。
     */
    int positionPower;

    /**
     * 運動量 p の指数 n です（0 以上）。
     */
    int momentumPower;

    /**
     * 両方の指数が 0（定数 1）かを返します。
     *
     * @return 定数の場合は true です
     */
    public boolean isTrivial() {
        return positionPower == 0 && momentumPower == 0;
    }
}
