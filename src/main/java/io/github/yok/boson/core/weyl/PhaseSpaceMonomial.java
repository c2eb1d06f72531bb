package io.github.yok.boson.core.weyl;

import static com.google.common.base.Preconditions.checkArgument;
import com.google.common.collect.ImmutableSortedMap;
import java.util.Map;
import java.util.TreeMap;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 位相空間の（可換な）単項式 {@code ∏_i q_i^{m_i} p_i^{n_i}} を表す不変クラスです。
 *
 * <p>
 * モード番号の昇順に {@link ModeExponents} を保持します。指数がすべて 0 のモードは保持しません。
 * </p>
 */
@Getter
@EqualsAndHashCode
@ToString
public final class PhaseSpaceMonomial {

    /**
     * 定数 1 の単項式です。
     */
    public static final PhaseSpaceMonomial ONE = new PhaseSpaceMonomial(ImmutableSortedMap.of());

    /**
     * モード番号から指数の組への写像です（昇順）。
     */
    private final ImmutableSortedMap<Integer, ModeExponents> exponents;

    private PhaseSpaceMonomial(ImmutableSortedMap<Integer, ModeExponents> exponents) {
        this.exponents = exponents;
    }

    /**
     * 単一モードの単項式 {@code q_mode^m p_mode^n} を生成します。
     *
     * @param mode モード番号です（0 以上）
     * @param positionPower 位置の指数 m です（0 以上）
     * @param momentumPower 運動量の指数 n です（0 以上）
     * @return 単項式です
     */
    public static PhaseSpaceMonomial of(int mode, int positionPower, int momentumPower) {
        return builder().position(mode, positionPower).momentum(mode, momentumPower).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 単項式の全次数 {@code Σ(m_i + n_i)} を返します。
     *
     * @return 全次数です
     */
    public int degree() {
        int d = 0;
        for (ModeExponents e : exponents.values()) {
            d += e.getPositionPower() + e.getMomentumPower();
        }
        return d;
    }

    /**
     * モードごとに指数を累積して単項式を組み立てるビルダーです。
     */
    public static final class Builder {

        private final Map<Integer, int[]> powers = new TreeMap<>();

        private Builder() {}

        /**
         * 位置 {@code q_mode} の指数を加算します。
         *
         * @param mode モード番号です（0 以上）
         * @param power 指数です（0 以上）
         * @return このビルダーです
         */
        public Builder position(int mode, int power) {
            return accumulate(mode, power, 0);
        }

        /**
         * 運動量 {@code p_mode} の指数を加算します。
         *
         * @param mode モード番号です（0 以上）
         * @param power 指数です（0 以上）
         * @return このビルダーです
         */
        public Builder momentum(int mode, int power) {
            return accumulate(mode, power, 1);
        }

        private Builder accumulate(int mode, int power, int slot) {
            checkArgument(mode >= 0, "mode は 0 以上が必要です: %s", mode);
            checkArgument(power >= 0, "指数は 0 以上が必要です: %s", power);
            powers.computeIfAbsent(mode, k -> new int[2])[slot] += power;
            return this;
        }

        public PhaseSpaceMonomial build() {
            ImmutableSortedMap.Builder<Integer, ModeExponents> b = ImmutableSortedMap.naturalOrder();
            for (Map.Entry<Integer, int[]> e : powers.entrySet()) {
                ModeExponents me = new ModeExponents(e.getValue()[0], e.getValue()[1]);
                if (!me.isTrivial()) {
                    b.put(e.getKey(), me);
                }
            }
            return new PhaseSpaceMonomial(b.build());
        }
    }
}
