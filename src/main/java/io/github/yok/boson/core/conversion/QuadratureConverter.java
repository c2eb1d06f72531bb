package io.github.yok.boson.core.conversion;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import com.google.common.collect.ImmutableList;
import io.github.yok.boson.core.algebra.Algebra;
import io.github.yok.boson.core.algebra.BosonicOperator;
import io.github.yok.boson.core.algebra.Factor;
import io.github.yok.boson.core.algebra.Term;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.complex.Complex;

/**
 * ラダー演算子と直交位相演算子の表現を相互に変換するクラスです。
 *
 * <p>
 * 変換は各因子を 2 項の線形結合で置き換える代入です。
 * </p>
 * <ul>
 * <li>{@code b_i = √(1/2ħ)(q_i + i p_i)}、{@code b_i† = √(1/2ħ)(q_i - i p_i)}</li>
 * <li>{@code q_i = √(ħ/2)(b_i + b_i†)}、{@code p_i = -i√(ħ/2)(b_i - b_i†)}</li>
 * </ul>
 *
 * <p>
 * 長さ k の項は最大 2^k 個の項に展開されます（因子の順序は保ちます）。 出力は正規順序化しないため、必要に応じて {@code NormalOrderer} と組み合わせてください。
 * </p>
 */
@Slf4j
public final class QuadratureConverter {

    /**
     * ħ です。
     */
    @Getter
    private final double hbar;

    /**
     * ラダー → 直交位相の係数 {@code √(1/2ħ)} です。
     */
    private final double toQuadratureScale;

    /**
     * 直交位相 → ラダーの係数 {@code √(ħ/2)} です。
     */
    private final double toLadderScale;

    /**
     * ħ=1 の変換器を生成します。
     */
    public QuadratureConverter() {
        this(1.0);
    }

    /**
     * 変換器を生成します。
     *
     * @param hbar ħ です（正の有限値）
     * @throws IllegalArgumentException hbar が正の有限値でない場合に発生します
     */
    public QuadratureConverter(double hbar) {
        this.hbar = Algebra.checkHbar(hbar);
        this.toQuadratureScale = Math.sqrt(1.0 / (2.0 * hbar));
        this.toLadderScale = Math.sqrt(hbar / 2.0);
    }

    /**
     * ラダー演算子を直交位相演算子に変換します。
     *
     * @param ladder ラダー代数の演算子です
     * @return 直交位相代数の演算子です（正規順序化はしません）
     * @throws IllegalArgumentException 入力がラダー代数でない場合に発生します
     */
    public BosonicOperator toQuadrature(BosonicOperator ladder) {
        return substitute(ladder, Algebra.LADDER, Algebra.QUADRATURE);
    }

    /**
     * 直交位相演算子をラダー演算子に変換します。
     *
     * @param quadrature 直交位相代数の演算子です
     * @return ラダー代数の演算子です（正規順序化はしません）
     * @throws IllegalArgumentException 入力が直交位相代数でない場合に発生します
     */
    public BosonicOperator toLadder(BosonicOperator quadrature) {
        return substitute(quadrature, Algebra.QUADRATURE, Algebra.LADDER);
    }

    private BosonicOperator substitute(BosonicOperator operator, Algebra source, Algebra target) {
        checkNotNull(operator, "operator は null 不可です");
        checkArgument(operator.getAlgebra() == source, "%s 代数の演算子が必要です: %s", source,
                operator.getAlgebra());

        BosonicOperator.Builder out = BosonicOperator.builder(target);
        for (Map.Entry<Term, Complex> e : operator.getTerms().entrySet()) {
            expandTerm(e.getKey(), e.getValue(), out);
        }

        BosonicOperator result = out.build();
        log.debug("{} → {} に変換しました。入力項数={}、出力項数={}、ħ={}", source, target,
                operator.termCount(), result.termCount(), hbar);
        return result;
    }

    /**
     * 項を因子ごとの代入の直積として展開し、蓄積器に足し込みます。
     *
     * @param term 項です
     * @param coefficient 係数です
     * @param out 蓄積器です
     */
    private void expandTerm(Term term, Complex coefficient, BosonicOperator.Builder out) {
        List<Partial> partials = new ArrayList<>();
        partials.add(new Partial(ImmutableList.of(), coefficient));

        for (Factor factor : term) {
            List<Substitution> subs = substitutionsOf(factor);
            List<Partial> next = new ArrayList<>(partials.size() * subs.size());
            for (Partial p : partials) {
                for (Substitution s : subs) {
                    Complex c = p.coefficient.multiply(s.weight);
                    if (c.getReal() == 0.0 && c.getImaginary() == 0.0) {
                        continue;
                    }
                    next.add(p.append(s.factor, c));
                }
            }
            partials = next;
        }

        for (Partial p : partials) {
            out.add(Term.of(p.factors), p.coefficient);
        }
    }

    /**
     * 1 つの因子を置き換える 2 項の線形結合を返します。
     *
     * @param f 因子です
     * @return 代入先の（因子, 重み）のリストです
     */
    private List<Substitution> substitutionsOf(Factor f) {
        int mode = f.getMode();
        double s = toQuadratureScale;
        double t = toLadderScale;
        switch (f.getKind()) {
            case LOWER:
                return List.of(new Substitution(Factor.position(mode), new Complex(s)),
                        new Substitution(Factor.momentum(mode), new Complex(0.0, s)));
            case RAISE:
                return List.of(new Substitution(Factor.position(mode), new Complex(s)),
                        new Substitution(Factor.momentum(mode), new Complex(0.0, -s)));
            case POSITION:
                return List.of(new Substitution(Factor.lower(mode), new Complex(t)),
                        new Substitution(Factor.raise(mode), new Complex(t)));
            case MOMENTUM:
                return List.of(new Substitution(Factor.lower(mode), new Complex(0.0, -t)),
                        new Substitution(Factor.raise(mode), new Complex(0.0, t)));
            default:
                throw new IllegalStateException("未知の因子種類です: " + f.getKind());
        }
    }

    /**
     * 因子 1 つ分の代入先です。
     */
    private static final class Substitution {

        private final Factor factor;

        private final Complex weight;

        private Substitution(Factor factor, Complex weight) {
            this.factor = factor;
            this.weight = weight;
        }
    }

    /**
     * 展開途中の部分積（先頭から処理済みの因子列と係数）です。
     */
    private static final class Partial {

        private final ImmutableList<Factor> factors;

        private final Complex coefficient;

        private Partial(ImmutableList<Factor> factors, Complex coefficient) {
            this.factors = factors;
            this.coefficient = coefficient;
        }

        private Partial append(Factor factor, Complex newCoefficient) {
            ImmutableList<Factor> extended = ImmutableList.<Factor>builderWithExpectedSize(
                    factors.size() + 1).addAll(factors).add(factor).build();
            return new Partial(extended, newCoefficient);
        }
    }
}
