package io.github.yok.boson.core.weyl;

import static com.google.common.base.Preconditions.checkNotNull;
import io.github.yok.boson.core.algebra.Algebra;
import io.github.yok.boson.core.algebra.BosonicOperator;
import io.github.yok.boson.core.algebra.Factor;
import io.github.yok.boson.core.algebra.FactorKind;
import io.github.yok.boson.core.algebra.Term;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.util.CombinatoricsUtils;

/**
 * McCoy の公式による Weyl 量子化（対称順序化）を行うクラスです。
 *
 * <p>
 * 単一モードの単項式 {@code q^m p^n} は次の和に写されます。
 * </p>
 *
 * <pre>
 *   q^m p^n  →  2^{-n} Σ_{r=0}^{n} C(n, r) p^r q^m p^{n-r}
 * </pre>
 *
 * <p>
 * 異なるモードの演算子は可換なので、複数モードの単項式はモードごとの結果をモード番号の昇順に掛け合わせます。 ラダー代数では生成 b† を q、消滅 b を p
 * に対応させた同じ公式を直接適用します（交換子が c 数である限り公式は成り立ちます）。
 * </p>
 *
 * <p>
 * 出力は正規順序化されていません。簡約した形が必要な場合は {@code NormalOrderer} を適用してください。
 * </p>
 */
@Slf4j
public final class WeylQuantizer {

    /**
     * 位相空間の単項式を対称順序の直交位相演算子に量子化します。
     *
     * @param monomial 単項式です（null 不可）
     * @return 直交位相代数の演算子です（定数 1 の単項式は恒等演算子）
     */
    public BosonicOperator quantizeMonomial(PhaseSpaceMonomial monomial) {
        checkNotNull(monomial, "monomial は null 不可です");
        return symmetrize(Algebra.QUADRATURE, monomial.getExponents());
    }

    /**
     * 位相空間の多項式（単項式から係数への写像）を量子化します。
     *
     * @param polynomial 多項式です（null 不可）
     * @return 直交位相代数の演算子です
     */
    public BosonicOperator quantizePolynomial(Map<PhaseSpaceMonomial, Complex> polynomial) {
        checkNotNull(polynomial, "polynomial は null 不可です");
        BosonicOperator.Builder out = BosonicOperator.builder(Algebra.QUADRATURE);
        for (Map.Entry<PhaseSpaceMonomial, Complex> e : polynomial.entrySet()) {
            checkNotNull(e.getValue(), "係数は null 不可です: %s", e.getKey());
            out.addAll(quantizeMonomial(e.getKey()).times(e.getValue()));
        }
        return out.build();
    }

    /**
     * 演算子の各項を単項式とみなして対称順序化します（係数と恒等項は保持します）。
     *
     * @param operator ラダー代数または直交位相代数の演算子です（null 不可）
     * @return 入力と同じ代数の対称順序化した演算子です
     */
    public BosonicOperator symmetricOrdering(BosonicOperator operator) {
        return symmetricOrdering(operator, false, false);
    }

    /**
     * 演算子の各項を単項式とみなして対称順序化します。
     *
     * @param operator ラダー代数または直交位相代数の演算子です（null 不可）
     * @param ignoreCoefficient true の場合、各項の係数を 1 とみなします
     * @param ignoreIdentity true の場合、恒等項を結果から除きます
     * @return 入力と同じ代数の対称順序化した演算子です
     */
    public BosonicOperator symmetricOrdering(BosonicOperator operator, boolean ignoreCoefficient,
            boolean ignoreIdentity) {
        checkNotNull(operator, "operator は null 不可です");

        Algebra algebra = operator.getAlgebra();
        BosonicOperator.Builder out = BosonicOperator.builder(algebra);

        for (Map.Entry<Term, Complex> e : operator.getTerms().entrySet()) {
            Term term = e.getKey();
            if (term.isIdentity() && ignoreIdentity) {
                continue;
            }
            Complex coefficient = ignoreCoefficient ? Complex.ONE : e.getValue();
            out.addAll(symmetrize(algebra, exponentsOf(term)).times(coefficient));
        }

        BosonicOperator result = out.build();
        log.debug("対称順序化しました。代数={}、入力項数={}、出力項数={}", algebra, operator.termCount(),
                result.termCount());
        return result;
    }

    /**
     * 項をモードごとの（leading の個数, trailing の個数）に分解します。
     *
     * @param term 項です
     * @return モード番号昇順の指数の写像です
     */
    private static SortedMap<Integer, ModeExponents> exponentsOf(Term term) {
        SortedMap<Integer, int[]> counts = new TreeMap<>();
        for (Factor f : term) {
            int slot = f.getKind().rank();
            counts.computeIfAbsent(f.getMode(), k -> new int[2])[slot]++;
        }
        SortedMap<Integer, ModeExponents> exponents = new TreeMap<>();
        for (Map.Entry<Integer, int[]> c : counts.entrySet()) {
            exponents.put(c.getKey(), new ModeExponents(c.getValue()[0], c.getValue()[1]));
        }
        return exponents;
    }

    /**
     * モードごとに McCoy 展開し、モード番号の昇順に掛け合わせます。
     *
     * @param algebra 出力の代数です
     * @param exponents モード番号昇順の指数の写像です
     * @return 対称順序化した演算子です
     */
    private static BosonicOperator symmetrize(Algebra algebra,
            SortedMap<Integer, ModeExponents> exponents) {
        BosonicOperator product = BosonicOperator.identity(algebra);
        for (Map.Entry<Integer, ModeExponents> e : exponents.entrySet()) {
            ModeExponents me = e.getValue();
            product = product.times(mccoy(algebra, e.getKey(), me.getPositionPower(),
                    me.getMomentumPower()));
        }
        return product;
    }

    /**
     * 単一モードの McCoy 展開 {@code 2^{-n} Σ_r C(n,r) b^r a^m b^{n-r}} を返します。
     *
     * <p>
     * {@code a} は代数の leading 種類（q または b†）、{@code b} は trailing 種類（p または b）です。
     * </p>
     *
     * @param algebra 代数です
     * @param mode モード番号です
     * @param m leading 種類の指数です
     * @param n trailing 種類の指数です
     * @return 展開した演算子です
     */
    static BosonicOperator mccoy(Algebra algebra, int mode, int m, int n) {
        FactorKind a = algebra.leadingKind();
        FactorKind b = algebra.trailingKind();
        double norm = Math.pow(2.0, -n);

        BosonicOperator.Builder out = BosonicOperator.builder(algebra);
        for (int r = 0; r <= n; r++) {
            List<Factor> factors = new ArrayList<>(m + n);
            repeat(factors, new Factor(mode, b), r);
            repeat(factors, new Factor(mode, a), m);
            repeat(factors, new Factor(mode, b), n - r);
            double weight = CombinatoricsUtils.binomialCoefficientDouble(n, r) * norm;
            out.add(Term.of(factors), new Complex(weight));
        }
        return out.build();
    }

    private static void repeat(List<Factor> sink, Factor factor, int times) {
        for (int i = 0; i < times; i++) {
            sink.add(factor);
        }
    }
}
