package io.github.yok.boson.app;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import io.github.yok.boson.core.algebra.Algebra;
import io.github.yok.boson.core.algebra.BosonicOperator;
import io.github.yok.boson.core.algebra.Factor;
import io.github.yok.boson.core.algebra.Term;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.math3.complex.Complex;

/**
 * 設定値（boson.input.*）から入力演算子を組み立てるクラスです。
 */
public final class ConfiguredOperatorFactory {

    /**
     * 入力設定から演算子を生成します。
     *
     * @param input 入力設定です（null 不可）
     * @return 演算子です
     * @throws IllegalArgumentException 項が空、または因子が代数に属さない場合に発生します
     */
    public BosonicOperator create(BosonAlgebraProperties.Input input) {
        checkNotNull(input, "input は null 不可です");
        Algebra algebra = checkNotNull(input.getAlgebra(), "input.algebra は必須です");
        List<BosonAlgebraProperties.TermEntry> entries = input.getTerms();
        checkArgument(entries != null && !entries.isEmpty(), "input.terms は必須です（項を 1 つ以上指定してください）");

        BosonicOperator.Builder b = BosonicOperator.builder(algebra);
        for (int i = 0; i < entries.size(); i++) {
            BosonAlgebraProperties.TermEntry entry =
                    checkNotNull(entries.get(i), "input.terms[%s] が null です", i);
            b.add(toTerm(entry, i), new Complex(entry.getReal(), entry.getImag()));
        }
        return b.build();
    }

    /**
     * 項の設定を項に変換します。
     *
     * @param entry 項の設定です
     * @param index 設定上の位置です（エラーメッセージ用）
     * @return 項です
     */
    private static Term toTerm(BosonAlgebraProperties.TermEntry entry, int index) {
        List<Factor> factors = new ArrayList<>();
        if (entry.getFactors() != null) {
            for (BosonAlgebraProperties.FactorEntry f : entry.getFactors()) {
                checkNotNull(f, "input.terms[%s].factors に null が含まれています", index);
                checkNotNull(f.getKind(), "input.terms[%s].factors[].kind は必須です", index);
                factors.add(new Factor(f.getMode(), f.getKind()));
            }
        }
        return Term.of(factors);
    }
}
