package io.github.yok.boson.core.conversion;

import static io.github.yok.boson.core.algebra.Factor.lower;
import static io.github.yok.boson.core.algebra.Factor.momentum;
import static io.github.yok.boson.core.algebra.Factor.position;
import static io.github.yok.boson.core.algebra.Factor.raise;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.github.yok.boson.core.algebra.Algebra;
import io.github.yok.boson.core.algebra.BosonicOperator;
import io.github.yok.boson.core.algebra.Term;
import io.github.yok.boson.core.ordering.NormalOrderer;
import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class QuadratureConverterTest {

    private static final double TOLERANCE = 1e-12;

    @Nested
    class ToQuadrature {

        @Test
        void lowerExpandsToPositionPlusIMomentum() {
            BosonicOperator result = new QuadratureConverter().toQuadrature(
                    BosonicOperator.ladder(lower(0)));
            double s = Math.sqrt(0.5);

            assertThat(result.termCount()).isEqualTo(2);
            assertThat(result.coefficientOf(Term.of(position(0)))).isEqualTo(new Complex(s));
            assertThat(result.coefficientOf(Term.of(momentum(0)))).isEqualTo(new Complex(0.0, s));
        }

        @Test
        void raiseExpandsToPositionMinusIMomentum() {
            BosonicOperator result = new QuadratureConverter(2.0).toQuadrature(
                    BosonicOperator.ladder(raise(3)));

            assertThat(result.coefficientOf(Term.of(position(3))).getReal())
                    .isCloseTo(0.5, within(TOLERANCE));
            assertThat(result.coefficientOf(Term.of(momentum(3))).getImaginary())
                    .isCloseTo(-0.5, within(TOLERANCE));
        }

        @Test
        void productExpandsIntoAllCombinations() {
            BosonicOperator result = new QuadratureConverter().toQuadrature(
                    BosonicOperator.ladder(lower(0), lower(1), raise(2)));
            assertThat(result.termCount()).isEqualTo(8);
            assertThat(result.getAlgebra()).isEqualTo(Algebra.QUADRATURE);
        }

        @Test
        void constantIsKept() {
            BosonicOperator id = BosonicOperator.identity(Algebra.LADDER).times(new Complex(2.0, 1.0));
            assertThat(new QuadratureConverter().toQuadrature(id)).isEqualTo(
                    BosonicOperator.identity(Algebra.QUADRATURE).times(new Complex(2.0, 1.0)));
        }

        @Test
        void numberOperatorBecomesHarmonicOscillator() {
            // b†b = (q² + p²)/2 - 1/2 (ħ=1)
            BosonicOperator number = BosonicOperator.ladder(raise(0), lower(0));
            BosonicOperator result = new NormalOrderer().normalOrder(
                    new QuadratureConverter().toQuadrature(number));

            BosonicOperator expected = BosonicOperator.quadrature(position(0), position(0)).times(0.5)
                    .plus(BosonicOperator.quadrature(momentum(0), momentum(0)).times(0.5))
                    .plus(BosonicOperator.identity(Algebra.QUADRATURE).times(-0.5));

            assertThat(result.isClose(expected, TOLERANCE)).isTrue();
        }

        @Test
        void quadratureInputIsRejected() {
            assertThatThrownBy(() -> new QuadratureConverter().toQuadrature(
                    BosonicOperator.quadrature(position(0))))
                            .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    class ToLadder {

        @Test
        void positionAndMomentumWithUnitScale() {
            QuadratureConverter converter = new QuadratureConverter(2.0);

            assertThat(converter.toLadder(BosonicOperator.quadrature(position(0))))
                    .isEqualTo(BosonicOperator.ladder(lower(0))
                            .plus(BosonicOperator.ladder(raise(0))));

            assertThat(converter.toLadder(BosonicOperator.quadrature(momentum(0))))
                    .isEqualTo(BosonicOperator.of(Algebra.LADDER, new Complex(0.0, -1.0), lower(0))
                            .plus(BosonicOperator.of(Algebra.LADDER, new Complex(0.0, 1.0),
                                    raise(0))));
        }

        @Test
        void ladderInputIsRejected() {
            assertThatThrownBy(() -> new QuadratureConverter().toLadder(
                    BosonicOperator.ladder(raise(0))))
                            .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.5, 1.0, 2.0, 6.62607015e-34})
    void roundTripRestoresNormalOrderedOperator(double hbar) {
        QuadratureConverter converter = new QuadratureConverter(hbar);
        NormalOrderer ladderOrderer = new NormalOrderer(hbar);

        BosonicOperator original = BosonicOperator.of(Algebra.LADDER, new Complex(1.0, 2.0), lower(0),
                raise(1))
                .plus(BosonicOperator.ladder(raise(0), lower(0), lower(1)).times(0.5))
                .plus(BosonicOperator.ladder(lower(0), raise(0)))
                .plus(BosonicOperator.identity(Algebra.LADDER).times(-3.0));

        BosonicOperator back = converter.toLadder(converter.toQuadrature(original));

        assertThat(ladderOrderer.normalOrder(back)
                .isClose(ladderOrderer.normalOrder(original), 1e-9)).isTrue();
    }

    @Test
    void invalidHbarIsRejected() {
        assertThatThrownBy(() -> new QuadratureConverter(0.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new QuadratureConverter(Double.POSITIVE_INFINITY))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
