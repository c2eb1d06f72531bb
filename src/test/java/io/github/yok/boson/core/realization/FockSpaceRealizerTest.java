package io.github.yok.boson.core.realization;

import static io.github.yok.boson.core.algebra.Factor.lower;
import static io.github.yok.boson.core.algebra.Factor.momentum;
import static io.github.yok.boson.core.algebra.Factor.position;
import static io.github.yok.boson.core.algebra.Factor.raise;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.github.yok.boson.core.algebra.Algebra;
import io.github.yok.boson.core.algebra.BosonicOperator;
import org.apache.commons.math3.complex.Complex;
import org.ejml.data.ZMatrixRMaj;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class FockSpaceRealizerTest {

    private static final double TOLERANCE = 1e-12;

    private final FockSpaceRealizer realizer = new FockSpaceRealizer();

    @Nested
    class Ladder {

        @Test
        void numberOperatorIsExactDiagonal() {
            SparseRealization m = realizer.realize(BosonicOperator.ladder(raise(0), lower(0)), 5, 1);

            assertThat(m.dimension()).isEqualTo(5);
            for (int n = 0; n < 5; n++) {
                assertThat(m.get(n, n)).isEqualTo(new Complex(n));
            }
            // |0> の対角成分は 0 なので格納されない
            assertThat(m.nonZeroCount()).isEqualTo(4);
        }

        @Test
        void raiseHasSquareRootAmplitudesBelowCutoff() {
            SparseRealization m = realizer.realize(BosonicOperator.ladder(raise(0)), 3, 1);

            assertThat(m.nonZeroCount()).isEqualTo(2);
            assertThat(m.get(1, 0)).isEqualTo(new Complex(1.0));
            assertThat(m.get(2, 1).getReal()).isCloseTo(Math.sqrt(2.0), within(TOLERANCE));
            assertThat(m.get(0, 2)).isEqualTo(Complex.ZERO);
        }

        @Test
        void truncationDropsStatesLeavingTheSpace() {
            // b b† = b† b + 1 だが |N-1> からの生成は打ち切られる
            SparseRealization m = realizer.realize(BosonicOperator.ladder(lower(0), raise(0)), 3, 1);

            assertThat(m.get(0, 0)).isEqualTo(new Complex(1.0));
            assertThat(m.get(1, 1)).isEqualTo(new Complex(2.0));
            assertThat(m.get(2, 2)).isEqualTo(Complex.ZERO);
        }

        @Test
        void hoppingBetweenModes() {
            SparseRealization m = realizer.realize(BosonicOperator.ladder(raise(0), lower(1)), 2, 2);

            // |n0=0, n1=1> (index 1) → |n0=1, n1=0> (index 2)
            assertThat(m.nonZeroElements()).hasSize(1);
            SparseRealization.MatrixElement el = m.nonZeroElements().get(0);
            assertThat(el.getRow()).isEqualTo(2);
            assertThat(el.getCol()).isEqualTo(1);
            assertThat(el.getValue()).isEqualTo(new Complex(1.0));
        }

        @Test
        void complexCoefficientAndConstantArePropagated() {
            BosonicOperator op = BosonicOperator.of(Algebra.LADDER, new Complex(0.0, 1.0), raise(0),
                    lower(0)).plus(BosonicOperator.identity(Algebra.LADDER).times(2.0));
            SparseRealization m = realizer.realize(op, 3, 1);

            assertThat(m.get(0, 0)).isEqualTo(new Complex(2.0));
            assertThat(m.get(1, 1)).isEqualTo(new Complex(2.0, 1.0));
            assertThat(m.get(2, 2)).isEqualTo(new Complex(2.0, 2.0));
        }

        @Test
        void modeCountIsInferredFromOperator() {
            SparseRealization m = realizer.realize(BosonicOperator.ladder(lower(1)), 3);
            assertThat(m.getBasis().modeCount()).isEqualTo(2);
            assertThat(m.dimension()).isEqualTo(9);

            SparseRealization id = realizer.realize(BosonicOperator.identity(Algebra.LADDER), 3);
            assertThat(id.getBasis().modeCount()).isEqualTo(1);
            assertThat(id.nonZeroCount()).isEqualTo(3);
        }
    }

    @Nested
    class Quadrature {

        @Test
        void positionIsSymmetricTridiagonal() {
            SparseRealization m = new FockSpaceRealizer(2.0)
                    .realize(BosonicOperator.quadrature(position(0)), 3, 1);

            assertThat(m.nonZeroCount()).isEqualTo(4);
            assertThat(m.get(0, 1)).isEqualTo(new Complex(1.0));
            assertThat(m.get(1, 0)).isEqualTo(new Complex(1.0));
            assertThat(m.get(1, 2).getReal()).isCloseTo(Math.sqrt(2.0), within(TOLERANCE));
            assertThat(m.get(2, 1).getReal()).isCloseTo(Math.sqrt(2.0), within(TOLERANCE));
        }

        @Test
        void momentumMatrixIsHermitian() {
            SparseRealization m = realizer.realize(BosonicOperator.quadrature(momentum(0)), 4, 1);

            for (int r = 0; r < m.dimension(); r++) {
                for (int c = 0; c < m.dimension(); c++) {
                    Complex diff = m.get(r, c).subtract(m.get(c, r).conjugate());
                    assertThat(diff.abs()).isCloseTo(0.0, within(TOLERANCE));
                }
            }
            assertThat(m.get(0, 1).getImaginary()).isCloseTo(-Math.sqrt(0.5), within(TOLERANCE));
        }
    }

    @Test
    void denseMatrixMatchesSparseElements() {
        BosonicOperator op = BosonicOperator.of(Algebra.LADDER, new Complex(1.0, -1.0), raise(0))
                .plus(BosonicOperator.ladder(raise(0), lower(0)));
        SparseRealization m = realizer.realize(op, 3, 1);
        ZMatrixRMaj dense = m.toDenseMatrix();

        assertThat(dense.getNumRows()).isEqualTo(3);
        assertThat(dense.getNumCols()).isEqualTo(3);
        assertThat(dense.getReal(1, 0)).isEqualTo(1.0);
        assertThat(dense.getImag(1, 0)).isEqualTo(-1.0);
        assertThat(dense.getReal(2, 2)).isEqualTo(2.0);
        assertThat(dense.getReal(0, 0)).isEqualTo(0.0);
    }

    @Test
    void modeOutsideBasisIsRejected() {
        assertThatThrownBy(() -> realizer.realize(BosonicOperator.ladder(lower(2)), 3, 2))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void invalidTruncationIsRejected() {
        assertThatThrownBy(() -> realizer.realize(BosonicOperator.ladder(lower(0)), 0, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void outOfRangeLookupIsRejected() {
        SparseRealization m = realizer.realize(BosonicOperator.ladder(lower(0)), 2, 1);
        assertThatThrownBy(() -> m.get(2, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
