package io.github.yok.boson.core.realization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class FockBasisTest {

    @Test
    void dimensionIsTruncationToThePowerOfModes() {
        assertThat(new FockBasis(4, 1).dimension()).isEqualTo(4);
        assertThat(new FockBasis(3, 3).dimension()).isEqualTo(27);
    }

    @Test
    void modeZeroIsMostSignificantDigit() {
        FockBasis basis = new FockBasis(3, 2);
        assertThat(basis.indexOf(new int[] {0, 1})).isEqualTo(1);
        assertThat(basis.indexOf(new int[] {1, 0})).isEqualTo(3);
        assertThat(basis.indexOf(new int[] {1, 2})).isEqualTo(5);
        assertThat(basis.occupationsOf(7)).containsExactly(2, 1);
    }

    @Test
    void indexAndOccupationsAreInverse() {
        FockBasis basis = new FockBasis(4, 3);
        for (int i = 0; i < basis.dimension(); i++) {
            assertThat(basis.indexOf(basis.occupationsOf(i))).isEqualTo(i);
        }
    }

    @Test
    void invalidArgumentsAreRejected() {
        assertThatThrownBy(() -> new FockBasis(0, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FockBasis(2, 0)).isInstanceOf(IllegalArgumentException.class);

        FockBasis basis = new FockBasis(2, 2);
        assertThatThrownBy(() -> basis.indexOf(new int[] {0}))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> basis.indexOf(new int[] {0, 2}))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> basis.occupationsOf(4))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void overflowingDimensionIsRejected() {
        assertThatThrownBy(() -> new FockBasis(10, 12))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
