package io.github.yok.pauli.core.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.pauli.core.RandomOperators;
import io.github.yok.pauli.core.algebra.Coefficient;
import io.github.yok.pauli.core.algebra.PauliLabel;
import io.github.yok.pauli.core.sum.ForkJoinProductStrategy;
import io.github.yok.pauli.core.sum.OperatorSum;
import io.github.yok.pauli.core.sum.SequentialProductStrategy;
import io.github.yok.pauli.core.sum.Tolerance;
import io.github.yok.pauli.core.term.Factor;
import io.github.yok.pauli.core.term.OperatorTerm;
import io.github.yok.pauli.core.term.PauliString;
import java.util.List;
import java.util.concurrent.ForkJoinPool;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class OperatorAlgebraTest {

    private final OperatorAlgebra algebra = new OperatorAlgebra();

    private static Factor f(PauliLabel label, int site) {
        return Factor.of(site, label);
    }

    private OperatorSum single(double c, Factor... factors) {
        return algebra.sum(algebra.term(c, factors));
    }

    /**
     * X0 X1 + Y0 Y1 + Z0 Z1 です。
     */
    private OperatorSum heisenbergBond() {
        return algebra.sum(algebra.term(1.0, f(PauliLabel.X, 0), f(PauliLabel.X, 1)),
                algebra.term(1.0, f(PauliLabel.Y, 0), f(PauliLabel.Y, 1)),
                algebra.term(1.0, f(PauliLabel.Z, 0), f(PauliLabel.Z, 1)));
    }

    @Test
    void defaults() {
        assertEquals(Tolerance.DEFAULT, algebra.getTolerance());
        assertSame(SequentialProductStrategy.INSTANCE, algebra.getProductStrategy());
        assertEquals(Tolerance.EXACT, algebra.withTolerance(Tolerance.EXACT).getTolerance());
    }

    @Test
    @DisplayName("[X0, Y0] = 2i Z0")
    void commutator_singleSite() {
        OperatorSum c = algebra.commutator(single(1.0, f(PauliLabel.X, 0)),
                single(1.0, f(PauliLabel.Y, 0)));

        assertEquals(algebra.sum(algebra.term(Coefficient.of(0.0, 2.0), f(PauliLabel.Z, 0))), c);
    }

    @Test
    @DisplayName("{X0, Y0} = 0、{X0, X0} = 2I")
    void anticommutator() {
        OperatorSum x = single(1.0, f(PauliLabel.X, 0));
        OperatorSum y = single(1.0, f(PauliLabel.Y, 0));

        assertTrue(algebra.anticommutator(x, y).isZero());
        assertEquals(algebra.sum(OperatorTerm.identity(Coefficient.real(2.0))),
                algebra.anticommutator(x, x));
    }

    @Test
    @DisplayName("ハイゼンベルク結合と Z0 の交換子は 2i X0 Y1 - 2i Y0 X1")
    void commutator_heisenbergWithZ0() {
        OperatorSum c = algebra.commutator(heisenbergBond(), single(1.0, f(PauliLabel.Z, 0)));

        assertEquals(2, c.size());
        assertEquals(Coefficient.of(0.0, 2.0),
                c.coefficientOf(PauliString.of(f(PauliLabel.X, 0), f(PauliLabel.Y, 1))));
        assertEquals(Coefficient.of(0.0, -2.0),
                c.coefficientOf(PauliString.of(f(PauliLabel.Y, 0), f(PauliLabel.X, 1))));
        assertFalse(algebra.isHermitian(c));
        assertTrue(algebra.isHermitian(c.scale(Coefficient.I)));
    }

    @Test
    void commute() {
        OperatorSum bond = heisenbergBond();
        OperatorSum totalZ = algebra.sum(algebra.term(1.0, f(PauliLabel.Z, 0)),
                algebra.term(1.0, f(PauliLabel.Z, 1)));

        assertTrue(algebra.commute(bond, totalZ));
        assertFalse(algebra.commute(bond, single(1.0, f(PauliLabel.Z, 0))));
    }

    @Test
    void power() {
        OperatorSum a = algebra.sum(algebra.term(1.0, f(PauliLabel.X, 0)),
                algebra.term(1.0, f(PauliLabel.Z, 0)));

        assertEquals(OperatorSum.identity(), algebra.power(a, 0));
        assertEquals(a, algebra.power(a, 1));
        assertEquals(algebra.sum(OperatorTerm.identity(Coefficient.real(2.0))), algebra.power(a, 2));
        assertEquals(a.scale(2.0), algebra.power(a, 3));
        assertEquals(algebra.sum(OperatorTerm.identity(Coefficient.real(32.0))),
                algebra.power(a, 10));
        assertThrows(IllegalArgumentException.class, () -> algebra.power(a, -1));
    }

    @Test
    @DisplayName("冪は繰り返し積と一致する")
    void power_matchesRepeatedMultiplication() {
        RandomOperators random = new RandomOperators(17L, 3);
        OperatorSum a = random.sum(3);
        OperatorSum expected = OperatorSum.identity();
        for (int n = 0; n <= 5; n++) {
            assertEquals(expected, algebra.power(a, n), "n=" + n);
            expected = algebra.multiply(expected, a);
        }
    }

    @Test
    void isHermitian() {
        assertTrue(algebra.isHermitian(heisenbergBond()));
        assertTrue(algebra.isHermitian(OperatorSum.empty()));
        assertFalse(algebra.isHermitian(
                algebra.sum(algebra.term(Coefficient.I, f(PauliLabel.X, 0)))));
    }

    @Test
    @DisplayName("可換な組への分割は貪欲に行い、足し戻すと元の和になる")
    void commutingGroups() {
        OperatorSum h = heisenbergBond().add(single(0.5, f(PauliLabel.Z, 0)));

        List<OperatorSum> groups = algebra.commutingGroups(h);

        assertEquals(2, groups.size());
        assertEquals(heisenbergBond(), groups.get(0));
        assertEquals(single(0.5, f(PauliLabel.Z, 0)), groups.get(1));

        OperatorSum restored = OperatorSum.empty();
        for (OperatorSum g : groups) {
            restored = algebra.add(restored, g);
            List<OperatorTerm> terms = g.getTerms();
            for (OperatorTerm a : terms) {
                for (OperatorTerm b : terms) {
                    assertTrue(a.commutesWith(b));
                }
            }
        }
        assertEquals(h, restored);
    }

    @Test
    void commutingGroups_empty() {
        assertTrue(algebra.commutingGroups(OperatorSum.empty()).isEmpty());
    }

    @Test
    void equals_usesTolerance() {
        OperatorSum a = single(1.0, f(PauliLabel.X, 2));
        OperatorSum b = single(1.0 + 1e-15, f(PauliLabel.X, 2));

        assertTrue(algebra.equals(a, b));
        assertFalse(algebra.withTolerance(Tolerance.EXACT).equals(a, b));
    }

    @Test
    @DisplayName("並列積を使う窓口も逐次と同じ結果を返す")
    void parallelStrategy_matchesSequential() {
        ForkJoinPool pool = new ForkJoinPool(2);
        try {
            OperatorAlgebra parallel =
                    new OperatorAlgebra(Tolerance.DEFAULT, new ForkJoinProductStrategy(pool, 1));
            RandomOperators random = new RandomOperators(23L, 5);
            OperatorSum a = random.sumWithRealNoise(40);
            OperatorSum b = random.sumWithRealNoise(40);

            assertEquals(algebra.multiply(a, b), parallel.multiply(a, b));
            assertEquals(algebra.commutator(a, b), parallel.commutator(a, b));
        } finally {
            pool.shutdown();
        }
    }

    @Test
    void constructor_rejectsNull() {
        assertThrows(IllegalArgumentException.class,
                () -> new OperatorAlgebra(null, SequentialProductStrategy.INSTANCE));
        assertThrows(IllegalArgumentException.class,
                () -> new OperatorAlgebra(Tolerance.DEFAULT, null));
        assertThrows(IllegalArgumentException.class, () -> algebra.add(null, OperatorSum.empty()));
    }

    @Test
    @DisplayName("許容誤差を変えた窓口では scale・isZero・equals が同じ閾値で判定する")
    void tolerantFacade_scaleIsZeroAndEqualsAgree() {
        OperatorAlgebra tolerant = algebra.withTolerance(Tolerance.absolute(1e-6));
        OperatorSum x0 = tolerant.sum(tolerant.term(1.0, f(PauliLabel.X, 0)));

        OperatorSum scaled = tolerant.scale(x0, 1e-9);

        assertTrue(scaled.isZero());
        assertTrue(tolerant.isZero(scaled));
        assertTrue(tolerant.equals(scaled, OperatorSum.empty()));
        assertTrue(tolerant.isZero(tolerant.scale(x0, Coefficient.of(0.0, 1e-9))));
        assertFalse(algebra.scale(x0, 1e-9).isZero());
    }

    @Test
    void tolerantFacade_isZeroIgnoresTermsBelowThreshold() {
        OperatorSum residue = OperatorSum.of(OperatorTerm.of(1e-9, f(PauliLabel.X, 0)),
                OperatorTerm.of(-1e-8, f(PauliLabel.Z, 3)));
        OperatorAlgebra tolerant = algebra.withTolerance(Tolerance.absolute(1e-6));

        assertFalse(algebra.isZero(residue));
        assertTrue(tolerant.isZero(residue));
        assertFalse(algebra.equals(residue, OperatorSum.empty()));
        assertTrue(tolerant.equals(residue, OperatorSum.empty()));
        assertFalse(tolerant.isZero(single(1e-5, f(PauliLabel.Y, 1))));
    }

    @Test
    void tolerantFacade_commuteMatchesEquals() {
        OperatorAlgebra tolerant = algebra.withTolerance(Tolerance.absolute(1e-6));
        OperatorSum x0 = single(1.0, f(PauliLabel.X, 0));
        OperatorSum tinyY0 = single(1e-9, f(PauliLabel.Y, 0));

        assertFalse(algebra.commute(x0, tinyY0));
        assertTrue(tolerant.commute(x0, tinyY0));
        assertEquals(tolerant.commute(x0, tinyY0),
                tolerant.equals(tolerant.multiply(x0, tinyY0), tolerant.multiply(tinyY0, x0)));
    }
}
