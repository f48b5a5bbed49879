package io.github.yok.pauli.app;

import io.github.yok.pauli.core.algebra.PauliLabel;
import java.util.ArrayList;
import java.util.List;

/**
 * 設定オブジェクトを組み立てるテスト用ヘルパです。
 */
final class JobFixtures {

    private JobFixtures() {}

    static PauliAlgebraProperties.FactorSpec factor(PauliLabel label, int site) {
        PauliAlgebraProperties.FactorSpec f = new PauliAlgebraProperties.FactorSpec();
        f.setSite(site);
        f.setLabel(label);
        return f;
    }

    static PauliAlgebraProperties.TermSpec term(double real, double imaginary,
            PauliAlgebraProperties.FactorSpec... factors) {
        PauliAlgebraProperties.TermSpec t = new PauliAlgebraProperties.TermSpec();
        t.setReal(real);
        t.setImaginary(imaginary);
        t.setFactors(new ArrayList<>(List.of(factors)));
        return t;
    }

    /**
     * [X0 X1 + Y0 Y1 + Z0 Z1, Z0] を計算する設定です。
     */
    static PauliAlgebraProperties.Job heisenbergCommutator() {
        PauliAlgebraProperties.Job job = new PauliAlgebraProperties.Job();
        job.setName("heisenberg_commutator");
        job.setOperation(PauliAlgebraProperties.Job.Operation.COMMUTATOR);
        job.setLeft(new ArrayList<>(List.of(
                term(1.0, 0.0, factor(PauliLabel.X, 0), factor(PauliLabel.X, 1)),
                term(1.0, 0.0, factor(PauliLabel.Y, 0), factor(PauliLabel.Y, 1)),
                term(1.0, 0.0, factor(PauliLabel.Z, 0), factor(PauliLabel.Z, 1)))));
        job.setRight(new ArrayList<>(List.of(term(1.0, 0.0, factor(PauliLabel.Z, 0)))));
        return job;
    }
}
