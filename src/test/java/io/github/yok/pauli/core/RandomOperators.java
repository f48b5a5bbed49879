package io.github.yok.pauli.core;

import io.github.yok.pauli.core.algebra.Coefficient;
import io.github.yok.pauli.core.algebra.PauliLabel;
import io.github.yok.pauli.core.sum.OperatorSum;
import io.github.yok.pauli.core.term.Factor;
import io.github.yok.pauli.core.term.OperatorTerm;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * テスト用に乱数で項・和を生成するヘルパです。
 *
 * <p>
 * 係数は小さな整数（実部・虚部とも -3..3）なので、積や和の計算で丸め誤差が出ません。
 * </p>
 */
public final class RandomOperators {

    private final Random random;

    private final int siteCount;

    public RandomOperators(long seed, int siteCount) {
        this.random = new Random(seed);
        this.siteCount = siteCount;
    }

    public OperatorTerm term() {
        List<Factor> factors = new ArrayList<>();
        for (int site = 0; site < siteCount; site++) {
            PauliLabel label = PauliLabel.fromCode(random.nextInt(4));
            // I も明示的に渡して、恒等因子の除去も通す
            if (random.nextInt(3) > 0) {
                factors.add(Factor.of(site, label));
            }
        }
        int re = random.nextInt(7) - 3;
        int im = random.nextInt(7) - 3;
        if (re == 0 && im == 0) {
            re = 1;
        }
        return OperatorTerm.of(factors, Coefficient.of(re, im));
    }

    public OperatorSum sum(int terms) {
        List<OperatorTerm> out = new ArrayList<>(terms);
        for (int i = 0; i < terms; i++) {
            out.add(term());
        }
        return OperatorSum.fromTerms(out);
    }

    /**
     * 実数の乱数係数を持つ和を生成します（丸め誤差が出る係数の検証用）。
     *
     * @param terms 項数です
     * @return 和です
     */
    public OperatorSum sumWithRealNoise(int terms) {
        List<OperatorTerm> out = new ArrayList<>(terms);
        for (int i = 0; i < terms; i++) {
            OperatorTerm t = term();
            out.add(t.scale(Coefficient.of(random.nextGaussian(), random.nextGaussian())));
        }
        return OperatorSum.fromTerms(out);
    }
}
