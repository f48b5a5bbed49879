package io.github.yok.pauli.core.engine;

import io.github.yok.pauli.core.algebra.Coefficient;
import io.github.yok.pauli.core.expr.OperatorExpression;
import io.github.yok.pauli.core.sum.OperatorSum;
import io.github.yok.pauli.core.sum.ProductStrategy;
import io.github.yok.pauli.core.sum.SequentialProductStrategy;
import io.github.yok.pauli.core.sum.Tolerance;
import io.github.yok.pauli.core.term.Factor;
import io.github.yok.pauli.core.term.OperatorTerm;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 演算子式の構築・演算の公開窓口となるクラスです。
 *
 * <p>
 * 許容誤差と積の計算方式を 1 か所で保持し、すべての演算をそれらで実行します。 返す値はすべて正準形の不変オブジェクトです。
 * </p>
 */
@Slf4j
@Getter
public final class OperatorAlgebra {

    /**
     * 係数の打ち消し判定に用いる許容誤差です。
     */
    private final Tolerance tolerance;

    /**
     * 和同士の積の計算方式です。
     */
    private final ProductStrategy productStrategy;

    /**
     * 既定の許容誤差と逐次計算で生成します。
     */
    public OperatorAlgebra() {
        this(Tolerance.DEFAULT, SequentialProductStrategy.INSTANCE);
    }

    /**
     * 演算窓口を生成します。
     *
     * @param tolerance 許容誤差です（null 不可）
     * @param productStrategy 積の計算方式です（null 不可）
     * @throws IllegalArgumentException 引数が null の場合に発生します
     */
    public OperatorAlgebra(Tolerance tolerance, ProductStrategy productStrategy) {
        if (tolerance == null) {
            throw new IllegalArgumentException("tolerance は null 不可です");
        }
        if (productStrategy == null) {
            throw new IllegalArgumentException("productStrategy は null 不可です");
        }
        this.tolerance = tolerance;
        this.productStrategy = productStrategy;
    }

    /**
     * 許容誤差だけを差し替えた演算窓口を返します。
     *
     * @param newTolerance 許容誤差です（null 不可）
     * @return 新しい演算窓口です
     */
    public OperatorAlgebra withTolerance(Tolerance newTolerance) {
        return new OperatorAlgebra(newTolerance, productStrategy);
    }

    // ---- 構築 ----

    public OperatorTerm term(Coefficient coefficient, Factor... factors) {
        return OperatorTerm.of(coefficient, factors);
    }

    public OperatorTerm term(double coefficient, Factor... factors) {
        return OperatorTerm.of(coefficient, factors);
    }

    public OperatorSum sum(OperatorTerm... terms) {
        if (terms == null) {
            throw new IllegalArgumentException("terms は null 不可です");
        }
        return sum(Arrays.asList(terms));
    }

    public OperatorSum sum(Collection<OperatorTerm> terms) {
        return OperatorSum.fromTerms(terms, tolerance);
    }

    // ---- 算術 ----

    public OperatorSum add(OperatorSum a, OperatorSum b) {
        return requireNonNull(a, "a").add(b, tolerance);
    }

    public OperatorSum subtract(OperatorSum a, OperatorSum b) {
        return requireNonNull(a, "a").subtract(b, tolerance);
    }

    /**
     * 積 a·b を返します。一般に非可換です。
     *
     * @param a 左の和です
     * @param b 右の和です
     * @return 積です
     */
    public OperatorSum multiply(OperatorSum a, OperatorSum b) {
        return productStrategy.multiply(a, b, tolerance);
    }

    public OperatorTerm multiply(OperatorTerm a, OperatorTerm b) {
        return requireNonNull(a, "a").multiply(b);
    }

    /**
     * スカラー倍を返します。許容誤差以下になった項は除去します。
     *
     * @param a 和です
     * @param scalar スカラーです
     * @return スカラー倍です
     */
    public OperatorSum scale(OperatorSum a, Coefficient scalar) {
        return requireNonNull(a, "a").scale(scalar, tolerance);
    }

    public OperatorSum scale(OperatorSum a, double scalar) {
        return scale(a, Coefficient.real(scalar));
    }

    /**
     * 交換子 [a, b] = ab - ba を返します。
     *
     * @param a 左の和です
     * @param b 右の和です
     * @return 交換子です
     */
    public OperatorSum commutator(OperatorSum a, OperatorSum b) {
        return multiply(a, b).subtract(multiply(b, a), tolerance);
    }

    /**
     * 反交換子 {a, b} = ab + ba を返します。
     *
     * @param a 左の和です
     * @param b 右の和です
     * @return 反交換子です
     */
    public OperatorSum anticommutator(OperatorSum a, OperatorSum b) {
        return multiply(a, b).add(multiply(b, a), tolerance);
    }

    /**
     * 冪 a^n を返します（a^0 は恒等演算子）。
     *
     * <p>
     * 二乗を繰り返す方法で積の回数を O(log n) に抑えます。 同じ a の冪同士は可換なので掛ける順序は結果に影響しません。
     * </p>
     *
     * @param a 底の和です（null 不可）
     * @param exponent 指数です（0 以上）
     * @return 冪です
     * @throws IllegalArgumentException exponent が負の場合に発生します
     */
    public OperatorSum power(OperatorSum a, int exponent) {
        requireNonNull(a, "a");
        if (exponent < 0) {
            throw new IllegalArgumentException("exponent は 0 以上が必要です: " + exponent);
        }
        OperatorSum result = OperatorSum.identity();
        OperatorSum base = a;
        int n = exponent;
        while (n > 0) {
            if ((n & 1) == 1) {
                result = multiply(result, base);
            }
            n >>>= 1;
            if (n > 0) {
                base = multiply(base, base);
            }
        }
        return result;
    }

    public OperatorSum adjoint(OperatorSum a) {
        return requireNonNull(a, "a").adjoint();
    }

    // ---- 判定 ----

    /**
     * この窓口の許容誤差で 0 とみなせるかを返します。
     *
     * <p>
     * 別の許容誤差で作られた和も、この窓口の許容誤差で係数を整理してから判定します。 {@link #equals(OperatorSum, OperatorSum)}
     * と同じ基準です。
     * </p>
     *
     * @param a 和です
     * @return 0 とみなせる場合は true です
     */
    public boolean isZero(OperatorSum a) {
        requireNonNull(a, "a");
        return a.isZero() || OperatorSum.fromTerms(a.getTerms(), tolerance).isZero();
    }

    /**
     * 許容誤差の範囲で等しいかを返します（{@code isZero(a - b)}）。
     *
     * @param a 和です
     * @param b 和です
     * @return 等しい場合は true です
     */
    public boolean equals(OperatorSum a, OperatorSum b) {
        return isZero(subtract(a, b));
    }

    /**
     * エルミート（a = a†）かどうかを許容誤差の範囲で返します。
     *
     * @param a 和です
     * @return エルミートの場合は true です
     */
    public boolean isHermitian(OperatorSum a) {
        return equals(a, adjoint(a));
    }

    /**
     * 2 つの和が可換かどうかを許容誤差の範囲で返します。
     *
     * @param a 和です
     * @param b 和です
     * @return [a, b] = 0 の場合は true です
     */
    public boolean commute(OperatorSum a, OperatorSum b) {
        return isZero(commutator(a, b));
    }

    /**
     * 項を互いに可換な項の組に分割します（測定のための項のグループ化）。
     *
     * <p>
     * 正準順に項を走査し、すべての既存メンバと可換な最初の組に入れ、なければ新しい組を作る貪欲法です。 入力が同じなら結果も同じです。 各組の和を足し戻すと元の和になります。
     * </p>
     *
     * @param a 分割する和です（null 不可）
     * @return 可換な項の組（各組は正準形の和）です
     */
    public List<OperatorSum> commutingGroups(OperatorSum a) {
        requireNonNull(a, "a");
        List<List<OperatorTerm>> groups = new ArrayList<>();
        for (OperatorTerm t : a) {
            List<OperatorTerm> target = null;
            for (List<OperatorTerm> g : groups) {
                if (g.stream().allMatch(t::commutesWith)) {
                    target = g;
                    break;
                }
            }
            if (target == null) {
                target = new ArrayList<>();
                groups.add(target);
            }
            target.add(t);
        }

        List<OperatorSum> out = new ArrayList<>(groups.size());
        for (List<OperatorTerm> g : groups) {
            out.add(OperatorSum.fromTerms(g, tolerance));
        }
        log.debug("可換な組に分割しました。項数={}、組数={}", a.size(), out.size());
        return out;
    }

    /**
     * 式木を評価して正準形の和を返します。
     *
     * @param expression 式木です（null 不可）
     * @return 和です
     */
    public OperatorSum evaluate(OperatorExpression expression) {
        return requireNonNull(expression, "expression").evaluate(this);
    }

    private static <T> T requireNonNull(T value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " は null 不可です");
        }
        return value;
    }
}
