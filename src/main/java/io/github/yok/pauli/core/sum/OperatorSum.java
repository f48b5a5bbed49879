package io.github.yok.pauli.core.sum;

import io.github.yok.pauli.core.algebra.Coefficient;
import io.github.yok.pauli.core.ordering.CanonicalOrdering;
import io.github.yok.pauli.core.term.OperatorTerm;
import io.github.yok.pauli.core.term.PauliString;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Pauli 積の重み付き和 Σ cᵢ·Pᵢ を表す不変クラスです。
 *
 * <p>
 * 不変条件は以下のとおりです（すべての演算の後で保たれます）。
 * </p>
 * <ul>
 * <li>項は {@link CanonicalOrdering} の順に並び、台の重複がない</li>
 * <li>許容誤差以下の係数を持つ項は存在しない</li>
 * </ul>
 *
 * <p>
 * 演算は被演算子を変更せず、常に内部配列を共有しない新しい和を返します。 {@link #equals(Object)} は正準形同士の厳密比較です。
 * 浮動小数点誤差を許す比較は {@link #equalsWithin(OperatorSum, Tolerance)} を使います。
 * </p>
 */
public final class OperatorSum implements Iterable<OperatorTerm> {

    /**
     * 空の和（0 演算子）です。
     */
    private static final OperatorSum EMPTY = new OperatorSum(Collections.emptyList());

    /**
     * 正準順の項リストです（変更不可）。
     */
    private final List<OperatorTerm> terms;

    private OperatorSum(List<OperatorTerm> terms) {
        this.terms = terms;
    }

    /**
     * 正準順であることが保証された項リストから和を生成します。リストは所有権ごと受け取ります。
     *
     * @param canonicalTerms 正準順の項リストです
     * @return 和です
     */
    static OperatorSum ofCanonical(List<OperatorTerm> canonicalTerms) {
        if (canonicalTerms.isEmpty()) {
            return EMPTY;
        }
        return new OperatorSum(Collections.unmodifiableList(canonicalTerms));
    }

    /**
     * 空の和（0 演算子）を返します。
     *
     * @return 空の和です
     */
    public static OperatorSum empty() {
        return EMPTY;
    }

    /**
     * 恒等演算子 1·I だけからなる和を返します。
     *
     * @return 恒等演算子です
     */
    public static OperatorSum identity() {
        return ofCanonical(new ArrayList<>(List.of(OperatorTerm.identity(Coefficient.ONE))));
    }

    /**
     * 項から既定の許容誤差で和を生成します。
     *
     * @param terms 項です
     * @return 和です
     */
    public static OperatorSum of(OperatorTerm... terms) {
        if (terms == null) {
            throw new IllegalArgumentException("terms は null 不可です");
        }
        return fromTerms(Arrays.asList(terms), Tolerance.DEFAULT);
    }

    /**
     * 項の集まりから既定の許容誤差で和を生成します。
     *
     * @param terms 項の集まりです
     * @return 和です
     */
    public static OperatorSum fromTerms(Collection<OperatorTerm> terms) {
        return fromTerms(terms, Tolerance.DEFAULT);
    }

    /**
     * 項の集まりから和を生成します。
     *
     * <p>
     * 台が等しい項は係数を合計して 1 つにまとめ、許容誤差以下になった項は除去します。
     * </p>
     *
     * @param terms 項の集まりです（null 不可、要素も null 不可）
     * @param tolerance 許容誤差です（null 不可）
     * @return 正準形の和です
     * @throws IllegalArgumentException 引数が null の場合に発生します
     */
    public static OperatorSum fromTerms(Collection<OperatorTerm> terms, Tolerance tolerance) {
        if (terms == null) {
            throw new IllegalArgumentException("terms は null 不可です");
        }
        requireTolerance(tolerance);
        TermAccumulator acc = new TermAccumulator();
        for (OperatorTerm t : terms) {
            if (t == null) {
                throw new IllegalArgumentException("terms に null が含まれています");
            }
            acc.add(t);
        }
        return acc.toSum(tolerance);
    }

    public OperatorSum add(OperatorSum other) {
        return add(other, Tolerance.DEFAULT);
    }

    /**
     * 和 this + other を返します。
     *
     * @param other 加える和です（null 不可）
     * @param tolerance 許容誤差です（null 不可）
     * @return 和です
     */
    public OperatorSum add(OperatorSum other, Tolerance tolerance) {
        requireOperand(other);
        requireTolerance(tolerance);
        TermAccumulator acc = new TermAccumulator();
        acc.addAll(terms);
        acc.addAll(other.terms);
        return acc.toSum(tolerance);
    }

    public OperatorSum subtract(OperatorSum other) {
        return subtract(other, Tolerance.DEFAULT);
    }

    /**
     * 差 this - other を返します。
     *
     * @param other 引く和です（null 不可）
     * @param tolerance 許容誤差です（null 不可）
     * @return 差です
     */
    public OperatorSum subtract(OperatorSum other, Tolerance tolerance) {
        requireOperand(other);
        requireTolerance(tolerance);
        TermAccumulator acc = new TermAccumulator();
        acc.addAll(terms);
        acc.subtractAll(other.terms);
        return acc.toSum(tolerance);
    }

    public OperatorSum multiply(OperatorSum right) {
        return multiply(right, Tolerance.DEFAULT);
    }

    /**
     * 積 this·right を逐次計算で返します。
     *
     * @param right 右から掛ける和です（null 不可）
     * @param tolerance 許容誤差です（null 不可）
     * @return 積です
     * @see ProductStrategy
     */
    public OperatorSum multiply(OperatorSum right, Tolerance tolerance) {
        return SequentialProductStrategy.INSTANCE.multiply(this, right, tolerance);
    }

    public OperatorSum scale(Coefficient scalar) {
        return scale(scalar, Tolerance.DEFAULT);
    }

    /**
     * スカラー倍を返します。scalar が 0 の場合は空の和です。
     *
     * <p>
     * 台は変わらないので順序はそのままです。 倍した係数が許容誤差以下になった項（アンダーフローで 0 になった項を含む）は除去します。
     * </p>
     *
     * @param scalar スカラーです（null 不可）
     * @param tolerance 許容誤差です（null 不可）
     * @return スカラー倍です
     */
    public OperatorSum scale(Coefficient scalar, Tolerance tolerance) {
        if (scalar == null) {
            throw new IllegalArgumentException("scalar は null 不可です");
        }
        requireTolerance(tolerance);
        if (scalar.isZero() || terms.isEmpty()) {
            return EMPTY;
        }
        List<OperatorTerm> out = new ArrayList<>(terms.size());
        for (OperatorTerm t : terms) {
            OperatorTerm scaled = t.scale(scalar);
            Coefficient c = scaled.getCoefficient();
            if (!tolerance.isNegligible(c, c.abs())) {
                out.add(scaled);
            }
        }
        return ofCanonical(out);
    }

    public OperatorSum scale(double scalar) {
        return scale(Coefficient.real(scalar));
    }

    /**
     * 符号を反転した和を返します。
     *
     * @return -this です
     */
    public OperatorSum negate() {
        return scale(Coefficient.real(-1.0));
    }

    /**
     * エルミート共役を返します（各係数の複素共役）。
     *
     * @return 共役な和です
     */
    public OperatorSum adjoint() {
        List<OperatorTerm> out = new ArrayList<>(terms.size());
        for (OperatorTerm t : terms) {
            out.add(t.adjoint());
        }
        return ofCanonical(out);
    }

    /**
     * 0 演算子かどうかを返します。
     *
     * @return 項がない場合は true です
     */
    public boolean isZero() {
        return terms.isEmpty();
    }

    /**
     * 許容誤差の範囲で等しいかを返します（{@code isZero(this - other)}）。
     *
     * @param other 比較対象です（null 不可）
     * @param tolerance 許容誤差です（null 不可）
     * @return 等しい場合は true です
     */
    public boolean equalsWithin(OperatorSum other, Tolerance tolerance) {
        return subtract(other, tolerance).isZero();
    }

    /**
     * 項数を返します。
     *
     * @return 項数です
     */
    public int size() {
        return terms.size();
    }

    /**
     * 正準順の項リストを返します。
     *
     * @return 変更不可の項リストです
     */
    public List<OperatorTerm> getTerms() {
        return terms;
    }

    /**
     * 指定した台の係数を返します。含まれない場合は 0 です。
     *
     * @param support 台です（null 不可）
     * @return 係数です
     */
    public Coefficient coefficientOf(PauliString support) {
        if (support == null) {
            throw new IllegalArgumentException("support は null 不可です");
        }
        int lo = 0;
        int hi = terms.size() - 1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            int c = CanonicalOrdering.compareSupports(terms.get(mid).getSupport(), support);
            if (c < 0) {
                lo = mid + 1;
            } else if (c > 0) {
                hi = mid - 1;
            } else {
                return terms.get(mid).getCoefficient();
            }
        }
        return Coefficient.ZERO;
    }

    /**
     * 作用する最大のサイトインデックスを返します。サイトを持たない場合は -1 です。
     *
     * @return 最大サイトインデックスです
     */
    public int maxSite() {
        int max = -1;
        for (OperatorTerm t : terms) {
            max = Math.max(max, t.getSupport().maxSite());
        }
        return max;
    }

    /**
     * 表現に必要な量子ビット数（maxSite + 1）を返します。
     *
     * <p>
     * サイト {@link Integer#MAX_VALUE} でも桁あふれしないよう long で返します。
     * </p>
     *
     * @return 量子ビット数です
     */
    public long qubitCount() {
        return maxSite() + 1L;
    }

    @Override
    public Iterator<OperatorTerm> iterator() {
        return terms.iterator();
    }

    public Stream<OperatorTerm> stream() {
        return terms.stream();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof OperatorSum)) {
            return false;
        }
        return terms.equals(((OperatorSum) o).terms);
    }

    @Override
    public int hashCode() {
        return terms.hashCode();
    }

    /**
     * 正準順の {@code "c1*P1 + c2*P2"} 形式の文字列を返します。空の和は {@code "0"} です。
     *
     * @return 文字列表現です
     */
    @Override
    public String toString() {
        if (terms.isEmpty()) {
            return "0";
        }
        return terms.stream().map(OperatorTerm::toString).collect(Collectors.joining(" + "));
    }

    private static void requireOperand(OperatorSum other) {
        if (other == null) {
            throw new IllegalArgumentException("other は null 不可です");
        }
    }

    static void requireTolerance(Tolerance tolerance) {
        if (tolerance == null) {
            throw new IllegalArgumentException("tolerance は null 不可です");
        }
    }
}
