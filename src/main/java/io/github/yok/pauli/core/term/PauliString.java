package io.github.yok.pauli.core.term;

import io.github.yok.pauli.core.algebra.PauliAlgebra;
import io.github.yok.pauli.core.algebra.PauliAlgebra.FactorProduct;
import io.github.yok.pauli.core.algebra.PauliLabel;
import io.github.yok.pauli.core.algebra.Phase;
import io.github.yok.pauli.core.ordering.CanonicalOrdering;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import lombok.Value;

/**
 * 項の台（support）、すなわち正準形の因子列を表す不変クラスです。
 *
 * <p>
 * 不変条件は以下のとおりです。
 * </p>
 * <ul>
 * <li>サイトインデックスは狭義単調増加（重複なし）</li>
 * <li>恒等演算子 I の因子は含まない</li>
 * </ul>
 *
 * <p>
 * 因子を持たない台は恒等演算子を表し、{@code "I"} と表示します。 比較順序は {@link CanonicalOrdering} に従います。
 * </p>
 */
public final class PauliString implements Comparable<PauliString> {

    /**
     * 恒等演算子（空の台）です。
     */
    public static final PauliString IDENTITY = new PauliString(new int[0], new PauliLabel[0]);

    /**
     * サイトインデックス列です（昇順）。
     */
    private final int[] sites;

    /**
     * sites と同じ並びのラベル列です（I を含みません）。
     */
    private final PauliLabel[] labels;

    /**
     * ハッシュ値のキャッシュです。
     */
    private final int hash;

    /**
     * 正準形であることが保証された配列から生成します。配列は所有権ごと受け取ります。
     *
     * @param sites サイトインデックス列です
     * @param labels ラベル列です
     */
    private PauliString(int[] sites, PauliLabel[] labels) {
        this.sites = sites;
        this.labels = labels;
        this.hash = 31 * Arrays.hashCode(sites) + Arrays.hashCode(labels);
    }

    /**
     * 因子列から正準形の台を生成します。
     *
     * <p>
     * 恒等因子を除去し、サイト昇順に並べ替えます。 同じサイトへの因子が 2 つ以上ある場合は、ラベルにかかわらず（恒等因子の除去前に）拒否します。
     * </p>
     *
     * @param factors 因子列です（null 不可、要素も null 不可）
     * @return 台です
     * @throws IllegalArgumentException factors または要素が null の場合に発生します
     * @throws DuplicateSiteException 同じサイトへの因子が複数ある場合に発生します
     */
    public static PauliString of(Collection<Factor> factors) {
        if (factors == null) {
            throw new IllegalArgumentException("factors は null 不可です");
        }
        List<Factor> sorted = new ArrayList<>(factors.size());
        for (Factor f : factors) {
            if (f == null) {
                throw new IllegalArgumentException("factors に null が含まれています");
            }
            sorted.add(f);
        }
        sorted.sort(CanonicalOrdering.FACTOR_ORDER);

        int[] outSites = new int[sorted.size()];
        PauliLabel[] outLabels = new PauliLabel[sorted.size()];
        int n = 0;
        Factor previous = null;
        for (Factor f : sorted) {
            if (previous != null && previous.getSite() == f.getSite()) {
                throw new DuplicateSiteException(f.getSite(), previous.getLabel(), f.getLabel());
            }
            previous = f;
            if (!f.getLabel().isIdentity()) {
                outSites[n] = f.getSite();
                outLabels[n] = f.getLabel();
                n++;
            }
        }
        if (n == 0) {
            return IDENTITY;
        }
        return new PauliString(Arrays.copyOf(outSites, n), Arrays.copyOf(outLabels, n));
    }

    /**
     * 因子列から正準形の台を生成します。
     *
     * @param factors 因子です
     * @return 台です
     * @throws DuplicateSiteException 同じサイトへの因子が複数ある場合に発生します
     */
    public static PauliString of(Factor... factors) {
        if (factors == null) {
            throw new IllegalArgumentException("factors は null 不可です");
        }
        return of(Arrays.asList(factors));
    }

    /**
     * 非恒等因子の数（Pauli weight）を返します。
     *
     * @return 因子数です
     */
    public int size() {
        return sites.length;
    }

    /**
     * 恒等演算子かどうかを返します。
     *
     * @return 因子を持たない場合は true です
     */
    public boolean isIdentity() {
        return sites.length == 0;
    }

    /**
     * index 番目の因子のサイトインデックスを返します。
     *
     * @param index 因子の位置です（0 以上 size 未満）
     * @return サイトインデックスです
     */
    public int siteAt(int index) {
        return sites[index];
    }

    /**
     * index 番目の因子のラベルを返します。
     *
     * @param index 因子の位置です（0 以上 size 未満）
     * @return ラベルです
     */
    public PauliLabel labelAt(int index) {
        return labels[index];
    }

    /**
     * 指定サイトに作用するラベルを返します。因子がなければ I です。
     *
     * @param site サイトインデックスです
     * @return ラベルです
     */
    public PauliLabel labelOnSite(int site) {
        int pos = Arrays.binarySearch(sites, site);
        return pos >= 0 ? labels[pos] : PauliLabel.I;
    }

    /**
     * 最大のサイトインデックスを返します。恒等演算子の場合は -1 です。
     *
     * @return 最大サイトインデックスです
     */
    public int maxSite() {
        return sites.length == 0 ? -1 : sites[sites.length - 1];
    }

    /**
     * 正準順の因子リストを返します。
     *
     * @return 変更不可の因子リストです
     */
    public List<Factor> factors() {
        List<Factor> out = new ArrayList<>(sites.length);
        for (int i = 0; i < sites.length; i++) {
            out.add(Factor.of(sites[i], labels[i]));
        }
        return Collections.unmodifiableList(out);
    }

    /**
     * 台同士の積 this·right を計算します。
     *
     * <p>
     * 両者のサイト列を 1 回の走査でマージします。 片方にしかないサイトは因子をそのまま写し、共通サイトは this のラベルを左にして
     * {@link PauliAlgebra#multiply} を適用し、位相を厳密に累積します。 積が I になったサイトは台から除きます。
     * </p>
     *
     * @param right 右から掛ける台です（null 不可）
     * @return 積の台と累積位相です
     */
    public PauliProduct multiply(PauliString right) {
        if (right == null) {
            throw new IllegalArgumentException("right は null 不可です");
        }
        if (right.isIdentity()) {
            return new PauliProduct(this, Phase.ONE);
        }
        if (isIdentity()) {
            return new PauliProduct(right, Phase.ONE);
        }

        int[] outSites = new int[sites.length + right.sites.length];
        PauliLabel[] outLabels = new PauliLabel[outSites.length];
        int n = 0;
        int i = 0;
        int j = 0;
        Phase phase = Phase.ONE;

        while (i < sites.length && j < right.sites.length) {
            int a = sites[i];
            int b = right.sites[j];
            if (a < b) {
                outSites[n] = a;
                outLabels[n++] = labels[i++];
            } else if (a > b) {
                outSites[n] = b;
                outLabels[n++] = right.labels[j++];
            } else {
                FactorProduct p = PauliAlgebra.multiply(labels[i++], right.labels[j++]);
                phase = phase.times(p.getPhase());
                if (!p.getLabel().isIdentity()) {
                    outSites[n] = a;
                    outLabels[n++] = p.getLabel();
                }
            }
        }
        while (i < sites.length) {
            outSites[n] = sites[i];
            outLabels[n++] = labels[i++];
        }
        while (j < right.sites.length) {
            outSites[n] = right.sites[j];
            outLabels[n++] = right.labels[j++];
        }

        PauliString support = n == 0 ? IDENTITY
                : new PauliString(Arrays.copyOf(outSites, n), Arrays.copyOf(outLabels, n));
        return new PauliProduct(support, phase);
    }

    /**
     * 演算子として可換かどうかを返します。
     *
     * <p>
     * 共通サイトのうちラベルが異なる（反交換する）サイトの数が偶数なら可換です。
     * </p>
     *
     * @param other 比較対象です（null 不可）
     * @return 可換の場合は true です
     */
    public boolean commutesWith(PauliString other) {
        if (other == null) {
            throw new IllegalArgumentException("other は null 不可です");
        }
        int anticommuting = 0;
        int i = 0;
        int j = 0;
        while (i < sites.length && j < other.sites.length) {
            if (sites[i] < other.sites[j]) {
                i++;
            } else if (sites[i] > other.sites[j]) {
                j++;
            } else {
                if (!PauliAlgebra.commutes(labels[i], other.labels[j])) {
                    anticommuting++;
                }
                i++;
                j++;
            }
        }
        return (anticommuting & 1) == 0;
    }

    @Override
    public int compareTo(PauliString other) {
        return CanonicalOrdering.compareSupports(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PauliString)) {
            return false;
        }
        PauliString other = (PauliString) o;
        return hash == other.hash && Arrays.equals(sites, other.sites)
                && Arrays.equals(labels, other.labels);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    /**
     * {@code "X0 Y1"} 形式の文字列を返します。恒等演算子は {@code "I"} です。
     *
     * @return 文字列表現です
     */
    @Override
    public String toString() {
        if (sites.length == 0) {
            return "I";
        }
        StringBuilder sb = new StringBuilder(sites.length * 4);
        for (int i = 0; i < sites.length; i++) {
            if (i > 0) {
                sb.append(' ');
            }
            sb.append(labels[i].name()).append(sites[i]);
        }
        return sb.toString();
    }

    /**
     * 台同士の積の結果（台と位相）を保持するクラスです。
     */
    @Value
    public static class PauliProduct {

        /**
         * 積の台です。
         */
        PauliString support;

        /**
         * 累積位相です。
         */
        Phase phase;
    }
}
