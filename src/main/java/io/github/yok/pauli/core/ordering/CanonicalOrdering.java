package io.github.yok.pauli.core.ordering;

import io.github.yok.pauli.core.term.Factor;
import io.github.yok.pauli.core.term.OperatorTerm;
import io.github.yok.pauli.core.term.PauliString;
import java.util.Comparator;
import java.util.List;

/**
 * 正準形を定める全順序を提供するクラスです。
 *
 * <p>
 * 台（正準形の因子列）同士は、(サイトインデックス昇順, ラベルコード昇順) の辞書式で比較します。 一方が他方の真の接頭辞である場合は短い方を先とします。
 * この順序は {@link PauliString#equals} と整合するため、ソートキーと重複排除の同値判定を兼ねます。
 * </p>
 *
 * <p>
 * 項の内部の因子の並べ替え（{@link #FACTOR_ORDER}）と、和の中の項の並べ替え（{@link #TERM_ORDER}）の両方で使用します。
 * </p>
 */
public final class CanonicalOrdering {

    /**
     * 因子の順序です（サイト昇順、同一サイトならラベルコード昇順）。
     */
    public static final Comparator<Factor> FACTOR_ORDER =
            Comparator.comparingInt(Factor::getSite).thenComparingInt(f -> f.getLabel().code());

    /**
     * 台の順序です。
     */
    public static final Comparator<PauliString> SUPPORT_ORDER = CanonicalOrdering::compareSupports;

    /**
     * 項の順序です（係数は比較しません）。
     */
    public static final Comparator<OperatorTerm> TERM_ORDER =
            (a, b) -> compareSupports(a.getSupport(), b.getSupport());

    private CanonicalOrdering() {}

    /**
     * 2 つの台を比較します。
     *
     * @param a 台です（null 不可）
     * @param b 台です（null 不可）
     * @return a が先なら負、等しければ 0、a が後なら正です
     */
    public static int compareSupports(PauliString a, PauliString b) {
        if (a == b) {
            return 0;
        }
        int common = Math.min(a.size(), b.size());
        for (int i = 0; i < common; i++) {
            int bySite = Integer.compare(a.siteAt(i), b.siteAt(i));
            if (bySite != 0) {
                return bySite;
            }
            int byLabel = Integer.compare(a.labelAt(i).code(), b.labelAt(i).code());
            if (byLabel != 0) {
                return byLabel;
            }
        }
        // 接頭辞が一致した場合は短い方が先
        return Integer.compare(a.size(), b.size());
    }

    /**
     * 項リストが正準順（台が狭義単調増加）に並んでいるかを返します。
     *
     * @param terms 項リストです
     * @return 正準順で、台の重複がない場合は true です
     */
    public static boolean isCanonical(List<OperatorTerm> terms) {
        for (int i = 1; i < terms.size(); i++) {
            if (TERM_ORDER.compare(terms.get(i - 1), terms.get(i)) >= 0) {
                return false;
            }
        }
        return true;
    }
}
