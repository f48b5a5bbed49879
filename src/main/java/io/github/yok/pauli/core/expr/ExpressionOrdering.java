package io.github.yok.pauli.core.expr;

import io.github.yok.pauli.core.algebra.Coefficient;
import io.github.yok.pauli.core.ordering.CanonicalOrdering;
import java.util.Comparator;
import java.util.List;

/**
 * 式木の節の全順序です。 {@link OperatorExpression#canonical()} で和の子を並べるのに使います。
 *
 * <p>
 * 節の種類（スカラー、項、和、積の順）で比較し、同種なら中身で比較します。 和と積は子を先頭から辞書式に比較し、一方が他方の接頭辞なら短い方が先です。
 * </p>
 */
public final class ExpressionOrdering {

    /**
     * 節の順序です。
     */
    public static final Comparator<OperatorExpression> NODE_ORDER = ExpressionOrdering::compare;

    private ExpressionOrdering() {}

    /**
     * 2 つの節を比較します。
     *
     * @param a 節です（null 不可）
     * @param b 節です（null 不可）
     * @return a が先なら負、等しければ 0、b が先なら正です
     */
    public static int compare(OperatorExpression a, OperatorExpression b) {
        int byKind = Integer.compare(rank(a), rank(b));
        if (byKind != 0) {
            return byKind;
        }
        if (a instanceof ScalarExpression) {
            return compareCoefficients(((ScalarExpression) a).getValue(),
                    ((ScalarExpression) b).getValue());
        }
        if (a instanceof TermExpression) {
            TermExpression ta = (TermExpression) a;
            TermExpression tb = (TermExpression) b;
            int bySupport = CanonicalOrdering.compareSupports(ta.getTerm().getSupport(),
                    tb.getTerm().getSupport());
            return bySupport != 0 ? bySupport
                    : compareCoefficients(ta.getTerm().getCoefficient(),
                            tb.getTerm().getCoefficient());
        }
        if (a instanceof SumExpression) {
            return compareChildren(((SumExpression) a).getSummands(),
                    ((SumExpression) b).getSummands());
        }
        return compareChildren(((ProductExpression) a).getFactors(),
                ((ProductExpression) b).getFactors());
    }

    private static int rank(OperatorExpression node) {
        if (node instanceof ScalarExpression) {
            return 0;
        }
        if (node instanceof TermExpression) {
            return 1;
        }
        if (node instanceof SumExpression) {
            return 2;
        }
        if (node instanceof ProductExpression) {
            return 3;
        }
        throw new IllegalArgumentException("未知の節です: " + node.getClass().getName());
    }

    private static int compareChildren(List<OperatorExpression> a, List<OperatorExpression> b) {
        int n = Math.min(a.size(), b.size());
        for (int i = 0; i < n; i++) {
            int c = compare(a.get(i), b.get(i));
            if (c != 0) {
                return c;
            }
        }
        return Integer.compare(a.size(), b.size());
    }

    private static int compareCoefficients(Coefficient a, Coefficient b) {
        // -0.0 と 0.0 を同一視する
        int byReal = Double.compare(a.getReal() + 0.0, b.getReal() + 0.0);
        return byReal != 0 ? byReal
                : Double.compare(a.getImaginary() + 0.0, b.getImaginary() + 0.0);
    }
}
