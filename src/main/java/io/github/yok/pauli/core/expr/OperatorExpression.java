package io.github.yok.pauli.core.expr;

import io.github.yok.pauli.core.algebra.Coefficient;
import io.github.yok.pauli.core.engine.OperatorAlgebra;
import io.github.yok.pauli.core.sum.OperatorSum;
import io.github.yok.pauli.core.term.OperatorTerm;
import java.util.Arrays;
import java.util.List;

/**
 * 和と積を入れ子にした演算子の式木を表すインタフェースです。
 *
 * <p>
 * 式木は評価を遅延した構造表現で、{@link #evaluate(OperatorAlgebra)} で正準形の {@link OperatorSum} に落とします。
 * {@link #flatten()} は入れ子の和・積を 1 段に展開しますが、代数的な簡約は行いません。 積は非可換なので、展開後も因子の順序を保ちます。
 * </p>
 *
 * <p>
 * {@link #canonical()} は展開に加えて和の子を {@link ExpressionOrdering} の順に並べ、被加数の順序だけが異なる式を同じ木にします。
 * </p>
 */
public interface OperatorExpression {

    /**
     * 入れ子になった同種の節（和の中の和、積の中の積）を 1 段に展開した式を返します。
     *
     * @return 展開した式です
     */
    OperatorExpression flatten();

    /**
     * 正準形の式を返します。
     *
     * <p>
     * 入れ子を展開し、子を再帰的に正準化したうえで和の子を {@link ExpressionOrdering#NODE_ORDER} で整列します。 積の因子は並べ替えません。
     * 係数の結合などの簡約は行わないため、評価結果は元の式と同じです。
     * </p>
     *
     * @return 正準形の式です
     */
    OperatorExpression canonical();

    /**
     * 式を評価して正準形の和を返します。
     *
     * @param algebra 演算に用いる窓口です
     * @return 和です
     */
    OperatorSum evaluate(OperatorAlgebra algebra);

    static OperatorExpression scalar(Coefficient value) {
        return new ScalarExpression(value);
    }

    static OperatorExpression scalar(double value) {
        return new ScalarExpression(Coefficient.real(value));
    }

    static OperatorExpression term(OperatorTerm term) {
        return new TermExpression(term);
    }

    static OperatorExpression sum(OperatorExpression... summands) {
        return new SumExpression(List.copyOf(Arrays.asList(summands)));
    }

    static OperatorExpression product(OperatorExpression... factors) {
        return new ProductExpression(List.copyOf(Arrays.asList(factors)));
    }
}
