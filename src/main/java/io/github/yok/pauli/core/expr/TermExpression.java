package io.github.yok.pauli.core.expr;

import io.github.yok.pauli.core.engine.OperatorAlgebra;
import io.github.yok.pauli.core.sum.OperatorSum;
import io.github.yok.pauli.core.term.OperatorTerm;
import lombok.Value;

/**
 * 係数付き Pauli 積の葉です。
 */
@Value
public class TermExpression implements OperatorExpression {

    /**
     * 項です。
     */
    OperatorTerm term;

    @Override
    public OperatorExpression flatten() {
        return this;
    }

    @Override
    public OperatorExpression canonical() {
        return this;
    }

    @Override
    public OperatorSum evaluate(OperatorAlgebra algebra) {
        return algebra.sum(term);
    }
}
