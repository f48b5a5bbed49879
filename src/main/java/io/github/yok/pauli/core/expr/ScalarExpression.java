package io.github.yok.pauli.core.expr;

import io.github.yok.pauli.core.algebra.Coefficient;
import io.github.yok.pauli.core.engine.OperatorAlgebra;
import io.github.yok.pauli.core.sum.OperatorSum;
import io.github.yok.pauli.core.term.OperatorTerm;
import lombok.Value;

/**
 * スカラー c（= c·I）の葉です。
 */
@Value
public class ScalarExpression implements OperatorExpression {

    /**
     * 値です。
     */
    Coefficient value;

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
        return algebra.sum(OperatorTerm.identity(value));
    }
}
