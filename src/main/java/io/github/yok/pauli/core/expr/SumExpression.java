package io.github.yok.pauli.core.expr;

import io.github.yok.pauli.core.engine.OperatorAlgebra;
import io.github.yok.pauli.core.sum.OperatorSum;
import java.util.ArrayList;
import java.util.List;
import lombok.Value;

/**
 * 和の節です。子を持たない和は 0 です。
 */
@Value
public class SumExpression implements OperatorExpression {

    /**
     * 被加数です（変更不可）。
     */
    List<OperatorExpression> summands;

    @Override
    public OperatorExpression flatten() {
        List<OperatorExpression> out = new ArrayList<>();
        for (OperatorExpression child : summands) {
            OperatorExpression flat = child.flatten();
            if (flat instanceof SumExpression) {
                out.addAll(((SumExpression) flat).summands);
            } else {
                out.add(flat);
            }
        }
        return new SumExpression(List.copyOf(out));
    }

    @Override
    public OperatorExpression canonical() {
        List<OperatorExpression> out = new ArrayList<>();
        for (OperatorExpression child : ((SumExpression) flatten()).summands) {
            out.add(child.canonical());
        }
        out.sort(ExpressionOrdering.NODE_ORDER);
        return new SumExpression(List.copyOf(out));
    }

    @Override
    public OperatorSum evaluate(OperatorAlgebra algebra) {
        OperatorSum acc = OperatorSum.empty();
        for (OperatorExpression child : summands) {
            acc = algebra.add(acc, child.evaluate(algebra));
        }
        return acc;
    }
}
