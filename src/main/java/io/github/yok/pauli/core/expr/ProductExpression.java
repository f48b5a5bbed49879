package io.github.yok.pauli.core.expr;

import io.github.yok.pauli.core.engine.OperatorAlgebra;
import io.github.yok.pauli.core.sum.OperatorSum;
import java.util.ArrayList;
import java.util.List;
import lombok.Value;

/**
 * 積の節です。因子は左から順に掛けます。子を持たない積は恒等演算子です。
 */
@Value
public class ProductExpression implements OperatorExpression {

    /**
     * 因子です（変更不可、順序に意味があります）。
     */
    List<OperatorExpression> factors;

    @Override
    public OperatorExpression flatten() {
        List<OperatorExpression> out = new ArrayList<>();
        for (OperatorExpression child : factors) {
            OperatorExpression flat = child.flatten();
            if (flat instanceof ProductExpression) {
                out.addAll(((ProductExpression) flat).factors);
            } else {
                out.add(flat);
            }
        }
        return new ProductExpression(List.copyOf(out));
    }

    @Override
    public OperatorExpression canonical() {
        List<OperatorExpression> out = new ArrayList<>();
        for (OperatorExpression child : ((ProductExpression) flatten()).factors) {
            out.add(child.canonical());
        }
        return new ProductExpression(List.copyOf(out));
    }

    @Override
    public OperatorSum evaluate(OperatorAlgebra algebra) {
        OperatorSum acc = OperatorSum.identity();
        for (OperatorExpression child : factors) {
            acc = algebra.multiply(acc, child.evaluate(algebra));
        }
        return acc;
    }
}
