package io.github.yok.pauli.core.sum;

import io.github.yok.pauli.core.term.OperatorTerm;

/**
 * 積を単一スレッドで計算するクラスです。
 */
public final class SequentialProductStrategy implements ProductStrategy {

    /**
     * 共有インスタンスです（状態を持ちません）。
     */
    public static final SequentialProductStrategy INSTANCE = new SequentialProductStrategy();

    private SequentialProductStrategy() {}

    @Override
    public OperatorSum multiply(OperatorSum left, OperatorSum right, Tolerance tolerance) {
        if (left == null || right == null) {
            throw new IllegalArgumentException("left/right は null 不可です");
        }
        OperatorSum.requireTolerance(tolerance);
        if (left.isZero() || right.isZero()) {
            return OperatorSum.empty();
        }

        // 左の項を外側、右の項を内側に回す（並列版もこの順で寄与を合流させる）
        TermAccumulator acc = new TermAccumulator();
        for (OperatorTerm a : left) {
            for (OperatorTerm b : right) {
                acc.add(a.multiply(b));
            }
        }
        return acc.toSum(tolerance);
    }
}
