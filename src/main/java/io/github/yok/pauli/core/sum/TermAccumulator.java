package io.github.yok.pauli.core.sum;

import io.github.yok.pauli.core.algebra.Coefficient;
import io.github.yok.pauli.core.ordering.CanonicalOrdering;
import io.github.yok.pauli.core.term.OperatorTerm;
import io.github.yok.pauli.core.term.PauliString;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 台ごとに係数を合流させる作業用の可変バッファです。
 *
 * <p>
 * 和の構築・加減算・積のすべてがこの 1 つの合流処理を通ります。 寄与を加える順序が同じであれば結果はビット単位で一致します。 外部に公開せず、
 * {@link #toSum(Tolerance)} で不変な {@link OperatorSum} に確定させます。
 * </p>
 */
final class TermAccumulator {

    /**
     * 台 → 合流中の係数です（正準順）。
     */
    private final TreeMap<PauliString, Slot> slots = new TreeMap<>(CanonicalOrdering.SUPPORT_ORDER);

    void add(OperatorTerm term) {
        add(term.getSupport(), term.getCoefficient());
    }

    void add(PauliString support, Coefficient coefficient) {
        Slot slot = slots.get(support);
        if (slot == null) {
            slots.put(support, new Slot(coefficient));
        } else {
            slot.accept(coefficient);
        }
    }

    void addAll(Iterable<OperatorTerm> terms) {
        for (OperatorTerm t : terms) {
            add(t);
        }
    }

    void subtractAll(Iterable<OperatorTerm> terms) {
        for (OperatorTerm t : terms) {
            add(t.getSupport(), t.getCoefficient().negate());
        }
    }

    int size() {
        return slots.size();
    }

    /**
     * 許容誤差以下の係数を除去し、正準順の和として確定させます。
     *
     * @param tolerance 許容誤差です
     * @return 和です
     */
    OperatorSum toSum(Tolerance tolerance) {
        List<OperatorTerm> out = new ArrayList<>(slots.size());
        for (Map.Entry<PauliString, Slot> e : slots.entrySet()) {
            Slot slot = e.getValue();
            if (!tolerance.isNegligible(slot.value, slot.scale)) {
                out.add(OperatorTerm.of(e.getKey(), slot.value));
            }
        }
        return OperatorSum.ofCanonical(out);
    }

    /**
     * 1 つの台に合流した係数と、寄与の最大絶対値です。
     */
    private static final class Slot {

        private Coefficient value;

        private double scale;

        Slot(Coefficient first) {
            this.value = first;
            this.scale = first.abs();
        }

        void accept(Coefficient c) {
            value = value.plus(c);
            scale = Math.max(scale, c.abs());
        }
    }
}
