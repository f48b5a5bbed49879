package io.github.yok.pauli.core.linearalgebra;

import io.github.yok.pauli.core.algebra.Coefficient;
import io.github.yok.pauli.core.algebra.PauliLabel;
import io.github.yok.pauli.core.algebra.Phase;
import io.github.yok.pauli.core.sum.OperatorSum;
import io.github.yok.pauli.core.term.OperatorTerm;
import io.github.yok.pauli.core.term.PauliString;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.ZMatrixRMaj;

/**
 * EJML の密な複素行列（{@link ZMatrixRMaj}）に変換するクラスです。
 *
 * <p>
 * Pauli 積の行列は各列に非零要素を 1 つだけ持つ（一般化置換行列）ため、 クロネッカー積を作らずに「列 → 行、位相」を直接求めて加算します。
 * </p>
 */
@Slf4j
public final class EjmlDenseMatrixBackend implements MatrixBackend {

    /**
     * 扱う量子ビット数の上限です（1024×1024 複素行列）。
     */
    public static final int MAX_QUBITS = 10;

    /**
     * 和を 2^n × 2^n の複素行列に変換します。
     *
     * @param sum 変換する和です（null 不可）
     * @param qubitCount 量子ビット数 n です（0 以上、sum.qubitCount() 以上、{@link #MAX_QUBITS} 以下）
     * @return 複素行列です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    @Override
    public ZMatrixRMaj toMatrix(OperatorSum sum, int qubitCount) {
        if (sum == null) {
            throw new IllegalArgumentException("sum は null 不可です");
        }
        if (qubitCount < 0) {
            throw new IllegalArgumentException("qubitCount は 0 以上が必要です: " + qubitCount);
        }
        if (qubitCount < sum.qubitCount()) {
            throw new IllegalArgumentException("qubitCount が和の作用するサイト数より小さいです: qubitCount="
                    + qubitCount + ", 必要=" + sum.qubitCount());
        }
        if (qubitCount > MAX_QUBITS) {
            throw new IllegalArgumentException(
                    "qubitCount は " + MAX_QUBITS + " 以下が必要です: " + qubitCount);
        }

        int dim = 1 << qubitCount;
        ZMatrixRMaj matrix = new ZMatrixRMaj(dim, dim);

        for (OperatorTerm term : sum) {
            accumulateTerm(matrix, term, qubitCount);
        }

        log.debug("行列に変換しました。量子ビット数={}、次元={}、項数={}", qubitCount, dim, sum.size());
        return matrix;
    }

    /**
     * 1 つの項を行列に加算します。
     *
     * @param matrix 加算先です
     * @param term 項です
     * @param qubitCount 量子ビット数です
     */
    private static void accumulateTerm(ZMatrixRMaj matrix, OperatorTerm term, int qubitCount) {
        PauliString support = term.getSupport();
        Coefficient c = term.getCoefficient();

        // X/Y が作用するビットを反転するマスク
        int flipMask = 0;
        for (int k = 0; k < support.size(); k++) {
            PauliLabel label = support.labelAt(k);
            if (label == PauliLabel.X || label == PauliLabel.Y) {
                flipMask |= bitOf(support.siteAt(k), qubitCount);
            }
        }

        int dim = matrix.numCols;
        for (int col = 0; col < dim; col++) {
            int row = col ^ flipMask;
            Phase phase = Phase.ONE;
            for (int k = 0; k < support.size(); k++) {
                boolean one = (col & bitOf(support.siteAt(k), qubitCount)) != 0;
                phase = phase.times(columnPhase(support.labelAt(k), one));
            }
            Coefficient v = c.times(phase);
            matrix.set(row, col, matrix.getReal(row, col) + v.getReal(),
                    matrix.getImag(row, col) + v.getImaginary());
        }
    }

    /**
     * 1 量子ビットの演算子が基底 |b&gt; に作用したときの位相を返します。
     *
     * <pre>
     *   X|b&gt; = |1-b&gt;
     *   Y|0&gt; = i|1&gt;,  Y|1&gt; = -i|0&gt;
     *   Z|0&gt; = |0&gt;,   Z|1&gt; = -|1&gt;
     * </pre>
     *
     * @param label ラベルです
     * @param one 入力ビットが 1 の場合は true です
     * @return 位相です
     */
    private static Phase columnPhase(PauliLabel label, boolean one) {
        switch (label) {
            case Y:
                return one ? Phase.MINUS_I : Phase.I;
            case Z:
                return one ? Phase.MINUS_ONE : Phase.ONE;
            default:
                return Phase.ONE;
        }
    }

    private static int bitOf(int site, int qubitCount) {
        return 1 << (qubitCount - 1 - site);
    }
}
