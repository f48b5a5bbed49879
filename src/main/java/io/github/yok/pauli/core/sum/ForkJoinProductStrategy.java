package io.github.yok.pauli.core.sum;

import io.github.yok.pauli.core.term.OperatorTerm;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RecursiveTask;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 積を {@link ForkJoinPool} 上で並列に計算するクラスです。
 *
 * <p>
 * 左の和の行（項）を再帰的に分割し、各葉タスクが担当行と右の全項との積を計算します。 部分結果は共有の可変領域に書き込まず、行の順に連結してから 1 回の合流処理で
 * 和にまとめます。 そのため寄与の合流順は逐次版と同じになり、結果はビット単位で一致します。
 * </p>
 *
 * <p>
 * 積の数が {@link #getThreshold()} 未満の場合は逐次計算に委ねます。
 * </p>
 */
@Slf4j
@Getter
public final class ForkJoinProductStrategy implements ProductStrategy {

    /**
     * 1 つの葉タスクが担当する積の数の目安です。
     */
    private static final int PRODUCTS_PER_LEAF = 1024;

    /**
     * 並列計算に用いるプールです。
     */
    private final ForkJoinPool pool;

    /**
     * 並列計算に切り替える積の数（|A|·|B|）の下限です。
     */
    private final long threshold;

    /**
     * 並列積の計算方式を生成します。
     *
     * @param pool 並列計算に用いるプールです（null 不可、所有権は呼び出し側に残ります）
     * @param threshold 並列計算に切り替える積の数の下限です（1 以上）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public ForkJoinProductStrategy(ForkJoinPool pool, long threshold) {
        if (pool == null) {
            throw new IllegalArgumentException("pool は null 不可です");
        }
        if (threshold <= 0) {
            throw new IllegalArgumentException("threshold は 1 以上が必要です: " + threshold);
        }
        this.pool = pool;
        this.threshold = threshold;
    }

    @Override
    public OperatorSum multiply(OperatorSum left, OperatorSum right, Tolerance tolerance) {
        if (left == null || right == null) {
            throw new IllegalArgumentException("left/right は null 不可です");
        }
        OperatorSum.requireTolerance(tolerance);

        long products = (long) left.size() * right.size();
        if (products < threshold) {
            return SequentialProductStrategy.INSTANCE.multiply(left, right, tolerance);
        }

        int rowsPerLeaf = Math.max(1, PRODUCTS_PER_LEAF / right.size());
        log.debug("並列積を実行します。左項数={}、右項数={}、積の数={}、葉あたり行数={}、並列度={}", left.size(),
                right.size(), products, rowsPerLeaf, pool.getParallelism());

        List<OperatorTerm> contributions = pool.invoke(
                new RowProductTask(left.getTerms(), right.getTerms(), 0, left.size(), rowsPerLeaf));

        TermAccumulator acc = new TermAccumulator();
        acc.addAll(contributions);
        OperatorSum result = acc.toSum(tolerance);

        log.debug("並列積が完了しました。寄与数={}、結果項数={}", contributions.size(), result.size());
        return result;
    }

    /**
     * 左の和の行範囲 [from, to) と右の全項との積を計算するタスクです。
     */
    @SuppressWarnings("serial")
    private static final class RowProductTask extends RecursiveTask<List<OperatorTerm>> {

        private final List<OperatorTerm> leftTerms;

        private final List<OperatorTerm> rightTerms;

        private final int from;

        private final int to;

        private final int rowsPerLeaf;

        RowProductTask(List<OperatorTerm> leftTerms, List<OperatorTerm> rightTerms, int from,
                int to, int rowsPerLeaf) {
            this.leftTerms = leftTerms;
            this.rightTerms = rightTerms;
            this.from = from;
            this.to = to;
            this.rowsPerLeaf = rowsPerLeaf;
        }

        @Override
        protected List<OperatorTerm> compute() {
            if (to - from <= rowsPerLeaf) {
                List<OperatorTerm> out = new ArrayList<>((to - from) * rightTerms.size());
                for (int i = from; i < to; i++) {
                    OperatorTerm a = leftTerms.get(i);
                    for (OperatorTerm b : rightTerms) {
                        out.add(a.multiply(b));
                    }
                }
                return out;
            }

            int mid = (from + to) >>> 1;
            RowProductTask lower = new RowProductTask(leftTerms, rightTerms, from, mid, rowsPerLeaf);
            RowProductTask upper = new RowProductTask(leftTerms, rightTerms, mid, to, rowsPerLeaf);
            lower.fork();
            List<OperatorTerm> upperResult = upper.compute();
            List<OperatorTerm> lowerResult = lower.join();

            // 行の順序を保って連結する
            List<OperatorTerm> out = new ArrayList<>(lowerResult.size() + upperResult.size());
            out.addAll(lowerResult);
            out.addAll(upperResult);
            return out;
        }
    }
}
