package io.github.yok.pauli.app;

import io.github.yok.pauli.core.algebra.Coefficient;
import io.github.yok.pauli.core.engine.OperatorAlgebra;
import io.github.yok.pauli.core.sum.OperatorSum;
import io.github.yok.pauli.core.term.Factor;
import io.github.yok.pauli.core.term.OperatorTerm;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * 設定（pauli.job.*）で指定された演算を実行するクラスです。
 *
 * <p>
 * 設定の項一覧を構築用 API に通して正準形の和に変換し、演算窓口で演算します。
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public class OperatorJobExecutor {

    /**
     * 演算窓口です。
     */
    private final OperatorAlgebra algebra;

    /**
     * 演算を実行します。
     *
     * @param job 演算の設定です（null 不可）
     * @return 実行結果です
     * @throws IllegalArgumentException 設定が不正な場合に発生します
     */
    public JobResult execute(PauliAlgebraProperties.Job job) {
        if (job == null) {
            throw new IllegalArgumentException("job は null 不可です");
        }
        if (job.getOperation() == null) {
            throw new IllegalArgumentException("job.operation は必須です");
        }

        OperatorSum left = toSum(job.getLeft(), "job.left");
        OperatorSum right = toSum(job.getRight(), "job.right");

        log.info("演算を開始します。演算={}、左項数={}、右項数={}", job.getOperation(), left.size(),
                right.size());

        OperatorSum result;
        switch (job.getOperation()) {
            case ADD:
                result = algebra.add(left, right);
                break;
            case SUBTRACT:
                result = algebra.subtract(left, right);
                break;
            case MULTIPLY:
                result = algebra.multiply(left, right);
                break;
            case COMMUTATOR:
                result = algebra.commutator(left, right);
                break;
            case ANTICOMMUTATOR:
                result = algebra.anticommutator(left, right);
                break;
            default:
                throw new IllegalArgumentException("未対応の演算です: " + job.getOperation());
        }

        boolean hermitian = algebra.isHermitian(result);
        int groups = algebra.commutingGroups(result).size();

        log.info("演算が完了しました。結果項数={}、量子ビット数={}、エルミート={}、可換な組の数={}", result.size(),
                result.qubitCount(), hermitian, groups);
        return new JobResult(left, right, result, hermitian, groups);
    }

    /**
     * 設定の項一覧を和に変換します。
     *
     * @param specs 項一覧です（null は空とみなします）
     * @param path エラーメッセージ用の設定パスです
     * @return 正準形の和です
     */
    OperatorSum toSum(List<PauliAlgebraProperties.TermSpec> specs, String path) {
        if (specs == null || specs.isEmpty()) {
            return OperatorSum.empty();
        }
        List<OperatorTerm> terms = new ArrayList<>(specs.size());
        for (int i = 0; i < specs.size(); i++) {
            PauliAlgebraProperties.TermSpec spec = specs.get(i);
            if (spec == null) {
                throw new IllegalArgumentException(path + "[" + i + "] に null が含まれています");
            }
            List<Factor> factors = new ArrayList<>();
            for (PauliAlgebraProperties.FactorSpec f : spec.getFactors()) {
                factors.add(Factor.of(f.getSite(), f.getLabel()));
            }
            terms.add(OperatorTerm.of(factors,
                    Coefficient.of(spec.getReal(), spec.getImaginary())));
        }
        return algebra.sum(terms);
    }

    /**
     * 実行結果を表すクラスです。
     */
    @Value
    public static class JobResult {

        /**
         * 左の被演算子です。
         */
        OperatorSum left;

        /**
         * 右の被演算子です。
         */
        OperatorSum right;

        /**
         * 演算結果です。
         */
        OperatorSum result;

        /**
         * 結果がエルミートかどうかです。
         */
        boolean hermitian;

        /**
         * 結果を可換な項の組に分けたときの組数です。
         */
        int commutingGroupCount;
    }
}
