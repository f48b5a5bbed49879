package io.github.yok.pauli.app;

import io.github.yok.pauli.core.term.OperatorTerm;
import io.github.yok.pauli.out.ResultWriter;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * CLI で pauli-algebra を実行するクラスです。
 *
 * <p>
 * 設定された 2 つの被演算子に演算を適用し、正準形の結果を表示して CSV に出力します。
 * </p>
 */
@Component
@RequiredArgsConstructor
public class PauliCliRunner implements CommandLineRunner {

    /**
     * pauli-algebra の設定値（pauli.*）です。
     */
    private final PauliAlgebraProperties properties;

    /**
     * 演算の実行ロジックです。
     */
    private final OperatorJobExecutor operatorJobExecutor;

    /**
     * 結果出力ロジックです。
     */
    private final ResultWriter resultWriter;

    /**
     * CLI 実行を開始します。
     *
     * @param args 起動引数です
     */
    @Override
    public void run(String... args) {
        System.out.println("=== pauli-algebra start: evaluate operator job ===");
        System.out.print(properties.toMultilineString());

        PauliAlgebraProperties.Job job = properties.getJob();
        OperatorJobExecutor.JobResult r = operatorJobExecutor.execute(job);

        System.out.println("入力: left = " + r.getLeft());
        System.out.println("入力: right = " + r.getRight());
        System.out.println("=== " + job.getOperation() + " の結果（正準順） ===");
        if (r.getResult().isZero()) {
            System.out.println("  0");
        }
        for (OperatorTerm t : r.getResult()) {
            System.out.println("  " + t);
        }
        System.out.println("結果: 項数=" + r.getResult().size() + ", 量子ビット数="
                + r.getResult().qubitCount() + ", エルミート=" + r.isHermitian() + ", 可換な組の数="
                + r.getCommutingGroupCount());

        resultWriter.write(job.getName(), job.getOperation().name(), r.getResult(),
                r.isHermitian());
    }
}
