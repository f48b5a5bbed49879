package io.github.yok.pauli.app;

import io.github.yok.pauli.core.engine.OperatorAlgebra;
import io.github.yok.pauli.core.linearalgebra.EjmlDenseMatrixBackend;
import io.github.yok.pauli.core.linearalgebra.MatrixBackend;
import io.github.yok.pauli.core.sum.ForkJoinProductStrategy;
import io.github.yok.pauli.core.sum.ProductStrategy;
import io.github.yok.pauli.core.sum.SequentialProductStrategy;
import io.github.yok.pauli.core.sum.Tolerance;
import io.github.yok.pauli.out.CsvResultWriter;
import io.github.yok.pauli.out.ResultWriter;
import java.util.concurrent.ForkJoinPool;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 演算エンジン一式の Bean 定義を行う設定クラスです。
 *
 * <p>
 * 許容誤差・積の計算方式・演算窓口・行列バックエンド・結果出力を組み立てます。
 * </p>
 */
@Configuration
@RequiredArgsConstructor
public class PauliAlgebraConfiguration {

    /**
     * pauli-algebra の設定値（pauli.*）です。
     */
    private final PauliAlgebraProperties p;

    /**
     * 数値許容誤差を生成します。
     *
     * @return 許容誤差です
     */
    @Bean
    public Tolerance tolerance() {
        PauliAlgebraProperties.Tolerance t = p.getTolerance();
        return Tolerance.of(t.getAbsolute(), t.getRelative());
    }

    /**
     * 並列積に用いる ForkJoinPool を生成します。スレッドは必要になるまで起動しません。
     *
     * @return プールです
     */
    @Bean(destroyMethod = "shutdown")
    public ForkJoinPool productPool() {
        return new ForkJoinPool(p.getParallel().getParallelism());
    }

    /**
     * 積の計算方式を生成します。
     *
     * @param productPool 並列積に用いるプールです
     * @return 計算方式です
     */
    @Bean
    public ProductStrategy productStrategy(ForkJoinPool productPool) {
        PauliAlgebraProperties.Parallel par = p.getParallel();
        if (!par.isEnabled()) {
            return SequentialProductStrategy.INSTANCE;
        }
        return new ForkJoinProductStrategy(productPool, par.getThreshold());
    }

    /**
     * 演算窓口を生成します。
     *
     * @param tolerance 許容誤差です
     * @param productStrategy 積の計算方式です
     * @return 演算窓口です
     */
    @Bean
    public OperatorAlgebra operatorAlgebra(Tolerance tolerance, ProductStrategy productStrategy) {
        return new OperatorAlgebra(tolerance, productStrategy);
    }

    /**
     * 行列バックエンドを生成します。
     *
     * @return 行列バックエンドです
     */
    @Bean
    public MatrixBackend matrixBackend() {
        return new EjmlDenseMatrixBackend();
    }

    /**
     * 設定された演算を実行するロジックを生成します。
     *
     * @param operatorAlgebra 演算窓口です
     * @return 実行ロジックです
     */
    @Bean
    public OperatorJobExecutor operatorJobExecutor(OperatorAlgebra operatorAlgebra) {
        return new OperatorJobExecutor(operatorAlgebra);
    }

    /**
     * 結果出力ロジックを生成します。
     *
     * @param matrixBackend 行列バックエンドです
     * @return 結果出力ロジックです
     */
    @Bean
    public ResultWriter resultWriter(MatrixBackend matrixBackend) {
        PauliAlgebraProperties.Output o = p.getOutput();
        MatrixBackend backend = o.getMatrix().isEnabled() ? matrixBackend : null;
        return new CsvResultWriter(o.getDir(), backend, o.getMatrix().getMaxQubits());
    }
}
