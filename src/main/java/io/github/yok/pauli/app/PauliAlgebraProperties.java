package io.github.yok.pauli.app;

import io.github.yok.pauli.core.algebra.PauliLabel;
import java.util.ArrayList;
import java.util.List;
import javax.validation.Valid;
import javax.validation.constraints.DecimalMax;
import javax.validation.constraints.Max;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.PositiveOrZero;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * pauli-algebra の設定値（pauli.*）を保持するクラスです。
 *
 * <p>
 * application.yml などから読み込まれ、CLI 実行時の初期化に使用します。
 * </p>
 */
@Data
@ToString(onlyExplicitlyIncluded = true)
@Validated
@ConfigurationProperties(prefix = "pauli")
public class PauliAlgebraProperties {

    /**
     * 数値許容誤差の設定です。
     */
    @Valid
    private Tolerance tolerance = new Tolerance();

    /**
     * 並列積の設定です。
     */
    @Valid
    private Parallel parallel = new Parallel();

    /**
     * 実行する演算の設定です。
     */
    @Valid
    private Job job = new Job();

    /**
     * 出力設定です。
     */
    @Valid
    private Output output = new Output();

    /**
     * 設定値を YAML 風の複数行文字列に整形して返します。
     *
     * @return 設定値の整形文字列です
     */
    @ToString.Include(name = "pauli")
    public String toMultilineString() {
        String nl = System.lineSeparator();

        Tolerance t = getTolerance();
        Parallel par = getParallel();
        Job j = getJob();
        Output o = getOutput();

        // 先頭改行を入れて、ログの可読性を上げます。
        StringBuilder sb = new StringBuilder(256).append(nl);

        appendSection(sb, nl, "tolerance",
                // absolute: 絶対許容誤差
                "absolute", t.getAbsolute(),
                // relative: 相対許容誤差（合流した寄与の最大絶対値に掛ける）
                "relative", t.getRelative());

        appendSection(sb, nl, "parallel",
                // enabled: 並列積を有効化するかどうか
                "enabled", par.isEnabled(),
                // threshold: 並列に切り替える積の数 |A|·|B| の下限
                "threshold", par.getThreshold(),
                // parallelism: ForkJoinPool の並列度
                "parallelism", par.getParallelism());

        appendSection(sb, nl, "job",
                // name: 出力名
                "name", j.getName(),
                // operation: 演算の種類
                "operation", j.getOperation(),
                // left/right: 被演算子の項数
                "left.terms", j.getLeft().size(), "right.terms", j.getRight().size());

        appendSection(sb, nl, "output",
                // dir: 出力先ディレクトリ
                "dir", o.getDir(),
                // matrix.enabled: 行列 CSV を出力するかどうか
                "matrix.enabled", o.getMatrix().isEnabled(),
                // matrix.maxQubits: 行列 CSV を出力する量子ビット数の上限
                "matrix.maxQubits", o.getMatrix().getMaxQubits());

        return sb.toString();
    }

    /**
     * セクション名と (key, value) ペア列を、YAML 風の複数行テキストとして追記します。
     *
     * @param sb 追記先バッファです
     * @param nl 改行文字列です
     * @param section セクション名です
     * @param kvPairs key1, value1, key2, value2, ... の順で渡すペア列です
     */
    private static void appendSection(StringBuilder sb, String nl, String section,
            Object... kvPairs) {
        sb.append("  ").append(section).append(":").append(nl);
        for (int i = 0; i < kvPairs.length; i += 2) {
            String key = String.valueOf(kvPairs[i]);
            Object val = (i + 1 < kvPairs.length) ? kvPairs[i + 1] : null;
            sb.append("    ").append(key).append(": ").append(val).append(nl);
        }
    }

    @Data
    public static class Tolerance {

        /**
         * 絶対許容誤差です。
         */
        @PositiveOrZero
        private double absolute = 0.0;

        /**
         * 相対許容誤差です（既定はマシンイプシロンの 8 倍）。
         */
        @PositiveOrZero
        @DecimalMax(value = "1.0", inclusive = false)
        private double relative = io.github.yok.pauli.core.sum.Tolerance.DEFAULT_RELATIVE;
    }

    @Data
    public static class Parallel {

        /**
         * 並列積を有効化するかどうかです。
         */
        private boolean enabled = false;

        /**
         * 並列に切り替える積の数 |A|·|B| の下限です。
         */
        @Min(1)
        private long threshold = 4096;

        /**
         * ForkJoinPool の並列度です。
         */
        @Min(1)
        private int parallelism = Runtime.getRuntime().availableProcessors();
    }

    @Data
    public static class Job {

        /**
         * 出力名（ファイル名の接頭辞）です。
         */
        @NotEmpty
        private String name = "result";

        /**
         * 演算の種類です。
         */
        @NotNull
        private Operation operation = Operation.MULTIPLY;

        /**
         * 左の被演算子の項一覧です。
         */
        @Valid
        private List<TermSpec> left = new ArrayList<>();

        /**
         * 右の被演算子の項一覧です。
         */
        @Valid
        private List<TermSpec> right = new ArrayList<>();

        public enum Operation {
            ADD, SUBTRACT, MULTIPLY, COMMUTATOR, ANTICOMMUTATOR
        }
    }

    /**
     * 1 つの項（係数と因子の一覧）の設定です。
     */
    @Data
    public static class TermSpec {

        /**
         * 係数の実部です。
         */
        private double real = 1.0;

        /**
         * 係数の虚部です。
         */
        private double imaginary = 0.0;

        /**
         * 因子の一覧です（空の場合は恒等演算子）。
         */
        @Valid
        private List<FactorSpec> factors = new ArrayList<>();
    }

    @Data
    public static class FactorSpec {

        /**
         * サイトインデックスです。
         */
        @Min(0)
        private int site;

        /**
         * ラベル（I/X/Y/Z）です。
         */
        @NotNull
        private PauliLabel label;
    }

    @Data
    public static class Output {

        /**
         * 出力先ディレクトリです。
         */
        private String dir = "./out";

        /**
         * 行列出力の設定です。
         */
        @Valid
        private Matrix matrix = new Matrix();

        @Data
        public static class Matrix {

            /**
             * 行列 CSV を出力するかどうかです。
             */
            private boolean enabled = false;

            /**
             * 行列 CSV を出力する量子ビット数の上限です。
             */
            @Min(0)
            @Max(10)
            private int maxQubits = 6;
        }
    }
}
