package io.github.yok.pauli.out;

import io.github.yok.pauli.core.linearalgebra.MatrixBackend;
import io.github.yok.pauli.core.sum.OperatorSum;
import io.github.yok.pauli.core.term.OperatorTerm;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.ejml.data.ZMatrixRMaj;

/**
 * 計算結果を CSV に出力するクラスです。
 *
 * <p>
 * 出力ファイル名は、以下の命名規約に従います（name は出力名）。
 * </p>
 *
 * <ul>
 * <li>{@code <name>_terms.csv}（正準順の項: term, real, imaginary, support）</li>
 * <li>{@code <name>_meta.csv}（演算名、項数、量子ビット数、エルミート性）</li>
 * <li>{@code <name>_matrix.csv}（行列バックエンドが設定され、量子ビット数が上限以下の場合のみ。非零要素: row, col, real,
 * imaginary）</li>
 * </ul>
 *
 * <p>
 * 係数は {@link Double#toString(double)} で出力するため、読み戻しで値が変化しません。
 * </p>
 */
@Slf4j
public final class CsvResultWriter implements ResultWriter {

    /**
     * 項 CSV のヘッダです。
     */
    static final String[] TERM_HEADER = {"term", "real", "imaginary", "support"};

    /**
     * 出力先ディレクトリです。
     */
    private final Path outputDir;

    /**
     * 行列バックエンドです（null の場合は行列を出力しません）。
     */
    private final MatrixBackend matrixBackend;

    /**
     * 行列を出力する量子ビット数の上限です。
     */
    private final int matrixMaxQubits;

    /**
     * 項とメタ情報だけを出力する CSV 出力を生成します。
     *
     * @param outputDir 出力先ディレクトリです
     */
    public CsvResultWriter(String outputDir) {
        this(outputDir, null, 0);
    }

    /**
     * CSV 出力を生成します。
     *
     * @param outputDir 出力先ディレクトリです
     * @param matrixBackend 行列バックエンドです（null 可）
     * @param matrixMaxQubits 行列を出力する量子ビット数の上限です（0 以上）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public CsvResultWriter(String outputDir, MatrixBackend matrixBackend, int matrixMaxQubits) {
        if (outputDir == null || outputDir.isEmpty()) {
            throw new IllegalArgumentException("output.dir は必須です");
        }
        if (matrixMaxQubits < 0) {
            throw new IllegalArgumentException(
                    "matrixMaxQubits は 0 以上を指定してください: " + matrixMaxQubits);
        }
        this.outputDir = Paths.get(outputDir);
        this.matrixBackend = matrixBackend;
        this.matrixMaxQubits = matrixMaxQubits;
    }

    /**
     * 計算結果を出力します。
     *
     * @param name 出力名です（空不可）
     * @param operation 実行した演算の名前です
     * @param result 計算結果の和です（null 不可）
     * @param hermitian 結果がエルミートかどうかです
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void write(String name, String operation, OperatorSum result, boolean hermitian) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("name は必須です");
        }
        if (result == null) {
            throw new IllegalArgumentException("result は null 不可です");
        }

        try {
            Files.createDirectories(outputDir);

            // 1) 項（正準順）
            writeTermsCsv(outputDir.resolve(name + "_terms.csv"), result);

            // 2) メタ情報
            writeMetaCsv(outputDir.resolve(name + "_meta.csv"), operation, result, hermitian);

            // 3) 行列（任意）
            if (matrixBackend != null && result.qubitCount() <= matrixMaxQubits) {
                writeMatrixCsv(outputDir.resolve(name + "_matrix.csv"), result);
            } else if (matrixBackend != null) {
                log.info("量子ビット数が上限を超えるため行列出力を省略します。量子ビット数={}、上限={}",
                        result.qubitCount(), matrixMaxQubits);
            }
        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + outputDir, e);
        }

        log.info("計算結果を出力しました。出力先={}、名前={}、項数={}", outputDir, name, result.size());
    }

    /**
     * 正準順の項を出力します。
     *
     * @param file 出力ファイルです
     * @param sum 和です
     * @throws IOException 出力に失敗した場合に発生します
     */
    static void writeTermsCsv(Path file, OperatorSum sum) throws IOException {
        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader(TERM_HEADER).build().print(w)) {

            int index = 0;
            for (OperatorTerm t : sum) {
                pr.printRecord(index++, unsigned(t.getCoefficient().getReal()),
                        unsigned(t.getCoefficient().getImaginary()), t.getSupport().toString());
            }
        }
    }

    private static void writeMetaCsv(Path file, String operation, OperatorSum sum,
            boolean hermitian) throws IOException {
        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("key", "value").build().print(w)) {

            pr.printRecord("operation", operation);
            pr.printRecord("termCount", sum.size());
            pr.printRecord("qubitCount", sum.qubitCount());
            pr.printRecord("hermitian", hermitian);
        }
    }

    /**
     * 行列の非零要素を出力します。
     *
     * @param file 出力ファイルです
     * @param sum 和です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeMatrixCsv(Path file, OperatorSum sum) throws IOException {
        // 呼び出し側で matrixMaxQubits 以下を確認済み
        ZMatrixRMaj m = matrixBackend.toMatrix(sum, (int) sum.qubitCount());

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("row", "col", "real", "imaginary").build().print(w)) {

            for (int row = 0; row < m.numRows; row++) {
                for (int col = 0; col < m.numCols; col++) {
                    double re = m.getReal(row, col);
                    double im = m.getImag(row, col);
                    if (re != 0.0 || im != 0.0) {
                        pr.printRecord(row, col, unsigned(re), unsigned(im));
                    }
                }
            }
        }
    }

    /**
     * -0.0 を 0.0 に揃えます（それ以外の値はそのまま）。
     *
     * @param value 値です
     * @return 出力する値です
     */
    private static double unsigned(double value) {
        return value + 0.0;
    }
}
