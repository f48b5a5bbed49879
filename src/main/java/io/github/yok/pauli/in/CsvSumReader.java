package io.github.yok.pauli.in;

import io.github.yok.pauli.core.algebra.Coefficient;
import io.github.yok.pauli.core.algebra.PauliLabel;
import io.github.yok.pauli.core.sum.OperatorSum;
import io.github.yok.pauli.core.sum.Tolerance;
import io.github.yok.pauli.core.term.Factor;
import io.github.yok.pauli.core.term.OperatorTerm;
import io.github.yok.pauli.core.term.PauliString;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

/**
 * 項 CSV（{@code <name>_terms.csv}）を読み込み、和を再構築するクラスです。
 *
 * <p>
 * 各行を構築用の公開 API（{@link Factor#of}, {@link OperatorTerm#of}, {@link OperatorSum#fromTerms}）に通すため、
 * ファイル上の行順や台の表記ゆれ（サイト順、I 因子）にかかわらず正準形になります。
 * </p>
 */
public final class CsvSumReader {

    /**
     * 許容誤差です。
     */
    private final Tolerance tolerance;

    public CsvSumReader() {
        this(Tolerance.DEFAULT);
    }

    /**
     * 読み込み処理を生成します。
     *
     * @param tolerance 再構築に用いる許容誤差です（null 不可）
     */
    public CsvSumReader(Tolerance tolerance) {
        if (tolerance == null) {
            throw new IllegalArgumentException("tolerance は null 不可です");
        }
        this.tolerance = tolerance;
    }

    /**
     * 項 CSV を読み込みます。
     *
     * @param file 項 CSV です（null 不可）
     * @return 正準形の和です
     * @throws IllegalArgumentException 内容が不正な場合に発生します
     * @throws IllegalStateException 読み込みに失敗した場合に発生します
     */
    public OperatorSum read(Path file) {
        if (file == null) {
            throw new IllegalArgumentException("file は null 不可です");
        }
        CSVFormat format = CSVFormat.Builder.create(CSVFormat.DEFAULT).setHeader()
                .setSkipHeaderRecord(true).build();

        List<OperatorTerm> terms = new ArrayList<>();
        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8);
                CSVParser parser = format.parse(r)) {
            for (CSVRecord record : parser) {
                terms.add(toTerm(record));
            }
        } catch (IOException e) {
            throw new IllegalStateException("CSV 読み込みに失敗しました: " + file, e);
        }
        return OperatorSum.fromTerms(terms, tolerance);
    }

    private static OperatorTerm toTerm(CSVRecord record) {
        try {
            double re = Double.parseDouble(record.get("real"));
            double im = Double.parseDouble(record.get("imaginary"));
            PauliString support = parseSupport(record.get("support"));
            return OperatorTerm.of(support, Coefficient.of(re, im));
        } catch (IllegalArgumentException e) {
            // NumberFormatException / DuplicateSiteException もここに来る
            throw new IllegalArgumentException(
                    "項 CSV の " + record.getRecordNumber() + " 行目が不正です: " + e.getMessage(), e);
        }
    }

    /**
     * {@code "X0 Y1"} 形式（恒等演算子は {@code "I"}）の台を読み取ります。
     *
     * @param text 台の文字列です
     * @return 台です
     * @throws IllegalArgumentException 書式が不正な場合に発生します
     */
    static PauliString parseSupport(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty() || "I".equals(trimmed)) {
            return PauliString.IDENTITY;
        }
        List<Factor> factors = new ArrayList<>();
        for (String token : trimmed.split("\\s+")) {
            if (token.length() < 2) {
                throw new IllegalArgumentException("因子の書式が不正です: " + token);
            }
            PauliLabel label = PauliLabel.fromSymbol(token.charAt(0));
            int site = Integer.parseInt(token.substring(1));
            factors.add(Factor.of(site, label));
        }
        return PauliString.of(factors);
    }
}
