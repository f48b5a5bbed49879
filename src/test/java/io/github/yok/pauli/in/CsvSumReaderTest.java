package io.github.yok.pauli.in;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.pauli.core.RandomOperators;
import io.github.yok.pauli.core.algebra.Coefficient;
import io.github.yok.pauli.core.algebra.PauliLabel;
import io.github.yok.pauli.core.sum.OperatorSum;
import io.github.yok.pauli.core.term.DuplicateSiteException;
import io.github.yok.pauli.core.term.Factor;
import io.github.yok.pauli.core.term.OperatorTerm;
import io.github.yok.pauli.core.term.PauliString;
import io.github.yok.pauli.out.CsvResultWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvSumReaderTest {

    @TempDir
    Path tempDir;

    private final CsvSumReader reader = new CsvSumReader();

    private Path csv(String... lines) throws IOException {
        return Files.write(tempDir.resolve("input_terms.csv"), List.of(lines),
                StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("出力した項 CSV を読み戻すと同じ和になる")
    void read_writtenTerms() {
        OperatorSum original = new RandomOperators(77L, 5).sumWithRealNoise(30);
        new CsvResultWriter(tempDir.toString()).write("rt", "ADD", original, false);

        OperatorSum restored = reader.read(tempDir.resolve("rt_terms.csv"));

        assertEquals(original, restored);
    }

    @Test
    @DisplayName("行順や台の表記ゆれは正準化される")
    void read_canonicalizesRows() throws IOException {
        Path file = csv("term,real,imaginary,support", "0,1.0,0.0,Z3 X0", "1,2.0,0.0,I",
                "2,0.5,0.5,X0 I1 Z3", "3,-1.0,0.0,");

        OperatorSum sum = reader.read(file);

        assertEquals(2, sum.size());
        assertEquals(Coefficient.real(1.0), sum.coefficientOf(PauliString.IDENTITY));
        assertEquals(Coefficient.of(1.5, 0.5), sum.coefficientOf(
                PauliString.of(Factor.of(0, PauliLabel.X), Factor.of(3, PauliLabel.Z))));
    }

    @Test
    void read_headerOnlyIsEmpty() throws IOException {
        assertTrue(reader.read(csv("term,real,imaginary,support")).isZero());
    }

    @Test
    void read_rejectsMalformedRows() throws IOException {
        assertThrows(IllegalArgumentException.class,
                () -> reader.read(csv("term,real,imaginary,support", "0,1.0,0.0,Q1")));
        assertThrows(IllegalArgumentException.class,
                () -> reader.read(csv("term,real,imaginary,support", "0,abc,0.0,X1")));
        assertThrows(IllegalArgumentException.class,
                () -> reader.read(csv("term,real,imaginary,support", "0,1.0,0.0,X-1")));

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> reader.read(csv("term,real,imaginary,support", "0,1.0,0.0,X0 Y0")));
        assertTrue(ex.getCause() instanceof DuplicateSiteException);
    }

    @Test
    void read_missingFileIsIllegalState() {
        assertThrows(IllegalStateException.class,
                () -> reader.read(tempDir.resolve("missing.csv")));
    }

    @Test
    void parseSupport() {
        assertEquals(PauliString.IDENTITY, CsvSumReader.parseSupport(" I "));
        assertEquals(OperatorTerm.of(1.0, Factor.of(12, PauliLabel.Y)).getSupport(),
                CsvSumReader.parseSupport("Y12"));
        assertThrows(IllegalArgumentException.class, () -> CsvSumReader.parseSupport("X"));
    }
}
