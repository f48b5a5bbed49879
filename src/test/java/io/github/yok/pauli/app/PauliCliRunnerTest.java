package io.github.yok.pauli.app;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.pauli.core.engine.OperatorAlgebra;
import io.github.yok.pauli.core.linearalgebra.EjmlDenseMatrixBackend;
import io.github.yok.pauli.out.CsvResultWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PauliCliRunnerTest {

    @TempDir
    Path tempDir;

    @Test
    void run_writesResultFiles() throws IOException {
        PauliAlgebraProperties properties = new PauliAlgebraProperties();
        properties.setJob(JobFixtures.heisenbergCommutator());
        PauliCliRunner runner = new PauliCliRunner(properties,
                new OperatorJobExecutor(new OperatorAlgebra()),
                new CsvResultWriter(tempDir.toString(), new EjmlDenseMatrixBackend(), 6));

        runner.run();

        List<String> terms = Files.readAllLines(tempDir.resolve("heisenberg_commutator_terms.csv"),
                StandardCharsets.UTF_8);
        assertEquals(List.of("term,real,imaginary,support", "0,0.0,2.0,X0 Y1",
                "1,0.0,-2.0,Y0 X1"), terms);

        List<String> meta = Files.readAllLines(tempDir.resolve("heisenberg_commutator_meta.csv"),
                StandardCharsets.UTF_8);
        assertTrue(meta.contains("operation,COMMUTATOR"));
        assertTrue(meta.contains("hermitian,false"));
        assertTrue(Files.exists(tempDir.resolve("heisenberg_commutator_matrix.csv")));
    }
}
