package io.github.yok.pauli.app;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.pauli.core.algebra.PauliLabel;
import io.github.yok.pauli.core.sum.Tolerance;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import javax.validation.ConstraintViolation;
import javax.validation.Validation;
import javax.validation.Validator;
import javax.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

class PauliAlgebraPropertiesTest {

    private static ValidatorFactory validatorFactory;

    private static Validator validator;

    @BeforeAll
    static void setUpValidator() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
        validator = validatorFactory.getValidator();
    }

    @AfterAll
    static void closeValidator() {
        validatorFactory.close();
    }

    private static PauliAlgebraProperties bind(Map<String, String> source) {
        Binder binder = new Binder(new MapConfigurationPropertySource(source));
        return binder.bind("pauli", PauliAlgebraProperties.class)
                .orElseGet(PauliAlgebraProperties::new);
    }

    @Test
    void defaults() {
        PauliAlgebraProperties p = new PauliAlgebraProperties();

        assertEquals(0.0, p.getTolerance().getAbsolute());
        assertEquals(Tolerance.DEFAULT_RELATIVE, p.getTolerance().getRelative());
        assertFalse(p.getParallel().isEnabled());
        assertEquals(PauliAlgebraProperties.Job.Operation.MULTIPLY, p.getJob().getOperation());
        assertTrue(p.getJob().getLeft().isEmpty());
        assertEquals("./out", p.getOutput().getDir());
        assertTrue(validator.validate(p).isEmpty());
    }

    @Test
    @DisplayName("ケバブケースのキーと項一覧を束縛できる")
    void bind_jobAndOptions() {
        Map<String, String> source = new HashMap<>();
        source.put("pauli.tolerance.absolute", "1e-10");
        source.put("pauli.parallel.enabled", "true");
        source.put("pauli.parallel.threshold", "2048");
        source.put("pauli.job.name", "bond");
        source.put("pauli.job.operation", "anticommutator");
        source.put("pauli.job.left[0].real", "0.5");
        source.put("pauli.job.left[0].factors[0].site", "1");
        source.put("pauli.job.left[0].factors[0].label", "Y");
        source.put("pauli.job.right[0].imaginary", "2.0");
        source.put("pauli.output.matrix.enabled", "true");
        source.put("pauli.output.matrix.max-qubits", "4");

        PauliAlgebraProperties p = bind(source);

        assertEquals(1e-10, p.getTolerance().getAbsolute());
        assertTrue(p.getParallel().isEnabled());
        assertEquals(2048L, p.getParallel().getThreshold());
        assertEquals("bond", p.getJob().getName());
        assertEquals(PauliAlgebraProperties.Job.Operation.ANTICOMMUTATOR,
                p.getJob().getOperation());
        assertEquals(1, p.getJob().getLeft().size());
        PauliAlgebraProperties.TermSpec left = p.getJob().getLeft().get(0);
        assertEquals(0.5, left.getReal());
        assertEquals(1, left.getFactors().get(0).getSite());
        assertEquals(PauliLabel.Y, left.getFactors().get(0).getLabel());
        PauliAlgebraProperties.TermSpec right = p.getJob().getRight().get(0);
        assertEquals(1.0, right.getReal());
        assertEquals(2.0, right.getImaginary());
        assertTrue(right.getFactors().isEmpty());
        assertEquals(4, p.getOutput().getMatrix().getMaxQubits());
        assertTrue(validator.validate(p).isEmpty());
    }

    @Test
    @DisplayName("負のサイト・ラベル欠落・上限超えの行列設定は検証で拒否される")
    void validate_rejectsInvalidValues() {
        PauliAlgebraProperties p = new PauliAlgebraProperties();
        PauliAlgebraProperties.FactorSpec negative = JobFixtures.factor(PauliLabel.X, -1);
        PauliAlgebraProperties.FactorSpec noLabel = JobFixtures.factor(null, 0);
        p.getJob().getLeft().add(JobFixtures.term(1.0, 0.0, negative, noLabel));
        p.getOutput().getMatrix().setMaxQubits(11);
        p.getParallel().setThreshold(0);

        Set<ConstraintViolation<PauliAlgebraProperties>> violations = validator.validate(p);

        assertEquals(4, violations.size());
    }

    @Test
    void validate_rejectsRelativeToleranceOfOne() {
        PauliAlgebraProperties p = new PauliAlgebraProperties();
        p.getTolerance().setRelative(1.0);

        assertEquals(1, validator.validate(p).size());
    }

    @Test
    void toMultilineString_listsSections() {
        PauliAlgebraProperties p = new PauliAlgebraProperties();
        p.setJob(JobFixtures.heisenbergCommutator());

        String text = p.toMultilineString();

        assertTrue(text.contains("  tolerance:"));
        assertTrue(text.contains("    operation: COMMUTATOR"));
        assertTrue(text.contains("    left.terms: 3"));
        assertTrue(text.contains("    matrix.maxQubits: 6"));
        assertTrue(p.toString().contains("operation: COMMUTATOR"));
    }
}
