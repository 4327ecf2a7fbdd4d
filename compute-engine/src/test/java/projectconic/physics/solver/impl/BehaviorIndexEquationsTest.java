package projectconic.physics.solver.impl;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import projectconic.domain.sounding.ConvergenceStatus;
import projectconic.physics.solver.impl.BehaviorIndexEquations.RowSolution;

import java.lang.reflect.Constructor;
import java.lang.reflect.Modifier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test unitario para {@link BehaviorIndexEquations}.
 * Registro de referencia: qt = 5000 kPa, σv = 100 kPa, σ'v = 80 kPa, Fr = 1 %.
 */
@Slf4j
class BehaviorIndexEquationsTest {

    private static final double QT = 5000.0;
    private static final double SIGMA_TOT = 100.0;
    private static final double SIGMA_EFF = 80.0;
    private static final double FR = 1.0;
    private static final double P_REF = 100.0;
    private static final int MAX_ITER = 999;
    private static final double TOLERANCE = 1e-3;

    @Test
    @DisplayName("El constructor debe ser privado para prohibir la instanciación")
    void constructorIsPrivate() throws NoSuchMethodException {
        Constructor<BehaviorIndexEquations> constructor = BehaviorIndexEquations.class.getDeclaredConstructor();
        assertTrue(Modifier.isPrivate(constructor.getModifiers()), "El constructor debe ser privado.");
    }

    @Test
    @DisplayName("Registro de referencia: converge y es determinista")
    void solve_referenceRow_shouldConvergeDeterministically() {
        // ACT
        RowSolution first = BehaviorIndexEquations.solve(QT, SIGMA_TOT, SIGMA_EFF, FR, P_REF, MAX_ITER, TOLERANCE);
        RowSolution second = BehaviorIndexEquations.solve(QT, SIGMA_TOT, SIGMA_EFF, FR, P_REF, MAX_ITER, TOLERANCE);
        log.info("n={}, Qtn={}, Ic={}, estado={}", first.n(), first.qtn(), first.ic(), first.status());

        // ASSERT
        assertEquals(ConvergenceStatus.CONVERGED, first.status());
        assertEquals(first, second, "Dos ejecuciones deben producir exactamente lo mismo.");
        assertTrue(first.n() > 0.5 && first.n() < 1.0, "n debe quedar entre arenas limosas y arcillas.");

        // Qtn e Ic finales se recalculan con el n aceptado
        assertEquals(BehaviorIndexEquations.calculateQtn(first.n(), QT, SIGMA_TOT, SIGMA_EFF, P_REF), first.qtn());
        assertEquals(BehaviorIndexEquations.calculateIc(first.qtn(), FR), first.ic());
    }

    @Test
    @DisplayName("Criterio de parada: se acepta el candidato siguiente que cumple la tolerancia")
    void solve_shouldReturnLookAheadCandidate() {
        // ARRANGE: iteración manual con el mismo criterio
        double current = 1.0;
        int steps = 0;
        while (true) {
            double qtn = BehaviorIndexEquations.calculateQtn(current, QT, SIGMA_TOT, SIGMA_EFF, P_REF);
            double next = BehaviorIndexEquations.calculateN(BehaviorIndexEquations.calculateIc(qtn, FR), SIGMA_EFF, P_REF);
            steps++;
            boolean done = Math.abs(next - current) <= TOLERANCE;
            current = next;
            if (done) break;
        }
        log.info("Convergencia manual en {} pasos, n={}", steps, current);

        // ACT
        RowSolution solution = BehaviorIndexEquations.solve(QT, SIGMA_TOT, SIGMA_EFF, FR, P_REF, MAX_ITER, TOLERANCE);

        // ASSERT
        assertEquals(current, solution.n());
    }

    @Test
    @DisplayName("max_iter = 1: ningún paso, n = 1 y sin convergencia")
    void solve_maxIterOne_shouldNotIterate() {
        RowSolution solution = BehaviorIndexEquations.solve(QT, SIGMA_TOT, SIGMA_EFF, FR, P_REF, 1, TOLERANCE);

        assertEquals(1.0, solution.n());
        assertEquals(49.0 * 1.25, solution.qtn(), 1e-12);
        assertEquals(ConvergenceStatus.NOT_CONVERGED, solution.status());
    }

    @Test
    @DisplayName("max_iter = 2: exactamente un paso; el estado depende sólo de la tolerancia")
    void solve_maxIterTwo_shouldTakeSingleStep() {
        double qtn0 = BehaviorIndexEquations.calculateQtn(1.0, QT, SIGMA_TOT, SIGMA_EFF, P_REF);
        double expectedN = BehaviorIndexEquations.calculateN(
                BehaviorIndexEquations.calculateIc(qtn0, FR), SIGMA_EFF, P_REF);

        RowSolution strict = BehaviorIndexEquations.solve(QT, SIGMA_TOT, SIGMA_EFF, FR, P_REF, 2, TOLERANCE);
        RowSolution loose = BehaviorIndexEquations.solve(QT, SIGMA_TOT, SIGMA_EFF, FR, P_REF, 2, 1.0);

        assertEquals(expectedN, strict.n());
        assertEquals(ConvergenceStatus.NOT_CONVERGED, strict.status());
        assertEquals(expectedN, loose.n());
        assertEquals(ConvergenceStatus.CONVERGED, loose.status());
    }

    @Test
    @DisplayName("Fr negativo o ausente: no aplicable, sin iterar")
    void solve_invalidFrictionRatio_shouldBeNotApplicable() {
        for (double fr : new double[]{-0.5, -1e-12, Double.NaN, Double.NEGATIVE_INFINITY}) {
            RowSolution solution = BehaviorIndexEquations.solve(QT, SIGMA_TOT, SIGMA_EFF, fr, P_REF, MAX_ITER, TOLERANCE);

            assertEquals(ConvergenceStatus.NOT_APPLICABLE, solution.status(), "Fr=" + fr);
            assertTrue(Double.isNaN(solution.n()));
            assertTrue(Double.isNaN(solution.qtn()));
            assertTrue(Double.isNaN(solution.ic()));
        }
    }

    @Test
    @DisplayName("Resistencia neta negativa: Ic indefinido, n se queda en 1 y converge al primer paso")
    void solve_negativeNetResistance_shouldKeepUnitExponent() {
        // ARRANGE: qt < σv -> Qtn = (50 - 100) / 100 · (100 / 80)^1 = -0.625
        // ACT
        RowSolution solution = BehaviorIndexEquations.solve(50.0, SIGMA_TOT, SIGMA_EFF, FR, P_REF, MAX_ITER, TOLERANCE);

        // ASSERT
        assertEquals(1.0, solution.n());
        assertEquals(-0.625, solution.qtn(), 1e-12);
        assertTrue(Double.isNaN(solution.ic()));
        assertEquals(ConvergenceStatus.CONVERGED, solution.status());
    }

    @Test
    @DisplayName("Tensión efectiva negativa (u0 > σv): n = 1 y Qtn negativo, sin agotar iteraciones")
    void solve_negativeEffectiveStress_shouldKeepUnitExponent() {
        // Qtn = (5000 - 100) / 100 · (100 / -20)^1 = -245
        RowSolution solution = BehaviorIndexEquations.solve(QT, SIGMA_TOT, -20.0, FR, P_REF, MAX_ITER, TOLERANCE);

        assertEquals(1.0, solution.n());
        assertEquals(-245.0, solution.qtn(), 1e-9);
        assertTrue(Double.isNaN(solution.ic()));
        assertEquals(ConvergenceStatus.CONVERGED, solution.status());
    }

    @Test
    @DisplayName("calculateN: un Ic NaN da el tope n = 1")
    void calculateN_nanIc_shouldReturnUpperBound() {
        assertEquals(1.0, BehaviorIndexEquations.calculateN(Double.NaN, SIGMA_EFF, P_REF));
        assertEquals(1.0, BehaviorIndexEquations.calculateN(10.0, SIGMA_EFF, P_REF));
    }

    @Test
    @DisplayName("Fr = 0: se clasifica, Ic infinito")
    void solve_zeroFrictionRatio_shouldGiveInfiniteIc() {
        RowSolution solution = BehaviorIndexEquations.solve(QT, SIGMA_TOT, SIGMA_EFF, 0.0, P_REF, MAX_ITER, TOLERANCE);

        assertEquals(Double.POSITIVE_INFINITY, solution.ic());
        assertEquals(1.0, solution.n());
        assertEquals(ConvergenceStatus.CONVERGED, solution.status());
    }

    @Test
    @DisplayName("Índices secundarios Cd e Ib")
    void secondaryIndices_shouldMatchClosedForm() {
        assertEquals(39.0 * Math.pow(1.06, 17), BehaviorIndexEquations.calculateCd(50.0, 1.0), 1e-9);
        assertEquals(50.0, BehaviorIndexEquations.calculateIb(50.0, 1.0), 1e-12);
        assertTrue(Double.isNaN(BehaviorIndexEquations.calculateIb(Double.NaN, 1.0)));
    }
}
