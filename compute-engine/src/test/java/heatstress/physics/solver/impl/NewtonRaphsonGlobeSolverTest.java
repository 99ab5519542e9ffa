package heatstress.physics.solver.impl;

import heatstress.config.GlobeConstants;
import heatstress.config.SolverSettings;
import heatstress.domain.field.GridField;
import heatstress.domain.solver.CellResult;
import heatstress.domain.solver.CellStatus;
import heatstress.domain.solver.GlobeTemperatureResult;
import heatstress.physics.model.EnergyBalanceEquation;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Test unitario del solver de temperatura de globo.
 * Se centra en la robustez del método Newton-Raphson y en la propagación de celdas ausentes.
 */
@Slf4j
class NewtonRaphsonGlobeSolverTest {

    private static final GlobeConstants CONSTANTS = GlobeConstants.standard();
    private static final double MISSING = GridField.MISSING;

    private NewtonRaphsonGlobeSolver solver;

    @BeforeEach
    void setUp() {
        solver = new NewtonRaphsonGlobeSolver(CONSTANTS, SolverSettings.defaults());
    }

    // --------------------------------------------------------------------------
    // Escenarios de una celda
    // --------------------------------------------------------------------------

    @Test
    @DisplayName("Escenario concreto: Ta=35°C, SW=1000, WS=1 -> 35°C < Tg < 70°C")
    void solveCell_concreteScenario_shouldBePhysicallyPlausible() {
        CellResult result = solver.solveCell(35.0, 1000.0, 1.0);

        log.info("Tg={}°C tras {} iteraciones ({})", result.globeTemperature(), result.iterations(), result.status());

        assertEquals(CellStatus.CONVERGED, result.status());
        assertThat(result.globeTemperature()).isGreaterThan(35.0).isLessThan(70.0);
        assertThat(result.iterations()).isLessThanOrEqualTo(100);
    }

    @ParameterizedTest(name = "Ta={0}°C, SW={1} W/m²")
    @CsvSource({"30, 800", "35, 1000", "0, 200", "-10, 0", "45, 1200"})
    @DisplayName("Sin viento: coincide con la solución cerrada (left/(ε·σ))^0.25")
    void solveCell_zeroWind_shouldMatchClosedForm(double ta, double sw) {
        double taK = ta + GlobeConstants.KELVIN_OFFSET;
        double left = CONSTANTS.solarAbsorptivity() * sw
                + CONSTANTS.longwaveEmissivity() * CONSTANTS.atmosphericEmissivity()
                * CONSTANTS.stefanBoltzmann() * Math.pow(taK, 4);
        double expected = Math.pow(left / (CONSTANTS.longwaveEmissivity() * CONSTANTS.stefanBoltzmann()), 0.25)
                - GlobeConstants.KELVIN_OFFSET;

        CellResult result = solver.solveCell(ta, sw, 0.0);

        assertEquals(CellStatus.CONVERGED, result.status());
        assertEquals(expected, result.globeTemperature(), 0.01);
        assertEquals(EnergyBalanceEquation.forCell(taK, sw, 0.0, CONSTANTS).radiativeEquilibriumKelvin()
                - GlobeConstants.KELVIN_OFFSET, result.globeTemperature(), 0.01);
    }

    @Test
    @DisplayName("Sin viento y con sol fuerte (Ta=30, SW=800) el globo queda claramente por encima del aire")
    void solveCell_zeroWindStrongSun_shouldHeatGlobe() {
        CellResult result = solver.solveCell(30.0, 800.0, 0.0);

        assertThat(result.globeTemperature()).isGreaterThan(30.0 + 5.0);
    }

    @Test
    @DisplayName("Viento negativo (-5 m/s) produce exactamente el mismo resultado que viento nulo")
    void solveCell_negativeWind_shouldEqualZeroWind() {
        CellResult negative = solver.solveCell(28.0, 650.0, -5.0);
        CellResult zero = solver.solveCell(28.0, 650.0, 0.0);

        assertEquals(zero, negative);
    }

    @Test
    @DisplayName("Monotonía: a Ta y WS fijos, más radiación nunca enfría el globo")
    void solveCell_increasingShortwave_shouldNotDecreaseGlobeTemperature() {
        for (double ws : new double[]{0.0, 1.0, 5.0, 15.0}) {
            double previous = Double.NEGATIVE_INFINITY;
            for (double sw = 0.0; sw <= 1200.0; sw += 50.0) {
                double tg = solver.solveCell(25.0, sw, ws).globeTemperature();
                assertThat(tg).as("SW=%s, WS=%s", sw, ws).isGreaterThanOrEqualTo(previous);
                previous = tg;
            }
        }
    }

    @Test
    @DisplayName("Entrada ausente en cualquiera de los tres campos: celda ausente sin iterar")
    void solveCell_missingInput_shouldNotCompute() {
        assertEquals(CellResult.missingInput(), solver.solveCell(MISSING, 500.0, 1.0));
        assertEquals(CellResult.missingInput(), solver.solveCell(20.0, MISSING, 1.0));
        assertEquals(CellResult.missingInput(), solver.solveCell(20.0, 500.0, MISSING));
        assertEquals(0, solver.solveCell(20.0, 500.0, MISSING).iterations());
    }

    @Test
    @DisplayName("Entrada no finita (±Infinito) se trata como ausente, nunca como valor")
    void solveCell_nonFiniteInput_shouldBeTreatedAsMissing() {
        assertEquals(CellResult.missingInput(), solver.solveCell(Double.POSITIVE_INFINITY, 500.0, 1.0));
        assertEquals(CellResult.missingInput(), solver.solveCell(20.0, Double.NEGATIVE_INFINITY, 1.0));
        assertEquals(CellResult.missingInput(), solver.solveCell(20.0, 500.0, Double.POSITIVE_INFINITY));
        assertFalse(solver.solveCell(Double.POSITIVE_INFINITY, 500.0, 1.0).hasValue());
    }

    @Test
    @DisplayName("Derivada plana en la semilla: aire a 0 K y sin viento -> f'(TaK) = 0, celda ausente")
    void solveCell_flatDerivativeAtSeed_shouldLeaveCellMissing() {
        CellResult result = solver.solveCell(-GlobeConstants.KELVIN_OFFSET, 500.0, 0.0);

        assertEquals(CellStatus.DEGENERATE_DERIVATIVE, result.status());
        assertTrue(GridField.isMissingValue(result.globeTemperature()));
        assertFalse(result.hasValue());
        assertEquals(0, result.iterations());
    }

    @Test
    @DisplayName("Derivada plana tras el primer paso: la celda se aborta aunque la semilla fuese válida")
    void solveCell_flatDerivativeAfterFirstStep_shouldAbortCell() {
        // Ta=20°C, sin sol ni viento: la raíz está por debajo de TaK, el primer paso baja Tg
        // y f'(Tg) cae de ~5.43 a ~4.84, por debajo del umbral 5.0.
        double taK = 20.0 + GlobeConstants.KELVIN_OFFSET;
        EnergyBalanceEquation eq = EnergyBalanceEquation.forCell(taK, 0.0, 0.0, CONSTANTS);
        double firstEstimate = taK - eq.value(taK) / eq.derivative(taK);
        assertThat(eq.derivative(taK)).isGreaterThan(5.0);
        assertThat(eq.derivative(firstEstimate)).isLessThan(5.0);

        NewtonRaphsonGlobeSolver strictSolver = new NewtonRaphsonGlobeSolver(
                CONSTANTS, SolverSettings.defaults().withDerivativeThreshold(5.0));

        CellResult result = strictSolver.solveCell(20.0, 0.0, 0.0);

        assertEquals(CellStatus.DEGENERATE_DERIVATIVE, result.status());
        assertEquals(1, result.iterations());
        assertTrue(GridField.isMissingValue(result.globeTemperature()));
    }

    @Test
    @DisplayName("Sin convergencia en el techo de iteraciones: se publica la última estimación de Newton")
    void solveCell_iterationCeiling_shouldReturnLastNewtonEstimate() {
        NewtonRaphsonGlobeSolver oneStep = new NewtonRaphsonGlobeSolver(
                CONSTANTS, SolverSettings.defaults().withMaxIterations(1));
        double taK = 35.0 + GlobeConstants.KELVIN_OFFSET;
        EnergyBalanceEquation eq = EnergyBalanceEquation.forCell(taK, 1000.0, 1.0, CONSTANTS);
        double expected = taK - eq.value(taK) / eq.derivative(taK) - GlobeConstants.KELVIN_OFFSET;

        CellResult result = oneStep.solveCell(35.0, 1000.0, 1.0);
        CellResult converged = solver.solveCell(35.0, 1000.0, 1.0);

        log.info("Mejor esfuerzo={}°C (esperado {}), convergido={}°C",
                result.globeTemperature(), expected, converged.globeTemperature());

        assertEquals(CellStatus.BEST_EFFORT, result.status());
        assertEquals(1, result.iterations());
        assertTrue(result.hasValue());
        assertEquals(expected, result.globeTemperature(), 1e-12);
        assertThat(Math.abs(result.globeTemperature() - converged.globeTemperature())).isGreaterThan(0.01);
    }

    @Test
    @DisplayName("Techo de dos iteraciones: se publica el segundo paso de Newton, no el primero")
    void solveCell_twoIterationCeiling_shouldPublishSecondEstimate() {
        NewtonRaphsonGlobeSolver twoSteps = new NewtonRaphsonGlobeSolver(
                CONSTANTS, SolverSettings.defaults().withMaxIterations(2));
        double taK = -20.0 + GlobeConstants.KELVIN_OFFSET;
        EnergyBalanceEquation eq = EnergyBalanceEquation.forCell(taK, 1200.0, 0.0, CONSTANTS);
        double tg1 = taK - eq.value(taK) / eq.derivative(taK);
        double tg2 = tg1 - eq.value(tg1) / eq.derivative(tg1);

        CellResult result = twoSteps.solveCell(-20.0, 1200.0, 0.0);

        assertEquals(CellStatus.BEST_EFFORT, result.status());
        assertEquals(2, result.iterations());
        assertEquals(tg2 - GlobeConstants.KELVIN_OFFSET, result.globeTemperature(), 1e-12);
    }

    @Test
    @DisplayName("Constantes alternativas: un globo más grande convecta menos y se calienta más con viento")
    void solveCell_alternativeConstants_shouldChangeResult() {
        NewtonRaphsonGlobeSolver largeGlobe = new NewtonRaphsonGlobeSolver(
                CONSTANTS.withGlobeDiameter(0.15), SolverSettings.defaults());

        double standard = solver.solveCell(30.0, 900.0, 4.0).globeTemperature();
        double large = largeGlobe.solveCell(30.0, 900.0, 4.0).globeTemperature();

        assertThat(large).isGreaterThan(standard);
    }

    // --------------------------------------------------------------------------
    // Malla completa
    // --------------------------------------------------------------------------

    @Test
    @DisplayName("Forma y ausencias: la salida tiene la forma de la entrada y hereda las celdas ausentes")
    void solve_shouldPreserveShapeAndPropagateMissing() {
        GridField ta = GridField.fromRows(new double[][]{{30.0, MISSING, 25.0}, {20.0, 22.0, 18.0}});
        GridField sw = GridField.fromRows(new double[][]{{800.0, 700.0, 600.0}, {MISSING, 100.0, 0.0}});
        GridField ws = GridField.fromRows(new double[][]{{1.0, 2.0, 3.0}, {1.0, 2.0, MISSING}});

        GlobeTemperatureResult result = solver.solve(ta, sw, ws);
        GridField tg = result.getGlobeTemperature();

        assertTrue(tg.hasSameShape(ta));
        assertTrue(tg.isMissing(0, 1));
        assertTrue(tg.isMissing(1, 0));
        assertTrue(tg.isMissing(1, 2));
        assertFalse(tg.isMissing(0, 0));
        assertFalse(tg.isMissing(1, 1));
        assertEquals(3, result.countWithStatus(CellStatus.MISSING_INPUT));
        assertEquals(3, result.countWithStatus(CellStatus.CONVERGED));

        for (int i = 0; i < tg.cellCount(); i++) {
            double v = tg.getAt(i);
            assertTrue(GridField.isMissingValue(v) || Double.isFinite(v));
        }
    }

    @Test
    @DisplayName("Los campos de entrada no se modifican")
    void solve_shouldNotMutateInputs() {
        GridField ta = GridField.uniform(3, 3, 25.0);
        GridField sw = GridField.uniform(3, 3, 500.0);
        GridField ws = GridField.uniform(3, 3, 2.0);
        GridField taCopy = GridField.of(3, 3, ta.clonePackedValues());

        solver.solve(ta, sw, ws);

        assertEquals(taCopy, ta);
    }

    @Test
    @DisplayName("Formas incompatibles: falla rápido con IllegalArgumentException")
    void solve_shapeMismatch_shouldFailFast() {
        GridField ta = GridField.uniform(2, 3, 25.0);
        GridField sw = GridField.uniform(3, 2, 500.0);
        GridField ws = GridField.uniform(2, 3, 1.0);

        assertThatThrownBy(() -> solver.solve(ta, sw, ws))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Formas incompatibles");
        assertThatThrownBy(() -> solver.solve(ta, null, ws))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Idempotencia: dos ejecuciones sobre la misma entrada son idénticas bit a bit")
    void solve_shouldBeIdempotent() {
        GridField[] inputs = randomInputs(20, 30, 42L);

        GridField first = solver.solve(inputs[0], inputs[1], inputs[2]).getGlobeTemperature();
        GridField second = solver.solve(inputs[0], inputs[1], inputs[2]).getGlobeTemperature();

        assertArrayEquals(first.clonePackedValues(), second.clonePackedValues());
    }

    @Test
    @DisplayName("Recorrido paralelo: mismo resultado que el secuencial")
    void solve_parallel_shouldMatchSequential() {
        GridField[] inputs = randomInputs(120, 120, 7L);
        NewtonRaphsonGlobeSolver parallel = new NewtonRaphsonGlobeSolver(CONSTANTS,
                SolverSettings.defaults().withUseParallelExecution(true).withParallelThreshold(1_000));

        GlobeTemperatureResult seq = solver.solve(inputs[0], inputs[1], inputs[2]);
        GlobeTemperatureResult par = parallel.solve(inputs[0], inputs[1], inputs[2]);

        assertEquals(seq.getGlobeTemperature(), par.getGlobeTemperature());
        assertArrayEquals(seq.cloneStatuses(), par.cloneStatuses());
        assertArrayEquals(seq.cloneIterations(), par.cloneIterations());
    }

    @Test
    @DisplayName("Regresión de convergencia: >=99% de celdas en rangos físicos convergen en 20 iteraciones o menos")
    void solve_typicalRanges_shouldConvergeQuickly() {
        GridField[] inputs = randomInputs(100, 100, 2024L);

        GlobeTemperatureResult result = solver.solve(inputs[0], inputs[1], inputs[2]);

        int[] iterations = result.cloneIterations();
        int fast = 0;
        int maxIterations = 0;
        for (int it : iterations) {
            if (it <= 20) fast++;
            maxIterations = Math.max(maxIterations, it);
        }
        double ratio = fast / (double) iterations.length;
        log.info("Celdas rápidas: {}%, iteraciones máximas: {}", ratio * 100, maxIterations);

        assertThat(ratio).isGreaterThanOrEqualTo(0.99);
        assertEquals(iterations.length, result.countWithStatus(CellStatus.CONVERGED));
    }

    @Test
    @DisplayName("El nombre del componente identifica el método")
    void getName_shouldIdentifySolver() {
        assertEquals("Globe_NewtonRaphson", solver.getName());
    }

    /**
     * Ta ∈ [-20, 50] °C, SW ∈ [0, 1200] W/m², WS ∈ [0, 20] m/s.
     */
    private static GridField[] randomInputs(int rows, int cols, long seed) {
        Random random = new Random(seed);
        int n = rows * cols;
        double[] ta = new double[n];
        double[] sw = new double[n];
        double[] ws = new double[n];
        for (int i = 0; i < n; i++) {
            ta[i] = -20.0 + 70.0 * random.nextDouble();
            sw[i] = 1200.0 * random.nextDouble();
            ws[i] = 20.0 * random.nextDouble();
        }
        return new GridField[]{GridField.of(rows, cols, ta), GridField.of(rows, cols, sw), GridField.of(rows, cols, ws)};
    }
}
