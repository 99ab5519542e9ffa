package heatstress.physics.solver.impl;

import heatstress.config.GlobeConstants;
import heatstress.config.SolverSettings;
import heatstress.domain.field.GridField;
import heatstress.domain.solver.CellResult;
import heatstress.domain.solver.CellStatus;
import heatstress.domain.solver.GlobeTemperatureResult;
import heatstress.physics.model.EnergyBalanceEquation;
import heatstress.physics.solver.GlobeTemperatureSolver;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.stream.IntStream;

/**
 * Solver de la temperatura del globo por Newton-Raphson, celda a celda.
 * <p>
 * La malla se resuelve como un mapeo puro {@code out[i] = solveCell(in[i])}: cada celda escribe
 * solo su propia posición del array de salida, así que el recorrido puede ser secuencial o
 * paralelo sin sincronización (la barrera es el final del stream).
 * <p>
 * Stateless entre llamadas: la configuración es inmutable y no hay caché.
 */
@Slf4j
@Getter
public class NewtonRaphsonGlobeSolver implements GlobeTemperatureSolver {

    private final GlobeConstants constants;
    private final SolverSettings settings;

    public NewtonRaphsonGlobeSolver() {
        this(GlobeConstants.standard(), SolverSettings.defaults());
    }

    public NewtonRaphsonGlobeSolver(GlobeConstants constants, SolverSettings settings) {
        if (constants == null || settings == null) {
            throw new IllegalArgumentException("Las constantes y la configuración del solver son obligatorias.");
        }
        this.constants = constants;
        this.settings = settings;
    }

    @Override
    public String getName() {
        return "Globe_NewtonRaphson";
    }

    @Override
    public CellResult solveCell(double airTemperature, double shortwave, double windSpeed) {
        // 1. Entrada ausente: no se intenta el cálculo
        if (GridField.isMissingValue(airTemperature)
                || GridField.isMissingValue(shortwave)
                || GridField.isMissingValue(windSpeed)) {
            return CellResult.missingInput();
        }

        // 2-4. Kelvin, recorte del viento y términos fijos del balance
        final double taK = airTemperature + GlobeConstants.KELVIN_OFFSET;
        final EnergyBalanceEquation equation = EnergyBalanceEquation.forCell(taK, shortwave, windSpeed, constants);

        final int maxIterations = settings.maxIterations();
        final double tolerance = settings.tolerance();
        final double derivativeThreshold = settings.derivativeThreshold();

        // 5. Semilla: la temperatura del aire
        double tgPrev = taK;

        for (int iter = 0; iter < maxIterations; iter++) {
            double fVal = equation.value(tgPrev);
            double fPrime = equation.derivative(tgPrev);

            // Derivada plana: se aborta, la celda queda ausente
            if (Math.abs(fPrime) < derivativeThreshold) {
                log.debug("Derivada plana (|f'|={}) en iteración {} con Tg={} K. Celda descartada.", fPrime, iter, tgPrev);
                return CellResult.degenerate(iter);
            }

            double tgNext = tgPrev - fVal / fPrime;

            if (Math.abs(tgNext - tgPrev) < tolerance) {
                return CellResult.converged(tgNext - GlobeConstants.KELVIN_OFFSET, iter + 1);
            }

            // Última iteración sin convergencia: se acepta la última estimación
            if (iter == maxIterations - 1) {
                return CellResult.bestEffort(tgNext - GlobeConstants.KELVIN_OFFSET, iter + 1);
            }

            tgPrev = tgNext;
        }

        // Inalcanzable con maxIterations >= 1 (validado en SolverSettings)
        throw new IllegalStateException("El bucle de Newton terminó sin producir resultado.");
    }

    @Override
    public GlobeTemperatureResult solve(GridField airTemperature, GridField shortwave, GridField windSpeed) {
        validateShapes(airTemperature, shortwave, windSpeed);

        final int rows = airTemperature.rows();
        final int cols = airTemperature.cols();
        final int n = airTemperature.cellCount();
        final CellResult[] cells = new CellResult[n];

        long start = System.currentTimeMillis();

        if (settings.useParallelExecution() && n > settings.parallelThreshold()) {
            IntStream.range(0, n).parallel()
                    .forEach(i -> cells[i] = solveCell(airTemperature.getAt(i), shortwave.getAt(i), windSpeed.getAt(i)));
        } else {
            for (int i = 0; i < n; i++) {
                cells[i] = solveCell(airTemperature.getAt(i), shortwave.getAt(i), windSpeed.getAt(i));
            }
        }

        long elapsed = System.currentTimeMillis() - start;
        GlobeTemperatureResult result = GlobeTemperatureResult.fromCells(rows, cols, cells, elapsed);

        int degenerate = result.countWithStatus(CellStatus.DEGENERATE_DERIVATIVE);
        int bestEffort = result.countWithStatus(CellStatus.BEST_EFFORT);
        if (degenerate > 0) {
            log.warn("{} celdas abortadas por derivada plana en la malla {}.", degenerate, airTemperature.shapeDescription());
        }
        if (bestEffort > 0) {
            log.info("{} celdas sin convergencia tras {} iteraciones (estimación de mejor esfuerzo).",
                    bestEffort, settings.maxIterations());
        }
        log.debug("Malla {} resuelta en {}ms. Estados: {}", airTemperature.shapeDescription(), elapsed, result.statusCounts());

        return result;
    }

    private static void validateShapes(GridField airTemperature, GridField shortwave, GridField windSpeed) {
        if (airTemperature == null || shortwave == null || windSpeed == null) {
            throw new IllegalArgumentException("Los campos de temperatura, radiación y viento son obligatorios.");
        }
        if (!airTemperature.hasSameShape(shortwave) || !airTemperature.hasSameShape(windSpeed)) {
            throw new IllegalArgumentException(String.format(
                    "Formas incompatibles: Ta=%s, SW=%s, WS=%s",
                    airTemperature.shapeDescription(), shortwave.shapeDescription(), windSpeed.shapeDescription()));
        }
    }
}
