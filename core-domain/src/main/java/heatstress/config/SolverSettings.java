package heatstress.config;

import lombok.Builder;
import lombok.With;

/**
 * Parámetros del método Newton-Raphson y de la estrategia de recorrido de la malla.
 *
 * @param maxIterations        Techo de iteraciones por celda. Actúa como único "timeout" del solver.
 * @param tolerance            Tolerancia de convergencia en Kelvin sobre |Tg_next - Tg|.
 * @param derivativeThreshold  Si |f'(Tg)| cae por debajo de este valor la celda se aborta (derivada plana).
 * @param useParallelExecution Si es true, recorre las celdas con un stream paralelo (ForkJoinPool común).
 * @param parallelThreshold    Número mínimo de celdas para que compense paralelizar.
 */
@Builder
@With
public record SolverSettings(
        int maxIterations,
        double tolerance,
        double derivativeThreshold,
        boolean useParallelExecution,
        int parallelThreshold
) {

    public SolverSettings {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("El número máximo de iteraciones debe ser al menos 1.");
        }
        if (tolerance <= 0) {
            throw new IllegalArgumentException("La tolerancia de convergencia debe ser positiva.");
        }
        if (derivativeThreshold < 0) {
            throw new IllegalArgumentException("El umbral de derivada no puede ser negativo.");
        }
    }

    public static SolverSettings defaults() {
        return new SolverSettings(100, 0.01, 1e-7, false, 10_000);
    }
}
