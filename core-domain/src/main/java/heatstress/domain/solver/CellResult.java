package heatstress.domain.solver;

import heatstress.domain.field.GridField;

/**
 * Resultado de una celda: estado, temperatura del globo en °C (o {@link GridField#MISSING})
 * y número de pasos de Newton ejecutados.
 */
public record CellResult(CellStatus status, double globeTemperature, int iterations) {

    private static final CellResult MISSING_INPUT = new CellResult(CellStatus.MISSING_INPUT, GridField.MISSING, 0);

    public static CellResult converged(double globeTemperature, int iterations) {
        return new CellResult(CellStatus.CONVERGED, globeTemperature, iterations);
    }

    public static CellResult bestEffort(double globeTemperature, int iterations) {
        return new CellResult(CellStatus.BEST_EFFORT, globeTemperature, iterations);
    }

    public static CellResult degenerate(int iterations) {
        return new CellResult(CellStatus.DEGENERATE_DERIVATIVE, GridField.MISSING, iterations);
    }

    public static CellResult missingInput() {
        return MISSING_INPUT;
    }

    public boolean hasValue() {
        return status.hasValue();
    }
}
