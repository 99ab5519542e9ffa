package heatstress.io.dto;

import java.util.List;

/**
 * Formato de intercambio de la salida. Los ejes se copian sin cambios de la entrada.
 * Las celdas ausentes se escriben con {@code fillValue}.
 */
public record WbgtDataset(
        double[] latitudes,
        double[] longitudes,
        double fillValue,
        String exposureMode,
        List<Step> steps
) {

    /**
     * @param bestEffortCells Celdas cuyo globo no alcanzó la tolerancia (valor publicado igualmente).
     * @param degenerateCells Celdas abortadas por derivada plana (ausentes en la salida).
     */
    public record Step(
            String time,
            double[][] wetBulbTemperature,
            double[][] globeTemperature,
            double[][] wbgt,
            int bestEffortCells,
            int degenerateCells
    ) {
    }
}
