package heatstress.io.dto;

import java.util.List;

/**
 * Formato de intercambio de la entrada: rejilla regular con sus ejes y una lista de pasos de tiempo.
 * Las celdas iguales a {@code fillValue} se consideran ausentes.
 */
public record MeteoDataset(
        double[] latitudes,
        double[] longitudes,
        Double fillValue,
        List<Step> steps
) {

    public record Step(
            String time,
            double[][] airTemperature,
            double[][] relativeHumidity,
            double[][] shortwave,
            double[][] windSpeed
    ) {
    }
}
