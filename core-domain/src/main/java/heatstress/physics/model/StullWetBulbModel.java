package heatstress.physics.model;

/**
 * Fórmula empírica de Stull (2011), "Wet-Bulb Temperature from Relative Humidity and Air Temperature".
 * <p>
 * Válida aproximadamente para RH entre 5% y 99% y Ta entre -20°C y 50°C a presión estándar.
 * Fuera de ese rango se evalúa igualmente (RH se recorta a [0, 100]).
 */
public class StullWetBulbModel implements WetBulbModel {

    @Override
    public double wetBulbTemperature(double airTemperature, double relativeHumidity) {
        if (Double.isNaN(airTemperature) || Double.isNaN(relativeHumidity)) {
            return Double.NaN;
        }
        final double t = airTemperature;
        final double rh = Math.min(100.0, Math.max(0.0, relativeHumidity));

        return t * Math.atan(0.151977 * Math.sqrt(rh + 8.313659))
                + Math.atan(t + rh)
                - Math.atan(rh - 1.676331)
                + 0.00391838 * Math.pow(rh, 1.5) * Math.atan(0.023101 * rh)
                - 4.686035;
    }
}
