package heatstress.physics.model;

/**
 * Aproximación de la temperatura de bulbo húmedo a partir de temperatura del aire y humedad relativa.
 * <p>
 * Las implementaciones deben ser funciones puras. Una entrada ausente (NaN) produce NaN.
 */
@FunctionalInterface
public interface WetBulbModel {

    /**
     * @param airTemperature   Temperatura del aire en °C.
     * @param relativeHumidity Humedad relativa en %.
     * @return Temperatura de bulbo húmedo en °C.
     */
    double wetBulbTemperature(double airTemperature, double relativeHumidity);
}
