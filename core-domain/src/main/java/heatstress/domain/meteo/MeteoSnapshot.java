package heatstress.domain.meteo;

import heatstress.domain.field.GridField;
import lombok.Builder;

/**
 * Forzamiento meteorológico de un paso de tiempo: cuatro campos co-registrados.
 *
 * @param label            Etiqueta del paso (p.ej. la marca temporal ISO del fichero de origen).
 * @param airTemperature   Temperatura del aire a 2 m (°C).
 * @param relativeHumidity Humedad relativa (%).
 * @param shortwave        Radiación de onda corta entrante (W/m²).
 * @param windSpeed        Velocidad del viento (m/s).
 */
@Builder
public record MeteoSnapshot(
        String label,
        GridField airTemperature,
        GridField relativeHumidity,
        GridField shortwave,
        GridField windSpeed
) {
}
