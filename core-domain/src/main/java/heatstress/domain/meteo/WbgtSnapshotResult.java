package heatstress.domain.meteo;

import heatstress.domain.field.GridField;
import heatstress.domain.solver.GlobeTemperatureResult;
import lombok.Builder;
import lombok.Value;

/**
 * Resultado de un paso de tiempo: bulbo húmedo, globo y WBGT, todos en °C y con la forma de la entrada.
 */
@Value
@Builder
public class WbgtSnapshotResult {

    String label;
    GridField wetBulbTemperature;
    GlobeTemperatureResult globe;
    GridField wbgt;

    public GridField getGlobeTemperature() {
        return globe.getGlobeTemperature();
    }
}
