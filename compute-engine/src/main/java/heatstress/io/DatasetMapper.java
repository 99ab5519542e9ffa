package heatstress.io;

import heatstress.domain.field.GridField;
import heatstress.domain.meteo.MeteoSnapshot;
import heatstress.domain.meteo.WbgtSnapshotResult;
import heatstress.domain.solver.CellStatus;
import heatstress.io.dto.MeteoDataset;
import heatstress.io.dto.WbgtDataset;

import java.util.List;

/**
 * Traduce entre el formato de fichero (valor de relleno) y el dominio (marcador de ausencia).
 */
public final class DatasetMapper {

    public static final double DEFAULT_FILL_VALUE = -9999.0;

    private DatasetMapper() {}

    public static List<MeteoSnapshot> toSnapshots(MeteoDataset dataset) {
        if (dataset.steps() == null) {
            throw new IllegalArgumentException("El dataset no contiene pasos de tiempo.");
        }
        Double fill = dataset.fillValue();
        return dataset.steps().stream()
                .map(step -> MeteoSnapshot.builder()
                        .label(step.time())
                        .airTemperature(toField(step.airTemperature(), fill, "airTemperature", step.time()))
                        .relativeHumidity(toField(step.relativeHumidity(), fill, "relativeHumidity", step.time()))
                        .shortwave(toField(step.shortwave(), fill, "shortwave", step.time()))
                        .windSpeed(toField(step.windSpeed(), fill, "windSpeed", step.time()))
                        .build())
                .toList();
    }

    public static WbgtDataset toDataset(MeteoDataset source, List<WbgtSnapshotResult> results, String exposureMode) {
        double fill = source.fillValue() != null ? source.fillValue() : DEFAULT_FILL_VALUE;

        List<WbgtDataset.Step> steps = results.stream()
                .map(r -> new WbgtDataset.Step(
                        r.getLabel(),
                        r.getWetBulbTemperature().toRows(fill),
                        r.getGlobeTemperature().toRows(fill),
                        r.getWbgt().toRows(fill),
                        r.getGlobe().countWithStatus(CellStatus.BEST_EFFORT),
                        r.getGlobe().countWithStatus(CellStatus.DEGENERATE_DERIVATIVE)))
                .toList();

        return new WbgtDataset(source.latitudes(), source.longitudes(), fill, exposureMode, steps);
    }

    private static GridField toField(double[][] data, Double fill, String variable, String time) {
        if (data == null) {
            throw new IllegalArgumentException("Falta la variable '" + variable + "' en el paso '" + time + "'.");
        }
        return GridField.fromRows(data, fill);
    }
}
