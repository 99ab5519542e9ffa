package heatstress.physics.simulator;

import heatstress.domain.field.GridField;
import heatstress.domain.meteo.MeteoSnapshot;
import heatstress.domain.meteo.WbgtSnapshotResult;
import heatstress.domain.solver.GlobeTemperatureResult;
import heatstress.physics.model.StullWetBulbModel;
import heatstress.physics.model.WbgtFormula;
import heatstress.physics.model.WbgtFormula.ExposureMode;
import heatstress.physics.model.WetBulbModel;
import heatstress.physics.solver.GlobeTemperatureSolver;
import heatstress.physics.solver.impl.NewtonRaphsonGlobeSolver;
import lombok.extern.slf4j.Slf4j;

/**
 * Calcula el WBGT de un paso de tiempo.
 * <p>
 * Encadena tres piezas independientes: bulbo húmedo (fórmula empírica), globo (solver iterativo)
 * y la combinación lineal final. Las celdas ausentes en cualquier entrada salen ausentes.
 */
@Slf4j
public class WbgtCalculator {

    private final WetBulbModel wetBulbModel;
    private final GlobeTemperatureSolver globeSolver;
    private final ExposureMode exposureMode;

    public WbgtCalculator() {
        this(new StullWetBulbModel(), new NewtonRaphsonGlobeSolver(), ExposureMode.OUTDOOR);
    }

    public WbgtCalculator(WetBulbModel wetBulbModel, GlobeTemperatureSolver globeSolver, ExposureMode exposureMode) {
        this.wetBulbModel = wetBulbModel;
        this.globeSolver = globeSolver;
        this.exposureMode = exposureMode;
    }

    public WbgtSnapshotResult compute(MeteoSnapshot snapshot) {
        GridField ta = snapshot.airTemperature();
        GridField rh = snapshot.relativeHumidity();
        validateShapes(snapshot);

        // 1. Bulbo húmedo
        GridField wetBulb = computeWetBulb(ta, rh);

        // 2. Globo (núcleo iterativo)
        GlobeTemperatureResult globe = globeSolver.solve(ta, snapshot.shortwave(), snapshot.windSpeed());

        // 3. Combinación
        GridField wbgt = combine(wetBulb, globe.getGlobeTemperature(), ta);

        log.debug("Paso '{}' calculado con {} ({}).", snapshot.label(), globeSolver.getName(), exposureMode);

        return WbgtSnapshotResult.builder()
                .label(snapshot.label())
                .wetBulbTemperature(wetBulb)
                .globe(globe)
                .wbgt(wbgt)
                .build();
    }

    private GridField computeWetBulb(GridField ta, GridField rh) {
        int n = ta.cellCount();
        double[] tw = new double[n];
        for (int i = 0; i < n; i++) {
            tw[i] = (ta.isMissingAt(i) || rh.isMissingAt(i))
                    ? GridField.MISSING
                    : wetBulbModel.wetBulbTemperature(ta.getAt(i), rh.getAt(i));
        }
        return GridField.of(ta.rows(), ta.cols(), tw);
    }

    private GridField combine(GridField wetBulb, GridField globe, GridField ta) {
        int n = ta.cellCount();
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            out[i] = WbgtFormula.combine(wetBulb.getAt(i), globe.getAt(i), ta.getAt(i), exposureMode);
        }
        return GridField.of(ta.rows(), ta.cols(), out);
    }

    private static void validateShapes(MeteoSnapshot snapshot) {
        GridField ta = snapshot.airTemperature();
        if (ta == null || snapshot.relativeHumidity() == null
                || snapshot.shortwave() == null || snapshot.windSpeed() == null) {
            throw new IllegalArgumentException("El paso '" + snapshot.label() + "' no tiene los cuatro campos obligatorios.");
        }
        if (!ta.hasSameShape(snapshot.relativeHumidity())
                || !ta.hasSameShape(snapshot.shortwave())
                || !ta.hasSameShape(snapshot.windSpeed())) {
            throw new IllegalArgumentException("Los campos del paso '" + snapshot.label() + "' no comparten forma.");
        }
    }
}
