package heatstress.compute;

import heatstress.config.GlobeConstants;
import heatstress.config.SolverSettings;
import heatstress.physics.model.WbgtFormula.ExposureMode;
import lombok.Builder;
import lombok.With;

/**
 * Configuración completa del motor, cargable desde JSON. Las secciones ausentes toman los valores estándar.
 */
@Builder
@With
public record EngineSettings(
        GlobeConstants constants,
        SolverSettings solver,
        ExposureMode exposureMode
) {

    public EngineSettings {
        if (constants == null) constants = GlobeConstants.standard();
        if (solver == null) solver = SolverSettings.defaults();
        if (exposureMode == null) exposureMode = ExposureMode.OUTDOOR;
    }

    public static EngineSettings defaults() {
        return new EngineSettings(null, null, null);
    }
}
