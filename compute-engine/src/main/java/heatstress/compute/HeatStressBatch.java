package heatstress.compute;

import heatstress.domain.meteo.MeteoSnapshot;
import heatstress.domain.meteo.WbgtSnapshotResult;
import heatstress.io.DatasetMapper;
import heatstress.io.JsonFileHandler;
import heatstress.io.dto.MeteoDataset;
import heatstress.io.dto.WbgtDataset;
import heatstress.physics.model.StullWetBulbModel;
import heatstress.physics.simulator.HeatStressRunner;
import heatstress.physics.simulator.WbgtCalculator;
import heatstress.physics.solver.impl.NewtonRaphsonGlobeSolver;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.List;

/**
 * Punto de entrada por lotes: lee un dataset meteorológico JSON, calcula el WBGT de todos
 * los pasos y escribe el dataset de salida.
 * <p>
 * Uso: {@code HeatStressBatch <entrada.json> <salida.json> [config.json]}
 */
@Slf4j
public class HeatStressBatch {

    private final JsonFileHandler fileHandler;

    public HeatStressBatch(JsonFileHandler fileHandler) {
        this.fileHandler = fileHandler;
    }

    public static void main(String[] args) {
        if (args.length < 2) {
            log.error("Uso: HeatStressBatch <entrada.json> <salida.json> [config.json]");
            System.exit(2);
        }
        try {
            new HeatStressBatch(new JsonFileHandler()).execute(args[0], args[1], args.length > 2 ? args[2] : null);
        } catch (IOException e) {
            log.error("Ejecución abortada por un error de E/S: {}", e.getMessage());
            System.exit(1);
        }
    }

    /**
     * @param settingsPath Ruta opcional (puede ser null) a un {@link EngineSettings} en JSON.
     * @return El dataset escrito.
     */
    public WbgtDataset execute(String inputPath, String outputPath, String settingsPath) throws IOException {
        EngineSettings settings = settingsPath == null
                ? EngineSettings.defaults()
                : fileHandler.readSettings(settingsPath);
        log.info("Configuración: {}", settings);

        MeteoDataset input = fileHandler.readDataset(inputPath);
        List<MeteoSnapshot> snapshots = DatasetMapper.toSnapshots(input);

        WbgtCalculator calculator = new WbgtCalculator(
                new StullWetBulbModel(),
                new NewtonRaphsonGlobeSolver(settings.constants(), settings.solver()),
                settings.exposureMode());
        List<WbgtSnapshotResult> results = new HeatStressRunner(calculator).run(snapshots);

        WbgtDataset output = DatasetMapper.toDataset(input, results, settings.exposureMode().name());
        fileHandler.writeResult(output, outputPath);
        return output;
    }
}
