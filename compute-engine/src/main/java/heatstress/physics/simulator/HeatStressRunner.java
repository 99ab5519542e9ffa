package heatstress.physics.simulator;

import heatstress.domain.meteo.MeteoSnapshot;
import heatstress.domain.meteo.WbgtSnapshotResult;
import heatstress.domain.solver.CellStatus;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Orquesta el cálculo de WBGT sobre la dimensión temporal.
 * Cada paso es independiente; se procesan en orden e informan del progreso.
 */
@Slf4j
public class HeatStressRunner {

    private final WbgtCalculator calculator;

    public HeatStressRunner(WbgtCalculator calculator) {
        this.calculator = calculator;
    }

    public List<WbgtSnapshotResult> run(List<MeteoSnapshot> snapshots) {
        int total = snapshots.size();
        log.info("Iniciando cálculo de WBGT: {} pasos de tiempo.", total);

        List<WbgtSnapshotResult> results = new ArrayList<>(total);
        long start = System.currentTimeMillis();
        int bestEffort = 0;
        int degenerate = 0;

        for (int step = 0; step < total; step++) {
            MeteoSnapshot snapshot = snapshots.get(step);
            WbgtSnapshotResult result = calculator.compute(snapshot);
            results.add(result);

            bestEffort += result.getGlobe().countWithStatus(CellStatus.BEST_EFFORT);
            degenerate += result.getGlobe().countWithStatus(CellStatus.DEGENERATE_DERIVATIVE);
            log.info("Paso {}/{} ('{}') completado en {}ms.", step + 1, total, snapshot.label(),
                    result.getGlobe().getComputeTimeMillis());
        }

        log.info("Cálculo finalizado en {}ms. Celdas de mejor esfuerzo: {}, celdas degeneradas: {}.",
                System.currentTimeMillis() - start, bestEffort, degenerate);
        return results;
    }
}
