package heatstress.physics.solver;

import heatstress.domain.field.GridField;
import heatstress.domain.solver.CellResult;
import heatstress.domain.solver.GlobeTemperatureResult;

public interface GlobeTemperatureSolver extends SolverComponent {

    /**
     * Resuelve la temperatura del globo en una celda.
     *
     * @param airTemperature Temperatura del aire (°C) o ausente.
     * @param shortwave      Radiación de onda corta (W/m²) o ausente.
     * @param windSpeed      Velocidad del viento (m/s) o ausente.
     */
    CellResult solveCell(double airTemperature, double shortwave, double windSpeed);

    /**
     * Resuelve la malla completa para un paso de tiempo.
     * Los tres campos deben tener la misma forma; si no, lanza {@link IllegalArgumentException}.
     * Los campos de entrada no se modifican.
     */
    GlobeTemperatureResult solve(GridField airTemperature, GridField shortwave, GridField windSpeed);
}
