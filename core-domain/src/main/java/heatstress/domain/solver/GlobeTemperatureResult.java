package heatstress.domain.solver;

import heatstress.domain.field.GridField;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Value;

import java.util.EnumMap;
import java.util.Map;

/**
 * Campo de temperatura del globo (°C) junto con la máscara de estados y las iteraciones por celda.
 * <p>
 * La máscara permite distinguir las celdas convergidas de las de mejor esfuerzo, que en el campo
 * de temperatura son indistinguibles.
 * <p>
 * Inmutable una vez publicado: los arrays internos solo salen como copias.
 */
@Value
public class GlobeTemperatureResult {

    GridField globeTemperature;

    @Getter(AccessLevel.NONE)
    CellStatus[] statuses;

    @Getter(AccessLevel.NONE)
    int[] iterations;

    long computeTimeMillis;

    /**
     * Empaqueta los resultados celda a celda (orden fila-mayor) en el campo de salida.
     */
    public static GlobeTemperatureResult fromCells(int rows, int cols, CellResult[] cells, long computeTimeMillis) {
        if (cells.length != rows * cols) {
            throw new IllegalArgumentException("Número de celdas " + cells.length + " incompatible con " + rows + "x" + cols);
        }
        double[] temperatures = new double[cells.length];
        CellStatus[] statuses = new CellStatus[cells.length];
        int[] iterations = new int[cells.length];

        for (int i = 0; i < cells.length; i++) {
            temperatures[i] = cells[i].globeTemperature();
            statuses[i] = cells[i].status();
            iterations[i] = cells[i].iterations();
        }
        return new GlobeTemperatureResult(GridField.of(rows, cols, temperatures), statuses, iterations, computeTimeMillis);
    }

    public CellStatus getStatusAt(int row, int col) {
        return statuses[globeTemperature.indexOf(row, col)];
    }

    public int getIterationsAt(int row, int col) {
        return iterations[globeTemperature.indexOf(row, col)];
    }

    /**
     * Copia defensiva de la máscara de estados (fila-mayor).
     */
    public CellStatus[] cloneStatuses() {
        return statuses.clone();
    }

    /**
     * Copia defensiva de las iteraciones por celda (fila-mayor).
     */
    public int[] cloneIterations() {
        return iterations.clone();
    }

    public int countWithStatus(CellStatus status) {
        int count = 0;
        for (CellStatus s : statuses) {
            if (s == status) count++;
        }
        return count;
    }

    public Map<CellStatus, Integer> statusCounts() {
        Map<CellStatus, Integer> counts = new EnumMap<>(CellStatus.class);
        for (CellStatus status : CellStatus.values()) {
            counts.put(status, 0);
        }
        for (CellStatus s : statuses) {
            counts.merge(s, 1, Integer::sum);
        }
        return counts;
    }
}
