package heatstress.domain.field;

import java.util.Arrays;

/**
 * Campo 2-D inmutable de valores en coma flotante, indexado por (fila, columna).
 * <p>
 * ALMACENAMIENTO: un único array primitivo plano en orden fila-mayor
 * ({@code index = row * cols + col}), igual que los resultados empaquetados de la simulación.
 * <p>
 * Las celdas ausentes se marcan con {@link #MISSING}. El marcador es propio del dominio:
 * los valores de relleno de cada formato de fichero (_FillValue, -9999...) se traducen
 * en la frontera mediante {@link #fromRows(double[][], Double)} y {@link #toRows(double)}.
 */
public final class GridField {

    /**
     * Marcador de celda ausente. Se compara siempre con {@link #isMissingValue(double)}, nunca con ==.
     * Cualquier valor no finito (NaN, ±Infinito) cuenta como ausente.
     */
    public static final double MISSING = Double.NaN;

    private final int rows;
    private final int cols;
    private final double[] values;

    private GridField(int rows, int cols, double[] values) {
        this.rows = rows;
        this.cols = cols;
        this.values = values;
    }

    /**
     * Crea un campo a partir de un array plano fila-mayor. El array se copia y los valores
     * no finitos se normalizan a {@link #MISSING}.
     */
    public static GridField of(int rows, int cols, double[] packedValues) {
        if (rows < 0 || cols < 0) {
            throw new IllegalArgumentException("Las dimensiones del campo no pueden ser negativas: " + rows + "x" + cols);
        }
        if (packedValues == null || packedValues.length != rows * cols) {
            throw new IllegalArgumentException("El array plano no coincide con la forma " + rows + "x" + cols);
        }
        double[] packed = packedValues.clone();
        for (int i = 0; i < packed.length; i++) {
            if (isMissingValue(packed[i])) packed[i] = MISSING;
        }
        return new GridField(rows, cols, packed);
    }

    /**
     * Crea un campo a partir de filas. Las celdas iguales a {@code fillValue} (si no es null)
     * o no finitas se convierten en {@link #MISSING}.
     */
    public static GridField fromRows(double[][] data, Double fillValue) {
        if (data == null) {
            throw new IllegalArgumentException("Los datos del campo no pueden ser nulos.");
        }
        int rows = data.length;
        int cols = rows == 0 ? 0 : data[0].length;
        double[] packed = new double[rows * cols];

        for (int r = 0; r < rows; r++) {
            if (data[r] == null || data[r].length != cols) {
                throw new IllegalArgumentException("La fila " + r + " no tiene " + cols + " columnas (campo irregular).");
            }
            for (int c = 0; c < cols; c++) {
                double v = data[r][c];
                boolean isFill = fillValue != null && v == fillValue;
                packed[r * cols + c] = (isFill || isMissingValue(v)) ? MISSING : v;
            }
        }
        return new GridField(rows, cols, packed);
    }

    public static GridField fromRows(double[][] data) {
        return fromRows(data, null);
    }

    /**
     * Campo de la forma indicada con todas las celdas ausentes.
     */
    public static GridField allMissing(int rows, int cols) {
        double[] packed = new double[rows * cols];
        Arrays.fill(packed, MISSING);
        return new GridField(rows, cols, packed);
    }

    /**
     * Campo con el mismo valor en todas las celdas. Útil para forzamientos uniformes.
     */
    public static GridField uniform(int rows, int cols, double value) {
        double[] packed = new double[rows * cols];
        Arrays.fill(packed, value);
        return new GridField(rows, cols, packed);
    }

    public static boolean isMissingValue(double value) {
        return !Double.isFinite(value);
    }

    public int rows() {
        return rows;
    }

    public int cols() {
        return cols;
    }

    public int cellCount() {
        return values.length;
    }

    public double get(int row, int col) {
        return values[indexOf(row, col)];
    }

    /**
     * Acceso por índice plano (fila-mayor). Usado por los recorridos celda a celda.
     */
    public double getAt(int index) {
        return values[index];
    }

    public boolean isMissing(int row, int col) {
        return isMissingValue(get(row, col));
    }

    public boolean isMissingAt(int index) {
        return isMissingValue(values[index]);
    }

    public boolean hasSameShape(GridField other) {
        return other != null && other.rows == rows && other.cols == cols;
    }

    public String shapeDescription() {
        return rows + "x" + cols;
    }

    public int countMissing() {
        int missing = 0;
        for (double v : values) {
            if (isMissingValue(v)) missing++;
        }
        return missing;
    }

    /**
     * Copia defensiva del array plano interno.
     */
    public double[] clonePackedValues() {
        return values.clone();
    }

    /**
     * Exporta a filas sustituyendo el marcador de ausencia por {@code fillValue}.
     */
    public double[][] toRows(double fillValue) {
        double[][] out = new double[rows][cols];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                double v = values[r * cols + c];
                out[r][c] = isMissingValue(v) ? fillValue : v;
            }
        }
        return out;
    }

    /**
     * Índice plano (fila-mayor) de una celda, con comprobación de límites en ambas dimensiones.
     */
    public int indexOf(int row, int col) {
        if (row < 0 || row >= rows || col < 0 || col >= cols) {
            throw new IndexOutOfBoundsException("Celda (" + row + ", " + col + ") fuera del campo " + shapeDescription());
        }
        return row * cols + col;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GridField other)) return false;
        // Arrays.equals compara bit a bit: NaN == NaN, así que dos máscaras de ausencia iguales son iguales.
        return rows == other.rows && cols == other.cols && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * rows + cols) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "GridField[" + shapeDescription() + ", missing=" + countMissing() + "]";
    }
}
