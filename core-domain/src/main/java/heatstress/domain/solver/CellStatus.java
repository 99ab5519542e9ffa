package heatstress.domain.solver;

/**
 * Resultado etiquetado de la resolución de una celda.
 */
public enum CellStatus {

    /**
     * |Tg_next - Tg| por debajo de la tolerancia. Valor fiable.
     */
    CONVERGED(true),

    /**
     * Se agotó el techo de iteraciones sin alcanzar la tolerancia.
     * Se publica la última estimación (mejor esfuerzo).
     */
    BEST_EFFORT(true),

    /**
     * Derivada plana (|f'| por debajo del umbral). La celda queda ausente.
     */
    DEGENERATE_DERIVATIVE(false),

    /**
     * Alguna de las entradas de la celda estaba ausente. No se intenta el cálculo.
     */
    MISSING_INPUT(false);

    private final boolean hasValue;

    CellStatus(boolean hasValue) {
        this.hasValue = hasValue;
    }

    public boolean hasValue() {
        return hasValue;
    }
}
