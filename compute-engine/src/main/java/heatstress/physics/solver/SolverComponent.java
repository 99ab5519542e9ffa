package heatstress.physics.solver;

/**
 * Contrato común de los componentes de cálculo: un nombre identificable para logs y métricas.
 */
public interface SolverComponent {
    String getName();
}
