package projectconic.domain.sounding;

/**
 * Estado de la iteración del exponente de tensiones para una fila.
 */
public enum ConvergenceStatus {
    /** La diferencia entre iteraciones cayó por debajo de la tolerancia. */
    CONVERGED,
    /** Se agotó el presupuesto de iteraciones. */
    NOT_CONVERGED,
    /** La fila no se clasifica (Fr negativo o ausente), no se itera. */
    NOT_APPLICABLE
}
