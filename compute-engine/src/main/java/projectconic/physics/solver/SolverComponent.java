package projectconic.physics.solver;

/**
 * Componente identificable de la cadena de cálculo.
 */
public interface SolverComponent {
    /**
     * Nombre corto del algoritmo, para trazas.
     */
    String getName();
}
