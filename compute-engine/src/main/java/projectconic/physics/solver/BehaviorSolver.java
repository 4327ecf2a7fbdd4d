package projectconic.physics.solver;

import projectconic.config.SoundingConfig;
import projectconic.domain.sounding.SoundingTable;

public interface BehaviorSolver extends SolverComponent {
    /**
     * Calcula por registro el exponente de tensiones, la resistencia normalizada,
     * el índice de comportamiento y el estado de convergencia.
     *
     * @param table  Tabla con las columnas de {@link StressSolver}.
     * @param config Configuración validada.
     * @return Tabla nueva con las columnas de clasificación.
     */
    SoundingTable solveBehavior(SoundingTable table, SoundingConfig config);
}
