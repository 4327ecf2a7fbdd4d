package projectconic.physics.solver;

import projectconic.config.SoundingConfig;
import projectconic.domain.sounding.SoundingTable;

public interface StressSolver extends SolverComponent {
    /**
     * Añade las tensiones verticales, la resistencia corregida y los ratios
     * normalizados Fr y Bq.
     *
     * @param table  Tabla con depth, qc, fs, u2 y u0.
     * @param config Configuración validada.
     * @return Tabla nueva con las columnas derivadas.
     */
    SoundingTable computeStresses(SoundingTable table, SoundingConfig config);
}
