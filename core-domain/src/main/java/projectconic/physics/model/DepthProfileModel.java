package projectconic.physics.model;

import projectconic.config.SoundingConfig;

/**
 * Contrato para modelos físicos que calculan una propiedad del terreno a partir
 * únicamente de la profundidad y de la configuración estática del sondeo.
 */
@FunctionalInterface
public interface DepthProfileModel {

    /**
     * @param depth  Profundidad del registro (m).
     * @param config Configuración del sondeo.
     * @return Valor de la propiedad a esa profundidad.
     */
    double calculate(double depth, SoundingConfig config);

    /**
     * Aplica el modelo registro a registro sobre un perfil completo.
     */
    default double[] generateProfile(double[] depth, SoundingConfig config) {
        double[] profile = new double[depth.length];
        for (int i = 0; i < depth.length; i++) {
            profile[i] = calculate(depth[i], config);
        }
        return profile;
    }
}
