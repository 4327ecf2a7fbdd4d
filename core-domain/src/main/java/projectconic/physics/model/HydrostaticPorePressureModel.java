package projectconic.physics.model;

import projectconic.config.SoundingConfig;
import projectconic.domain.exception.InvalidConfigurationException;

/**
 * Presión intersticial de equilibrio (u0) para columna de agua hidrostática.
 * <p>
 * {@code u0 = gamma_w * (z - z_w)} por debajo del nivel freático y {@code 0}
 * por encima. Una profundidad NaN produce NaN.
 */
public class HydrostaticPorePressureModel implements DepthProfileModel {

    @Override
    public double[] generateProfile(double[] depth, SoundingConfig config) {
        requireParameters(config);
        return DepthProfileModel.super.generateProfile(depth, config);
    }

    @Override
    public double calculate(double depth, SoundingConfig config) {
        requireParameters(config);
        double waterLevel = config.getWaterLevel();
        if (Double.isNaN(depth)) {
            return Double.NaN;
        }
        return depth >= waterLevel ? config.getGammaW() * (depth - waterLevel) : 0.0;
    }

    private static void requireParameters(SoundingConfig config) {
        if (!config.hasHydrostaticParameters()) {
            throw new InvalidConfigurationException(
                    "Sin columna u0 es obligatorio configurar gammaW y waterLevel.");
        }
    }
}
