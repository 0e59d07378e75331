package narrativeforge.factory;

import lombok.extern.slf4j.Slf4j;
import narrativeforge.config.LayoutConfig;
import narrativeforge.config.LayoutConfig.CoolingStrategy;
import narrativeforge.physics.i.ICoolingSchedule;
import narrativeforge.physics.i.IForceModel;
import narrativeforge.physics.impl.FruchtermanReingoldForceModel;
import narrativeforge.physics.impl.GeometricCoolingSchedule;
import narrativeforge.physics.impl.LinearCoolingSchedule;
import narrativeforge.physics.simulator.ForceDirectedLayoutDriver;

/**
 * Fábrica de los componentes numéricos de una sesión a partir de {@link LayoutConfig}.
 * <p>
 * Los valores no válidos de la configuración (cero, negativos, no finitos, nulos) se sustituyen
 * por los valores por defecto en lugar de fallar: una configuración cargada de JSON
 * con campos ausentes debe seguir funcionando.
 */
@Slf4j
public final class LayoutComponentFactory {

    private LayoutComponentFactory() {
    }

    public static IForceModel createForceModel(LayoutConfig config, double width, double height, int nodeCount) {
        double baseline = (config.baselineIntensity() > 0 && Double.isFinite(config.baselineIntensity()))
                ? config.baselineIntensity()
                : LayoutConfig.DEFAULT_BASELINE_INTENSITY;
        double minDistance = (config.minDistance() > 0 && Double.isFinite(config.minDistance()))
                ? config.minDistance()
                : LayoutConfig.DEFAULT_MIN_DISTANCE;
        double k = FruchtermanReingoldForceModel.idealSpacing(width, height, nodeCount);
        return new FruchtermanReingoldForceModel(k, baseline, minDistance);
    }

    public static ICoolingSchedule createCoolingSchedule(LayoutConfig config) {
        CoolingStrategy strategy = config.coolingStrategy();
        if (strategy == null) strategy = CoolingStrategy.LINEAR;

        switch (strategy) {
            case GEOMETRIC:
                double factor = config.coolingFactor();
                if (!(factor > 0) || factor >= 1.0) {
                    log.warn("Factor de enfriamiento {} fuera de (0, 1). Se usa {}.",
                            factor, LayoutConfig.DEFAULT_COOLING_FACTOR);
                    factor = LayoutConfig.DEFAULT_COOLING_FACTOR;
                }
                return new GeometricCoolingSchedule(factor);
            case LINEAR:
            default:
                return new LinearCoolingSchedule();
        }
    }

    public static ForceDirectedLayoutDriver createDriver(LayoutConfig config, double width, double height, int nodeCount) {
        return new ForceDirectedLayoutDriver(
                createForceModel(config, width, height, nodeCount),
                createCoolingSchedule(config),
                width,
                height,
                config.parallelism()
        );
    }
}
