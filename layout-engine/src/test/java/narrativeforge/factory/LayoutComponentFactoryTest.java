package narrativeforge.factory;

import narrativeforge.config.LayoutConfig;
import narrativeforge.config.LayoutConfig.CoolingStrategy;
import narrativeforge.physics.i.ICoolingSchedule;
import narrativeforge.physics.i.IForceModel;
import narrativeforge.physics.impl.GeometricCoolingSchedule;
import narrativeforge.physics.impl.LinearCoolingSchedule;
import narrativeforge.physics.simulator.ForceDirectedLayoutDriver;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class LayoutComponentFactoryTest {

    private final LayoutConfig defaults = LayoutConfig.getDefaultLayout();

    @Test
    @DisplayName("Modelo de fuerzas: k del área y valores por defecto ante parámetros nulos")
    void createForceModel_shouldFallBackToDefaults() {
        LayoutConfig broken = defaults.withBaselineIntensity(0).withMinDistance(-1);

        IForceModel model = LayoutComponentFactory.createForceModel(broken, 400, 300, 2);

        assertEquals(Math.sqrt(60000.0), model.getIdealSpacing(), 1e-9);
        assertEquals(LayoutConfig.DEFAULT_MIN_DISTANCE, model.getMinDistance());
        assertEquals(100.0 * 100.0 / model.getIdealSpacing(),
                model.attraction(100.0, LayoutConfig.DEFAULT_BASELINE_INTENSITY), 1e-9);

        IForceModel infinite = LayoutComponentFactory.createForceModel(
                defaults.withMinDistance(Double.POSITIVE_INFINITY).withBaselineIntensity(Double.NaN), 400, 300, 2);
        assertEquals(LayoutConfig.DEFAULT_MIN_DISTANCE, infinite.getMinDistance());
        assertEquals(model.attraction(100.0, 50.0), infinite.attraction(100.0, 50.0), 1e-9);
    }

    @Test
    @DisplayName("Enfriamiento: LINEAR por defecto, también con estrategia nula")
    void createCoolingSchedule_shouldDefaultToLinear() {
        assertThat(LayoutComponentFactory.createCoolingSchedule(defaults)).isInstanceOf(LinearCoolingSchedule.class);
        assertThat(LayoutComponentFactory.createCoolingSchedule(defaults.withCoolingStrategy(null)))
                .isInstanceOf(LinearCoolingSchedule.class);
    }

    @Test
    @DisplayName("Enfriamiento geométrico con factor no válido usa el factor por defecto")
    void createCoolingSchedule_shouldSanitizeGeometricFactor() {
        ICoolingSchedule schedule = LayoutComponentFactory.createCoolingSchedule(
                defaults.withCoolingStrategy(CoolingStrategy.GEOMETRIC).withCoolingFactor(1.5));

        assertThat(schedule).isInstanceOf(GeometricCoolingSchedule.class);
        assertEquals(LayoutConfig.DEFAULT_COOLING_FACTOR, ((GeometricCoolingSchedule) schedule).getFactor());
    }

    @Test
    @DisplayName("Driver con el paralelismo configurado")
    void createDriver_shouldUseConfiguredParallelism() {
        try (ForceDirectedLayoutDriver driver = LayoutComponentFactory.createDriver(defaults.withParallelism(3), 400, 300, 10)) {
            assertEquals(3, driver.getParallelism());
            assertEquals("LinearCooling", driver.getCoolingSchedule().getName());
        }
    }
}
