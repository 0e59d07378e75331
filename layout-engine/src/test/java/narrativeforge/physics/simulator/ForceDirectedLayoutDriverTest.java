package narrativeforge.physics.simulator;

import narrativeforge.config.LayoutConfig;
import narrativeforge.domain.graph.NodeOutput;
import narrativeforge.physics.impl.FruchtermanReingoldForceModel;
import narrativeforge.physics.impl.LinearCoolingSchedule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test unitario para ForceDirectedLayoutDriver.
 */
class ForceDirectedLayoutDriverTest {

    @Test
    @DisplayName("Paralelo vs secuencial: resultado bit a bit idéntico")
    void run_parallelShouldMatchSequential() {
        // --- ARRANGE ---
        LayoutConfig sequential = LayoutConfig.getDefaultLayout().withWidth(400).withHeight(300);
        LayoutConfig parallel = sequential.withParallelism(4);

        // --- ACT ---
        NodeOutput[] a;
        NodeOutput[] b;
        try (LayoutSession s1 = LayoutSession.create(LayoutSessionTest.sampleNodes(41), LayoutSessionTest.ringEdges(41), sequential);
             LayoutSession s2 = LayoutSession.create(LayoutSessionTest.sampleNodes(41), LayoutSessionTest.ringEdges(41), parallel)) {
            a = s1.compute(50, 8.0);
            b = s2.compute(50, 8.0);
        }

        // --- ASSERT ---
        assertArrayEquals(a, b);
    }

    @Test
    @DisplayName("Temperatura cero: ningún nodo se mueve")
    void run_shouldNotMoveWithZeroTemperature() {
        double[] x = {-1.0, 1.0};
        double[] y = {0.0, 0.0};

        try (ForceDirectedLayoutDriver driver = driver(1)) {
            driver.run(x, y, new boolean[2], new int[0], new int[0], new double[0], 100, 0.0);
        }

        assertArrayEquals(new double[]{-1.0, 1.0}, x);
        assertArrayEquals(new double[]{0.0, 0.0}, y);
    }

    @Test
    @DisplayName("El desplazamiento por iteración no supera la temperatura")
    void run_shouldLimitDisplacementToTemperature() {
        double[] x = {-1.0, 1.0};
        double[] y = {0.0, 0.0};

        try (ForceDirectedLayoutDriver driver = driver(1)) {
            driver.run(x, y, new boolean[2], new int[0], new int[0], new double[0], 1, 3.0);
        }

        assertEquals(-4.0, x[0], 1e-12);
        assertEquals(4.0, x[1], 1e-12);
    }

    @Test
    @DisplayName("Los nodos fijados nunca se escriben")
    void run_shouldNotWritePinnedPositions() {
        double[] x = {0.0, 5.0};
        double[] y = {0.0, 0.0};
        boolean[] fixed = {true, false};

        try (ForceDirectedLayoutDriver driver = driver(1)) {
            driver.run(x, y, fixed, new int[]{0}, new int[]{1}, new double[]{50.0}, 20, 5.0);
        }

        assertEquals(0.0, x[0]);
        assertEquals(0.0, y[0]);
        assertTrue(x[1] > 5.0);
    }

    @Test
    @DisplayName("Paralelismo < 1 se normaliza a secuencial")
    void constructor_shouldNormalizeParallelism() {
        try (ForceDirectedLayoutDriver driver = driver(0)) {
            assertEquals(1, driver.getParallelism());
        }
    }

    private static ForceDirectedLayoutDriver driver(int parallelism) {
        double k = FruchtermanReingoldForceModel.idealSpacing(400, 300, 2);
        return new ForceDirectedLayoutDriver(
                new FruchtermanReingoldForceModel(k, 50.0, 0.01),
                new LinearCoolingSchedule(),
                400, 300, parallelism);
    }
}
