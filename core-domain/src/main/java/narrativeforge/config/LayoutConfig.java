package narrativeforge.config;

import lombok.Builder;
import lombok.With;

/**
 * Objeto de valor inmutable con los parámetros de una ejecución de layout.
 *
 * @param width              Ancho del área de simulación (debe ser &gt; 0).
 * @param height             Alto del área de simulación (debe ser &gt; 0).
 * @param maxIterations      Número exacto de iteraciones. No hay salida anticipada por convergencia.
 * @param initialTemperature Desplazamiento máximo permitido en la iteración 0.
 * @param baselineIntensity  Intensidad que equivale a un multiplicador de atracción neutro (1.0).
 * @param minDistance        Suelo de distancia para evitar divisiones por cero entre nodos coincidentes.
 * @param coolingStrategy    Forma del decaimiento de la temperatura.
 * @param coolingFactor      Factor por iteración para {@link CoolingStrategy#GEOMETRIC}.
 * @param parallelism        Hilos para el paso de repulsión O(n²). 1 = secuencial.
 */
@Builder
@With
public record LayoutConfig(
        double width,
        double height,
        int maxIterations,
        double initialTemperature,
        double baselineIntensity,
        double minDistance,
        CoolingStrategy coolingStrategy,
        double coolingFactor,
        int parallelism
) {
    public static final double DEFAULT_BASELINE_INTENSITY = 50.0;
    public static final double DEFAULT_MIN_DISTANCE = 0.01;
    public static final double DEFAULT_COOLING_FACTOR = 0.99;

    public static LayoutConfig getDefaultLayout() {
        return LayoutConfig.builder()
                .width(800.0)
                .height(600.0)
                .maxIterations(100)
                .initialTemperature(5.0)
                .baselineIntensity(DEFAULT_BASELINE_INTENSITY)
                .minDistance(DEFAULT_MIN_DISTANCE)
                .coolingStrategy(CoolingStrategy.LINEAR)
                .coolingFactor(DEFAULT_COOLING_FACTOR)
                .parallelism(1)
                .build();
    }

    /**
     * Estrategias de enfriamiento disponibles.
     */
    public enum CoolingStrategy {
        /**
         * Decaimiento lineal hasta casi cero en la última iteración (por defecto).
         */
        LINEAR,

        /**
         * Decaimiento exponencial {@code t *= factor} en cada iteración.
         */
        GEOMETRIC
    }
}
