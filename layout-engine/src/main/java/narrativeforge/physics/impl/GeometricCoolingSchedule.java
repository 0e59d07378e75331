package narrativeforge.physics.impl;

import lombok.Getter;
import narrativeforge.physics.i.ICoolingSchedule;

/**
 * Enfriamiento geométrico: {@code t_i = T0 · factor^i}.
 * <p>
 * Usa {@link StrictMath#pow} para que el resultado sea idéntico en cualquier plataforma.
 */
@Getter
public class GeometricCoolingSchedule implements ICoolingSchedule {

    private final double factor;

    public GeometricCoolingSchedule(double factor) {
        if (!(factor > 0) || factor >= 1.0) {
            throw new IllegalArgumentException("El factor de enfriamiento debe estar en (0, 1): " + factor);
        }
        this.factor = factor;
    }

    @Override
    public String getName() {
        return "GeometricCooling";
    }

    @Override
    public String getDescription() {
        return "Decaimiento exponencial t *= " + factor + " por iteración";
    }

    @Override
    public double temperatureAt(int iteration, int maxIterations, double initialTemperature) {
        if (maxIterations <= 0 || iteration >= maxIterations) return 0.0;
        return initialTemperature * StrictMath.pow(factor, iteration);
    }
}
