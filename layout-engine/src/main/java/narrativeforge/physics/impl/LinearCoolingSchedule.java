package narrativeforge.physics.impl;

import narrativeforge.physics.i.ICoolingSchedule;

/**
 * Enfriamiento lineal: {@code t_i = T0 · (1 - i / N)}.
 * La última iteración todavía mueve {@code T0 / N}.
 */
public class LinearCoolingSchedule implements ICoolingSchedule {

    @Override
    public String getName() {
        return "LinearCooling";
    }

    @Override
    public String getDescription() {
        return "Decaimiento lineal de T0 hacia cero a lo largo de maxIterations";
    }

    @Override
    public double temperatureAt(int iteration, int maxIterations, double initialTemperature) {
        if (maxIterations <= 0 || iteration >= maxIterations) return 0.0;
        return initialTemperature * (1.0 - (double) iteration / maxIterations);
    }
}
