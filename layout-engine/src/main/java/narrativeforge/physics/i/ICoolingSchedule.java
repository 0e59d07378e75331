package narrativeforge.physics.i;

/**
 * Esquema de enfriamiento: cota del desplazamiento máximo por iteración.
 * <p>
 * Debe ser monótonamente no creciente en {@code iteration} y devolver exactamente
 * {@code initialTemperature} en la iteración 0.
 */
public interface ICoolingSchedule extends ISolverComponent {

    double temperatureAt(int iteration, int maxIterations, double initialTemperature);
}
