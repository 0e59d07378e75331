package narrativeforge.physics.i;

/**
 * Funciones puras de fuerza en función de la distancia entre dos nodos.
 * Las magnitudes devueltas son escalares; la dirección la aplica el driver.
 */
public interface IForceModel extends ISolverComponent {

    /**
     * Magnitud de la repulsión entre dos nodos cualesquiera a distancia {@code distance}.
     * Se aplica a todos los pares, haya arista o no.
     */
    double repulsion(double distance);

    /**
     * Magnitud de la atracción a lo largo de una arista de peso {@code intensity}.
     */
    double attraction(double distance, double intensity);

    /**
     * Distancia de equilibrio k entre repulsión y atracción neutra.
     */
    double getIdealSpacing();

    /**
     * Suelo de distancia por debajo del cual dos nodos se consideran coincidentes.
     */
    double getMinDistance();
}
