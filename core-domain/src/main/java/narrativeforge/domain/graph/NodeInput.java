package narrativeforge.domain.graph;

import lombok.Builder;
import lombok.With;

/**
 * Nodo de entrada de una sesión de layout.
 * <p>
 * Las coordenadas se expresan en el espacio local del motor, centrado en el origen
 * (ver {@link SceneFrame}). Un nodo fijado ({@code fixed = true}) nunca se desplaza,
 * pero sigue ejerciendo fuerzas sobre el resto.
 *
 * @param id    Identificador asignado por el llamador. Único dentro de una sesión.
 * @param x     Posición X inicial.
 * @param y     Posición Y inicial.
 * @param fixed Si es {@code true}, el nodo está anclado (usuario lo bloqueó o lo está arrastrando).
 */
@Builder
@With
public record NodeInput(
        int id,
        double x,
        double y,
        boolean fixed
) {
    public static NodeInput of(int id, double x, double y) {
        return new NodeInput(id, x, y, false);
    }

    public static NodeInput pinned(int id, double x, double y) {
        return new NodeInput(id, x, y, true);
    }

    /**
     * Coordenadas finitas (ni NaN ni infinito). Los nodos que no lo cumplen se descartan.
     */
    public boolean hasFinitePosition() {
        return Double.isFinite(x) && Double.isFinite(y);
    }
}
