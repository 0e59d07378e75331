package narrativeforge.domain.graph;

/**
 * Posición final de un nodo aceptado por la sesión.
 */
public record NodeOutput(int id, double x, double y) {

    public double distanceTo(NodeOutput other) {
        double dx = x - other.x;
        double dy = y - other.y;
        return Math.sqrt(dx * dx + dy * dy);
    }
}
