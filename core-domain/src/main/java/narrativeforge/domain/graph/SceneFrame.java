package narrativeforge.domain.graph;

import java.util.Collection;

/**
 * Rectángulo del sistema de coordenadas del llamador (por ejemplo, la escena gráfica).
 * <p>
 * El motor trabaja en un espacio centrado en el origen, {@code [-W/2, W/2] x [-H/2, H/2]}.
 * Esta clase hace la traslación en ambos sentidos: {@link #toLocal} antes de crear la
 * sesión y {@link #toScene} con los resultados.
 *
 * @param originX Esquina mínima X del rectángulo en coordenadas del llamador.
 * @param originY Esquina mínima Y del rectángulo en coordenadas del llamador.
 * @param width   Ancho del área de simulación.
 * @param height  Alto del área de simulación.
 */
public record SceneFrame(
        double originX,
        double originY,
        double width,
        double height
) {
    /**
     * Marco cuyo centro coincide con el origen del llamador (traslación nula).
     */
    public static SceneFrame centered(double width, double height) {
        return new SceneFrame(-width / 2.0, -height / 2.0, width, height);
    }

    /**
     * Construye el marco que envuelve las posiciones actuales de los nodos.
     * <p>
     * Se añade {@code padding} a cada lado y se garantiza un tamaño mínimo, manteniendo
     * el centro de la caja envolvente. Los nodos con coordenadas no finitas se ignoran.
     */
    public static SceneFrame enclosing(Collection<NodeInput> nodes, double padding,
                                       double minWidth, double minHeight) {
        double minX = Double.POSITIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;

        for (NodeInput node : nodes) {
            if (!node.hasFinitePosition()) continue;
            minX = Math.min(minX, node.x());
            minY = Math.min(minY, node.y());
            maxX = Math.max(maxX, node.x());
            maxY = Math.max(maxY, node.y());
        }

        if (minX > maxX) {
            // Sin nodos válidos: marco mínimo centrado en el origen
            return centered(minWidth, minHeight);
        }

        double width = Math.max(minWidth, (maxX - minX) + 2.0 * padding);
        double height = Math.max(minHeight, (maxY - minY) + 2.0 * padding);
        double cx = (minX + maxX) / 2.0;
        double cy = (minY + maxY) / 2.0;
        return new SceneFrame(cx - width / 2.0, cy - height / 2.0, width, height);
    }

    public double centerX() {
        return originX + width / 2.0;
    }

    public double centerY() {
        return originY + height / 2.0;
    }

    public NodeInput toLocal(NodeInput node) {
        return node.withX(node.x() - centerX()).withY(node.y() - centerY());
    }

    public NodeOutput toScene(NodeOutput output) {
        return new NodeOutput(output.id(), output.x() + centerX(), output.y() + centerY());
    }
}
