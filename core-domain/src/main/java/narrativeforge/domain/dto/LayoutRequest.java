package narrativeforge.domain.dto;

import lombok.Builder;
import narrativeforge.config.LayoutConfig;
import narrativeforge.domain.graph.EdgeInput;
import narrativeforge.domain.graph.NodeInput;

import java.util.List;

/**
 * Petición de layout completa (configuración + grafo), serializable a JSON.
 * Las coordenadas de los nodos están en el espacio local centrado del motor.
 */
@Builder
public record LayoutRequest(
        LayoutConfig config,
        List<NodeInput> nodes,
        List<EdgeInput> edges
) {
    public LayoutRequest {
        if (config == null) {
            config = LayoutConfig.getDefaultLayout();
        }
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
    }
}
