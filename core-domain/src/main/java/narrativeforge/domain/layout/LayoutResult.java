package narrativeforge.domain.layout;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import narrativeforge.domain.graph.LayoutStatus;
import narrativeforge.domain.graph.NodeOutput;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Resultado de una petición de layout, tal y como lo consume la capa anfitriona.
 * <p>
 * Si {@code status} no es {@link LayoutStatus#OK}, {@code positions} contiene las
 * posiciones originales sin tocar y {@code message} un texto apto para el usuario.
 *
 * @param status          Estado final.
 * @param positions       Una posición por nodo aceptado.
 * @param iterations      Iteraciones ejecutadas.
 * @param executionTimeMs Tiempo de cómputo en milisegundos.
 * @param message         Mensaje descriptivo del estado.
 */
@Builder
public record LayoutResult(
        LayoutStatus status,
        List<NodeOutput> positions,
        int iterations,
        long executionTimeMs,
        String message
) {
    public LayoutResult {
        Objects.requireNonNull(status, "El estado no puede ser nulo.");
        positions = positions == null ? List.of() : List.copyOf(positions);
        if (message == null) {
            message = status.getMessage();
        }
    }

    public static LayoutResult success(List<NodeOutput> positions, int iterations, long executionTimeMs) {
        return new LayoutResult(LayoutStatus.OK, positions, iterations, executionTimeMs, null);
    }

    public static LayoutResult failure(LayoutStatus status, List<NodeOutput> untouchedPositions, String message) {
        return new LayoutResult(status, untouchedPositions, 0, 0L, message);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status.isSuccess();
    }

    public Optional<NodeOutput> positionOf(int id) {
        return positions.stream().filter(p -> p.id() == id).findFirst();
    }

    /**
     * Vista indexada por id, en el orden de {@code positions}.
     */
    public Map<Integer, NodeOutput> positionsById() {
        Map<Integer, NodeOutput> byId = new LinkedHashMap<>();
        for (NodeOutput p : positions) {
            byId.put(p.id(), p);
        }
        return byId;
    }
}
