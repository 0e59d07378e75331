package narrativeforge.domain.graph;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.With;

/**
 * Arista no dirigida entre dos nodos de la sesión.
 * <p>
 * La dirección (source/target) no tiene significado físico. La intensidad escala
 * únicamente la atracción, nunca la repulsión.
 *
 * @param sourceId  Id de uno de los extremos.
 * @param targetId  Id del otro extremo.
 * @param intensity Peso de la relación, rango nominal 1-100 (por defecto 50).
 */
@Builder
@With
public record EdgeInput(
        int sourceId,
        int targetId,
        double intensity
) {
    public static final double DEFAULT_INTENSITY = 50.0;

    public static EdgeInput of(int sourceId, int targetId) {
        return new EdgeInput(sourceId, targetId, DEFAULT_INTENSITY);
    }

    @JsonIgnore
    public boolean isSelfLoop() {
        return sourceId == targetId;
    }
}
