package narrativeforge.domain.dto;

import narrativeforge.config.LayoutConfig;
import narrativeforge.config.LayoutConfig.CoolingStrategy;
import narrativeforge.domain.exception.LayoutException;
import narrativeforge.domain.graph.LayoutStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LayoutRequestTest {

    @Test
    @DisplayName("Campos nulos: configuración por defecto y listas vacías")
    void constructor_shouldNormalizeNulls() {
        LayoutRequest request = new LayoutRequest(null, null, null);

        assertEquals(LayoutConfig.getDefaultLayout(), request.config());
        assertTrue(request.nodes().isEmpty());
        assertTrue(request.edges().isEmpty());
    }

    @Test
    @DisplayName("Configuración por defecto")
    void defaultLayout_shouldMatchDocumentedValues() {
        LayoutConfig config = LayoutConfig.getDefaultLayout();

        assertEquals(800.0, config.width());
        assertEquals(600.0, config.height());
        assertEquals(100, config.maxIterations());
        assertEquals(5.0, config.initialTemperature());
        assertEquals(CoolingStrategy.LINEAR, config.coolingStrategy());
        assertEquals(1, config.parallelism());
    }

    @Test
    @DisplayName("LayoutException usa el mensaje del estado si no se indica otro")
    void layoutException_shouldCarryStatus() {
        LayoutException ex = new LayoutException(LayoutStatus.INVALID_HANDLE);

        assertEquals(LayoutStatus.INVALID_HANDLE, ex.getStatus());
        assertEquals(LayoutStatus.INVALID_HANDLE.getMessage(), ex.getMessage());
    }
}
