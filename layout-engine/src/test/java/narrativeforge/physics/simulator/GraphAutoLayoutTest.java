package narrativeforge.physics.simulator;

import narrativeforge.config.LayoutConfig;
import narrativeforge.domain.dto.LayoutRequest;
import narrativeforge.domain.graph.EdgeInput;
import narrativeforge.domain.graph.LayoutStatus;
import narrativeforge.domain.graph.NodeInput;
import narrativeforge.domain.graph.NodeOutput;
import narrativeforge.domain.graph.SceneFrame;
import narrativeforge.domain.layout.LayoutResult;
import narrativeforge.physics.jni.IGraphLayoutBridge;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

/**
 * Test del facade de auto layout: traslación de coordenadas y tratamiento de fallos.
 */
class GraphAutoLayoutTest {

    private LayoutConfig config;
    private GraphAutoLayout autoLayout;

    @BeforeEach
    void setUp() {
        config = LayoutConfig.getDefaultLayout().withWidth(400).withHeight(300);
        autoLayout = new GraphAutoLayout(config);
    }

    @Test
    @DisplayName("Marco desplazado: resultados en coordenadas de escena dentro del marco")
    void autoLayout_shouldTranslateToSceneCoordinates() {
        // --- ARRANGE ---
        SceneFrame frame = new SceneFrame(1000, 2000, 400, 300);
        List<NodeInput> nodes = List.of(
                NodeInput.pinned(1, 1200.3, 2150.7),
                NodeInput.of(2, 1210, 2150.7),
                NodeInput.of(3, 1190, 2160));
        List<EdgeInput> edges = List.of(EdgeInput.of(1, 2), EdgeInput.of(1, 3));

        // --- ACT ---
        LayoutResult result = autoLayout.autoLayout(frame, nodes, edges);

        // --- ASSERT ---
        assertTrue(result.isSuccess());
        assertEquals(config.maxIterations(), result.iterations());
        assertEquals(new NodeOutput(1, 1200.3, 2150.7), result.positionOf(1).orElseThrow(),
                "El nodo fijado conserva sus coordenadas de escena exactas");
        for (NodeOutput p : result.positions()) {
            assertThat(p.x()).isBetween(1000.0, 1400.0);
            assertThat(p.y()).isBetween(2000.0, 2300.0);
        }
        assertThat(result.positionOf(2).orElseThrow().x()).isGreaterThan(1210.0);
    }

    @Test
    @DisplayName("Dimensiones no válidas: estado de error y posiciones originales intactas")
    void autoLayout_shouldLeavePositionsUntouchedOnFailure() {
        List<NodeInput> nodes = List.of(NodeInput.of(1, 5, 6), NodeInput.of(2, 7, 8));

        LayoutResult result = autoLayout.autoLayout(new SceneFrame(0, 0, 0, 300), nodes, List.of());

        assertFalse(result.isSuccess());
        assertEquals(LayoutStatus.INVALID_DIMENSIONS, result.status());
        assertEquals(List.of(new NodeOutput(1, 5, 6), new NodeOutput(2, 7, 8)), result.positions());
        assertEquals(LayoutStatus.INVALID_DIMENSIONS.getMessage(), result.message());
    }

    @Test
    @DisplayName("Fallo en compute: se destruye la sesión y se devuelve el estado")
    void autoLayout_shouldReportComputeFailure() {
        IGraphLayoutBridge bridge = mock(IGraphLayoutBridge.class);
        when(bridge.createSession(any(), anyInt(), any(), anyInt(), anyDouble(), anyDouble())).thenReturn(77L);
        when(bridge.compute(anyLong(), anyInt(), anyDouble(), any(), anyInt(), any()))
                .thenReturn(LayoutStatus.ALLOCATION_FAILURE.getCode());

        LayoutResult result = new GraphAutoLayout(bridge, config)
                .autoLayout(List.of(NodeInput.of(1, 3, 4)), List.of());

        assertEquals(LayoutStatus.ALLOCATION_FAILURE, result.status());
        assertEquals(List.of(new NodeOutput(1, 3, 4)), result.positions());
        verify(bridge, times(1)).destroySession(77L);
    }

    @Test
    @DisplayName("Grafo vacío: éxito sin posiciones")
    void autoLayout_shouldSucceedOnEmptyGraph() {
        LayoutResult result = autoLayout.autoLayout(List.of(), List.of());

        assertTrue(result.isSuccess());
        assertTrue(result.positions().isEmpty());
    }

    @Test
    @DisplayName("Petición con su propia configuración")
    void run_shouldUseRequestConfig() {
        LayoutRequest request = LayoutRequest.builder()
                .config(config.withMaxIterations(10))
                .nodes(List.of(NodeInput.of(1, -5, 0), NodeInput.of(2, 5, 0)))
                .edges(List.of(EdgeInput.of(1, 2)))
                .build();

        LayoutResult result = autoLayout.run(request);

        assertTrue(result.isSuccess());
        assertEquals(10, result.iterations());
        assertEquals(2, result.positions().size());
    }

    @Test
    @DisplayName("Área no representable: fallo controlado, sin excepción")
    void autoLayout_shouldReturnFailureForDegenerateArea() {
        List<NodeInput> nodes = List.of(NodeInput.of(1, 0, 0), NodeInput.of(2, 1e-201, 0));
        GraphAutoLayout tiny = new GraphAutoLayout(config.withWidth(1e-200).withHeight(1e-200));

        LayoutResult result = assertDoesNotThrow(() -> tiny.autoLayout(nodes, List.of()));

        assertEquals(LayoutStatus.INVALID_DIMENSIONS, result.status());
        assertEquals(List.of(new NodeOutput(1, 0, 0), new NodeOutput(2, 1e-201, 0)), result.positions());
    }

    @Test
    @DisplayName("Código desconocido de un puente externo: fallo controlado y sesión destruida")
    void autoLayout_shouldContainUnknownBridgeCodes() {
        IGraphLayoutBridge bridge = mock(IGraphLayoutBridge.class);
        when(bridge.createSession(any(), anyInt(), any(), anyInt(), anyDouble(), anyDouble())).thenReturn(5L);
        when(bridge.compute(anyLong(), anyInt(), anyDouble(), any(), anyInt(), any())).thenReturn(42);

        LayoutResult result = new GraphAutoLayout(bridge, config)
                .autoLayout(List.of(NodeInput.of(1, 3, 4)), List.of());

        assertFalse(result.isSuccess());
        assertEquals(GraphAutoLayout.UNEXPECTED_FAILURE_MESSAGE, result.message());
        assertEquals(List.of(new NodeOutput(1, 3, 4)), result.positions());
        verify(bridge, times(1)).destroySession(5L);
    }

    @Test
    @DisplayName("Código negativo desconocido en create: fallo controlado")
    void autoLayout_shouldContainUnknownCreateCodes() {
        IGraphLayoutBridge bridge = mock(IGraphLayoutBridge.class);
        when(bridge.createSession(any(), anyInt(), any(), anyInt(), anyDouble(), anyDouble())).thenReturn(-42L);

        LayoutResult result = assertDoesNotThrow(() -> new GraphAutoLayout(bridge, config)
                .autoLayout(List.of(NodeInput.of(1, 3, 4)), List.of()));

        assertFalse(result.isSuccess());
        verify(bridge, never()).destroySession(anyLong());
    }

    @Test
    @DisplayName("Elementos nulos en las listas se ignoran")
    void autoLayout_shouldSkipNullElements() {
        List<NodeInput> nodes = Arrays.asList(NodeInput.of(1, -10, 0), null, NodeInput.of(2, 10, 0));
        List<EdgeInput> edges = Arrays.asList(null, EdgeInput.of(1, 2));

        LayoutResult result = autoLayout.autoLayout(nodes, edges);

        assertTrue(result.isSuccess());
        assertThat(result.positions()).extracting(NodeOutput::id).containsExactly(1, 2);
    }

    @Test
    @DisplayName("Id duplicado libre y luego fijado: cuenta la primera aparición, que se mueve")
    void autoLayout_shouldApplyFirstOccurrenceRuleToPinnedNodes() {
        List<NodeInput> nodes = List.of(
                NodeInput.of(1, -10, 0),
                NodeInput.pinned(1, 100, 100),
                NodeInput.of(2, 10, 0));

        LayoutResult result = autoLayout.autoLayout(nodes, List.of(EdgeInput.of(1, 2)));

        assertTrue(result.isSuccess());
        assertEquals(2, result.positions().size());
        NodeOutput first = result.positionOf(1).orElseThrow();
        assertNotEquals(new NodeOutput(1, 100, 100), first);
        assertThat(first.x()).isLessThan(-10.0);
    }

    @Test
    @DisplayName("Petición con enfriamiento geométrico: se aplica la configuración completa")
    void run_shouldHonourFullRequestConfig() {
        LayoutConfig geometric = config.withCoolingStrategy(LayoutConfig.CoolingStrategy.GEOMETRIC).withCoolingFactor(0.5);
        LayoutRequest linearRequest = LayoutRequest.builder()
                .config(config)
                .nodes(LayoutSessionTest.sampleNodes(6))
                .edges(LayoutSessionTest.ringEdges(6))
                .build();
        LayoutRequest geometricRequest = new LayoutRequest(geometric, linearRequest.nodes(), linearRequest.edges());

        LayoutResult viaDefault = autoLayout.run(geometricRequest);
        LayoutResult fresh = new GraphAutoLayout(geometric).run(geometricRequest);
        LayoutResult linear = autoLayout.run(linearRequest);

        assertEquals(fresh.positions(), viaDefault.positions());
        assertNotEquals(linear.positions(), viaDefault.positions());
    }

    @Test
    @DisplayName("Variante asíncrona: mismo resultado que la síncrona")
    void autoLayoutAsync_shouldMatchSynchronousResult() throws Exception {
        SceneFrame frame = SceneFrame.centered(400, 300);
        List<NodeInput> nodes = LayoutSessionTest.sampleNodes(6);
        List<EdgeInput> edges = LayoutSessionTest.ringEdges(6);

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            LayoutResult async = autoLayout.autoLayoutAsync(frame, nodes, edges, executor).get(30, TimeUnit.SECONDS);
            LayoutResult sync = autoLayout.autoLayout(frame, nodes, edges);

            assertEquals(sync.positions(), async.positions());
        } finally {
            executor.shutdownNow();
        }
    }
}
