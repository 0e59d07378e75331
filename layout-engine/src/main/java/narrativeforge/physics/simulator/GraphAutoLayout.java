package narrativeforge.physics.simulator;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import narrativeforge.config.LayoutConfig;
import narrativeforge.domain.dto.LayoutRequest;
import narrativeforge.domain.exception.LayoutException;
import narrativeforge.domain.graph.EdgeInput;
import narrativeforge.domain.graph.LayoutStatus;
import narrativeforge.domain.graph.NodeInput;
import narrativeforge.domain.graph.NodeOutput;
import narrativeforge.domain.graph.SceneFrame;
import narrativeforge.domain.layout.LayoutResult;
import narrativeforge.io.JsonFileHandler;
import narrativeforge.physics.jni.GraphLayoutSessionRegistry;
import narrativeforge.physics.jni.GraphLayoutSolver;
import narrativeforge.physics.jni.IGraphLayoutBridge;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Facade de alto nivel para la petición "auto layout" de la aplicación anfitriona.
 * <p>
 * Responsabilidades:
 * 1. Trasladar las posiciones de la escena al espacio centrado del motor y de vuelta.
 * 2. Ejecutar exactamente un create/compute/destroy por petición.
 * 3. Ante un estado de error, devolver las posiciones originales intactas y un mensaje
 *    para el usuario, en lugar de lanzar.
 * <p>
 * El cálculo bloquea el hilo llamador; para grafos grandes usar {@link #autoLayoutAsync}.
 */
@Slf4j
public class GraphAutoLayout {

    static final String UNEXPECTED_FAILURE_MESSAGE =
            "No se pudo calcular el layout. Las posiciones actuales no se han modificado.";

    private final IGraphLayoutBridge bridge;
    @Getter
    private final LayoutConfig config;

    public GraphAutoLayout(LayoutConfig config) {
        this(new GraphLayoutSessionRegistry(config), config);
    }

    public GraphAutoLayout(IGraphLayoutBridge bridge, LayoutConfig config) {
        this.bridge = bridge;
        this.config = config;
    }

    /**
     * Layout en un marco centrado en el origen del llamador con el tamaño de la configuración.
     */
    public LayoutResult autoLayout(List<NodeInput> sceneNodes, List<EdgeInput> edges) {
        return autoLayout(SceneFrame.centered(config.width(), config.height()), sceneNodes, edges);
    }

    /**
     * Ejecuta una petición ya expresada en coordenadas locales del motor, con la
     * configuración completa de la petición (enfriamiento, paralelismo, fuerzas).
     */
    public LayoutResult run(LayoutRequest request) {
        LayoutConfig requestConfig = request.config();
        GraphAutoLayout delegate = new GraphAutoLayout(bridgeFor(requestConfig), requestConfig);
        return delegate.autoLayout(request.nodes(), request.edges());
    }

    /**
     * Reproduce una petición capturada en un archivo JSON (ver {@link JsonFileHandler#writeRequest}).
     *
     * @throws IOException Si el archivo no existe o no es una petición válida.
     */
    public LayoutResult replay(Path requestFile) throws IOException {
        return run(new JsonFileHandler().readRequest(requestFile));
    }

    /**
     * Calcula el layout de {@code sceneNodes} dentro de {@code frame}.
     *
     * @param frame      Rectángulo de la escena que define el área de simulación.
     * @param sceneNodes Nodos en coordenadas de la escena. Los nulos se ignoran.
     * @param edges      Aristas (las colgantes y las nulas se ignoran).
     * @return Resultado en coordenadas de la escena. Nunca nulo.
     */
    public LayoutResult autoLayout(SceneFrame frame, List<NodeInput> sceneNodes, List<EdgeInput> edges) {
        List<NodeOutput> untouched = new ArrayList<>(sceneNodes.size());
        // Misma regla que la sesión: cuenta la primera aparición válida de cada id
        Map<Integer, NodeInput> acceptedById = new HashMap<>();
        List<NodeInput> localNodes = new ArrayList<>(sceneNodes.size());

        for (NodeInput node : sceneNodes) {
            if (node == null) continue;
            untouched.add(new NodeOutput(node.id(), node.x(), node.y()));
            if (node.hasFinitePosition()) {
                acceptedById.putIfAbsent(node.id(), node);
            }
            localNodes.add(frame.toLocal(node));
        }
        List<EdgeInput> validEdges = new ArrayList<>(edges.size());
        for (EdgeInput edge : edges) {
            if (edge != null) validEdges.add(edge);
        }

        long startTime = System.currentTimeMillis();
        try (GraphLayoutSolver solver = new GraphLayoutSolver(bridge, localNodes, validEdges, frame.width(), frame.height())) {
            List<NodeOutput> localResult = solver.solve(config.maxIterations(), config.initialTemperature());

            List<NodeOutput> sceneResult = new ArrayList<>(localResult.size());
            for (NodeOutput local : localResult) {
                NodeInput accepted = acceptedById.get(local.id());
                // Un nodo fijado se devuelve con sus coordenadas de escena originales, sin ida y vuelta
                sceneResult.add(accepted != null && accepted.fixed()
                        ? new NodeOutput(accepted.id(), accepted.x(), accepted.y())
                        : frame.toScene(local));
            }

            long elapsed = System.currentTimeMillis() - startTime;
            log.info("Auto layout completado: {} nodos, {} aristas, {} iteraciones en {} ms.",
                    sceneResult.size(), validEdges.size(), Math.max(0, config.maxIterations()), elapsed);
            return LayoutResult.success(sceneResult, Math.max(0, config.maxIterations()), elapsed);

        } catch (LayoutException e) {
            log.warn("Auto layout fallido ({}): {}. Se conservan las posiciones actuales.",
                    e.getStatus(), e.getMessage());
            return LayoutResult.failure(e.getStatus(), untouched, e.getStatus().getMessage());
        } catch (RuntimeException e) {
            log.error("Error inesperado en el auto layout. Se conservan las posiciones actuales.", e);
            return LayoutResult.failure(LayoutStatus.ALLOCATION_FAILURE, untouched, UNEXPECTED_FAILURE_MESSAGE);
        }
    }

    /**
     * Variante asíncrona: ejecuta {@link #autoLayout(SceneFrame, List, List)} en {@code executor}
     * para no bloquear el hilo interactivo.
     */
    public CompletableFuture<LayoutResult> autoLayoutAsync(SceneFrame frame, List<NodeInput> sceneNodes,
                                                           List<EdgeInput> edges, Executor executor) {
        List<NodeInput> nodesCopy = List.copyOf(sceneNodes);
        List<EdgeInput> edgesCopy = List.copyOf(edges);
        return CompletableFuture.supplyAsync(() -> autoLayout(frame, nodesCopy, edgesCopy), executor);
    }

    /**
     * El registro en proceso aplica su propia configuración base a cada sesión. Si difiere
     * de la pedida se usa un registro con esa configuración; un puente externo se usa tal cual.
     */
    private IGraphLayoutBridge bridgeFor(LayoutConfig requestConfig) {
        if (bridge instanceof GraphLayoutSessionRegistry) {
            GraphLayoutSessionRegistry registry = (GraphLayoutSessionRegistry) bridge;
            if (!registry.getBaseConfig().equals(requestConfig)) {
                return new GraphLayoutSessionRegistry(requestConfig);
            }
        }
        return bridge;
    }
}
