package narrativeforge.physics.simulator;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import narrativeforge.config.LayoutConfig;
import narrativeforge.domain.exception.LayoutException;
import narrativeforge.domain.graph.EdgeInput;
import narrativeforge.domain.graph.LayoutStatus;
import narrativeforge.domain.graph.NodeInput;
import narrativeforge.domain.graph.NodeOutput;
import narrativeforge.factory.LayoutComponentFactory;
import narrativeforge.physics.impl.FruchtermanReingoldForceModel;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Sesión de layout: instancia de simulación de vida corta, propietaria de su copia
 * de nodos y aristas.
 * <p>
 * Ciclo de vida: {@link #create} una vez por petición, {@link #compute} y {@link #close}.
 * Nunca modifica la entrada del llamador. {@code compute} parte siempre de las
 * posiciones copiadas en la construcción, por lo que repetirlo da el mismo resultado.
 * <p>
 * Reglas de aceptación de la entrada:
 * <ul>
 *     <li>Id duplicado: se acepta la primera aparición.</li>
 *     <li>Nodo con coordenadas no finitas: se descarta.</li>
 *     <li>Arista con un extremo ausente (colgante) o con ambos extremos iguales: se descarta.</li>
 *     <li>Arista con intensidad no finita: se descarta. Intensidad negativa: se trata como 0.</li>
 * </ul>
 * Una sesión no debe usarse desde varios hilos a la vez.
 */
@Slf4j
public final class LayoutSession implements AutoCloseable {

    @Getter
    private final double width;
    @Getter
    private final double height;
    @Getter
    private final int droppedNodeCount;
    @Getter
    private final int droppedEdgeCount;
    private final LayoutConfig config;

    // --- Almacenamiento propio (copias) ---
    private int[] ids;
    private double[] initialX;
    private double[] initialY;
    private boolean[] fixed;
    private int[] edgeSource;
    private int[] edgeTarget;
    private double[] edgeIntensity;

    private boolean closed = false;

    private LayoutSession(LayoutConfig config, int[] ids, double[] initialX, double[] initialY, boolean[] fixed,
                          int[] edgeSource, int[] edgeTarget, double[] edgeIntensity,
                          int droppedNodeCount, int droppedEdgeCount) {
        this.config = config;
        this.width = config.width();
        this.height = config.height();
        this.ids = ids;
        this.initialX = initialX;
        this.initialY = initialY;
        this.fixed = fixed;
        this.edgeSource = edgeSource;
        this.edgeTarget = edgeTarget;
        this.edgeIntensity = edgeIntensity;
        this.droppedNodeCount = droppedNodeCount;
        this.droppedEdgeCount = droppedEdgeCount;
    }

    public static LayoutSession create(List<NodeInput> nodes, List<EdgeInput> edges, double width, double height) {
        return create(nodes, edges, LayoutConfig.getDefaultLayout().withWidth(width).withHeight(height));
    }

    /**
     * Valida las dimensiones, copia la entrada y filtra aristas colgantes.
     *
     * @throws LayoutException {@link LayoutStatus#INVALID_DIMENSIONS} si ancho o alto no son &gt; 0,
     *                         {@link LayoutStatus#ALLOCATION_FAILURE} si la copia no cabe en memoria.
     */
    public static LayoutSession create(List<NodeInput> nodes, List<EdgeInput> edges, LayoutConfig config) {
        Objects.requireNonNull(nodes, "La lista de nodos no puede ser nula.");
        Objects.requireNonNull(edges, "La lista de aristas no puede ser nula.");
        Objects.requireNonNull(config, "La configuración no puede ser nula.");

        validateDimensions(config.width(), config.height());

        try {
            return copyOf(nodes, edges, config);
        } catch (OutOfMemoryError e) {
            log.error("Sin memoria copiando {} nodos y {} aristas.", nodes.size(), edges.size());
            throw new LayoutException(LayoutStatus.ALLOCATION_FAILURE,
                    LayoutStatus.ALLOCATION_FAILURE.getMessage(), e);
        }
    }

    private static void validateDimensions(double width, double height) {
        double area = width * height;
        // El área también debe ser representable: k = sqrt(área / N) no puede ser 0 ni infinito
        boolean valid = width > 0 && height > 0 && Double.isFinite(width) && Double.isFinite(height)
                && area > 0 && Double.isFinite(area);
        if (!valid) {
            throw new LayoutException(LayoutStatus.INVALID_DIMENSIONS, String.format(
                    "Dimensiones inválidas: width=%s, height=%s. Ambas deben ser > 0.", width, height));
        }
    }

    private static LayoutSession copyOf(List<NodeInput> nodes, List<EdgeInput> edges, LayoutConfig config) {
        int nodeCapacity = nodes.size();
        int[] ids = new int[nodeCapacity];
        double[] xs = new double[nodeCapacity];
        double[] ys = new double[nodeCapacity];
        boolean[] fixed = new boolean[nodeCapacity];
        Map<Integer, Integer> indexById = new HashMap<>();

        int accepted = 0;
        for (NodeInput node : nodes) {
            if (node == null || !node.hasFinitePosition()) {
                log.warn("Nodo descartado por coordenadas no válidas: {}", node);
                continue;
            }
            if (indexById.putIfAbsent(node.id(), accepted) != null) {
                log.warn("Nodo con id duplicado {} descartado.", node.id());
                continue;
            }
            ids[accepted] = node.id();
            xs[accepted] = node.x();
            ys[accepted] = node.y();
            fixed[accepted] = node.fixed();
            accepted++;
        }

        int edgeCapacity = edges.size();
        int[] source = new int[edgeCapacity];
        int[] target = new int[edgeCapacity];
        double[] intensity = new double[edgeCapacity];

        int validEdges = 0;
        for (EdgeInput edge : edges) {
            if (edge == null || edge.isSelfLoop() || !Double.isFinite(edge.intensity())) continue;
            Integer u = indexById.get(edge.sourceId());
            Integer v = indexById.get(edge.targetId());
            if (u == null || v == null) continue;

            source[validEdges] = u;
            target[validEdges] = v;
            intensity[validEdges] = Math.max(0.0, edge.intensity());
            validEdges++;
        }

        double k = FruchtermanReingoldForceModel.idealSpacing(config.width(), config.height(), accepted);
        if (!(k > 0) || !Double.isFinite(k)) {
            throw new LayoutException(LayoutStatus.INVALID_DIMENSIONS, String.format(
                    "Área %sx%s demasiado pequeña para %d nodos (k=%s).", config.width(), config.height(), accepted, k));
        }

        int droppedNodes = nodeCapacity - accepted;
        int droppedEdges = edgeCapacity - validEdges;
        if (droppedEdges > 0) {
            log.warn("{} aristas descartadas (colgantes, bucles o intensidad no válida).", droppedEdges);
        }

        LayoutSession session = new LayoutSession(config,
                trim(ids, accepted), trim(xs, accepted), trim(ys, accepted), trim(fixed, accepted),
                trim(source, validEdges), trim(target, validEdges), trim(intensity, validEdges),
                droppedNodes, droppedEdges);
        log.info("Sesión de layout creada: {} nodos, {} aristas, área {}x{}.",
                accepted, validEdges, config.width(), config.height());
        return session;
    }

    /**
     * Ejecuta la simulación con las iteraciones y temperatura de la configuración.
     */
    public NodeOutput[] compute() {
        return compute(config.maxIterations(), config.initialTemperature());
    }

    /**
     * Ejecuta exactamente {@code maxIterations} iteraciones y devuelve una posición por
     * nodo aceptado, en el orden de aceptación.
     * <p>
     * {@code maxIterations} negativo equivale a 0; una temperatura no finita o negativa
     * equivale a 0 (ningún nodo se mueve).
     *
     * @throws LayoutException {@link LayoutStatus#INVALID_HANDLE} si la sesión ya se cerró.
     */
    public NodeOutput[] compute(int maxIterations, double initialTemperature) {
        ensureOpen();

        int n = ids.length;
        NodeOutput[] result = new NodeOutput[n];
        if (n == 0) {
            return result;
        }

        int iterations = Math.max(0, maxIterations);
        double temperature = (Double.isFinite(initialTemperature) && initialTemperature > 0) ? initialTemperature : 0.0;

        double[] x = initialX.clone();
        double[] y = initialY.clone();

        long start = System.currentTimeMillis();
        try (ForceDirectedLayoutDriver driver = LayoutComponentFactory.createDriver(config, width, height, n)) {
            driver.run(x, y, fixed, edgeSource, edgeTarget, edgeIntensity, iterations, temperature);
        }
        log.debug("Layout de {} nodos completado en {} ms ({} iteraciones, T0={}).",
                n, System.currentTimeMillis() - start, iterations, temperature);

        for (int i = 0; i < n; i++) {
            // Los nodos fijados devuelven su entrada tal cual
            result[i] = fixed[i]
                    ? new NodeOutput(ids[i], initialX[i], initialY[i])
                    : new NodeOutput(ids[i], x[i], y[i]);
        }
        return result;
    }

    public int getNodeCount() {
        ensureOpen();
        return ids.length;
    }

    public int getEdgeCount() {
        ensureOpen();
        return edgeSource.length;
    }

    public double getIdealSpacing() {
        ensureOpen();
        return FruchtermanReingoldForceModel.idealSpacing(width, height, ids.length);
    }

    public boolean isClosed() {
        return closed;
    }

    private void ensureOpen() {
        if (closed) {
            throw new LayoutException(LayoutStatus.INVALID_HANDLE);
        }
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        ids = null;
        initialX = null;
        initialY = null;
        fixed = null;
        edgeSource = null;
        edgeTarget = null;
        edgeIntensity = null;
    }

    // --- Helpers ---

    private static int[] trim(int[] data, int length) {
        return (data.length == length) ? data : Arrays.copyOf(data, length);
    }

    private static double[] trim(double[] data, int length) {
        return (data.length == length) ? data : Arrays.copyOf(data, length);
    }

    private static boolean[] trim(boolean[] data, int length) {
        return (data.length == length) ? data : Arrays.copyOf(data, length);
    }
}
