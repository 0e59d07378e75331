package narrativeforge.physics.jni;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import narrativeforge.config.LayoutConfig;
import narrativeforge.config.LayoutConfig.CoolingStrategy;
import narrativeforge.domain.exception.LayoutException;
import narrativeforge.domain.graph.EdgeInput;
import narrativeforge.domain.graph.LayoutStatus;
import narrativeforge.domain.graph.NodeInput;
import narrativeforge.domain.graph.NodeOutput;
import narrativeforge.physics.simulator.LayoutSession;

import java.nio.ByteBuffer;
import java.nio.IntBuffer;
import java.nio.ReadOnlyBufferException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Implementación en proceso de {@link IGraphLayoutBridge}.
 * <p>
 * Mantiene un registro {@code handle -> LayoutSession}. Los handles son positivos,
 * crecientes y nunca se reutilizan, de modo que un handle destruido se detecta como
 * {@link LayoutStatus#INVALID_HANDLE} en lugar de producir un comportamiento indefinido.
 * Ninguna excepción atraviesa esta clase: todo se traduce a códigos de estado. Los fallos
 * no previstos del motor se notifican como {@link LayoutStatus#ALLOCATION_FAILURE}.
 * <p>
 * Sesiones distintas son independientes y pueden ejecutarse en hilos distintos.
 */
@Slf4j
public class GraphLayoutSessionRegistry implements IGraphLayoutBridge {

    public static final String PARALLELISM_PROPERTY = "narrativeforge.layout.parallelism";
    public static final String COOLING_PROPERTY = "narrativeforge.layout.cooling";

    private static volatile GraphLayoutSessionRegistry INSTANCE = null;

    private final Map<Long, LayoutSession> sessions = new ConcurrentHashMap<>();
    private final AtomicLong nextHandle = new AtomicLong(1L);

    @Getter
    private final LayoutConfig baseConfig;

    public GraphLayoutSessionRegistry(LayoutConfig baseConfig) {
        this.baseConfig = baseConfig;
    }

    public static GraphLayoutSessionRegistry getInstance() {
        if (INSTANCE == null) {
            synchronized (GraphLayoutSessionRegistry.class) {
                if (INSTANCE == null) {
                    INSTANCE = new GraphLayoutSessionRegistry(configFromSystemProperties());
                }
            }
        }
        return INSTANCE;
    }

    /**
     * Configuración base del singleton. Las propiedades de sistema permiten ajustar el
     * paralelismo y el esquema de enfriamiento sin tocar a los llamadores.
     */
    static LayoutConfig configFromSystemProperties() {
        LayoutConfig config = LayoutConfig.getDefaultLayout();

        String parallelismProp = System.getProperty(PARALLELISM_PROPERTY);
        if (parallelismProp != null) {
            try {
                config = config.withParallelism(Math.max(1, Integer.parseInt(parallelismProp.trim())));
            } catch (NumberFormatException e) {
                log.warn("Valor inválido para {}: '{}'. Se usa ejecución secuencial.", PARALLELISM_PROPERTY, parallelismProp);
            }
        }

        String coolingProp = System.getProperty(COOLING_PROPERTY);
        if (coolingProp != null) {
            try {
                config = config.withCoolingStrategy(CoolingStrategy.valueOf(coolingProp.trim().toUpperCase()));
            } catch (IllegalArgumentException e) {
                log.warn("Valor inválido para {}: '{}'. Se usa enfriamiento LINEAR.", COOLING_PROPERTY, coolingProp);
            }
        }

        log.info("Registro de sesiones de layout inicializado (paralelismo={}, enfriamiento={}).",
                config.parallelism(), config.coolingStrategy());
        return config;
    }

    @Override
    public long createSession(ByteBuffer nodes, int nodeCount, ByteBuffer edges, int edgeCount,
                              double width, double height) {
        try {
            List<NodeInput> nodeList = LayoutStructCodec.decodeNodes(nodes, nodeCount);
            List<EdgeInput> edgeList = LayoutStructCodec.decodeEdges(edges, edgeCount);

            LayoutSession session = LayoutSession.create(nodeList, edgeList,
                    baseConfig.withWidth(width).withHeight(height));

            long handle = nextHandle.getAndIncrement();
            sessions.put(handle, session);
            log.debug("Sesión de layout registrada (Handle: {}).", handle);
            return handle;

        } catch (LayoutException e) {
            log.warn("Creación de sesión rechazada: {}", e.getMessage());
            return e.getStatus().getCode();
        } catch (IllegalArgumentException e) {
            // Buffers ausentes o más cortos que los recuentos declarados: la copia no es posible
            log.error("No se pudo copiar la entrada de la sesión: {}", e.getMessage());
            return LayoutStatus.ALLOCATION_FAILURE.getCode();
        } catch (OutOfMemoryError e) {
            log.error("Sin memoria al crear la sesión de layout ({} nodos, {} aristas).", nodeCount, edgeCount);
            return LayoutStatus.ALLOCATION_FAILURE.getCode();
        } catch (RuntimeException e) {
            log.error("Error inesperado al crear la sesión de layout.", e);
            return LayoutStatus.ALLOCATION_FAILURE.getCode();
        }
    }

    @Override
    public int compute(long sessionHandle, int maxIterations, double initialTemperature,
                       ByteBuffer output, int outputCapacity, IntBuffer outputCount) {
        try {
            boolean countWritable = isWritableCount(outputCount);
            if (countWritable) {
                outputCount.put(0, 0);
            }

            LayoutSession session = sessions.get(sessionHandle);
            if (session == null) {
                log.warn("compute() con handle inválido: {}", sessionHandle);
                return LayoutStatus.INVALID_HANDLE.getCode();
            }

            int nodeCount = session.getNodeCount();
            if (!countWritable
                    || outputCapacity < nodeCount
                    || LayoutStructCodec.recordsRemaining(output, LayoutStructCodec.NODE_OUTPUT_BYTES) < nodeCount) {
                log.warn("Buffer de salida insuficiente: capacidad={}, nodos={}.", outputCapacity, nodeCount);
                return LayoutStatus.INSUFFICIENT_BUFFER.getCode();
            }

            NodeOutput[] results = session.compute(maxIterations, initialTemperature);
            LayoutStructCodec.writeOutputs(output, results);
            outputCount.put(0, results.length);
            return LayoutStatus.OK.getCode();

        } catch (LayoutException e) {
            log.warn("compute() fallido (Handle: {}): {}", sessionHandle, e.getMessage());
            return e.getStatus().getCode();
        } catch (ReadOnlyBufferException | IndexOutOfBoundsException e) {
            log.warn("Buffer de salida no escribible (Handle: {}): {}", sessionHandle, e.toString());
            return LayoutStatus.INSUFFICIENT_BUFFER.getCode();
        } catch (OutOfMemoryError e) {
            log.error("Sin memoria durante compute() (Handle: {}).", sessionHandle);
            return LayoutStatus.ALLOCATION_FAILURE.getCode();
        } catch (RuntimeException e) {
            log.error("Error inesperado en compute() (Handle: {}).", sessionHandle, e);
            return LayoutStatus.ALLOCATION_FAILURE.getCode();
        }
    }

    // El recuento se escribe en el índice 0: debe existir y admitir escritura
    private static boolean isWritableCount(IntBuffer outputCount) {
        return outputCount != null && !outputCount.isReadOnly() && outputCount.limit() > 0;
    }

    @Override
    public void destroySession(long sessionHandle) {
        LayoutSession session = sessions.remove(sessionHandle);
        if (session == null) {
            log.warn("destroySession() con handle inválido o ya destruido: {}", sessionHandle);
            return;
        }
        session.close();
        log.debug("Sesión de layout destruida (Handle: {}).", sessionHandle);
    }

    public int getActiveSessionCount() {
        return sessions.size();
    }
}
