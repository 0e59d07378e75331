package narrativeforge.physics.jni;

import lombok.extern.slf4j.Slf4j;
import narrativeforge.domain.exception.LayoutException;
import narrativeforge.domain.graph.EdgeInput;
import narrativeforge.domain.graph.LayoutStatus;
import narrativeforge.domain.graph.NodeInput;
import narrativeforge.domain.graph.NodeOutput;

import java.nio.ByteBuffer;
import java.nio.IntBuffer;
import java.util.List;

/**
 * Puente Java sobre {@link IGraphLayoutBridge}: propietario de un único handle.
 * <p>
 * La sesión se crea en el constructor y se destruye en {@link #close()}, de modo que
 * con try-with-resources el doble destroy o el uso tras destroy no son representables.
 * Los códigos de estado distintos de 0 se convierten en {@link LayoutException}.
 */
@Slf4j
public final class GraphLayoutSolver implements AutoCloseable {

    private final IGraphLayoutBridge bridge;
    private final int nodeCount;
    private long sessionHandle;

    public GraphLayoutSolver(List<NodeInput> nodes, List<EdgeInput> edges, double width, double height) {
        this(GraphLayoutSessionRegistry.getInstance(), nodes, edges, width, height);
    }

    public GraphLayoutSolver(IGraphLayoutBridge bridge, List<NodeInput> nodes, List<EdgeInput> edges,
                             double width, double height) {
        this.bridge = bridge;
        this.nodeCount = nodes.size();

        ByteBuffer nodeBuf = LayoutStructCodec.encodeNodes(nodes);
        ByteBuffer edgeBuf = LayoutStructCodec.encodeEdges(edges);

        long result = bridge.createSession(nodeBuf, nodes.size(), edgeBuf, edges.size(), width, height);
        if (result == 0) {
            throw new LayoutException(LayoutStatus.ALLOCATION_FAILURE, "La frontera devolvió un handle nulo.");
        }
        if (result < 0) {
            throw new LayoutException(LayoutStatus.fromCode((int) result));
        }
        this.sessionHandle = result;
        log.debug("GraphLayoutSolver abierto (Handle: {}, nodos: {}).", sessionHandle, nodeCount);
    }

    /**
     * Ejecuta el layout y devuelve las posiciones finales.
     *
     * @throws LayoutException con el estado devuelto por la frontera si no es 0.
     */
    public List<NodeOutput> solve(int maxIterations, double initialTemperature) {
        if (sessionHandle == 0) {
            throw new LayoutException(LayoutStatus.INVALID_HANDLE);
        }

        ByteBuffer output = LayoutStructCodec.allocateOutput(nodeCount);
        IntBuffer count = LayoutStructCodec.allocateCount();

        int status = bridge.compute(sessionHandle, maxIterations, initialTemperature, output, nodeCount, count);
        if (status != LayoutStatus.OK.getCode()) {
            throw new LayoutException(LayoutStatus.fromCode(status));
        }

        return LayoutStructCodec.decodeOutputs(output, count.get(0));
    }

    public boolean isOpen() {
        return sessionHandle != 0;
    }

    @Override
    public void close() {
        if (sessionHandle != 0) {
            bridge.destroySession(sessionHandle);
            sessionHandle = 0;
        }
    }
}
