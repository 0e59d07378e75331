package narrativeforge.physics.jni;

import narrativeforge.domain.graph.EdgeInput;
import narrativeforge.domain.graph.NodeInput;
import narrativeforge.domain.graph.NodeOutput;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.IntBuffer;
import java.util.ArrayList;
import java.util.List;

/**
 * Codificación de los structs de la frontera en buffers directos con orden de bytes nativo.
 * <p>
 * Los layouts reproducen la alineación natural de C (double alineado a 8):
 * <pre>
 * NodeInput  (32 bytes): int32 id @0 | pad | f64 x @8 | f64 y @16 | u8 is_fixed @24 | pad
 * EdgeInput  (16 bytes): int32 source_id @0 | int32 target_id @4 | f64 intensity @8
 * NodeOutput (24 bytes): int32 id @0 | pad | f64 x @8 | f64 y @16
 * </pre>
 * Los registros se leen y escriben a partir de la posición actual del buffer, sin modificarla.
 */
public final class LayoutStructCodec {

    public static final int NODE_INPUT_BYTES = 32;
    public static final int EDGE_INPUT_BYTES = 16;
    public static final int NODE_OUTPUT_BYTES = 24;

    private static final int NODE_ID_OFFSET = 0;
    private static final int NODE_X_OFFSET = 8;
    private static final int NODE_Y_OFFSET = 16;
    private static final int NODE_FIXED_OFFSET = 24;

    private static final int EDGE_SOURCE_OFFSET = 0;
    private static final int EDGE_TARGET_OFFSET = 4;
    private static final int EDGE_INTENSITY_OFFSET = 8;

    private LayoutStructCodec() {
    }

    // --- Reserva ---

    public static ByteBuffer allocateDirect(int bytes) {
        return ByteBuffer.allocateDirect(Math.max(bytes, 1)).order(ByteOrder.nativeOrder());
    }

    public static ByteBuffer allocateOutput(int capacity) {
        return allocateDirect(Math.multiplyExact(capacity, NODE_OUTPUT_BYTES));
    }

    public static IntBuffer allocateCount() {
        return allocateDirect(Integer.BYTES).asIntBuffer();
    }

    // --- Codificación (lado llamador) ---

    public static ByteBuffer encodeNodes(List<NodeInput> nodes) {
        ByteBuffer buffer = allocateDirect(Math.multiplyExact(nodes.size(), NODE_INPUT_BYTES));
        for (int i = 0; i < nodes.size(); i++) {
            NodeInput node = nodes.get(i);
            int base = i * NODE_INPUT_BYTES;
            buffer.putInt(base + NODE_ID_OFFSET, node.id());
            buffer.putDouble(base + NODE_X_OFFSET, node.x());
            buffer.putDouble(base + NODE_Y_OFFSET, node.y());
            buffer.put(base + NODE_FIXED_OFFSET, (byte) (node.fixed() ? 1 : 0));
        }
        return buffer;
    }

    public static ByteBuffer encodeEdges(List<EdgeInput> edges) {
        ByteBuffer buffer = allocateDirect(Math.multiplyExact(edges.size(), EDGE_INPUT_BYTES));
        for (int i = 0; i < edges.size(); i++) {
            EdgeInput edge = edges.get(i);
            int base = i * EDGE_INPUT_BYTES;
            buffer.putInt(base + EDGE_SOURCE_OFFSET, edge.sourceId());
            buffer.putInt(base + EDGE_TARGET_OFFSET, edge.targetId());
            buffer.putDouble(base + EDGE_INTENSITY_OFFSET, edge.intensity());
        }
        return buffer;
    }

    public static List<NodeOutput> decodeOutputs(ByteBuffer buffer, int count) {
        ByteBuffer view = nativeView(buffer, count, NODE_OUTPUT_BYTES);
        List<NodeOutput> outputs = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int base = view.position() + i * NODE_OUTPUT_BYTES;
            outputs.add(new NodeOutput(
                    view.getInt(base + NODE_ID_OFFSET),
                    view.getDouble(base + NODE_X_OFFSET),
                    view.getDouble(base + NODE_Y_OFFSET)));
        }
        return outputs;
    }

    // --- Decodificación (lado motor) ---

    public static List<NodeInput> decodeNodes(ByteBuffer buffer, int count) {
        ByteBuffer view = nativeView(buffer, count, NODE_INPUT_BYTES);
        List<NodeInput> nodes = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int base = view.position() + i * NODE_INPUT_BYTES;
            nodes.add(new NodeInput(
                    view.getInt(base + NODE_ID_OFFSET),
                    view.getDouble(base + NODE_X_OFFSET),
                    view.getDouble(base + NODE_Y_OFFSET),
                    view.get(base + NODE_FIXED_OFFSET) != 0));
        }
        return nodes;
    }

    public static List<EdgeInput> decodeEdges(ByteBuffer buffer, int count) {
        ByteBuffer view = nativeView(buffer, count, EDGE_INPUT_BYTES);
        List<EdgeInput> edges = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int base = view.position() + i * EDGE_INPUT_BYTES;
            edges.add(new EdgeInput(
                    view.getInt(base + EDGE_SOURCE_OFFSET),
                    view.getInt(base + EDGE_TARGET_OFFSET),
                    view.getDouble(base + EDGE_INTENSITY_OFFSET)));
        }
        return edges;
    }

    public static void writeOutputs(ByteBuffer buffer, NodeOutput[] outputs) {
        ByteBuffer view = nativeView(buffer, outputs.length, NODE_OUTPUT_BYTES);
        for (int i = 0; i < outputs.length; i++) {
            int base = view.position() + i * NODE_OUTPUT_BYTES;
            view.putInt(base + NODE_ID_OFFSET, outputs[i].id());
            view.putDouble(base + NODE_X_OFFSET, outputs[i].x());
            view.putDouble(base + NODE_Y_OFFSET, outputs[i].y());
        }
    }

    /**
     * Número de registros completos de {@code recordBytes} que caben desde la posición actual.
     */
    public static int recordsRemaining(ByteBuffer buffer, int recordBytes) {
        return (buffer == null) ? 0 : buffer.remaining() / recordBytes;
    }

    // --- Helpers ---

    /**
     * Vista del buffer que interpreta la memoria en orden nativo, como haría el lado C,
     * independientemente del orden configurado en el buffer del llamador.
     */
    private static ByteBuffer nativeView(ByteBuffer buffer, int count, int recordBytes) {
        if (count < 0) {
            throw new IllegalArgumentException("El número de registros no puede ser negativo: " + count);
        }
        if (count == 0 && buffer == null) {
            return allocateDirect(1);
        }
        if (buffer == null) {
            throw new IllegalArgumentException("Buffer nulo para " + count + " registros.");
        }
        long required = (long) count * recordBytes;
        if (buffer.remaining() < required) {
            throw new IllegalArgumentException(String.format(
                    "Buffer insuficiente: se requieren %d bytes y quedan %d.", required, buffer.remaining()));
        }
        return buffer.duplicate().order(ByteOrder.nativeOrder());
    }
}
