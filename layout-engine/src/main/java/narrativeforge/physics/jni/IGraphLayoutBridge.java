package narrativeforge.physics.jni;

import java.nio.ByteBuffer;
import java.nio.IntBuffer;

// Contrato de la frontera por handles (estilo C-ABI)
public interface IGraphLayoutBridge {

    /**
     * Lifecycle: Create
     * Copia nodos y aristas desde buffers con layout fijo (ver {@link LayoutStructCodec})
     * al almacenamiento propio de una sesión nueva.
     *
     * @param nodes     Buffer con {@code nodeCount} registros NodeInput a partir de su posición.
     * @param nodeCount Número de nodos.
     * @param edges     Buffer con {@code edgeCount} registros EdgeInput a partir de su posición.
     * @param edgeCount Número de aristas.
     * @param width     Ancho del área de simulación (&gt; 0).
     * @param height    Alto del área de simulación (&gt; 0).
     * @return Handle opaco positivo si éxito; si no, el código negativo del
     * {@link narrativeforge.domain.graph.LayoutStatus} correspondiente.
     */
    long createSession(
            ByteBuffer nodes,
            int nodeCount,
            ByteBuffer edges,
            int edgeCount,
            double width,
            double height
    );

    /**
     * Lifecycle: Run
     * Ejecuta la simulación y escribe un registro NodeOutput por nodo aceptado.
     *
     * @param sessionHandle      Handle devuelto por {@link #createSession}.
     * @param maxIterations      Iteraciones exactas a ejecutar.
     * @param initialTemperature Desplazamiento máximo en la iteración 0.
     * @param output             Buffer reservado por el llamador.
     * @param outputCapacity     Capacidad del buffer, en registros.
     * @param outputCount        Recibe en su índice 0 el número de registros escritos.
     * @return Código de estado (0 = éxito).
     */
    int compute(
            long sessionHandle,
            int maxIterations,
            double initialTemperature,
            ByteBuffer output,
            int outputCapacity,
            IntBuffer outputCount
    );

    // Lifecycle: Destroy
    void destroySession(long sessionHandle);
}
