package narrativeforge.physics.simulator;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import narrativeforge.physics.i.ICoolingSchedule;
import narrativeforge.physics.i.IForceModel;
import narrativeforge.physics.impl.RepulsionRowTask;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Bucle de iteración del layout dirigido por fuerzas.
 * <p>
 * Responsabilidades:
 * 1. Acumular repulsión (todos los pares) y atracción (aristas) en un vector neto por nodo.
 * 2. Limitar el desplazamiento a la temperatura actual y aplicarlo, salvo a nodos fijados.
 * 3. Mantener cada nodo desplazado dentro de {@code [-W/2, W/2] x [-H/2, H/2]}.
 * <p>
 * Ejecuta exactamente {@code maxIterations} iteraciones, sin salida anticipada.
 * Con {@code parallelism > 1} el paso de repulsión se reparte en un pool fijo de hilos
 * sin alterar el resultado.
 */
@Slf4j
public class ForceDirectedLayoutDriver implements AutoCloseable {

    @Getter
    private final IForceModel forceModel;
    @Getter
    private final ICoolingSchedule coolingSchedule;
    private final double halfWidth;
    private final double halfHeight;
    @Getter
    private final int parallelism;

    // Solo existe si parallelism > 1
    private final ExecutorService threadPool;

    public ForceDirectedLayoutDriver(IForceModel forceModel, ICoolingSchedule coolingSchedule,
                                     double width, double height, int parallelism) {
        this.forceModel = forceModel;
        this.coolingSchedule = coolingSchedule;
        this.halfWidth = width / 2.0;
        this.halfHeight = height / 2.0;
        this.parallelism = Math.max(parallelism, 1);
        this.threadPool = (this.parallelism > 1) ? Executors.newFixedThreadPool(this.parallelism) : null;
        log.debug("ForceDirectedLayoutDriver inicializado. (Fuerzas: {}, Enfriamiento: {}, Hilos: {})",
                forceModel.getName(), coolingSchedule.getName(), this.parallelism);
    }

    /**
     * Ejecuta la simulación modificando {@code x} e {@code y} in-place.
     *
     * @param x                  Posiciones X (se sobrescriben con el resultado).
     * @param y                  Posiciones Y (se sobrescriben con el resultado).
     * @param fixed              Nodos anclados; nunca se escriben sus posiciones.
     * @param edgeSource         Índice (no id) del primer extremo de cada arista.
     * @param edgeTarget         Índice del segundo extremo de cada arista.
     * @param edgeIntensity      Peso de cada arista.
     * @param maxIterations      Iteraciones a ejecutar.
     * @param initialTemperature Temperatura en la iteración 0.
     */
    public void run(double[] x, double[] y, boolean[] fixed,
                    int[] edgeSource, int[] edgeTarget, double[] edgeIntensity,
                    int maxIterations, double initialTemperature) {
        int n = x.length;
        double[] dispX = new double[n];
        double[] dispY = new double[n];
        List<RepulsionRowTask> tasks = createRepulsionTasks(x, y, fixed, dispX, dispY);

        for (int iter = 0; iter < maxIterations; iter++) {
            double temperature = coolingSchedule.temperatureAt(iter, maxIterations, initialTemperature);

            Arrays.fill(dispX, 0.0);
            Arrays.fill(dispY, 0.0);

            applyRepulsiveForces(tasks);
            applyAttractiveForces(x, y, fixed, edgeSource, edgeTarget, edgeIntensity, dispX, dispY);
            updatePositions(x, y, fixed, dispX, dispY, temperature);
        }
    }

    // --- PASOS DEL ALGORITMO ---

    private List<RepulsionRowTask> createRepulsionTasks(double[] x, double[] y, boolean[] fixed,
                                                       double[] dispX, double[] dispY) {
        int n = x.length;
        int chunks = (threadPool == null) ? 1 : Math.max(1, Math.min(parallelism, n));
        int rowsPerChunk = (n + chunks - 1) / Math.max(chunks, 1);

        List<RepulsionRowTask> tasks = new ArrayList<>(chunks);
        for (int from = 0; from < n; from += rowsPerChunk) {
            int to = Math.min(n, from + rowsPerChunk);
            tasks.add(new RepulsionRowTask(x, y, fixed, forceModel, from, to, dispX, dispY));
        }
        return tasks;
    }

    private void applyRepulsiveForces(List<RepulsionRowTask> tasks) {
        if (threadPool == null || tasks.size() <= 1) {
            for (RepulsionRowTask task : tasks) {
                task.call();
            }
            return;
        }

        List<Future<RepulsionRowTask>> futures;
        try {
            futures = threadPool.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Cálculo de repulsión interrumpido.", e);
        }

        for (Future<RepulsionRowTask> future : futures) {
            try {
                future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Cálculo de repulsión interrumpido.", e);
            } catch (ExecutionException e) {
                throw new IllegalStateException("Error en el cálculo de repulsión.", e.getCause());
            }
        }
    }

    private void applyAttractiveForces(double[] x, double[] y, boolean[] fixed,
                                       int[] edgeSource, int[] edgeTarget, double[] edgeIntensity,
                                       double[] dispX, double[] dispY) {
        double minDistance = forceModel.getMinDistance();

        for (int e = 0; e < edgeSource.length; e++) {
            int u = edgeSource[e];
            int v = edgeTarget[e];

            double dx = x[u] - x[v];
            double dy = y[u] - y[v];
            double dist = Math.sqrt(dx * dx + dy * dy);
            if (dist < minDistance) continue;

            double force = forceModel.attraction(dist, edgeIntensity[e]);
            double fx = (dx / dist) * force;
            double fy = (dy / dist) * force;

            // u se acerca a v y viceversa
            if (!fixed[u]) {
                dispX[u] -= fx;
                dispY[u] -= fy;
            }
            if (!fixed[v]) {
                dispX[v] += fx;
                dispY[v] += fy;
            }
        }
    }

    private void updatePositions(double[] x, double[] y, boolean[] fixed,
                                 double[] dispX, double[] dispY, double temperature) {
        if (!(temperature > 0)) return;

        for (int i = 0; i < x.length; i++) {
            if (fixed[i]) continue;

            double dx = dispX[i];
            double dy = dispY[i];
            double magnitude = Math.sqrt(dx * dx + dy * dy);
            if (!(magnitude > 0)) continue;

            double scale = Math.min(magnitude, temperature) / magnitude;
            x[i] = clamp(x[i] + dx * scale, -halfWidth, halfWidth);
            y[i] = clamp(y[i] + dy * scale, -halfHeight, halfHeight);
        }
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    @Override
    public void close() {
        if (threadPool != null && !threadPool.isShutdown()) {
            threadPool.shutdown();
        }
    }
}
