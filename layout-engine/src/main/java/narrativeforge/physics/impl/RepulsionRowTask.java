package narrativeforge.physics.impl;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import narrativeforge.physics.i.IForceModel;

import java.util.concurrent.Callable;

/**
 * Tarea que calcula la repulsión neta de un rango de filas {@code [fromRow, toRow)}.
 * <p>
 * Cada fila (nodo) la suma una única tarea, recorriendo los vecinos en orden
 * ascendente. Así el resultado es bit a bit idéntico se ejecute en un hilo o en
 * varios. Escribe en rangos disjuntos de {@code dispX}/{@code dispY}.
 */
@Getter
@RequiredArgsConstructor
public class RepulsionRowTask implements Callable<RepulsionRowTask> {

    // Ángulo áureo en radianes: reparte las direcciones de pares coincidentes
    private static final double GOLDEN_ANGLE = Math.PI * (3.0 - Math.sqrt(5.0));
    private static final double TWO_PI = 2.0 * Math.PI;

    // --- Entradas para la tarea ---
    private final double[] x;
    private final double[] y;
    private final boolean[] fixed;
    private final IForceModel forceModel;
    private final int fromRow;
    private final int toRow;

    // --- Salida compartida (solo se escribe [fromRow, toRow)) ---
    private final double[] dispX;
    private final double[] dispY;

    @Override
    public RepulsionRowTask call() {
        int n = x.length;
        double minDistance = forceModel.getMinDistance();

        for (int i = fromRow; i < toRow; i++) {
            // La fuerza sobre un nodo fijado se descarta, no hace falta calcularla
            if (fixed[i]) continue;

            double sumX = 0.0;
            double sumY = 0.0;
            for (int j = 0; j < n; j++) {
                if (j == i) continue;

                double dx = x[i] - x[j];
                double dy = y[i] - y[j];
                double dist = Math.sqrt(dx * dx + dy * dy);

                double ux;
                double uy;
                if (dist < minDistance) {
                    // Puntos coincidentes: dirección determinista y antisimétrica por par
                    double angle = coincidentAngle(i, j);
                    double sign = (i < j) ? 1.0 : -1.0;
                    ux = sign * StrictMath.cos(angle);
                    uy = sign * StrictMath.sin(angle);
                } else {
                    ux = dx / dist;
                    uy = dy / dist;
                }

                double force = forceModel.repulsion(dist);
                sumX += ux * force;
                sumY += uy * force;
            }
            dispX[i] = sumX;
            dispY[i] = sumY;
        }
        return this;
    }

    /**
     * Ángulo asociado al par no ordenado {i, j}. Pares distintos reciben ángulos distintos.
     */
    static double coincidentAngle(int i, int j) {
        long lo = Math.min(i, j);
        long hi = Math.max(i, j);
        long pairRank = hi * (hi - 1) / 2 + lo + 1;
        return (pairRank * GOLDEN_ANGLE) % TWO_PI;
    }
}
