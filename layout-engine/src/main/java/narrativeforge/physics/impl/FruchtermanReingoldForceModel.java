package narrativeforge.physics.impl;

import lombok.Getter;
import narrativeforge.physics.i.IForceModel;

/**
 * Modelo de fuerzas de Fruchterman-Reingold ponderado por intensidad.
 * <p>
 * Repulsión {@code f_r(d) = k² / d}, atracción {@code f_a(d) = (d² / k) · (w / w0)},
 * donde {@code w0} es la intensidad base que deja la atracción sin escalar.
 * Con intensidad base, el equilibrio de dos nodos unidos está en {@code d = k}.
 */
@Getter
public class FruchtermanReingoldForceModel implements IForceModel {

    private final double idealSpacing;
    private final double baselineIntensity;
    private final double minDistance;

    public FruchtermanReingoldForceModel(double idealSpacing, double baselineIntensity, double minDistance) {
        if (!(idealSpacing > 0) || !(baselineIntensity > 0) || !(minDistance > 0)) {
            throw new IllegalArgumentException(String.format(
                    "Parámetros de fuerza inválidos: k=%f, baseline=%f, minDistance=%f",
                    idealSpacing, baselineIntensity, minDistance));
        }
        this.idealSpacing = idealSpacing;
        this.baselineIntensity = baselineIntensity;
        this.minDistance = minDistance;
    }

    /**
     * k = sqrt(área / N). Para un grafo vacío se usa 1.0 (valor seguro, no se usa).
     */
    public static double idealSpacing(double width, double height, int nodeCount) {
        if (nodeCount <= 0) {
            return 1.0;
        }
        return Math.sqrt((width * height) / nodeCount);
    }

    @Override
    public String getName() {
        return "Fruchterman-Reingold";
    }

    @Override
    public String getDescription() {
        return "Repulsión k²/d entre todos los pares, atracción (d²/k)·(w/w0) por arista";
    }

    @Override
    public double repulsion(double distance) {
        return (idealSpacing * idealSpacing) / Math.max(distance, minDistance);
    }

    @Override
    public double attraction(double distance, double intensity) {
        // Sin dirección definida: los nodos coincidentes no se atraen
        if (distance < minDistance) return 0.0;
        return ((distance * distance) / idealSpacing) * (intensity / baselineIntensity);
    }
}
