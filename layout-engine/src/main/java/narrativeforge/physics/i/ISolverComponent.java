package narrativeforge.physics.i;

/**
 * Contrato base para cualquier componente numérico del motor de layout.
 * Permite tratar fuerzas y esquemas de enfriamiento de forma polimórfica para
 * logging, identificación y depuración.
 */
public interface ISolverComponent {
    /**
     * Nombre corto del algoritmo (ej: "Fruchterman-Reingold", "LinearCooling").
     */
    String getName();

    /**
     * Descripción técnica detallada.
     */
    default String getDescription() {
        return "Sin descripción disponible.";
    }
}
