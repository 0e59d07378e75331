package narrativeforge.domain.graph;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Códigos de estado de la frontera create/compute/destroy.
 * <p>
 * Ningún error cruza la frontera como excepción: todo fallo se comunica con uno
 * de estos códigos. {@code 0} es éxito, los fallos son negativos.
 */
@Getter
@RequiredArgsConstructor
public enum LayoutStatus {

    OK(0, "Layout calculado correctamente."),

    /**
     * Ancho o alto no positivos (o no finitos).
     */
    INVALID_DIMENSIONS(-1, "Las dimensiones del área de simulación deben ser mayores que cero."),

    /**
     * Handle nulo, desconocido o ya destruido.
     */
    INVALID_HANDLE(-2, "La sesión de layout no existe o ya fue destruida."),

    /**
     * El buffer de salida no tiene capacidad para un registro por nodo.
     */
    INSUFFICIENT_BUFFER(-3, "El buffer de salida es demasiado pequeño para el número de nodos."),

    /**
     * Falló la copia de la entrada al almacenamiento propio de la sesión.
     */
    ALLOCATION_FAILURE(-4, "No se pudo reservar memoria para la sesión de layout.");

    private final int code;
    private final String message;

    public boolean isSuccess() {
        return this == OK;
    }

    public static LayoutStatus fromCode(int code) {
        for (LayoutStatus status : values()) {
            if (status.code == code) {
                return status;
            }
        }
        throw new IllegalArgumentException("Código de estado desconocido: " + code);
    }
}
