package narrativeforge.domain.exception;

import lombok.Getter;
import narrativeforge.domain.graph.LayoutStatus;

/**
 * Fallo de una operación de layout del lado Java.
 * <p>
 * Transporta el {@link LayoutStatus} equivalente para que la frontera por handles
 * pueda traducirlo a código sin perder información.
 */
@Getter
public class LayoutException extends RuntimeException {

    private final LayoutStatus status;

    public LayoutException(LayoutStatus status) {
        this(status, status.getMessage());
    }

    public LayoutException(LayoutStatus status, String message) {
        super(message);
        this.status = status;
    }

    public LayoutException(LayoutStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }
}
