package fr.lapetina.aiplatform.domain.exception;

import fr.lapetina.aiplatform.domain.model.ErrorKind;

/**
 * Failure raised by a control plane component.
 *
 * The {@link ErrorKind} decides how the failure is propagated: routing
 * absorbs provider failures through fallback, budget and authorization
 * failures surface immediately, and the gateway maps the kind to a status.
 */
public class ControlPlaneException extends RuntimeException {

    private final ErrorKind kind;

    public ControlPlaneException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ControlPlaneException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public static ControlPlaneException notFound(String message) {
        return new ControlPlaneException(ErrorKind.NOT_FOUND, message);
    }

    public static ControlPlaneException unavailable(String message) {
        return new ControlPlaneException(ErrorKind.UNAVAILABLE, message);
    }

    public static ControlPlaneException unavailable(String message, Throwable cause) {
        return new ControlPlaneException(ErrorKind.UNAVAILABLE, message, cause);
    }

    public static ControlPlaneException unauthorized(String message) {
        return new ControlPlaneException(ErrorKind.UNAUTHORIZED, message);
    }

    public static ControlPlaneException validation(String message) {
        return new ControlPlaneException(ErrorKind.VALIDATION, message);
    }

    public static ControlPlaneException conflict(String message) {
        return new ControlPlaneException(ErrorKind.CONFLICT, message);
    }

    public static ControlPlaneException budgetExceeded(String message) {
        return new ControlPlaneException(ErrorKind.BUDGET_EXCEEDED, message);
    }

    public static ControlPlaneException rateLimited(String message) {
        return new ControlPlaneException(ErrorKind.RATE_LIMITED, message);
    }
}
