package fr.lapetina.aiplatform.domain.model;

/**
 * Classification of failures surfaced by the control plane.
 *
 * Each kind carries the HTTP status and the numeric envelope code
 * used by the gateway when the failure reaches a client.
 */
public enum ErrorKind {
    VALIDATION(1001, 400),
    UNAUTHORIZED(1002, 401),
    RATE_LIMITED(1003, 429),
    BUDGET_EXCEEDED(1004, 429),
    NOT_FOUND(1005, 404),
    CONFLICT(1006, 409),
    PROVIDER_ERROR(5002, 500),
    UNAVAILABLE(5003, 503),
    INTERNAL(5001, 500);

    private final int code;
    private final int httpStatus;

    ErrorKind(int code, int httpStatus) {
        this.code = code;
        this.httpStatus = httpStatus;
    }

    public int getCode() {
        return code;
    }

    public int getHttpStatus() {
        return httpStatus;
    }
}
