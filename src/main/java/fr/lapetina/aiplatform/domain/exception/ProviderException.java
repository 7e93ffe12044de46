package fr.lapetina.aiplatform.domain.exception;

import fr.lapetina.aiplatform.domain.model.ErrorKind;

/**
 * A provider call failed.
 */
public class ProviderException extends ControlPlaneException {

    private final String providerId;
    private final String errorCode;
    private final boolean retryable;

    public ProviderException(String providerId, String errorCode, String message, boolean retryable) {
        super(ErrorKind.PROVIDER_ERROR, message);
        this.providerId = providerId;
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public ProviderException(String providerId, String errorCode, String message, boolean retryable, Throwable cause) {
        super(ErrorKind.PROVIDER_ERROR, message, cause);
        this.providerId = providerId;
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public String getProviderId() {
        return providerId;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
