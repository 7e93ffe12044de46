package fr.lapetina.aiplatform.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import fr.lapetina.aiplatform.domain.model.ErrorKind;

/**
 * Error envelope returned for every failed call.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(int code, String error, String message, String requestId) {

    public static ErrorResponse of(ErrorKind kind, String message, String requestId) {
        return new ErrorResponse(kind.getCode(), kind.name().toLowerCase(), message, requestId);
    }
}
