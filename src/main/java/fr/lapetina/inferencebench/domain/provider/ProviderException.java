package fr.lapetina.inferencebench.domain.provider;

import fr.lapetina.inferencebench.domain.model.ErrorType;

import java.util.Objects;

/**
 * Exception thrown by chat providers.
 *
 * Carries the error classification and, when the host answered, its HTTP status
 * and the body it returned.
 */
public class ProviderException extends RuntimeException {

    /** Status code value when no HTTP response was received. */
    public static final int NO_STATUS = -1;

    private final ErrorType errorType;
    private final int statusCode;
    private final String responseBody;

    public ProviderException(ErrorType errorType, String message) {
        this(errorType, message, NO_STATUS, null, null);
    }

    public ProviderException(ErrorType errorType, String message, Throwable cause) {
        this(errorType, message, NO_STATUS, null, cause);
    }

    public ProviderException(ErrorType errorType, String message, int statusCode, String responseBody, Throwable cause) {
        super(message, cause);
        this.errorType = Objects.requireNonNull(errorType, "Error type is required");
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    /**
     * Creates a protocol error for a non-success HTTP answer.
     */
    public static ProviderException badStatus(String operation, int statusCode, String body) {
        String detail = body == null ? "" : body.trim();
        return new ProviderException(
                ErrorType.PROTOCOL_ERROR,
                operation + " returned HTTP " + statusCode + (detail.isEmpty() ? "" : ": " + detail),
                statusCode, body, null);
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean hasStatusCode() {
        return statusCode != NO_STATUS;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
