package fr.lapetina.inferencebench.domain.model;

/**
 * Error taxonomy for backend calls.
 * Provides clear categorization for error handling, reports and metrics.
 */
public enum ErrorType {
    /** Connection refused, reset or otherwise unable to talk to the host */
    TRANSPORT_ERROR,

    /** Host answered with a non-success status or an unparsable body */
    PROTOCOL_ERROR,

    /** Call deadline expired before the exchange finished */
    TIMEOUT,

    /** Caller cancelled the call */
    CANCELLED,

    /** No provider is registered for the host type */
    NO_PROVIDER,

    /** Internal system error */
    INTERNAL_ERROR
}
