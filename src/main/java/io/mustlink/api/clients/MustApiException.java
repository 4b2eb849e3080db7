package io.mustlink.api.clients;

/**
 * Root of all errors raised by the MUSTlink clients.
 * Validation failures are raised before any request is sent, transport and
 * empty-result failures after the exchange completed.
 */
public class MustApiException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public MustApiException(String message) {
        super(message);
    }

    public MustApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
