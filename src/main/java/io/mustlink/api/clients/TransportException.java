package io.mustlink.api.clients;

/**
 * Network or HTTP failure, including non-2xx responses and malformed payloads.
 */
public class TransportException extends MustApiException {

    private static final long serialVersionUID = 1L;

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
