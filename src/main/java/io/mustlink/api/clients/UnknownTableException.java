package io.mustlink.api.clients;

/**
 * Table name not listed for the resolved provider.
 */
public class UnknownTableException extends MustApiException {

    private static final long serialVersionUID = 1L;

    public UnknownTableException(String message) {
        super(message);
    }
}
