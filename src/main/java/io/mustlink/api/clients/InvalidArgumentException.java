package io.mustlink.api.clients;

/**
 * Bad flag, mode or window passed by the caller.
 */
public class InvalidArgumentException extends MustApiException {

    private static final long serialVersionUID = 1L;

    public InvalidArgumentException(String message) {
        super(message);
    }
}
