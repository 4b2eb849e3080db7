package io.mustlink.api.clients;

/**
 * Well-formed request that matched nothing. Recoverable: the caller decides what to do next.
 */
public class EmptyResultException extends MustApiException {

    private static final long serialVersionUID = 1L;

    public EmptyResultException(String message) {
        super(message);
    }
}
