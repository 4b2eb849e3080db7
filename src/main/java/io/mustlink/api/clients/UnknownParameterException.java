package io.mustlink.api.clients;

/**
 * Parameter lookup returned no match.
 */
public class UnknownParameterException extends MustApiException {

    private static final long serialVersionUID = 1L;

    public UnknownParameterException(String message) {
        super(message);
    }
}
