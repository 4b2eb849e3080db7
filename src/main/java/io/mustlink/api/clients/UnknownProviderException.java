package io.mustlink.api.clients;

/**
 * Provider name not present in the registry's provider set.
 */
public class UnknownProviderException extends MustApiException {

    private static final long serialVersionUID = 1L;

    public UnknownProviderException(String message) {
        super(message);
    }
}
