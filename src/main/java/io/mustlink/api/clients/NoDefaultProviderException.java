package io.mustlink.api.clients;

/**
 * No provider given and no default provider pinned.
 */
public class NoDefaultProviderException extends MustApiException {

    private static final long serialVersionUID = 1L;

    public NoDefaultProviderException(String message) {
        super(message);
    }
}
