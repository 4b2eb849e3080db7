package io.mustlink.api.clients;

/**
 * Credentials rejected, credential source unusable, or an authorized call made without a valid token.
 */
public class AuthenticationException extends MustApiException {

    private static final long serialVersionUID = 1L;

    public AuthenticationException(String message) {
        super(message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
