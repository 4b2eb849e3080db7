package io.mustlink.api.clients;

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.mustlink.api.model.Credentials;
import io.mustlink.api.model.Session;

/**
 * Client for the MUSTlink authentication endpoints.
 * Owns the session lifecycle; the token it obtains is attached to every authorized request.
 * There is no automatic renewal: an expired token surfaces as {@link AuthenticationException}
 * and re-authenticating is left to the caller.
 */
public class MustSessionClient {

    private static final Logger logger = LoggerFactory.getLogger(MustSessionClient.class);

    static final String LOGIN_PATH = "/auth/login";
    static final String USER_INFO_PATH = "/usermanagement/userinfo";

    private final MustApiBase apiBase;
    private Session session;

    public MustSessionClient(MustApiBase apiBase) {
        this.apiBase = apiBase;
    }

    /**
     * Log in with the given credentials and load the identity of the logged-in user.
     * On any failure the client is left unauthenticated.
     */
    public Session authenticate(Credentials credentials) {
        apiBase.clearToken();
        session = null;

        if (credentials == null || isBlank(credentials.getLogin()) || isBlank(credentials.getPassword())) {
            throw new AuthenticationException("Login and password are required");
        }

        Map<String, Object> login = new LinkedHashMap<>();
        login.put("username", credentials.getLogin());
        login.put("password", credentials.getPassword());
        login.put("maxDuration", "false");

        try {
            String responseBody = apiBase.post(LOGIN_PATH, login, false);
            Object token = apiBase.parseMap(responseBody).get("token");
            if (token == null || token.toString().isEmpty()) {
                throw new AuthenticationException("Login response for " + credentials.getLogin() + " carried no token");
            }
            apiBase.setToken(token.toString());
            logger.debug("Token retrieved for {}", credentials.getLogin());

            Map<String, Object> user = currentUser();
            session = new Session(token.toString(), user);
            return session;
        } catch (AuthenticationException e) {
            apiBase.clearToken();
            logger.error("Error logging in as {}: {}", credentials.getLogin(), e.getMessage());
            throw e;
        } catch (MustApiException e) {
            apiBase.clearToken();
            logger.error("Error with authorisation for {}: {}", credentials.getLogin(), e.getMessage());
            throw new AuthenticationException("Unable to authenticate " + credentials.getLogin()
                    + ": " + e.getMessage(), e);
        }
    }

    /**
     * Retrieve information on the currently logged-in user.
     */
    public Map<String, Object> currentUser() {
        String responseBody = apiBase.get(USER_INFO_PATH, Map.of());
        Map<String, Object> user = apiBase.parseMap(responseBody);
        logger.info("User {} currently logged in", user.get("login"));
        return user;
    }

    public Session getSession() {
        return session;
    }

    public boolean isAuthenticated() {
        return apiBase.hasToken();
    }

    /** Forget the token locally; the service is not contacted. */
    public void logout() {
        apiBase.clearToken();
        session = null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
