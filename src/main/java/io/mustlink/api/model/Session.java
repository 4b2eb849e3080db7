package io.mustlink.api.model;

import java.util.Collections;
import java.util.Map;

/**
 * An authenticated WebMUST session: the bearer token and the identity it belongs to.
 */
public class Session {

    private final String token;
    private final Map<String, Object> user;

    public Session(String token, Map<String, Object> user) {
        this.token = token;
        this.user = user != null ? Collections.unmodifiableMap(user) : Collections.emptyMap();
    }

    public String getToken() {
        return token;
    }

    public Map<String, Object> getUser() {
        return user;
    }

    public String getLogin() {
        Object login = user.get("login");
        return login != null ? login.toString() : null;
    }
}
