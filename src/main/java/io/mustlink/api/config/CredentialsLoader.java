package io.mustlink.api.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import io.mustlink.api.clients.AuthenticationException;
import io.mustlink.api.model.Credentials;

/**
 * Reads MUSTlink credentials from a YAML file of the form:
 * <pre>
 * user:
 *   login: jdoe
 *   password: secret
 * </pre>
 */
public class CredentialsLoader {

    private static final Logger logger = LoggerFactory.getLogger(CredentialsLoader.class);

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public Credentials load(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            logger.error("Credentials file {} not found", file);
            throw new AuthenticationException("Credentials file not found: " + file);
        }

        JsonNode root;
        try {
            root = yamlMapper.readTree(file.toFile());
        } catch (IOException e) {
            logger.error("Failed to read credentials file {}: {}", file, e.getMessage());
            throw new AuthenticationException("Unreadable credentials file: " + file, e);
        }

        JsonNode user = root != null ? root.path("user") : null;
        String login = text(user, "login");
        String password = text(user, "password");
        if (login == null || password == null) {
            throw new AuthenticationException("Credentials file " + file + " must define user.login and user.password");
        }
        logger.debug("Credentials for {} loaded from {}", login, file);
        return new Credentials(login, password);
    }

    private static String text(JsonNode node, String field) {
        if (node == null || !node.hasNonNull(field)) {
            return null;
        }
        String value = node.get(field).asText();
        return value.isEmpty() ? null : value;
    }
}
