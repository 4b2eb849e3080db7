package io.mustlink.api.clients;

import java.net.InetSocketAddress;
import java.net.URI;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClientBuilder;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.http.io.SocketConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Base MUSTlink API client that owns the transport, the session token and common HTTP operations.
 * Specialized clients for the different API areas are built on top of this.
 * <p>
 * Not thread safe: one instance serves one logical caller.
 */
public class MustApiBase {

    private static final Logger logger = LoggerFactory.getLogger(MustApiBase.class);
    private static final Logger requestLogger = LoggerFactory.getLogger("MustRequestLogger");

    public static final String DEFAULT_URL = "https://bepicolombo.esac.esa.int/webclient-must/mustlink";
    public static final String AUTHORIZATION_HEADER = "Authorization";

    private static final TypeReference<List<Map<String, Object>>> LIST_OF_MAPS = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, Object>> MAP = new TypeReference<>() {
    };

    private final String baseUrl;
    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    private final Map<String, AtomicInteger> endpointCounts = new ConcurrentHashMap<>();
    private final DateTimeFormatter timeFormat = DateTimeFormatter.ofPattern("HH:mm:ss.SSS");
    private String token;
    private int totalRequests = 0;
    private int debugLevel = 0;

    public MustApiBase(String baseUrl) {
        this(baseUrl, (String) null, 0);
    }

    /**
     * @param socksProxy optional {@code host:port} of a SOCKS5 proxy all requests are sent through
     */
    public MustApiBase(String baseUrl, String socksProxy, int debugLevel) {
        this(baseUrl, RestClient.builder().requestFactory(createRequestFactory(socksProxy)), debugLevel);
        if (socksProxy != null) {
            logger.info("Routing MUSTlink requests through SOCKS5 proxy {}", socksProxy);
        }
    }

    /**
     * Build on a caller supplied {@link RestClient.Builder}, e.g. one bound to a mock server.
     */
    public MustApiBase(String baseUrl, RestClient.Builder restClientBuilder, int debugLevel) {
        this.baseUrl = stripTrailingSlash(baseUrl != null ? baseUrl : DEFAULT_URL);
        this.restClient = restClientBuilder.build();
        this.objectMapper = new ObjectMapper();
        this.debugLevel = debugLevel;

        logger.debug("MUSTlink base client initialized for {} with debug level {}", this.baseUrl, debugLevel);
    }

    private static HttpComponentsClientHttpRequestFactory createRequestFactory(String socksProxy) {
        HttpClientBuilder builder = HttpClients.custom();
        if (socksProxy != null && !socksProxy.trim().isEmpty()) {
            SocketConfig socketConfig = SocketConfig.custom()
                    .setSocksProxyAddress(parseProxyAddress(socksProxy))
                    .build();
            builder.setConnectionManager(PoolingHttpClientConnectionManagerBuilder.create()
                    .setDefaultSocketConfig(socketConfig)
                    .build());
        }
        CloseableHttpClient httpClient = builder.build();
        return new HttpComponentsClientHttpRequestFactory(httpClient);
    }

    static InetSocketAddress parseProxyAddress(String socksProxy) {
        String value = socksProxy.trim();
        int colon = value.lastIndexOf(':');
        if (colon <= 0 || colon == value.length() - 1) {
            throw new InvalidArgumentException("proxy must be given as hostname:port, got " + socksProxy);
        }
        try {
            int port = Integer.parseInt(value.substring(colon + 1));
            return InetSocketAddress.createUnresolved(value.substring(0, colon), port);
        } catch (IllegalArgumentException e) {
            throw new InvalidArgumentException("proxy must be given as hostname:port, got " + socksProxy);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    // Session token

    public String getToken() {
        return token;
    }

    void setToken(String token) {
        this.token = token;
    }

    void clearToken() {
        this.token = null;
    }

    public boolean hasToken() {
        return token != null && !token.isEmpty();
    }

    private void requireToken(String path) {
        if (!hasToken()) {
            throw new AuthenticationException("Not authenticated: a valid session is required for " + path);
        }
    }

    // Requests

    /**
     * Issue a GET against {@code path} (relative to the base URL).
     * Authorized requests carry the session token and fail fast without one.
     */
    protected String get(String path, Map<String, ?> params, boolean authorized) {
        return exchange(HttpMethod.GET, path, params, null, authorized);
    }

    protected String get(String path, Map<String, ?> params) {
        return get(path, params, true);
    }

    protected String post(String path, Object body, boolean authorized) {
        String requestBody;
        try {
            requestBody = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new InvalidArgumentException("Request body is not serializable: " + e.getMessage());
        }
        return exchange(HttpMethod.POST, path, Collections.emptyMap(), requestBody, authorized);
    }

    private String exchange(HttpMethod method, String path, Map<String, ?> params, String requestBody,
            boolean authorized) {
        if (authorized) {
            requireToken(path);
        }
        URI uri = buildUri(path, params);
        logRequest(method, path, uri);

        try {
            long startTime = System.currentTimeMillis();
            RestClient.RequestBodySpec request = restClient.method(method)
                    .uri(uri)
                    .accept(MediaType.APPLICATION_JSON);
            if (authorized) {
                request = request.header(AUTHORIZATION_HEADER, token);
            }
            String response;
            if (requestBody != null) {
                response = request.contentType(MediaType.APPLICATION_JSON)
                        .body(requestBody)
                        .retrieve()
                        .body(String.class);
            } else {
                response = request.retrieve().body(String.class);
            }
            long endTime = System.currentTimeMillis();

            if (debugLevel >= 2) {
                requestLogger.debug("Response time: {} ms for {} {}", (endTime - startTime), method, path);
            }
            return response;
        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            requestLogger.error("Request failed: {} {} - HTTP {}", method, path, status);
            if (status == 401 || status == 403) {
                throw new AuthenticationException(
                        "Authorization rejected (HTTP " + status + ") for " + path, e);
            }
            throw new TransportException("HTTP " + status + " for " + method + " " + path, e);
        } catch (RestClientException e) {
            requestLogger.error("Request failed: {} {} - {}", method, path, e.getMessage());
            throw new TransportException("Request failed for " + method + " " + path + ": " + e.getMessage(), e);
        }
    }

    URI buildUri(String path, Map<String, ?> params) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(baseUrl + path);
        if (params != null) {
            params.forEach((key, value) -> {
                if (value != null) {
                    builder.queryParam(key, value);
                }
            });
        }
        return builder.build().encode().toUri();
    }

    // Parsing

    /**
     * Generic method to parse API responses
     */
    protected <T> T parseResponse(String responseBody, Class<T> responseType) {
        try {
            return objectMapper.readValue(requireBody(responseBody), responseType);
        } catch (JsonProcessingException e) {
            logger.error("Failed to parse JSON response: {}", e.getMessage());
            throw new TransportException("Failed to parse JSON response", e);
        }
    }

    /**
     * Parse a JSON array of objects. A single object is returned as a one-element list.
     */
    protected List<Map<String, Object>> parseList(String responseBody) {
        try {
            String body = requireBody(responseBody).trim();
            if (body.startsWith("{")) {
                Map<String, Object> single = objectMapper.readValue(body, MAP);
                return single.isEmpty() ? List.of() : List.of(single);
            }
            return objectMapper.readValue(body, LIST_OF_MAPS);
        } catch (JsonProcessingException e) {
            logger.error("Failed to parse JSON list response: {}", e.getMessage());
            throw new TransportException("Failed to parse JSON list response", e);
        }
    }

    protected Map<String, Object> parseMap(String responseBody) {
        try {
            return objectMapper.readValue(requireBody(responseBody), MAP);
        } catch (JsonProcessingException e) {
            logger.error("Failed to parse JSON object response: {}", e.getMessage());
            throw new TransportException("Failed to parse JSON object response", e);
        }
    }

    private String requireBody(String responseBody) {
        if (responseBody == null || responseBody.isBlank()) {
            throw new TransportException("Empty response body");
        }
        return responseBody;
    }

    // Logging and statistics

    private synchronized void logRequest(HttpMethod method, String path, URI uri) {
        AtomicInteger count = endpointCounts.computeIfAbsent(path, k -> new AtomicInteger(0));
        int requestNum = count.incrementAndGet();
        totalRequests++;

        if (debugLevel >= 1) {
            String time = LocalDateTime.now().format(timeFormat);
            requestLogger.debug("[{}] Request #{}: {} {}", time, requestNum, method, path);
        }
        if (debugLevel >= 2) {
            requestLogger.debug("Full URL: {}", uri);
        }
    }

    public void setDebugLevel(int level) {
        this.debugLevel = Math.max(0, Math.min(3, level));
        logger.info("Debug level set to {}", this.debugLevel);
    }

    public int getDebugLevel() {
        return debugLevel;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public int getRequestCount(String path) {
        AtomicInteger count = endpointCounts.get(path);
        return count != null ? count.get() : 0;
    }

    public Map<String, Object> getApiStats() {
        Map<String, Object> stats = new HashMap<>();
        stats.put("totalRequests", totalRequests);

        Map<String, Integer> endpointStats = new HashMap<>();
        endpointCounts.forEach((endpoint, count) -> endpointStats.put(endpoint, count.get()));
        stats.put("endpointStats", endpointStats);

        return stats;
    }
}
