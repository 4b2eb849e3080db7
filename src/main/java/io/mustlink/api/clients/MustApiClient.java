package io.mustlink.api.clients;

import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.mustlink.api.config.CredentialsLoader;
import io.mustlink.api.config.MustClientConfig;
import io.mustlink.api.model.Credentials;

/**
 * Main entry point for MUSTlink API operations.
 * Provides access to specialized clients for the different API areas, all sharing one session.
 */
public class MustApiClient {

    private static final Logger logger = LoggerFactory.getLogger(MustApiClient.class);

    private final MustApiBase apiBase;
    private final MustSessionClient session;
    private final MustProvidersClient providers;
    private final MustTablesClient tables;
    private final MustParametersClient parameters;
    private final MustTimeSeriesClient timeSeries;
    private final MustTimelineClient timelines;

    public MustApiClient(String baseUrl) {
        this(new MustApiBase(baseUrl));
    }

    public MustApiClient(MustApiBase apiBase) {
        this(apiBase, Set.of(MustProvidersClient.SCRIPTING_ENGINE_USER));
    }

    public MustApiClient(MustApiBase apiBase, Set<String> excludedProviderUsers) {
        this.apiBase = apiBase;
        this.session = new MustSessionClient(apiBase);
        this.providers = new MustProvidersClient(apiBase, excludedProviderUsers);
        this.tables = new MustTablesClient(apiBase, providers);
        this.parameters = new MustParametersClient(apiBase, providers);
        this.timeSeries = new MustTimeSeriesClient(apiBase, providers, parameters);
        this.timelines = new MustTimelineClient(timeSeries);
    }

    /**
     * Build a client from configuration, log in with the configured credentials file,
     * load the provider list and pin the configured default provider.
     *
     * @throws AuthenticationException if the credentials are missing or rejected
     */
    public static MustApiClient connect(MustClientConfig config) {
        MustApiBase apiBase = new MustApiBase(config.getUrl(), config.getProxy(), config.getDebugLevel());
        MustApiClient client = new MustApiClient(apiBase, config.getExcludedProviderUsers());

        Credentials credentials = new CredentialsLoader().load(config.getCredentialsFile());
        client.session().authenticate(credentials);

        Set<String> known = client.providers().listProviders();
        logger.debug("{} data providers available", known.size());
        if (config.getDefaultProvider() != null) {
            client.providers().setDefault(config.getDefaultProvider());
        }
        return client;
    }

    public MustSessionClient session() {
        return session;
    }

    public MustProvidersClient providers() {
        return providers;
    }

    public MustTablesClient tables() {
        return tables;
    }

    public MustParametersClient parameters() {
        return parameters;
    }

    public MustTimeSeriesClient timeSeries() {
        return timeSeries;
    }

    public MustTimelineClient timelines() {
        return timelines;
    }

    /**
     * Access base functionality (request stats, debug level, token)
     */
    public MustApiBase base() {
        return apiBase;
    }

    public void setDebugLevel(int level) {
        apiBase.setDebugLevel(level);
    }

    public Map<String, Object> getApiStats() {
        return apiBase.getApiStats();
    }
}
