package io.mustlink.api.clients;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client for the MUSTlink data provider listing.
 * <p>
 * Resolves the effective provider of every provider-scoped call: an explicit name is checked
 * against the registry, a missing one falls back to the pinned default.
 */
public class MustProvidersClient {

    private static final Logger logger = LoggerFactory.getLogger(MustProvidersClient.class);

    static final String PROVIDERS_PATH = "/dataproviders";

    /** Automation account whose providers are internal to the service. */
    public static final String SCRIPTING_ENGINE_USER = "SCRIPTING ENGINE";

    private final MustApiBase apiBase;
    private final Set<String> excludedUsers;
    private Set<String> providers;
    private String defaultProvider;

    public MustProvidersClient(MustApiBase apiBase) {
        this(apiBase, Set.of(SCRIPTING_ENGINE_USER));
    }

    public MustProvidersClient(MustApiBase apiBase, Set<String> excludedUsers) {
        this.apiBase = apiBase;
        this.excludedUsers = Set.copyOf(excludedUsers);
    }

    /**
     * Get the names of all published providers, fetching them on first use.
     * Providers without an owning user or owned by an excluded automation account are left out.
     */
    public Set<String> listProviders() {
        if (providers == null) {
            providers = fetchProviders();
        }
        return providers;
    }

    /**
     * Re-read the provider list from the service. A pinned default that is no longer listed is dropped.
     */
    public Set<String> refreshProviders() {
        providers = fetchProviders();
        if (defaultProvider != null && !providers.contains(defaultProvider)) {
            logger.warn("Default provider {} is no longer listed, clearing it", defaultProvider);
            defaultProvider = null;
        }
        return providers;
    }

    private Set<String> fetchProviders() {
        String responseBody = apiBase.get(PROVIDERS_PATH, Map.of());
        List<Map<String, Object>> entries = apiBase.parseList(responseBody);

        Set<String> names = new LinkedHashSet<>();
        for (Map<String, Object> entry : entries) {
            Object user = entry.get("user");
            Object name = entry.get("name");
            if (name == null || user == null || excludedUsers.contains(user.toString())) {
                continue;
            }
            names.add(name.toString());
        }
        logger.info("{} providers found", names.size());
        return Collections.unmodifiableSet(names);
    }

    public boolean isProvider(String name) {
        return name != null && listProviders().contains(name);
    }

    /**
     * Pin a default provider used whenever a call omits one.
     */
    public void setDefault(String name) {
        if (!isProvider(name)) {
            logger.error("Provider {} is not a registered data provider", name);
            throw new UnknownProviderException("Provider " + name + " is not a registered data provider");
        }
        defaultProvider = name;
        logger.info("Default provider set to {}", name);
    }

    public String getDefault() {
        return defaultProvider;
    }

    public void clearDefault() {
        defaultProvider = null;
    }

    /**
     * Resolve the provider for a call.
     *
     * @param explicit provider named by the caller, or {@code null} to use the default
     * @throws UnknownProviderException if {@code explicit} is not a registered provider
     * @throws NoDefaultProviderException if {@code explicit} is {@code null} and no default is pinned
     */
    public String resolve(String explicit) {
        if (explicit == null) {
            if (defaultProvider == null) {
                logger.error("A provider must be specified");
                throw new NoDefaultProviderException("A provider must be specified or a default set");
            }
            return defaultProvider;
        }
        if (!isProvider(explicit)) {
            logger.error("Provider {} is not a registered data provider", explicit);
            throw new UnknownProviderException("Provider " + explicit + " is not a registered data provider");
        }
        return explicit;
    }
}
