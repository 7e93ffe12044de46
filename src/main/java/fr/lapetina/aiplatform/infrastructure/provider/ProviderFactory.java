package fr.lapetina.aiplatform.infrastructure.provider;

import fr.lapetina.aiplatform.domain.exception.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of third-party provider clients keyed by vendor name.
 *
 * Clients are built on first use and reused for identical settings. A
 * client built with an older secret for the same key is closed and
 * replaced on the next lookup.
 */
public final class ProviderFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProviderFactory.class);

    /**
     * Builds a client for one vendor.
     */
    @FunctionalInterface
    public interface Creator {
        Provider create(ProviderSettings settings);
    }

    private final Map<String, Creator> creators = new ConcurrentHashMap<>();
    private final Map<String, CachedClient> clients = new ConcurrentHashMap<>();

    /**
     * A factory with the built-in vendors registered.
     */
    public static ProviderFactory withDefaults() {
        ProviderFactory factory = new ProviderFactory();
        factory.register(OpenAiProvider.VENDOR, OpenAiProvider::new);
        return factory;
    }

    public void register(String vendor, Creator creator) {
        creators.put(normalize(vendor), creator);
        log.info("Provider vendor registered: vendor={}", vendor);
    }

    public boolean supports(String vendor) {
        return vendor != null && creators.containsKey(normalize(vendor));
    }

    /**
     * Returns the client for these settings, creating it if needed.
     *
     * @throws ProviderException when no client is registered for the vendor
     */
    public Provider getOrCreate(ProviderSettings settings) {
        Creator creator = creators.get(normalize(settings.vendor()));
        if (creator == null) {
            throw new ProviderException(settings.vendor(), "unknown_vendor",
                    "No provider client registered for vendor: " + settings.vendor(), false);
        }
        String fingerprint = settings.secretFingerprint();
        Provider[] replaced = new Provider[1];
        CachedClient cached = clients.compute(settings.cacheKey(), (key, current) -> {
            if (current != null && current.secretFingerprint().equals(fingerprint)) {
                return current;
            }
            Provider client = creator.create(settings);
            if (current != null) {
                replaced[0] = current.client();
                log.info("Provider client rebuilt after secret change: {}", settings);
            } else {
                log.info("Provider client created: {}", settings);
            }
            return new CachedClient(fingerprint, client);
        });
        if (replaced[0] != null) {
            closeQuietly(replaced[0]);
        }
        return cached.client();
    }

    public Set<String> getRegisteredVendors() {
        return new TreeSet<>(creators.keySet());
    }

    /**
     * Closes and forgets every cached client, e.g. after keys were rotated.
     */
    public void invalidateClients() {
        for (String key : clients.keySet()) {
            CachedClient cached = clients.remove(key);
            if (cached != null) {
                closeQuietly(cached.client());
            }
        }
    }

    @Override
    public void close() {
        invalidateClients();
    }

    private record CachedClient(String secretFingerprint, Provider client) {
    }

    private static void closeQuietly(Provider client) {
        try {
            client.close();
        } catch (RuntimeException e) {
            log.warn("Error closing provider client: name={}, error={}", client.getName(), e.getMessage());
        }
    }

    private static String normalize(String vendor) {
        return vendor.trim().toLowerCase(Locale.ROOT);
    }
}
