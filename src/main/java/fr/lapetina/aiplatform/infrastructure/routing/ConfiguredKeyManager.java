package fr.lapetina.aiplatform.infrastructure.routing;

import fr.lapetina.aiplatform.domain.exception.ControlPlaneException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Key manager backed by the configuration file.
 *
 * Keys are declared with the name of the environment variable holding their
 * secret; plaintext never appears in configuration. Among the keys covering
 * a vendor and service, enabled and unexpired keys are ranked by tier, then
 * by creation time.
 */
public final class ConfiguredKeyManager implements KeyManager {

    private static final Logger log = LoggerFactory.getLogger(ConfiguredKeyManager.class);

    private static final Comparator<ApiKey> PRECEDENCE = Comparator
            .comparing(ApiKey::tier)
            .thenComparing(ApiKey::createdAt);

    /**
     * A key and the environment variable its secret is read from.
     */
    public record ConfiguredKey(ApiKey key, String secretEnv) {
        public ConfiguredKey {
            Objects.requireNonNull(key, "Key is required");
        }
    }

    private final Function<String, String> secretLookup;
    private final Clock clock;
    private final Map<String, KeyUsageStats> usage = new ConcurrentHashMap<>();

    private volatile Map<String, ConfiguredKey> keys;

    public ConfiguredKeyManager(Collection<ConfiguredKey> keys, Function<String, String> secretLookup, Clock clock) {
        this.secretLookup = secretLookup;
        this.clock = clock;
        this.keys = index(keys);
    }

    /**
     * Reads secrets from the process environment.
     */
    public ConfiguredKeyManager(Collection<ConfiguredKey> keys) {
        this(keys, System::getenv, Clock.systemUTC());
    }

    @Override
    public Optional<ApiKey> getActiveKey(String vendor, String service) {
        return keys.values().stream()
                .map(ConfiguredKey::key)
                .filter(ApiKey::enabled)
                .filter(k -> !k.isExpired(clock.instant()))
                .filter(k -> k.covers(vendor, service))
                .min(PRECEDENCE);
    }

    @Override
    public String getPlaintextKey(ApiKey key) {
        ConfiguredKey configured = keys.get(key.id());
        if (configured == null) {
            throw ControlPlaneException.notFound("API key not found: " + key.id());
        }
        if (configured.secretEnv() == null || configured.secretEnv().isBlank()) {
            throw ControlPlaneException.unavailable("No secret source declared for key: " + key.id());
        }
        String secret = secretLookup.apply(configured.secretEnv());
        if (secret == null || secret.isBlank()) {
            throw ControlPlaneException.unavailable("Secret not set for key " + key.id()
                    + " (variable " + configured.secretEnv() + ")");
        }
        return secret;
    }

    @Override
    public void recordUsage(String keyId, KeyUsage keyUsage) {
        usage.merge(keyId, KeyUsageStats.EMPTY.add(keyUsage), (current, ignored) -> current.add(keyUsage));
        log.debug("Key usage recorded: keyId={}, requestId={}, success={}",
                keyId, keyUsage.requestId(), keyUsage.success());
    }

    public KeyUsageStats getUsage(String keyId) {
        return usage.getOrDefault(keyId, KeyUsageStats.EMPTY);
    }

    public List<ApiKey> listKeys() {
        return keys.values().stream().map(ConfiguredKey::key).toList();
    }

    /**
     * Replaces the key set. Usage counters of removed keys are kept.
     */
    public void replaceKeys(Collection<ConfiguredKey> newKeys) {
        this.keys = index(newKeys);
        log.info("API keys replaced: count={}", keys.size());
    }

    private static Map<String, ConfiguredKey> index(Collection<ConfiguredKey> keys) {
        Map<String, ConfiguredKey> indexed = new LinkedHashMap<>();
        for (ConfiguredKey key : keys) {
            if (indexed.put(key.key().id(), key) != null) {
                throw new IllegalArgumentException("Duplicate API key id: " + key.key().id());
            }
        }
        return indexed;
    }
}
