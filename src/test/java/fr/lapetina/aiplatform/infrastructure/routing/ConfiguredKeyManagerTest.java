package fr.lapetina.aiplatform.infrastructure.routing;

import fr.lapetina.aiplatform.domain.exception.ControlPlaneException;
import fr.lapetina.aiplatform.domain.model.ErrorKind;
import fr.lapetina.aiplatform.infrastructure.routing.ConfiguredKeyManager.ConfiguredKey;
import fr.lapetina.aiplatform.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfiguredKeyManagerTest {

    private MutableClock clock;
    private Map<String, String> secrets;
    private ConfiguredKeyManager manager;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atMinuteBoundary();
        secrets = new HashMap<>();
        secrets.put("OPENAI_MAIN", "sk-main");
        secrets.put("OPENAI_OLD", "sk-old");

        Instant now = clock.instant();
        manager = new ConfiguredKeyManager(List.of(
                configured("openai-backup", "openai", null, ApiKey.Tier.BACKUP, true, now.minusSeconds(7200), null, "OPENAI_OLD"),
                configured("openai-new", "openai", "text_to_image", ApiKey.Tier.PRIMARY, true, now, null, "OPENAI_MAIN"),
                configured("openai-old", "openai", "text_to_image", ApiKey.Tier.PRIMARY, true, now.minusSeconds(3600),
                        now.plus(Duration.ofMinutes(5)), "OPENAI_OLD"),
                configured("openai-off", "openai", null, ApiKey.Tier.PRIMARY, false, now.minusSeconds(9000), null, "OPENAI_MAIN"),
                configured("stability-main", "stability", "text_to_image", ApiKey.Tier.PRIMARY, true, now, null, "STABILITY_KEY")
        ), secrets::get, clock);
    }

    private static ConfiguredKey configured(String id, String vendor, String service, ApiKey.Tier tier,
                                            boolean enabled, Instant createdAt, Instant expiresAt, String env) {
        return new ConfiguredKey(new ApiKey(id, vendor, service, null, tier, enabled, createdAt, expiresAt), env);
    }

    @Test
    @DisplayName("should prefer the oldest key of the best tier")
    void shouldRankByTierThenAge() {
        assertThat(manager.getActiveKey("openai", "text_to_image"))
                .map(ApiKey::id)
                .hasValue("openai-old");
    }

    @Test
    @DisplayName("should skip expired keys")
    void shouldSkipExpired() {
        clock.advance(Duration.ofMinutes(5));

        assertThat(manager.getActiveKey("openai", "text_to_image"))
                .map(ApiKey::id)
                .hasValue("openai-new");
    }

    @Test
    @DisplayName("should use a vendor wide key for other services and never a disabled one")
    void shouldUseVendorWideKey() {
        // openai-off is older and primary but disabled
        assertThat(manager.getActiveKey("openai", "text_generation"))
                .map(ApiKey::id)
                .hasValue("openai-backup");
        assertThat(manager.getActiveKey("anthropic", "text_generation")).isEmpty();
    }

    @Test
    @DisplayName("should resolve the secret from its variable")
    void shouldResolveSecret() {
        ApiKey key = manager.getActiveKey("openai", "text_to_image").orElseThrow();

        assertThat(manager.getPlaintextKey(key)).isEqualTo("sk-old");
    }

    @Test
    @DisplayName("should report a missing secret as unavailable")
    void shouldFailOnMissingSecret() {
        ApiKey key = manager.getActiveKey("stability", "text_to_image").orElseThrow();

        assertThatThrownBy(() -> manager.getPlaintextKey(key))
                .isInstanceOfSatisfying(ControlPlaneException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.UNAVAILABLE))
                .hasMessageContaining("STABILITY_KEY");

        secrets.put("STABILITY_KEY", "st-1");
        assertThat(manager.getPlaintextKey(key)).isEqualTo("st-1");
    }

    @Test
    @DisplayName("should report an unknown key as not found")
    void shouldFailOnUnknownKey() {
        ApiKey unknown = new ApiKey("ghost", "openai", null, null, null, true, null, null);

        assertThatThrownBy(() -> manager.getPlaintextKey(unknown))
                .isInstanceOfSatisfying(ControlPlaneException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.NOT_FOUND));
    }

    @Test
    @DisplayName("should reject duplicate key ids")
    void shouldRejectDuplicates() {
        Instant now = clock.instant();
        List<ConfiguredKey> duplicated = List.of(
                configured("dup", "openai", null, ApiKey.Tier.PRIMARY, true, now, null, "A"),
                configured("dup", "stability", null, ApiKey.Tier.PRIMARY, true, now, null, "B"));

        assertThatThrownBy(() -> manager.replaceKeys(duplicated))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("dup");
        assertThat(manager.listKeys()).hasSize(5);
    }

    @Test
    @DisplayName("should swap the key set and keep usage counters")
    void shouldReplaceKeys() {
        manager.recordUsage("openai-old", new KeyUsage("req-1", "text_to_image", 0, 0, 1, 0.04, true, clock.instant()));

        manager.replaceKeys(List.of(
                configured("openai-rotated", "openai", null, ApiKey.Tier.PRIMARY, true, clock.instant(), null, "OPENAI_MAIN")));

        assertThat(manager.listKeys()).extracting(ApiKey::id).containsExactly("openai-rotated");
        assertThat(manager.getActiveKey("openai", "text_to_image")).map(ApiKey::id).hasValue("openai-rotated");
        assertThat(manager.getUsage("openai-old").requests()).isEqualTo(1);
    }

    @Test
    @DisplayName("should accumulate usage per key")
    void shouldAccumulateUsage() {
        Instant first = clock.instant();
        manager.recordUsage("openai-new", new KeyUsage("req-1", "text_generation", 10, 20, 0, 0.002, true, first));
        clock.advance(Duration.ofSeconds(1));
        manager.recordUsage("openai-new", new KeyUsage("req-2", "text_generation", 5, 0, 0, 0.0, false, clock.instant()));

        KeyUsageStats stats = manager.getUsage("openai-new");

        assertThat(stats.requests()).isEqualTo(2);
        assertThat(stats.failures()).isEqualTo(1);
        assertThat(stats.tokens()).isEqualTo(35);
        assertThat(stats.lastUsedAt()).isEqualTo(clock.instant());
        assertThat(manager.getUsage("never-used")).isEqualTo(KeyUsageStats.EMPTY);
    }
}
