package fr.lapetina.aiplatform.infrastructure.provider;

import fr.lapetina.aiplatform.domain.exception.ProviderException;
import fr.lapetina.aiplatform.domain.request.FeatureKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProviderFactoryTest {

    private List<ClosableProvider> created;
    private ProviderFactory factory;

    @BeforeEach
    void setUp() {
        created = new ArrayList<>();
        factory = new ProviderFactory();
        factory.register("Alpha", settings -> {
            ClosableProvider provider = new ClosableProvider(settings.vendor());
            created.add(provider);
            return provider;
        });
    }

    private static ProviderSettings settings(String secret) {
        return new ProviderSettings("alpha", "alpha-primary", secret, "https://alpha.example", "m1", null, null);
    }

    @Test
    @DisplayName("should reuse the client for identical settings")
    void shouldReuseClient() {
        Provider first = factory.getOrCreate(settings("sk-1"));
        Provider second = factory.getOrCreate(settings("sk-1"));

        assertThat(second).isSameAs(first);
        assertThat(created).hasSize(1);
    }

    @Test
    @DisplayName("should rebuild the client and close the old one when the secret changes")
    void shouldRebuildOnSecretChange() {
        Provider first = factory.getOrCreate(settings("sk-1"));
        Provider rotated = factory.getOrCreate(settings("sk-2"));

        assertThat(rotated).isNotSameAs(first);
        assertThat(created).hasSize(2);
        assertThat(created.get(0).closed).isTrue();
        assertThat(created.get(1).closed).isFalse();
        assertThat(factory.getOrCreate(settings("sk-2"))).isSameAs(rotated);
    }

    @Test
    @DisplayName("should keep the secret out of the settings string")
    void shouldHideSecret() {
        ProviderSettings settings = settings("sk-very-secret");

        assertThat(settings.toString()).doesNotContain("sk-very-secret");
        assertThat(settings.secretFingerprint()).hasSize(16).doesNotContain("sk-very-secret");
        assertThat(settings.secretFingerprint()).isNotEqualTo(settings("sk-other").secretFingerprint());
    }

    @Test
    @DisplayName("should refuse an unknown vendor")
    void shouldRefuseUnknownVendor() {
        ProviderSettings unknown = new ProviderSettings("gamma", "k", "sk", null, null, null, null);

        assertThatThrownBy(() -> factory.getOrCreate(unknown))
                .isInstanceOf(ProviderException.class)
                .hasMessageContaining("gamma");
    }

    @Test
    @DisplayName("should propagate a creator failure without caching anything")
    void shouldPropagateCreatorFailure() {
        factory.register("beta", settings -> {
            throw new IllegalStateException("client init failed");
        });
        ProviderSettings beta = new ProviderSettings("beta", "k", "sk", null, null, null, null);

        assertThatThrownBy(() -> factory.getOrCreate(beta))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("client init failed");
        assertThatThrownBy(() -> factory.getOrCreate(beta))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("should close every client on invalidation")
    void shouldCloseOnInvalidate() {
        factory.getOrCreate(settings("sk-1"));
        factory.getOrCreate(new ProviderSettings("alpha", "alpha-backup", "sk-3", null, null, null, null));

        factory.invalidateClients();

        assertThat(created).hasSize(2).allSatisfy(p -> assertThat(p.closed).isTrue());
    }

    private static final class ClosableProvider implements Provider {
        private final String name;
        private volatile boolean closed;

        private ClosableProvider(String name) {
            this.name = name;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public Set<FeatureKind> capabilities() {
            return EnumSet.of(FeatureKind.TEXT_GENERATION);
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
