package io.fullerstack.rosdiscover.bootstrap;

import io.fullerstack.rosdiscover.model.Model;
import io.fullerstack.rosdiscover.model.ModelRegistry;
import io.fullerstack.rosdiscover.spi.ModelProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.BiConsumer;

/**
 * Builds the {@link ModelRegistry} at startup.
 * <p>
 * Discovers every {@link ModelProvider} via {@link ServiceLoader} and registers the models it
 * enumerates. Registration happens here and only here: once bootstrap returns, the registry is
 * treated as read-only and can be shared by any number of interpreter sessions.
 * <p>
 * <strong>Usage:</strong>
 * <pre>
 * ModelRegistry registry = RosDiscoverBootstrap.registry();
 *
 * ModelRegistry custom = RosDiscoverBootstrap.builder()
 *     .provider(new MyExtraModels())
 *     .onModelRegistered((provider, model) -&gt; log.info("{} from {}", model.key(), provider))
 *     .bootstrap();
 * </pre>
 * A duplicate model aborts bootstrap with a {@link io.fullerstack.rosdiscover.model.DuplicateModelException}.
 */
public final class RosDiscoverBootstrap {

    private static final Logger logger = LoggerFactory.getLogger(RosDiscoverBootstrap.class);

    private RosDiscoverBootstrap() {
    }

    /**
     * Registry holding the models of all discovered providers.
     */
    public static ModelRegistry registry() {
        return builder().bootstrap();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private final List<ModelProvider> extraProviders = new ArrayList<>();
        private boolean discover = true;
        private ClassLoader classLoader;
        private BiConsumer<String, Model> onModelRegistered = (provider, model) -> {};

        /**
         * Adds a provider in addition to the discovered ones.
         */
        public Builder provider(ModelProvider provider) {
            extraProviders.add(Objects.requireNonNull(provider));
            return this;
        }

        /**
         * Whether to discover providers through {@link ServiceLoader} (default true).
         */
        public Builder discover(boolean discover) {
            this.discover = discover;
            return this;
        }

        public Builder classLoader(ClassLoader classLoader) {
            this.classLoader = Objects.requireNonNull(classLoader);
            return this;
        }

        /**
         * Callback invoked for every registered model.
         *
         * @param callback (provider class name, model) → void
         */
        public Builder onModelRegistered(BiConsumer<String, Model> callback) {
            this.onModelRegistered = Objects.requireNonNull(callback);
            return this;
        }

        public ModelRegistry bootstrap() {
            logger.info("Starting model bootstrap...");

            List<ModelProvider> providers = new ArrayList<>();
            if (discover) {
                ServiceLoader<ModelProvider> loader = classLoader == null
                    ? ServiceLoader.load(ModelProvider.class)
                    : ServiceLoader.load(ModelProvider.class, classLoader);
                loader.forEach(providers::add);
            }
            providers.addAll(extraProviders);
            logger.debug("Loaded model providers: {}", providers.size());

            ModelRegistry registry = new ModelRegistry();
            for (ModelProvider provider : providers) {
                String providerName = provider.getClass().getName();
                List<Model> models = provider.models();
                for (Model model : models) {
                    registry.register(model);
                    onModelRegistered.accept(providerName, model);
                }
                logger.debug("Provider {} registered {} models", providerName, models.size());
            }

            logger.info("Bootstrap complete: {} providers, {} models", providers.size(), registry.size());
            return registry;
        }
    }
}
