package com.docrepo.repositories.mongo;

import com.docrepo.core.ConfigurationException;
import com.docrepo.core.config.OptionsBinder;
import com.docrepo.core.config.RepositoryOptions;
import com.docrepo.core.config.ServiceLifetime;
import com.fasterxml.jackson.databind.JsonNode;
import com.mongodb.client.MongoClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Registers repository options against their configuration and hands out
 * scopes that resolve them. The registry wraps a client that the application
 * creates and closes; it never closes the client itself.
 */
public class MongoRepositoryRegistry {
    private static final Logger logger = LoggerFactory.getLogger(MongoRepositoryRegistry.class);

    private final MongoClient client;
    private final Map<Class<?>, Registration<?>> registrations = new ConcurrentHashMap<>();
    private final Map<Class<?>, RepositoryOptions> singletons = new ConcurrentHashMap<>();

    public MongoRepositoryRegistry(MongoClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    /**
     * Registers {@code optionsType} bound from {@code configuration}, scoped.
     */
    public <O extends RepositoryOptions> MongoRepositoryRegistry addRepositories(Class<O> optionsType, JsonNode configuration) {
        return addRepositories(optionsType, configuration, ServiceLifetime.SCOPED);
    }

    public <O extends RepositoryOptions> MongoRepositoryRegistry addRepositories(
            Class<O> optionsType, JsonNode configuration, ServiceLifetime lifetime) {
        Objects.requireNonNull(configuration, "configuration");
        return addRepositories(optionsType, () -> OptionsBinder.bind(configuration, optionsType), lifetime);
    }

    public <O extends RepositoryOptions> MongoRepositoryRegistry addRepositories(
            Class<O> optionsType, Supplier<O> factory, ServiceLifetime lifetime) {
        Objects.requireNonNull(optionsType, "optionsType");
        Objects.requireNonNull(factory, "factory");
        Objects.requireNonNull(lifetime, "lifetime");

        registrations.put(optionsType, new Registration<>(optionsType, factory, lifetime));
        singletons.remove(optionsType);
        logger.info("Registered {} as {}", optionsType.getSimpleName(), lifetime);
        return this;
    }

    public boolean isRegistered(Class<? extends RepositoryOptions> optionsType) {
        return registrations.containsKey(optionsType);
    }

    public MongoClient client() {
        return client;
    }

    public RepositoryScope openScope() {
        return new RepositoryScope(this);
    }

    ServiceLifetime lifetimeOf(Class<? extends RepositoryOptions> optionsType) {
        return registration(optionsType).lifetime();
    }

    /**
     * Creates a fresh instance, or returns the registry-wide one for singletons.
     */
    <O extends RepositoryOptions> O create(Class<O> optionsType) {
        Registration<O> registration = registration(optionsType);
        if (registration.lifetime() == ServiceLifetime.SINGLETON) {
            return optionsType.cast(singletons.computeIfAbsent(optionsType, t -> registration.newInstance()));
        }
        return registration.newInstance();
    }

    @SuppressWarnings("unchecked")
    private <O extends RepositoryOptions> Registration<O> registration(Class<O> optionsType) {
        Registration<?> registration = registrations.get(optionsType);
        if (registration == null) {
            throw new ConfigurationException(optionsType.getSimpleName() + " has not been registered");
        }
        return (Registration<O>) registration;
    }

    private record Registration<O extends RepositoryOptions>(
            Class<O> type,
            Supplier<O> factory,
            ServiceLifetime lifetime
    ) {
        O newInstance() {
            O options = factory.get();
            if (options == null) {
                throw new ConfigurationException("Factory for " + type.getSimpleName() + " returned null");
            }
            options.validate();
            return options;
        }
    }
}
