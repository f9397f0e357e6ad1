package com.docrepo.repositories.mongo;

import com.docrepo.core.config.RepositoryOptions;
import com.docrepo.core.config.ServiceLifetime;
import com.docrepo.core.keys.KeyDescriptor;
import com.mongodb.client.MongoClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A bounded lifetime for scoped options and the repositories built from them,
 * typically one request or one startup task. Not thread-safe. Closing the
 * scope releases what it holds but leaves the shared client open.
 */
public class RepositoryScope implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(RepositoryScope.class);

    private final MongoRepositoryRegistry registry;
    private final Map<Class<?>, RepositoryOptions> scopedOptions = new HashMap<>();
    private final Map<CacheKey, Object> repositories = new HashMap<>();
    private boolean closed;

    RepositoryScope(MongoRepositoryRegistry registry) {
        this.registry = registry;
    }

    public MongoClient client() {
        ensureOpen();
        return registry.client();
    }

    public <O extends RepositoryOptions> O options(Class<O> optionsType) {
        ensureOpen();
        if (registry.lifetimeOf(optionsType) == ServiceLifetime.SCOPED) {
            return optionsType.cast(scopedOptions.computeIfAbsent(optionsType, t -> registry.create(optionsType)));
        }
        return registry.create(optionsType);
    }

    /**
     * A CRUD repository for {@code modelType}, built once per scope and key
     * descriptor. Descriptors from {@link com.docrepo.core.keys.Keys} with the
     * same arity and key type share a repository.
     */
    @SuppressWarnings("unchecked")
    public <M> MongoCrudRepository<M> crudRepository(
            Class<? extends RepositoryOptions> optionsType, Class<M> modelType, KeyDescriptor<M> keys) {
        ensureOpen();
        CacheKey cacheKey = new CacheKey(optionsType, modelType, Objects.requireNonNull(keys, "keys"));
        return (MongoCrudRepository<M>) repositories.computeIfAbsent(cacheKey,
                n -> new MongoCrudRepository<>(options(optionsType), registry.client(), modelType, keys));
    }

    /**
     * A read-only repository for {@code modelType}, built once per scope.
     */
    @SuppressWarnings("unchecked")
    public <M> MongoRepository<M> repository(Class<? extends RepositoryOptions> optionsType, Class<M> modelType) {
        ensureOpen();
        CacheKey cacheKey = new CacheKey(optionsType, modelType, null);
        return (MongoRepository<M>) repositories.computeIfAbsent(cacheKey,
                n -> new MongoRepository<>(options(optionsType), registry.client(), modelType));
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        logger.debug("Closing scope with {} options and {} repositories", scopedOptions.size(), repositories.size());
        scopedOptions.clear();
        repositories.clear();
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Repository scope has been closed");
        }
    }

    /**
     * A null descriptor marks the read-only repository.
     */
    private record CacheKey(Class<?> optionsType, Class<?> modelType, KeyDescriptor<?> keys) {
    }
}
