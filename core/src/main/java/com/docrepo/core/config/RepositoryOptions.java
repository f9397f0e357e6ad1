package com.docrepo.core.config;

import com.docrepo.core.ConfigurationException;
import com.fasterxml.jackson.annotation.JsonAutoDetect;

import java.util.Map;
import java.util.Objects;

/**
 * Connection and startup settings for a document-store repository. Bound once
 * from configuration and not modified afterwards; subclasses may add their own
 * fields, which are bound the same way.
 */
@JsonAutoDetect(
        fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class RepositoryOptions {
    private String uri;
    private String databaseId;
    private boolean ensureCreated;
    private boolean dropDatabase;
    private boolean seedDatabase;

    public RepositoryOptions() {
    }

    protected RepositoryOptions(Builder builder) {
        this.uri = builder.uri;
        this.databaseId = builder.databaseId;
        this.ensureCreated = builder.ensureCreated;
        this.dropDatabase = builder.dropDatabase;
        this.seedDatabase = builder.seedDatabase;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads {@code <PREFIX>_URI}, {@code <PREFIX>_DATABASE_ID},
     * {@code <PREFIX>_ENSURE_CREATED}, {@code <PREFIX>_DROP_DATABASE} and
     * {@code <PREFIX>_SEED_DATABASE}. Missing flags default to {@code false}.
     */
    public static RepositoryOptions fromEnvironment(String prefix, Map<String, String> env) {
        Objects.requireNonNull(prefix, "prefix");
        Objects.requireNonNull(env, "env");
        return builder()
                .uri(getEnv(env, prefix + "_URI", null))
                .databaseId(getEnv(env, prefix + "_DATABASE_ID", null))
                .ensureCreated(Boolean.parseBoolean(getEnv(env, prefix + "_ENSURE_CREATED", "false")))
                .dropDatabase(Boolean.parseBoolean(getEnv(env, prefix + "_DROP_DATABASE", "false")))
                .seedDatabase(Boolean.parseBoolean(getEnv(env, prefix + "_SEED_DATABASE", "false")))
                .build();
    }

    public String getUri() {
        return uri;
    }

    public String getDatabaseId() {
        return databaseId;
    }

    public boolean isEnsureCreated() {
        return ensureCreated;
    }

    public boolean isDropDatabase() {
        return dropDatabase;
    }

    public boolean isSeedDatabase() {
        return seedDatabase;
    }

    /**
     * Whether any one-time startup action is requested.
     */
    public boolean requiresStartupAction() {
        return ensureCreated || dropDatabase || seedDatabase;
    }

    /**
     * @throws ConfigurationException when the URI or database id is missing
     */
    public void validate() {
        if (isBlank(uri)) {
            throw new ConfigurationException(getClass().getSimpleName() + ": uri is required");
        }
        if (isBlank(databaseId)) {
            throw new ConfigurationException(getClass().getSimpleName() + ": databaseId is required");
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static String getEnv(Map<String, String> env, String name, String defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isEmpty()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        // the uri may carry credentials
        return getClass().getSimpleName() + "{databaseId=" + databaseId
                + ", ensureCreated=" + ensureCreated
                + ", dropDatabase=" + dropDatabase
                + ", seedDatabase=" + seedDatabase + "}";
    }

    public static class Builder {
        private String uri;
        private String databaseId;
        private boolean ensureCreated;
        private boolean dropDatabase;
        private boolean seedDatabase;

        public Builder uri(String uri) {
            this.uri = uri;
            return this;
        }

        public Builder databaseId(String databaseId) {
            this.databaseId = databaseId;
            return this;
        }

        public Builder ensureCreated(boolean ensureCreated) {
            this.ensureCreated = ensureCreated;
            return this;
        }

        public Builder dropDatabase(boolean dropDatabase) {
            this.dropDatabase = dropDatabase;
            return this;
        }

        public Builder seedDatabase(boolean seedDatabase) {
            this.seedDatabase = seedDatabase;
            return this;
        }

        public RepositoryOptions build() {
            return new RepositoryOptions(this);
        }
    }
}
