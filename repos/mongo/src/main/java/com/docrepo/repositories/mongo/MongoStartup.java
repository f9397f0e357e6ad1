package com.docrepo.repositories.mongo;

import com.docrepo.core.config.RepositoryOptions;
import com.mongodb.client.MongoClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * One-time database preparation run while the application starts: drop,
 * ensure created, then seed, each only when its option flag is set. Any
 * failure propagates so the application does not start against a partially
 * prepared database.
 */
public final class MongoStartup {
    private static final Logger logger = LoggerFactory.getLogger(MongoStartup.class);

    private MongoStartup() {
    }

    /**
     * What {@link #useMongo} did.
     */
    public record Outcome(boolean dropped, boolean created, boolean seeded) {
        static final Outcome NOTHING = new Outcome(false, false, false);
    }

    public static <O extends RepositoryOptions> Outcome useMongo(
            MongoRepositoryRegistry registry, Class<O> optionsType, SeedAction seedAction) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(optionsType, "optionsType");
        Objects.requireNonNull(seedAction, "seedAction");

        try (RepositoryScope scope = registry.openScope()) {
            O options = scope.options(optionsType);
            if (!options.requiresStartupAction()) {
                logger.debug("No startup actions requested by {}", optionsType.getSimpleName());
                return Outcome.NOTHING;
            }

            MongoClient client = scope.client();
            String databaseId = options.getDatabaseId();
            boolean wasDropped = false;
            boolean wasCreated = false;
            boolean seeded = false;

            if (options.isDropDatabase()) {
                logger.info("Dropping database {}", databaseId);
                client.getDatabase(databaseId).drop();
                wasDropped = true;
            }

            if (options.isEnsureCreated()) {
                // MongoDB creates the database on first write; the handle is all there is to obtain
                client.getDatabase(databaseId);
                logger.info("Ensured database {}", databaseId);
                wasCreated = true;
            }

            if (options.isSeedDatabase()) {
                logger.info("Seeding database {} (dropped={}, created={})", databaseId, wasDropped, wasCreated);
                seedAction.seed(client, wasDropped, wasCreated);
                seeded = true;
            }

            return new Outcome(wasDropped, wasCreated, seeded);
        }
    }
}
