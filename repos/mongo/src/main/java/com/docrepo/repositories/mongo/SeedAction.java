package com.docrepo.repositories.mongo;

import com.mongodb.client.MongoClient;

/**
 * Populates a database at startup.
 */
@FunctionalInterface
public interface SeedAction {
    /**
     * @param client     the shared client
     * @param wasDropped whether the database was dropped during this startup
     * @param wasCreated whether the database was (re)created during this startup
     */
    void seed(MongoClient client, boolean wasDropped, boolean wasCreated);
}
