package com.docrepo.repositories.mongo;

import com.docrepo.core.CollectionNames;
import com.docrepo.core.QueryableRepository;
import com.docrepo.core.config.RepositoryOptions;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Read access to the collection backing a model type. The collection is named
 * after the pluralized model name and resolved once, at construction.
 * The client is shared and owned by the caller; it is never closed here.
 */
public class MongoRepository<M> implements QueryableRepository<M> {
    private static final Logger logger = LoggerFactory.getLogger(MongoRepository.class);

    private final Class<M> modelType;
    private final String collectionName;
    private final MongoDatabase database;
    private final MongoCollection<Document> collection;
    private final DocumentMapper<M> mapper;

    /**
     * @throws com.docrepo.core.ConfigurationException when the options have no uri or database id
     */
    public MongoRepository(RepositoryOptions options, MongoClient client, Class<M> modelType) {
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(client, "client");
        this.modelType = Objects.requireNonNull(modelType, "modelType");
        options.validate();

        this.collectionName = CollectionNames.resolve(modelType);
        this.database = client.getDatabase(options.getDatabaseId());
        this.collection = database.getCollection(collectionName);
        this.mapper = new DocumentMapper<>(modelType);

        logger.info("Bound {} to collection {}.{}", modelType.getSimpleName(), options.getDatabaseId(), collectionName);
    }

    @Override
    public MongoQueryable<M> asQueryable() {
        return new MongoQueryable<>(collection, mapper);
    }

    public Class<M> modelType() {
        return modelType;
    }

    public String collectionName() {
        return collectionName;
    }

    public MongoDatabase database() {
        return database;
    }

    public MongoCollection<Document> collection() {
        return collection;
    }

    DocumentMapper<M> mapper() {
        return mapper;
    }
}
