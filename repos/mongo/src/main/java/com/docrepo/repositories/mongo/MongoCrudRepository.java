package com.docrepo.repositories.mongo;

import com.docrepo.core.CrudRepository;
import com.docrepo.core.Model;
import com.docrepo.core.Model2;
import com.docrepo.core.Model3;
import com.docrepo.core.RepositoryError;
import com.docrepo.core.RepositoryResult;
import com.docrepo.core.config.RepositoryOptions;
import com.docrepo.core.keys.KeyDescriptor;
import com.docrepo.core.keys.Keys;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.InsertOneOptions;
import com.mongodb.client.result.DeleteResult;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

import static com.docrepo.core.keys.KeyDescriptor.KEY_FIELD;

/**
 * CRUD repository over one MongoDB collection. Every key arity goes through
 * the same code; the {@link KeyDescriptor} decides how a model's key is
 * matched and whether it is generated on insert.
 */
public class MongoCrudRepository<M> implements CrudRepository<M> {
    private static final Logger logger = LoggerFactory.getLogger(MongoCrudRepository.class);

    private final MongoRepository<M> reader;
    private final KeyDescriptor<M> keys;
    private final MongoCollection<Document> collection;
    private final DocumentMapper<M> mapper;

    public MongoCrudRepository(RepositoryOptions options, MongoClient client, Class<M> modelType, KeyDescriptor<M> keys) {
        this.keys = Objects.requireNonNull(keys, "keys");
        this.reader = new MongoRepository<>(options, client, modelType);
        this.collection = reader.collection();
        this.mapper = reader.mapper();
    }

    public static <M extends Model<K>, K> MongoCrudRepository<M> singleKey(
            RepositoryOptions options, MongoClient client, Class<M> modelType, Class<K> keyType) {
        return new MongoCrudRepository<>(options, client, modelType, Keys.<M, K>single(keyType));
    }

    public static <M extends Model2<?, ?>> MongoCrudRepository<M> pairKey(
            RepositoryOptions options, MongoClient client, Class<M> modelType) {
        return new MongoCrudRepository<>(options, client, modelType, Keys.<M>pair());
    }

    public static <M extends Model3<?, ?, ?>> MongoCrudRepository<M> tripleKey(
            RepositoryOptions options, MongoClient client, Class<M> modelType) {
        return new MongoCrudRepository<>(options, client, modelType, Keys.<M>triple());
    }

    @Override
    public MongoQueryable<M> asQueryable() {
        return reader.asQueryable();
    }

    public String collectionName() {
        return reader.collectionName();
    }

    @Override
    public RepositoryResult<M> add(M model) {
        Objects.requireNonNull(model, "model");
        Optional<String> storedKey = keys.storedKey(model);

        try {
            if (keys.assignMissingKey(model)) {
                logger.debug("Generated key for new {}", reader.modelType().getSimpleName());
            }

            Document document = mapper.toDocument(model);
            storedKey.ifPresent(key -> document.put(KEY_FIELD, key));

            // models arrive already validated by the calling layer
            collection.insertOne(document, new InsertOneOptions().bypassDocumentValidation(true));
            return RepositoryResult.success(model);
        } catch (Exception e) {
            return failure("add", model, e);
        }
    }

    @Override
    public RepositoryResult<Optional<M>> update(M model) {
        Objects.requireNonNull(model, "model");
        Bson filter = filterFor(model);
        Optional<String> storedKey = keys.storedKey(model);

        try {
            Document replacement = mapper.toDocument(model);
            storedKey.ifPresent(key -> replacement.put(KEY_FIELD, key));

            Document previous = collection.findOneAndReplace(filter, replacement);
            if (previous == null) {
                logger.debug("No {} matched {} for update", reader.modelType().getSimpleName(), filter);
            }
            return RepositoryResult.success(Optional.ofNullable(mapper.fromDocument(previous)));
        } catch (Exception e) {
            return failure("update", model, e);
        }
    }

    @Override
    public RepositoryResult<Void> delete(M model) {
        Objects.requireNonNull(model, "model");
        Bson filter = filterFor(model);

        try {
            DeleteResult result = collection.deleteOne(filter);
            logger.debug("Deleted {} {} matching {}", result.getDeletedCount(), reader.modelType().getSimpleName(), filter);
            return RepositoryResult.success(null);
        } catch (Exception e) {
            return failure("delete", model, e);
        }
    }

    private Bson filterFor(M model) {
        return Filters.eq(KEY_FIELD, mapper.toBsonValue(keys.filterValue(model)));
    }

    private <T> RepositoryResult<T> failure(String operation, M model, Exception e) {
        String modelName = reader.modelType().getSimpleName();
        logger.error("Error in {} for {}: {}", operation, modelName, e.getMessage(), e);

        return RepositoryResult.failure(new RepositoryError(
                MongoErrors.classify(e),
                operation,
                getClass().getSimpleName(),
                modelName,
                mapper.toJson(model),
                e));
    }
}
