package com.docrepo.repositories.mongo;

import com.docrepo.core.Queryable;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoCursor;
import com.mongodb.client.MongoIterable;
import com.mongodb.client.model.CountOptions;
import com.mongodb.client.model.Filters;
import org.bson.Document;
import org.bson.conversions.Bson;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Immutable query over a collection. Each operator returns a new view, and
 * the filter, sort and projection are executed by MongoDB when the view is
 * enumerated.
 */
public class MongoQueryable<M> implements Queryable<M> {
    private static final Bson ALL = new Document();

    private final MongoCollection<Document> collection;
    private final DocumentMapper<M> mapper;
    private final Bson filter;
    private final Bson sort;
    private final Bson projection;
    private final int skip;
    private final int limit;

    MongoQueryable(MongoCollection<Document> collection, DocumentMapper<M> mapper) {
        this(collection, mapper, ALL, null, null, 0, 0);
    }

    private MongoQueryable(MongoCollection<Document> collection, DocumentMapper<M> mapper,
                           Bson filter, Bson sort, Bson projection, int skip, int limit) {
        this.collection = collection;
        this.mapper = mapper;
        this.filter = filter;
        this.sort = sort;
        this.projection = projection;
        this.skip = skip;
        this.limit = limit;
    }

    /**
     * Narrows the view; successive calls are combined with {@code $and}.
     */
    public MongoQueryable<M> where(Bson condition) {
        Bson combined = filter == ALL ? condition : Filters.and(filter, condition);
        return new MongoQueryable<>(collection, mapper, combined, sort, projection, skip, limit);
    }

    public MongoQueryable<M> orderBy(Bson sort) {
        return new MongoQueryable<>(collection, mapper, filter, sort, projection, skip, limit);
    }

    public MongoQueryable<M> project(Bson projection) {
        return new MongoQueryable<>(collection, mapper, filter, sort, projection, skip, limit);
    }

    public MongoQueryable<M> skip(int skip) {
        if (skip < 0) {
            throw new IllegalArgumentException("skip must not be negative");
        }
        return new MongoQueryable<>(collection, mapper, filter, sort, projection, skip, limit);
    }

    /**
     * @param limit maximum number of documents, 0 for no limit
     */
    public MongoQueryable<M> limit(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative");
        }
        return new MongoQueryable<>(collection, mapper, filter, sort, projection, skip, limit);
    }

    public Bson filter() {
        return filter;
    }

    private MongoIterable<M> execute() {
        FindIterable<Document> found = collection.find(filter);
        if (sort != null) {
            found = found.sort(sort);
        }
        if (projection != null) {
            found = found.projection(projection);
        }
        if (skip > 0) {
            found = found.skip(skip);
        }
        if (limit > 0) {
            found = found.limit(limit);
        }
        return found.map(mapper::fromDocument);
    }

    @Override
    public Iterator<M> iterator() {
        return execute().iterator();
    }

    /**
     * The returned stream holds a server cursor; close it when not read to the end.
     */
    @Override
    public Stream<M> stream() {
        MongoCursor<M> cursor = execute().iterator();
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(cursor, Spliterator.ORDERED), false)
                .onClose(cursor::close);
    }

    @Override
    public List<M> toList() {
        return execute().into(new ArrayList<>());
    }

    @Override
    public Optional<M> first() {
        return Optional.ofNullable(execute().first());
    }

    @Override
    public long count() {
        CountOptions options = new CountOptions();
        if (skip > 0) {
            options.skip(skip);
        }
        if (limit > 0) {
            options.limit(limit);
        }
        return collection.countDocuments(filter, options);
    }
}
