package com.docrepo.repositories.mongo;

import com.docrepo.core.ErrorKind;
import com.docrepo.core.RepositoryError;
import com.docrepo.core.RepositoryResult;
import com.docrepo.core.config.RepositoryOptions;
import com.docrepo.repos.certification.model.Appointment;
import com.docrepo.repos.certification.model.Counter;
import com.docrepo.repos.certification.model.OrderLine;
import com.docrepo.repos.certification.model.Person;
import com.docrepo.repos.certification.model.Shipment;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoException;
import com.mongodb.MongoSocketOpenException;
import com.mongodb.ServerAddress;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.InsertOneOptions;
import com.mongodb.client.result.DeleteResult;
import org.bson.BsonDocument;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class MongoCrudRepositoryTest {
    private static final RepositoryOptions OPTIONS = RepositoryOptions.builder()
            .uri("mongodb://localhost:27017")
            .databaseId("shop")
            .build();

    private MongoClient client;
    private MongoDatabase database;
    private MongoCollection<Document> collection;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        client = mock(MongoClient.class);
        database = mock(MongoDatabase.class);
        collection = mock(MongoCollection.class);

        when(client.getDatabase("shop")).thenReturn(database);
        when(database.getCollection(anyString())).thenReturn(collection);
        when(collection.deleteOne(any(Bson.class))).thenReturn(DeleteResult.acknowledged(0));
    }

    private static BsonDocument render(Bson filter) {
        return filter.toBsonDocument(Document.class, MongoClientSettings.getDefaultCodecRegistry());
    }

    @Test
    void collectionIsNamedAfterThePluralizedModel() {
        MongoCrudRepository<Person> people = MongoCrudRepository.singleKey(OPTIONS, client, Person.class, String.class);

        assertEquals("People", people.collectionName());
        verify(database).getCollection("People");
    }

    @Test
    void pairKeyFilterIsThePipeJoinedKey() {
        MongoCrudRepository<OrderLine> lines = MongoCrudRepository.pairKey(OPTIONS, client, OrderLine.class);
        ArgumentCaptor<Bson> filter = ArgumentCaptor.forClass(Bson.class);

        lines.delete(new OrderLine("order-1", 2, "SKU", 1)).orElseThrow();

        verify(collection).deleteOne(filter.capture());
        assertEquals("order-1|2", render(filter.getValue()).getString("key").getValue());
    }

    @Test
    void tripleKeyFilterIsThePipeJoinedKey() {
        MongoCrudRepository<Shipment> shipments = MongoCrudRepository.tripleKey(OPTIONS, client, Shipment.class);
        ArgumentCaptor<Bson> filter = ArgumentCaptor.forClass(Bson.class);

        shipments.update(new Shipment("ACME", "T-9", 3, "delivered")).orElseThrow();

        verify(collection).findOneAndReplace(filter.capture(), any(Document.class));
        assertEquals("ACME|T-9|3", render(filter.getValue()).getString("key").getValue());
    }

    @Test
    void compositeKeyIsStampedOnTheDocument() {
        MongoCrudRepository<OrderLine> lines = MongoCrudRepository.pairKey(OPTIONS, client, OrderLine.class);
        ArgumentCaptor<Document> document = ArgumentCaptor.forClass(Document.class);

        lines.add(new OrderLine("order-1", 1, "SKU-A", 4)).orElseThrow();

        verify(collection).insertOne(document.capture(), any(InsertOneOptions.class));
        assertEquals("order-1|1", document.getValue().getString("key"));
        assertEquals("order-1", document.getValue().getString("key1"));
        assertEquals(4, document.getValue().getInteger("quantity"));
    }

    @Test
    void insertsBypassDocumentValidation() {
        MongoCrudRepository<Person> people = MongoCrudRepository.singleKey(OPTIONS, client, Person.class, String.class);
        ArgumentCaptor<InsertOneOptions> options = ArgumentCaptor.forClass(InsertOneOptions.class);

        people.add(new Person("p-1", "Ada", 36)).orElseThrow();

        verify(collection).insertOne(any(Document.class), options.capture());
        assertEquals(Boolean.TRUE, options.getValue().getBypassDocumentValidation());
    }

    @Test
    void updateWithoutAMatchReturnsEmpty() {
        MongoCrudRepository<Person> people = MongoCrudRepository.singleKey(OPTIONS, client, Person.class, String.class);
        when(collection.findOneAndReplace(any(Bson.class), any(Document.class))).thenReturn(null);

        RepositoryResult<Optional<Person>> result = people.update(new Person("p-404", "Nobody", 0));

        assertTrue(result.isSuccess());
        assertEquals(Optional.empty(), result.orElseThrow());
    }

    @Test
    void updateReturnsThePreviousDocumentWithoutItsId() {
        MongoCrudRepository<Person> people = MongoCrudRepository.singleKey(OPTIONS, client, Person.class, String.class);
        when(collection.findOneAndReplace(any(Bson.class), any(Document.class))).thenReturn(
                new Document("_id", "abc").append("key", "p-1").append("name", "Old").append("age", 30));

        Person previous = people.update(new Person("p-1", "New", 31)).orElseThrow().orElseThrow();

        assertEquals(new Person("p-1", "Old", 30), previous);
    }

    @Test
    void driverFailuresBecomeRepositoryErrors() {
        MongoCrudRepository<Person> people = MongoCrudRepository.singleKey(OPTIONS, client, Person.class, String.class);
        MongoException cause = new MongoException("duplicate key");
        when(collection.insertOne(any(Document.class), any(InsertOneOptions.class))).thenThrow(cause);

        RepositoryResult<Person> result = people.add(new Person("p-1", "Ada", 36));

        RepositoryError error = result.error().orElseThrow();
        assertEquals(ErrorKind.REPOSITORY, error.kind());
        assertEquals("add", error.operation());
        assertEquals("MongoCrudRepository", error.repositoryType());
        assertEquals("Person", error.modelType());
        assertSame(cause, error.cause());
        assertTrue(error.payload().contains("\"name\":\"Ada\""));
        assertTrue(error.payload().contains("\"key\":\"p-1\""));
    }

    @Test
    void dateFieldsAreStoredAsIsoStrings() {
        MongoCrudRepository<Appointment> appointments =
                MongoCrudRepository.singleKey(OPTIONS, client, Appointment.class, String.class);
        ArgumentCaptor<Document> document = ArgumentCaptor.forClass(Document.class);

        appointments.add(new Appointment("a-1", "Review", LocalDate.of(2024, 1, 1),
                Instant.parse("2024-01-01T00:00:00Z"))).orElseThrow();

        verify(collection).insertOne(document.capture(), any(InsertOneOptions.class));
        assertEquals("2024-01-01", document.getValue().getString("day"));
        assertEquals("2024-01-01T00:00:00Z", document.getValue().getString("startsAt"));
    }

    @Test
    void errorPayloadsSerializeDateFields() {
        MongoCrudRepository<Appointment> appointments =
                MongoCrudRepository.singleKey(OPTIONS, client, Appointment.class, String.class);
        when(collection.insertOne(any(Document.class), any(InsertOneOptions.class)))
                .thenThrow(new MongoException("write failed"));

        RepositoryError error = appointments.add(new Appointment("a-1", "Review", LocalDate.of(2024, 1, 1),
                Instant.parse("2024-01-01T00:00:00Z"))).error().orElseThrow();

        assertTrue(error.payload().contains("\"startsAt\":\"2024-01-01T00:00:00Z\""));
        assertTrue(error.payload().contains("\"day\":\"2024-01-01\""));
    }

    @Test
    void unreachableStoresAreReportedAsConnectionErrors() {
        MongoCrudRepository<Person> people = MongoCrudRepository.singleKey(OPTIONS, client, Person.class, String.class);
        when(collection.deleteOne(any(Bson.class)))
                .thenThrow(new MongoSocketOpenException("connection refused", new ServerAddress()));

        RepositoryError error = people.delete(new Person("p-1", "Ada", 36)).error().orElseThrow();

        assertEquals(ErrorKind.CONNECTION, error.kind());
        assertEquals("delete", error.operation());
        assertInstanceOf(MongoSocketOpenException.class, error.cause());
    }

    @Test
    void updateFailuresCarryTheModel() {
        MongoCrudRepository<OrderLine> lines = MongoCrudRepository.pairKey(OPTIONS, client, OrderLine.class);
        when(collection.findOneAndReplace(any(Bson.class), any(Document.class))).thenThrow(new MongoException("boom"));

        RepositoryError error = lines.update(new OrderLine("order-1", 1, "SKU-Z", 2)).error().orElseThrow();

        assertEquals("update", error.operation());
        assertEquals("OrderLine", error.modelType());
        assertTrue(error.payload().contains("SKU-Z"));
    }

    @Test
    void keysWithoutAGenerationStrategyFailWithoutInserting() {
        MongoCrudRepository<Counter> counters = MongoCrudRepository.singleKey(OPTIONS, client, Counter.class, Long.class);

        RepositoryError error = counters.add(new Counter(null, 1)).error().orElseThrow();

        assertEquals(ErrorKind.UNSUPPORTED_KEY_TYPE, error.kind());
        verify(collection, never()).insertOne(any(Document.class), any(InsertOneOptions.class));
    }

    @Test
    void presentNumericKeysAreInsertedAsIs() {
        MongoCrudRepository<Counter> counters = MongoCrudRepository.singleKey(OPTIONS, client, Counter.class, Long.class);

        Counter added = counters.add(new Counter(7L, 1)).orElseThrow();

        assertEquals(7L, added.getKey());
    }

    @Test
    void deletingAnAbsentKeyIsNotAnError() {
        MongoCrudRepository<Person> people = MongoCrudRepository.singleKey(OPTIONS, client, Person.class, String.class);

        assertTrue(people.delete(new Person("gone", "Nobody", 0)).isSuccess());
    }

    @Test
    void theSharedClientIsNeverClosed() {
        MongoCrudRepository<Person> people = MongoCrudRepository.singleKey(OPTIONS, client, Person.class, String.class);
        people.delete(new Person("p-1", "Ada", 36));

        verify(client, never()).close();
    }
}
