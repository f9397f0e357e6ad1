package com.docrepo.repos.certification;

import com.docrepo.core.CrudRepository;
import com.docrepo.core.Queryable;
import com.docrepo.core.RepositoryResult;
import com.docrepo.core.keys.KeyUtility;
import com.docrepo.repos.certification.model.Appointment;
import com.docrepo.repos.certification.model.Order;
import com.docrepo.repos.certification.model.OrderLine;
import com.docrepo.repos.certification.model.Person;
import com.docrepo.repos.certification.model.Shipment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour every {@link CrudRepository} implementation must show. Subclasses
 * point the repositories at an empty store in {@link #init()}.
 */
public abstract class CrudRepositoryCertification {
    protected CrudRepository<Person> people;
    protected CrudRepository<Order> orders;
    protected CrudRepository<OrderLine> orderLines;
    protected CrudRepository<Shipment> shipments;
    protected CrudRepository<Appointment> appointments;

    public abstract void init();

    @BeforeEach
    public void setUp() throws Exception {
        init();
    }

    @Test
    public void addShouldGenerateAMissingStringKey() {
        Person person = new Person(null, "Ada", 36);

        Person added = people.add(person).orElseThrow();

        assertFalse(KeyUtility.isKeyMissing(added.getKey()));
        assertEquals(added.getKey(), people.asQueryable().first().orElseThrow().getKey());
    }

    @Test
    public void addShouldGenerateAKeyForAnEmptyString() {
        Person added = people.add(new Person("", "Grace", 45)).orElseThrow();

        assertFalse(added.getKey().isEmpty());
    }

    @Test
    public void addShouldGenerateAMissingUuidKey() {
        Order added = orders.add(new Order(null, "Ada", 12.5)).orElseThrow();

        assertNotNull(added.getKey());
        assertFalse(KeyUtility.isKeyMissing(added.getKey()));

        Order stored = orders.asQueryable().first().orElseThrow();
        assertEquals(added.getKey(), stored.getKey());
        assertEquals(12.5, stored.getTotal());
    }

    @Test
    public void generatedKeysShouldBeDistinct() {
        Set<String> keys = new HashSet<>();
        for (int i = 0; i < 25; i++) {
            keys.add(people.add(new Person(null, "p" + i, i)).orElseThrow().getKey());
        }

        assertEquals(25, keys.size());
    }

    @Test
    public void addShouldKeepAPresentKey() {
        Person added = people.add(new Person("fixed-key", "Linus", 54)).orElseThrow();

        assertEquals("fixed-key", added.getKey());
        assertEquals("fixed-key", people.asQueryable().first().orElseThrow().getKey());
    }

    @Test
    public void updateShouldReplaceAndReturnThePreviousDocument() {
        people.add(new Person("p-1", "Before", 20)).orElseThrow();

        Optional<Person> previous = people.update(new Person("p-1", "After", 21)).orElseThrow();

        assertTrue(previous.isPresent());
        assertEquals("Before", previous.get().getName());

        List<Person> stored = people.asQueryable().toList();
        assertEquals(1, stored.size());
        assertEquals("After", stored.get(0).getName());
        assertEquals(21, stored.get(0).getAge());
    }

    @Test
    public void updateOfAnAbsentKeyShouldReturnEmpty() {
        RepositoryResult<Optional<Person>> result = people.update(new Person("missing", "Nobody", 1));

        assertTrue(result.isSuccess());
        assertTrue(result.orElseThrow().isEmpty());
        assertEquals(0, people.asQueryable().count());
    }

    @Test
    public void deleteShouldRemoveOnlyTheMatchingDocument() {
        Person keep = people.add(new Person(null, "Keep", 1)).orElseThrow();
        Person remove = people.add(new Person(null, "Remove", 2)).orElseThrow();

        assertTrue(people.delete(remove).isSuccess());

        List<Person> stored = people.asQueryable().toList();
        assertEquals(1, stored.size());
        assertEquals(keep.getKey(), stored.get(0).getKey());
    }

    @Test
    public void deleteOfAnAbsentKeyShouldSucceed() {
        people.add(new Person("present", "Here", 3)).orElseThrow();

        RepositoryResult<Void> result = people.delete(new Person("absent", "Gone", 4));

        assertTrue(result.isSuccess());
        assertEquals(1, people.asQueryable().count());
    }

    @Test
    public void pairKeysShouldAddressOneDocument() {
        orderLines.add(new OrderLine("order-1", 1, "SKU-A", 1)).orElseThrow();
        orderLines.add(new OrderLine("order-1", 2, "SKU-B", 1)).orElseThrow();

        Optional<OrderLine> previous = orderLines.update(new OrderLine("order-1", 2, "SKU-B", 7)).orElseThrow();
        assertEquals(1, previous.orElseThrow().getQuantity());

        orderLines.delete(new OrderLine("order-1", 1, null, 0)).orElseThrow();

        List<OrderLine> stored = orderLines.asQueryable().toList();
        assertEquals(1, stored.size());
        assertEquals(2, stored.get(0).getKey2());
        assertEquals(7, stored.get(0).getQuantity());
    }

    @Test
    public void tripleKeysShouldAddressOneDocument() {
        shipments.add(new Shipment("ACME", "T-1", 1, "picked")).orElseThrow();
        shipments.add(new Shipment("ACME", "T-1", 2, "waiting")).orElseThrow();

        Optional<Shipment> previous = shipments.update(new Shipment("ACME", "T-1", 2, "in transit")).orElseThrow();
        assertEquals("waiting", previous.orElseThrow().getStatus());

        shipments.delete(new Shipment("ACME", "T-1", 1, null)).orElseThrow();

        List<Shipment> stored = shipments.asQueryable().toList();
        assertEquals(1, stored.size());
        assertEquals("in transit", stored.get(0).getStatus());
    }

    @Test
    public void keyPartsContainingTheSeparatorShouldNotCollide() {
        shipments.add(new Shipment("a|b", "c", 1, "first")).orElseThrow();
        shipments.add(new Shipment("a", "b|c", 1, "second")).orElseThrow();

        shipments.delete(new Shipment("a", "b|c", 1, null)).orElseThrow();

        List<Shipment> stored = shipments.asQueryable().toList();
        assertEquals(1, stored.size());
        assertEquals("first", stored.get(0).getStatus());
    }

    @Test
    public void queryableShouldBeLazyAndRestartable() {
        Queryable<Person> all = people.asQueryable();

        people.add(new Person(null, "One", 1)).orElseThrow();
        people.add(new Person(null, "Two", 2)).orElseThrow();

        assertEquals(2, all.toList().size());
        assertEquals(2, all.stream().count());

        people.add(new Person(null, "Three", 3)).orElseThrow();
        Set<String> names = all.stream().map(Person::getName).collect(Collectors.toSet());
        assertEquals(Set.of("One", "Two", "Three"), names);
    }

    @Test
    public void asyncOperationsShouldRunOnTheCallersExecutor() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Person added = people.addAsync(new Person(null, "Async", 9), executor).get().orElseThrow();
            assertFalse(KeyUtility.isKeyMissing(added.getKey()));

            added.setAge(10);
            Optional<Person> previous = people.updateAsync(added, executor).get().orElseThrow();
            assertEquals(9, previous.orElseThrow().getAge());

            assertTrue(people.deleteAsync(added, executor).get().isSuccess());
            assertEquals(0, people.asQueryable().count());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void cancelledAsyncOperationsShouldNotReachTheStore() {
        List<Runnable> held = new ArrayList<>();
        Executor deferred = held::add;

        CompletableFuture<RepositoryResult<Person>> future = people.addAsync(new Person(null, "Never", 1), deferred);
        assertTrue(future.cancel(true));
        held.forEach(Runnable::run);

        assertTrue(future.isCancelled());
        assertEquals(1, held.size());
        assertEquals(0, people.asQueryable().count());
    }

    @Test
    public void dateAndTimeFieldsShouldRoundTrip() {
        Appointment standup = new Appointment(null, "Standup",
                LocalDate.of(2024, 1, 1), Instant.parse("2024-01-01T09:30:00Z"));
        Appointment added = appointments.add(standup).orElseThrow();

        assertEquals(added, appointments.asQueryable().first().orElseThrow());

        Appointment moved = new Appointment(added.getKey(), "Standup",
                LocalDate.of(2024, 1, 2), Instant.parse("2024-01-02T10:15:30.123456789Z"));
        Optional<Appointment> previous = appointments.update(moved).orElseThrow();

        assertEquals(Instant.parse("2024-01-01T09:30:00Z"), previous.orElseThrow().getStartsAt());
        assertEquals(List.of(moved), appointments.asQueryable().toList());
    }

    @Test
    public void nullModelsShouldBeRejectedBeforeAnyIo() {
        assertThrows(NullPointerException.class, () -> people.add(null));
        assertThrows(NullPointerException.class, () -> people.update(null));
        assertThrows(NullPointerException.class, () -> people.delete(null));
        assertThrows(NullPointerException.class, () -> people.addAsync(null, Runnable::run));
    }

    @Test
    public void missingCompositeKeyPartsShouldBeRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> orderLines.add(new OrderLine("order-1", null, "SKU", 1)));
        assertEquals(0, orderLines.asQueryable().count());
    }

    @Test
    public void randomUuidKeysShouldDifferFromTheNilUuid() {
        Order added = orders.add(new Order(new UUID(0, 0), "Nil", 1)).orElseThrow();

        assertNotEquals(new UUID(0, 0), added.getKey());
    }
}
