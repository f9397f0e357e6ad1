package com.docrepo.core.config;

import com.docrepo.core.ConfigurationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RepositoryOptionsTest {
    private static final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void flagsDefaultToFalse() {
        RepositoryOptions options = RepositoryOptions.builder()
                .uri("mongodb://localhost:27017")
                .databaseId("shop")
                .build();

        assertFalse(options.isEnsureCreated());
        assertFalse(options.isDropDatabase());
        assertFalse(options.isSeedDatabase());
        assertFalse(options.requiresStartupAction());
        options.validate();
    }

    @Test
    void anyFlagRequiresAStartupAction() {
        assertTrue(RepositoryOptions.builder().seedDatabase(true).build().requiresStartupAction());
        assertTrue(RepositoryOptions.builder().dropDatabase(true).build().requiresStartupAction());
        assertTrue(RepositoryOptions.builder().ensureCreated(true).build().requiresStartupAction());
    }

    @Test
    void uriAndDatabaseIdAreRequired() {
        assertThrows(ConfigurationException.class,
                () -> RepositoryOptions.builder().databaseId("shop").build().validate());
        assertThrows(ConfigurationException.class,
                () -> RepositoryOptions.builder().uri("mongodb://localhost").databaseId("  ").build().validate());
    }

    @Test
    void bindsFromAJsonSection() throws Exception {
        JsonNode section = objectMapper.readTree(
                "{\"uri\":\"mongodb://db:27017\",\"databaseId\":\"shop\",\"ensureCreated\":true,\"seedDatabase\":true,\"extra\":1}");

        RepositoryOptions options = OptionsBinder.bind(section, RepositoryOptions.class);

        assertEquals("mongodb://db:27017", options.getUri());
        assertEquals("shop", options.getDatabaseId());
        assertTrue(options.isEnsureCreated());
        assertFalse(options.isDropDatabase());
        assertTrue(options.isSeedDatabase());
    }

    @Test
    void bindsSubclassFields() throws Exception {
        JsonNode section = objectMapper.readTree(
                "{\"uri\":\"mongodb://db\",\"databaseId\":\"shop\",\"tenant\":\"acme\"}");

        ShopOptions options = OptionsBinder.bind(section, ShopOptions.class);

        assertEquals("acme", options.getTenant());
        assertEquals("shop", options.getDatabaseId());
    }

    @Test
    void bindingValidates() throws Exception {
        JsonNode section = objectMapper.readTree("{\"uri\":\"mongodb://db\"}");

        assertThrows(ConfigurationException.class, () -> OptionsBinder.bind(section, RepositoryOptions.class));
    }

    @Test
    void readsANamedSectionFromAFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("appsettings.json");
        Files.writeString(file, "{\"Repositories\":{\"uri\":\"mongodb://db\",\"databaseId\":\"shop\"}}");

        RepositoryOptions options = OptionsBinder.bind(OptionsBinder.readSection(file, "Repositories"), RepositoryOptions.class);

        assertEquals("shop", options.getDatabaseId());
        assertThrows(ConfigurationException.class, () -> OptionsBinder.readSection(file, "Missing"));
    }

    @Test
    void bindsFromTheEnvironment() {
        RepositoryOptions options = RepositoryOptions.fromEnvironment("SHOP", Map.of(
                "SHOP_URI", "mongodb://env:27017",
                "SHOP_DATABASE_ID", "shop_dev",
                "SHOP_DROP_DATABASE", "true",
                "SHOP_SEED_DATABASE", ""));

        assertEquals("mongodb://env:27017", options.getUri());
        assertEquals("shop_dev", options.getDatabaseId());
        assertTrue(options.isDropDatabase());
        assertFalse(options.isSeedDatabase());
        assertFalse(options.isEnsureCreated());
    }

    @Test
    void toStringLeavesOutTheUri() {
        RepositoryOptions options = RepositoryOptions.builder()
                .uri("mongodb://user:secret@db")
                .databaseId("shop")
                .build();

        assertFalse(options.toString().contains("secret"));
    }

    public static class ShopOptions extends RepositoryOptions {
        private String tenant;

        public String getTenant() {
            return tenant;
        }
    }
}
