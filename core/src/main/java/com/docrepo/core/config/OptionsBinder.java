package com.docrepo.core.config;

import com.docrepo.core.ConfigurationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Binds {@link RepositoryOptions} (or a subclass) from a JSON configuration section.
 */
public final class OptionsBinder {
    private static final Logger logger = LoggerFactory.getLogger(OptionsBinder.class);
    private static final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private OptionsBinder() {
    }

    public static <O extends RepositoryOptions> O bind(JsonNode section, Class<O> optionsType) {
        Objects.requireNonNull(section, "section");
        Objects.requireNonNull(optionsType, "optionsType");

        O options;
        try {
            options = objectMapper.treeToValue(section, optionsType);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ConfigurationException("Unable to bind " + optionsType.getSimpleName(), e);
        }
        if (options == null) {
            throw new ConfigurationException("No configuration found for " + optionsType.getSimpleName());
        }
        options.validate();
        logger.debug("Bound {}", options);
        return options;
    }

    /**
     * Reads a JSON configuration file and returns the named section, or the
     * whole document when {@code sectionName} is null.
     */
    public static JsonNode readSection(Path file, String sectionName) {
        JsonNode root;
        try {
            root = objectMapper.readTree(file.toFile());
        } catch (IOException e) {
            throw new ConfigurationException("Unable to read configuration " + file, e);
        }
        if (sectionName == null) {
            return root;
        }
        JsonNode section = root.path(sectionName);
        if (section.isMissingNode()) {
            throw new ConfigurationException("Section '" + sectionName + "' not found in " + file);
        }
        return section;
    }
}
