package com.sysdiagram.core.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sysdiagram.core.model.ModelNode;

import static com.sysdiagram.core.io.ModelJsonWriter.FIELD_ALIAS;
import static com.sysdiagram.core.io.ModelJsonWriter.FIELD_DESCRIPTION;
import static com.sysdiagram.core.io.ModelJsonWriter.FIELD_NAME;
import static com.sysdiagram.core.io.ModelJsonWriter.FIELD_PARTS;
import static com.sysdiagram.core.io.ModelJsonWriter.FIELD_TYPE;

/**
 * Reads a model tree previously written by {@link ModelJsonWriter}.
 *
 * <p>The top-level object is always treated as the synthetic root. Unknown fields are
 * ignored; an element without {@code name} is rejected.
 */
public class ModelJsonReader {

    private static final Logger log = LoggerFactory.getLogger(ModelJsonReader.class);

    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * Parses a JSON document into a tree.
     *
     * @param json JSON text
     * @return synthetic root of the tree
     * @throws ModelIoException if the document is not valid JSON or misses required fields
     */
    public ModelNode read(String json) {
        Objects.requireNonNull(json, "json must not be null");
        JsonNode tree;
        try {
            tree = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ModelIoException("Invalid model JSON: " + e.getOriginalMessage(), e);
        }
        if (tree == null || !tree.isObject()) {
            throw new ModelIoException("Model JSON must be an object");
        }
        return ModelNode.root(readParts(tree));
    }

    /**
     * Reads a JSON model file.
     *
     * @param source JSON file
     * @return synthetic root of the tree
     */
    public ModelNode read(Path source) {
        Objects.requireNonNull(source, "source must not be null");
        try {
            String json = Files.readString(source, StandardCharsets.UTF_8);
            log.debug("Loaded model IR from {}", source);
            return read(json);
        } catch (IOException e) {
            throw new ModelIoException("Failed to read model IR: " + source, e);
        }
    }

    private List<ModelNode> readParts(JsonNode json) {
        JsonNode parts = json.get(FIELD_PARTS);
        if (parts == null || parts.isNull()) {
            return List.of();
        }
        if (!parts.isArray()) {
            throw new ModelIoException("'" + FIELD_PARTS + "' must be an array");
        }
        List<ModelNode> nodes = new ArrayList<>(parts.size());
        for (JsonNode part : parts) {
            nodes.add(readNode(part));
        }
        return nodes;
    }

    private ModelNode readNode(JsonNode json) {
        String name = text(json, FIELD_NAME);
        if (name == null) {
            throw new ModelIoException("Model element without '" + FIELD_NAME + "': " + json);
        }
        String type = text(json, FIELD_TYPE);
        return new ModelNode(
            type != null ? type : "",
            name,
            text(json, FIELD_ALIAS),
            text(json, FIELD_DESCRIPTION),
            readParts(json));
    }

    private static String text(JsonNode json, String field) {
        JsonNode value = json.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
