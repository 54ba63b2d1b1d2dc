package com.sysdiagram.core.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sysdiagram.core.model.ModelNode;

/**
 * Serializes the model tree as nested JSON records.
 *
 * <p>Output shape:
 * <pre>{@code
 * {
 *   "name" : null,
 *   "parts" : [ {
 *     "type" : "Package",
 *     "name" : "DroneFunctions",
 *     "parts" : [ {
 *       "type" : "LogicalFunction",
 *       "name" : "Sense",
 *       "alias" : "S",
 *       "description" : "Detect obstacles",
 *       "parts" : [ ]
 *     } ]
 *   } ]
 * }
 * }</pre>
 *
 * <p>{@code alias} and {@code description} are omitted when absent; {@code parts} is
 * written for scope-bearing kinds and for any node that has children.
 */
public class ModelJsonWriter {

    private static final Logger log = LoggerFactory.getLogger(ModelJsonWriter.class);

    static final String FIELD_NAME = "name";
    static final String FIELD_TYPE = "type";
    static final String FIELD_ALIAS = "alias";
    static final String FIELD_DESCRIPTION = "description";
    static final String FIELD_PARTS = "parts";

    private final ObjectMapper mapper = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Serializes a tree to a JSON string.
     *
     * @param root synthetic root of the tree
     * @return pretty-printed JSON
     */
    public String write(ModelNode root) {
        Objects.requireNonNull(root, "root must not be null");
        try {
            return mapper.writeValueAsString(toJson(root));
        } catch (JsonProcessingException e) {
            throw new ModelIoException("Failed to serialize model", e);
        }
    }

    /**
     * Serializes a tree to a UTF-8 file, creating parent directories.
     *
     * @param root synthetic root of the tree
     * @param target output file
     */
    public void write(ModelNode root, Path target) {
        Objects.requireNonNull(target, "target must not be null");
        String json = write(root);
        try {
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, json, StandardCharsets.UTF_8);
            log.info("Wrote model IR to {}", target);
        } catch (IOException e) {
            throw new ModelIoException("Failed to write model IR: " + target, e);
        }
    }

    private ObjectNode toJson(ModelNode node) {
        ObjectNode json = mapper.createObjectNode();
        if (node.isRoot()) {
            json.putNull(FIELD_NAME);
        } else {
            json.put(FIELD_TYPE, node.type());
            json.put(FIELD_NAME, node.name());
            if (node.alias() != null) {
                json.put(FIELD_ALIAS, node.alias());
            }
            if (node.description() != null) {
                json.put(FIELD_DESCRIPTION, node.description());
            }
        }

        if (node.kind().isScope() || node.hasChildren()) {
            ArrayNode parts = json.putArray(FIELD_PARTS);
            for (ModelNode child : node.children()) {
                parts.add(toJson(child));
            }
        }
        return json;
    }
}
