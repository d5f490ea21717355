package org.ascenoria.content.decode;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.exc.StreamReadException;
import com.fasterxml.jackson.databind.DatabindException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.ascenoria.content.api.ContentParseException;
import org.ascenoria.content.api.ContentSchemaException;
import org.ascenoria.content.api.ContentSourceException;
import org.ascenoria.content.diagnostics.DiagnosticCode;
import org.ascenoria.content.model.CollectionType;
import org.ascenoria.content.model.ContentCollections;
import org.ascenoria.content.model.ContentRecord;
import org.ascenoria.content.model.EntityDefinition;
import org.ascenoria.content.model.TechnologyPrerequisite;
import org.ascenoria.content.model.VictoryRules;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Decodes a single content file. Stateless and independent of every other file.
 * <p>
 * A collection file is a table whose only key is the collection name, holding an array of
 * record tables. Syntax errors raise {@link ContentParseException}; structural errors raise
 * {@link ContentSchemaException}.
 */
public class FileDecoder {

    /**
     * Decodes the records of one collection file.
     *
     * @param file       The file, {@code .toml} or {@code .json}.
     * @param collection The collection the file belongs to.
     * @param <R>        The record type.
     * @return The records in file order.
     * @throws ContentSourceException if the file cannot be read, parsed or mapped.
     */
    public <R extends ContentRecord> List<R> decodeCollection(Path file, CollectionType<R, ?> collection)
            throws ContentSourceException {
        final ObjectMapper mapper = DataFormat.of(file).mapper();
        final JsonNode list = readSingleRoot(file, collection.name());
        if (list.isMissingNode()) {
            return List.of();
        }
        if (!list.isArray()) {
            throw new ContentSchemaException(file, "'" + collection.name() + "' must be an array of tables");
        }
        final List<R> records = new ArrayList<>(list.size());
        for (int i = 0; i < list.size(); i++) {
            final String position = collection.name() + "[" + i + "]";
            final R record;
            try {
                record = mapper.treeToValue(list.get(i), collection.recordType());
            } catch (JsonProcessingException | IllegalArgumentException e) {
                throw new ContentSchemaException(file, position + ": " + rootMessage(e), e);
            }
            checkKeys(file, position, record);
            records.add(record);
        }
        return records;
    }

    /**
     * Decodes a victory rules file.
     *
     * @param file The file.
     * @return The rules, or {@code null} if the file holds no {@code victory_rules} table.
     * @throws ContentSourceException if the file cannot be read, parsed or mapped.
     */
    public VictoryRules decodeVictoryRules(Path file) throws ContentSourceException {
        final JsonNode table = readSingleRoot(file, ContentCollections.VICTORY_RULES_KEY);
        if (table.isMissingNode()) {
            return null;
        }
        try {
            return DataFormat.of(file).mapper().treeToValue(table, VictoryRules.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ContentSchemaException(file, ContentCollections.VICTORY_RULES_KEY + ": " + rootMessage(e), e);
        }
    }

    /**
     * Decodes a small standalone document such as a manifest or mod descriptor.
     *
     * @param file The file.
     * @param type The target type.
     * @param <T>  The target type.
     * @return The mapped value.
     * @throws ContentSourceException if the file cannot be read, parsed or mapped.
     */
    public <T> T decodeDocument(Path file, Class<T> type) throws ContentSourceException {
        try {
            return DataFormat.of(file).mapper().readValue(file.toFile(), type);
        } catch (StreamReadException e) {
            throw new ContentParseException(file, rootMessage(e), e);
        } catch (DatabindException e) {
            throw new ContentSchemaException(file, rootMessage(e), e);
        } catch (IOException e) {
            throw new ContentSourceException(DiagnosticCode.IO_ERROR, file, e.getMessage(), e);
        }
    }

    private JsonNode readSingleRoot(Path file, String rootKey) throws ContentSourceException {
        final JsonNode root;
        try {
            root = DataFormat.of(file).mapper().readTree(file.toFile());
        } catch (JsonProcessingException e) {
            throw new ContentParseException(file, rootMessage(e), e);
        } catch (IOException e) {
            throw new ContentSourceException(DiagnosticCode.IO_ERROR, file, e.getMessage(), e);
        }
        if (root == null || root.isMissingNode()) {
            return MissingNode.getInstance();
        }
        if (!root.isObject()) {
            throw new ContentSchemaException(file, "root must be a table");
        }
        final Iterator<String> names = root.fieldNames();
        while (names.hasNext()) {
            final String name = names.next();
            if (!name.equals(rootKey)) {
                throw new ContentSchemaException(file, "unknown top-level key '" + name + "', expected '" + rootKey + "'");
            }
        }
        return root.path(rootKey);
    }

    private static void checkKeys(Path file, String position, ContentRecord record) throws ContentSchemaException {
        if (record instanceof EntityDefinition entity) {
            if (entity.id() == null || entity.id().isBlank()) {
                throw new ContentSchemaException(file, position + ": 'id' must not be blank");
            }
        } else if (record instanceof TechnologyPrerequisite edge) {
            if (edge.from() == null || edge.from().isBlank() || edge.to() == null || edge.to().isBlank()) {
                throw new ContentSchemaException(file, position + ": 'from' and 'to' must not be blank");
            }
        }
    }

    private static String rootMessage(Exception e) {
        if (e instanceof JsonProcessingException jpe) {
            return jpe.getOriginalMessage();
        }
        Throwable t = e;
        while (t.getCause() != null) {
            t = t.getCause();
        }
        return t.getMessage();
    }
}
