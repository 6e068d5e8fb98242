package br.com.analytics.pipeline.sales_crm_batch.schema;

import br.com.analytics.pipeline.sales_crm_batch.exception.SchemaLoadException;
import br.com.analytics.pipeline.sales_crm_batch.model.ColumnSpec;
import br.com.analytics.pipeline.sales_crm_batch.model.ColumnType;
import br.com.analytics.pipeline.sales_crm_batch.model.DataSchema;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Schemas read from one JSON document keyed by source name:
 * <pre>
 * {
 *   "sales": {
 *     "product_name": {
 *       "type": "text",
 *       "choices": ["Globberin", "Snaffleflax"],
 *       "value_mapping": {"Globberin": ["Globbrin", " Globberin"]}
 *     },
 *     "date": {"type": "date"}
 *   }
 * }
 * </pre>
 * The document is parsed on first access and kept for the lifetime of the source.
 */
public class JsonSchemaSource implements SchemaSource {

    private static final String KEY_TYPE = "type";
    private static final String KEY_CHOICES = "choices";
    private static final String KEY_VALUE_MAPPING = "value_mapping";

    private final Resource location;
    private final ObjectMapper objectMapper;
    private final Map<String, DataSchema> schemas = new LinkedHashMap<>();
    private JsonNode document;

    public JsonSchemaSource(Resource location, ObjectMapper objectMapper) {
        this.location = location;
        this.objectMapper = objectMapper;
    }

    @Override
    public DataSchema schema(String sourceName) {
        return schemas.computeIfAbsent(sourceName, this::parseSchema);
    }

    private DataSchema parseSchema(String sourceName) {
        JsonNode columns = document().get(sourceName);
        if (columns == null || !columns.isObject()) {
            throw new SchemaLoadException("No schema for source '" + sourceName + "' in " + location);
        }
        Map<String, ColumnSpec> specs = new LinkedHashMap<>();
        for (Map.Entry<String, JsonNode> column : columns.properties()) {
            specs.put(column.getKey(), parseColumn(sourceName, column.getKey(), column.getValue()));
        }
        return new DataSchema(sourceName, specs);
    }

    private ColumnSpec parseColumn(String sourceName, String column, JsonNode node) {
        JsonNode type = node.get(KEY_TYPE);
        if (type == null || !type.isTextual()) {
            throw new SchemaLoadException("Column '" + column + "' of source '" + sourceName + "' has no type");
        }
        Map<String, List<String>> valueMapping = null;
        JsonNode mappingNode = node.get(KEY_VALUE_MAPPING);
        if (mappingNode != null && !mappingNode.isNull()) {
            valueMapping = new LinkedHashMap<>();
            for (Map.Entry<String, JsonNode> canonical : mappingNode.properties()) {
                valueMapping.put(canonical.getKey(), texts(canonical.getValue()));
            }
        }
        JsonNode choicesNode = node.get(KEY_CHOICES);
        List<String> choices = choicesNode == null || choicesNode.isNull() ? null : texts(choicesNode);
        return new ColumnSpec(ColumnType.fromName(type.asText()), valueMapping, choices);
    }

    private static List<String> texts(JsonNode array) {
        List<String> values = new ArrayList<>(array.size());
        for (JsonNode element : array) {
            values.add(element.asText());
        }
        return values;
    }

    private JsonNode document() {
        if (document == null) {
            try (InputStream in = location.getInputStream()) {
                document = objectMapper.readTree(in);
            } catch (IOException e) {
                throw new SchemaLoadException("Cannot read schema document " + location, e);
            }
            if (document == null || !document.isObject()) {
                throw new SchemaLoadException("Schema document " + location + " is not a JSON object");
            }
        }
        return document;
    }
}
