package br.com.analytics.pipeline.sales_crm_batch.reader;

import br.com.analytics.pipeline.sales_crm_batch.exception.UnsupportedSourceFormatException;
import br.com.analytics.pipeline.sales_crm_batch.model.DataTable;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads JSON sales files. Accepted layouts:
 * <ul>
 *   <li>an array of records, {@code [{"col": v, ...}, ...]};</li>
 *   <li>an object of columns keyed by row label, {@code {"col": {"0": v, ...}, ...}};</li>
 *   <li>either of the above double-encoded as the first string element of an array, which is
 *   how the sales export writes its files.</li>
 * </ul>
 */
public class JsonTableReader implements TableReader {

    private final ObjectMapper objectMapper;

    public JsonTableReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public DataTable read(Path path) throws IOException {
        JsonNode root = objectMapper.readTree(path.toFile());
        if (root != null && root.isArray() && root.size() > 0 && root.get(0).isTextual()) {
            root = objectMapper.readTree(root.get(0).asText());
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new UnsupportedSourceFormatException("Empty JSON document: " + path);
        }
        if (root.isArray()) {
            return fromRecords(path, root);
        }
        if (root.isObject()) {
            return fromColumns(path, root);
        }
        throw new UnsupportedSourceFormatException("Expected a JSON array or object in " + path);
    }

    private DataTable fromRecords(Path path, JsonNode records) {
        List<Map<String, Object>> rows = new ArrayList<>(records.size());
        for (JsonNode record : records) {
            if (!record.isObject()) {
                throw new UnsupportedSourceFormatException("Expected JSON records in " + path + ", found " + record.getNodeType());
            }
            Map<String, Object> row = new LinkedHashMap<>();
            for (Map.Entry<String, JsonNode> field : record.properties()) {
                row.put(field.getKey(), scalar(path, field.getValue()));
            }
            rows.add(row);
        }
        return DataTable.fromRows(rows);
    }

    private DataTable fromColumns(Path path, JsonNode columns) {
        Map<String, Map<String, Object>> rowsByLabel = new LinkedHashMap<>();
        for (Map.Entry<String, JsonNode> column : columns.properties()) {
            if (!column.getValue().isObject()) {
                throw new UnsupportedSourceFormatException("Column " + column.getKey() + " in " + path
                        + " is not an object of row labels");
            }
            for (Map.Entry<String, JsonNode> cell : column.getValue().properties()) {
                rowsByLabel.computeIfAbsent(cell.getKey(), label -> new LinkedHashMap<>())
                        .put(column.getKey(), scalar(path, cell.getValue()));
            }
        }
        return DataTable.fromRows(new ArrayList<>(rowsByLabel.values()));
    }

    private static Object scalar(Path path, JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        if (node.isIntegralNumber()) {
            return node.canConvertToLong() ? (Object) node.longValue() : node.bigIntegerValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        throw new UnsupportedSourceFormatException("Nested value " + node + " in " + path + " is not a scalar");
    }
}
