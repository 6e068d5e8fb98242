package br.com.analytics.pipeline.sales_crm_batch.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class DataTable {

    private final Map<String, List<Object>> columns;
    private final int rowCount;

    private DataTable(Map<String, List<Object>> columns, int rowCount) {
        this.columns = columns;
        this.rowCount = rowCount;
    }

    public static DataTable empty() {
        return new DataTable(Collections.emptyMap(), 0);
    }

    public static DataTable fromRows(List<? extends Map<String, ?>> rows) {
        Set<String> names = new LinkedHashSet<>();
        for (Map<String, ?> row : rows) {
            names.addAll(row.keySet());
        }
        Map<String, List<Object>> columns = new LinkedHashMap<>();
        for (String name : names) {
            List<Object> values = new ArrayList<>(rows.size());
            for (Map<String, ?> row : rows) {
                values.add(row.get(name));
            }
            columns.put(name, Collections.unmodifiableList(values));
        }
        return new DataTable(Collections.unmodifiableMap(columns), rows.size());
    }

    public static DataTable fromColumns(Map<String, ? extends List<?>> source) {
        Map<String, List<Object>> columns = new LinkedHashMap<>();
        int rowCount = -1;
        for (Map.Entry<String, ? extends List<?>> entry : source.entrySet()) {
            if (rowCount >= 0 && entry.getValue().size() != rowCount) {
                throw new IllegalArgumentException("Column " + entry.getKey() + " has "
                        + entry.getValue().size() + " values, expected " + rowCount);
            }
            rowCount = entry.getValue().size();
            columns.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<>(entry.getValue())));
        }
        return new DataTable(Collections.unmodifiableMap(columns), Math.max(rowCount, 0));
    }

    /**
     * Stacks tables vertically. Columns are the union of all inputs; a table lacking a column
     * contributes nulls for it.
     */
    public static DataTable concat(List<DataTable> tables) {
        Set<String> names = new LinkedHashSet<>();
        for (DataTable table : tables) {
            names.addAll(table.columnNames());
        }
        Map<String, List<Object>> columns = new LinkedHashMap<>();
        int rowCount = 0;
        for (DataTable table : tables) {
            rowCount += table.rowCount;
        }
        for (String name : names) {
            List<Object> values = new ArrayList<>(rowCount);
            for (DataTable table : tables) {
                if (table.hasColumn(name)) {
                    values.addAll(table.column(name));
                } else {
                    values.addAll(Collections.nCopies(table.rowCount, null));
                }
            }
            columns.put(name, Collections.unmodifiableList(values));
        }
        return new DataTable(Collections.unmodifiableMap(columns), rowCount);
    }

    public int rowCount() {
        return rowCount;
    }

    public List<String> columnNames() {
        return List.copyOf(columns.keySet());
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    public List<Object> column(String name) {
        List<Object> values = columns.get(name);
        if (values == null) {
            throw new IllegalArgumentException("No such column: " + name);
        }
        return values;
    }

    public DataTable withColumn(String name, List<?> values) {
        if (!columns.isEmpty() && values.size() != rowCount) {
            throw new IllegalArgumentException("Column " + name + " has " + values.size()
                    + " values, expected " + rowCount);
        }
        Map<String, List<Object>> copy = new LinkedHashMap<>(columns);
        copy.put(name, Collections.unmodifiableList(new ArrayList<>(values)));
        return new DataTable(Collections.unmodifiableMap(copy), values.size());
    }

    public Map<String, Object> row(int index) {
        if (index < 0 || index >= rowCount) {
            throw new IndexOutOfBoundsException("Row " + index + " of " + rowCount);
        }
        Map<String, Object> row = new LinkedHashMap<>();
        columns.forEach((name, values) -> row.put(name, values.get(index)));
        return row;
    }

    public List<Map<String, Object>> rows() {
        List<Map<String, Object>> rows = new ArrayList<>(rowCount);
        for (int i = 0; i < rowCount; i++) {
            rows.add(row(i));
        }
        return rows;
    }

    @Override
    public String toString() {
        return "DataTable" + columnNames() + "[" + rowCount + " rows]";
    }
}
