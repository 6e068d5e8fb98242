package br.com.analytics.pipeline.sales_crm_batch.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

public final class MonthlySeries {

    private final List<LocalDate> index;
    private final Map<String, List<Number>> columns;

    private MonthlySeries(List<LocalDate> index, Map<String, List<Number>> columns) {
        this.index = index;
        this.columns = columns;
    }

    public static MonthlySeries indexedBy(List<LocalDate> index) {
        for (int i = 1; i < index.size(); i++) {
            if (!index.get(i - 1).isBefore(index.get(i))) {
                throw new IllegalArgumentException("Index must be strictly ascending at position " + i
                        + ": " + index.get(i - 1) + " then " + index.get(i));
            }
        }
        return new MonthlySeries(List.copyOf(index), Collections.emptyMap());
    }

    public MonthlySeries withColumn(String name, List<? extends Number> values) {
        if (columns.containsKey(name)) {
            throw new IllegalArgumentException("Series already has a column " + name);
        }
        if (values.size() != index.size()) {
            throw new IllegalArgumentException("Column " + name + " has " + values.size()
                    + " values for an index of " + index.size());
        }
        Map<String, List<Number>> copy = new LinkedHashMap<>(columns);
        copy.put(name, Collections.unmodifiableList(new ArrayList<>(values)));
        return new MonthlySeries(index, Collections.unmodifiableMap(copy));
    }

    public List<LocalDate> index() {
        return index;
    }

    public int size() {
        return index.size();
    }

    public List<String> columnNames() {
        return List.copyOf(columns.keySet());
    }

    public List<Number> column(String name) {
        List<Number> values = columns.get(name);
        if (values == null) {
            throw new IllegalArgumentException("No such column: " + name);
        }
        return values;
    }

    public Number value(String column, LocalDate date) {
        int position = index.indexOf(date);
        if (position < 0) {
            throw new IllegalArgumentException("Date not in index: " + date);
        }
        return column(column).get(position);
    }

    /**
     * Full outer join on the date index. The result holds this series' columns followed by the
     * other's; dates present on one side only get null cells on the other.
     */
    public MonthlySeries outerJoin(MonthlySeries other) {
        for (String name : other.columns.keySet()) {
            if (columns.containsKey(name)) {
                throw new IllegalArgumentException("Both series define column " + name);
            }
        }
        TreeSet<LocalDate> dates = new TreeSet<>(index);
        dates.addAll(other.index);
        MonthlySeries joined = indexedBy(new ArrayList<>(dates));
        for (String name : columns.keySet()) {
            joined = joined.withColumn(name, joined.align(this, name));
        }
        for (String name : other.columns.keySet()) {
            joined = joined.withColumn(name, joined.align(other, name));
        }
        return joined;
    }

    private List<Number> align(MonthlySeries source, String name) {
        Map<LocalDate, Number> byDate = new LinkedHashMap<>();
        List<Number> values = source.column(name);
        for (int i = 0; i < source.index.size(); i++) {
            byDate.put(source.index.get(i), values.get(i));
        }
        List<Number> aligned = new ArrayList<>(index.size());
        for (LocalDate date : index) {
            aligned.add(byDate.get(date));
        }
        return aligned;
    }

    @Override
    public String toString() {
        return "MonthlySeries" + columnNames() + "[" + index.size() + " dates]";
    }
}
