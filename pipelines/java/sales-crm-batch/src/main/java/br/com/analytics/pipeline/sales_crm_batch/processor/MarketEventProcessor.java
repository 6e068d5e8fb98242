package br.com.analytics.pipeline.sales_crm_batch.processor;

import br.com.analytics.pipeline.sales_crm_batch.exception.PipelineException;
import br.com.analytics.pipeline.sales_crm_batch.model.DataTable;
import br.com.analytics.pipeline.sales_crm_batch.model.MonthlySeries;
import br.com.analytics.pipeline.sales_crm_batch.model.WindowSpec;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

public class MarketEventProcessor extends AbstractSeriesProcessor {

    public static final String EVENT_COUNT = "event_count";

    static final String DATE = "date";
    static final String EVENT_TYPE = "event_type";

    public MarketEventProcessor(List<WindowSpec> windows, int decimalDigits) {
        super(windows, decimalDigits);
    }

    @Override
    public MonthlySeries process(DataTable events) {
        List<Object> dates = events.column(DATE);
        List<Object> types = events.column(EVENT_TYPE);

        Map<LocalDate, Map<String, Long>> countsByMonth = new TreeMap<>();
        SortedSet<String> eventTypes = new TreeSet<>();
        for (int i = 0; i < events.rowCount(); i++) {
            if (dates.get(i) == null || types.get(i) == null) {
                continue;
            }
            String type = String.valueOf(types.get(i));
            eventTypes.add(type);
            countsByMonth.computeIfAbsent(eventMonth((LocalDate) dates.get(i)), month -> new HashMap<>())
                    .merge(type, 1L, Long::sum);
        }

        Map<String, String> typeByColumn = new HashMap<>();
        for (String type : eventTypes) {
            String column = columnName(type);
            if (EVENT_COUNT.equals(column)) {
                throw new PipelineException("Event type '" + type + "' clashes with the " + EVENT_COUNT + " column");
            }
            String other = typeByColumn.putIfAbsent(column, type);
            if (other != null) {
                throw new PipelineException("Event types '" + other + "' and '" + type
                        + "' both map to column " + column);
            }
        }

        List<LocalDate> months = new ArrayList<>(countsByMonth.keySet());
        MonthlySeries series = MonthlySeries.indexedBy(months);
        for (String type : eventTypes) {
            List<Long> counts = new ArrayList<>(months.size());
            for (LocalDate month : months) {
                counts.add(countsByMonth.get(month).getOrDefault(type, 0L));
            }
            series = series.withColumn(columnName(type), counts);
        }

        List<Long> totals = new ArrayList<>(months.size());
        for (LocalDate month : months) {
            totals.add(countsByMonth.get(month).values().stream().mapToLong(Long::longValue).sum());
        }
        series = series.withColumn(EVENT_COUNT, totals);

        for (WindowSpec window : windows) {
            series = series.withColumn(laggedName(window, "sum_events"),
                    RollingWindows.movingAverage(totals, window.size(), decimalDigits));
        }
        for (WindowSpec window : windows) {
            if (window.isWeighted()) {
                series = series.withColumn(laggedName(window, "weighted_sum_events"),
                        RollingWindows.weightedMovingAverage(totals, window.weights(), decimalDigits));
            }
        }
        return series;
    }

    static LocalDate eventMonth(LocalDate date) {
        return date.withDayOfMonth(1);
    }

    static String columnName(String eventType) {
        return eventType.replace(' ', '_');
    }
}
