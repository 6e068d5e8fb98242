package br.com.analytics.pipeline.sales_crm_batch.processor;

import br.com.analytics.pipeline.sales_crm_batch.exception.PipelineException;
import br.com.analytics.pipeline.sales_crm_batch.model.DataTable;
import br.com.analytics.pipeline.sales_crm_batch.model.MonthlySeries;
import br.com.analytics.pipeline.sales_crm_batch.model.WindowSpec;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MarketEventProcessorTest {

    private static final LocalDate JAN = LocalDate.of(2021, 1, 1);
    private static final LocalDate FEB = LocalDate.of(2021, 2, 1);
    private static final LocalDate MAR = LocalDate.of(2021, 3, 1);

    private final List<Map<String, Object>> rows = new ArrayList<>();

    private void event(LocalDate date, String type) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("acct_id", "A" + rows.size());
        row.put("event_type", type);
        row.put("date", date);
        rows.add(row);
    }

    private void events(LocalDate date, String type, int count) {
        for (int i = 0; i < count; i++) {
            event(date, type);
        }
    }

    @Test
    void countsEventsPerTypeAndMonth() {
        event(LocalDate.of(2021, 1, 4), "f2f");
        event(LocalDate.of(2021, 1, 28), "f2f");
        event(LocalDate.of(2021, 1, 15), "group call");

        MonthlySeries series = new MarketEventProcessor(List.of(), 2).process(DataTable.fromRows(rows));

        assertThat(series.index()).containsExactly(JAN);
        assertThat(series.columnNames()).containsExactly("f2f", "group_call", "event_count");
        assertThat(series.value("f2f", JAN)).isEqualTo(2L);
        assertThat(series.value("group_call", JAN)).isEqualTo(1L);
        assertThat(series.value(MarketEventProcessor.EVENT_COUNT, JAN)).isEqualTo(3L);
    }

    @Test
    void typeNamedLikeTheTotalColumnFails() {
        event(JAN, "event count");
        event(JAN, "f2f");

        assertThatThrownBy(() -> new MarketEventProcessor(List.of(), 2).process(DataTable.fromRows(rows)))
                .isInstanceOf(PipelineException.class)
                .hasMessageContaining("event count");
    }

    @Test
    void typesSharingAColumnNameFail() {
        event(JAN, "group call");
        event(FEB, "group_call");

        assertThatThrownBy(() -> new MarketEventProcessor(List.of(), 2).process(DataTable.fromRows(rows)))
                .isInstanceOf(PipelineException.class)
                .hasMessageContaining("'group call'")
                .hasMessageContaining("'group_call'");
    }

    @Test
    void missingTypeMonthCombinationsCountZero() {
        event(JAN, "workplace event");
        event(FEB, "f2f");

        MonthlySeries series = new MarketEventProcessor(List.of(), 2).process(DataTable.fromRows(rows));

        assertThat(series.columnNames()).containsExactly("f2f", "workplace_event", "event_count");
        assertThat(series.column("f2f")).containsExactly(0L, 1L);
        assertThat(series.column("workplace_event")).containsExactly(1L, 0L);
        assertThat(series.column("event_count")).containsExactly(1L, 1L);
    }

    @Test
    void monthsWithoutEventsAreNotFilled() {
        event(JAN, "f2f");
        event(MAR, "f2f");

        MonthlySeries series = new MarketEventProcessor(List.of(), 2).process(DataTable.fromRows(rows));

        assertThat(series.index()).containsExactly(JAN, MAR);
    }

    @Test
    void addsPlainThenWeightedTrailingAverages() {
        events(JAN, "f2f", 10);
        events(FEB, "f2f", 20);
        events(MAR, "group call", 40);
        List<WindowSpec> windows = List.of(
                new WindowSpec(2, List.of(0.3, 0.7)),
                new WindowSpec(3, List.of(0.25, 0.25, 0.5)));

        MonthlySeries series = new MarketEventProcessor(windows, 2).process(DataTable.fromRows(rows));

        assertThat(series.columnNames()).containsExactly(
                "f2f", "group_call", "event_count",
                "lagged_1_month_sum_events", "lagged_2_month_sum_events",
                "lagged_1_month_weighted_sum_events", "lagged_2_month_weighted_sum_events");
        assertThat(series.column("event_count")).containsExactly(10L, 20L, 40L);
        assertThat(series.column("lagged_1_month_sum_events")).containsExactly(null, 15.0, 30.0);
        assertThat(series.column("lagged_2_month_sum_events")).containsExactly(null, null, 23.33);
        assertThat(series.column("lagged_1_month_weighted_sum_events")).containsExactly(null, 17.0, 34.0);
        assertThat(series.column("lagged_2_month_weighted_sum_events")).containsExactly(null, null, 27.5);
    }

    @Test
    void unweightedWindowsGetNoWeightedColumn() {
        events(JAN, "f2f", 2);
        events(FEB, "f2f", 4);

        MonthlySeries series = new MarketEventProcessor(List.of(WindowSpec.unweighted(2)), 2)
                .process(DataTable.fromRows(rows));

        assertThat(series.columnNames()).containsExactly("f2f", "event_count", "lagged_1_month_sum_events");
        assertThat(series.column("lagged_1_month_sum_events")).containsExactly(null, 3.0);
    }

    @Test
    void uniformWeightsEqualThePlainAverage() {
        events(JAN, "f2f", 3);
        events(FEB, "f2f", 8);
        events(MAR, "f2f", 4);

        MonthlySeries series = new MarketEventProcessor(List.of(new WindowSpec(3, List.of(1.0, 1.0, 1.0))), 2)
                .process(DataTable.fromRows(rows));

        assertThat(series.column("lagged_2_month_weighted_sum_events"))
                .isEqualTo(series.column("lagged_2_month_sum_events"));
    }
}
