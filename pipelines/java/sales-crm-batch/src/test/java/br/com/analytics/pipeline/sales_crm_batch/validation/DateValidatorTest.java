package br.com.analytics.pipeline.sales_crm_batch.validation;

import br.com.analytics.pipeline.sales_crm_batch.exception.TypeCoercionException;
import br.com.analytics.pipeline.sales_crm_batch.model.ColumnType;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DateValidatorTest {

    private final DateValidator validator = new DateValidator();

    @Test
    void parsesIsoDatesAndTimestamps() {
        List<Object> dates = validator.validate("date", List.of(
                "2021-03-01",
                "2021-03-02T10:15:30",
                "2021-03-03 23:59:59",
                "2021-03-04T08:00:00Z",
                "2021-03-05T08:00:00.123+02:00"));

        assertThat(dates).containsExactly(
                LocalDate.of(2021, 3, 1),
                LocalDate.of(2021, 3, 2),
                LocalDate.of(2021, 3, 3),
                LocalDate.of(2021, 3, 4),
                LocalDate.of(2021, 3, 5));
    }

    @Test
    void parsesSlashSeparatedDates() {
        assertThat(validator.validate("date", List.of("2021/03/01", "03/15/2021")))
                .containsExactly(LocalDate.of(2021, 3, 1), LocalDate.of(2021, 3, 15));
    }

    @Test
    void readsNumbersAsEpochMillis() {
        long millis = LocalDate.of(2021, 1, 1).atStartOfDay().toInstant(ZoneOffset.UTC).toEpochMilli();

        assertThat(validator.validate("date", List.of(millis))).containsExactly(LocalDate.of(2021, 1, 1));
    }

    @Test
    void keepsJavaTimeValuesAndNulls() {
        List<Object> dates = validator.validate("date", Arrays.asList(
                LocalDate.of(2020, 5, 1), LocalDateTime.of(2020, 6, 1, 12, 0), null));

        assertThat(dates).containsExactly(LocalDate.of(2020, 5, 1), LocalDate.of(2020, 6, 1), null);
    }

    @Test
    void rejectsUnparseableDates() {
        assertThatThrownBy(() -> validator.validate("created_at", List.of("2021-01-01", "yesterday")))
                .isInstanceOfSatisfying(TypeCoercionException.class, e -> {
                    assertThat(e.getColumn()).isEqualTo("created_at");
                    assertThat(e.getValue()).isEqualTo("yesterday");
                    assertThat(e.getTargetType()).isEqualTo(ColumnType.DATE);
                });
        assertThatThrownBy(() -> validator.validate("date", List.of("2021-02-30")))
                .isInstanceOf(TypeCoercionException.class);
    }

    @Test
    void doesNotRemapValues() {
        List<Object> parsed = List.of(LocalDate.of(2021, 1, 1));

        assertThat(validator.mapValue("date", parsed)).isSameAs(parsed);
    }
}
