package br.com.analytics.pipeline.sales_crm_batch.validation;

import br.com.analytics.pipeline.sales_crm_batch.exception.TypeCoercionException;
import br.com.analytics.pipeline.sales_crm_batch.model.ColumnType;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;

public final class DateValidator implements ColumnValidator {

    private static final DateTimeFormatter DATE_FORMAT = new DateTimeFormatterBuilder()
            .appendOptional(DateTimeFormatter.ISO_OFFSET_DATE_TIME)
            .appendOptional(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
            .appendOptional(DateTimeFormatter.ISO_LOCAL_DATE)
            .appendOptional(DateTimeFormatter.ofPattern("uuuu/MM/dd"))
            .appendOptional(DateTimeFormatter.ofPattern("MM/dd/uuuu"))
            .toFormatter()
            .withResolverStyle(ResolverStyle.STRICT);

    @Override
    public List<Object> transformType(String column, List<?> values) {
        List<Object> dates = new ArrayList<>(values.size());
        for (Object value : values) {
            dates.add(value == null ? null : toDate(column, value));
        }
        return dates;
    }

    private static LocalDate toDate(String column, Object value) {
        if (value instanceof LocalDate) {
            return (LocalDate) value;
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).toLocalDate();
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toLocalDate();
        }
        if (value instanceof ZonedDateTime) {
            return ((ZonedDateTime) value).toLocalDate();
        }
        if (value instanceof Instant) {
            return LocalDate.ofInstant((Instant) value, ZoneOffset.UTC);
        }
        if (value instanceof Number) {
            try {
                long epochMillis = new BigDecimal(value.toString()).longValueExact();
                return LocalDate.ofInstant(Instant.ofEpochMilli(epochMillis), ZoneOffset.UTC);
            } catch (ArithmeticException | NumberFormatException e) {
                throw new TypeCoercionException(column, value, ColumnType.DATE);
            }
        }
        if (value instanceof String) {
            String text = ((String) value).trim();
            if (text.length() > 10 && text.charAt(10) == ' ') {
                text = text.substring(0, 10) + 'T' + text.substring(11);
            }
            try {
                return LocalDate.parse(text, DATE_FORMAT);
            } catch (DateTimeParseException e) {
                throw new TypeCoercionException(column, value, ColumnType.DATE);
            }
        }
        throw new TypeCoercionException(column, value, ColumnType.DATE);
    }
}
