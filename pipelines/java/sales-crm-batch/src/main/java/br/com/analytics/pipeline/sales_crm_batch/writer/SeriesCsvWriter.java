package br.com.analytics.pipeline.sales_crm_batch.writer;

import br.com.analytics.pipeline.sales_crm_batch.model.MonthlySeries;
import org.springframework.batch.infrastructure.item.Chunk;
import org.springframework.batch.infrastructure.item.ExecutionContext;
import org.springframework.batch.infrastructure.item.file.FlatFileItemWriter;
import org.springframework.batch.infrastructure.item.file.builder.FlatFileItemWriterBuilder;
import org.springframework.core.io.FileSystemResource;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class SeriesCsvWriter {

    static final String DATE_COLUMN = "date";
    private static final String DELIMITER = ",";

    private final int decimalDigits;

    public SeriesCsvWriter(int decimalDigits) {
        this.decimalDigits = decimalDigits;
    }

    public void write(MonthlySeries series, Path output) throws Exception {
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        FlatFileItemWriter<List<String>> delegateWriter = createDelegateWriter(header(series), output);
        delegateWriter.open(new ExecutionContext());
        try {
            delegateWriter.write(new Chunk<>(rows(series)));
        } finally {
            delegateWriter.close();
        }
    }

    private FlatFileItemWriter<List<String>> createDelegateWriter(String header, Path output) {
        return new FlatFileItemWriterBuilder<List<String>>()
                .name("seriesCsvWriter")
                .resource(new FileSystemResource(output))
                .encoding("UTF-8")
                .lineSeparator("\n")
                .headerCallback(writer -> writer.write(header))
                .lineAggregator(row -> String.join(DELIMITER, row))
                .shouldDeleteIfExists(true)
                .transactional(false)
                .build();
    }

    String header(MonthlySeries series) {
        List<String> names = new ArrayList<>();
        names.add("");
        names.add(DATE_COLUMN);
        names.addAll(series.columnNames());
        return String.join(DELIMITER, names);
    }

    List<List<String>> rows(MonthlySeries series) {
        List<String> columns = series.columnNames();
        Map<String, Boolean> wholeCounts = new HashMap<>();
        for (String column : columns) {
            wholeCounts.put(column, isWholeCountColumn(series.column(column)));
        }
        List<List<String>> rows = new ArrayList<>(series.size());
        for (int i = 0; i < series.size(); i++) {
            List<String> row = new ArrayList<>(columns.size() + 2);
            row.add(String.valueOf(i));
            row.add(formatDate(series.index().get(i)));
            for (String column : columns) {
                Number value = series.column(column).get(i);
                if (value != null && !wholeCounts.get(column)) {
                    value = value.doubleValue();
                }
                row.add(formatNumber(value));
            }
            rows.add(row);
        }
        return rows;
    }

    // a count column with an undefined cell is written as decimals
    private static boolean isWholeCountColumn(List<Number> values) {
        for (Number value : values) {
            if (!isIntegral(value)) {
                return false;
            }
        }
        return true;
    }

    private static boolean isIntegral(Number value) {
        return value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte;
    }

    private static String formatDate(LocalDate date) {
        return DateTimeFormatter.ISO_LOCAL_DATE.format(date);
    }

    String formatNumber(Number value) {
        if (value == null) {
            return "";
        }
        if (isIntegral(value)) {
            return value.toString();
        }
        double number = value.doubleValue();
        if (Double.isNaN(number) || Double.isInfinite(number)) {
            return "";
        }
        String plain = BigDecimal.valueOf(number)
                .setScale(decimalDigits, RoundingMode.HALF_EVEN)
                .stripTrailingZeros()
                .toPlainString();
        return plain.indexOf('.') < 0 ? plain + ".0" : plain;
    }
}
