package br.com.analytics.pipeline.sales_crm_batch.reader;

import br.com.analytics.pipeline.sales_crm_batch.exception.UnsupportedSourceFormatException;
import br.com.analytics.pipeline.sales_crm_batch.model.DataTable;
import org.springframework.batch.infrastructure.item.ExecutionContext;
import org.springframework.batch.infrastructure.item.file.FlatFileItemReader;
import org.springframework.batch.infrastructure.item.file.builder.FlatFileItemReaderBuilder;
import org.springframework.batch.infrastructure.item.file.separator.DefaultRecordSeparatorPolicy;
import org.springframework.batch.infrastructure.item.file.transform.DelimitedLineTokenizer;
import org.springframework.core.io.FileSystemResource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class CsvTableReader implements TableReader {

    private final DelimitedLineTokenizer tokenizer = new DelimitedLineTokenizer();

    @Override
    public DataTable read(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new NoSuchFileException(path.toString());
        }
        List<String> header = new ArrayList<>(1);
        List<CsvRecord> records = new ArrayList<>();

        FlatFileItemReader<CsvRecord> delegateReader = createDelegateReader(path, header);
        delegateReader.open(new ExecutionContext());
        try {
            CsvRecord record;
            while ((record = delegateReader.read()) != null) {
                if (record.values().length > 0) {
                    records.add(record);
                }
            }
        } catch (Exception e) {
            throw new UnsupportedSourceFormatException("Cannot parse " + path + ": " + e.getMessage(), e);
        } finally {
            delegateReader.close();
        }

        if (header.isEmpty()) {
            throw new UnsupportedSourceFormatException("CSV file has no header: " + path);
        }
        String[] names = tokenizer.tokenize(stripBom(header.get(0))).getValues();

        if (records.isEmpty()) {
            Map<String, List<Object>> columns = new LinkedHashMap<>();
            for (String name : names) {
                columns.put(name, List.of());
            }
            return DataTable.fromColumns(columns);
        }

        List<Map<String, Object>> rows = new ArrayList<>(records.size());
        for (CsvRecord record : records) {
            String[] values = record.values();
            if (values.length != names.length) {
                throw new UnsupportedSourceFormatException("Line " + record.lineNumber() + " of " + path + " has "
                        + values.length + " fields, header has " + names.length);
            }
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 0; i < names.length; i++) {
                row.put(names[i], values[i].isEmpty() ? null : values[i]);
            }
            rows.add(row);
        }
        return DataTable.fromRows(rows);
    }

    private FlatFileItemReader<CsvRecord> createDelegateReader(Path path, List<String> header) {
        return new FlatFileItemReaderBuilder<CsvRecord>()
                .name("csvTableReader")
                .saveState(false)
                .resource(new FileSystemResource(path))
                .encoding("UTF-8")
                .linesToSkip(1)
                .skippedLinesCallback(line -> {
                    if (line != null) {
                        header.add(line);
                    }
                })
                .recordSeparatorPolicy(new DefaultRecordSeparatorPolicy())
                .lineMapper((line, lineNumber) -> line.isBlank()
                        ? new CsvRecord(lineNumber, new String[0])
                        : new CsvRecord(lineNumber, tokenizer.tokenize(line).getValues()))
                .build();
    }

    private static String stripBom(String line) {
        return !line.isEmpty() && line.charAt(0) == '\uFEFF' ? line.substring(1) : line;
    }

    private record CsvRecord(int lineNumber, String[] values) {
    }
}
