package br.com.analytics.pipeline.sales_crm_batch.reader;

import br.com.analytics.pipeline.sales_crm_batch.exception.UnsupportedSourceFormatException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public class SourceFileLocator {

    /**
     * Lists the regular files of a landing directory in name order. Every file must have the
     * given extension; a stray file fails the run rather than being skipped.
     */
    public List<Path> listFiles(Path directory, String extension) throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new UnsupportedSourceFormatException("Landing directory does not exist: " + directory);
        }
        List<Path> files;
        try (Stream<Path> entries = Files.list(directory)) {
            files = entries.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        }
        for (Path file : files) {
            requireExtension(file, extension);
        }
        return files;
    }

    public Path requireExtension(Path file, String extension) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (!name.endsWith(extension.toLowerCase(Locale.ROOT))) {
            throw new UnsupportedSourceFormatException("Expected a " + extension + " file: " + file);
        }
        return file;
    }
}
