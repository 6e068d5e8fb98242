package br.com.analytics.pipeline.sales_crm_batch.reader;

import br.com.analytics.pipeline.sales_crm_batch.exception.UnsupportedSourceFormatException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SourceFileLocatorTest {

    private final SourceFileLocator locator = new SourceFileLocator();

    @TempDir
    Path tempDir;

    @Test
    void listsFilesInNameOrder() throws IOException {
        Files.writeString(tempDir.resolve("sales_2021_02.json"), "[]");
        Files.writeString(tempDir.resolve("sales_2021_01.JSON"), "[]");
        Files.createDirectory(tempDir.resolve("archive"));

        assertThat(locator.listFiles(tempDir, ".json"))
                .extracting(path -> path.getFileName().toString())
                .containsExactly("sales_2021_01.JSON", "sales_2021_02.json");
    }

    @Test
    void strayFileFailsTheListing() throws IOException {
        Files.writeString(tempDir.resolve("sales.json"), "[]");
        Files.writeString(tempDir.resolve("notes.txt"), "");

        assertThatThrownBy(() -> locator.listFiles(tempDir, ".json"))
                .isInstanceOf(UnsupportedSourceFormatException.class)
                .hasMessageContaining("notes.txt");
    }

    @Test
    void missingDirectoryFails() {
        assertThatThrownBy(() -> locator.listFiles(tempDir.resolve("absent"), ".json"))
                .isInstanceOf(UnsupportedSourceFormatException.class);
    }

    @Test
    void requiresTheExpectedExtension() {
        assertThat(locator.requireExtension(Path.of("crm_data.csv"), ".csv")).isEqualTo(Path.of("crm_data.csv"));
        assertThatThrownBy(() -> locator.requireExtension(Path.of("crm_data.xlsx"), ".csv"))
                .isInstanceOf(UnsupportedSourceFormatException.class);
    }
}
