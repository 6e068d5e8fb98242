package br.com.analytics.pipeline.sales_crm_batch.config;

import br.com.analytics.pipeline.sales_crm_batch.model.WindowSpec;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.util.List;

@ConfigurationProperties(prefix = "pipeline")
public record PipelineProperties(
        String name,
        String salesDataPath,
        String crmDataPath,
        String outputPath,
        String schemaLocation,
        Integer decimalDigits,
        String trackedProduct,
        List<WindowSpec> salesWindows,
        List<WindowSpec> crmWindows
) {

    public static final String DEFAULT_NAME = "sales_crm";
    public static final int DEFAULT_DECIMAL_DIGITS = 2;
    public static final String DEFAULT_TRACKED_PRODUCT = "Snaffleflax";
    public static final String DEFAULT_SCHEMA_LOCATION = "classpath:schemas.json";

    public PipelineProperties {
        name = name == null ? DEFAULT_NAME : name;
        schemaLocation = schemaLocation == null ? DEFAULT_SCHEMA_LOCATION : schemaLocation;
        decimalDigits = decimalDigits == null ? DEFAULT_DECIMAL_DIGITS : decimalDigits;
        trackedProduct = trackedProduct == null ? DEFAULT_TRACKED_PRODUCT : trackedProduct;
        salesWindows = salesWindows == null
                ? List.of(WindowSpec.unweighted(2), WindowSpec.unweighted(3))
                : List.copyOf(salesWindows);
        crmWindows = crmWindows == null
                ? List.of(new WindowSpec(2, List.of(0.3, 0.7)), new WindowSpec(3, List.of(0.25, 0.25, 0.5)))
                : List.copyOf(crmWindows);
    }

    public Path salesDirectory() {
        return Path.of(salesDataPath);
    }

    public Path crmFile() {
        return Path.of(crmDataPath);
    }

    public Path outputFile() {
        return Path.of(outputPath);
    }
}
