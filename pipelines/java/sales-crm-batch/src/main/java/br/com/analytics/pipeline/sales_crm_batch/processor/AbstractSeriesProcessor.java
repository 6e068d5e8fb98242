package br.com.analytics.pipeline.sales_crm_batch.processor;

import br.com.analytics.pipeline.sales_crm_batch.model.DataTable;
import br.com.analytics.pipeline.sales_crm_batch.model.MonthlySeries;
import br.com.analytics.pipeline.sales_crm_batch.model.WindowSpec;
import org.springframework.batch.infrastructure.item.ItemProcessor;

import java.util.List;

public abstract class AbstractSeriesProcessor implements ItemProcessor<DataTable, MonthlySeries> {

    protected final List<WindowSpec> windows;
    protected final int decimalDigits;

    protected AbstractSeriesProcessor(List<WindowSpec> windows, int decimalDigits) {
        if (decimalDigits < 0) {
            throw new IllegalArgumentException("Decimal digits must not be negative: " + decimalDigits);
        }
        this.windows = List.copyOf(windows);
        this.decimalDigits = decimalDigits;
    }

    @Override
    public abstract MonthlySeries process(DataTable table);

    /**
     * Windows count periods, so a window of size 3 is the current month plus a lag of 2.
     */
    protected static String laggedName(WindowSpec window, String suffix) {
        return "lagged_" + (window.size() - 1) + "_month_" + suffix;
    }

    protected double round(double value) {
        return Decimals.round(value, decimalDigits);
    }
}
