package br.com.analytics.pipeline.sales_crm_batch.processor;

import br.com.analytics.pipeline.sales_crm_batch.model.DataTable;
import br.com.analytics.pipeline.sales_crm_batch.model.MonthlySeries;
import br.com.analytics.pipeline.sales_crm_batch.model.ProductShare;
import br.com.analytics.pipeline.sales_crm_batch.model.WindowSpec;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Computes the tracked product's share of unit sales per date and its trailing averages.
 * Shares are taken over the products present on each date, so a date with a single product
 * gives that product a share of 1.0.
 */
public class MarketShareProcessor extends AbstractSeriesProcessor {

    public static final String MARKET_SHARE = "market_share";

    static final String DATE = "date";
    static final String PRODUCT_NAME = "product_name";
    static final String UNIT_SALES = "unit_sales";

    private final String trackedProduct;

    public MarketShareProcessor(List<WindowSpec> windows, int decimalDigits, String trackedProduct) {
        super(windows, decimalDigits);
        this.trackedProduct = trackedProduct;
    }

    @Override
    public MonthlySeries process(DataTable sales) {
        List<LocalDate> dates = new ArrayList<>();
        List<Double> shares = new ArrayList<>();
        for (ProductShare productShare : calculateMarketShare(sales)) {
            if (trackedProduct.equals(productShare.productName())) {
                dates.add(productShare.date());
                shares.add(productShare.share());
            }
        }

        MonthlySeries series = MonthlySeries.indexedBy(dates).withColumn(MARKET_SHARE, shares);
        for (WindowSpec window : windows) {
            series = series.withColumn(laggedName(window, "avg_market_share"),
                    RollingWindows.movingAverage(shares, window.size(), decimalDigits));
        }
        return series;
    }

    /**
     * Sums unit sales per date and product and divides each sum by its date's total.
     * Results are ordered by date, then product name.
     */
    public List<ProductShare> calculateMarketShare(DataTable sales) {
        List<Object> dates = sales.column(DATE);
        List<Object> products = sales.column(PRODUCT_NAME);
        List<Object> units = sales.column(UNIT_SALES);

        Map<LocalDate, Map<String, Double>> unitsByDate = new TreeMap<>();
        for (int i = 0; i < sales.rowCount(); i++) {
            if (dates.get(i) == null || products.get(i) == null) {
                continue;
            }
            double sold = units.get(i) == null ? 0.0 : ((Number) units.get(i)).doubleValue();
            unitsByDate.computeIfAbsent((LocalDate) dates.get(i), date -> new TreeMap<>())
                    .merge(String.valueOf(products.get(i)), sold, Double::sum);
        }

        List<ProductShare> shares = new ArrayList<>();
        unitsByDate.forEach((date, unitsByProduct) -> {
            double total = unitsByProduct.values().stream().mapToDouble(Double::doubleValue).sum();
            unitsByProduct.forEach((product, sold) ->
                    shares.add(new ProductShare(date, product, total == 0.0 ? null : round(sold / total))));
        });
        return shares;
    }
}
