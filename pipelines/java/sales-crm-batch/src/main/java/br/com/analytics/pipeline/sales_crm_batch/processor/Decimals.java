package br.com.analytics.pipeline.sales_crm_batch.processor;

import java.math.BigDecimal;
import java.math.RoundingMode;

final class Decimals {

    private Decimals() {
    }

    /**
     * Rounds half to even. Non-finite values are returned unchanged.
     */
    static double round(double value, int digits) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(digits, RoundingMode.HALF_EVEN).doubleValue();
    }
}
