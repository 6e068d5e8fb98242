package br.com.analytics.pipeline.sales_crm_batch.model;

import java.time.LocalDate;

public record ProductShare(
        LocalDate date,
        String productName,
        Double share
) {
}
