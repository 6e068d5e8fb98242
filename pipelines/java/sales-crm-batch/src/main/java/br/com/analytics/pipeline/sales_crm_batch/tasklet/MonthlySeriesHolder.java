package br.com.analytics.pipeline.sales_crm_batch.tasklet;

import br.com.analytics.pipeline.sales_crm_batch.model.MonthlySeries;

public class MonthlySeriesHolder {

    private MonthlySeries marketShare;
    private MonthlySeries marketEvents;

    public void setMarketShare(MonthlySeries marketShare) {
        this.marketShare = marketShare;
    }

    public void setMarketEvents(MonthlySeries marketEvents) {
        this.marketEvents = marketEvents;
    }

    public MonthlySeries getMarketShare() {
        if (marketShare == null) {
            throw new IllegalStateException("Market share series has not been computed");
        }
        return marketShare;
    }

    public MonthlySeries getMarketEvents() {
        if (marketEvents == null) {
            throw new IllegalStateException("Market event series has not been computed");
        }
        return marketEvents;
    }
}
