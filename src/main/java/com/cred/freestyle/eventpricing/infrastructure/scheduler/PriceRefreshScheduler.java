package com.cred.freestyle.eventpricing.infrastructure.scheduler;

import com.cred.freestyle.eventpricing.service.PricingService;
import com.cred.freestyle.eventpricing.service.PricingService.PriceRefreshSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Scheduled job that keeps the persisted current price of upcoming events fresh.
 *
 * Prices move with time even when nobody books, so the stored currentPrice (shown by
 * the availability view) would otherwise go stale. Each event is refreshed under its
 * own pool lock. A failing event is logged and skipped.
 *
 * Runs with a fixed delay (default 5 minutes) after the previous run completes.
 *
 * @author Event Pricing Team
 */
@Service
public class PriceRefreshScheduler {

    private static final Logger logger = LoggerFactory.getLogger(PriceRefreshScheduler.class);

    private final PricingService pricingService;

    @Value("${eventpricing.price-refresh.enabled:true}")
    private boolean schedulerEnabled = true;

    public PriceRefreshScheduler(PricingService pricingService) {
        this.pricingService = pricingService;
    }

    @Scheduled(
            fixedDelayString = "${eventpricing.price-refresh.interval-ms:300000}",
            initialDelayString = "${eventpricing.price-refresh.initial-delay-ms:60000}"
    )
    public void refreshPrices() {
        if (!schedulerEnabled) {
            logger.debug("Price refresh scheduler is disabled");
            return;
        }

        long startTime = System.currentTimeMillis();
        try {
            PriceRefreshSummary summary = pricingService.refreshAllPrices(null);
            if (summary.getTotal() == 0) {
                logger.debug("No upcoming events to re-price");
                return;
            }
            logger.info("Price refresh run: {}/{} events refreshed in {}ms",
                    summary.getRefreshed(), summary.getTotal(), System.currentTimeMillis() - startTime);
            if (!summary.getFailedEventIds().isEmpty()) {
                logger.warn("Price refresh failed for events: {}", summary.getFailedEventIds());
            }
        } catch (RuntimeException e) {
            // Listing events failed; the next run tries again
            logger.error("Price refresh run failed", e);
        }
    }
}
