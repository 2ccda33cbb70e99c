package com.cred.freestyle.eventpricing.domain.pricing;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Result of one price computation, with the contribution of every rule.
 *
 * @author Event Pricing Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PriceBreakdown {

    private String eventId;
    private BigDecimal basePrice;
    private BigDecimal floorPrice;
    private BigDecimal ceilingPrice;

    private RuleAdjustment timeBased;
    private RuleAdjustment demandBased;
    private RuleAdjustment inventoryBased;

    /**
     * Sum of the weighted adjustments.
     */
    private BigDecimal totalAdjustment;

    /**
     * basePrice x (1 + totalAdjustment), before clamping and rounding.
     */
    private BigDecimal rawPrice;

    private BigDecimal finalPrice;

    private long demandCount;
    private Instant computedAt;

    /**
     * Contribution of a single rule.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RuleAdjustment {
        private BigDecimal adjustment;
        private BigDecimal weight;
        private BigDecimal weightedAdjustment;
    }
}
