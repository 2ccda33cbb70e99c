package com.cred.freestyle.eventpricing.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * One pricing signal's configuration: how much it moves the price when triggered
 * (adjustment rate) and how much it counts in the combined adjustment (weight).
 *
 * @author Event Pricing Team
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PricingRule {

    @Column(name = "weight", nullable = false, precision = 5, scale = 4)
    private BigDecimal weight;

    @Column(name = "adjustment_rate", nullable = false, precision = 5, scale = 4)
    private BigDecimal adjustmentRate;

    public static PricingRule of(String weight, String adjustmentRate) {
        return new PricingRule(new BigDecimal(weight), new BigDecimal(adjustmentRate));
    }
}
