package com.cred.freestyle.eventpricing.domain.model;

import com.cred.freestyle.eventpricing.exception.InvalidPricingRulesException;
import jakarta.persistence.AttributeOverride;
import jakarta.persistence.AttributeOverrides;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.Embedded;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * The three weighted rules an event is priced with.
 *
 * Weights and rates must each lie in [0, 1] and the weights must sum to 1
 * within a tolerance of 0.01. Rule sets are validated once, when the event is
 * created, so the price model can assume a well-formed set.
 *
 * @author Event Pricing Team
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PricingRuleSet {

    private static final BigDecimal WEIGHT_SUM_TOLERANCE = new BigDecimal("0.01");

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "weight", column = @Column(name = "time_weight", nullable = false, precision = 5, scale = 4)),
        @AttributeOverride(name = "adjustmentRate", column = @Column(name = "time_rate", nullable = false, precision = 5, scale = 4))
    })
    private PricingRule timeBased;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "weight", column = @Column(name = "demand_weight", nullable = false, precision = 5, scale = 4)),
        @AttributeOverride(name = "adjustmentRate", column = @Column(name = "demand_rate", nullable = false, precision = 5, scale = 4))
    })
    private PricingRule demandBased;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "weight", column = @Column(name = "inventory_weight", nullable = false, precision = 5, scale = 4)),
        @AttributeOverride(name = "adjustmentRate", column = @Column(name = "inventory_rate", nullable = false, precision = 5, scale = 4))
    })
    private PricingRule inventoryBased;

    /**
     * Rule set applied when an event is created without explicit rules.
     */
    public static PricingRuleSet defaults() {
        return new PricingRuleSet(
                PricingRule.of("0.33", "0.1"),
                PricingRule.of("0.33", "0.1"),
                PricingRule.of("0.34", "0.1")
        );
    }

    /**
     * Check the rule set invariants.
     *
     * @throws InvalidPricingRulesException if a rule is missing, out of range, or the weights do not sum to 1
     */
    public void validate() {
        validateRule("timeBased", timeBased);
        validateRule("demandBased", demandBased);
        validateRule("inventoryBased", inventoryBased);

        BigDecimal sum = timeBased.getWeight()
                .add(demandBased.getWeight())
                .add(inventoryBased.getWeight());
        if (sum.subtract(BigDecimal.ONE).abs().compareTo(WEIGHT_SUM_TOLERANCE) > 0) {
            throw new InvalidPricingRulesException(
                    String.format("Pricing rule weights must sum to 1.0, got %s", sum.stripTrailingZeros().toPlainString()));
        }
    }

    private static void validateRule(String name, PricingRule rule) {
        if (rule == null || rule.getWeight() == null || rule.getAdjustmentRate() == null) {
            throw new InvalidPricingRulesException(String.format("Pricing rule %s is incomplete", name));
        }
        if (!inUnitInterval(rule.getWeight())) {
            throw new InvalidPricingRulesException(
                    String.format("Pricing rule %s has weight %s outside [0, 1]", name, rule.getWeight()));
        }
        if (!inUnitInterval(rule.getAdjustmentRate())) {
            throw new InvalidPricingRulesException(
                    String.format("Pricing rule %s has adjustment rate %s outside [0, 1]", name, rule.getAdjustmentRate()));
        }
    }

    private static boolean inUnitInterval(BigDecimal value) {
        return value.signum() >= 0 && value.compareTo(BigDecimal.ONE) <= 0;
    }
}
