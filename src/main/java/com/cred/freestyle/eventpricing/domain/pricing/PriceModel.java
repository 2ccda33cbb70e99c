package com.cred.freestyle.eventpricing.domain.pricing;

import com.cred.freestyle.eventpricing.domain.model.Event;
import com.cred.freestyle.eventpricing.domain.model.PricingRule;
import com.cred.freestyle.eventpricing.domain.model.PricingRuleSet;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;

/**
 * Dynamic price model.
 *
 * The price is anchored to the event's base price and moved by three signals:
 * - Time: the closer the event, the higher the price
 * - Demand: number of bookings in the trailing demand window
 * - Inventory: fraction of capacity still available
 *
 * Each signal yields an adjustment (rule rate x tier multiplier). The weighted sum
 * of the adjustments scales the base price, and the result is clamped to
 * [floorPrice, ceilingPrice] and rounded half-up to cents.
 *
 * Pure and deterministic: the same event state, demand count and clock give the same price.
 *
 * @author Event Pricing Team
 */
@Component
public class PriceModel {

    private static final Duration ONE_DAY = Duration.ofDays(1);
    private static final Duration ONE_WEEK = Duration.ofDays(7);
    private static final Duration ONE_MONTH = Duration.ofDays(30);

    private static final BigDecimal TIER_NONE = BigDecimal.ZERO;
    private static final BigDecimal TIER_LOW = BigDecimal.ONE;
    private static final BigDecimal TIER_MEDIUM = new BigDecimal("2");
    private static final BigDecimal TIER_MEDIUM_HIGH = new BigDecimal("2.5");
    private static final BigDecimal TIER_HIGH = new BigDecimal("3");
    private static final BigDecimal TIER_IMMINENT = new BigDecimal("5");

    private static final int PRICE_SCALE = 2;

    /**
     * Compute the price of one ticket.
     *
     * @param event Event with capacity, booked tickets, prices and a validated rule set
     * @param demandCount Bookings for the event in the trailing demand window
     * @param now Pricing instant
     * @return Full breakdown with the final price
     */
    public PriceBreakdown computePrice(Event event, long demandCount, Instant now) {
        PricingRuleSet rules = event.getPricingRules();

        PriceBreakdown.RuleAdjustment time = weigh(rules.getTimeBased(),
                timeMultiplier(event.getEventDate(), now));
        PriceBreakdown.RuleAdjustment demand = weigh(rules.getDemandBased(),
                demandMultiplier(demandCount));
        PriceBreakdown.RuleAdjustment inventory = weigh(rules.getInventoryBased(),
                inventoryMultiplier(event.getCapacity(), event.getBookedTickets()));

        BigDecimal totalAdjustment = time.getWeightedAdjustment()
                .add(demand.getWeightedAdjustment())
                .add(inventory.getWeightedAdjustment());

        BigDecimal rawPrice = event.getBasePrice().multiply(BigDecimal.ONE.add(totalAdjustment));
        BigDecimal finalPrice = clamp(rawPrice, event.getFloorPrice(), event.getCeilingPrice())
                .setScale(PRICE_SCALE, RoundingMode.HALF_UP);

        return PriceBreakdown.builder()
                .eventId(event.getEventId())
                .basePrice(event.getBasePrice())
                .floorPrice(event.getFloorPrice())
                .ceilingPrice(event.getCeilingPrice())
                .timeBased(time)
                .demandBased(demand)
                .inventoryBased(inventory)
                .totalAdjustment(totalAdjustment)
                .rawPrice(rawPrice)
                .finalPrice(finalPrice)
                .demandCount(demandCount)
                .computedAt(now)
                .build();
    }

    /**
     * Time tiers: past or within a day x5, within a week x2, within 30 days x1.
     */
    BigDecimal timeMultiplier(Instant eventDate, Instant now) {
        Duration untilEvent = Duration.between(now, eventDate);
        if (untilEvent.compareTo(ONE_DAY) <= 0) {
            return TIER_IMMINENT;
        }
        if (untilEvent.compareTo(ONE_WEEK) <= 0) {
            return TIER_MEDIUM;
        }
        if (untilEvent.compareTo(ONE_MONTH) <= 0) {
            return TIER_LOW;
        }
        return TIER_NONE;
    }

    /**
     * Demand tiers: more than 20 bookings x3, more than 10 x2, more than 5 x1.
     */
    BigDecimal demandMultiplier(long demandCount) {
        if (demandCount > 20) {
            return TIER_HIGH;
        }
        if (demandCount > 10) {
            return TIER_MEDIUM;
        }
        if (demandCount > 5) {
            return TIER_LOW;
        }
        return TIER_NONE;
    }

    /**
     * Inventory tiers on remaining/capacity: at most 10% x3, at most 20% x2.5, at most 50% x1.
     * Compared in integer arithmetic so tier boundaries are exact.
     */
    BigDecimal inventoryMultiplier(int capacity, int bookedTickets) {
        if (capacity <= 0) {
            return TIER_NONE;
        }
        long remaining = Math.max(0, capacity - bookedTickets);
        if (remaining * 10 <= capacity) {
            return TIER_HIGH;
        }
        if (remaining * 5 <= capacity) {
            return TIER_MEDIUM_HIGH;
        }
        if (remaining * 2 <= capacity) {
            return TIER_LOW;
        }
        return TIER_NONE;
    }

    private static PriceBreakdown.RuleAdjustment weigh(PricingRule rule, BigDecimal multiplier) {
        BigDecimal adjustment = rule.getAdjustmentRate().multiply(multiplier);
        return new PriceBreakdown.RuleAdjustment(adjustment, rule.getWeight(), adjustment.multiply(rule.getWeight()));
    }

    private static BigDecimal clamp(BigDecimal value, BigDecimal floor, BigDecimal ceiling) {
        if (value.compareTo(floor) < 0) {
            return floor;
        }
        if (value.compareTo(ceiling) > 0) {
            return ceiling;
        }
        return value;
    }
}
