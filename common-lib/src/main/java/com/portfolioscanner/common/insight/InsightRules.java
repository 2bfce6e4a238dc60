package com.portfolioscanner.common.insight;

import com.portfolioscanner.common.model.RiskLevel;
import com.portfolioscanner.common.model.TimeHorizon;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-stock rule tables. Pure data and predicates; no I/O, no logging.
 *
 * <h3>Recommendation (first match)</h3>
 * <ol>
 *   <li>positive, confidence &gt; 0.7, mentions &ge; 3: strong BUY</li>
 *   <li>positive, confidence &gt; 0.5: BUY</li>
 *   <li>negative, confidence &gt; 0.7, mentions &ge; 3: SELL</li>
 *   <li>negative, confidence &gt; 0.5: HOLD and monitor</li>
 *   <li>mentions &ge; 5: HOLD on news volume</li>
 *   <li>otherwise: HOLD, neutral</li>
 * </ol>
 */
public final class InsightRules {

    public static final double STRONG_CONFIDENCE = 0.7;
    public static final double MODERATE_CONFIDENCE = 0.5;
    public static final double ACTION_CONFIDENCE = 0.6;
    public static final double CONVICTION_CONFIDENCE = 0.8;
    public static final int CONFIRMED_MENTIONS = 3;
    public static final int HIGH_VOLUME_MENTIONS = 5;

    private InsightRules() {}

    public static final RuleTable<InsightSignal, String> RECOMMENDATION =
        RuleTable.<InsightSignal, String>named("recommendation")
            .when("strong-buy", s -> s.positive() && s.confidence() > STRONG_CONFIDENCE
                            && s.mentions() >= CONFIRMED_MENTIONS,
                    "BUY - Strong positive sentiment with high confidence")
            .when("buy", s -> s.positive() && s.confidence() > MODERATE_CONFIDENCE,
                    "BUY - Positive sentiment, consider for portfolio")
            .when("sell", s -> s.negative() && s.confidence() > STRONG_CONFIDENCE
                            && s.mentions() >= CONFIRMED_MENTIONS,
                    "SELL - Strong negative sentiment, consider exiting")
            .when("hold-negative", s -> s.negative() && s.confidence() > MODERATE_CONFIDENCE,
                    "HOLD - Negative sentiment, monitor closely")
            .when("hold-volume", s -> s.mentions() >= HIGH_VOLUME_MENTIONS,
                    "HOLD - High news volume, wait for clearer direction")
            .otherwise("hold-neutral", "HOLD - Neutral sentiment, maintain current position");

    public static final RuleTable<InsightSignal, RiskLevel> RISK =
        RuleTable.<InsightSignal, RiskLevel>named("risk")
            .when("high", s -> s.mentions() >= HIGH_VOLUME_MENTIONS && s.confidence() > CONVICTION_CONFIDENCE,
                    RiskLevel.HIGH)
            .when("medium", s -> s.mentions() >= CONFIRMED_MENTIONS && s.confidence() > ACTION_CONFIDENCE,
                    RiskLevel.MEDIUM)
            .otherwise("low", RiskLevel.LOW);

    public static final RuleTable<InsightSignal, TimeHorizon> TIME_HORIZON =
        RuleTable.<InsightSignal, TimeHorizon>named("time-horizon")
            .when("strong-directional", s -> s.sentiment().isDirectional() && s.confidence() > STRONG_CONFIDENCE,
                    TimeHorizon.SHORT)
            .otherwise("moderate", TimeHorizon.MEDIUM);

    public static final RuleTable<InsightSignal, String> PRICE_OUTLOOK =
        RuleTable.<InsightSignal, String>named("price-outlook")
            .when("bullish", s -> s.positive() && s.confidence() > STRONG_CONFIDENCE
                            && s.mentions() >= HIGH_VOLUME_MENTIONS,
                    "Bullish - Strong positive momentum expected")
            .when("moderately-bullish", s -> s.positive() && s.confidence() > STRONG_CONFIDENCE,
                    "Moderately Bullish - Positive trend developing")
            .when("bearish", s -> s.negative() && s.confidence() > STRONG_CONFIDENCE
                            && s.mentions() >= HIGH_VOLUME_MENTIONS,
                    "Bearish - Strong negative pressure expected")
            .when("moderately-bearish", s -> s.negative() && s.confidence() > STRONG_CONFIDENCE,
                    "Moderately Bearish - Negative trend developing")
            .otherwise("neutral", "Neutral - Mixed signals, sideways movement likely");

    /** Additive: every matching row contributes. */
    public static final RuleTable<InsightSignal, List<String>> KEY_FACTORS =
        RuleTable.<InsightSignal, List<String>>named("key-factors")
            .when("media-attention", s -> s.mentions() >= HIGH_VOLUME_MENTIONS,
                    List.of("High media attention"))
            .when("strong-signal", s -> s.confidence() > STRONG_CONFIDENCE,
                    List.of("Strong sentiment signal"))
            .when("positive-flow", InsightSignal::positive,
                    List.of("Positive news flow", "Potential upside opportunity"))
            .when("negative-flow", InsightSignal::negative,
                    List.of("Negative news flow", "Downside risk present"))
            .when("confirmed", s -> s.mentions() >= CONFIRMED_MENTIONS,
                    List.of("Multiple news sources confirming trend"))
            .build();

    /** First match: the position-management block of the action list. */
    public static final RuleTable<InsightSignal, List<String>> POSITION_ACTIONS =
        RuleTable.<InsightSignal, List<String>>named("position-actions")
            .when("add-with-conviction", s -> s.positive() && s.confidence() > CONVICTION_CONFIDENCE,
                    List.of("Consider adding to portfolio if not already held",
                            "Set stop-loss at 5-10% below current price",
                            "Consider increasing position size for high conviction"))
            .when("add", s -> s.positive() && s.confidence() > ACTION_CONFIDENCE,
                    List.of("Consider adding to portfolio if not already held",
                            "Set stop-loss at 5-10% below current price"))
            .when("reduce-or-exit", s -> s.negative() && s.confidence() > CONVICTION_CONFIDENCE,
                    List.of("Review current position and consider reducing exposure",
                            "Set tighter stop-loss to protect capital",
                            "Consider exiting position if risk tolerance is low"))
            .when("reduce", s -> s.negative() && s.confidence() > ACTION_CONFIDENCE,
                    List.of("Review current position and consider reducing exposure",
                            "Set tighter stop-loss to protect capital"))
            .otherwise("monitor",
                    List.of("Monitor news flow for clearer direction",
                            "Maintain current position size"));

    /** Additive: volume follow-ups, then the standing research items. */
    public static final RuleTable<InsightSignal, List<String>> FOLLOW_UP_ACTIONS =
        RuleTable.<InsightSignal, List<String>>named("follow-up-actions")
            .when("high-volume", s -> s.mentions() >= HIGH_VOLUME_MENTIONS,
                    List.of("Set up price alerts for significant moves",
                            "Monitor earnings calendar for upcoming events"))
            .when("always", s -> true,
                    List.of("Review quarterly results and management commentary",
                            "Check analyst upgrades/downgrades"))
            .build();

    /** Templates take the resolved sector name. */
    public static final RuleTable<InsightSignal, String> SECTOR_IMPACT =
        RuleTable.<InsightSignal, String>named("sector-impact")
            .when("positive-impact", s -> s.mentions() >= CONFIRMED_MENTIONS && s.positive(),
                    "Positive sector impact expected in %s")
            .when("negative-impact", s -> s.mentions() >= CONFIRMED_MENTIONS && s.negative(),
                    "Negative sector impact possible in %s")
            .otherwise("monitor", "Monitor %s sector for broader trends");

    // ── composed lookups ───────────────────────────────────────────

    public static List<String> keyFactors(InsightSignal signal) {
        return flatten(KEY_FACTORS.collect(signal));
    }

    public static List<String> actionItems(InsightSignal signal) {
        List<String> actions = new ArrayList<>(POSITION_ACTIONS.evaluate(signal));
        actions.addAll(flatten(FOLLOW_UP_ACTIONS.collect(signal)));
        return actions;
    }

    public static String sectorImpact(String sector, InsightSignal signal) {
        return String.format(SECTOR_IMPACT.evaluate(signal), sector);
    }

    private static List<String> flatten(List<List<String>> groups) {
        List<String> out = new ArrayList<>();
        groups.forEach(out::addAll);
        return out;
    }
}
