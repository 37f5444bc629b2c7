package com.eainde.expedition.nodes;

import com.eainde.expedition.model.ChannelFamily;

import java.util.EnumMap;
import java.util.Map;

/**
 * Data that makes the investigator family-specific: which prompt it uses and what it looks at.
 */
public record InvestigationStrategy(ChannelFamily family, String promptName, String focus) {

    public static Map<ChannelFamily, InvestigationStrategy> defaults() {
        Map<ChannelFamily, InvestigationStrategy> strategies = new EnumMap<>(ChannelFamily.class);
        strategies.put(ChannelFamily.PAID_MEDIA, new InvestigationStrategy(ChannelFamily.PAID_MEDIA,
                "investigator-paid-media",
                "auction pressure, bids and budgets, impression share, creative fatigue, tracking and platform changes"));
        strategies.put(ChannelFamily.INFLUENCER, new InvestigationStrategy(ChannelFamily.INFLUENCER,
                "investigator-influencer",
                "creator performance, engagement quality, fake followers, posting cadence, promo code leakage"));
        strategies.put(ChannelFamily.OFFLINE, new InvestigationStrategy(ChannelFamily.OFFLINE,
                "investigator-offline",
                "spend ledgers, vendor delivery, preemptions and make-goods, measurement lag, regional mix"));
        return strategies;
    }
}
