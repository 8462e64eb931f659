package com.scriptplatform.common.scoring;

import com.scriptplatform.common.model.FormatType;
import com.scriptplatform.common.model.Platform;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Static channel-weight table keyed by platform and format.
 *
 * <p>Lookup order: {@code platform.format}, then {@code platform}, then the default row.
 * The table is immutable; a changed configuration produces a new policy, and breakdowns
 * already computed keep the weights copied into them.
 */
public final class WeightPolicy {

    public static final ChannelWeights DEFAULT_WEIGHTS = new ChannelWeights(0.35, 0.45, 0.20);

    private final ChannelWeights defaults;
    private final Map<String, ChannelWeights> table;

    private WeightPolicy(ChannelWeights defaults, Map<String, ChannelWeights> table) {
        this.defaults = defaults;
        this.table = Map.copyOf(table);
    }

    public static WeightPolicy standard() {
        Map<String, ChannelWeights> table = new HashMap<>();
        table.put("tiktok", new ChannelWeights(0.40, 0.40, 0.20));
        table.put("youtube.long_form", new ChannelWeights(0.40, 0.35, 0.25));
        return new WeightPolicy(DEFAULT_WEIGHTS, table);
    }

    /**
     * Builds a policy from configuration. Keys are {@code platform} or
     * {@code platform.format}; entries override the standard table.
     */
    public static WeightPolicy of(ChannelWeights defaults, Map<String, ChannelWeights> overrides) {
        WeightPolicy standard = standard();
        Map<String, ChannelWeights> table = new HashMap<>(standard.table);
        if (overrides != null) {
            overrides.forEach((key, weights) -> table.put(key.trim().toLowerCase(Locale.ROOT), weights));
        }
        return new WeightPolicy(defaults != null ? defaults : standard.defaults, table);
    }

    public ChannelWeights resolve(Platform platform, FormatType format) {
        String platformKey = platform == null ? Platform.UNKNOWN.key() : platform.key();
        ChannelWeights exact = table.get(platformKey + "." + format.key());
        if (exact != null) {
            return exact;
        }
        return table.getOrDefault(platformKey, defaults);
    }
}
