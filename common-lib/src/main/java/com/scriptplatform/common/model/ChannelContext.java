package com.scriptplatform.common.model;

/**
 * External inputs for the competitor and historical channels of one scoring request.
 */
public record ChannelContext(
    CompetitorBenchmark benchmark,
    HistoricalBaseline historical
) {
    public ChannelContext {
        benchmark = benchmark == null ? CompetitorBenchmark.empty() : benchmark;
        historical = historical == null ? HistoricalBaseline.empty() : historical;
    }

    public static ChannelContext empty() {
        return new ChannelContext(CompetitorBenchmark.empty(), HistoricalBaseline.empty());
    }
}
