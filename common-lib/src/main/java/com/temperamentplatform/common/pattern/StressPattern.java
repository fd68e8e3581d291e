package com.temperamentplatform.common.pattern;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Summary of stress deltas over the window.
 *
 * @param averageReduction mean of the negative stress deltas (a value &le; 0), 0 when none
 * @param averageChange    mean of all stress deltas
 * @param spikes           interactions whose stress delta reached the spike threshold
 */
public record StressPattern(
    @JsonProperty("trend")            Trend trend,
    @JsonProperty("averageReduction") double averageReduction,
    @JsonProperty("averageChange")    double averageChange,
    @JsonProperty("totalChange")      int totalChange,
    @JsonProperty("spikes")           List<StressSpike> spikes
) {

    public StressPattern {
        spikes = spikes == null ? List.of() : List.copyOf(spikes);
    }

    public int spikeCount() {
        return spikes.size();
    }
}
