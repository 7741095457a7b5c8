package com.skillpulse.processing.trend;

import java.util.List;

public record TrendSummary(
    List<TrendRecord> rising,
    List<TrendRecord> stable,
    List<TrendRecord> declining
) {

    public int size() {
        return rising.size() + stable.size() + declining.size();
    }
}
