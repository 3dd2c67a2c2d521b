package com.serviceradar.srql.service.core.parser;

/** Time bucketing request: {@code bucket:5m agg:max series:device_id}. Series is null when absent. */
public record DownsampleSpec(long bucketSeconds, DownsampleAgg agg, String series) {

    public DownsampleSpec withSeries(String newSeries) {
        return new DownsampleSpec(bucketSeconds, agg, newSeries);
    }
}
