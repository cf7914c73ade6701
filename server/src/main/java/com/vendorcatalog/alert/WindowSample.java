package com.vendorcatalog.alert;

public record WindowSample(long timestampMillis, double requestMs, boolean error, double downstreamMs) {
}
