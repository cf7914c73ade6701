package com.vendorcatalog.alert;

public record AlertEvent(AlertKind kind, Type type, double observed, double threshold, int sampleSize) {

    public enum Type {
        BREACH,
        RECOVERY
    }
}
