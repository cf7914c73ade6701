package com.vendorcatalog.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RequestOutcome {
    String method;
    String path;
    int statusCode;
    double elapsedMs;
    long dbCalls;
    double dbTotalMs;
    long dbCacheHits;
    long dbErrors;
}
