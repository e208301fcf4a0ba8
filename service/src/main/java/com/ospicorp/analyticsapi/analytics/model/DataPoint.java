package com.ospicorp.analyticsapi.analytics.model;

import java.time.Instant;

public record DataPoint(Instant time, double value) {}
