package com.eainde.expedition.model;

import java.io.Serializable;
import java.time.Instant;

public record MetricPoint(Instant timestamp, double value) implements Serializable {
}
