package com.driftmonitor.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "drift.thresholds")
public class DriftThresholdProperties {
    private double label = 0.15;
    private double embedding = 0.2;
}
