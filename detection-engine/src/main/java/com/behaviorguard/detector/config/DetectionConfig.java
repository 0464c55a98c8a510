package com.behaviorguard.detector.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Fusion thresholds used to turn a classifier confidence and a heuristic score
 * into a verdict.
 *
 * <p>
 * The defaults are tuned starting points, not derived constants. They are
 * expected to be re-validated against observed false-positive rates.
 * </p>
 */
@Configuration
@ConfigurationProperties(prefix = "behaviorguard.detection")
@Validated
public class DetectionConfig {

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double detectionThreshold = 0.5;

    @Min(0)
    @Max(100)
    private int hardHeuristicCeiling = 70;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double mlSoftFloor = 0.4;

    @Min(0)
    @Max(100)
    private int heuristicSoftFloor = 50;

    public double getDetectionThreshold() {
        return detectionThreshold;
    }

    public void setDetectionThreshold(double detectionThreshold) {
        this.detectionThreshold = detectionThreshold;
    }

    public int getHardHeuristicCeiling() {
        return hardHeuristicCeiling;
    }

    public void setHardHeuristicCeiling(int hardHeuristicCeiling) {
        this.hardHeuristicCeiling = hardHeuristicCeiling;
    }

    public double getMlSoftFloor() {
        return mlSoftFloor;
    }

    public void setMlSoftFloor(double mlSoftFloor) {
        this.mlSoftFloor = mlSoftFloor;
    }

    public int getHeuristicSoftFloor() {
        return heuristicSoftFloor;
    }

    public void setHeuristicSoftFloor(int heuristicSoftFloor) {
        this.heuristicSoftFloor = heuristicSoftFloor;
    }
}
