package com.retail.herd.simulation;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Scripted event sequence to push through the ingestion path")
public class SimulationRequest {

    @Schema(description = "Traffic shape", example = "SPIKE")
    @Builder.Default
    private LoadPattern pattern = LoadPattern.SPIKE;

    @Schema(description = "Product the events are generated for", example = "sneaker-limited-001")
    private String productId;

    @Schema(description = "Event time of the first bucket; defaults to now minus the run length")
    private Instant start;

    @Schema(description = "Buckets of plain background traffic before the pattern starts", example = "30")
    @Builder.Default
    private int warmupBuckets = 30;

    @Schema(description = "Buckets the pattern runs for", example = "10")
    @Builder.Default
    private int activeBuckets = 10;

    @Schema(description = "Background events per bucket", example = "5")
    @Builder.Default
    private int baseRate = 5;

    @Schema(description = "Rate multiplier (divisor for COLLAPSE)", example = "4.0")
    @Builder.Default
    private double multiplier = 4.0;

    @Schema(description = "Maximum random deviation added to each background bucket", example = "0")
    @Builder.Default
    private int jitter = 0;

    @Schema(description = "Random seed; the same request always produces the same events", example = "42")
    @Builder.Default
    private long seed = 42L;

    public int getTotalBuckets() {
        return warmupBuckets + activeBuckets;
    }
}
