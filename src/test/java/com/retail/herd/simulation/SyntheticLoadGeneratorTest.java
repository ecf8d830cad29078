package com.retail.herd.simulation;

import com.retail.herd.model.InteractionEvent;
import com.retail.herd.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.retail.herd.testutil.TestDataFactory.T0;
import static com.retail.herd.testutil.TestDataFactory.bucket;
import static org.assertj.core.api.Assertions.assertThat;

class SyntheticLoadGeneratorTest {

    private SyntheticLoadGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new SyntheticLoadGenerator(TestDataFactory.detectionConfig());
    }

    @Test
    void spike_followsWarmupWithMultipliedRate() {
        int[] counts = generator.bucketCounts(request(LoadPattern.SPIKE, 3, 2), new Random(1));

        assertThat(counts).containsExactly(5, 5, 5, 20, 20);
    }

    @Test
    void collapse_dividesRate() {
        int[] counts = generator.bucketCounts(request(LoadPattern.COLLAPSE, 2, 2), new Random(1));

        assertThat(counts).containsExactly(5, 5, 1, 1);
    }

    @Test
    void gradual_rampsThenPlateausBelowPeak() {
        int[] counts = generator.bucketCounts(request(LoadPattern.GRADUAL, 0, 10), new Random(1));

        // 3 slow, 4 ramping to the 20 peak, 3 at 75% of it
        assertThat(counts).containsExactly(5, 5, 5, 9, 13, 16, 20, 15, 15, 15);
    }

    @Test
    void background_withJitterStaysWithinBand() {
        SimulationRequest request = request(LoadPattern.BACKGROUND, 20, 20);
        request.setJitter(2);

        int[] counts = generator.bucketCounts(request, new Random(3));

        assertThat(counts).hasSize(40);
        for (int count : counts) {
            assertThat(count).isBetween(3, 7);
        }
    }

    @Test
    void generate_placesEventsInsideTheirBucketInOrder() {
        List<InteractionEvent> events = generator.generate(request(LoadPattern.SPIKE, 2, 1));

        assertThat(events).hasSize(30);
        assertThat(events).isSortedAccordingTo((a, b) -> a.getTimestamp().compareTo(b.getTimestamp()));
        Map<Instant, Long> perBucket = events.stream()
                .map(e -> T0.plusSeconds((e.getTimestamp().getEpochSecond() - T0.getEpochSecond()) / 10 * 10))
                .collect(Collectors.groupingBy(Function.identity(), Collectors.counting()));
        assertThat(perBucket).containsEntry(bucket(0), 5L).containsEntry(bucket(1), 5L).containsEntry(bucket(2), 20L);
        assertThat(events).allSatisfy(e -> assertThat(e.getProductId()).isEqualTo("sku-sim"));
    }

    @Test
    void generate_isDeterministicForSeed() {
        List<InteractionEvent> first = generator.generate(request(LoadPattern.GRADUAL, 5, 10));
        List<InteractionEvent> second = generator.generate(request(LoadPattern.GRADUAL, 5, 10));

        assertThat(first).isEqualTo(second);
        assertThat(first).extracting(InteractionEvent::getEventType)
                .allMatch(t -> List.of("view_product", "add_to_cart", "purchase", "share_product").contains(t));
    }

    private static SimulationRequest request(LoadPattern pattern, int warmup, int active) {
        return SimulationRequest.builder()
                .pattern(pattern)
                .productId("sku-sim")
                .start(T0)
                .warmupBuckets(warmup)
                .activeBuckets(active)
                .baseRate(5)
                .multiplier(4.0)
                .seed(42L)
                .build();
    }
}
