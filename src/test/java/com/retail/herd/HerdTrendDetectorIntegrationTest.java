package com.retail.herd;

import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import com.retail.herd.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Drives the whole pipeline over HTTP: simulated traffic in, trend snapshot and alerts out.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class HerdTrendDetectorIntegrationTest {

    @Autowired
    private TestRestTemplate restTemplate;

    @Test
    void simulatedSpike_surfacesAsTrendingProduct() {
        ResponseEntity<String> simulated = restTemplate.postForEntity("/api/v1/simulate", Map.of(
                "pattern", "SPIKE",
                "productId", "it-spike-sku",
                "start", TestDataFactory.T0.toString(),
                "warmupBuckets", 30,
                "activeBuckets", 3,
                "baseRate", 5,
                "multiplier", 4.0), String.class);
        assertThat(simulated.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(JsonPath.parse(simulated.getBody()).read("$.accepted", Integer.class)).isEqualTo(210);

        ResponseEntity<String> trends = restTemplate.getForEntity("/api/v1/trends?topK=50", String.class);
        DocumentContext json = JsonPath.parse(trends.getBody());
        List<String> trending = json.read("$.products[?(@.status == 'TRENDING_UP')].product_id");
        assertThat(trending).contains("it-spike-sku");

        ResponseEntity<String> latest = restTemplate.getForEntity("/api/v1/alerts/latest/it-spike-sku", String.class);
        assertThat(latest.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(JsonPath.parse(latest.getBody()).read("$.trend_direction", String.class)).isEqualTo("up");
    }

    @Test
    void trackedEvent_isVisibleInProductDetail() {
        ResponseEntity<String> tracked = restTemplate.postForEntity("/api/v1/events/track",
                TestDataFactory.trackRequest("it-track-sku", "2025-01-27T09:00:00Z"), String.class);
        assertThat(tracked.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);

        ResponseEntity<String> detail = restTemplate.getForEntity("/api/v1/trends/it-track-sku", String.class);
        assertThat(detail.getStatusCode()).isEqualTo(HttpStatus.OK);
        DocumentContext json = JsonPath.parse(detail.getBody());
        assertThat(json.read("$.active_count", Integer.class)).isEqualTo(1);
        assertThat(json.read("$.baseline_defined", Boolean.class)).isFalse();
    }

    @Test
    void malformedEvent_isRejectedWithValidationError() {
        ResponseEntity<String> response = restTemplate.postForEntity("/api/v1/events/track",
                Map.of("product_id", "it-bad-sku", "timestamp", "not-a-time"), String.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(JsonPath.parse(response.getBody()).read("$.field", String.class)).isEqualTo("timestamp");
    }
}
