package eu.virtualparadox.documind.api;

import eu.virtualparadox.documind.metrics.MetricsSink;
import eu.virtualparadox.documind.metrics.model.UsageSummary;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/analytics")
@RequiredArgsConstructor
public class AnalyticsController {

    private final MetricsSink metricsSink;

    @GetMapping("/summary")
    public UsageSummary summary(@RequestHeader(ApiHeaders.OWNER_ID) String ownerId) {
        return metricsSink.summarize(ApiHeaders.requireOwner(ownerId));
    }
}
