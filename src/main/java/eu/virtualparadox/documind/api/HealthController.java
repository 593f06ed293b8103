package eu.virtualparadox.documind.api;

import eu.virtualparadox.documind.rag.index.VectorIndexService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/health")
@RequiredArgsConstructor
public class HealthController {

    private final VectorIndexService vectorIndexService;

    @GetMapping
    public Map<String, Object> health() {
        final Map<String, Object> health = new LinkedHashMap<>();
        try {
            health.put("index", Map.of(
                    "status", "UP",
                    "entries", vectorIndexService.count(),
                    "vectorDimension", vectorIndexService.dimension()));
            health.put("status", "UP");
        } catch (Exception e) {
            log.error("Index health check failed: {}", e.getMessage());
            health.put("index", Map.of("status", "DOWN", "error", String.valueOf(e.getMessage())));
            health.put("status", "DEGRADED");
        }
        return health;
    }
}
