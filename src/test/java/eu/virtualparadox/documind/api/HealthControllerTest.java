package eu.virtualparadox.documind.api;

import eu.virtualparadox.documind.rag.index.VectorIndexService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.*;

class HealthControllerTest {

    private final VectorIndexService index = mock(VectorIndexService.class);
    private final HealthController controller = new HealthController(index);

    @Test
    @DisplayName("Reports index size and vector dimension")
    void up() throws IOException {
        when(index.count()).thenReturn(12);
        when(index.dimension()).thenReturn(384);

        Map<String, Object> health = controller.health();

        assertEquals("UP", health.get("status"));
        assertEquals(Map.of("status", "UP", "entries", 12, "vectorDimension", 384), health.get("index"));
    }

    @Test
    @DisplayName("An unreadable index degrades the status")
    void degraded() throws IOException {
        when(index.count()).thenThrow(new IOException("lock obtain timed out"));

        Map<String, Object> health = controller.health();

        assertEquals("DEGRADED", health.get("status"));
        assertEquals(Map.of("status", "DOWN", "error", "lock obtain timed out"), health.get("index"));
    }
}
