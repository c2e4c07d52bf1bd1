package guraa.formcompare.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * Controller for health checks.
 */
@RestController
@RequestMapping("/api/health")
public class HealthController {

    @GetMapping
    public ResponseEntity<Map<String, Object>> healthCheck() {
        Map<String, Object> status = new HashMap<>();
        status.put("status", "UP");

        Map<String, Object> runtime = new HashMap<>();
        runtime.put("maxMemory", Runtime.getRuntime().maxMemory() / (1024 * 1024) + " MB");
        runtime.put("freeMemory", Runtime.getRuntime().freeMemory() / (1024 * 1024) + " MB");
        runtime.put("processors", Runtime.getRuntime().availableProcessors());
        status.put("runtime", runtime);

        return ResponseEntity.ok(status);
    }
}
