package com.trakbridge.bridge.api;

import com.trakbridge.bridge.dispatch.DispatchService;
import com.trakbridge.queue.DestinationRegistry;
import com.trakbridge.queue.QueueStats;
import java.util.List;
import java.util.Map;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator endpoints for destination queues.
 *
 * <ul>
 *   <li>{@code GET /api/destinations}: stats of every queue</li>
 *   <li>{@code GET /api/destinations/{id}}: stats of one queue</li>
 *   <li>{@code POST /api/destinations/flush}: discard queued events of every destination</li>
 *   <li>{@code POST /api/destinations/{id}/flush}: discard queued events</li>
 *   <li>{@code DELETE /api/destinations/{id}}: tear the destination down</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/destinations")
public class DestinationController {
  private final DestinationRegistry registry;
  private final DispatchService dispatchService;

  public DestinationController(DestinationRegistry registry, DispatchService dispatchService) {
    this.registry = registry;
    this.dispatchService = dispatchService;
  }

  @GetMapping
  public List<QueueStats> listDestinations() {
    return registry.allStats();
  }

  @GetMapping("/{id}")
  public QueueStats getDestination(@PathVariable("id") String id) {
    return registry.stats(id).orElseThrow(() -> notFound(id));
  }

  @PostMapping("/flush")
  public Map<String, Object> flushAll() {
    return Map.of("flushed", registry.flushAll());
  }

  @PostMapping("/{id}/flush")
  public Map<String, Object> flush(@PathVariable("id") String id) {
    int flushed = registry.flush(id).orElseThrow(() -> notFound(id));
    return Map.of("destination", id, "flushed", flushed);
  }

  @DeleteMapping("/{id}")
  public Map<String, Object> remove(@PathVariable("id") String id) {
    if (!dispatchService.removeDestination(id)) {
      throw notFound(id);
    }
    return Map.of("destination", id, "removed", true);
  }

  private static NotFoundException notFound(String id) {
    return new NotFoundException("destination not found: " + id);
  }
}
