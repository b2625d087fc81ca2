package com.trakbridge.bridge.source;

import com.trakbridge.bridge.config.BridgeProperties;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Pops raw CoT payloads that external plugins push onto a Redis list.
 *
 * <p>Producers {@code RPUSH}; this source {@code LPOP}s up to {@code max-batch} entries per poll,
 * so payloads are seen in push order.
 */
@Component
@ConditionalOnProperty(prefix = "bridge.sources.redis", name = "enabled", havingValue = "true")
public class RedisEventSource implements EventSource {
  private static final Logger log = LoggerFactory.getLogger(RedisEventSource.class);

  private final StringRedisTemplate redisTemplate;
  private final String key;
  private final int maxBatch;

  public RedisEventSource(StringRedisTemplate redisTemplate, BridgeProperties properties) {
    this.redisTemplate = redisTemplate;
    this.key = properties.sources().redis().key();
    this.maxBatch = Math.max(1, properties.sources().redis().maxBatch());
  }

  @Override
  public String name() {
    return "redis";
  }

  @Override
  public List<byte[]> poll() {
    List<String> payloads = redisTemplate.opsForList().leftPop(key, maxBatch);
    if (payloads == null || payloads.isEmpty()) {
      return List.of();
    }
    List<byte[]> batch = new ArrayList<>(payloads.size());
    for (String payload : payloads) {
      batch.add(payload.getBytes(StandardCharsets.UTF_8));
    }
    log.debug("Popped {} payloads from {}", batch.size(), key);
    return batch;
  }
}
