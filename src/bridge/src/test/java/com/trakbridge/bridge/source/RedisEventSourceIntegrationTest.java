package com.trakbridge.bridge.source;

import static org.assertj.core.api.Assertions.assertThat;

import com.trakbridge.bridge.config.BridgeProperties;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@Testcontainers(disabledWithoutDocker = true)
class RedisEventSourceIntegrationTest {

  private static final String KEY = "trakbridge:cot:in";

  @Container
  private static final GenericContainer<?> REDIS =
      new GenericContainer<>("redis:7.2-alpine").withExposedPorts(6379);

  private static LettuceConnectionFactory connectionFactory;

  private StringRedisTemplate redisTemplate;

  @BeforeAll
  static void setupRedis() {
    RedisStandaloneConfiguration config =
        new RedisStandaloneConfiguration(REDIS.getHost(), REDIS.getMappedPort(6379));
    connectionFactory = new LettuceConnectionFactory(config);
    connectionFactory.afterPropertiesSet();
  }

  @AfterAll
  static void shutdownRedis() {
    if (connectionFactory != null) {
      connectionFactory.destroy();
    }
  }

  @BeforeEach
  void clearRedis() {
    redisTemplate = new StringRedisTemplate(connectionFactory);
    redisTemplate.afterPropertiesSet();
    try (RedisConnection connection = connectionFactory.getConnection()) {
      connection.serverCommands().flushAll();
    }
  }

  @Test
  void pollPopsAtMostMaxBatchInPushOrder() {
    redisTemplate.opsForList().rightPushAll(KEY, cot("a"), cot("b"), cot("c"));
    RedisEventSource source = new RedisEventSource(redisTemplate, properties(2));

    List<byte[]> first = source.poll();
    List<byte[]> second = source.poll();

    assertThat(first).extracting(RedisEventSourceIntegrationTest::text)
        .containsExactly(cot("a"), cot("b"));
    assertThat(second).extracting(RedisEventSourceIntegrationTest::text)
        .containsExactly(cot("c"));
    assertThat(source.poll()).isEmpty();
  }

  @Test
  void pollOnMissingKeyReturnsEmpty() {
    RedisEventSource source = new RedisEventSource(redisTemplate, properties(10));

    assertThat(source.poll()).isEmpty();
  }

  private static BridgeProperties properties(int maxBatch) {
    return new BridgeProperties(
        new BridgeProperties.Queue(500, 400, Duration.ofMinutes(15), 60_000L),
        new BridgeProperties.Dispatch(20, 100L, 3, 0L, 1000),
        List.of(),
        new BridgeProperties.Sources(
            1_000L,
            new BridgeProperties.Redis(true, KEY, maxBatch),
            new BridgeProperties.Traccar(false, null, null, null, null, 300L, 5)),
        new BridgeProperties.Parser("cot", "uid", "time"));
  }

  private static String cot(String uid) {
    return "<event uid=\"" + uid + "\" time=\"2025-03-01T12:00:00Z\"/>";
  }

  private static String text(byte[] payload) {
    return new String(payload, StandardCharsets.UTF_8);
  }
}
