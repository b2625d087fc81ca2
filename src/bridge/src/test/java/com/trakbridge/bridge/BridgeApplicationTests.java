package com.trakbridge.bridge;

import static org.assertj.core.api.Assertions.assertThat;

import com.trakbridge.bridge.dispatch.DispatchService;
import com.trakbridge.bridge.source.EventSource;
import com.trakbridge.queue.DestinationRegistry;
import com.trakbridge.queue.event.CotEventParser;
import com.trakbridge.queue.event.EventParser;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class BridgeApplicationTests {
  @Autowired
  private DestinationRegistry registry;

  @Autowired
  private ApplicationContext applicationContext;

  @Autowired
  private EventParser eventParser;

  @MockBean
  private DispatchService dispatchService;

  @Test
  void contextLoadsWithConfiguredDestinations() {
    assertThat(registry.destinationIds()).containsExactly("tak-primary");
    assertThat(registry.queue("tak-primary")).get()
        .satisfies(queue -> assertThat(queue.settings().maxDevices()).isEqualTo(500));
  }

  @Test
  void cotParserIsTheDefault() {
    assertThat(eventParser).isInstanceOf(CotEventParser.class);
  }

  @Test
  void sourcesAreDisabledByDefault() {
    assertThat(applicationContext.getBeansOfType(EventSource.class)).isEmpty();
  }
}
