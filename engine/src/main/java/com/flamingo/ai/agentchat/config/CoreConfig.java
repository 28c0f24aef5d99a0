package com.flamingo.ai.agentchat.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Clock and metrics wiring shared by the engine services. */
@Configuration
public class CoreConfig {

  /**
   * Enables the @Timed annotation on session registry calls.
   *
   * @param registry the meter registry
   * @return the timed aspect bean
   */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  @Bean
  public Clock clock() {
    return Clock.systemDefaultZone();
  }
}
