/*
 * Where: Notification application configuration binding
 * What: Holds the event processing store TTL
 * Why: Payloads must outlive the ingest pipeline but not linger forever
 */
package com.issuealert.notification.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notification.event-store")
public record EventStoreProperties(Duration ttl) {

  private static final Duration DEFAULT_TTL = Duration.ofHours(24);

  public EventStoreProperties {
    if (ttl == null) {
      ttl = DEFAULT_TTL;
    }
  }
}
