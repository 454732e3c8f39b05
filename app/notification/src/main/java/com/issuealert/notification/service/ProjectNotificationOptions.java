/*
 * どこで: Notification サービス層
 * 何を: digest 遅延と件名プレフィックスをプロジェクト option から解決し、無ければ設定値を使う
 * なぜ: プロジェクトごとの上書きを 1 箇所で解釈するため
 */
package com.issuealert.notification.service;

import com.issuealert.notification.config.NotificationDigestProperties;
import com.issuealert.notification.config.NotificationMailProperties;
import com.issuealert.notification.repository.ProjectOptionRepository;
import java.time.Duration;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ProjectNotificationOptions {

  private static final Logger logger = LoggerFactory.getLogger(ProjectNotificationOptions.class);

  static final String INCREMENT_DELAY_KEY = "digests:mail:increment_delay";
  static final String MAXIMUM_DELAY_KEY = "digests:mail:maximum_delay";
  static final String SUBJECT_PREFIX_KEY = "mail:subject_prefix";

  private final ProjectOptionRepository optionRepository;
  private final NotificationDigestProperties digestProperties;
  private final NotificationMailProperties mailProperties;

  public Duration incrementDelay(long projectId) {
    return seconds(projectId, INCREMENT_DELAY_KEY).orElse(digestProperties.defaultIncrementDelay());
  }

  /** increment より短い maximum は increment に揃える。 */
  public Duration maximumDelay(long projectId) {
    final Duration maximum =
        seconds(projectId, MAXIMUM_DELAY_KEY).orElse(digestProperties.defaultMaximumDelay());
    final Duration increment = incrementDelay(projectId);
    return maximum.compareTo(increment) < 0 ? increment : maximum;
  }

  public String subjectPrefix(long projectId) {
    return optionRepository
        .getValue(projectId, SUBJECT_PREFIX_KEY)
        .filter(value -> !value.isBlank())
        .orElse(mailProperties.subjectPrefix() == null ? "" : mailProperties.subjectPrefix());
  }

  private Optional<Duration> seconds(long projectId, String key) {
    final Optional<String> raw = optionRepository.getValue(projectId, key);
    if (raw.isEmpty()) {
      return Optional.empty();
    }
    try {
      final long value = Long.parseLong(raw.get().trim());
      return value > 0 ? Optional.of(Duration.ofSeconds(value)) : Optional.empty();
    } catch (NumberFormatException ex) {
      logger.warn("invalid project option ignored projectId={} key={} value={}",
          projectId, key, raw.get());
      return Optional.empty();
    }
  }
}
