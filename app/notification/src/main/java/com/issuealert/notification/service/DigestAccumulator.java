/*
 * どこで: Notification サービス層
 * 何を: digest key ごとのバッファへの追記/drain/期限到来 key の取得を行う
 * なぜ: 即時配信か遅延配信かの判定を保存先実装から独立させ、呼び出し側へ返すため
 */
package com.issuealert.notification.service;

import com.issuealert.notification.config.NotificationDigestProperties;
import com.issuealert.notification.model.Digest;
import com.issuealert.notification.model.DigestKey;
import com.issuealert.notification.model.DigestRecord;
import com.issuealert.notification.repository.DigestRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class DigestAccumulator {

  private static final Logger logger = LoggerFactory.getLogger(DigestAccumulator.class);

  private final DigestRepository digestRepository;
  private final ProjectNotificationOptions projectOptions;
  private final NotificationDigestProperties properties;
  private final NotificationMetrics metrics;
  private final Clock clock;

  /** プロジェクト option (無ければ既定値) の遅延で追記する。 */
  public boolean add(DigestKey key, DigestRecord record) {
    return add(
        key,
        record,
        projectOptions.incrementDelay(key.projectId()),
        projectOptions.maximumDelay(key.projectId()));
  }

  /**
   * レコードを追記する。
   *
   * @return true ならバッファが空からの最初のレコードで、呼び出し側は今すぐ flush を起動する
   */
  public boolean add(
      DigestKey key, DigestRecord record, Duration incrementDelay, Duration maximumDelay) {
    final boolean immediate =
        digestRepository.add(key, record, incrementDelay, maximumDelay, Instant.now(clock));
    metrics.recordDigestAdded(immediate);
    logger.debug("digest record added key={} eventId={} immediate={}",
        key, record.eventId(), immediate);
    return immediate;
  }

  /** バッファを読み出して空にし、digest を組み立てる。空なら空の digest。 */
  public Digest drain(DigestKey key) {
    final List<DigestRecord> records = drainRecords(key);
    if (records.isEmpty()) {
      return Digest.empty();
    }
    return Digest.build(records);
  }

  public List<DigestRecord> drainRecords(DigestKey key) {
    return digestRepository.drain(key, Instant.now(clock));
  }

  /** drain 済みレコードをバッファへ戻し、key を ready-timeout 後の再 claim 対象にする。 */
  public void restore(DigestKey key, List<DigestRecord> records) {
    digestRepository.restore(key, records, Instant.now(clock));
    logger.info("digest records restored key={} records={}", key, records.size());
  }

  public List<DigestKey> claimDue() {
    return digestRepository.claimDue(
        Instant.now(clock), properties.readyTimeout(), properties.batchSize());
  }
}
