/*
 * どこで: Notification Repository 層
 * 何を: digest バッファ (レコード列 + タイムライン) の原子的操作を抽象化する
 * なぜ: Redis Lua 実装とインメモリ実装を差し替え可能にし、サービスから保存形式を隠すため
 */
package com.issuealert.notification.repository;

import com.issuealert.notification.model.DigestKey;
import com.issuealert.notification.model.DigestRecord;
import com.issuealert.notification.model.DigestTimeline;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface DigestRepository {

  /**
   * 役割: レコードを key のバッファへ追記し、タイムラインを進める。
   * 動作: タイムラインが無ければ READY で作成して true を返す (即時配信の合図)。
   * WAITING なら deadline を min(now + increment, windowStart + maximum) に延ばして false、READY なら false。
   */
  boolean add(
      DigestKey key,
      DigestRecord record,
      Duration incrementDelay,
      Duration maximumDelay,
      Instant now);

  /**
   * 役割: バッファを読み出して空にする (読み出しと削除は不可分)。
   * 動作: 1 件以上あればタイムラインを WAITING (windowStart = now) にし、0 件ならタイムラインを削除する。
   */
  List<DigestRecord> drain(DigestKey key, Instant now);

  /**
   * 役割: 配信できなかった drain 済みレコードをバッファ先頭へ戻す。
   * 動作: タイムラインを READY (readySince = now) にし、readyTimeout 経過後の claimDue で再び取り出せるようにする。
   */
  void restore(DigestKey key, List<DigestRecord> records, Instant now);

  /**
   * 役割: deadline を過ぎた WAITING と readyTimeout を超えて滞留した READY を READY として取り出す。
   * 前提: 戻り値の key は呼び出し側が drain する。
   */
  List<DigestKey> claimDue(Instant now, Duration readyTimeout, int limit);

  Optional<DigestTimeline> findTimeline(DigestKey key);
}
