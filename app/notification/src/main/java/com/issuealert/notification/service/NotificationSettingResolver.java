/*
 * どこで: Notification サービス層
 * 何を: 通知設定をユーザー/スコープ別に整理し、最も具体的な値と参加判定を求める
 * なぜ: 参加者解決と受信者解決で同じ優先順位 (project > organization > user) を使うため
 */
package com.issuealert.notification.service;

import com.issuealert.notification.model.GroupSubscription;
import com.issuealert.notification.model.NotificationScopeType;
import com.issuealert.notification.model.NotificationSetting;
import com.issuealert.notification.model.NotificationSettingOption;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class NotificationSettingResolver {

  private NotificationSettingResolver() {}

  /** 設定行をユーザー -> スコープ -> 値 に変換する。設定の無いユーザーは空 Map を持つ。 */
  public static Map<Long, Map<NotificationScopeType, NotificationSettingOption>> byUser(
      List<NotificationSetting> settings, Collection<Long> userIds) {
    final Map<Long, Map<NotificationScopeType, NotificationSettingOption>> result =
        new LinkedHashMap<>();
    for (Long userId : userIds) {
      result.put(userId, new EnumMap<>(NotificationScopeType.class));
    }
    for (NotificationSetting setting : settings) {
      final Map<NotificationScopeType, NotificationSettingOption> byScope =
          result.get(setting.userId());
      if (byScope != null) {
        byScope.put(setting.scopeType(), setting.value());
      }
    }
    return result;
  }

  /** DEFAULT 以外で最も具体的なスコープの値。どのスコープにも無ければ DEFAULT。 */
  public static NotificationSettingOption mostSpecific(
      Map<NotificationScopeType, NotificationSettingOption> byScope) {
    return byScope.entrySet().stream()
        .filter(entry -> entry.getValue() != NotificationSettingOption.DEFAULT)
        .max(Comparator.comparingInt(entry -> entry.getKey().specificity()))
        .map(Map.Entry::getValue)
        .orElse(NotificationSettingOption.DEFAULT);
  }

  /**
   * 明示購読があり有効かつ NEVER でなければ参加。購読が無い場合は ALWAYS のときだけ参加する。
   *
   * @param subscription 購読が無ければ null
   */
  public static boolean shouldBeParticipating(
      GroupSubscription subscription, NotificationSettingOption value) {
    if (subscription != null) {
      return subscription.active() && value != NotificationSettingOption.NEVER;
    }
    return value == NotificationSettingOption.ALWAYS;
  }
}
