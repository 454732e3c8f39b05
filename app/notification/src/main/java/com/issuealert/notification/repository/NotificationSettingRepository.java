/*
 * どこで: Notification データアクセス
 * 何を: notification_settings をユーザー集合と親スコープ (project/organization/user) で取得する
 * なぜ: 参加者/受信者判定に必要な設定だけを 1 クエリで読むため
 */
package com.issuealert.notification.repository;

import com.issuealert.notification.model.NotificationProvider;
import com.issuealert.notification.model.NotificationScopeType;
import com.issuealert.notification.model.NotificationSetting;
import com.issuealert.notification.model.NotificationSettingOption;
import com.issuealert.notification.model.NotificationSettingType;
import com.issuealert.notification.model.Project;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationSettingRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public List<NotificationSetting> findForUsersByParent(
      NotificationProvider provider,
      NotificationSettingType type,
      Project parent,
      Collection<Long> userIds) {
    if (userIds.isEmpty()) {
      return List.of();
    }
    final String sql =
        """
        SELECT user_id, provider, type, scope_type, scope_identifier, value
        FROM notification_settings
        WHERE user_id IN (:userIds)
          AND provider = :provider
          AND type = :type
          AND (
            (scope_type = 'project' AND scope_identifier = :projectId)
            OR (scope_type = 'organization' AND scope_identifier = :organizationId)
            OR (scope_type = 'user' AND scope_identifier = user_id)
          )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userIds", userIds)
            .addValue("provider", toDbValue(provider))
            .addValue("type", toDbValue(type))
            .addValue("projectId", parent.projectId())
            .addValue("organizationId", parent.organizationId());
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  static String toDbValue(Enum<?> value) {
    return value.name().toLowerCase(Locale.ROOT);
  }

  private NotificationSetting mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new NotificationSetting(
        rs.getLong("user_id"),
        NotificationProvider.valueOf(upper(rs.getString("provider"))),
        NotificationSettingType.valueOf(upper(rs.getString("type"))),
        NotificationScopeType.valueOf(upper(rs.getString("scope_type"))),
        rs.getLong("scope_identifier"),
        NotificationSettingOption.valueOf(upper(rs.getString("value"))));
  }

  private String upper(String value) {
    return value.toUpperCase(Locale.ROOT);
  }
}
