/*
 * どこで: Notification データアクセス
 * 何を: group_subscriptions の登録/検索を担う
 * なぜ: 一意制約違反を DuplicateKeyException として上位の冪等処理へ渡すため
 */
package com.issuealert.notification.repository;

import static com.issuealert.common.JdbcTimestampUtils.toTimestamp;

import com.issuealert.notification.model.GroupSubscription;
import com.issuealert.notification.model.SubscriptionReason;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class GroupSubscriptionRepository {

  private static final String INSERT_SQL =
      """
      INSERT INTO group_subscriptions (project_id, group_id, user_id, is_active, reason, created_at)
      VALUES (:projectId, :groupId, :userId, :active, :reason, :createdAt)
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** 一意制約 (group_id, user_id) 違反時は DuplicateKeyException を送出する。 */
  public void insert(GroupSubscription subscription) {
    jdbcTemplate.update(INSERT_SQL, toParams(subscription));
  }

  /** 1 バッチで登録する。1 行でも衝突すれば DuplicateKeyException になる。 */
  public void insertAll(List<GroupSubscription> subscriptions) {
    if (subscriptions.isEmpty()) {
      return;
    }
    final SqlParameterSource[] batch =
        subscriptions.stream().map(this::toParams).toArray(SqlParameterSource[]::new);
    jdbcTemplate.batchUpdate(INSERT_SQL, batch);
  }

  public Set<Long> findSubscribedUserIds(long groupId, Collection<Long> userIds) {
    if (userIds.isEmpty()) {
      return Set.of();
    }
    final String sql =
        """
        SELECT user_id
        FROM group_subscriptions
        WHERE group_id = :groupId
          AND user_id IN (:userIds)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("groupId", groupId).addValue("userIds", userIds);
    return new HashSet<>(jdbcTemplate.queryForList(sql, params, Long.class));
  }

  public List<GroupSubscription> findByGroupAndUsers(long groupId, Collection<Long> userIds) {
    if (userIds.isEmpty()) {
      return List.of();
    }
    final String sql =
        """
        SELECT project_id, group_id, user_id, is_active, reason, created_at
        FROM group_subscriptions
        WHERE group_id = :groupId
          AND user_id IN (:userIds)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("groupId", groupId).addValue("userIds", userIds);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int countByGroup(long groupId) {
    final String sql = "SELECT COUNT(*) FROM group_subscriptions WHERE group_id = :groupId";
    final Integer count =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource().addValue("groupId", groupId), Integer.class);
    return count == null ? 0 : count;
  }

  private MapSqlParameterSource toParams(GroupSubscription subscription) {
    return new MapSqlParameterSource()
        .addValue("projectId", subscription.projectId())
        .addValue("groupId", subscription.groupId())
        .addValue("userId", subscription.userId())
        .addValue("active", subscription.active())
        .addValue("reason", subscription.reason().code())
        .addValue("createdAt", toTimestamp(subscription.createdAt()));
  }

  private GroupSubscription mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new GroupSubscription(
        rs.getLong("project_id"),
        rs.getLong("group_id"),
        rs.getLong("user_id"),
        rs.getBoolean("is_active"),
        SubscriptionReason.fromCode(rs.getInt("reason")),
        rs.getTimestamp("created_at").toInstant());
  }
}
