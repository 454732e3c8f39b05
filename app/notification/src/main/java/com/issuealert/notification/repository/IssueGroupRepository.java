/*
 * どこで: Notification データアクセス
 * 何を: issue_groups を参照する
 */
package com.issuealert.notification.repository;

import com.issuealert.notification.model.IssueGroup;
import java.util.Locale;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class IssueGroupRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<IssueGroup> findById(long groupId) {
    final String sql =
        """
        SELECT g.group_id, g.project_id, p.slug, g.short_id, g.title, g.logger, g.level
        FROM issue_groups g
        JOIN projects p ON p.project_id = g.project_id
        WHERE g.group_id = :groupId
        """;
    return jdbcTemplate
        .query(
            sql,
            new MapSqlParameterSource().addValue("groupId", groupId),
            (rs, rowNum) ->
                new IssueGroup(
                    rs.getLong("group_id"),
                    rs.getLong("project_id"),
                    // 表示用の短縮 ID はプロジェクト slug を前置する (例: BACKEND-1A)
                    rs.getString("slug").toUpperCase(Locale.ROOT)
                        + "-"
                        + rs.getString("short_id"),
                    rs.getString("title"),
                    rs.getString("logger"),
                    rs.getString("level")))
        .stream()
        .findFirst();
  }
}
