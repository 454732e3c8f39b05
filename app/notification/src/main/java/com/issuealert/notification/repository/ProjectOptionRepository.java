/*
 * どこで: Notification データアクセス
 * 何を: project_options のキー/値を取得する
 * なぜ: digest 遅延や件名プレフィックスをプロジェクト単位で上書きするため
 */
package com.issuealert.notification.repository;

import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ProjectOptionRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<String> getValue(long projectId, String key) {
    final String sql =
        """
        SELECT option_value
        FROM project_options
        WHERE project_id = :projectId
          AND option_key = :key
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("projectId", projectId).addValue("key", key);
    return jdbcTemplate.queryForList(sql, params, String.class).stream().findFirst();
  }
}
