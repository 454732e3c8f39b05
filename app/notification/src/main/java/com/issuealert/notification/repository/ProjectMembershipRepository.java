/*
 * どこで: Notification データアクセス
 * 何を: プロジェクト/チーム/メンバーの所属関係を参照する
 * なぜ: 受信者解決でプロジェクトに属するユーザーだけを対象にするため
 */
package com.issuealert.notification.repository;

import com.issuealert.notification.model.Project;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ProjectMembershipRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<Project> findProject(long projectId) {
    final String sql =
        """
        SELECT project_id, organization_id, slug, name, enhanced_privacy
        FROM projects
        WHERE project_id = :projectId
        """;
    final List<Project> projects =
        jdbcTemplate.query(
            sql,
            new MapSqlParameterSource().addValue("projectId", projectId),
            (rs, rowNum) ->
                new Project(
                    rs.getLong("project_id"),
                    rs.getLong("organization_id"),
                    rs.getString("slug"),
                    rs.getString("name"),
                    rs.getBoolean("enhanced_privacy")));
    return projects.stream().findFirst();
  }

  public boolean hasTeams(long projectId) {
    final String sql =
        "SELECT EXISTS (SELECT 1 FROM project_teams WHERE project_id = :projectId)";
    final Boolean exists =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource().addValue("projectId", projectId), Boolean.class);
    return Boolean.TRUE.equals(exists);
  }

  /** プロジェクトのいずれかのチームに属する有効ユーザー。 */
  public Set<Long> findMemberUserIds(long projectId) {
    final String sql =
        """
        SELECT DISTINCT u.user_id
        FROM users u
        JOIN team_members tm ON tm.user_id = u.user_id
        JOIN project_teams pt ON pt.team_id = tm.team_id
        WHERE pt.project_id = :projectId
          AND u.is_active
        ORDER BY u.user_id
        """;
    return new LinkedHashSet<>(
        jdbcTemplate.queryForList(
            sql, new MapSqlParameterSource().addValue("projectId", projectId), Long.class));
  }

  public boolean isTeamInProject(long teamId, long projectId) {
    final String sql =
        """
        SELECT EXISTS (
          SELECT 1 FROM project_teams WHERE team_id = :teamId AND project_id = :projectId
        )
        """;
    final Boolean exists =
        jdbcTemplate.queryForObject(
            sql,
            new MapSqlParameterSource().addValue("teamId", teamId).addValue("projectId", projectId),
            Boolean.class);
    return Boolean.TRUE.equals(exists);
  }

  public Set<Long> findTeamMemberUserIds(Collection<Long> teamIds) {
    if (teamIds.isEmpty()) {
      return Set.of();
    }
    final String sql =
        """
        SELECT DISTINCT u.user_id
        FROM users u
        JOIN team_members tm ON tm.user_id = u.user_id
        WHERE tm.team_id IN (:teamIds)
          AND u.is_active
        ORDER BY u.user_id
        """;
    return new LinkedHashSet<>(
        jdbcTemplate.queryForList(
            sql, new MapSqlParameterSource().addValue("teamIds", teamIds), Long.class));
  }

  /** プロジェクトのチーム経由で所属しているユーザーのみ返す。 */
  public Optional<Long> findMemberInProject(long userId, long projectId) {
    final String sql =
        """
        SELECT DISTINCT u.user_id
        FROM users u
        JOIN team_members tm ON tm.user_id = u.user_id
        JOIN project_teams pt ON pt.team_id = tm.team_id
        WHERE u.user_id = :userId
          AND pt.project_id = :projectId
        """;
    return jdbcTemplate
        .queryForList(
            sql,
            new MapSqlParameterSource().addValue("userId", userId).addValue("projectId", projectId),
            Long.class)
        .stream()
        .findFirst();
  }
}
