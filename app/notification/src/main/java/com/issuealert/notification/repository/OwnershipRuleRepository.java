/*
 * どこで: Notification データアクセス
 * 何を: プロジェクトの ownership 設定 (fallthrough とルール/オーナー) を取得する
 * なぜ: Issue オーナー宛て通知の受信者をルールから決めるため
 */
package com.issuealert.notification.repository;

import com.issuealert.notification.model.Owner;
import com.issuealert.notification.model.OwnerType;
import com.issuealert.notification.model.OwnershipRule;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class OwnershipRuleRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<Boolean> findFallthrough(long projectId) {
    final String sql = "SELECT fallthrough FROM project_ownership WHERE project_id = :projectId";
    return jdbcTemplate
        .queryForList(sql, new MapSqlParameterSource().addValue("projectId", projectId), Boolean.class)
        .stream()
        .findFirst();
  }

  /** position 順のルール。オーナーが 1 件も無いルールも返す。 */
  public List<OwnershipRule> findRules(long projectId) {
    final String sql =
        """
        SELECT r.rule_id, r.matcher_type, r.pattern, o.owner_type, o.owner_id
        FROM ownership_rules r
        LEFT JOIN ownership_rule_owners o ON o.rule_id = r.rule_id
        WHERE r.project_id = :projectId
        ORDER BY r.position, r.rule_id, o.owner_type, o.owner_id
        """;
    final Map<Long, RuleRow> rows = new LinkedHashMap<>();
    jdbcTemplate.query(
        sql,
        new MapSqlParameterSource().addValue("projectId", projectId),
        rs -> {
          final long ruleId = rs.getLong("rule_id");
          RuleRow row = rows.get(ruleId);
          if (row == null) {
            row = new RuleRow(ruleId, rs.getString("matcher_type"), rs.getString("pattern"));
            rows.put(ruleId, row);
          }
          final String ownerType = rs.getString("owner_type");
          if (ownerType != null) {
            row.owners.add(
                new Owner(OwnerType.valueOf(ownerType.toUpperCase(Locale.ROOT)), rs.getLong("owner_id")));
          }
        });
    return rows.values().stream()
        .map(row -> new OwnershipRule(row.ruleId, row.matcherType, row.pattern, row.owners))
        .toList();
  }

  private static final class RuleRow {
    private final long ruleId;
    private final String matcherType;
    private final String pattern;
    private final List<Owner> owners = new ArrayList<>();

    private RuleRow(long ruleId, String matcherType, String pattern) {
      this.ruleId = ruleId;
      this.matcherType = matcherType;
      this.pattern = pattern;
    }
  }
}
