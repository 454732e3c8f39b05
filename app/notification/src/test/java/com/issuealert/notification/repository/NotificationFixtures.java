/*
 * どこで: Notification 統合テストの補助
 * 何を: 参照データと通知テーブルを FK 順に空にする
 * なぜ: コンテキストキャッシュで DB を共有するテスト間の干渉を防ぐため
 */
package com.issuealert.notification.repository;

import org.springframework.jdbc.core.JdbcTemplate;

public final class NotificationFixtures {

  private NotificationFixtures() {}

  public static void reset(JdbcTemplate jdbcTemplate) {
    jdbcTemplate.execute(
        "TRUNCATE notifications, ownership_rule_owners, ownership_rules, project_ownership,"
            + " project_options, notification_settings, group_subscriptions, issue_groups,"
            + " team_members, users, project_teams, teams, projects RESTART IDENTITY CASCADE");
  }
}
