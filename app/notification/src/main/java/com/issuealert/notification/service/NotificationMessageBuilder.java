/*
 * どこで: Notification サービス層
 * 何を: 単一アラート/digest/フィードバックの受信者 1 人分の配信要求を組み立てる
 * なぜ: 件名・テンプレート参照・コンテキスト・ヘッダの形を配信経路ごとに 1 箇所で決めるため
 */
package com.issuealert.notification.service;

import com.issuealert.common.event.UserReportPayload;
import com.issuealert.notification.config.NotificationMailProperties;
import com.issuealert.notification.model.AlertRule;
import com.issuealert.notification.model.DeliveryRequest;
import com.issuealert.notification.model.Digest;
import com.issuealert.notification.model.DigestMetadata;
import com.issuealert.notification.model.DigestRecord;
import com.issuealert.notification.model.IssueEvent;
import com.issuealert.notification.model.IssueGroup;
import com.issuealert.notification.model.Project;
import com.issuealert.notification.model.SubscriptionReason;
import com.issuealert.notification.model.SuspectCommit;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

@Component
@RequiredArgsConstructor
public class NotificationMessageBuilder {

  static final String TYPE_ISSUE_ALERT = "notify.error";
  static final String TYPE_DIGEST = "notify.digest";
  static final String TYPE_USER_REPORT = "notify.user-report";
  static final String REFERENCE_GROUP = "group";
  static final String REFERENCE_PROJECT = "project";

  static final String HEADER_LOGGER = "X-IssueAlert-Logger";
  static final String HEADER_LOGGER_LEVEL = "X-IssueAlert-Logger-Level";
  static final String HEADER_PROJECT = "X-IssueAlert-Project";
  static final String HEADER_REPLY_TO = "X-IssueAlert-Reply-To";
  static final String HEADER_CATEGORY = "X-SMTPAPI";

  private static final DateTimeFormatter SUBJECT_DATE =
      DateTimeFormatter.ofPattern("MMM d, yyyy, h:mm a z", Locale.ENGLISH)
          .withZone(ZoneId.of("UTC"));

  private final ProjectNotificationOptions projectOptions;
  private final UnsubscribeLinkSigner linkSigner;
  private final NotificationMailProperties mailProperties;

  public DeliveryRequest buildIssueAlert(
      Project project,
      IssueEvent event,
      List<AlertRule> rules,
      List<SuspectCommit> commits,
      long userId) {
    final IssueGroup group = event.group();
    final String title = event.title() == null || event.title().isBlank() ? group.title() : event.title();
    final String subject =
        projectOptions.subjectPrefix(project.projectId())
            + group.qualifiedShortId()
            + " - "
            + title;

    final Map<String, Object> context = new LinkedHashMap<>();
    context.put("project_label", project.fullName());
    context.put("group", groupContext(group));
    context.put("event", eventContext(event));
    context.put("link", groupLink(project, group, event.environment()));
    context.put("rules", ruleContext(project, rules));
    context.put("enhanced_privacy", project.enhancedPrivacy());
    context.put("commits", commitContext(commits));
    context.put("environment", event.environment());
    if (!project.enhancedPrivacy()) {
      // enhanced privacy ではタグ (PII を含み得る) を載せない
      context.put("tags", new LinkedHashMap<>(event.tags()));
    }
    context.put(
        "unsubscribe_link",
        linkSigner.sign(userId, UnsubscribeLinkSigner.Scope.PROJECT, project.projectId(), "alert_email"));

    final Map<String, String> headers = new LinkedHashMap<>();
    headers.put(HEADER_LOGGER, group.logger());
    headers.put(HEADER_LOGGER_LEVEL, group.level());
    headers.put(HEADER_PROJECT, project.slug());
    headers.put(HEADER_REPLY_TO, "group-" + group.groupId());
    headers.put(HEADER_CATEGORY, category("issue_alert_email"));

    return new DeliveryRequest(
        userId,
        subject,
        "issue-alert/error.txt",
        "issue-alert/error.html",
        TYPE_ISSUE_ALERT,
        context,
        headers,
        REFERENCE_GROUP,
        group.groupId());
  }

  public DeliveryRequest buildDigest(
      Project project, Digest digest, DigestMetadata metadata, long userId) {
    final long firstGroupId = metadata.firstGroupId();
    final String shortId =
        digest.group(firstGroupId).map(IssueGroup::qualifiedShortId).orElse(String.valueOf(firstGroupId));
    final String subject =
        projectOptions.subjectPrefix(project.projectId()) + digestSubject(shortId, metadata);

    final Map<String, Object> context = new LinkedHashMap<>();
    context.put("start", metadata.start().toString());
    context.put("end", metadata.end().toString());
    context.put("project", projectContext(project));
    context.put("counts", countContext(metadata));
    context.put("digest", digestContext(project, digest));
    context.put(
        "unsubscribe_link",
        linkSigner.sign(userId, UnsubscribeLinkSigner.Scope.PROJECT, project.projectId(), "alert_digest"));

    final Map<String, String> headers = new LinkedHashMap<>();
    headers.put(HEADER_PROJECT, project.slug());
    headers.put(HEADER_CATEGORY, category("digest_email"));

    return new DeliveryRequest(
        userId,
        subject,
        "digests/body.txt",
        "digests/body.html",
        TYPE_DIGEST,
        context,
        headers,
        REFERENCE_PROJECT,
        project.projectId());
  }

  public DeliveryRequest buildUserReport(
      Project project,
      IssueGroup group,
      UserReportPayload report,
      SubscriptionReason reason,
      long userId) {
    final String subject =
        projectOptions.subjectPrefix(project.projectId())
            + group.qualifiedShortId()
            + " - New Feedback from "
            + report.name();
    final String issuePath =
        "/" + project.organizationId() + "/" + project.slug() + "/issues/" + group.groupId() + "/";

    final Map<String, Object> context = new LinkedHashMap<>();
    context.put("project", projectContext(project));
    context.put("project_link", absolute("/" + project.organizationId() + "/" + project.slug() + "/"));
    context.put("issue_link", absolute(issuePath));
    context.put("link", absolute(issuePath + "feedback/"));
    context.put("group", groupContext(group));
    final Map<String, Object> reportContext = new LinkedHashMap<>();
    reportContext.put("report_id", report.reportId());
    reportContext.put("name", report.name());
    reportContext.put("email", report.email());
    reportContext.put("comments", report.comments());
    context.put("report", reportContext);
    context.put("enhanced_privacy", project.enhancedPrivacy());
    context.put("reason", reason.description());
    context.put(
        "unsubscribe_link",
        linkSigner.sign(userId, UnsubscribeLinkSigner.Scope.ISSUE, group.groupId(), null));

    final Map<String, String> headers = new LinkedHashMap<>();
    headers.put(HEADER_PROJECT, project.slug());
    headers.put(HEADER_CATEGORY, category("user_report_email"));

    return new DeliveryRequest(
        userId,
        subject,
        "activity/new-user-feedback.txt",
        "activity/new-user-feedback.html",
        TYPE_USER_REPORT,
        context,
        headers,
        REFERENCE_GROUP,
        group.groupId());
  }

  /** "{short_id} - {n} new alert(s) since {date}"。n は digest 内の Issue 数。 */
  static String digestSubject(String shortId, DigestMetadata metadata) {
    final int count = metadata.counts().size();
    return shortId
        + " - "
        + count
        + " new "
        + (count == 1 ? "alert" : "alerts")
        + " since "
        + SUBJECT_DATE.format(metadata.start());
  }

  private Map<String, Object> groupContext(IssueGroup group) {
    final Map<String, Object> context = new LinkedHashMap<>();
    context.put("id", group.groupId());
    context.put("short_id", group.qualifiedShortId());
    context.put("title", group.title());
    context.put("level", group.level());
    return context;
  }

  private Map<String, Object> eventContext(IssueEvent event) {
    final Map<String, Object> context = new LinkedHashMap<>();
    context.put("id", event.eventId());
    context.put("title", event.title());
    context.put("occurred_at", event.occurredAt() == null ? null : event.occurredAt().toString());
    return context;
  }

  private Map<String, Object> projectContext(Project project) {
    final Map<String, Object> context = new LinkedHashMap<>();
    context.put("id", project.projectId());
    context.put("slug", project.slug());
    context.put("name", project.fullName());
    return context;
  }

  private List<Map<String, Object>> ruleContext(Project project, List<AlertRule> rules) {
    final List<Map<String, Object>> result = new ArrayList<>();
    for (AlertRule rule : rules) {
      final Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("label", rule.label());
      entry.put(
          "link",
          absolute(
              "/organizations/"
                  + project.organizationId()
                  + "/alerts/rules/"
                  + project.slug()
                  + "/"
                  + rule.ruleId()
                  + "/"));
      result.add(entry);
    }
    return result;
  }

  // 同じコミットは 1 回だけ、score の高い順
  private List<Map<String, Object>> commitContext(List<SuspectCommit> commits) {
    final Map<String, SuspectCommit> unique = new LinkedHashMap<>();
    for (SuspectCommit commit : commits) {
      unique.putIfAbsent(commit.id(), commit);
    }
    return unique.values().stream()
        .sorted(Comparator.comparingInt(SuspectCommit::score).reversed())
        .map(
            commit -> {
              final Map<String, Object> entry = new LinkedHashMap<>();
              entry.put("id", commit.id());
              entry.put("short_id", commit.id().length() > 7 ? commit.id().substring(0, 7) : commit.id());
              entry.put("subject", commit.message() == null ? "" : commit.message().split("\n", 2)[0]);
              entry.put("author", commit.authorEmail());
              entry.put("score", commit.score());
              return entry;
            })
        .toList();
  }

  private List<Map<String, Object>> countContext(DigestMetadata metadata) {
    final List<Map<String, Object>> result = new ArrayList<>();
    metadata
        .counts()
        .forEach(
            (groupId, count) -> {
              final Map<String, Object> entry = new LinkedHashMap<>();
              entry.put("group_id", groupId);
              entry.put("count", count);
              result.add(entry);
            });
    return result;
  }

  private List<Map<String, Object>> digestContext(Project project, Digest digest) {
    final List<Map<String, Object>> result = new ArrayList<>();
    for (AlertRule rule : digest.rules()) {
      final List<Map<String, Object>> groups = new ArrayList<>();
      for (Map.Entry<Long, List<DigestRecord>> entry : digest.groups(rule).entrySet()) {
        final DigestRecord latest = entry.getValue().get(0);
        final Map<String, Object> groupEntry = groupContext(latest.event().group());
        groupEntry.put("event_count", entry.getValue().size());
        groupEntry.put("last_seen", latest.timestamp().toString());
        groupEntry.put("link", groupLink(project, latest.event().group(), null));
        groups.add(groupEntry);
      }
      final Map<String, Object> ruleEntry = new LinkedHashMap<>();
      ruleEntry.put("rule_id", rule.ruleId());
      ruleEntry.put("label", rule.label());
      ruleEntry.put("groups", groups);
      result.add(ruleEntry);
    }
    return result;
  }

  private String groupLink(Project project, IssueGroup group, String environment) {
    final UriComponentsBuilder builder =
        UriComponentsBuilder.fromHttpUrl(mailProperties.baseUrl())
            .path("/organizations/{organizationId}/issues/{groupId}/")
            .queryParam("referrer", "alert_email");
    if (environment != null && !environment.isBlank()) {
      builder.queryParam("environment", environment);
    }
    return builder.buildAndExpand(project.organizationId(), group.groupId()).encode().toUriString();
  }

  private String absolute(String path) {
    return mailProperties.baseUrl() + path;
  }

  private String category(String name) {
    return "{\"category\":\"" + name + "\"}";
  }
}
