/*
 * どこで: Notification サービス層
 * 何を: コミット連携が無い場合の SuspectCommitLookup 実装
 * なぜ: 連携実装を差し込むまで空の結果で本文を組み立てるため
 */
package com.issuealert.notification.service;

import com.issuealert.notification.model.IssueEvent;
import com.issuealert.notification.model.Project;
import com.issuealert.notification.model.SuspectCommit;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class NoopSuspectCommitLookup implements SuspectCommitLookup {

  @Override
  public List<SuspectCommit> findSuspectCommits(Project project, IssueEvent event) {
    return List.of();
  }
}
