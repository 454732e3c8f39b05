/*
 * どこで: Notification サービス層
 * 何を: イベントに関与したコミットを探す外部連携の抽象
 * なぜ: リリース/リポジトリ連携が無い環境でもアラート本文の生成を止めないため
 */
package com.issuealert.notification.service;

import com.issuealert.notification.model.IssueEvent;
import com.issuealert.notification.model.Project;
import com.issuealert.notification.model.SuspectCommit;
import java.util.List;

public interface SuspectCommitLookup {

  List<SuspectCommit> findSuspectCommits(Project project, IssueEvent event);
}
