/*
 * どこで: Notification サービス層
 * 何を: 保存済み ownership ルールを position 順に評価し、一致した全ルールのオーナーを合算する
 * なぜ: Issue オーナー宛てアラートの受信者をプロジェクト設定どおりに決めるため
 */
package com.issuealert.notification.service;

import com.issuealert.notification.model.IssueEvent;
import com.issuealert.notification.model.Owner;
import com.issuealert.notification.model.OwnershipResult;
import com.issuealert.notification.model.OwnershipRule;
import com.issuealert.notification.repository.OwnershipRuleRepository;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ProjectOwnershipEvaluator implements OwnershipEvaluator {

  private final OwnershipRuleRepository ownershipRuleRepository;

  @Override
  public OwnershipResult getOwners(long projectId, IssueEvent event) {
    final Set<Owner> owners = new LinkedHashSet<>();
    final List<Long> matchedRuleIds = new ArrayList<>();
    for (OwnershipRule rule : ownershipRuleRepository.findRules(projectId)) {
      if (OwnershipPatternMatcher.matches(rule, event)) {
        owners.addAll(rule.owners());
        matchedRuleIds.add(rule.ruleId());
      }
    }
    if (!matchedRuleIds.isEmpty()) {
      return OwnershipResult.ownersOf(owners, matchedRuleIds);
    }
    // ownership 行が無いプロジェクトは fallthrough 有効として扱う
    final boolean fallthrough = ownershipRuleRepository.findFallthrough(projectId).orElse(true);
    return fallthrough ? OwnershipResult.everyoneResult() : OwnershipResult.ownersOf(Set.of(), List.of());
  }
}
