/*
 * どこで: ProjectOwnershipEvaluator のユニットテスト
 * 何を: ルール照合 (path/url/tags) と fallthrough の扱いを検証する
 * なぜ: 一致なし時に「全員」と「誰にも送らない」を設定どおりに返すことを保証するため
 */
package com.issuealert.notification.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.issuealert.notification.model.IssueEvent;
import com.issuealert.notification.model.IssueGroup;
import com.issuealert.notification.model.Owner;
import com.issuealert.notification.model.OwnerType;
import com.issuealert.notification.model.OwnershipResult;
import com.issuealert.notification.model.OwnershipRule;
import com.issuealert.notification.repository.OwnershipRuleRepository;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ProjectOwnershipEvaluatorTest {

  private static final long PROJECT_ID = 3L;
  private static final IssueEvent EVENT =
      new IssueEvent(
          "evt-1",
          new IssueGroup(7L, PROJECT_ID, "WEB-7", "KeyError", "root", "error"),
          Instant.parse("2026-02-01T00:00:00Z"),
          "KeyError: 'id'",
          "production",
          Map.of("browser", "Chrome 120"),
          List.of("lib/util.py", "src/api/users.py"),
          "https://shop.example.com/checkout/confirm");

  @Mock private OwnershipRuleRepository ownershipRuleRepository;

  private ProjectOwnershipEvaluator evaluator;

  @BeforeEach
  void setUp() {
    evaluator = new ProjectOwnershipEvaluator(ownershipRuleRepository);
  }

  @Test
  void ownersOfEveryMatchingRuleAreUnioned() {
    when(ownershipRuleRepository.findRules(PROJECT_ID))
        .thenReturn(
            List.of(
                rule(1L, "path", "src/api/*", new Owner(OwnerType.USER, 10L)),
                rule(2L, "url", "*/checkout/*", new Owner(OwnerType.TEAM, 50L)),
                rule(3L, "tags.browser", "Firefox*", new Owner(OwnerType.USER, 11L)),
                rule(4L, "tags.browser", "chrome*", new Owner(OwnerType.USER, 10L))));

    final OwnershipResult result = evaluator.getOwners(PROJECT_ID, EVENT);

    assertThat(result.everyone()).isFalse();
    assertThat(result.matchedRuleIds()).containsExactly(1L, 2L, 4L);
    assertThat(result.owners())
        .containsExactlyInAnyOrder(new Owner(OwnerType.USER, 10L), new Owner(OwnerType.TEAM, 50L));
    verify(ownershipRuleRepository, never()).findFallthrough(PROJECT_ID);
  }

  @Test
  void noMatchWithFallthroughMeansEveryone() {
    when(ownershipRuleRepository.findRules(PROJECT_ID))
        .thenReturn(List.of(rule(1L, "path", "docs/*", new Owner(OwnerType.USER, 10L))));
    when(ownershipRuleRepository.findFallthrough(PROJECT_ID)).thenReturn(Optional.empty());

    assertThat(evaluator.getOwners(PROJECT_ID, EVENT).everyone()).isTrue();
  }

  @Test
  void noMatchWithoutFallthroughMeansNobody() {
    when(ownershipRuleRepository.findRules(PROJECT_ID)).thenReturn(List.of());
    when(ownershipRuleRepository.findFallthrough(PROJECT_ID)).thenReturn(Optional.of(false));

    final OwnershipResult result = evaluator.getOwners(PROJECT_ID, EVENT);

    assertThat(result.everyone()).isFalse();
    assertThat(result.owners()).isEmpty();
  }

  @ParameterizedTest(name = "{0} ~ {1} -> {2}")
  @CsvSource({
    "src/*.py, src/api/users.py, true",
    "SRC/API/*, src/api/users.py, true",
    "src/api/user?.py, src/api/users.py, true",
    "src/api/user?.py, src/api/user.py, false",
    "*.js, src/api/users.py, false",
    "src/(api)/*, src/(api)/users.py, true",
  })
  void globMatchesWholeValue(String glob, String value, boolean expected) {
    assertThat(OwnershipPatternMatcher.compileGlob(glob).matcher(value).matches()).isEqualTo(expected);
  }

  private static OwnershipRule rule(long ruleId, String matcherType, String pattern, Owner owner) {
    return new OwnershipRule(ruleId, matcherType, pattern, List.of(owner));
  }
}
