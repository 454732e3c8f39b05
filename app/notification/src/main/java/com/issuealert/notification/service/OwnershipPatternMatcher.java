/*
 * どこで: Notification サービス層
 * 何を: ownership ルールの matcher (path/url/tags.<key>) と glob パターンの照合
 * なぜ: ルール 1 件がイベントに一致するかを評価器から独立して検証できるようにするため
 */
package com.issuealert.notification.service;

import com.issuealert.notification.model.IssueEvent;
import com.issuealert.notification.model.OwnershipRule;
import java.util.regex.Pattern;

final class OwnershipPatternMatcher {

  static final String MATCHER_PATH = "path";
  static final String MATCHER_URL = "url";
  static final String MATCHER_TAG_PREFIX = "tags.";

  private OwnershipPatternMatcher() {}

  static boolean matches(OwnershipRule rule, IssueEvent event) {
    final Pattern pattern = compileGlob(rule.pattern());
    final String matcherType = rule.matcherType();
    if (MATCHER_PATH.equals(matcherType)) {
      return event.stackPaths().stream().anyMatch(path -> matchesValue(pattern, path));
    }
    if (MATCHER_URL.equals(matcherType)) {
      return matchesValue(pattern, event.url());
    }
    if (matcherType != null && matcherType.startsWith(MATCHER_TAG_PREFIX)) {
      final String tagKey = matcherType.substring(MATCHER_TAG_PREFIX.length());
      return matchesValue(pattern, event.tags().get(tagKey));
    }
    return false;
  }

  /** '*' は任意長 ('/' を含む)、'?' は任意の 1 文字。大文字小文字は区別しない。 */
  static Pattern compileGlob(String glob) {
    final StringBuilder regex = new StringBuilder();
    final StringBuilder literal = new StringBuilder();
    for (char c : glob.toCharArray()) {
      if (c == '*' || c == '?') {
        if (literal.length() > 0) {
          regex.append(Pattern.quote(literal.toString()));
          literal.setLength(0);
        }
        regex.append(c == '*' ? ".*" : ".");
      } else {
        literal.append(c);
      }
    }
    if (literal.length() > 0) {
      regex.append(Pattern.quote(literal.toString()));
    }
    return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
  }

  private static boolean matchesValue(Pattern pattern, String value) {
    return value != null && pattern.matcher(value).matches();
  }
}
