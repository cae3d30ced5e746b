package com.delta.pagetracker.crawl.robots;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

public class RobotsRules {
  private final List<Rule> rules;
  private final Long crawlDelayMs;

  public RobotsRules(List<Rule> rules, Long crawlDelayMs) {
    this.rules = List.copyOf(rules);
    this.crawlDelayMs = crawlDelayMs;
  }

  public static RobotsRules allowAll() {
    return new RobotsRules(List.of(), null);
  }

  public static RobotsRules disallowAll() {
    return new RobotsRules(List.of(new Rule("/", false)), null);
  }

  public Long getCrawlDelayMs() {
    return crawlDelayMs;
  }

  public boolean isAllowed(String pathAndQuery) {
    if (rules.isEmpty()) {
      return true;
    }

    Rule bestMatch = null;
    int bestMatchLength = -1;
    String subject = pathAndQuery == null || pathAndQuery.isBlank() ? "/" : pathAndQuery;
    for (Rule rule : rules) {
      if (!rule.matches(subject)) {
        continue;
      }
      int length = rule.path().length();
      if (length > bestMatchLength) {
        bestMatch = rule;
        bestMatchLength = length;
      } else if (length == bestMatchLength
          && bestMatch != null
          && rule.allow()
          && !bestMatch.allow()) {
        bestMatch = rule;
      }
    }
    return bestMatch == null || bestMatch.allow();
  }

  /**
   * Parses robots.txt for the given agent token. A group naming the token wins over the
   * wildcard group; when neither exists everything is allowed.
   */
  public static RobotsRules parse(String robotsText, String agentToken) {
    if (robotsText == null || robotsText.isBlank()) {
      return allowAll();
    }
    String token = agentToken == null ? "" : agentToken.toLowerCase(Locale.ROOT);

    Group wildcard = new Group();
    Group specific = new Group();
    List<String> currentAgents = new ArrayList<>();
    boolean lastDirectiveWasUserAgent = false;

    for (String rawLine : robotsText.split("\\R")) {
      String line = stripComment(rawLine).trim();
      if (line.isEmpty()) {
        continue;
      }
      int colonIdx = line.indexOf(':');
      if (colonIdx <= 0) {
        continue;
      }

      String key = line.substring(0, colonIdx).trim().toLowerCase(Locale.ROOT);
      String value = line.substring(colonIdx + 1).trim();

      if ("user-agent".equals(key)) {
        if (!lastDirectiveWasUserAgent) {
          currentAgents.clear();
        }
        currentAgents.add(value.toLowerCase(Locale.ROOT));
        lastDirectiveWasUserAgent = true;
        continue;
      }
      lastDirectiveWasUserAgent = false;

      Group target = null;
      if (!token.isEmpty() && currentAgents.stream().anyMatch(agent -> !agent.equals("*") && token.contains(agent))) {
        target = specific;
      } else if (currentAgents.contains("*")) {
        target = wildcard;
      }
      if (target == null) {
        continue;
      }
      target.seen = true;
      if (("allow".equals(key) || "disallow".equals(key)) && !value.isBlank()) {
        target.rules.add(new Rule(value, "allow".equals(key)));
      } else if ("crawl-delay".equals(key)) {
        target.crawlDelayMs = parseDelay(value);
      }
    }

    Group chosen = specific.seen ? specific : wildcard;
    return new RobotsRules(chosen.rules, chosen.crawlDelayMs);
  }

  private static Long parseDelay(String value) {
    try {
      double seconds = Double.parseDouble(value);
      return seconds < 0 ? null : Math.round(seconds * 1000);
    } catch (NumberFormatException ignored) {
      return null;
    }
  }

  private static String stripComment(String line) {
    int idx = line.indexOf('#');
    return idx >= 0 ? line.substring(0, idx) : line;
  }

  private static final class Group {
    private final List<Rule> rules = new ArrayList<>();
    private Long crawlDelayMs;
    private boolean seen;
  }

  public record Rule(String path, boolean allow) {
    public boolean matches(String testPath) {
      String normalizedPath = path.startsWith("/") ? path : "/" + path;
      if (!normalizedPath.contains("*") && !normalizedPath.contains("$")) {
        return testPath.startsWith(normalizedPath);
      }
      StringBuilder regex = new StringBuilder("^");
      for (int i = 0; i < normalizedPath.length(); i++) {
        char c = normalizedPath.charAt(i);
        if (c == '*') {
          regex.append(".*");
        } else if (c == '$') {
          regex.append("$");
        } else {
          regex.append(Pattern.quote(Character.toString(c)));
        }
      }
      return Pattern.compile(regex.toString()).matcher(testPath).find();
    }
  }
}
