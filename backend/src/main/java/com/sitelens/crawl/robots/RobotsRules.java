package com.sitelens.crawl.robots;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parsed robots.txt: user-agent groups with their allow/disallow rules and crawl-delay,
 * plus the file-wide sitemap hints.
 */
public class RobotsRules {
  private static final String WILDCARD_AGENT = "*";

  private final List<Group> groups;
  private final List<String> sitemapUrls;

  public RobotsRules(List<Group> groups, List<String> sitemapUrls) {
    this.groups = List.copyOf(groups);
    this.sitemapUrls = List.copyOf(sitemapUrls);
  }

  public static RobotsRules allowAll() {
    return new RobotsRules(List.of(), List.of());
  }

  public List<String> getSitemapUrls() {
    return sitemapUrls;
  }

  public List<Group> getGroups() {
    return groups;
  }

  public boolean isAllowed(String pathAndQuery, String userAgent) {
    List<Rule> rules = rulesFor(userAgent);
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

  public Optional<Double> getCrawlDelay(String userAgent) {
    for (Group group : matchingGroups(userAgent)) {
      if (group.crawlDelay() != null) {
        return Optional.of(group.crawlDelay());
      }
    }
    return Optional.empty();
  }

  private List<Rule> rulesFor(String userAgent) {
    List<Rule> rules = new ArrayList<>();
    for (Group group : matchingGroups(userAgent)) {
      rules.addAll(group.rules());
    }
    return rules;
  }

  /**
   * Groups naming the longest agent token contained in {@code userAgent}; the "*" groups when
   * no named agent matches. Several groups naming the same agent are merged.
   */
  List<Group> matchingGroups(String userAgent) {
    String ua = userAgent == null ? "" : userAgent.toLowerCase(Locale.ROOT);
    String bestAgent = null;
    for (Group group : groups) {
      for (String agent : group.agents()) {
        if (WILDCARD_AGENT.equals(agent) || agent.isEmpty() || !ua.contains(agent)) {
          continue;
        }
        if (bestAgent == null || agent.length() > bestAgent.length()) {
          bestAgent = agent;
        }
      }
    }
    String selected = bestAgent == null ? WILDCARD_AGENT : bestAgent;
    List<Group> matched = new ArrayList<>();
    for (Group group : groups) {
      if (group.agents().contains(selected)) {
        matched.add(group);
      }
    }
    return matched;
  }

  public static RobotsRules parse(String robotsText) {
    if (robotsText == null || robotsText.isBlank()) {
      return allowAll();
    }

    List<String> sitemaps = new ArrayList<>();
    List<Group> parsedGroups = new ArrayList<>();

    List<String> currentAgents = new ArrayList<>();
    List<Rule> currentRules = new ArrayList<>();
    Double currentDelay = null;
    boolean lastDirectiveWasUserAgent = false;

    String[] lines = robotsText.split("\\R");
    for (String rawLine : lines) {
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
          if (!currentAgents.isEmpty()) {
            parsedGroups.add(new Group(currentAgents, currentRules, currentDelay));
          }
          currentAgents = new ArrayList<>();
          currentRules = new ArrayList<>();
          currentDelay = null;
        }
        currentAgents.add(value.toLowerCase(Locale.ROOT));
        lastDirectiveWasUserAgent = true;
        continue;
      }

      lastDirectiveWasUserAgent = false;
      if ("sitemap".equals(key)) {
        if (!value.isBlank()) {
          sitemaps.add(value);
        }
        continue;
      }

      if (currentAgents.isEmpty()) {
        continue;
      }
      if (("allow".equals(key) || "disallow".equals(key)) && !value.isBlank()) {
        currentRules.add(new Rule(value, "allow".equals(key)));
      } else if ("crawl-delay".equals(key)) {
        Double delay = parseDelay(value);
        if (delay != null) {
          currentDelay = delay;
        }
      }
    }
    if (!currentAgents.isEmpty()) {
      parsedGroups.add(new Group(currentAgents, currentRules, currentDelay));
    }

    return new RobotsRules(parsedGroups, sitemaps);
  }

  private static Double parseDelay(String value) {
    try {
      double delay = Double.parseDouble(value);
      return delay >= 0 && Double.isFinite(delay) ? delay : null;
    } catch (NumberFormatException e) {
      return null;
    }
  }

  private static String stripComment(String line) {
    int idx = line.indexOf('#');
    return idx >= 0 ? line.substring(0, idx) : line;
  }

  public record Group(List<String> agents, List<Rule> rules, Double crawlDelay) {
    public Group {
      agents = List.copyOf(agents);
      rules = List.copyOf(rules);
    }
  }

  public record Rule(String path, boolean allow) {
    public boolean matches(String testPath) {
      String normalizedPath = path.startsWith("/") || path.startsWith("*") ? path : "/" + path;
      if (!normalizedPath.contains("*") && !normalizedPath.contains("$")) {
        return testPath.startsWith(normalizedPath);
      }
      StringBuilder regex = new StringBuilder("^");
      for (int i = 0; i < normalizedPath.length(); i++) {
        char c = normalizedPath.charAt(i);
        if (c == '*') {
          regex.append(".*");
        } else if (c == '$' && i == normalizedPath.length() - 1) {
          regex.append("$");
        } else {
          regex.append(Pattern.quote(Character.toString(c)));
        }
      }
      return Pattern.compile(regex.toString()).matcher(testPath).find();
    }
  }
}
