package io.github.themoah.vigil.logs;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Mines structural tokens from log lines as a cheap diversity signal.
 *
 * <p>Three token shapes are collected: HTTP-status-like numbers (100-599), dotted-quad
 * IPv4-shaped addresses and ISO-like date-times. Only the number of distinct tokens is
 * used downstream. Any standalone three-digit number in that range counts as a status
 * token, so unrelated numbers inflate the count; this is accepted.
 */
public class PatternExtractor {

  public static final int DEFAULT_SAMPLE_LIMIT = 100;

  private static final Pattern HTTP_STATUS = Pattern.compile("\\b(?:[1-5]\\d{2})\\b");
  private static final Pattern IPV4 = Pattern.compile("\\b(?:\\d{1,3}\\.){3}\\d{1,3}\\b");
  private static final Pattern DATE_TIME = Pattern.compile("\\d{4}-\\d{2}-\\d{2}[\\sT]\\d{2}:\\d{2}:\\d{2}");

  private static final List<Pattern> TOKEN_PATTERNS = List.of(HTTP_STATUS, IPV4, DATE_TIME);

  /**
   * Extracts tokens from the first {@value #DEFAULT_SAMPLE_LIMIT} lines.
   */
  public Set<String> extract(List<String> lines) {
    return extract(lines, DEFAULT_SAMPLE_LIMIT);
  }

  /**
   * Extracts the distinct structural tokens of the first {@code sampleLimit} lines.
   *
   * @param lines the log lines, in batch order
   * @param sampleLimit maximum number of lines to scan
   * @return distinct tokens across the scanned lines
   */
  public Set<String> extract(List<String> lines, int sampleLimit) {
    Set<String> tokens = new HashSet<>();
    int limit = Math.min(lines.size(), Math.max(0, sampleLimit));

    for (String line : lines.subList(0, limit)) {
      for (Pattern pattern : TOKEN_PATTERNS) {
        Matcher matcher = pattern.matcher(line);
        while (matcher.find()) {
          tokens.add(matcher.group());
        }
      }
    }
    return tokens;
  }
}
