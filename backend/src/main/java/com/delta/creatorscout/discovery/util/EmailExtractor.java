package com.delta.creatorscout.discovery.util;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class EmailExtractor {
  private static final Pattern EMAIL = Pattern.compile("[\\w.-]+@[\\w.-]+\\.[\\w-]+");

  private EmailExtractor() {}

  public static List<String> extract(String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    Set<String> found = new LinkedHashSet<>();
    Matcher matcher = EMAIL.matcher(text);
    while (matcher.find()) {
      String candidate = trimTrailingDots(matcher.group());
      if (candidate.indexOf('@') > 0) {
        found.add(candidate.toLowerCase(Locale.ROOT));
      }
    }
    return new ArrayList<>(found);
  }

  private static String trimTrailingDots(String value) {
    int end = value.length();
    while (end > 0 && value.charAt(end - 1) == '.') {
      end--;
    }
    return value.substring(0, end);
  }
}
