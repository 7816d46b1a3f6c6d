package com.delta.creatorscout.discovery.util;

import org.jsoup.Jsoup;

public final class TextSanitizer {
  private static final int MAX_LENGTH = 4000;

  private TextSanitizer() {}

  public static String clean(String raw) {
    if (raw == null) {
      return null;
    }
    String text = Jsoup.parse(raw).wholeText();
    text = text.replace('\u00a0', ' ').replaceAll("[\\t\\x0B\\f\\r ]+", " ").trim();
    if (text.isEmpty()) {
      return null;
    }
    return text.length() > MAX_LENGTH ? text.substring(0, MAX_LENGTH) : text;
  }
}
