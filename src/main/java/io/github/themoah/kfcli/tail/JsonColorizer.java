package io.github.themoah.kfcli.tail;

import picocli.CommandLine.Help.Ansi.Style;

/**
 * Adds ANSI colors to encoded JSON text, compact or indented.
 *
 * <p>Object keys are bold blue, strings green, numbers cyan, booleans and null yellow.
 * Punctuation and whitespace are copied unchanged.
 */
final class JsonColorizer {

  private static final String KEY = Style.on(Style.bold, Style.fg_blue);
  private static final String STRING = Style.on(Style.fg_green);
  private static final String NUMBER = Style.on(Style.fg_cyan);
  private static final String LITERAL = Style.on(Style.fg_yellow);
  private static final String RESET = Style.reset.on();

  private JsonColorizer() {
  }

  static String colorize(String json) {
    StringBuilder sb = new StringBuilder(json.length() * 2);
    int i = 0;
    while (i < json.length()) {
      char c = json.charAt(i);
      if (c == '"') {
        int end = endOfString(json, i);
        append(sb, isKey(json, end) ? KEY : STRING, json.substring(i, end));
        i = end;
      } else if (c == '-' || Character.isDigit(c)) {
        int end = i + 1;
        while (end < json.length() && "0123456789.eE+-".indexOf(json.charAt(end)) >= 0) {
          end++;
        }
        append(sb, NUMBER, json.substring(i, end));
        i = end;
      } else if (Character.isLetter(c)) {
        int end = i + 1;
        while (end < json.length() && Character.isLetter(json.charAt(end))) {
          end++;
        }
        append(sb, LITERAL, json.substring(i, end));
        i = end;
      } else {
        sb.append(c);
        i++;
      }
    }
    return sb.toString();
  }

  // Index just past the closing quote of the string starting at start
  private static int endOfString(String json, int start) {
    int i = start + 1;
    while (i < json.length()) {
      char c = json.charAt(i);
      if (c == '\\') {
        i += 2;
      } else if (c == '"') {
        return i + 1;
      } else {
        i++;
      }
    }
    return json.length();
  }

  private static boolean isKey(String json, int afterString) {
    int i = afterString;
    while (i < json.length() && Character.isWhitespace(json.charAt(i))) {
      i++;
    }
    return i < json.length() && json.charAt(i) == ':';
  }

  private static void append(StringBuilder sb, String style, String token) {
    sb.append(style).append(token).append(RESET);
  }
}
