package ca.gc.cra.kafkarecon.api;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits shell input into words using POSIX shell quoting.
 *
 * <p>Single quotes preserve everything literally; inside double quotes a backslash escapes only
 * {@code \ " $ `}; outside quotes a backslash escapes any character. Adjacent quoted and unquoted parts join
 * into one word.</p>
 */
final class CommandLineTokenizer {
  private static final String DOUBLE_QUOTE_ESCAPABLE = "\\\"$`\n";

  private CommandLineTokenizer() {
    // Utility
  }

  /**
   * Tokenizes one input line.
   *
   * @param line raw input; {@code null} yields no tokens
   * @return words in input order
   * @throws IllegalArgumentException on an unbalanced quote or a trailing backslash
   */
  static List<String> tokenize(String line) {
    List<String> tokens = new ArrayList<>();
    if (line == null) {
      return tokens;
    }
    StringBuilder current = new StringBuilder();
    boolean inWord = false;
    int i = 0;
    int length = line.length();
    while (i < length) {
      char c = line.charAt(i);
      if (Character.isWhitespace(c)) {
        if (inWord) {
          tokens.add(current.toString());
          current.setLength(0);
          inWord = false;
        }
        i++;
        continue;
      }
      inWord = true;
      if (c == '\'') {
        int end = line.indexOf('\'', i + 1);
        if (end < 0) {
          throw new IllegalArgumentException("No closing quotation");
        }
        current.append(line, i + 1, end);
        i = end + 1;
      } else if (c == '"') {
        i = readDoubleQuoted(line, i + 1, current);
      } else if (c == '\\') {
        if (i + 1 >= length) {
          throw new IllegalArgumentException("No escaped character");
        }
        current.append(line.charAt(i + 1));
        i += 2;
      } else {
        current.append(c);
        i++;
      }
    }
    if (inWord) {
      tokens.add(current.toString());
    }
    return tokens;
  }

  private static int readDoubleQuoted(String line, int start, StringBuilder out) {
    int i = start;
    while (i < line.length()) {
      char c = line.charAt(i);
      if (c == '"') {
        return i + 1;
      }
      if (c == '\\' && i + 1 < line.length() && DOUBLE_QUOTE_ESCAPABLE.indexOf(line.charAt(i + 1)) >= 0) {
        out.append(line.charAt(i + 1));
        i += 2;
        continue;
      }
      out.append(c);
      i++;
    }
    throw new IllegalArgumentException("No closing quotation");
  }
}
