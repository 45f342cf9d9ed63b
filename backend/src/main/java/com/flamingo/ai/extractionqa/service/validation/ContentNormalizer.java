package com.flamingo.ai.extractionqa.service.validation;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Reduces extracted text to comparable forms: alphanumeric-only text, and numeric literals in a
 * canonical decimal notation independent of thousands/decimal separator conventions.
 */
@Component
public class ContentNormalizer {

  private static final Pattern CURRENCY_SYMBOLS = Pattern.compile("[₪$€£¥₹]");

  // sign, digit groups separated by comma/period/space, optional decimal tail, optional percent;
  // digits of any script, so Arabic-Indic and other decimal digits are found too
  private static final Pattern NUMBER_TOKEN =
      Pattern.compile(
          "-?\\d+(?:[,. ]\\d{3})*(?:[,.]\\d+)?%?", Pattern.UNICODE_CHARACTER_CLASS);

  /**
   * Keeps letters and digits of any script, lower-cased. Punctuation, table pipes and whitespace
   * are dropped so a prose rendering and a table rendering of the same content compare equal.
   *
   * @param text text to normalize
   * @return alphanumeric-only lower-case text, empty when the input has no letters or digits
   */
  public String normalizeForComparison(String text) {
    if (text == null || text.isEmpty()) {
      return "";
    }
    StringBuilder sb = new StringBuilder(text.length());
    text.codePoints()
        .filter(Character::isLetterOrDigit)
        .map(Character::toLowerCase)
        .forEach(sb::appendCodePoint);
    return sb.toString();
  }

  /**
   * Extracts numeric literals and canonicalizes them, e.g. {@code 1.234.567,89} and {@code
   * 1,234,567.89} both become {@code 1234567.89}; {@code 15%} becomes {@code 15}. Decimal digits
   * of other scripts are mapped to ASCII, so {@code ١٢٣٤} becomes {@code 1234}.
   *
   * <p>Tokens that do not parse as numbers after canonicalization are skipped.
   *
   * @param text text to scan
   * @return canonical number strings in order of appearance
   */
  public List<String> extractNumbers(String text) {
    if (text == null || text.isEmpty()) {
      return List.of();
    }
    String cleaned = CURRENCY_SYMBOLS.matcher(text).replaceAll("");
    Matcher matcher = NUMBER_TOKEN.matcher(cleaned);

    List<String> numbers = new ArrayList<>();
    while (matcher.find()) {
      String canonical = canonicalize(matcher.group());
      if (isParseable(canonical)) {
        numbers.add(canonical);
      }
    }
    return numbers;
  }

  /**
   * Resolves which separator is the decimal point.
   *
   * <ul>
   *   <li>both {@code .} and {@code ,}: the one closer to the end is decimal
   *   <li>commas only: a single comma followed by at most two digits is decimal, else grouping
   *   <li>several periods: a trailing group of at most two digits is decimal, else all grouping
   * </ul>
   */
  String canonicalize(String token) {
    String ascii = toAsciiDigits(token);
    String num = ascii.endsWith("%") ? ascii.substring(0, ascii.length() - 1) : ascii;

    int lastPeriod = num.lastIndexOf('.');
    int lastComma = num.lastIndexOf(',');
    long periodCount = num.chars().filter(c -> c == '.').count();
    long commaCount = num.chars().filter(c -> c == ',').count();

    if (commaCount > 0 && periodCount > 0) {
      if (lastComma > lastPeriod) {
        num = num.replace(".", "").replace(',', '.');
      } else {
        num = num.replace(",", "");
      }
    } else if (commaCount > 0) {
      String afterComma = num.substring(lastComma + 1);
      if (commaCount == 1 && afterComma.length() <= 2 && isDigits(afterComma)) {
        num = num.replace(',', '.');
      } else {
        num = num.replace(",", "");
      }
    } else if (periodCount > 1) {
      String tail = num.substring(lastPeriod + 1);
      if (tail.length() <= 2) {
        num = num.substring(0, lastPeriod).replace(".", "") + "." + tail;
      } else {
        num = num.replace(".", "");
      }
    }
    return num.replace(" ", "");
  }

  private static String toAsciiDigits(String token) {
    StringBuilder sb = new StringBuilder(token.length());
    token
        .codePoints()
        .map(cp -> Character.isDigit(cp) ? '0' + Character.digit(cp, 10) : cp)
        .forEach(sb::appendCodePoint);
    return sb.toString();
  }

  private static boolean isDigits(String s) {
    return !s.isEmpty() && s.chars().allMatch(Character::isDigit);
  }

  private static boolean isParseable(String candidate) {
    try {
      new BigDecimal(candidate);
      return true;
    } catch (NumberFormatException e) {
      return false;
    }
  }
}
