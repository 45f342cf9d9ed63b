package com.flamingo.ai.extractionqa.service.validation;

import com.flamingo.ai.extractionqa.service.validation.model.ProblemDetection;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Detects quality issues in one page of extracted markdown.
 *
 * <p>Each {@link ProblemType} maps to one pure check. Only the enabled checks run; a disabled check
 * costs nothing, which matters because the orchestrator calls this once per page.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProblemDetector {

  static final int MIN_ALPHANUMERIC_CHARS = 100;
  static final int MIN_PAGE_LENGTH = 200;
  static final int KEYWORD_CHECK_MIN_LENGTH = 500;
  static final int MIN_TABLE_ROWS = 5;
  static final double MAX_SPECIAL_CHAR_RATIO = 0.2;
  static final double MAX_UNKNOWN_CHAR_RATIO = 0.05;
  static final int MIN_DUPLICATE_PARAGRAPH_LENGTH = 50;
  static final int MIN_DUPLICATE_OCCURRENCES = 3;

  static final int MIN_EMPTY_TABLE_ROWS = 5;
  static final double MIN_VALID_SEPARATOR_RATIO = 0.7;

  // a row opening with a run of empty cells: | | |
  private static final Pattern EMPTY_CELL_RUN = Pattern.compile("\\|[ \\t]*\\|[ \\t]*\\|");
  // quantifiers stay bounded so a long run cannot exhaust the stack
  private static final Pattern REPEATED_CHARACTER = Pattern.compile("(.)\\1{9}");
  private static final Pattern REPEATED_TABLE_NUMBER =
      Pattern.compile("\\|\\s*(\\d+(?:[.,]\\d+)?)\\s*\\|(?:\\s*\\1\\s*\\|){2}");
  private static final Pattern REPEATED_TEXT_NUMBER =
      Pattern.compile("\\b(\\d+(?:[.,]\\d+)?)\\s+(?:\\1\\s+){2}");
  private static final Pattern STANDALONE_QUESTION_MARK = Pattern.compile("\\s\\?\\s");
  private static final Pattern MARKDOWN_IMAGE = Pattern.compile("!\\[([^\\]]*)\\]\\(([^)]+)\\)");

  private static final Set<Integer> DECORATIVE_REPEATS =
      Set.of((int) ' ', (int) '-', (int) '_', (int) '=', (int) '*', (int) '\n');

  private static final String COMMON_PUNCTUATION = " \n\t.,;:!?-()[]{}\"'/\\|";

  private static final Set<Character> UNKNOWN_GLYPHS = Set.of('□', '�', '☐', '▯', '▢', '▣');

  private static final List<String> FINANCIAL_KEYWORDS =
      List.of(
          "revenue", "expense", "balance", "asset", "liability", "equity", "income", "profit",
          "loss", "debit", "credit", "account", "total", "subtotal", "amount", "date",
          "transaction", "payment", "statement", "bank", "financial", "report", "summary",
          "הכנסות", "הוצאות", "יתרה", "חשבון", "סכום", "סה\"כ", "זכות", "חובה", "תאריך", "עסקה",
          "תשלום", "דוח", "כספי", "מאזן", "רווח", "הפסד");

  private final ContentNormalizer normalizer;

  /**
   * Runs the enabled checks and returns those that fired.
   *
   * @param text page markdown
   * @param enabled checks to run; anything else is skipped entirely
   * @return fired checks, empty when the page looks fine
   */
  public Set<ProblemType> detect(String text, Set<ProblemType> enabled) {
    String content = text == null ? "" : text;
    EnumSet<ProblemType> fired = EnumSet.noneOf(ProblemType.class);
    for (ProblemType type : enabled) {
      if (check(type, content)) {
        fired.add(type);
      }
    }
    return fired;
  }

  /** Per-check results for the enabled checks, useful for diagnostics. */
  public Map<ProblemType, Boolean> detectAll(String text, Set<ProblemType> enabled) {
    Set<ProblemType> fired = detect(text, enabled);
    return enabled.stream().collect(Collectors.toMap(Function.identity(), fired::contains));
  }

  /**
   * Convenience wrapper over {@link #detect}. Empty text is always a problem.
   *
   * @param text page markdown
   * @param enabled checks to run
   * @return detection outcome
   */
  public ProblemDetection hasAnyProblem(String text, Set<ProblemType> enabled) {
    if (text == null || text.isEmpty()) {
      return ProblemDetection.of(Set.of(ProblemType.EMPTY_CONTENT));
    }
    Set<ProblemType> fired = detect(text, enabled);
    if (!fired.isEmpty()) {
      log.debug("Detected problems: {}", fired);
    }
    return ProblemDetection.of(fired);
  }

  private boolean check(ProblemType type, String text) {
    return switch (type) {
      case EMPTY_TABLES -> hasEmptyTableRows(text);
      case LOW_CONTENT_DENSITY -> hasLowContentDensity(text);
      case MISSING_NUMBERS -> hasTableWithoutNumbers(text);
      case INCONSISTENT_COLUMNS -> hasInconsistentColumns(text);
      case REPEATED_CHARACTERS -> hasRepeatedCharacters(text);
      case GARBLED_TEXT -> isGarbled(text);
      case HEADER_ONLY_TABLES -> hasHeaderOnlyTable(text);
      case VERY_SHORT_PAGES -> isVeryShort(text);
      case MISSING_KEYWORDS -> isMissingKeywords(text);
      case MALFORMED_STRUCTURE -> hasMalformedSeparator(text);
      case DUPLICATE_CONTENT -> hasDuplicateParagraphs(text);
      case UNKNOWN_CHARACTERS -> hasUnknownCharacters(text);
      case REPETITIVE_NUMBERS -> hasRepetitiveNumbers(text);
      case MARKDOWN_IMAGES -> hasMarkdownImages(text);
      case EMPTY_CONTENT -> text.isEmpty();
    };
  }

  private boolean hasEmptyTableRows(String text) {
    int run = 0;
    for (String line : text.lines().map(String::strip).toList()) {
      if (!EMPTY_CELL_RUN.matcher(line).lookingAt()) {
        run = 0;
        continue;
      }
      if (++run >= MIN_EMPTY_TABLE_ROWS) {
        log.debug("Empty tables: {} consecutive rows of empty cells", run);
        return true;
      }
    }
    return false;
  }

  private boolean hasLowContentDensity(String text) {
    long alphanumeric = countAlphanumeric(text);
    if (alphanumeric < MIN_ALPHANUMERIC_CHARS) {
      log.debug("Low content density: {} alphanumeric characters", alphanumeric);
      return true;
    }
    return false;
  }

  private boolean hasTableWithoutNumbers(String text) {
    if (text.isEmpty()) {
      return false;
    }
    // four pipes per row is a rough estimate
    double tableRows = text.chars().filter(c -> c == '|').count() / 4.0;
    if (tableRows < MIN_TABLE_ROWS) {
      return false;
    }
    return normalizer.extractNumbers(text).isEmpty();
  }

  private boolean hasInconsistentColumns(String text) {
    List<String> tableLines = tableLines(text);
    if (tableLines.size() < 3) {
      return false;
    }
    // one extra count is tolerated for the header separator
    Set<Long> columnCounts =
        tableLines.stream()
            .map(line -> line.chars().filter(c -> c == '|').count() - 1)
            .collect(Collectors.toSet());
    if (columnCounts.size() > 2) {
      log.debug("Inconsistent columns: {} different column counts", columnCounts.size());
      return true;
    }
    return false;
  }

  private boolean hasRepeatedCharacters(String text) {
    Matcher matcher = REPEATED_CHARACTER.matcher(text);
    while (matcher.find()) {
      if (!DECORATIVE_REPEATS.contains(matcher.group(1).codePointAt(0))) {
        return true;
      }
    }
    return false;
  }

  private boolean isGarbled(String text) {
    if (text.isEmpty()) {
      return false;
    }
    long alphanumeric = countAlphanumeric(text);
    if (alphanumeric == 0) {
      return true;
    }
    long special =
        text.codePoints()
            .filter(c -> !Character.isLetterOrDigit(c) && COMMON_PUNCTUATION.indexOf(c) < 0)
            .count();
    double ratio = (double) special / alphanumeric;
    if (ratio > MAX_SPECIAL_CHAR_RATIO) {
      log.debug("Garbled text: {} special character ratio", String.format("%.3f", ratio));
      return true;
    }
    return false;
  }

  private boolean hasHeaderOnlyTable(String text) {
    List<String> lines = tableLines(text);
    if (lines.size() < 2) {
      return false;
    }
    for (int i = 0; i < lines.size(); i++) {
      if (lines.get(i).contains("---")) {
        return lines.size() - i - 1 <= 1;
      }
    }
    return false;
  }

  private boolean isVeryShort(String text) {
    return text.strip().length() < MIN_PAGE_LENGTH;
  }

  private boolean isMissingKeywords(String text) {
    if (text.length() < KEYWORD_CHECK_MIN_LENGTH) {
      return false;
    }
    String lower = text.toLowerCase(Locale.ROOT);
    return FINANCIAL_KEYWORDS.stream().noneMatch(lower::contains);
  }

  /**
   * A separator row is a table row with at least one cell made only of dashes and colons, holding
   * two or more dashes. Such a row is malformed when fewer than 70% of its cells are separator
   * cells. Data rows holding dates or a lone "-" placeholder are not separator rows.
   */
  private boolean hasMalformedSeparator(String text) {
    List<String> lines = tableLines(text);
    if (lines.size() < 2) {
      return false;
    }
    for (String line : lines) {
      List<String> cells =
          Arrays.stream(line.split("\\|")).map(String::strip).filter(c -> !c.isEmpty()).toList();
      if (cells.stream().noneMatch(ProblemDetector::isSeparatorCell)) {
        continue;
      }
      long valid =
          cells.stream()
              .filter(c -> c.chars().allMatch(ch -> ch == '-' || ch == ':' || ch == ' '))
              .count();
      if ((double) valid / cells.size() < MIN_VALID_SEPARATOR_RATIO) {
        log.debug("Malformed structure: invalid table separator '{}'", line);
        return true;
      }
    }
    return false;
  }

  private static boolean isSeparatorCell(String cell) {
    return cell.chars().allMatch(ch -> ch == '-' || ch == ':')
        && cell.chars().filter(ch -> ch == '-').count() >= 2;
  }

  private boolean hasDuplicateParagraphs(String text) {
    List<String> paragraphs =
        Arrays.stream(text.split("\n\n")).map(String::strip).filter(p -> !p.isEmpty()).toList();
    if (paragraphs.size() < MIN_DUPLICATE_OCCURRENCES) {
      return false;
    }
    return paragraphs.stream()
        .filter(p -> p.length() > MIN_DUPLICATE_PARAGRAPH_LENGTH)
        .collect(Collectors.groupingBy(Function.identity(), Collectors.counting()))
        .values()
        .stream()
        .anyMatch(count -> count >= MIN_DUPLICATE_OCCURRENCES);
  }

  private boolean hasUnknownCharacters(String text) {
    if (text.isEmpty()) {
      return false;
    }
    long unknown = text.chars().filter(c -> UNKNOWN_GLYPHS.contains((char) c)).count();
    Matcher matcher = STANDALONE_QUESTION_MARK.matcher(text);
    while (matcher.find()) {
      unknown++;
    }
    return (double) unknown / text.length() > MAX_UNKNOWN_CHAR_RATIO;
  }

  private boolean hasRepetitiveNumbers(String text) {
    if (REPEATED_TABLE_NUMBER.matcher(text).find()) {
      log.debug("Repetitive numbers in table row");
      return true;
    }
    if (REPEATED_TEXT_NUMBER.matcher(text).find()) {
      log.debug("Repetitive numbers in running text");
      return true;
    }
    return false;
  }

  private boolean hasMarkdownImages(String text) {
    return MARKDOWN_IMAGE.matcher(text).find();
  }

  private static long countAlphanumeric(String text) {
    return text.codePoints().filter(Character::isLetterOrDigit).count();
  }

  private static List<String> tableLines(String text) {
    return text.lines().map(String::strip).filter(line -> line.startsWith("|")).toList();
  }
}
