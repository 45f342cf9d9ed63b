package com.flamingo.ai.extractionqa.service.validation;

import com.flamingo.ai.extractionqa.config.ValidationConfig;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Scores how similar two extractions of the same page are.
 *
 * <p>A cheap word-set Jaccard pre-check short-circuits obviously identical content; everything
 * else goes through the configured full algorithm (number-frequency cosine or normalized
 * Levenshtein).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SimilarityCalculator {

  static final double EARLY_EXIT_THRESHOLD = 0.95;
  static final double MAX_LENGTH_DIFFERENCE = 0.05;

  private final ContentNormalizer normalizer;
  private final ValidationConfig validationConfig;

  /**
   * Calculates similarity with the configured method, skipping the full calculation when the
   * quick estimate already exceeds 95%.
   *
   * @param first first extraction
   * @param second second extraction
   * @return score between 0.0 and 1.0
   */
  public double similarity(String first, String second) {
    String a = first == null ? "" : first;
    String b = second == null ? "" : second;

    double quick = quickEstimate(a, b);
    if (quick > EARLY_EXIT_THRESHOLD) {
      log.debug("Early exit: quick similarity {} > 95%", String.format("%.3f", quick));
      return quick;
    }
    return fullSimilarity(a, b, validationConfig.getCrossValidation().getSimilarityMethod());
  }

  /**
   * Jaccard similarity over whitespace-separated word sets. Returns 0 without tokenizing when the
   * lengths differ by more than 5%, or when either side is empty.
   */
  public double quickEstimate(String first, String second) {
    int len1 = first.length();
    int len2 = second.length();
    if (len1 == 0 || len2 == 0) {
      return 0.0;
    }
    double lengthDiff = (double) Math.abs(len1 - len2) / Math.max(len1, len2);
    if (lengthDiff > MAX_LENGTH_DIFFERENCE) {
      return 0.0;
    }

    Set<String> words1 = tokenize(first);
    Set<String> words2 = tokenize(second);
    if (words1.isEmpty() || words2.isEmpty()) {
      return 0.0;
    }

    Set<String> union = new HashSet<>(words1);
    union.addAll(words2);
    Set<String> intersection = new HashSet<>(words1);
    intersection.retainAll(words2);

    return (double) intersection.size() / union.size();
  }

  public double fullSimilarity(String first, String second, SimilarityMethod method) {
    return switch (method) {
      case NUMBER_FREQUENCY -> numberFrequencySimilarity(first, second);
      case LEVENSHTEIN -> levenshteinSimilarity(first, second);
    };
  }

  /**
   * Cosine similarity of the number frequency vectors of both texts. Non-numeric content is
   * ignored, so layout and language may differ freely.
   */
  public double numberFrequencySimilarity(String first, String second) {
    Map<String, Long> freq1 = frequencies(normalizer.extractNumbers(first));
    Map<String, Long> freq2 = frequencies(normalizer.extractNumbers(second));

    double similarity = cosine(freq1, freq2);
    log.debug(
        "Number-based similarity: {} ({} vs {} distinct numbers)",
        String.format("%.3f", similarity),
        freq1.size(),
        freq2.size());
    return similarity;
  }

  /** {@code 1 - distance / maxLength} over the alphanumeric-only form of both texts. */
  public double levenshteinSimilarity(String first, String second) {
    String normalized1 = normalizer.normalizeForComparison(first);
    String normalized2 = normalizer.normalizeForComparison(second);

    if (normalized1.isEmpty() && normalized2.isEmpty()) {
      return 1.0;
    }
    if (normalized1.isEmpty() || normalized2.isEmpty()) {
      return 0.0;
    }

    int[] cp1 = normalized1.codePoints().toArray();
    int[] cp2 = normalized2.codePoints().toArray();
    int distance = levenshtein(cp1, cp2);
    int maxLength = Math.max(cp1.length, cp2.length);

    double similarity = 1.0 - (double) distance / maxLength;
    log.debug(
        "Levenshtein: lengths {} vs {}, distance {}, similarity {}",
        cp1.length,
        cp2.length,
        distance,
        String.format("%.3f", similarity));
    return clamp(similarity);
  }

  private static Set<String> tokenize(String text) {
    return Arrays.stream(text.trim().split("\\s+"))
        .filter(word -> !word.isEmpty())
        .collect(Collectors.toSet());
  }

  private static Map<String, Long> frequencies(List<String> numbers) {
    return numbers.stream()
        .collect(
            Collectors.groupingBy(Function.identity(), LinkedHashMap::new, Collectors.counting()));
  }

  private static double cosine(Map<String, Long> freq1, Map<String, Long> freq2) {
    if (freq1.isEmpty() && freq2.isEmpty()) {
      return 1.0;
    }
    if (freq1.isEmpty() || freq2.isEmpty()) {
      return 0.0;
    }

    Set<String> allNumbers = new HashSet<>(freq1.keySet());
    allNumbers.addAll(freq2.keySet());

    double dot = 0;
    double magnitude1 = 0;
    double magnitude2 = 0;
    for (String number : allNumbers) {
      long a = freq1.getOrDefault(number, 0L);
      long b = freq2.getOrDefault(number, 0L);
      dot += a * b;
      magnitude1 += a * a;
      magnitude2 += b * b;
    }
    if (magnitude1 == 0 || magnitude2 == 0) {
      return 0.0;
    }
    return clamp(dot / Math.sqrt(magnitude1 * magnitude2));
  }

  /** Two-row dynamic programming edit distance over code points. */
  private static int levenshtein(int[] a, int[] b) {
    int[] previous = new int[b.length + 1];
    int[] current = new int[b.length + 1];
    for (int j = 0; j <= b.length; j++) {
      previous[j] = j;
    }
    for (int i = 1; i <= a.length; i++) {
      current[0] = i;
      for (int j = 1; j <= b.length; j++) {
        int cost = a[i - 1] == b[j - 1] ? 0 : 1;
        current[j] =
            Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
      }
      int[] swap = previous;
      previous = current;
      current = swap;
    }
    return previous[b.length];
  }

  private static double clamp(double value) {
    return Math.max(0.0, Math.min(1.0, value));
  }
}
