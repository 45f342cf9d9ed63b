package com.flamingo.ai.extractionqa.service.table;

import com.flamingo.ai.extractionqa.config.ValidationConfig;
import com.flamingo.ai.extractionqa.service.validation.ContentNormalizer;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Decides whether two table rows on either side of a page break belong to one running ledger.
 *
 * <p>The last number in a row is taken as its running balance. Rows are continuous when:
 *
 * <ol>
 *   <li>the balances are equal within tolerance, or
 *   <li>the previous balance is non-zero and the balance moved by less than the configured ratio
 *       of it (a single transaction should not swing a balance by half), or
 *   <li>the previous balance is zero and the new balance is below the configured ceiling, or
 *   <li>otherwise, at least the configured share of numeric column positions coincide.
 * </ol>
 *
 * <p>A non-zero previous balance with too large a swing is rejected outright.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TableContinuityValidator {

  private final ContentNormalizer normalizer;
  private final ValidationConfig validationConfig;

  public boolean isContinuous(List<String> previousRow, List<String> currentRow) {
    return isContinuous(
        previousRow, currentRow, validationConfig.getTables().getBalanceTolerance());
  }

  /**
   * Checks running-balance continuity between two rows.
   *
   * @param previousRow last row of the preceding fragment
   * @param currentRow first row of the following fragment
   * @param tolerance balance difference still treated as unchanged
   * @return true when the rows look like one continuous ledger
   */
  public boolean isContinuous(List<String> previousRow, List<String> currentRow, double tolerance) {
    ValidationConfig.Tables tables = validationConfig.getTables();
    RowNumbers previous = extract(previousRow);
    RowNumbers current = extract(currentRow);

    if (!previous.hasNumbers() || !current.hasNumbers()) {
      log.debug("Numerical continuity: no numbers found in rows");
      return false;
    }

    double previousBalance = previous.balance();
    double currentBalance = current.balance();
    double difference = Math.abs(currentBalance - previousBalance);

    if (difference <= tolerance) {
      log.debug("Numerical continuity: same balance ({})", currentBalance);
      return true;
    }

    if (previousBalance != 0) {
      double change = difference / Math.abs(previousBalance);
      boolean reasonable = change < tables.getMaxBalanceChangeRatio();
      log.debug(
          "Numerical continuity: balance {} -> {} ({}% change) {}",
          previousBalance,
          currentBalance,
          String.format("%.1f", change * 100),
          reasonable ? "accepted" : "rejected");
      return reasonable;
    }

    if (Math.abs(currentBalance) < tables.getZeroBalanceCeiling()) {
      log.debug("Numerical continuity: starting from zero balance");
      return true;
    }

    Set<Integer> overlap = new HashSet<>(previous.positions());
    overlap.retainAll(current.positions());
    int total = Math.max(previous.positions().size(), current.positions().size());
    if ((double) overlap.size() / total >= tables.getColumnOverlapRatio()) {
      log.debug("Numerical continuity: column positions match ({}/{})", overlap.size(), total);
      return true;
    }

    log.debug("Numerical continuity: no criterion met");
    return false;
  }

  private RowNumbers extract(List<String> row) {
    List<Double> amounts = new ArrayList<>();
    Set<Integer> positions = new HashSet<>();
    for (int i = 0; i < row.size(); i++) {
      String cell = row.get(i);
      if (cell == null || cell.isBlank()) {
        continue;
      }
      for (String number : normalizer.extractNumbers(cell.strip())) {
        amounts.add(Double.parseDouble(number));
        positions.add(i);
      }
    }
    return new RowNumbers(amounts, positions);
  }

  private record RowNumbers(List<Double> amounts, Set<Integer> positions) {

    boolean hasNumbers() {
      return !amounts.isEmpty();
    }

    double balance() {
      return amounts.get(amounts.size() - 1);
    }
  }
}
