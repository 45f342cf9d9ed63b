package com.flamingo.ai.extractionqa.service.table;

import com.flamingo.ai.extractionqa.config.ValidationConfig;
import com.flamingo.ai.extractionqa.service.table.model.MergedTable;
import com.flamingo.ai.extractionqa.service.table.model.TableFragment;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Stitches table fragments on consecutive pages into logical tables.
 *
 * <p>Pages are folded in ascending order. For each fragment, in order:
 *
 * <ol>
 *   <li>no running table: start one
 *   <li>tagged headers equal to the running headers (case and surrounding space ignored): append
 *       the data rows
 *   <li>no header tagging at all: the fragment is a continuation, append every row
 *   <li>headers differ but the boundary rows are numerically continuous: append the data rows
 *   <li>otherwise: close the running table and start a new one
 * </ol>
 *
 * <p>Merging depends on the immediately preceding fragment and is strictly sequential.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TableMerger {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final TableContinuityValidator continuityValidator;
  private final ValidationConfig validationConfig;

  /**
   * Groups fragments by page. Fragments without a page association cannot be placed and are
   * skipped.
   *
   * @param fragments fragments in provider order
   * @return fragments keyed by ascending page number, provider order kept within a page
   */
  public SortedMap<Integer, List<TableFragment>> groupByPage(List<TableFragment> fragments) {
    SortedMap<Integer, List<TableFragment>> byPage = new TreeMap<>();
    for (TableFragment fragment : fragments) {
      if (fragment.pageNumber() == null) {
        log.warn("Table has no page association, skipping");
        continue;
      }
      byPage.computeIfAbsent(fragment.pageNumber(), k -> new ArrayList<>()).add(fragment);
    }
    return byPage;
  }

  /**
   * Merges fragments across pages into logical tables.
   *
   * @param fragmentsByPage fragments grouped by page
   * @return logical tables in page order
   */
  public List<MergedTable> mergeAcrossPages(Map<Integer, List<TableFragment>> fragmentsByPage) {
    List<MergedTable> merged = new ArrayList<>();
    MergedTable running = null;
    int fragmentCount = 0;

    List<Integer> pages = new ArrayList<>(fragmentsByPage.keySet());
    Collections.sort(pages);

    for (int page : pages) {
      for (TableFragment fragment : fragmentsByPage.get(page)) {
        fragmentCount++;
        if (fragment.isEmpty()) {
          log.debug("Skipping empty table on page {}", page);
          continue;
        }

        if (running == null) {
          running = startTable(fragment, page);
          continue;
        }

        if (fragment.hasHeaders() && headersMatch(running.getHeaders(), fragment.headers())) {
          log.info("Merging table on page {} with previous table (same headers)", page);
          running.addRows(fragment.dataRows(), page);
          continue;
        }

        if (!fragment.hasHeaders()) {
          log.info("Merging table on page {} with previous table (no headers, continuation)", page);
          running.addRows(fragment.allRows(), page);
          continue;
        }

        if (isNumericallyContinuous(running, fragment)) {
          log.info(
              "Merging table on page {} with previous table "
                  + "(numerical continuity validated despite structure mismatch)",
              page);
          running.addRows(fragment.dataRows(), page);
          continue;
        }

        merged.add(running);
        running = startTable(fragment, page);
      }
    }

    if (running != null) {
      merged.add(running);
    }

    log.info("Merged {} tables into {} merged table(s)", fragmentCount, merged.size());
    return merged;
  }

  /**
   * Renders one fragment on its own: page line, header row and separator when the fragment has
   * headers, then data rows fitted to the header width.
   */
  public String renderFragment(TableFragment fragment, int pageNumber) {
    List<String> lines = new ArrayList<>();
    lines.add("**Table from Page " + pageNumber + "**\n");

    boolean tagged = fragment.hasHeaders();
    List<String> headers = tagged ? fragment.headers() : List.of();
    if (!headers.isEmpty()) {
      lines.add(MergedTable.pipeRow(headers));
      lines.add(MergedTable.pipeRow(Collections.nCopies(headers.size(), "---")));
    }
    for (List<String> row : fragment.dataRows()) {
      List<String> fitted = headers.isEmpty() ? row : MergedTable.fitRow(row, headers.size());
      lines.add(MergedTable.pipeRow(fitted));
    }
    return String.join("\n", lines);
  }

  boolean headersMatch(List<String> first, List<String> second) {
    if (first.size() != second.size()) {
      return false;
    }
    for (int i = 0; i < first.size(); i++) {
      if (!normalizeHeader(first.get(i)).equals(normalizeHeader(second.get(i)))) {
        return false;
      }
    }
    return true;
  }

  private boolean isNumericallyContinuous(MergedTable running, TableFragment fragment) {
    if (!validationConfig.getTables().isNumericalValidationEnabled()) {
      return false;
    }
    List<List<String>> data = fragment.dataRows();
    if (running.getRows().isEmpty() || data.isEmpty() || data.get(0).isEmpty()) {
      return false;
    }
    return continuityValidator.isContinuous(running.lastRow(), data.get(0));
  }

  /** An untagged fragment that opens a table contributes its first row as the header. */
  private static MergedTable startTable(TableFragment fragment, int page) {
    MergedTable table = new MergedTable(fragment.headers(), page);
    if (fragment.hasHeaders()) {
      table.addRows(fragment.dataRows(), page);
    } else {
      List<List<String>> rows = fragment.allRows();
      table.addRows(rows.subList(1, rows.size()), page);
    }
    return table;
  }

  private static String normalizeHeader(String header) {
    return header == null
        ? ""
        : WHITESPACE.matcher(header.strip()).replaceAll(" ").toLowerCase(Locale.ROOT);
  }
}
