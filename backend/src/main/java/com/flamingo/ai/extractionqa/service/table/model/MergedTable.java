package com.flamingo.ai.extractionqa.service.table.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Getter;

/**
 * A logical table assembled from one or more fragments on consecutive pages.
 *
 * <p>Rows may differ in width while the table is being built; {@link #toMarkdown()} pads or
 * truncates every row to the widest row seen.
 */
@Getter
public class MergedTable {

  private final List<String> headers;
  private final int startPage;
  private int endPage;
  private final List<List<String>> rows = new ArrayList<>();

  public MergedTable(List<String> headers, int startPage) {
    this.headers = headers == null ? List.of() : List.copyOf(headers);
    this.startPage = startPage;
    this.endPage = startPage;
  }

  /** Appends rows that were found on {@code pageNumber}. */
  public void addRows(List<List<String>> newRows, int pageNumber) {
    for (List<String> row : newRows) {
      rows.add(List.copyOf(row));
    }
    endPage = Math.max(endPage, pageNumber);
  }

  public List<List<String>> getRows() {
    return Collections.unmodifiableList(rows);
  }

  public List<String> lastRow() {
    return rows.isEmpty() ? List.of() : rows.get(rows.size() - 1);
  }

  public boolean isEmpty() {
    return headers.isEmpty() && rows.isEmpty();
  }

  /**
   * Renders the table as a pipe table preceded by a page-range line. Missing header names are
   * synthesized as {@code ColN}.
   *
   * @return markdown, or an empty string for a table with neither headers nor rows
   */
  public String toMarkdown() {
    if (isEmpty()) {
      return "";
    }

    int maxCols = headers.size();
    for (List<String> row : rows) {
      maxCols = Math.max(maxCols, row.size());
    }

    List<String> adjustedHeaders = new ArrayList<>(headers);
    while (adjustedHeaders.size() < maxCols) {
      adjustedHeaders.add("Col" + (adjustedHeaders.size() + 1));
    }

    List<String> lines = new ArrayList<>();
    lines.add(pageRangeLine());
    lines.add(pipeRow(adjustedHeaders));
    lines.add(pipeRow(Collections.nCopies(adjustedHeaders.size(), "---")));
    for (List<String> row : rows) {
      lines.add(pipeRow(fitRow(row, maxCols)));
    }
    return String.join("\n", lines);
  }

  private String pageRangeLine() {
    if (startPage == endPage) {
      return "**Table from Page " + startPage + "**\n";
    }
    return "**Table from Pages " + startPage + "-" + endPage + "**\n";
  }

  public static List<String> fitRow(List<String> row, int width) {
    List<String> fitted = new ArrayList<>(row.subList(0, Math.min(row.size(), width)));
    while (fitted.size() < width) {
      fitted.add("");
    }
    return fitted;
  }

  public static String pipeRow(List<String> cells) {
    return "| " + String.join(" | ", cells) + " |";
  }
}
