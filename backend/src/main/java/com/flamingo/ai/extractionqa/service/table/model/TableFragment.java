package com.flamingo.ai.extractionqa.service.table.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * A table as reported by the structured table-extraction provider for a single page.
 *
 * @param rowCount rows reported by the provider
 * @param columnCount columns reported by the provider
 * @param cells cells with explicit row and column indices
 * @param pageNumber page the table sits on, or null when the provider gave no page association
 */
public record TableFragment(
    int rowCount, int columnCount, List<TableCell> cells, Integer pageNumber) {

  public TableFragment {
    cells = cells == null ? List.of() : List.copyOf(cells);
  }

  /** Whether any cell is tagged as a column header. */
  public boolean hasHeaders() {
    return cells.stream().anyMatch(TableCell::header);
  }

  public boolean isEmpty() {
    return cells.isEmpty() || rowCount == 0;
  }

  /**
   * Header texts: the header-tagged cells ordered by column, or the first row when nothing is
   * tagged.
   */
  public List<String> headers() {
    List<TableCell> headerCells = cells.stream().filter(TableCell::header).toList();
    if (headerCells.isEmpty()) {
      return row(0);
    }
    return headerCells.stream()
        .sorted(Comparator.comparingInt(TableCell::columnIndex))
        .map(cell -> cell.content().strip())
        .toList();
  }

  /** Rows below the header row; every row when nothing is header-tagged. */
  public List<List<String>> dataRows() {
    return rowsFrom(hasHeaders() ? 1 : 0);
  }

  /** Every row, header row included. */
  public List<List<String>> allRows() {
    return rowsFrom(0);
  }

  private List<List<String>> rowsFrom(int startRow) {
    List<List<String>> rows = new ArrayList<>();
    for (int r = startRow; r < rowCount; r++) {
      rows.add(row(r));
    }
    return rows;
  }

  private List<String> row(int rowIndex) {
    return cells.stream()
        .filter(cell -> cell.rowIndex() == rowIndex)
        .sorted(Comparator.comparingInt(TableCell::columnIndex))
        .map(cell -> cell.content().strip())
        .toList();
  }
}
