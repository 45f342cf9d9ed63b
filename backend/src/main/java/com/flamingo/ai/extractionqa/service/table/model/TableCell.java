package com.flamingo.ai.extractionqa.service.table.model;

/**
 * One cell of a provider-reported table.
 *
 * @param rowIndex zero-based row
 * @param columnIndex zero-based column
 * @param rowSpan rows covered, at least 1
 * @param columnSpan columns covered, at least 1
 * @param content cell text
 * @param header whether the provider tagged the cell as a column header
 */
public record TableCell(
    int rowIndex, int columnIndex, int rowSpan, int columnSpan, String content, boolean header) {

  public TableCell {
    if (rowSpan < 1 || columnSpan < 1) {
      throw new IllegalArgumentException("Cell spans must be at least 1");
    }
    content = content == null ? "" : content;
  }

  public static TableCell data(int rowIndex, int columnIndex, String content) {
    return new TableCell(rowIndex, columnIndex, 1, 1, content, false);
  }

  public static TableCell header(int rowIndex, int columnIndex, String content) {
    return new TableCell(rowIndex, columnIndex, 1, 1, content, true);
  }
}
