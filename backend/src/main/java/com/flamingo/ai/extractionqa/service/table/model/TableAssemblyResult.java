package com.flamingo.ai.extractionqa.service.table.model;

import java.util.List;

/**
 * Markdown tables produced for one document.
 *
 * @param markdownTables rendered tables in page order
 * @param tableCount fragments received from the provider
 * @param mergedTableCount tables after merging, equal to the rendered count when not merging
 * @param merged whether cross-page merging was applied
 */
public record TableAssemblyResult(
    List<String> markdownTables, int tableCount, int mergedTableCount, boolean merged) {

  public TableAssemblyResult {
    markdownTables = List.copyOf(markdownTables);
  }

  public static TableAssemblyResult empty() {
    return new TableAssemblyResult(List.of(), 0, 0, false);
  }

  public boolean isEmpty() {
    return markdownTables.isEmpty();
  }
}
