package com.flamingo.ai.extractionqa.service.table;

import com.flamingo.ai.extractionqa.exception.TableAssemblyException;
import com.flamingo.ai.extractionqa.service.table.model.MergedTable;
import com.flamingo.ai.extractionqa.service.table.model.TableAssemblyResult;
import com.flamingo.ai.extractionqa.service.table.model.TableFragment;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns the structured table fragments of one document into markdown tables, merging fragments
 * that continue across page breaks when asked to.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TableAssemblyService {

  private final TableMerger tableMerger;
  private final MeterRegistry meterRegistry;

  /**
   * Assembles markdown tables from provider fragments.
   *
   * @param fragments fragments in provider order
   * @param merge whether to stitch fragments across pages
   * @return rendered tables with counts
   * @throws TableAssemblyException when {@code fragments} is null
   */
  @Timed(value = "tables.assemble", description = "Time to assemble document tables")
  public TableAssemblyResult assemble(List<TableFragment> fragments, boolean merge) {
    if (fragments == null) {
      throw new TableAssemblyException("Table fragment list must not be null");
    }
    if (fragments.isEmpty()) {
      log.debug("No tables to assemble");
      return TableAssemblyResult.empty();
    }

    SortedMap<Integer, List<TableFragment>> byPage = tableMerger.groupByPage(fragments);
    log.info(
        "Assembling {} tables from {} pages (merge={})", fragments.size(), byPage.size(), merge);

    if (merge) {
      List<MergedTable> mergedTables = tableMerger.mergeAcrossPages(byPage);
      List<String> markdown =
          mergedTables.stream()
              .map(MergedTable::toMarkdown)
              .filter(table -> !table.isEmpty())
              .toList();
      meterRegistry.counter("tables.merged").increment(mergedTables.size());
      return new TableAssemblyResult(markdown, fragments.size(), mergedTables.size(), true);
    }

    List<String> markdown = new ArrayList<>();
    for (Map.Entry<Integer, List<TableFragment>> entry : byPage.entrySet()) {
      for (TableFragment fragment : entry.getValue()) {
        if (!fragment.isEmpty()) {
          markdown.add(tableMerger.renderFragment(fragment, entry.getKey()));
        }
      }
    }
    return new TableAssemblyResult(markdown, fragments.size(), markdown.size(), false);
  }
}
