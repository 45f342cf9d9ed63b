package com.flamingo.ai.extractionqa.service.validation.model;

import com.flamingo.ai.extractionqa.service.validation.ProblemType;
import java.util.Set;

/**
 * Outcome of running the enabled problem checks on one page.
 *
 * @param hasProblem true when at least one check fired
 * @param problems the checks that fired (empty when none)
 */
public record ProblemDetection(boolean hasProblem, Set<ProblemType> problems) {

  public ProblemDetection {
    problems = Set.copyOf(problems);
  }

  public static ProblemDetection clean() {
    return new ProblemDetection(false, Set.of());
  }

  public static ProblemDetection of(Set<ProblemType> problems) {
    return new ProblemDetection(!problems.isEmpty(), problems);
  }
}
