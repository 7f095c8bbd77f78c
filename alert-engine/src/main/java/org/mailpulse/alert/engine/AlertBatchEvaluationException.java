package org.mailpulse.alert.engine;

import java.util.List;
import java.util.stream.Collectors;
import org.mailpulse.alert.engine.datamodel.EvaluationResult;
import org.mailpulse.alert.engine.datamodel.InvalidConfigurationException;

/**
 * Raised by {@link AlertEngine#evaluateAll()} after every definition was attempted, when at least
 * one of them is malformed. Carries the results of the definitions that did evaluate.
 */
public class AlertBatchEvaluationException extends RuntimeException {
  private final List<EvaluationResult> results;
  private final List<InvalidConfigurationException> failures;

  public AlertBatchEvaluationException(
      List<EvaluationResult> results, List<InvalidConfigurationException> failures) {
    super(
        String.format(
            "%d alert definition(s) failed to evaluate: %s",
            failures.size(),
            failures.stream()
                .map(InvalidConfigurationException::getAlertId)
                .collect(Collectors.joining(", "))));
    this.results = List.copyOf(results);
    this.failures = List.copyOf(failures);
    failures.forEach(this::addSuppressed);
  }

  public List<EvaluationResult> getResults() {
    return results;
  }

  public List<InvalidConfigurationException> getFailures() {
    return failures;
  }
}
