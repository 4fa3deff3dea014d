package io.github.themoah.vigil.insight;

import io.github.themoah.vigil.model.InsightResult;
import io.vertx.core.Future;
import java.util.List;

/**
 * External provider of free-form insights about a set of log lines.
 * The returned payload is opaque and embedded unmodified in the log analysis.
 */
public interface InsightProvider {

  /**
   * Requests insights for the given lines.
   *
   * @param lines log lines, in batch order
   * @param modelId model identifier understood by the provider
   * @return Future containing the provider response; implementations may also fail
   *     the future, callers convert failures to {@link InsightResult#failed(String)}
   */
  Future<InsightResult> insights(List<String> lines, String modelId);

  default Future<Void> close() {
    return Future.succeededFuture();
  }
}
