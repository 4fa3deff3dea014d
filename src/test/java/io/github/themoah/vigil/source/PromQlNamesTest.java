package io.github.themoah.vigil.source;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.github.themoah.vigil.model.MetricDescriptor;
import io.github.themoah.vigil.model.Statistic;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for PromQlNames.
 */
public class PromQlNamesTest {

  @Test
  void snakeCase_namespacesAndMetrics() {
    assertEquals("aws_lambda", PromQlNames.snakeCase("AWS/Lambda"));
    assertEquals("aws_application_elb", PromQlNames.snakeCase("AWS/ApplicationELB"));
    assertEquals("target_response_time", PromQlNames.snakeCase("TargetResponseTime"));
    assertEquals("sample_count", PromQlNames.snakeCase("SampleCount"));
    assertEquals("cpu_utilization", PromQlNames.snakeCase("CPUUtilization"));
  }

  @Test
  void metricName_includesStatistic() {
    MetricDescriptor descriptor = MetricDescriptor.of("AWS/Lambda", "Duration", Statistic.AVERAGE);

    assertEquals("aws_lambda_duration_average", PromQlNames.metricName(descriptor));
    assertEquals("aws_lambda_duration_average", PromQlNames.selector(descriptor));
  }

  @Test
  void selector_labelsSortedAndEscaped() {
    Map<String, String> dimensions = new LinkedHashMap<>();
    dimensions.put("Resource", "say \"hi\"");
    dimensions.put("FunctionName", "checkout");
    MetricDescriptor descriptor = new MetricDescriptor("AWS/Lambda", "Errors", dimensions, Statistic.SUM);

    assertEquals("aws_lambda_errors_sum{function_name=\"checkout\",resource=\"say \\\"hi\\\"\"}",
      PromQlNames.selector(descriptor));
  }
}
