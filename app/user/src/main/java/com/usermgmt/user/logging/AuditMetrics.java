/*
 * どこで: 監査ログ
 * 何を: 監査ストア書き込み失敗と低速操作の件数を記録する
 * なぜ: ログ欠落や性能劣化を Prometheus から検知できるようにするため
 */
package com.usermgmt.user.logging;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class AuditMetrics {

  private static final String METRIC_AUDIT_WRITE_FAILURE_TOTAL =
      "usermgmt.audit.write.failure.total";
  private static final String METRIC_SLOW_OPERATION_TOTAL = "usermgmt.slow.operation.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> writeFailureCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> slowOperationCounters = new ConcurrentHashMap<>();

  public AuditMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordWriteFailure(String shape) {
    writeFailureCounters
        .computeIfAbsent(
            shape,
            ignored ->
                Counter.builder(METRIC_AUDIT_WRITE_FAILURE_TOTAL)
                    .description("Audit store write failures by input shape")
                    .tags(Tags.of("shape", shape))
                    .register(meterRegistry))
        .increment();
  }

  public void recordSlowOperation(String kind) {
    slowOperationCounters
        .computeIfAbsent(
            kind,
            ignored ->
                Counter.builder(METRIC_SLOW_OPERATION_TOTAL)
                    .description("Operations slower than the slow-operation threshold")
                    .tags(Tags.of("kind", kind))
                    .register(meterRegistry))
        .increment();
  }
}
