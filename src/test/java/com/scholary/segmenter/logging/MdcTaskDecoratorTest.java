package com.scholary.segmenter.logging;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class MdcTaskDecoratorTest {

  private final MdcTaskDecorator decorator = new MdcTaskDecorator();

  @AfterEach
  void tearDown() {
    MDC.clear();
  }

  @Test
  void decorate_shouldPropagateContextToWorkerThread() throws Exception {
    MDC.put("runId", "run-1");
    AtomicReference<String> seen = new AtomicReference<>();
    Runnable task = decorator.decorate(() -> seen.set(MDC.get("runId")));
    MDC.clear();

    ExecutorService pool = Executors.newSingleThreadExecutor();
    try {
      pool.submit(task).get(5, TimeUnit.SECONDS);
    } finally {
      pool.shutdownNow();
    }

    assertThat(seen.get()).isEqualTo("run-1");
  }

  @Test
  void decorate_shouldRestoreContextOfRunningThread() {
    MDC.put("runId", "run-1");
    Runnable task = decorator.decorate(() -> MDC.put("segment_id", "cut1"));
    MDC.put("runId", "run-2");

    task.run();

    assertThat(MDC.get("runId")).isEqualTo("run-2");
    assertThat(MDC.get("segment_id")).isNull();
  }

  @Test
  void decorate_shouldClearContextWhenSubmitterHadNone() {
    Runnable task = decorator.decorate(() -> assertThat(MDC.get("runId")).isNull());
    MDC.put("runId", "stale");

    task.run();

    assertThat(MDC.get("runId")).isEqualTo("stale");
  }
}
