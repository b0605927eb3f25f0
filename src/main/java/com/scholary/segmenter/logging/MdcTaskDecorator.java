package com.scholary.segmenter.logging;

import java.util.Map;
import org.slf4j.MDC;
import org.springframework.core.task.TaskDecorator;

/**
 * Copies the submitting thread's MDC into pool threads, so that worker log lines keep the run
 * context.
 *
 * <p>The running thread's own context is restored afterwards; with a caller-runs rejection policy
 * the submitting thread may run the task itself.
 */
public class MdcTaskDecorator implements TaskDecorator {

  @Override
  public Runnable decorate(Runnable runnable) {
    Map<String, String> context = MDC.getCopyOfContextMap();
    return () -> {
      Map<String, String> previous = MDC.getCopyOfContextMap();
      apply(context);
      try {
        runnable.run();
      } finally {
        apply(previous);
      }
    };
  }

  private static void apply(Map<String, String> context) {
    if (context == null) {
      MDC.clear();
    } else {
      MDC.setContextMap(context);
    }
  }
}
