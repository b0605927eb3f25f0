package com.scholary.segmenter.config;

import com.scholary.segmenter.logging.MdcTaskDecorator;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for the worker pools.
 *
 * <p>{@code segmentationExecutor} splits segments in parallel, one thread per configured job. When
 * its queue is full the submitting thread runs the task itself, which throttles submission for
 * large corpora. {@code taskExecutor} runs asynchronous API jobs.
 */
@Configuration
public class WorkerExecutorConfig {

  @Bean(name = "segmentationExecutor")
  public Executor segmentationExecutor(SegmentationProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.numJobs());
    executor.setMaxPoolSize(properties.numJobs());
    executor.setQueueCapacity(properties.workerQueueSize());
    executor.setThreadNamePrefix("segmenter-");
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.setTaskDecorator(new MdcTaskDecorator());
    executor.initialize();
    return executor;
  }

  @Bean(name = "taskExecutor")
  public Executor taskExecutor(
      @Value("${jobstore.workerThreads}") int threads,
      @Value("${jobstore.queueSize}") int queueSize) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(queueSize);
    executor.setThreadNamePrefix("segmentation-job-");
    executor.setTaskDecorator(new MdcTaskDecorator());
    executor.initialize();
    return executor;
  }
}
