package com.scholary.segmenter;

import com.scholary.segmenter.cli.CliArguments;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.scheduling.annotation.EnableAsync;

/**
 * Starts the segmenter.
 *
 * <p>With {@code --input} it runs as a batch job without a web server and exits with the run's
 * exit code; otherwise it serves the HTTP API.
 */
@SpringBootApplication
@EnableAsync
public class SegmenterApplication {

  public static void main(String[] args) {
    String[] normalized = CliArguments.normalize(args);
    SpringApplication application = new SpringApplication(SegmenterApplication.class);
    if (CliArguments.isBatchRun(normalized)) {
      application.setWebApplicationType(WebApplicationType.NONE);
      ConfigurableApplicationContext context = application.run(normalized);
      System.exit(SpringApplication.exit(context));
    }
    application.run(normalized);
  }
}
