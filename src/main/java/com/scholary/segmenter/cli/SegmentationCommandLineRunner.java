package com.scholary.segmenter.cli;

import com.scholary.segmenter.config.SegmentationProperties;
import com.scholary.segmenter.corpus.CorpusReport;
import com.scholary.segmenter.corpus.CorpusResult;
import com.scholary.segmenter.corpus.CorpusSegmentationService;
import com.scholary.segmenter.corpus.IdPrefixer;
import com.scholary.segmenter.corpus.LengthFilter;
import com.scholary.segmenter.export.StmWriter;
import com.scholary.segmenter.export.SupervisionExtractor;
import com.scholary.segmenter.manifest.ManifestException;
import com.scholary.segmenter.manifest.ManifestReader;
import com.scholary.segmenter.manifest.ManifestWriter;
import com.scholary.segmenter.model.RecordingSegment;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Batch entry point: runs one task over a manifest when the application is started with {@code
 * --input}.
 *
 * <pre>
 * --input cuts.jsonl.gz --output segmented.jsonl.gz [--max_len 30] [--num_jobs 8]
 *     [--task segment|filter|prefix|supervisions|stm] [--prefix ami] [--stm_output ref.stm]
 * </pre>
 *
 * <p>The exit code is 0 when every segment was processed and 1 otherwise.
 */
@Component
@ConditionalOnProperty(name = CliArguments.INPUT)
public class SegmentationCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

  private static final Logger LOGGER = LoggerFactory.getLogger(SegmentationCommandLineRunner.class);

  static final int EXIT_OK = 0;
  static final int EXIT_FAILED = 1;

  private final ManifestReader reader;
  private final ManifestWriter writer;
  private final CorpusSegmentationService segmentationService;
  private final LengthFilter lengthFilter;
  private final IdPrefixer idPrefixer;
  private final SupervisionExtractor supervisionExtractor;
  private final StmWriter stmWriter;
  private final SegmentationProperties properties;

  private int exitCode = EXIT_OK;

  public SegmentationCommandLineRunner(
      ManifestReader reader,
      ManifestWriter writer,
      CorpusSegmentationService segmentationService,
      LengthFilter lengthFilter,
      IdPrefixer idPrefixer,
      SupervisionExtractor supervisionExtractor,
      StmWriter stmWriter,
      SegmentationProperties properties) {
    this.reader = reader;
    this.writer = writer;
    this.segmentationService = segmentationService;
    this.lengthFilter = lengthFilter;
    this.idPrefixer = idPrefixer;
    this.supervisionExtractor = supervisionExtractor;
    this.stmWriter = stmWriter;
    this.properties = properties;
  }

  @Override
  public void run(ApplicationArguments args) {
    try {
      CliTask task = CliTask.parse(option(args, CliArguments.TASK));
      Path input = Path.of(required(args, CliArguments.INPUT));
      Path output = Path.of(required(args, CliArguments.OUTPUT));
      LOGGER.info("Running {} on {} -> {}", task, input, output);

      List<RecordingSegment> segments = reader.read(input);
      exitCode = execute(task, segments, input, output, args);
    } catch (ManifestException | IllegalArgumentException | IOException e) {
      LOGGER.error("Run failed: {}", e.getMessage(), e);
      exitCode = EXIT_FAILED;
    }
  }

  private int execute(
      CliTask task,
      List<RecordingSegment> segments,
      Path input,
      Path output,
      ApplicationArguments args)
      throws IOException {
    if (task == CliTask.SEGMENT) {
      return segment(segments, input, output, option(args, CliArguments.STM_OUTPUT));
    }
    if (task == CliTask.FILTER) {
      writer.write(lengthFilter.filter(segments, properties.maxLen()), output);
    } else if (task == CliTask.PREFIX) {
      writer.write(idPrefixer.prefix(segments, required(args, CliArguments.PREFIX)), output);
    } else if (task == CliTask.SUPERVISIONS) {
      writer.writeSupervisions(supervisionExtractor.extract(segments), output);
    } else {
      stmWriter.write(supervisionExtractor.extract(segments), output);
    }
    return EXIT_OK;
  }

  private int segment(
      List<RecordingSegment> segments, Path input, Path output, String stmOutput)
      throws IOException {
    CorpusResult result = segmentationService.segment(segments, input.toString());
    writer.write(result.segments(), output);
    if (stmOutput != null) {
      stmWriter.write(supervisionExtractor.extract(result.segments()), Path.of(stmOutput));
    }

    CorpusReport report = result.report();
    LOGGER.info(
        "Run {}: {} segments in, {} sub-segments out, {} utterances lost, {} failed",
        report.runId(),
        report.inputSegments(),
        report.outputSegments(),
        report.lostUtterances(),
        report.failures().size());
    return report.hasFailures() ? EXIT_FAILED : EXIT_OK;
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }

  private static String option(ApplicationArguments args, String name) {
    List<String> values = args.getOptionValues(name);
    return values == null || values.isEmpty() ? null : values.get(values.size() - 1);
  }

  private static String required(ApplicationArguments args, String name) {
    String value = option(args, name);
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Missing required option --" + name);
    }
    return value;
  }
}
