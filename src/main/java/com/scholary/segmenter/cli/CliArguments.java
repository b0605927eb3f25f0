package com.scholary.segmenter.cli;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Rewrites command line arguments into the form Spring Boot binds.
 *
 * <p>Spring only reads {@code --name=value} options, so {@code --name value} pairs are joined.
 * The length and job flags are mapped onto their configuration properties, so that they override
 * {@code application.yml}:
 *
 * <pre>
 * --max_len 20   becomes  --segmentation.max-len=20
 * --num_jobs 4   becomes  --segmentation.num-jobs=4
 * </pre>
 */
public final class CliArguments {

  public static final String INPUT = "input";
  public static final String OUTPUT = "output";
  public static final String TASK = "task";
  public static final String PREFIX = "prefix";
  public static final String STM_OUTPUT = "stm_output";

  private static final Map<String, String> PROPERTY_FLAGS =
      Map.of(
          "max_len", "segmentation.max-len",
          "num_jobs", "segmentation.num-jobs",
          "max_pause", "segmentation.max-pause");

  private CliArguments() {}

  public static String[] normalize(String[] args) {
    List<String> normalized = new ArrayList<>(args.length);
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if (!arg.startsWith("--") || arg.length() == 2) {
        normalized.add(arg);
        continue;
      }
      String name = arg.substring(2);
      String value = null;
      int equals = name.indexOf('=');
      if (equals >= 0) {
        value = name.substring(equals + 1);
        name = name.substring(0, equals);
      } else if (i + 1 < args.length && !args[i + 1].startsWith("--")) {
        value = args[++i];
      }
      name = PROPERTY_FLAGS.getOrDefault(name, name);
      normalized.add(value == null ? "--" + name : "--" + name + "=" + value);
    }
    return normalized.toArray(new String[0]);
  }

  /** A batch run is requested whenever an input manifest is given. */
  public static boolean isBatchRun(String[] normalizedArgs) {
    for (String arg : normalizedArgs) {
      if (arg.equals("--" + INPUT) || arg.startsWith("--" + INPUT + "=")) {
        return true;
      }
    }
    return false;
  }
}
