package com.scholary.segmenter.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JobPathResolverTest {

  @TempDir Path baseDir;

  private JobPathResolver resolver;

  @BeforeEach
  void setUp() {
    resolver = new JobPathResolver(baseDir.toString());
  }

  @Test
  void resolve_shouldPlaceRelativePathUnderBaseDir() {
    Path resolved = resolver.resolve("corpus/./cuts.jsonl");

    assertThat(resolved).isEqualTo(resolver.getBaseDir().resolve("corpus/cuts.jsonl"));
  }

  @Test
  void resolve_shouldAcceptAbsolutePathInsideBaseDir() {
    Path inside = resolver.getBaseDir().resolve("out/segmented.jsonl");

    assertThat(resolver.resolve(inside.toString())).isEqualTo(inside);
  }

  @Test
  void resolve_shouldRejectParentTraversal() {
    assertThatThrownBy(() -> resolver.resolve("corpus/../../secret.jsonl"))
        .isInstanceOf(JobPathException.class)
        .hasMessageContaining("outside");
  }

  @Test
  void resolve_shouldRejectAbsolutePathOutsideBaseDir() {
    String outside = resolver.getBaseDir().getParent().resolve("other.jsonl").toString();

    assertThatThrownBy(() -> resolver.resolve(outside)).isInstanceOf(JobPathException.class);
  }

  @Test
  void resolve_shouldRejectBlankPath() {
    assertThatThrownBy(() -> resolver.resolve(" ")).isInstanceOf(JobPathException.class);
  }
}
