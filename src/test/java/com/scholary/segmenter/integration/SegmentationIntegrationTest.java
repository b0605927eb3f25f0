package com.scholary.segmenter.integration;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.segmenter.api.AsyncJobResponse;
import com.scholary.segmenter.api.JobStatusResponse;
import com.scholary.segmenter.api.SegmentResponse;
import com.scholary.segmenter.manifest.CutManifest;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

/**
 * End-to-end test of the HTTP API.
 *
 * <p>Starts the full application on a random port and runs a cut through both the inline endpoint
 * and an asynchronous manifest job.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class SegmentationIntegrationTest {

  private static final String CUT =
      "{\"id\":\"cut1\",\"start\":0.0,\"duration\":45.0,\"recording_id\":\"rec1\","
          + "\"supervisions\":[{\"id\":\"sup1\",\"speaker\":\"A\",\"start\":0.0,\"duration\":40.0,"
          + "\"text\":\"w0 w1 w2 w3 w4 w5 w6 w7\",\"alignment\":{\"word\":["
          + "[\"w0\",0.0,5.0,0.9],[\"w1\",5.0,5.0,0.9],[\"w2\",10.0,5.0,0.9],"
          + "[\"w3\",15.0,5.0,0.9],[\"w4\",20.0,5.0,0.9],[\"w5\",25.0,5.0,0.9],"
          + "[\"w6\",30.0,5.0,0.9],[\"w7\",35.0,5.0,0.9]]}}]}";

  @Autowired private TestRestTemplate restTemplate;

  @TempDir static Path baseDir;

  @DynamicPropertySource
  static void jobDirectory(DynamicPropertyRegistry registry) {
    registry.add("jobstore.baseDir", () -> baseDir.toString());
  }

  @Test
  void segment_shouldSplitInlineCut() {
    ResponseEntity<SegmentResponse> response =
        restTemplate.postForEntity(
            "/api/segment",
            json("{\"segments\":[" + CUT + "],\"maxLen\":20}"),
            SegmentResponse.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    SegmentResponse body = response.getBody();
    assertThat(body).isNotNull();
    assertThat(body.segments()).hasSize(3);
    assertThat(body.segments())
        .extracting(CutManifest::getDuration)
        .allSatisfy(duration -> assertThat(duration).isLessThanOrEqualTo(20.0));
    assertThat(body.report().inputSegments()).isEqualTo(1);
    assertThat(body.report().outputSegments()).isEqualTo(3);
    assertThat(body.report().failures()).isEmpty();
  }

  @Test
  void segment_shouldRejectCutWithoutId() {
    ResponseEntity<String> response =
        restTemplate.postForEntity(
            "/api/segment", json("{\"segments\":[{\"duration\":3.0}]}"), String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
  }

  @Test
  void job_shouldWriteSegmentedManifest() throws Exception {
    Path input = baseDir.resolve("cuts.jsonl");
    Path output = baseDir.resolve("out/segmented.jsonl");
    Files.writeString(input, CUT + "\n");

    ResponseEntity<AsyncJobResponse> started =
        restTemplate.postForEntity(
            "/api/jobs",
            json(
                "{\"input\":\"cuts.jsonl\",\"output\":\"out/segmented.jsonl\",\"maxLen\":20}"),
            AsyncJobResponse.class);
    assertThat(started.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
    assertThat(started.getBody()).isNotNull();

    JobStatusResponse status = awaitFinished(started.getBody().statusUrl());

    assertThat(status.status()).isEqualTo(JobStatusResponse.Status.COMPLETED);
    assertThat(status.report().outputSegments()).isEqualTo(3);
    assertThat(Files.readAllLines(output)).hasSize(3);
  }

  @Test
  void job_shouldRejectPathOutsideBaseDir() {
    ResponseEntity<String> response =
        restTemplate.postForEntity(
            "/api/jobs",
            json("{\"input\":\"../cuts.jsonl\",\"output\":\"out.jsonl\"}"),
            String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody()).contains("JobPathException");
  }

  @Test
  void jobStatus_shouldReturnNotFoundForUnknownJob() {
    ResponseEntity<String> response = restTemplate.getForEntity("/api/jobs/missing", String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
  }

  private JobStatusResponse awaitFinished(String statusUrl) throws InterruptedException {
    JobStatusResponse status = null;
    for (int attempt = 0; attempt < 50; attempt++) {
      status = restTemplate.getForObject(statusUrl, JobStatusResponse.class);
      if (status != null
          && (status.status() == JobStatusResponse.Status.COMPLETED
              || status.status() == JobStatusResponse.Status.FAILED)) {
        return status;
      }
      Thread.sleep(100);
    }
    return status;
  }

  private static HttpEntity<String> json(String body) {
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    return new HttpEntity<>(body, headers);
  }
}
