package com.scholary.mediascribe.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import com.scholary.mediascribe.acquisition.MediaRequest;
import com.scholary.mediascribe.api.AsyncJobResponse;
import com.scholary.mediascribe.api.JobStatusResponse;
import com.scholary.mediascribe.api.JobStatusResponse.Status;
import com.scholary.mediascribe.progress.ProgressReporter;
import com.scholary.mediascribe.refine.RefinementResult;
import com.scholary.mediascribe.service.PipelineOrchestrator;
import com.scholary.mediascribe.service.PipelineResult;
import com.scholary.mediascribe.transcript.Transcript;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

/**
 * End-to-end test of the REST API on a running server.
 *
 * <p>The pipeline itself is mocked; everything from HTTP to the job executor and back is real.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class TranscriptionApiIntegrationTest {

  @Autowired private TestRestTemplate restTemplate;

  @MockBean private PipelineOrchestrator orchestrator;

  @DynamicPropertySource
  static void configureProperties(DynamicPropertyRegistry registry) {
    Path root = createTempRoot();
    registry.add("pipeline.workDir", () -> root.resolve("work").toString());
    registry.add("pipeline.outputDir", () -> root.resolve("out").toString());
    registry.add("telegram.polling.enabled", () -> "false");
    registry.add("relay.enabled", () -> "false");
  }

  @Test
  void upload_shouldRunJobToCompletion() throws Exception {
    Transcript transcript =
        new Transcript("talk.mp3", "Hello there.", "[00:00:00] Hello there.", null, null, null);
    when(orchestrator.run(any(MediaRequest.class), any(ProgressReporter.class)))
        .thenReturn(
            new PipelineResult("cid-1", transcript, 1, 1, 0, new RefinementResult("x", 1, 0)));

    MultiValueMap<String, Object> body = new LinkedMultiValueMap<>();
    body.add(
        "file",
        new ByteArrayResource(new byte[] {1, 2, 3, 4}) {
          @Override
          public String getFilename() {
            return "talk.mp3";
          }
        });
    body.add("requesterId", "integration");
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.MULTIPART_FORM_DATA);

    ResponseEntity<AsyncJobResponse> accepted =
        restTemplate.postForEntity(
            "/api/transcriptions/upload", new HttpEntity<>(body, headers), AsyncJobResponse.class);

    assertThat(accepted.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
    String jobId = accepted.getBody().jobId();

    JobStatusResponse status = awaitFinished(jobId);
    assertThat(status.status()).isEqualTo(Status.COMPLETED);
    assertThat(status.progress()).isEqualTo(100);
    assertThat(status.result().formatted()).isEqualTo("[00:00:00] Hello there.");
  }

  @Test
  void transcribe_shouldRejectRequestWithoutUrl() {
    ResponseEntity<Map> response =
        restTemplate.postForEntity(
            "/api/transcriptions", Map.of("requesterId", "integration"), Map.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody()).containsEntry("error", "url is required for the URL route");
  }

  @Test
  void lookups_shouldReturnNotFoundForUnknownIds() {
    assertThat(restTemplate.getForEntity("/api/jobs/unknown", String.class).getStatusCode())
        .isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(restTemplate.getForEntity("/api/results/unknown", String.class).getStatusCode())
        .isEqualTo(HttpStatus.NOT_FOUND);
  }

  private JobStatusResponse awaitFinished(String jobId) throws InterruptedException {
    long deadline = System.currentTimeMillis() + 10_000;
    JobStatusResponse status = null;
    while (System.currentTimeMillis() < deadline) {
      status = restTemplate.getForObject("/api/jobs/" + jobId, JobStatusResponse.class);
      if (status.status() == Status.COMPLETED || status.status() == Status.FAILED) {
        return status;
      }
      Thread.sleep(100);
    }
    return status;
  }

  private static Path createTempRoot() {
    try {
      return Files.createTempDirectory("mediascribe-it");
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
