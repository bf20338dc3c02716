package com.delta.jobapplication.form.submit;

import com.delta.jobapplication.config.ApplicationFormProperties;
import com.delta.jobapplication.form.model.JobApplicationRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Posts the application as JSON to the configured endpoint. Any 2xx response is success; other
 * statuses and transport failures complete the future with a {@link SubmissionException}.
 */
public class HttpSubmissionGateway implements SubmissionGateway {
    private static final Logger log = LoggerFactory.getLogger(HttpSubmissionGateway.class);
    private static final int MAX_ERROR_BODY_LENGTH = 200;

    private final ApplicationFormProperties properties;
    private final HttpClient client;
    private final ObjectMapper objectMapper;

    public HttpSubmissionGateway(
        ApplicationFormProperties properties,
        ExecutorService submissionExecutor,
        ObjectMapper objectMapper
    ) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getSubmission().getTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(submissionExecutor)
            .build();
    }

    @Override
    public CompletableFuture<Void> submit(JobApplicationRecord application) {
        String endpoint = properties.getSubmission().getEndpoint();
        URI uri = toUri(endpoint);
        if (uri == null || uri.getHost() == null) {
            return CompletableFuture.failedFuture(
                new SubmissionException(SubmissionException.IO_ERROR, "Submission endpoint is not a valid URL")
            );
        }
        String body;
        try {
            body = objectMapper.writeValueAsString(application);
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(
                new SubmissionException(SubmissionException.SERIALIZATION, "Failed to serialize application", e)
            );
        }
        HttpRequest request = HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(properties.getSubmission().getTimeoutSeconds()))
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
            .build();
        Instant startedAt = Instant.now();
        return client.sendAsync(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8))
            .handle((response, error) -> {
                long elapsedMs = Duration.between(startedAt, Instant.now()).toMillis();
                if (error != null) {
                    SubmissionException failure = transportFailure(unwrap(error));
                    log.warn(
                        "submission request failed endpoint={} errorCode={} errorMessage={} durationMs={}",
                        endpoint,
                        failure.getErrorCode(),
                        failure.getMessage(),
                        elapsedMs
                    );
                    throw failure;
                }
                int status = response.statusCode();
                if (status < 200 || status >= 300) {
                    log.warn(
                        "submission rejected endpoint={} status={} body={} durationMs={}",
                        endpoint,
                        status,
                        truncate(response.body()),
                        elapsedMs
                    );
                    throw new SubmissionException(
                        SubmissionException.HTTP_STATUS,
                        "Submission failed with HTTP " + status
                    );
                }
                log.info("submission accepted endpoint={} status={} durationMs={}", endpoint, status, elapsedMs);
                return null;
            });
    }

    private SubmissionException transportFailure(Throwable error) {
        if (error instanceof SubmissionException submissionException) {
            return submissionException;
        }
        if (error instanceof HttpTimeoutException) {
            return new SubmissionException(SubmissionException.TIMEOUT, "Submission timed out", error);
        }
        String detail = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        return new SubmissionException(SubmissionException.IO_ERROR, "Submission request failed: " + detail, error);
    }

    private Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private String truncate(String body) {
        if (body == null) {
            return null;
        }
        return body.length() <= MAX_ERROR_BODY_LENGTH ? body : body.substring(0, MAX_ERROR_BODY_LENGTH);
    }

    private URI toUri(String url) {
        try {
            return new URI(url);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
