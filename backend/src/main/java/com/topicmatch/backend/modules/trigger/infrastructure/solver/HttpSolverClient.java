package com.topicmatch.backend.modules.trigger.infrastructure.solver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

@Component
public class HttpSolverClient implements SolverClient {

    private static final Logger log = LoggerFactory.getLogger(HttpSolverClient.class);

    private final RestClient restClient;

    public HttpSolverClient(
            RestClient.Builder restClientBuilder,
            @Value("${app.solver.base-url}") String baseUrl
    ) {
        this.restClient = restClientBuilder.baseUrl(baseUrl).build();
    }

    @Override
    public void submit(SolverSubmission submission) {
        try {
            restClient.post()
                    .uri("/solve")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(submission)
                    .retrieve()
                    .toBodilessEntity();
            log.info("Submitted deferred job {} to solver", submission.deferredId());
        } catch (RestClientException ex) {
            throw new SolverSubmissionException(
                    "Solver rejected job %s: %s".formatted(submission.deferredId(), ex.getMessage()), ex);
        }
    }
}
