package com.deepansh.research.resilience;

import com.deepansh.research.exception.ResearchException;
import com.fasterxml.jackson.core.JsonParseException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.NoSuchElementException;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorClassifierTest {

    private final ErrorClassifier classifier = new ErrorClassifier();

    @Test
    void classify_timeouts_areTransient() {
        assertThat(classifier.classify(new SocketTimeoutException("Read timed out"))).isEqualTo(ErrorClass.TRANSIENT);
        assertThat(classifier.classify(new TimeoutException())).isEqualTo(ErrorClass.TRANSIENT);
    }

    @Test
    void classify_rateLimitAndGatewayErrors_areTransient() {
        assertThat(classifier.isTransient(new RuntimeException("rate limit exceeded (429)"))).isTrue();
        assertThat(classifier.isTransient(
                HttpServerErrorException.create(HttpStatus.SERVICE_UNAVAILABLE, "Service Unavailable", HttpHeaders.EMPTY, new byte[0], null)))
                .isTrue();
        assertThat(classifier.isTransient(new RuntimeException("server error [502]"))).isTrue();
    }

    @Test
    void classify_transientCause_isTransient() {
        ResourceAccessException wrapped = new ResourceAccessException(
                "I/O error on GET request", new IOException("Connection reset"));

        assertThat(classifier.classify(wrapped)).isEqualTo(ErrorClass.TRANSIENT);
    }

    @Test
    void classify_permanentTypes_winOverMessage() {
        assertThat(classifier.classify(new IllegalArgumentException("timeout must be positive")))
                .isEqualTo(ErrorClass.PERMANENT);
        assertThat(classifier.classify(new ResearchException("connection refused: bad key")))
                .isEqualTo(ErrorClass.PERMANENT);
        assertThat(classifier.classify(new NoSuchElementException())).isEqualTo(ErrorClass.PERMANENT);
        assertThat(classifier.classify(new JsonParseException(null, "Unexpected character")))
                .isEqualTo(ErrorClass.PERMANENT);
        assertThat(classifier.classify(
                HttpClientErrorException.create(HttpStatus.UNAUTHORIZED, "Unauthorized", HttpHeaders.EMPTY, new byte[0], null)))
                .isEqualTo(ErrorClass.PERMANENT);
    }

    @Test
    void classify_unknownError_isPermanent() {
        assertThat(classifier.classify(new IllegalStateException("something odd"))).isEqualTo(ErrorClass.PERMANENT);
        assertThat(classifier.classify(null)).isEqualTo(ErrorClass.PERMANENT);
    }
}
