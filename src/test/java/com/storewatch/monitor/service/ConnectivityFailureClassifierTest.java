package com.storewatch.monitor.service;

import com.storewatch.monitor.client.CaptureException;
import io.micronaut.http.client.exceptions.ReadTimeoutException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.net.ConnectException;
import java.net.UnknownHostException;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ConnectivityFailureClassifier")
class ConnectivityFailureClassifierTest {

    private final ConnectivityFailureClassifier classifier = new ConnectivityFailureClassifier();

    @ParameterizedTest
    @ValueSource(strings = {
            "net::ERR_NAME_NOT_RESOLVED at https://shop.example.com",
            "getaddrinfo ENOTFOUND shop.example.com",
            "connect ECONNREFUSED 10.0.0.1:443",
            "Navigation timeout of 45000 ms exceeded",
            "Read timed out",
            "net::ERR_CONNECTION_REFUSED at https://shop.example.com",
            "net::ERR_CONNECTION_TIMED_OUT at https://shop.example.com",
            "java.net.UnknownHostException: shop.example.com",
            "Connection refused"
    })
    @DisplayName("Recognises connectivity messages")
    void connectivityMessages(String message) {
        assertThat(classifier.isConnectivityFailure(new CaptureException(message))).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "Render service returned 500: Protocol error: Target closed",
            "Render service returned an empty screenshot for https://shop.example.com",
            "net::ERR_CERT_AUTHORITY_INVALID at https://shop.example.com"
    })
    @DisplayName("Other render errors are not connectivity failures")
    void otherMessages(String message) {
        assertThat(classifier.isConnectivityFailure(new CaptureException(message))).isFalse();
    }

    @Test
    @DisplayName("Matching is case-insensitive")
    void caseInsensitive() {
        assertThat(classifier.isConnectivityFailure(new CaptureException("NAVIGATION TIMEOUT"))).isTrue();
    }

    @Test
    @DisplayName("Looks through the cause chain")
    void causeChain() {
        CaptureException wrapped = new CaptureException("capture failed",
                new RuntimeException("wrapper", new UnknownHostException("shop.example.com")));

        assertThat(classifier.isConnectivityFailure(wrapped)).isTrue();
    }

    @Test
    @DisplayName("Recognises connectivity exception types")
    void exceptionTypes() {
        assertThat(classifier.isConnectivityFailure(new ConnectException())).isTrue();
        assertThat(classifier.isConnectivityFailure(ReadTimeoutException.TIMEOUT_EXCEPTION)).isTrue();
    }

    @Test
    @DisplayName("Render service outage is not the store's connectivity failure")
    void renderServiceUnavailable() {
        CaptureException outage = CaptureException.renderServiceUnavailable(
                "Render service unavailable: Connect Error: Connection refused: /127.0.0.1:1",
                new ConnectException("Connection refused"));
        CaptureException renderTimeout = CaptureException.renderServiceUnavailable(
                "Render service unavailable: Read Timeout", ReadTimeoutException.TIMEOUT_EXCEPTION);

        assertThat(classifier.isConnectivityFailure(outage)).isFalse();
        assertThat(classifier.isConnectivityFailure(renderTimeout)).isFalse();
    }

    @Test
    @DisplayName("Null is not a connectivity failure")
    void nullError() {
        assertThat(classifier.isConnectivityFailure(null)).isFalse();
    }
}
