package com.storewatch.monitor.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micronaut.context.annotation.Value;
import io.micronaut.core.type.Argument;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.MediaType;
import io.micronaut.http.client.HttpClient;
import io.micronaut.http.client.exceptions.HttpClientException;
import io.micronaut.http.client.exceptions.HttpClientResponseException;
import io.micronaut.http.uri.UriBuilder;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link RenderCaptureClient} backed by the Browserless REST {@code /screenshot} API.
 *
 * Each capture is a single blocking POST; the remote browser session lives only for
 * the duration of that request, so there is no connection to hand back on shutdown
 * beyond closing the HTTP client itself.  Error responses carry the browser's error
 * text (e.g. {@code net::ERR_CONNECTION_REFUSED at https://...}), which is preserved in
 * the {@link CaptureException} message.  A request that never gets an answer (refused
 * connection, read timeout) is reported as the render service being unavailable.
 */
@Singleton
public class BrowserlessCaptureClient implements RenderCaptureClient {

    private static final Logger log = LoggerFactory.getLogger(BrowserlessCaptureClient.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String token;

    @Inject
    public BrowserlessCaptureClient(@Named("render") HttpClient httpClient,
                                    ObjectMapper objectMapper,
                                    @Value("${render.token:}") String token) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.token = token;
    }

    @Override
    public byte[] capture(CaptureRequest request) throws CaptureException {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(buildPayload(request));
        } catch (JsonProcessingException e) {
            throw new CaptureException("Could not serialise capture request for " + request.url(), e);
        }

        HttpRequest<String> httpRequest = HttpRequest.POST(screenshotUri(), payload)
                .contentType(MediaType.APPLICATION_JSON_TYPE)
                .accept(MediaType.IMAGE_PNG_TYPE);

        long started = System.currentTimeMillis();
        try {
            HttpResponse<byte[]> response = httpClient.toBlocking()
                    .exchange(httpRequest, Argument.of(byte[].class), Argument.STRING);

            byte[] body = response.getBody().orElse(null);
            if (body == null || body.length == 0) {
                throw new CaptureException("Render service returned an empty screenshot for " + request.url());
            }

            log.info("Captured url={} bytes={} durationMs={}",
                    request.url(), body.length, System.currentTimeMillis() - started);
            return body;

        } catch (HttpClientResponseException e) {
            String detail = e.getResponse().getBody(String.class).orElse(e.getMessage());
            log.warn("Render service rejected url={} status={}: {}", request.url(), e.getStatus().getCode(), detail);
            throw new CaptureException("Render service returned " + e.getStatus().getCode() + ": " + detail, e);

        } catch (HttpClientException e) {
            log.warn("Render service unreachable url={}: {}", request.url(), e.getMessage());
            throw CaptureException.renderServiceUnavailable("Render service unavailable: " + e.getMessage(), e);
        }
    }

    // -----------------------------------------------------------------------
    // Private helpers
    // -----------------------------------------------------------------------

    private URI screenshotUri() {
        UriBuilder builder = UriBuilder.of("/screenshot");
        if (token != null && !token.isBlank()) {
            builder.queryParam("token", token);
        }
        return builder.build();
    }

    Map<String, Object> buildPayload(CaptureRequest request) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("url", request.url());
        payload.put("options", Map.of("fullPage", true, "type", "png"));
        payload.put("gotoOptions", Map.of(
                "waitUntil", "networkidle2",
                "timeout", request.timeout().toMillis()));
        payload.put("viewport", Map.of(
                "width", request.viewportWidth(),
                "height", request.viewportHeight()));
        payload.put("userAgent", request.userAgent());
        payload.put("setExtraHTTPHeaders", request.extraHeaders());
        payload.put("rejectResourceTypes", request.rejectedResourceTypes());
        payload.put("addStyleTag", List.of(Map.of("content", request.hideOverlaysCss())));
        payload.put("waitForTimeout", request.settleDelay().toMillis());
        return payload;
    }
}
