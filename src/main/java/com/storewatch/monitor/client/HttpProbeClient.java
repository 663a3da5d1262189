package com.storewatch.monitor.client;

import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.client.HttpClient;
import io.micronaut.http.client.exceptions.HttpClientResponseException;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * {@link ProbeClient} issuing a {@code HEAD} request through a Micronaut {@link HttpClient}
 * that follows redirects.  The request bound is the read timeout the {@code probe}
 * client is built with (see {@code MonitorClientFactory}).
 *
 * Any answer is turned into a status code, including 4xx/5xx which the blocking client
 * reports as {@link HttpClientResponseException}.  Everything else (DNS, refused
 * connection, timeout, TLS) becomes an error text.
 */
@Singleton
public class HttpProbeClient implements ProbeClient {

    private static final Logger log = LoggerFactory.getLogger(HttpProbeClient.class);

    private final HttpClient httpClient;

    @Inject
    public HttpProbeClient(@Named("probe") HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public ProbeResult probe(String url) {
        long started = System.nanoTime();
        try {
            HttpRequest<?> request = HttpRequest.HEAD(url).header("User-Agent", CaptureRequest.USER_AGENT);
            HttpResponse<?> response = httpClient.toBlocking().exchange(request);
            return new ProbeResult(response.getStatus().getCode(), elapsedMs(started), null);

        } catch (HttpClientResponseException e) {
            return new ProbeResult(e.getStatus().getCode(), elapsedMs(started), null);

        } catch (Exception e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.debug("Probe transport failure url={}: {}", url, message);
            return new ProbeResult(null, elapsedMs(started), message);
        }
    }

    private static long elapsedMs(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos).toMillis();
    }
}
