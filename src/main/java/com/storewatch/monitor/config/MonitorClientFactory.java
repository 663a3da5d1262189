package com.storewatch.monitor.config;

import com.sendgrid.SendGrid;
import com.sendgrid.SendGridAPI;
import com.storewatch.monitor.client.CaptureRequest;
import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Value;
import io.micronaut.http.client.DefaultHttpClientConfiguration;
import io.micronaut.http.client.HttpClient;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URL;
import java.time.Clock;
import java.time.Duration;

/**
 * Builds the outbound clients of the worker: the render service client, the
 * availability probe client, the artifact bucket client and the mail client.
 *
 * All of them are closed with the application context.
 */
@Factory
public class MonitorClientFactory {

    private static final Logger log = LoggerFactory.getLogger(MonitorClientFactory.class);

    /** Extra read allowance on top of the page timeout and settle delay of a capture. */
    static final Duration RENDER_READ_MARGIN = Duration.ofSeconds(15);

    /** Full-page screenshots of long homepages run to several megabytes. */
    static final int RENDER_MAX_CONTENT_LENGTH = 50 * 1024 * 1024;

    private final MonitorProperties properties;

    public MonitorClientFactory(MonitorProperties properties) {
        this.properties = properties;
    }

    @Singleton
    @Named("render")
    @Bean(preDestroy = "close")
    public HttpClient renderHttpClient(@Value("${render.endpoint}") String endpoint) throws MalformedURLException {
        DefaultHttpClientConfiguration configuration = new DefaultHttpClientConfiguration();
        configuration.setReadTimeout(renderReadTimeout(properties));
        configuration.setMaxContentLength(RENDER_MAX_CONTENT_LENGTH);

        log.info("Render client endpoint={} readTimeout={}", endpoint, configuration.getReadTimeout().orElse(null));
        return HttpClient.create(new URL(endpoint), configuration);
    }

    @Singleton
    @Named("probe")
    @Bean(preDestroy = "close")
    public HttpClient probeHttpClient() {
        DefaultHttpClientConfiguration configuration = new DefaultHttpClientConfiguration();
        configuration.setReadTimeout(properties.getProbeTimeout());
        configuration.setConnectTimeout(properties.getProbeTimeout());
        configuration.setFollowRedirects(true);
        return HttpClient.create(null, configuration);
    }

    @Singleton
    @Bean(preDestroy = "close")
    public S3Client s3Client(@Value("${artifacts.endpoint}") String endpoint,
                             @Value("${artifacts.region:auto}") String region,
                             @Value("${artifacts.access-key-id}") String accessKeyId,
                             @Value("${artifacts.secret-access-key}") String secretAccessKey) {
        log.info("Artifact bucket endpoint={} region={}", endpoint, region);
        return S3Client.builder()
                .endpointOverride(URI.create(endpoint))
                .region(Region.of(region))
                .credentialsProvider(StaticCredentialsProvider.create(
                        AwsBasicCredentials.create(accessKeyId, secretAccessKey)))
                .serviceConfiguration(S3Configuration.builder()
                        .pathStyleAccessEnabled(true)
                        .build())
                .build();
    }

    @Singleton
    public SendGridAPI sendGrid(@Value("${sendgrid.api-key:}") String apiKey) {
        return new SendGrid(apiKey);
    }

    @Singleton
    public Clock clock() {
        return Clock.systemUTC();
    }

    static Duration renderReadTimeout(MonitorProperties properties) {
        return properties.getCaptureTimeout()
                .plus(CaptureRequest.SETTLE_DELAY)
                .plus(RENDER_READ_MARGIN);
    }
}
