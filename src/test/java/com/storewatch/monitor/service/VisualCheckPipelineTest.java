package com.storewatch.monitor.service;

import com.storewatch.monitor.client.ArtifactStore;
import com.storewatch.monitor.client.CaptureException;
import com.storewatch.monitor.client.CaptureRequest;
import com.storewatch.monitor.client.RenderCaptureClient;
import com.storewatch.monitor.config.MonitorProperties;
import com.storewatch.monitor.model.Alert;
import com.storewatch.monitor.model.AlertCategory;
import com.storewatch.monitor.model.AlertSeverity;
import com.storewatch.monitor.model.Run;
import com.storewatch.monitor.model.RunStatus;
import com.storewatch.monitor.model.Store;
import com.storewatch.monitor.model.StoreStatus;
import com.storewatch.monitor.repository.AlertRepository;
import com.storewatch.monitor.repository.RunRepository;
import com.storewatch.monitor.repository.StoreRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.ConnectException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("VisualCheckPipeline")
class VisualCheckPipelineTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private static final UUID STORE_ID = UUID.fromString("5b1f3c2e-8a44-4a7e-9d0b-2f6c1e7a9b10");

    private static final String BASE = "https://cdn.storewatch.test/";
    private static final String SCREENSHOT_KEY = "screenshots/" + STORE_ID + "/homepage-2024-05-01T10-00-00Z.png";
    private static final String SCREENSHOT_URL = BASE + SCREENSHOT_KEY;
    private static final String DIFF_KEY = "diffs/" + STORE_ID + "/2024-05-01T10-00-00Z-diff.png";
    private static final String DIFF_URL = BASE + DIFF_KEY;
    private static final String BASELINE_KEY = "screenshots/" + STORE_ID + "/homepage-2024-04-30T10-00-00Z.png";
    private static final String BASELINE_URL = BASE + BASELINE_KEY;

    private static final byte[] CAPTURE = {1, 2, 3};
    private static final byte[] BASELINE = {4, 5, 6};
    private static final byte[] OVERLAY = {7, 8, 9};

    @Mock
    private RenderCaptureClient captureClient;

    @Mock
    private ArtifactStore artifactStore;

    @Mock
    private ImageDiffEngine diffEngine;

    @Mock
    private FailureTracker failureTracker;

    @Mock
    private StoreRepository storeRepository;

    @Mock
    private RunRepository runRepository;

    @Mock
    private AlertRepository alertRepository;

    @Mock
    private NotificationDispatcher notificationDispatcher;

    private MonitorProperties properties;
    private VisualCheckPipeline pipeline;

    @BeforeEach
    void setUp() {
        properties = new MonitorProperties();
        pipeline = new VisualCheckPipeline(captureClient, artifactStore, diffEngine, failureTracker,
                new ConnectivityFailureClassifier(), storeRepository, runRepository, alertRepository,
                notificationDispatcher, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Store store(String baselineUrl) {
        return Store.builder()
                .id(STORE_ID)
                .url("shop.example.com")
                .status(StoreStatus.ACTIVE)
                .baselineUrl(baselineUrl)
                .build();
    }

    private void captureSucceeds() throws CaptureException {
        when(captureClient.capture(any(CaptureRequest.class))).thenReturn(CAPTURE);
        when(artifactStore.put(SCREENSHOT_KEY, CAPTURE)).thenReturn(SCREENSHOT_URL);
    }

    private void baselineReadable() {
        when(artifactStore.keyFromPublicUrl(BASELINE_URL)).thenReturn(Optional.of(BASELINE_KEY));
        when(artifactStore.get(BASELINE_KEY)).thenReturn(Optional.of(BASELINE));
    }

    private Run savedRun() {
        ArgumentCaptor<Run> captor = ArgumentCaptor.forClass(Run.class);
        verify(runRepository).save(captor.capture());
        return captor.getValue();
    }

    // -----------------------------------------------------------------------
    // Baseline lifecycle
    // -----------------------------------------------------------------------

    @Nested
    @DisplayName("Baseline lifecycle")
    class BaselineLifecycle {

        @Test
        @DisplayName("First capture becomes the baseline without an alert")
        void firstCaptureCreatesBaseline() throws Exception {
            captureSucceeds();
            Store store = store(null);

            VisualCheckOutcome outcome = pipeline.process(store);

            assertThat(outcome).isEqualTo(VisualCheckOutcome.BASELINE_CREATED);
            verify(storeRepository).updateBaseline(STORE_ID, SCREENSHOT_URL);
            assertThat(store.getBaselineUrl()).isEqualTo(SCREENSHOT_URL);
            verifyNoInteractions(diffEngine, alertRepository, notificationDispatcher);
            verify(failureTracker).recordSuccess(store);

            Run run = savedRun();
            assertThat(run.getStatus()).isEqualTo(RunStatus.SUCCESS);
            assertThat(run.getScreenshotUrl()).isEqualTo(SCREENSHOT_URL);
            assertThat(run.getDiffPercentage()).isNull();
            assertThat(run.getStartedAt()).isEqualTo(NOW);
            assertThat(run.getFinishedAt()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("Unreadable baseline is replaced silently")
        void missingBaselineIsReset() throws Exception {
            captureSucceeds();
            when(artifactStore.keyFromPublicUrl(BASELINE_URL)).thenReturn(Optional.of(BASELINE_KEY));
            when(artifactStore.get(BASELINE_KEY)).thenReturn(Optional.empty());

            VisualCheckOutcome outcome = pipeline.process(store(BASELINE_URL));

            assertThat(outcome).isEqualTo(VisualCheckOutcome.BASELINE_RESET_MISSING);
            verify(storeRepository).updateBaseline(STORE_ID, SCREENSHOT_URL);
            verifyNoInteractions(diffEngine, alertRepository, notificationDispatcher);
            assertThat(savedRun().getStatus()).isEqualTo(RunStatus.SUCCESS);
        }

        @Test
        @DisplayName("Baseline URL without a key is replaced silently")
        void keylessBaselineIsReset() throws Exception {
            captureSucceeds();
            when(artifactStore.keyFromPublicUrl("not a url")).thenReturn(Optional.empty());

            VisualCheckOutcome outcome = pipeline.process(store("not a url"));

            assertThat(outcome).isEqualTo(VisualCheckOutcome.BASELINE_RESET_MISSING);
            verify(storeRepository).updateBaseline(STORE_ID, SCREENSHOT_URL);
            verify(artifactStore, never()).get(anyString());
        }

        @Test
        @DisplayName("Changed page size replaces the baseline without an alert")
        void dimensionChangeResetsBaseline() throws Exception {
            captureSucceeds();
            baselineReadable();
            when(diffEngine.compare(BASELINE, CAPTURE)).thenReturn(DiffResult.dimensionMismatch());

            VisualCheckOutcome outcome = pipeline.process(store(BASELINE_URL));

            assertThat(outcome).isEqualTo(VisualCheckOutcome.BASELINE_RESET_DIMENSIONS);
            verify(storeRepository).updateBaseline(STORE_ID, SCREENSHOT_URL);
            verifyNoInteractions(alertRepository, notificationDispatcher);
            assertThat(savedRun().getDiffPercentage()).isNull();
        }

        @Test
        @DisplayName("Small change moves the baseline forward")
        void minorChangeAdvancesBaseline() throws Exception {
            captureSucceeds();
            baselineReadable();
            when(diffEngine.compare(BASELINE, CAPTURE)).thenReturn(DiffResult.compared(false, 2.0, null));

            VisualCheckOutcome outcome = pipeline.process(store(BASELINE_URL));

            assertThat(outcome).isEqualTo(VisualCheckOutcome.BASELINE_ADVANCED);
            verify(storeRepository).updateBaseline(STORE_ID, SCREENSHOT_URL);
            verifyNoInteractions(alertRepository, notificationDispatcher);
            assertThat(savedRun().getDiffPercentage()).isEqualTo(2.0);
        }

        @Test
        @DisplayName("Identical capture leaves the baseline reference alone")
        void identicalCaptureKeepsBaseline() throws Exception {
            captureSucceeds();
            baselineReadable();
            when(diffEngine.compare(BASELINE, CAPTURE)).thenReturn(DiffResult.compared(false, 0.0, null));
            Store store = store(BASELINE_URL);

            VisualCheckOutcome outcome = pipeline.process(store);

            assertThat(outcome).isEqualTo(VisualCheckOutcome.UNCHANGED);
            verify(storeRepository, never()).updateBaseline(any(), anyString());
            assertThat(store.getBaselineUrl()).isEqualTo(BASELINE_URL);
            assertThat(savedRun().getDiffPercentage()).isEqualTo(0.0);
        }
    }

    // -----------------------------------------------------------------------
    // Alerting
    // -----------------------------------------------------------------------

    @Nested
    @DisplayName("Significant change")
    class SignificantChange {

        @Test
        @DisplayName("Raises a VISUAL alert with overlay and keeps the baseline")
        void raisesAlert() throws Exception {
            captureSucceeds();
            baselineReadable();
            when(diffEngine.compare(BASELINE, CAPTURE)).thenReturn(DiffResult.compared(true, 12.5, OVERLAY));
            when(artifactStore.put(DIFF_KEY, OVERLAY)).thenReturn(DIFF_URL);
            Store store = store(BASELINE_URL);

            VisualCheckOutcome outcome = pipeline.process(store);

            assertThat(outcome).isEqualTo(VisualCheckOutcome.ALERTED);

            ArgumentCaptor<Alert> captor = ArgumentCaptor.forClass(Alert.class);
            verify(alertRepository).save(captor.capture());
            Alert alert = captor.getValue();
            assertThat(alert.getStoreId()).isEqualTo(STORE_ID);
            assertThat(alert.getCategory()).isEqualTo(AlertCategory.VISUAL);
            assertThat(alert.getStep()).isEqualTo("homepage");
            assertThat(alert.getBeforeUrl()).isEqualTo(BASELINE_URL);
            assertThat(alert.getAfterUrl()).isEqualTo(SCREENSHOT_URL);
            assertThat(alert.getDiffUrl()).isEqualTo(DIFF_URL);
            assertThat(alert.getDiffPercentage()).isEqualTo(12.5);
            assertThat(alert.getSeverity()).isEqualTo(AlertSeverity.LOW);

            verify(notificationDispatcher).dispatch(store, alert);
            verify(storeRepository, never()).updateBaseline(any(), anyString());

            Run run = savedRun();
            assertThat(run.getStatus()).isEqualTo(RunStatus.SUCCESS);
            assertThat(run.getDiffPercentage()).isEqualTo(12.5);
        }

        @Test
        @DisplayName("Change above the high threshold is HIGH severity")
        void highSeverity() throws Exception {
            captureSucceeds();
            baselineReadable();
            when(diffEngine.compare(BASELINE, CAPTURE)).thenReturn(DiffResult.compared(true, 25.0, null));

            pipeline.process(store(BASELINE_URL));

            ArgumentCaptor<Alert> captor = ArgumentCaptor.forClass(Alert.class);
            verify(alertRepository).save(captor.capture());
            assertThat(captor.getValue().getSeverity()).isEqualTo(AlertSeverity.HIGH);
            assertThat(captor.getValue().getDiffUrl()).isNull();
        }

        @Test
        @DisplayName("Overlay upload failure still raises the alert")
        void overlayUploadFailure() throws Exception {
            captureSucceeds();
            baselineReadable();
            when(diffEngine.compare(BASELINE, CAPTURE)).thenReturn(DiffResult.compared(true, 30.0, OVERLAY));
            when(artifactStore.put(DIFF_KEY, OVERLAY)).thenThrow(new RuntimeException("bucket unavailable"));

            VisualCheckOutcome outcome = pipeline.process(store(BASELINE_URL));

            assertThat(outcome).isEqualTo(VisualCheckOutcome.ALERTED);
            ArgumentCaptor<Alert> captor = ArgumentCaptor.forClass(Alert.class);
            verify(alertRepository).save(captor.capture());
            assertThat(captor.getValue().getDiffUrl()).isNull();
            verify(notificationDispatcher).dispatch(any(), any());
        }

        @Test
        @DisplayName("Baseline advances on alert when configured")
        void advanceOnAlert() throws Exception {
            properties.setAdvanceBaselineOnAlert(true);
            captureSucceeds();
            baselineReadable();
            when(diffEngine.compare(BASELINE, CAPTURE)).thenReturn(DiffResult.compared(true, 12.5, null));

            VisualCheckOutcome outcome = pipeline.process(store(BASELINE_URL));

            assertThat(outcome).isEqualTo(VisualCheckOutcome.ALERTED);
            verify(storeRepository).updateBaseline(STORE_ID, SCREENSHOT_URL);
        }

        @Test
        @DisplayName("Failed comparison records an error run and keeps the baseline")
        void comparisonFailure() throws Exception {
            captureSucceeds();
            baselineReadable();
            when(diffEngine.compare(BASELINE, CAPTURE)).thenReturn(DiffResult.failed("Image decode failed: bad PNG"));

            VisualCheckOutcome outcome = pipeline.process(store(BASELINE_URL));

            assertThat(outcome).isEqualTo(VisualCheckOutcome.COMPARISON_FAILED);
            verifyNoInteractions(alertRepository, notificationDispatcher);
            verify(storeRepository, never()).updateBaseline(any(), anyString());

            Run run = savedRun();
            assertThat(run.getStatus()).isEqualTo(RunStatus.ERROR);
            assertThat(run.getErrorMessage()).isEqualTo("Image decode failed: bad PNG");
            assertThat(run.getScreenshotUrl()).isEqualTo(SCREENSHOT_URL);
        }
    }

    // -----------------------------------------------------------------------
    // Failures
    // -----------------------------------------------------------------------

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Unreachable store is counted as a connectivity failure")
        void connectivityFailure() throws Exception {
            when(captureClient.capture(any(CaptureRequest.class)))
                    .thenThrow(new CaptureException("net::ERR_NAME_NOT_RESOLVED at https://shop.example.com"));
            Store store = store(BASELINE_URL);

            VisualCheckOutcome outcome = pipeline.process(store);

            assertThat(outcome).isEqualTo(VisualCheckOutcome.CAPTURE_FAILED);
            verify(failureTracker).recordConnectivityFailure(store);
            verifyNoInteractions(artifactStore, diffEngine, alertRepository);
            verify(storeRepository).updateLastChecked(STORE_ID, NOW);

            Run run = savedRun();
            assertThat(run.getStatus()).isEqualTo(RunStatus.ERROR);
            assertThat(run.getErrorMessage()).contains("ERR_NAME_NOT_RESOLVED");
            assertThat(run.getScreenshotUrl()).isNull();
        }

        @Test
        @DisplayName("Other capture failures do not touch the failure counter")
        void genericCaptureFailure() throws Exception {
            when(captureClient.capture(any(CaptureRequest.class)))
                    .thenThrow(new CaptureException("Render service returned 500: Protocol error: Target closed"));

            VisualCheckOutcome outcome = pipeline.process(store(BASELINE_URL));

            assertThat(outcome).isEqualTo(VisualCheckOutcome.CAPTURE_FAILED);
            verify(failureTracker, never()).recordConnectivityFailure(any());
            assertThat(savedRun().getStatus()).isEqualTo(RunStatus.ERROR);
        }

        @Test
        @DisplayName("Render service outage is not held against the store")
        void renderServiceUnavailable() throws Exception {
            when(captureClient.capture(any(CaptureRequest.class)))
                    .thenThrow(CaptureException.renderServiceUnavailable(
                            "Render service unavailable: Connect Error: Connection refused: /127.0.0.1:1",
                            new ConnectException("Connection refused")));
            Store store = store(BASELINE_URL);

            VisualCheckOutcome outcome = pipeline.process(store);

            assertThat(outcome).isEqualTo(VisualCheckOutcome.RENDER_UNAVAILABLE);
            verifyNoInteractions(failureTracker, artifactStore, diffEngine, alertRepository, notificationDispatcher);
            verify(storeRepository, never()).markInactive(any(), anyInt());
            assertThat(store.getStatus()).isEqualTo(StoreStatus.ACTIVE);

            Run run = savedRun();
            assertThat(run.getStatus()).isEqualTo(RunStatus.ERROR);
            assertThat(run.getErrorMessage()).contains("Render service unavailable");
        }

        @Test
        @DisplayName("Storage failure after capture ends the run in error")
        void storageFailure() throws Exception {
            when(captureClient.capture(any(CaptureRequest.class))).thenReturn(CAPTURE);
            when(artifactStore.put(SCREENSHOT_KEY, CAPTURE)).thenThrow(new RuntimeException("bucket unavailable"));

            VisualCheckOutcome outcome = pipeline.process(store(BASELINE_URL));

            assertThat(outcome).isEqualTo(VisualCheckOutcome.FAILED);
            verify(failureTracker, never()).recordConnectivityFailure(any());
            verify(storeRepository).updateLastChecked(STORE_ID, NOW);

            Run run = savedRun();
            assertThat(run.getStatus()).isEqualTo(RunStatus.ERROR);
            assertThat(run.getErrorMessage()).isEqualTo("bucket unavailable");
        }

        @Test
        @DisplayName("Run persistence failure never escapes")
        void finalisationFailureIsContained() throws Exception {
            captureSucceeds();
            doThrow(new RuntimeException("DB error in save")).when(runRepository).save(any(Run.class));
            doThrow(new RuntimeException("DB error in updateLastChecked"))
                    .when(storeRepository).updateLastChecked(eq(STORE_ID), any(Instant.class));

            assertThatCode(() -> pipeline.process(store(null))).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Captures the scheme-normalised homepage")
        void normalisesUrl() throws Exception {
            captureSucceeds();

            pipeline.process(store(null));

            ArgumentCaptor<CaptureRequest> captor = ArgumentCaptor.forClass(CaptureRequest.class);
            verify(captureClient).capture(captor.capture());
            assertThat(captor.getValue().url()).isEqualTo("https://shop.example.com");
            assertThat(captor.getValue().timeout()).isEqualTo(properties.getCaptureTimeout());
        }
    }
}
