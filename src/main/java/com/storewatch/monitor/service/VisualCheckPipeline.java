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
import com.storewatch.monitor.model.Store;
import com.storewatch.monitor.repository.AlertRepository;
import com.storewatch.monitor.repository.RunRepository;
import com.storewatch.monitor.repository.StoreRepository;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Runs the visual check of one store: capture the homepage, keep the capture, compare
 * it with the baseline and either raise an alert or move the baseline forward.
 *
 * <p>Baseline lifecycle:
 * <ul>
 *   <li>no baseline, unreadable baseline or changed page size: the capture becomes the
 *       baseline, no alert;</li>
 *   <li>significant change: VISUAL alert, the baseline stays (unless
 *       {@code monitor.advance-baseline-on-alert});</li>
 *   <li>small change: the capture becomes the baseline;</li>
 *   <li>identical capture: nothing changes.</li>
 * </ul>
 *
 * Every invocation appends exactly one {@link Run} and refreshes {@code last_checked},
 * whatever happened before.  An unreachable render service ends the check as
 * {@link VisualCheckOutcome#RENDER_UNAVAILABLE} without touching the failure counter.
 * {@link #process(Store)} never throws.
 */
@Singleton
public class VisualCheckPipeline {

    private static final Logger log = LoggerFactory.getLogger(VisualCheckPipeline.class);

    private final RenderCaptureClient captureClient;
    private final ArtifactStore artifactStore;
    private final ImageDiffEngine diffEngine;
    private final FailureTracker failureTracker;
    private final ConnectivityFailureClassifier failureClassifier;
    private final StoreRepository storeRepository;
    private final RunRepository runRepository;
    private final AlertRepository alertRepository;
    private final NotificationDispatcher notificationDispatcher;
    private final MonitorProperties properties;
    private final Clock clock;

    @Inject
    public VisualCheckPipeline(RenderCaptureClient captureClient,
                               ArtifactStore artifactStore,
                               ImageDiffEngine diffEngine,
                               FailureTracker failureTracker,
                               ConnectivityFailureClassifier failureClassifier,
                               StoreRepository storeRepository,
                               RunRepository runRepository,
                               AlertRepository alertRepository,
                               NotificationDispatcher notificationDispatcher,
                               MonitorProperties properties,
                               Clock clock) {
        this.captureClient = captureClient;
        this.artifactStore = artifactStore;
        this.diffEngine = diffEngine;
        this.failureTracker = failureTracker;
        this.failureClassifier = failureClassifier;
        this.storeRepository = storeRepository;
        this.runRepository = runRepository;
        this.alertRepository = alertRepository;
        this.notificationDispatcher = notificationDispatcher;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Checks one store.
     *
     * @param store an ACTIVE store
     * @return how the check ended
     */
    public VisualCheckOutcome process(Store store) {
        Run run = Run.builder()
                .storeId(store.getId())
                .startedAt(clock.instant())
                .build();
        String url = StoreUrls.normalize(store.getUrl());
        log.info("Visual check started storeId={} url={}", store.getId(), url);

        VisualCheckOutcome outcome;

        // ---- 1. Capture ----------------------------------------------------
        byte[] screenshot;
        try {
            screenshot = captureClient.capture(CaptureRequest.homepage(url, properties.getCaptureTimeout()));
        } catch (CaptureException e) {
            VisualCheckOutcome failure = handleCaptureFailure(store, url, e);
            run.setErrorMessage(e.getMessage());
            finish(store, run, failure);
            return failure;
        }

        try {
            outcome = evaluate(store, run, screenshot);
        } catch (RuntimeException e) {
            log.error("Visual check failed storeId={} url={}", store.getId(), url, e);
            run.setErrorMessage(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            outcome = VisualCheckOutcome.FAILED;
        }

        finish(store, run, outcome);
        return outcome;
    }

    // -----------------------------------------------------------------------
    // Steps 2-4: persist, decide, compare
    // -----------------------------------------------------------------------

    private VisualCheckOutcome evaluate(Store store, Run run, byte[] screenshot) {
        Instant capturedAt = clock.instant();

        // ---- 2. Persist the capture ----------------------------------------
        String screenshotUrl = artifactStore.put(ArtifactKeys.screenshot(store.getId(), capturedAt), screenshot);
        run.setScreenshotUrl(screenshotUrl);
        failureTracker.recordSuccess(store);

        // ---- 3. Baseline decision ------------------------------------------
        String baselineUrl = store.getBaselineUrl();
        if (baselineUrl == null || baselineUrl.isBlank()) {
            adoptBaseline(store, screenshotUrl);
            log.info("Baseline created storeId={} baselineUrl={}", store.getId(), screenshotUrl);
            return VisualCheckOutcome.BASELINE_CREATED;
        }

        Optional<byte[]> baseline = artifactStore.keyFromPublicUrl(baselineUrl).flatMap(artifactStore::get);
        if (baseline.isEmpty()) {
            adoptBaseline(store, screenshotUrl);
            log.warn("Baseline unreadable, replaced storeId={} previous={} baselineUrl={}",
                    store.getId(), baselineUrl, screenshotUrl);
            return VisualCheckOutcome.BASELINE_RESET_MISSING;
        }

        // ---- 4. Diff disposition -------------------------------------------
        DiffResult diff = diffEngine.compare(baseline.get(), screenshot);

        if (diff.comparisonFailed()) {
            log.warn("Comparison failed storeId={} reason={}", store.getId(), diff.failureReason());
            run.setErrorMessage(diff.failureReason());
            return VisualCheckOutcome.COMPARISON_FAILED;
        }

        if (diff.dimensionChanged()) {
            adoptBaseline(store, screenshotUrl);
            log.info("Page size changed, baseline replaced storeId={} baselineUrl={}", store.getId(), screenshotUrl);
            return VisualCheckOutcome.BASELINE_RESET_DIMENSIONS;
        }

        run.setDiffPercentage(diff.percentage());

        if (diff.significant()) {
            raiseVisualAlert(store, baselineUrl, screenshotUrl, diff, capturedAt);
            if (properties.isAdvanceBaselineOnAlert()) {
                adoptBaseline(store, screenshotUrl);
            }
            return VisualCheckOutcome.ALERTED;
        }

        if (diff.percentage() > 0) {
            adoptBaseline(store, screenshotUrl);
            log.info("Minor change, baseline advanced storeId={} diffPercentage={}", store.getId(), diff.percentage());
            return VisualCheckOutcome.BASELINE_ADVANCED;
        }

        log.info("No change storeId={}", store.getId());
        return VisualCheckOutcome.UNCHANGED;
    }

    private void raiseVisualAlert(Store store, String beforeUrl, String afterUrl, DiffResult diff, Instant capturedAt) {
        String diffUrl = null;
        if (diff.hasOverlay()) {
            try {
                diffUrl = artifactStore.put(ArtifactKeys.diff(store.getId(), capturedAt), diff.overlayPng());
            } catch (RuntimeException e) {
                log.warn("Overlay upload failed, alerting without it storeId={}: {}", store.getId(), e.getMessage());
            }
        }

        Alert alert = Alert.builder()
                .storeId(store.getId())
                .category(AlertCategory.VISUAL)
                .step(Alert.STEP_HOMEPAGE)
                .beforeUrl(beforeUrl)
                .afterUrl(afterUrl)
                .diffUrl(diffUrl)
                .diffPercentage(diff.percentage())
                .severity(AlertSeverity.forDiffPercentage(diff.percentage(), properties.getHighSeverityPercent()))
                .build();
        alertRepository.save(alert);

        log.warn("Visual alert raised storeId={} alertId={} diffPercentage={} severity={}",
                store.getId(), alert.getId(), alert.getDiffPercentage(), alert.getSeverity());

        notificationDispatcher.dispatch(store, alert);
    }

    private void adoptBaseline(Store store, String screenshotUrl) {
        storeRepository.updateBaseline(store.getId(), screenshotUrl);
        store.setBaselineUrl(screenshotUrl);
    }

    // -----------------------------------------------------------------------
    // Failure routing and finalisation
    // -----------------------------------------------------------------------

    private VisualCheckOutcome handleCaptureFailure(Store store, String url, CaptureException e) {
        if (e.isRenderServiceUnavailable()) {
            log.error("Render service unavailable, storeId={} url={} not judged: {}", store.getId(), url, e.getMessage());
            return VisualCheckOutcome.RENDER_UNAVAILABLE;
        }
        if (!failureClassifier.isConnectivityFailure(e)) {
            log.warn("Capture failed storeId={} url={}: {}", store.getId(), url, e.getMessage());
            return VisualCheckOutcome.CAPTURE_FAILED;
        }

        log.warn("Store unreachable storeId={} url={}: {}", store.getId(), url, e.getMessage());
        try {
            failureTracker.recordConnectivityFailure(store);
        } catch (RuntimeException trackerError) {
            log.error("Could not record connectivity failure storeId={}", store.getId(), trackerError);
        }
        return VisualCheckOutcome.CAPTURE_FAILED;
    }

    private void finish(Store store, Run run, VisualCheckOutcome outcome) {
        Instant finishedAt = clock.instant();
        run.setFinishedAt(finishedAt);
        run.setStatus(outcome.runStatus());

        try {
            storeRepository.updateLastChecked(store.getId(), finishedAt);
            store.setLastChecked(finishedAt);
        } catch (RuntimeException e) {
            log.error("Could not update last_checked storeId={}", store.getId(), e);
        }

        try {
            runRepository.save(run);
        } catch (RuntimeException e) {
            log.error("Could not record run storeId={} outcome={}", store.getId(), outcome, e);
        }

        log.info("Visual check finished storeId={} outcome={} status={} durationMs={}",
                store.getId(), outcome, run.getStatus(),
                finishedAt.toEpochMilli() - run.getStartedAt().toEpochMilli());
    }
}
