package com.storewatch.monitor.service;

import com.storewatch.monitor.config.MonitorProperties;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Decides whether a fresh homepage capture differs meaningfully from its baseline.
 *
 * The engine never throws: missing or undecodable input fails closed with a
 * {@link DiffResult#failed(String) failed} result, and a size change is reported
 * without comparing any pixel.  Significance is judged on the unrounded percentage;
 * the reported percentage is rounded to two decimals.
 */
@Singleton
public class ImageDiffEngine {

    private static final Logger log = LoggerFactory.getLogger(ImageDiffEngine.class);

    private final PixelComparator pixelComparator;
    private final MonitorProperties properties;

    @Inject
    public ImageDiffEngine(PixelComparator pixelComparator, MonitorProperties properties) {
        this.pixelComparator = pixelComparator;
        this.properties = properties;
    }

    /**
     * @param baselinePng the stored baseline capture
     * @param currentPng  the capture just taken
     * @return the comparison outcome
     */
    public DiffResult compare(byte[] baselinePng, byte[] currentPng) {
        if (baselinePng == null || baselinePng.length == 0) {
            return DiffResult.failed("Baseline image is missing");
        }
        if (currentPng == null || currentPng.length == 0) {
            return DiffResult.failed("Current image is missing");
        }

        BufferedImage baseline;
        BufferedImage current;
        try {
            baseline = decode(baselinePng);
            current = decode(currentPng);
        } catch (IOException e) {
            log.warn("Image decode failed: {}", e.getMessage());
            return DiffResult.failed("Image decode failed: " + e.getMessage());
        }

        if (baseline.getWidth() != current.getWidth() || baseline.getHeight() != current.getHeight()) {
            log.info("Dimensions changed baseline={}x{} current={}x{}",
                    baseline.getWidth(), baseline.getHeight(), current.getWidth(), current.getHeight());
            return DiffResult.dimensionMismatch();
        }

        int width = current.getWidth();
        int height = current.getHeight();
        BufferedImage overlay = properties.isOverlayEnabled()
                ? new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB)
                : null;

        int diffPixels;
        try {
            diffPixels = pixelComparator.compare(baseline, current, overlay, properties.getPixelThreshold());
        } catch (RuntimeException e) {
            log.error("Pixel comparison failed", e);
            return DiffResult.failed("Pixel comparison failed: " + e.getMessage());
        }

        double rawPercentage = (double) diffPixels / ((long) width * height) * 100.0;
        double percentage = round2(rawPercentage);
        boolean significant = rawPercentage > properties.getDiffThresholdPercent();

        byte[] overlayPng = null;
        if (significant && overlay != null) {
            overlayPng = encodeOverlay(overlay);
        }

        log.debug("Compared {}x{} diffPixels={} percentage={} significant={}",
                width, height, diffPixels, percentage, significant);
        return DiffResult.compared(significant, percentage, overlayPng);
    }

    // -----------------------------------------------------------------------
    // Private helpers
    // -----------------------------------------------------------------------

    private static BufferedImage decode(byte[] png) throws IOException {
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(png));
        if (image == null) {
            throw new IOException("unsupported image format");
        }
        return image;
    }

    private static byte[] encodeOverlay(BufferedImage overlay) {
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            if (!ImageIO.write(overlay, "png", out)) {
                log.warn("No PNG writer available, overlay skipped");
                return null;
            }
            return out.toByteArray();
        } catch (IOException e) {
            log.warn("Overlay encoding failed: {}", e.getMessage());
            return null;
        }
    }

    static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
