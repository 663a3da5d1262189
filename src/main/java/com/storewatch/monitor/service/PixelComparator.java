package com.storewatch.monitor.service;

import java.awt.image.BufferedImage;

/**
 * Counts the perceptually differing pixels of two equally sized rasters.
 */
public interface PixelComparator {

    /**
     * @param baseline  reference raster
     * @param current   raster to compare against the reference
     * @param output    raster receiving the highlighted overlay, or {@code null} to skip it
     * @param threshold perceptual tolerance between 0 and 1; smaller is stricter
     * @return number of differing pixels
     * @throws IllegalArgumentException when the rasters (or the output) differ in size
     */
    int compare(BufferedImage baseline, BufferedImage current, BufferedImage output, double threshold);
}
