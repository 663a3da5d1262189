package com.storewatch.monitor.service;

import jakarta.inject.Singleton;

import java.awt.image.BufferedImage;
import java.util.Arrays;

/**
 * {@link PixelComparator} measuring colour distance in the YIQ space, which weighs
 * luminance over chrominance the way the eye does.
 *
 * A pixel counts as different when its squared YIQ delta exceeds
 * {@code 35215 * threshold²} (35215 being the largest possible delta) and it is not
 * an anti-aliasing artefact in either raster.  Anti-aliasing is recognised as a pixel
 * sitting on a luminance gradient between two neighbours that each have at least three
 * identical siblings in both rasters.
 *
 * The overlay shows the baseline in faded grayscale, differing pixels in red and
 * ignored anti-aliased pixels in yellow.
 */
@Singleton
public class YiqPixelComparator implements PixelComparator {

    static final double MAX_YIQ_DELTA = 35215;

    static final int DIFF_COLOR = 0xFFFF0000;
    static final int AA_COLOR   = 0xFFFFFF00;

    /** Opacity of the grayscale baseline in the overlay. */
    static final double OVERLAY_ALPHA = 0.5;

    @Override
    public int compare(BufferedImage baseline, BufferedImage current, BufferedImage output, double threshold) {
        int width = baseline.getWidth();
        int height = baseline.getHeight();
        if (current.getWidth() != width || current.getHeight() != height) {
            throw new IllegalArgumentException("Image sizes do not match: "
                    + width + "x" + height + " vs " + current.getWidth() + "x" + current.getHeight());
        }
        if (output != null && (output.getWidth() != width || output.getHeight() != height)) {
            throw new IllegalArgumentException("Output size does not match: "
                    + output.getWidth() + "x" + output.getHeight());
        }

        int[] img1 = baseline.getRGB(0, 0, width, height, null, 0, width);
        int[] img2 = current.getRGB(0, 0, width, height, null, 0, width);
        int[] out = output != null ? new int[width * height] : null;

        if (Arrays.equals(img1, img2)) {
            if (out != null) {
                for (int i = 0; i < img1.length; i++) {
                    out[i] = grayPixel(img1[i]);
                }
                output.setRGB(0, 0, width, height, out, 0, width);
            }
            return 0;
        }

        double maxDelta = MAX_YIQ_DELTA * threshold * threshold;
        int diff = 0;

        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int pos = y * width + x;
                double delta = colorDelta(img1[pos], img2[pos], false);

                if (Math.abs(delta) > maxDelta) {
                    if (antialiased(img1, x, y, width, height, img2)
                            || antialiased(img2, x, y, width, height, img1)) {
                        if (out != null) {
                            out[pos] = AA_COLOR;
                        }
                    } else {
                        if (out != null) {
                            out[pos] = DIFF_COLOR;
                        }
                        diff++;
                    }
                } else if (out != null) {
                    out[pos] = grayPixel(img1[pos]);
                }
            }
        }

        if (out != null) {
            output.setRGB(0, 0, width, height, out, 0, width);
        }
        return diff;
    }

    // -----------------------------------------------------------------------
    // Anti-aliasing detection
    // -----------------------------------------------------------------------

    private static boolean antialiased(int[] img, int x1, int y1, int width, int height, int[] other) {
        int x0 = Math.max(x1 - 1, 0);
        int y0 = Math.max(y1 - 1, 0);
        int x2 = Math.min(x1 + 1, width - 1);
        int y2 = Math.min(y1 + 1, height - 1);
        int pixel = img[y1 * width + x1];

        int zeroes = (x1 == x0 || x1 == x2 || y1 == y0 || y1 == y2) ? 1 : 0;
        double min = 0;
        double max = 0;
        int minX = 0, minY = 0, maxX = 0, maxY = 0;

        for (int x = x0; x <= x2; x++) {
            for (int y = y0; y <= y2; y++) {
                if (x == x1 && y == y1) {
                    continue;
                }
                double delta = colorDelta(pixel, img[y * width + x], true);
                if (delta == 0) {
                    zeroes++;
                    if (zeroes > 2) {
                        return false;
                    }
                } else if (delta < min) {
                    min = delta;
                    minX = x;
                    minY = y;
                } else if (delta > max) {
                    max = delta;
                    maxX = x;
                    maxY = y;
                }
            }
        }

        // no darker or no brighter neighbour: not on a gradient
        if (min == 0 || max == 0) {
            return false;
        }

        return (hasManySiblings(img, minX, minY, width, height) && hasManySiblings(other, minX, minY, width, height))
                || (hasManySiblings(img, maxX, maxY, width, height) && hasManySiblings(other, maxX, maxY, width, height));
    }

    private static boolean hasManySiblings(int[] img, int x1, int y1, int width, int height) {
        int x0 = Math.max(x1 - 1, 0);
        int y0 = Math.max(y1 - 1, 0);
        int x2 = Math.min(x1 + 1, width - 1);
        int y2 = Math.min(y1 + 1, height - 1);
        int pixel = img[y1 * width + x1];

        int zeroes = (x1 == x0 || x1 == x2 || y1 == y0 || y1 == y2) ? 1 : 0;
        for (int x = x0; x <= x2; x++) {
            for (int y = y0; y <= y2; y++) {
                if (x == x1 && y == y1) {
                    continue;
                }
                if (img[y * width + x] == pixel) {
                    zeroes++;
                }
                if (zeroes > 2) {
                    return true;
                }
            }
        }
        return false;
    }

    // -----------------------------------------------------------------------
    // Colour arithmetic (ARGB ints)
    // -----------------------------------------------------------------------

    /**
     * Squared YIQ distance between two pixels, signed negative when the first one is
     * brighter.  With {@code yOnly} only the signed luminance difference is returned.
     */
    static double colorDelta(int p1, int p2, boolean yOnly) {
        if (p1 == p2) {
            return 0;
        }

        double a1 = alpha(p1) / 255.0;
        double a2 = alpha(p2) / 255.0;
        double r1 = blend(red(p1), a1);
        double g1 = blend(green(p1), a1);
        double b1 = blend(blue(p1), a1);
        double r2 = blend(red(p2), a2);
        double g2 = blend(green(p2), a2);
        double b2 = blend(blue(p2), a2);

        double y1 = rgb2y(r1, g1, b1);
        double y2 = rgb2y(r2, g2, b2);
        double y = y1 - y2;
        if (yOnly) {
            return y;
        }

        double i = rgb2i(r1, g1, b1) - rgb2i(r2, g2, b2);
        double q = rgb2q(r1, g1, b1) - rgb2q(r2, g2, b2);
        double delta = 0.5053 * y * y + 0.299 * i * i + 0.1957 * q * q;
        return y1 > y2 ? -delta : delta;
    }

    private static int grayPixel(int pixel) {
        double a = alpha(pixel) / 255.0;
        double luma = rgb2y(blend(red(pixel), a), blend(green(pixel), a), blend(blue(pixel), a));
        int v = (int) Math.round(blend(luma, OVERLAY_ALPHA));
        v = Math.max(0, Math.min(255, v));
        return 0xFF000000 | (v << 16) | (v << 8) | v;
    }

    /** Composites a channel over white. */
    private static double blend(double c, double a) {
        return 255 + (c - 255) * a;
    }

    private static double rgb2y(double r, double g, double b) {
        return r * 0.29889531 + g * 0.58662247 + b * 0.11448223;
    }

    private static double rgb2i(double r, double g, double b) {
        return r * 0.59597799 - g * 0.27417610 - b * 0.32180189;
    }

    private static double rgb2q(double r, double g, double b) {
        return r * 0.21147017 - g * 0.52261711 + b * 0.31114694;
    }

    private static int alpha(int p) {
        return (p >>> 24) & 0xFF;
    }

    private static int red(int p) {
        return (p >> 16) & 0xFF;
    }

    private static int green(int p) {
        return (p >> 8) & 0xFF;
    }

    private static int blue(int p) {
        return p & 0xFF;
    }
}
