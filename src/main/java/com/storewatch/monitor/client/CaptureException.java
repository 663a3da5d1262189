package com.storewatch.monitor.client;

/**
 * Raised by a {@link RenderCaptureClient} when no screenshot could be produced.
 *
 * The message carries the render service's own error text (for example
 * {@code net::ERR_NAME_NOT_RESOLVED}) so that connectivity failures of the store can
 * be told apart from other render errors.  When the render service itself could not
 * be reached or did not answer, the exception is flagged with
 * {@link #isRenderServiceUnavailable()}; such a failure says nothing about the store.
 */
public class CaptureException extends Exception {

    private final boolean renderServiceUnavailable;

    public CaptureException(String message) {
        this(message, null, false);
    }

    public CaptureException(String message, Throwable cause) {
        this(message, cause, false);
    }

    private CaptureException(String message, Throwable cause, boolean renderServiceUnavailable) {
        super(message, cause);
        this.renderServiceUnavailable = renderServiceUnavailable;
    }

    /**
     * Transport failure between the worker and the render service.
     */
    public static CaptureException renderServiceUnavailable(String message, Throwable cause) {
        return new CaptureException(message, cause, true);
    }

    public boolean isRenderServiceUnavailable() {
        return renderServiceUnavailable;
    }
}
