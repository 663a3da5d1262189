package com.storewatch.monitor.service;

import com.storewatch.monitor.client.CaptureException;
import io.micronaut.http.client.exceptions.ReadTimeoutException;
import jakarta.inject.Singleton;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Locale;

/**
 * Tells connectivity failures (the store cannot be reached at all) apart from every
 * other capture failure.  Only the former count towards deactivating a store.
 *
 * The render service reports navigation errors as text (Chromium {@code net::ERR_*}
 * codes, Node {@code getaddrinfo}/{@code ECONNREFUSED}), so messages anywhere in the
 * cause chain are matched as well as exception types.  A capture that failed because
 * the render service was unreachable is never a connectivity failure of the store.
 */
@Singleton
public class ConnectivityFailureClassifier {

    static final List<String> CONNECTIVITY_MARKERS = List.of(
            "err_name_not_resolved",
            "getaddrinfo",
            "econnrefused",
            "timeout",
            "timed out",
            "enotfound",
            "err_connection_refused",
            "err_connection_timed_out",
            "unknownhost",
            "connection refused");

    public boolean isConnectivityFailure(Throwable error) {
        if (error instanceof CaptureException && ((CaptureException) error).isRenderServiceUnavailable()) {
            return false;
        }
        Throwable current = error;
        int depth = 0;
        while (current != null && depth < 16) {
            if (isConnectivityType(current) || hasConnectivityMarker(current.getMessage())) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
            depth++;
        }
        return false;
    }

    private static boolean isConnectivityType(Throwable t) {
        return t instanceof UnknownHostException
                || t instanceof ConnectException
                || t instanceof SocketTimeoutException
                || t instanceof NoRouteToHostException
                || t instanceof ReadTimeoutException;
    }

    private static boolean hasConnectivityMarker(String message) {
        if (message == null || message.isEmpty()) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        for (String marker : CONNECTIVITY_MARKERS) {
            if (lower.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
