package com.storewatch.monitor.client;

/**
 * Lightweight existence check against a URL.
 */
public interface ProbeClient {

    /**
     * Issues the probe, bounded by the implementation's configured timeout.  Never
     * throws: transport failures are reported through {@link ProbeResult#error()}.
     *
     * @param url absolute URL
     * @return the result
     */
    ProbeResult probe(String url);
}
