package com.company.anomaly.source;

/**
 * Message normalization and fingerprinting, supplied by the deployment
 */
public interface FingerprintExtractor {

    Fingerprint fingerprint(String message);
}
