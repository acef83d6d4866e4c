package com.company.anomaly.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorClassifierTest {

    private final ErrorClassifier classifier = new ErrorClassifier();

    @Test
    void knownPatternsMapToStableClasses() {
        assertThat(classifier.classify("java.net.SocketTimeoutException", "Read timed out")).isEqualTo("timeout");
        assertThat(classifier.classify(null, "Connection refused by 10.0.0.4")).isEqualTo("connection_error");
        assertThat(classifier.classify("PSQLException", "duplicate key")).isEqualTo("database_error");
        assertThat(classifier.classify("HttpClientErrorException", "404 Not Found")).isEqualTo("not_found");
    }

    @Test
    void unknownTypesFallBackToSnakeCase() {
        assertThat(classifier.classify("PaymentDeclinedError", "card declined")).isEqualTo("payment_declined_error");
    }

    @Test
    void nothingUsableIsUnclassified() {
        assertThat(classifier.classify(null, null)).isEqualTo(ErrorClassifier.UNCLASSIFIED);
        assertThat(classifier.classify("UnknownError", "something odd")).isEqualTo(ErrorClassifier.UNCLASSIFIED);
    }
}
