package com.company.anomaly.service;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Maps an error type and message to a coarse, stable error class used as problem signature
 */
@Component
public class ErrorClassifier {

    public static final String UNCLASSIFIED = "unclassified";

    private static final String UNKNOWN_ERROR_TYPE = "UnknownError";

    // first match wins
    private static final Map<Pattern, String> ERROR_CLASS_PATTERNS = new LinkedHashMap<>();

    static {
        register("ServiceBusinessException", "business_exception");
        register("ValidationException", "validation_error");
        register("ConstraintViolationException", "constraint_violation");
        register("AccessDeniedException", "access_denied");
        register("AuthenticationException", "authentication_error");
        register("TimeoutException|timed out", "timeout");
        register("ConnectException|ConnectionException|Connection refused", "connection_error");
        register("SQLException|DataAccessException", "database_error");
        register("OutOfMemoryError", "memory_error");
        register("NullPointerException", "null_pointer");
        register("IllegalArgumentException", "invalid_argument");
        register("IOException", "io_error");
        register("ResourceNotFoundException|not found|\\b404\\b", "not_found");
        register("\\b401\\b|Unauthorized", "unauthorized");
        register("\\b403\\b|Forbidden", "forbidden");
        register("\\b500\\b", "internal_error");
        register("\\b50[234]\\b", "gateway_error");
    }

    private static final Pattern CAMEL_WORD = Pattern.compile("(.)([A-Z][a-z]+)");
    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("([a-z0-9])([A-Z])");
    private static final Pattern NON_TOKEN = Pattern.compile("[^a-z0-9_]+");

    private static void register(String regex, String errorClass) {
        ERROR_CLASS_PATTERNS.put(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), errorClass);
    }

    public String classify(String errorType, String message) {
        String combined = (errorType != null ? errorType : "") + " " + (message != null ? message : "");

        for (Map.Entry<Pattern, String> entry : ERROR_CLASS_PATTERNS.entrySet()) {
            if (entry.getKey().matcher(combined).find()) {
                return entry.getValue();
            }
        }

        if (errorType != null && !errorType.isBlank() && !UNKNOWN_ERROR_TYPE.equals(errorType)) {
            String snake = CAMEL_WORD.matcher(errorType.trim()).replaceAll("$1_$2");
            snake = CAMEL_BOUNDARY.matcher(snake).replaceAll("$1_$2").toLowerCase();
            snake = NON_TOKEN.matcher(snake).replaceAll("_");
            if (!snake.isBlank() && !snake.equals("_")) {
                return snake;
            }
        }
        return UNCLASSIFIED;
    }
}
