package net.lookvault.controller.support;

import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Consistent {@code {error, message, ...}} payloads across controllers.
 */
public final class ErrorResponseUtils {

    private ErrorResponseUtils() {
        // Utility class
    }

    public static Map<String, Object> errorBody(String error) {
        return errorBody(error, null, Map.of());
    }

    /**
     * @param error short machine-readable code
     * @param message human-readable detail; omitted when blank
     * @param extra additional fields appended after {@code error} and {@code message}
     */
    public static Map<String, Object> errorBody(String error, String message, Map<String, ?> extra) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        if (message != null && !message.isBlank()) {
            body.put("message", message);
        }
        extra.forEach((key, value) -> {
            if (value != null) {
                body.put(key, value);
            }
        });
        return body;
    }

    public static ResponseEntity<Object> error(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(errorBody(error, message, Map.of()));
    }

    public static ResponseEntity<Object> badRequest(String message) {
        return error(HttpStatus.BAD_REQUEST, "bad_request", message);
    }

    public static ResponseEntity<Object> internalServerError(String message) {
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", message);
    }

    public static ResponseEntity<Object> unprocessable(String error, Map<String, ?> extra) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_CONTENT).body(errorBody(error, null, extra));
    }
}
