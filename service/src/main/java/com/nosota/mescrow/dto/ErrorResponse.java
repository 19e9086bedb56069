package com.nosota.mescrow.dto;

import java.time.LocalDateTime;

/**
 * Body of every error response.
 *
 * @param timestamp When the error was produced
 * @param status    HTTP status code
 * @param error     Short error title
 * @param message   Reason reported by the failing operation
 * @param path      Request URI
 */
public record ErrorResponse(
        LocalDateTime timestamp,
        int status,
        String error,
        String message,
        String path
) {

    public static ErrorResponse of(int status, String error, String message, String path) {
        return new ErrorResponse(LocalDateTime.now(), status, error, message, path);
    }
}
