package com.elssolution.motormonitor.web;

/** {@code {"status": "...", "message": "..."}} body used by the write endpoints and errors. */
public record ApiResponse(String status, String message) {

    public static ApiResponse success(String message) {
        return new ApiResponse("success", message);
    }

    public static ApiResponse error(String message) {
        return new ApiResponse("error", message);
    }
}
