package dev.summarycache.api;

/**
 * Envelope returned by the remote API. {@code success=false} is treated exactly like a transport error.
 *
 * @param success whether the call succeeded
 * @param data    the payload, null on failure
 * @param error   failure description, null on success
 */
public record ApiResponse<T>(boolean success, T data, String error) {

    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, data, null);
    }

    public static <T> ApiResponse<T> failure(String error) {
        return new ApiResponse<>(false, null, error);
    }
}
