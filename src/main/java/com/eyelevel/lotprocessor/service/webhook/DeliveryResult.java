package com.eyelevel.lotprocessor.service.webhook;

/**
 * Outcome of one HTTP delivery attempt.
 *
 * @param success        {@code true} for a 2xx answer.
 * @param responseStatus The HTTP status, {@code null} when the request never got an answer.
 * @param responseBody   The response body, if any.
 * @param errorMessage   Why the attempt failed, {@code null} on success.
 */
public record DeliveryResult(boolean success, Integer responseStatus, String responseBody, String errorMessage) {

    public static DeliveryResult delivered(int status, String body) {
        return new DeliveryResult(true, status, body, null);
    }

    public static DeliveryResult failed(Integer status, String body, String errorMessage) {
        return new DeliveryResult(false, status, body, errorMessage);
    }
}
