package com.eyelevel.lotprocessor.dto.common;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;

/**
 * A standardized, generic wrapper for all API responses.
 * It provides a consistent structure for both successful and failed responses,
 * so clients can handle every endpoint the same way.
 **/
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {
    /**
     * A message to display to the user.
     */
    private final String displayMessage;

    /**
     * The response data, or error details for a failed request.
     */
    private final T response;

    /**
     * A flag indicating whether to show the display message.
     */
    private final Boolean showMessage;

    /**
     * The HTTP status code of the response.
     */
    private final Integer statusCode;

    /**
     * Builds a successful response carrying the given data.
     */
    public static <T> ApiResponse<T> success(T response, String displayMessage, int statusCode) {
        return ApiResponse.<T>builder()
                          .response(response)
                          .displayMessage(displayMessage)
                          .showMessage(true)
                          .statusCode(statusCode)
                          .build();
    }

    public static <T> ApiResponse<T> error(String displayMessage) {
        return ApiResponse.<T>builder().displayMessage(displayMessage).showMessage(true).build();
    }

    /**
     * Builds an error response with a user-facing message and technical details in the response body.
     */
    public static ApiResponse<Object> error(String displayMessage, String details) {
        return ApiResponse.<Object>builder()
                          .displayMessage(displayMessage)
                          .response(details)
                          .showMessage(true)
                          .build();
    }
}
