package com.tradinggrok.api;

/**
 * Non-2xx answer from the Alpaca REST API. The broker was reached and responded.
 */
public class AlpacaApiException extends RuntimeException {
    private final int statusCode;
    private final String responseBody;

    public AlpacaApiException(int statusCode, String responseBody) {
        super(String.format("API Request failed: %d - %s", statusCode, responseBody));
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }

    public boolean isRateLimited() {
        return statusCode == 429;
    }

    public boolean isServerError() {
        return statusCode >= 500;
    }

    /** 429 and 5xx may succeed on a later attempt; other 4xx will not. */
    public boolean isTransient() {
        return isRateLimited() || isServerError();
    }
}
