package com.marketbot.data.http;

/**
 * Raised when a caller treats a failed fetch as fatal.
 */
public class FetchException extends Exception {
    private final String url;
    private final String category;
    private final int statusCode;

    public FetchException(FetchResult result) {
        super("fetch failed: url=" + result.url + ", category=" + result.errorCategory + ", error=" + result.error);
        this.url = result.url;
        this.category = result.errorCategory;
        this.statusCode = result.statusCode;
    }

    public String url() {
        return url;
    }

    public String category() {
        return category;
    }

    public int statusCode() {
        return statusCode;
    }
}
