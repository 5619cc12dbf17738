package com.marketbot.data.http;

/**
 * Outcome of a single GET. Either a body or a categorized failure, never both.
 */
public final class FetchResult {
    public static final String CATEGORY_TIMEOUT = "timeout";
    public static final String CATEGORY_HTTP_STATUS = "http_status";
    public static final String CATEGORY_NETWORK = "network";
    public static final String CATEGORY_INVALID_URL = "invalid_url";
    public static final String CATEGORY_INTERRUPTED = "interrupted";

    public final String url;
    public final String body;
    public final int statusCode;
    public final long elapsedMs;
    public final boolean success;
    public final String error;
    public final String errorCategory;

    private FetchResult(
            String url,
            String body,
            int statusCode,
            long elapsedMs,
            boolean success,
            String error,
            String errorCategory
    ) {
        this.url = url == null ? "" : url;
        this.body = body == null ? "" : body;
        this.statusCode = statusCode;
        this.elapsedMs = Math.max(0L, elapsedMs);
        this.success = success;
        this.error = error == null ? "" : error;
        this.errorCategory = errorCategory == null ? "" : errorCategory;
    }

    public static FetchResult success(String url, String body, int statusCode, long elapsedMs) {
        return new FetchResult(url, body, statusCode, elapsedMs, true, "", "");
    }

    public static FetchResult failed(String url, String error, String category, int statusCode, long elapsedMs) {
        return new FetchResult(url, "", statusCode, elapsedMs, false, error, category);
    }

    /**
     * Body of a successful fetch; a failed fetch is raised as {@link FetchException}.
     */
    public String requireBody() throws FetchException {
        if (!success) {
            throw new FetchException(this);
        }
        return body;
    }

    @Override
    public String toString() {
        if (success) {
            return "FetchResult{url=" + url + ", status=" + statusCode + ", bytes=" + body.length() + "}";
        }
        return "FetchResult{url=" + url + ", category=" + errorCategory + ", error=" + error + "}";
    }
}
