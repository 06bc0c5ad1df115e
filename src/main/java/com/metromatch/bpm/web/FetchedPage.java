package com.metromatch.bpm.web;

/**
 * Raw result of fetching one page: final URL, HTTP status and body.
 */
public record FetchedPage(String url, int statusCode, String body) {

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }
}
