package com.newsboard.collectors.page;

public record NavigationResult(
        Status status,
        int httpStatus,
        String finalUrl,
        String pageTitle,
        String error
) {
    public enum Status {
        OK,
        TIMEOUT,
        FAILED
    }

    public static NavigationResult ok(int httpStatus, String finalUrl, String pageTitle) {
        return new NavigationResult(Status.OK, httpStatus, finalUrl, pageTitle, null);
    }

    public static NavigationResult timeout(String url, String error) {
        return new NavigationResult(Status.TIMEOUT, 0, url, null, error);
    }

    public static NavigationResult failed(String url, int httpStatus, String error) {
        return new NavigationResult(Status.FAILED, httpStatus, url, null, error);
    }
}
