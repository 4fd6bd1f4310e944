package com.newsboard.service.remote;

public class StoreException extends RuntimeException {
    private final int status;
    private final String code;
    private final String details;
    private final String hint;

    public StoreException(int status, String code, String details, String hint, String message) {
        super(message);
        this.status = status;
        this.code = code;
        this.details = details;
        this.hint = hint;
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
        this.status = 0;
        this.code = null;
        this.details = null;
        this.hint = null;
    }

    public int status() {
        return status;
    }

    public String code() {
        return code;
    }

    public String details() {
        return details;
    }

    public String hint() {
        return hint;
    }
}
