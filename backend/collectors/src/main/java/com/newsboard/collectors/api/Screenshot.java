package com.newsboard.collectors.api;

import java.util.Objects;

public record Screenshot(byte[] bytes, String contentType, String extension) {
    public static final String JPEG = "image/jpeg";

    public Screenshot {
        Objects.requireNonNull(bytes, "bytes is required");
        contentType = contentType == null ? JPEG : contentType;
        extension = extension == null ? "jpg" : extension;
    }

    public static Screenshot jpeg(byte[] bytes) {
        return new Screenshot(bytes, JPEG, "jpg");
    }
}
