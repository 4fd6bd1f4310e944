package com.newsboard.service.remote;

import java.time.Instant;

public record StoredObject(String path, Instant createdAt) {
}
