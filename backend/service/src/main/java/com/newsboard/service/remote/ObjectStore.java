package com.newsboard.service.remote;

import java.time.Duration;
import java.util.List;

public interface ObjectStore {
    void upload(String path, byte[] bytes, String contentType);

    List<StoredObject> list(String prefix);

    String signedUrl(String path, Duration ttl);

    void delete(List<String> paths);
}
