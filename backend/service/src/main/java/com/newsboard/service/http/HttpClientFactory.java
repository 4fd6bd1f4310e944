package com.newsboard.service.http;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;
import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public final class HttpClientFactory {
    private HttpClientFactory() {
    }

    public static HttpClient create(Duration connectTimeout) {
        return create(connectTimeout, TrustStoreSettings.fromEnvironment(System.getenv()));
    }

    static HttpClient create(Duration connectTimeout, Optional<TrustStoreSettings> trustStore) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL);
        trustStore.map(HttpClientFactory::sslContext).ifPresent(builder::sslContext);
        return builder.build();
    }

    static SSLContext sslContext(TrustStoreSettings settings) {
        if (!Files.isRegularFile(settings.path())) {
            throw new IllegalStateException("Trust store not found at " + settings.path());
        }
        try (InputStream in = Files.newInputStream(settings.path())) {
            KeyStore keyStore = KeyStore.getInstance(settings.type());
            keyStore.load(in, settings.password().toCharArray());
            TrustManagerFactory trustManagers = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            trustManagers.init(keyStore);
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, trustManagers.getTrustManagers(), null);
            return context;
        } catch (IOException | GeneralSecurityException e) {
            throw new IllegalStateException("Unable to load " + settings.type() + " trust store " + settings.path(), e);
        }
    }

    public record TrustStoreSettings(Path path, String password, String type) {
        static Optional<TrustStoreSettings> fromEnvironment(Map<String, String> environment) {
            String rawPath = environment.getOrDefault("TRUSTSTORE_PATH", "");
            if (rawPath.isBlank()) {
                return Optional.empty();
            }
            String password = environment.get("TRUSTSTORE_PASSWORD");
            if (password == null) {
                throw new IllegalStateException("TRUSTSTORE_PATH is set but TRUSTSTORE_PASSWORD is missing");
            }
            Path path = Path.of(rawPath);
            String type = environment.getOrDefault("TRUSTSTORE_TYPE", "");
            return Optional.of(new TrustStoreSettings(path, password, type.isBlank() ? typeFor(path) : type));
        }

        static String typeFor(Path path) {
            String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
            return name.endsWith(".p12") || name.endsWith(".pfx") ? "PKCS12" : "JKS";
        }
    }
}
