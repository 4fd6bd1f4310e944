package com.newsboard.service.http;

import com.newsboard.service.http.HttpClientFactory.TrustStoreSettings;
import org.junit.jupiter.api.Test;

import java.io.OutputStream;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyStore;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpClientFactoryTest {
    @Test
    void plainClientFollowsRedirectsWithTheGivenTimeout() {
        HttpClient client = HttpClientFactory.create(Duration.ofSeconds(3), Optional.empty());

        assertEquals(HttpClient.Redirect.NORMAL, client.followRedirects());
        assertEquals(Duration.ofSeconds(3), client.connectTimeout().orElseThrow());
    }

    @Test
    void noTrustStoreWithoutAPath() {
        assertTrue(TrustStoreSettings.fromEnvironment(Map.of()).isEmpty());
        assertTrue(TrustStoreSettings.fromEnvironment(Map.of("TRUSTSTORE_PATH", " ")).isEmpty());
    }

    @Test
    void pathWithoutPasswordIsRejected() {
        IllegalStateException ex = assertThrows(
                IllegalStateException.class,
                () -> TrustStoreSettings.fromEnvironment(Map.of("TRUSTSTORE_PATH", "/etc/newsboard/ca.jks"))
        );
        assertTrue(ex.getMessage().contains("TRUSTSTORE_PASSWORD"));
    }

    @Test
    void typeComesFromTheFileNameUnlessOverridden() {
        TrustStoreSettings guessed = TrustStoreSettings.fromEnvironment(Map.of(
                "TRUSTSTORE_PATH", "/etc/newsboard/Proxy.PFX",
                "TRUSTSTORE_PASSWORD", "secret"
        )).orElseThrow();
        TrustStoreSettings overridden = TrustStoreSettings.fromEnvironment(Map.of(
                "TRUSTSTORE_PATH", "/etc/newsboard/cacerts",
                "TRUSTSTORE_PASSWORD", "secret",
                "TRUSTSTORE_TYPE", "PKCS12"
        )).orElseThrow();

        assertEquals("PKCS12", guessed.type());
        assertEquals("PKCS12", overridden.type());
        assertEquals("JKS", TrustStoreSettings.typeFor(Path.of("cacerts")));
    }

    @Test
    void missingTrustStoreFileNamesThePath() {
        Path missing = Path.of("/tmp/newsboard-no-such-store.jks");
        IllegalStateException ex = assertThrows(
                IllegalStateException.class,
                () -> HttpClientFactory.sslContext(new TrustStoreSettings(missing, "secret", "JKS"))
        );
        assertTrue(ex.getMessage().contains(missing.toString()));
    }

    @Test
    void loadsAnEmptyPkcs12Store() throws Exception {
        Path store = Files.createTempFile("newsboard-ca-", ".p12");
        writeEmptyStore(store, "PKCS12", "secret");
        TrustStoreSettings settings = new TrustStoreSettings(store, "secret", "PKCS12");

        HttpClient client = HttpClientFactory.create(Duration.ofSeconds(1), Optional.of(settings));

        assertEquals("TLS", client.sslContext().getProtocol());
    }

    @Test
    void wrongPasswordIsAConfigurationError() throws Exception {
        Path store = Files.createTempFile("newsboard-ca-", ".jks");
        writeEmptyStore(store, "JKS", "right");

        IllegalStateException ex = assertThrows(
                IllegalStateException.class,
                () -> HttpClientFactory.sslContext(new TrustStoreSettings(store, "wrong", "JKS"))
        );
        assertTrue(ex.getMessage().contains(store.toString()));
        assertSame(IllegalStateException.class, ex.getClass());
    }

    private static void writeEmptyStore(Path path, String type, String password) throws Exception {
        KeyStore keyStore = KeyStore.getInstance(type);
        keyStore.load(null, password.toCharArray());
        try (OutputStream out = Files.newOutputStream(path)) {
            keyStore.store(out, password.toCharArray());
        }
    }
}
