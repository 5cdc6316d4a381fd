package jobhub.backend.storage;

import jobhub.backend.error.BackendConfigException;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class UrlSignerTest {

    private static final byte[] KEY = "signing-key".getBytes(StandardCharsets.UTF_8);
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private final UrlSigner signer = new UrlSigner("https://hub.example.com/objects/", KEY, Duration.ofMinutes(15),
            Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void signedUrlVerifies() {
        URL url = signer.sign("artifacts/repo/job-1/out/a.txt", SignedUrlMode.GET);

        assertEquals("/objects/artifacts/repo/job-1/out/a.txt", url.getPath());
        assertTrue(url.getQuery().contains("expires=" + NOW.plus(Duration.ofMinutes(15)).getEpochSecond()));
        assertTrue(signer.verify(url, SignedUrlMode.GET));
    }

    @Test
    void modeIsPartOfSignature() {
        URL url = signer.sign("k", SignedUrlMode.GET);
        assertFalse(signer.verify(url, SignedUrlMode.PUT));
    }

    @Test
    void tamperedKeyRejected() throws Exception {
        URL url = signer.sign("artifacts/repo/job-1/a.txt", SignedUrlMode.PUT);
        URL tampered = URI.create(url.toString().replace("job-1", "job-2")).toURL();

        assertFalse(signer.verify(tampered, SignedUrlMode.PUT));
    }

    @Test
    void expiredUrlRejected() {
        URL url = signer.sign("k", SignedUrlMode.GET);
        UrlSigner later = new UrlSigner("https://hub.example.com/objects", KEY, Duration.ofMinutes(15),
                Clock.fixed(NOW.plus(Duration.ofHours(1)), ZoneOffset.UTC));

        assertFalse(later.verify(url, SignedUrlMode.GET));
    }

    @Test
    void otherKeyRejected() {
        URL url = signer.sign("k", SignedUrlMode.GET);
        UrlSigner other = new UrlSigner("https://hub.example.com/objects", "other".getBytes(StandardCharsets.UTF_8),
                Duration.ofMinutes(15), Clock.fixed(NOW, ZoneOffset.UTC));

        assertFalse(other.verify(url, SignedUrlMode.GET));
    }

    @Test
    void emptyKeyIsConfigError() {
        BackendConfigException e = assertThrows(BackendConfigException.class,
                () -> new UrlSigner("http://x", new byte[0], Duration.ofMinutes(1)));
        assertTrue(e.fields().contains("STORAGE.signing_key"));
    }
}
