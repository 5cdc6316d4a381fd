package jobhub.backend.storage;

import jobhub.backend.error.BackendConfigException;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.net.MalformedURLException;
import java.net.URI;
import java.net.URL;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;

/**
 * Issues and verifies time-bounded URLs for object keys.
 * URL shape: {@code <baseUrl>/<key>?mode=GET&expires=<epochSeconds>&signature=<hmac>}.
 */
public final class UrlSigner {

    private static final String ALGORITHM = "HmacSHA256";

    private final String baseUrl;
    private final byte[] signingKey;
    private final Duration ttl;
    private final Clock clock;

    public UrlSigner(String baseUrl, byte[] signingKey, Duration ttl) {
        this(baseUrl, signingKey, ttl, Clock.systemUTC());
    }

    public UrlSigner(String baseUrl, byte[] signingKey, Duration ttl, Clock clock) {
        if (signingKey == null || signingKey.length == 0) {
            throw BackendConfigException.missing("STORAGE.signing_key");
        }
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.signingKey = signingKey.clone();
        this.ttl = ttl;
        this.clock = clock;
    }

    public URL sign(String key, SignedUrlMode mode) {
        long expires = clock.instant().plus(ttl).getEpochSecond();
        String signature = signature(key, mode, expires);
        String url = baseUrl + "/" + encodePath(key)
                + "?mode=" + mode.name()
                + "&expires=" + expires
                + "&signature=" + signature;
        try {
            return URI.create(url).toURL();
        } catch (MalformedURLException e) {
            throw new IllegalArgumentException("Cannot build signed URL for " + key, e);
        }
    }

    /**
     * Check a URL issued by {@link #sign}: signature matches, mode matches and not expired.
     */
    public boolean verify(URL url, SignedUrlMode mode) {
        String path = url.getPath();
        String basePath = URI.create(baseUrl).getPath();
        if (!path.startsWith(basePath + "/")) {
            return false;
        }
        String key = URLDecoder.decode(path.substring(basePath.length() + 1), StandardCharsets.UTF_8);
        Map<String, String> query = parseQuery(url.getQuery());
        if (!mode.name().equals(query.get("mode")) || query.get("expires") == null || query.get("signature") == null) {
            return false;
        }
        long expires;
        try {
            expires = Long.parseLong(query.get("expires"));
        } catch (NumberFormatException e) {
            return false;
        }
        if (Instant.ofEpochSecond(expires).isBefore(clock.instant())) {
            return false;
        }
        byte[] expected = signature(key, mode, expires).getBytes(StandardCharsets.US_ASCII);
        byte[] actual = query.get("signature").getBytes(StandardCharsets.US_ASCII);
        return java.security.MessageDigest.isEqual(expected, actual);
    }

    private String signature(String key, SignedUrlMode mode, long expires) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(signingKey, ALGORITHM));
            byte[] digest = mac.doFinal((mode.name() + "\n" + key + "\n" + expires).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC unavailable", e);
        }
    }

    private static String encodePath(String key) {
        List<String> segments = List.of(key.split("/", -1));
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < segments.size(); i++) {
            if (i > 0) {
                sb.append('/');
            }
            sb.append(URLEncoder.encode(segments.get(i), StandardCharsets.UTF_8).replace("+", "%20"));
        }
        return sb.toString();
    }

    private static Map<String, String> parseQuery(String query) {
        Map<String, String> params = new HashMap<>();
        if (query == null) {
            return params;
        }
        for (String pair : query.split("&")) {
            int idx = pair.indexOf('=');
            if (idx > 0) {
                params.put(pair.substring(0, idx), URLDecoder.decode(pair.substring(idx + 1), StandardCharsets.UTF_8));
            }
        }
        return params;
    }
}
