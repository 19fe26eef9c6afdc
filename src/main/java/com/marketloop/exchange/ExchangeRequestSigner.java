package com.marketloop.exchange;

import com.marketloop.config.ExchangeProperties;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.Base64;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

/**
 * Builds the authentication headers for exchange requests.
 *
 * <p>Signature: base64(HMAC-SHA256(secret, timestampMillis + METHOD + path)), where the
 * secret is the base64-decoded API secret and {@code path} excludes the query string.
 */
@Component
public class ExchangeRequestSigner {

    static final String HEADER_KEY = "KALSHI-ACCESS-KEY";
    static final String HEADER_TIMESTAMP = "KALSHI-ACCESS-TIMESTAMP";
    static final String HEADER_SIGNATURE = "KALSHI-ACCESS-SIGNATURE";

    private static final String ALGORITHM = "HmacSHA256";

    private final ExchangeProperties exchangeProperties;
    private final Clock clock;

    public ExchangeRequestSigner(ExchangeProperties exchangeProperties, Clock clock) {
        this.exchangeProperties = exchangeProperties;
        this.clock = clock;
    }

    public HttpHeaders signedHeaders(HttpMethod method, String path) {
        String timestamp = String.valueOf(clock.millis());
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(HEADER_KEY, nullToEmpty(exchangeProperties.getApiKey()));
        headers.set(HEADER_TIMESTAMP, timestamp);
        headers.set(HEADER_SIGNATURE, sign(timestamp, method.name(), path));
        return headers;
    }

    String sign(String timestamp, String method, String path) {
        String secret = exchangeProperties.getApiSecret();
        byte[] keyBytes = secret == null || secret.isBlank() ? new byte[0] : Base64.getDecoder().decode(secret.trim());
        String message = timestamp + method.toUpperCase() + path;
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            // SecretKeySpec rejects an empty key; one zero byte pads to the same HMAC key.
            mac.init(new SecretKeySpec(keyBytes.length == 0 ? new byte[1] : keyBytes, ALGORITHM));
            byte[] signature = mac.doFinal(message.getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(signature);
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("Unable to sign exchange request", e);
        }
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
