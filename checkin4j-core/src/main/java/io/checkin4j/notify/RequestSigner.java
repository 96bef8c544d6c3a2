package io.checkin4j.notify;

import io.checkin4j.core.NotificationException;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;

/**
 * Chat-bot webhook signature: {@code base64(HMAC-SHA256(key = secret, data = timestamp + "\n" + secret))}.
 */
public final class RequestSigner {
    private RequestSigner() {
    }

    private static final String HMAC_ALGORITHM = "HmacSHA256";

    public static String sign(String timestamp, String secret) {
        String stringToSign = timestamp + "\n" + secret;
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            byte[] digest = mac.doFinal(stringToSign.getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(digest);
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new NotificationException("Failed to compute webhook signature", e);
        }
    }
}
