package com.example.reelbot_backend.service;

import com.example.reelbot_backend.config.ProviderProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Checks the HMAC-SHA256 signature of a raw webhook body. Without a configured secret every
 * signature is rejected.
 */
@Service
public class WebhookSignatureVerifier {
    private static final Logger LOGGER = LoggerFactory.getLogger(WebhookSignatureVerifier.class);
    private static final String ALGORITHM = "HmacSHA256";
    private static final String PREFIX = "sha256=";

    private final ProviderProperties props;

    public WebhookSignatureVerifier(ProviderProperties props) {
        this.props = props;
    }

    public boolean verify(byte[] rawBody, String signatureHeader) {
        String secret = props.getWebhook().getSecret();
        if (secret == null || secret.isBlank()) {
            LOGGER.warn("WEBHOOK REJECT reason=no-secret-configured");
            return false;
        }
        if (signatureHeader == null || signatureHeader.isBlank()) {
            return false;
        }
        String hex = signatureHeader.trim();
        if (hex.toLowerCase(Locale.ROOT).startsWith(PREFIX)) {
            hex = hex.substring(PREFIX.length());
        }
        byte[] provided;
        try {
            provided = HexFormat.of().parseHex(hex);
        } catch (IllegalArgumentException e) {
            LOGGER.debug("WEBHOOK REJECT reason=signature-not-hex");
            return false;
        }
        return MessageDigest.isEqual(provided, sign(rawBody == null ? new byte[0] : rawBody, secret));
    }

    /**
     * Hex encoded HMAC-SHA256 of {@code body}.
     */
    public String signHex(byte[] body, String secret) {
        return HexFormat.of().formatHex(sign(body, secret));
    }

    private static byte[] sign(byte[] body, String secret) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return mac.doFinal(body);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }
}
