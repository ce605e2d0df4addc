package com.topicmatch.backend.modules.trigger.infrastructure.solver;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Locale;

import javax.crypto.Mac;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Signs and checks solver callbacks: hex HMAC-SHA256 over the compact JSON of the payload with map keys
 * sorted, keyed by {@code app.solver.callback-hash-key}.
 */
@Component
public class CallbackSignatureVerifier {

    private static final String HMAC_SHA_256 = "HmacSHA256";

    private final SecretKey secretKey;
    private final ObjectMapper canonicalMapper;

    public CallbackSignatureVerifier(
            @Value("${app.solver.callback-hash-key}") String hashKey,
            ObjectMapper objectMapper
    ) {
        if (hashKey == null || hashKey.isBlank()) {
            throw new IllegalStateException("app.solver.callback-hash-key must be set");
        }
        this.secretKey = new SecretKeySpec(hashKey.getBytes(StandardCharsets.UTF_8), HMAC_SHA_256);
        this.canonicalMapper = objectMapper.copy()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .configure(SerializationFeature.INDENT_OUTPUT, false);
    }

    public String sign(Object payload) {
        try {
            byte[] canonical = payload instanceof String text
                    ? text.getBytes(StandardCharsets.UTF_8)
                    : canonicalMapper.writeValueAsBytes(payload);
            Mac mac = Mac.getInstance(HMAC_SHA_256);
            mac.init(secretKey);
            return HexFormat.of().formatHex(mac.doFinal(canonical));
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Callback payload cannot be serialized", ex);
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("HMAC-SHA256 is not available", ex);
        }
    }

    public boolean verify(Object payload, String hash) {
        if (hash == null || hash.isBlank()) {
            return false;
        }
        byte[] expected = sign(payload).getBytes(StandardCharsets.US_ASCII);
        byte[] actual = hash.trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(expected, actual);
    }
}
