package com.contentdesk.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.io.DecodingException;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * 액세스 토큰 HS256 서명 키. {@code jwt.secret}이 Base64이면 디코딩한 바이트를, 아니면 UTF-8 바이트를
 * 사용하며 어느 쪽이든 256비트 미만이면 기동을 중단한다.
 */
@Component
public class JwtTokenProvider {

    public static final int MIN_KEY_BYTES = 32;

    private static final String HMAC_SHA_256 = "HmacSHA256";

    private final SecretKey secretKey;

    public JwtTokenProvider(@Value("${jwt.secret:}") String secret) {
        byte[] keyBytes = keyBytes(secret);
        if (keyBytes.length < MIN_KEY_BYTES) {
            throw new IllegalStateException("jwt.secret must provide at least " + MIN_KEY_BYTES + " key bytes");
        }
        this.secretKey = new SecretKeySpec(keyBytes, HMAC_SHA_256);
    }

    public SecretKey getSecretKey() {
        return secretKey;
    }

    private static byte[] keyBytes(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("jwt.secret is not configured");
        }
        String trimmed = secret.trim();
        try {
            return Decoders.BASE64.decode(trimmed);
        } catch (DecodingException ex) {
            return trimmed.getBytes(StandardCharsets.UTF_8);
        }
    }
}
