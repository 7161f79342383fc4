package com.multila.backend.global.common;

import java.security.SecureRandom;
import java.util.HexFormat;

import org.springframework.stereotype.Component;

/**
 * Random hex strings for bearer tokens and public user codes.
 */
@Component
public class SecureCodeGenerator {

    public static final int DEFAULT_BYTES = 32;

    private final SecureRandom random = new SecureRandom();

    public String nextHex() {
        return nextHex(DEFAULT_BYTES);
    }

    public String nextHex(int bytes) {
        byte[] buffer = new byte[bytes];
        random.nextBytes(buffer);
        return HexFormat.of().formatHex(buffer);
    }
}
