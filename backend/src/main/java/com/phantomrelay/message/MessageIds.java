package com.phantomrelay.message;

import java.security.SecureRandom;
import java.util.HexFormat;

/** 128-bit random message ids, hex encoded. */
public class MessageIds {

    private static final int ID_BYTES = 16;

    private final SecureRandom random = new SecureRandom();

    public String next() {
        byte[] bytes = new byte[ID_BYTES];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}
