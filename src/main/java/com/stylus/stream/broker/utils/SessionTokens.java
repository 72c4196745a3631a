package com.stylus.stream.broker.utils;

import com.google.common.io.BaseEncoding;

import javax.annotation.Nonnull;
import java.security.SecureRandom;

public class SessionTokens {
    private static final int TOKEN_BYTES = 32;
    private static final SecureRandom RANDOM = new SecureRandom();

    @Nonnull
    public static String newToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        RANDOM.nextBytes(bytes);
        return BaseEncoding.base16().lowerCase().encode(bytes);
    }
}
