package com.transferengine.common;

import com.transferengine.common.exception.InvalidTransferException;

import java.util.UUID;

/**
 * Utility class for generating and validating idempotency keys.
 *
 * Keys are opaque client tokens. Any non-blank value up to {@link #MAX_LENGTH}
 * characters is accepted; UUIDs are what {@link #generate()} hands out.
 */
public final class IdempotencyKey {

    public static final int MAX_LENGTH = 100;

    private IdempotencyKey() {
    }

    public static String generate() {
        return UUID.randomUUID().toString();
    }

    public static boolean isValid(String key) {
        return key != null && !key.isBlank() && key.length() <= MAX_LENGTH;
    }

    public static void validate(String key) {
        if (!isValid(key)) {
            throw new InvalidTransferException("Invalid idempotency key: " + key);
        }
    }
}
