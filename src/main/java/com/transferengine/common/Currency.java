package com.transferengine.common;

import java.util.Arrays;

/**
 * Currencies recognized by the transfer engine, with the number of minor-unit
 * digits every amount in that currency is kept at.
 */
public enum Currency {
    USD(2),
    EUR(2),
    GBP(2),
    PEN(2),
    JPY(0);

    private final int scale;

    Currency(int scale) {
        this.scale = scale;
    }

    public int getScale() {
        return scale;
    }

    public static Currency fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Currency code cannot be null");
        }
        return Arrays.stream(values())
            .filter(c -> c.name().equalsIgnoreCase(code.trim()))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unsupported currency: " + code));
    }
}
