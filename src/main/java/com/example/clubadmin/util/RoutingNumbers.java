package com.example.clubadmin.util;

/**
 * US ABA routing number checks.
 */
public final class RoutingNumbers {

    private static final int[] WEIGHTS = {3, 7, 1, 3, 7, 1, 3, 7, 1};

    private RoutingNumbers() {
    }

    public static boolean hasNineDigits(String value) {
        return value != null && value.matches("\\d{9}");
    }

    /** Weighted digit sum (3,7,1 repeating) must be divisible by 10. */
    public static boolean isValidChecksum(String value) {
        if (!hasNineDigits(value)) {
            return false;
        }
        int sum = 0;
        for (int i = 0; i < 9; i++) {
            sum += (value.charAt(i) - '0') * WEIGHTS[i];
        }
        return sum % 10 == 0;
    }
}
