package com.flagship.group_ledger.ledger;

import com.flagship.group_ledger.error.LedgerCorruptionException;

/**
 * Signed balances stored in an unsigned 64-bit word.
 *
 * Encoding (unsigned view of the word):
 * <ul>
 *   <li>{@code 0 .. 2^63-1}: non-negative balance, stored as-is</li>
 *   <li>{@code 2^63 .. 2^64-1}: negative balance with magnitude {@code word - 2^63}</li>
 * </ul>
 * Zero is always stored as {@code 0}, never as {@code 2^63}.
 *
 * Both magnitudes must stay below {@link #MAX_MAGNITUDE} (2^62). Anything at
 * or above it, in either half, is treated as corruption.
 *
 * Example: +100 is stored as 100. Debit 150 flips it to -50, stored as
 * 2^63 + 50. Credit 200 flips it back to +150, stored as 150.
 */
public final class EncodedBalance {

    /** 2^63 in the unsigned view. */
    public static final long SIGN_OFFSET = Long.MIN_VALUE;

    /** Overflow ceiling for magnitudes: 2^62, a quarter of the word's range. */
    public static final long MAX_MAGNITUDE = 1L << 62;

    private EncodedBalance() {
    }

    public static long encode(long balance) {
        if (balance == Long.MIN_VALUE) {
            throw new LedgerCorruptionException("Balance magnitude exceeds overflow ceiling: " + balance);
        }
        long magnitude = Math.abs(balance);
        checkMagnitude(magnitude, "encode");
        return balance < 0 ? SIGN_OFFSET | magnitude : magnitude;
    }

    public static long decode(long word) {
        long magnitude = magnitude(word);
        return isNegative(word) ? -magnitude : magnitude;
    }

    public static boolean isNegative(long word) {
        return Long.compareUnsigned(word, SIGN_OFFSET) >= 0;
    }

    /**
     * @throws LedgerCorruptionException if the word holds a magnitude at or above the ceiling
     */
    public static long magnitude(long word) {
        long magnitude = word & Long.MAX_VALUE;
        checkMagnitude(magnitude, "decode");
        if (magnitude == 0 && word != 0) {
            throw new LedgerCorruptionException("Negative zero in encoded balance");
        }
        return magnitude;
    }

    /**
     * Adds {@code amount} to the encoded balance, flipping a negative balance
     * to non-negative when the credit covers the debt.
     */
    public static long credit(long word, long amount) {
        checkDelta(amount);
        long magnitude = magnitude(word);
        if (isNegative(word)) {
            if (amount >= magnitude) {
                long result = amount - magnitude;
                checkMagnitude(result, "credit");
                return result;
            }
            return SIGN_OFFSET | (magnitude - amount);
        }
        long result = magnitude + amount;
        checkMagnitude(result, "credit");
        return result;
    }

    /**
     * Subtracts {@code amount} from the encoded balance, flipping a
     * non-negative balance to negative when the debit exceeds it.
     */
    public static long debit(long word, long amount) {
        checkDelta(amount);
        long magnitude = magnitude(word);
        if (isNegative(word)) {
            long result = magnitude + amount;
            checkMagnitude(result, "debit");
            return SIGN_OFFSET | result;
        }
        if (amount > magnitude) {
            long result = amount - magnitude;
            checkMagnitude(result, "debit");
            return SIGN_OFFSET | result;
        }
        return magnitude - amount;
    }

    /**
     * Applies a signed delta to a signed balance under the same ceiling as the
     * encoded form, so both store representations reject the same values.
     */
    public static long addSigned(long balance, long delta) {
        if (delta == Long.MIN_VALUE) {
            throw new LedgerCorruptionException("Delta exceeds overflow ceiling: " + delta);
        }
        long word = encode(balance);
        return decode(delta >= 0 ? credit(word, delta) : debit(word, -delta));
    }

    public static String toUnsignedString(long word) {
        return Long.toUnsignedString(word);
    }

    private static void checkDelta(long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Amount must not be negative: " + amount);
        }
        checkMagnitude(amount, "delta");
    }

    private static void checkMagnitude(long magnitude, String operation) {
        // magnitude is non-negative here: sums of two values below 2^62 cannot wrap
        if (magnitude >= MAX_MAGNITUDE) {
            throw new LedgerCorruptionException(
                String.format("Balance overflow on %s: magnitude %d reaches ceiling %d",
                    operation, magnitude, MAX_MAGNITUDE));
        }
    }
}
