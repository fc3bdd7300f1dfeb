package org.dynamis.exprtree.benchmark.domain;

/** Currency amount with user-defined {@code +} and {@code <}. */
public final class Credits {

    private final long amount;

    public Credits(long amount) {
        this.amount = amount;
    }

    public static Credits add(Credits left, Credits right) {
        return new Credits(left.amount + right.amount);
    }

    public static boolean lessThan(Credits left, Credits right) {
        return left.amount < right.amount;
    }

    public long getAmount() {
        return amount;
    }
}
