package org.dynamis.exprtree.reduce;

import java.util.Objects;

/**
 * Names temporaries {@code <prefix><role><n>} with {@code n} counting up from 0 across all roles.
 */
public final class SequentialTempNameAllocator implements TempNameAllocator {

    private final String prefix;
    private int next;

    public SequentialTempNameAllocator(String prefix) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
    }

    @Override
    public String allocate(String role) {
        return prefix + role + next++;
    }
}
