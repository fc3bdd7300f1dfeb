package org.dynamis.exprtree.reduce;

/**
 * Supplies names for temporaries introduced by a reduction. One allocator serves one reduction
 * and never returns the same name twice.
 */
@FunctionalInterface
public interface TempNameAllocator {

    /**
     * @param role what the temporary holds, such as {@code "receiver"} or {@code "value"}
     */
    String allocate(String role);
}
