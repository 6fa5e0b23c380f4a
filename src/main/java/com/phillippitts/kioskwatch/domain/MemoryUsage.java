package com.phillippitts.kioskwatch.domain;

/**
 * Memory counters parsed from {@code dumpsys meminfo}. Counters that were not present in
 * the dump are null.
 *
 * @param totalPssKb   total proportional set size in KB
 * @param nativeHeapKb native heap allocation in KB
 * @param dalvikHeapKb dalvik/ART heap allocation in KB
 */
public record MemoryUsage(Long totalPssKb, Long nativeHeapKb, Long dalvikHeapKb) {

    /** Total PSS, treating a missing counter as zero. */
    public long totalPssOrZero() {
        return totalPssKb == null ? 0L : totalPssKb;
    }

    public boolean isEmpty() {
        return totalPssKb == null && nativeHeapKb == null && dalvikHeapKb == null;
    }
}
