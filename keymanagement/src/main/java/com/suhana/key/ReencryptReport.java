package com.suhana.key;

/**
 * Outcome of a bulk re-encryption pass: how many matching files were found and how many
 * of them now carry a token under the current primary key.
 */
public class ReencryptReport {
    private static final ReencryptReport EMPTY = new ReencryptReport(0, 0, 0L);

    public final int successCount;
    public final int totalCount;
    public final long timeMs;

    public ReencryptReport(int successCount, int totalCount, long timeMs) {
        if (successCount < 0 || totalCount < 0) throw new IllegalArgumentException("counts must be >= 0");
        if (successCount > totalCount) throw new IllegalArgumentException("success > total");
        if (timeMs < 0) throw new IllegalArgumentException("timeMs must be >= 0");
        this.successCount = successCount;
        this.totalCount = totalCount;
        this.timeMs = timeMs;
    }

    public static ReencryptReport empty() {
        return EMPTY;
    }

    public int failedCount() {
        return totalCount - successCount;
    }

    public ReencryptReport plus(ReencryptReport other) {
        return new ReencryptReport(successCount + other.successCount,
                totalCount + other.totalCount,
                timeMs + other.timeMs);
    }

    @Override
    public String toString() {
        return successCount + "/" + totalCount + " files re-encrypted in " + timeMs + " ms";
    }
}
