package com.docaudit.core.model;

/**
 * Front-matter status counts across the corpus.
 *
 * @param complete documents with every required field
 * @param incomplete documents with a block missing required fields
 * @param absent documents without a block
 */
public record FrontmatterCoverage(int complete, int incomplete, int absent) {
    public FrontmatterCoverage {
        if (complete < 0 || incomplete < 0 || absent < 0) {
            throw new IllegalArgumentException("counts must be >= 0");
        }
    }

    public int total() {
        return complete + incomplete + absent;
    }

    /**
     * Documents counted as front-matter issues.
     *
     * @return absent plus incomplete
     */
    public int issues() {
        return incomplete + absent;
    }

    public int completePercentage() {
        return total() == 0 ? 0 : complete * 100 / total();
    }
}
