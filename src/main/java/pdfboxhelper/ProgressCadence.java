package pdfboxhelper;

/**
 * Adaptive progress reporting interval for page loops.
 *
 * <p>Small documents report every page; large ones roughly every 5%.
 * The first and last page always report.</p>
 */
public final class ProgressCadence {

    private final int totalPages;
    private final int block;

    public ProgressCadence(int totalPages) {
        this.totalPages = totalPages;
        this.block = blockSize(totalPages);
    }

    /**
     * Pages between two progress reports.
     */
    public static int blockSize(int totalPages) {
        if (totalPages <= 20)
            return 1;
        if (totalPages <= 100)
            return 3;
        if (totalPages <= 300)
            return 5;
        return Math.max(1, totalPages / 20);
    }

    /**
     * @param page 1-based page index
     */
    public boolean shouldReport(int page) {
        return page % block == 0 || page == 1 || page == totalPages;
    }

    /**
     * @param page 1-based page index
     * @return percent complete after {@code page}, 0..100
     */
    public int percent(int page) {
        if (totalPages <= 0)
            return 100;
        return (int) ((long) page * 100 / totalPages);
    }
}
