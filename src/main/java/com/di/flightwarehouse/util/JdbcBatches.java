package com.di.flightwarehouse.util;

/**
 * Helpers for interpreting {@code JdbcTemplate.batchUpdate} results.
 */
public final class JdbcBatches {

    private JdbcBatches() {
    }

    /**
     * Rows affected across all batches. With {@code ON CONFLICT DO NOTHING} this is the number of
     * new rows. Drivers may report {@code SUCCESS_NO_INFO} (-2), which is not counted.
     */
    public static int affectedRows(int[][] counts) {
        int total = 0;
        for (int[] batch : counts) {
            for (int c : batch) {
                if (c > 0) {
                    total += c;
                }
            }
        }
        return total;
    }
}
