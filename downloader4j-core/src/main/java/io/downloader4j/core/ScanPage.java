package io.downloader4j.core;

import java.util.List;

/**
 * One page of a key scan.
 *
 * keys   : job-record keys found in this page (may be empty)
 * cursor : cursor for the next call; {@code JobStore.SCAN_START} when the scan is complete
 */
public record ScanPage(
        List<String> keys,
        String cursor
) {
    public ScanPage {
        keys = List.copyOf(keys);
    }
}
