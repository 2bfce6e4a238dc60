package com.portfolioscanner.common.scan;

import java.util.List;

/**
 * Supplies article texts ({@code "Title: ...\nContent: ...\n"}) for a scan.
 * Implementations return an empty list rather than failing when nothing is available.
 */
@FunctionalInterface
public interface NewsSource {

    List<String> fetch(ScanRequest request);
}
