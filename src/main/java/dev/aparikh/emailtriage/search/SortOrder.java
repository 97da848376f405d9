package dev.aparikh.emailtriage.search;

/**
 * Order of results by sent date. Searches default to newest first; conversations read oldest first.
 */
public enum SortOrder {
    NEWEST_FIRST,
    OLDEST_FIRST
}
