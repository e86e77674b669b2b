package com.dcruver.incipit.citation;

import com.dcruver.incipit.config.IncipitProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import lombok.Data;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Derives the deduplication key of a cited work from its author and title.
 *
 * The key is a pure function of its inputs, so one memo table is shared by
 * every conversion. The table is bounded to the configured size.
 */
@Component
@Slf4j
public class FingerprintGenerator {

    static final String NO_AUTHOR = "no_auth";
    static final int TITLE_KEY_LENGTH = 25;

    private static final Pattern NON_WORD = Pattern.compile("\\W+", Pattern.UNICODE_CHARACTER_CLASS);

    private final int maxEntries;
    private final Cache<MemoKey, String> memo;

    @Autowired
    public FingerprintGenerator(IncipitProperties properties) {
        this(properties.getFingerprintCacheSize());
    }

    public FingerprintGenerator(int maxEntries) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("Fingerprint cache size must be positive: " + maxEntries);
        }
        this.maxEntries = maxEntries;
        this.memo = Caffeine.newBuilder()
            .maximumSize(maxEntries)
            .recordStats()
            .build();
    }

    /**
     * Compute the fingerprint of a work.
     *
     * @param author author as parsed, may be null
     * @param title title as parsed
     * @return the key, or null when there is no title
     */
    public String fingerprint(String author, String title) {
        if (title == null || title.isBlank()) {
            return null;
        }

        return memo.get(new MemoKey(author, title), key -> compute(key.getAuthor(), key.getTitle()));
    }

    private String compute(String author, String title) {
        String authorKey = author != null && !author.isBlank() ? normalize(author) : NO_AUTHOR;
        String titleKey = normalize(title);
        if (titleKey.length() > TITLE_KEY_LENGTH) {
            titleKey = titleKey.substring(0, TITLE_KEY_LENGTH);
        }
        return authorKey + "_" + titleKey;
    }

    private String normalize(String text) {
        return NON_WORD.matcher(text).replaceAll("").toLowerCase(Locale.ROOT);
    }

    /**
     * Drop every memoized key. Hit and miss counts are cumulative and survive a clear.
     */
    public void clear() {
        memo.invalidateAll();
        memo.cleanUp();
        log.info("Cleared fingerprint cache");
    }

    public Stats getStats() {
        memo.cleanUp();
        CacheStats cacheStats = memo.stats();

        Stats stats = new Stats();
        stats.setSize(memo.estimatedSize());
        stats.setMaxEntries(maxEntries);
        stats.setHits(cacheStats.hitCount());
        stats.setMisses(cacheStats.missCount());
        return stats;
    }

    @Value
    private static class MemoKey {
        String author;
        String title;
    }

    /**
     * Fingerprint cache statistics.
     */
    @Data
    public static class Stats {
        private long size;
        private int maxEntries;
        private long hits;
        private long misses;
    }
}
