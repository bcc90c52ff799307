package com.finsight.view;

/**
 * Where the price in a {@link MarketView} came from.
 */
public enum FreshnessState {
    /** Quote fetched from the provider on this call. */
    LIVE,
    /** Provider unreachable; cached close within the fresh age limit. */
    CACHED_FRESH,
    /** Provider unreachable; cached close older than the fresh age limit. */
    CACHED_STALE,
    /** Provider unreachable and nothing cached. */
    UNAVAILABLE;

    public boolean isStale() {
        return this != LIVE;
    }

/**
 * 方法说明：resolve，负责根据行情抓取结果与缓存年龄决定新鲜度状态。
 */
    public static FreshnessState resolve(boolean quoteFetched, Long cachedAgeSeconds, long freshMaxAgeSeconds) {
        if (quoteFetched) {
            return LIVE;
        }
        if (cachedAgeSeconds == null) {
            return UNAVAILABLE;
        }
        return cachedAgeSeconds <= freshMaxAgeSeconds ? CACHED_FRESH : CACHED_STALE;
    }
}
