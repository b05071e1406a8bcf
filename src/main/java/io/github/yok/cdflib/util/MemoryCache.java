package io.github.yok.cdflib.util;

import com.google.common.base.Preconditions;
import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.math.LongMath;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;

/**
 * Process-local key/value cache with a time to live per item.
 *
 * <p>
 * Items expire once their time to live has elapsed; {@link Duration#ZERO} keeps an item until it is
 * removed or evicted. Once the maximum number of items is reached, items that have not been used
 * recently are evicted first.
 * </p>
 *
 * <p>
 * A {@link #disabled() disabled} cache accepts every call and caches nothing, so callers can switch
 * caching off without changing their code.
 * </p>
 *
 * <pre>
 * MemoryCache cache = new MemoryCache(Duration.ofMinutes(10));
 * cache.storeItem("user:42", user);
 * User cached = cache.getItem("user:42", User.class);
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class MemoryCache {

    /**
     * Time to live used when none is given.
     */
    public static final Duration DEFAULT_TTL = Duration.ofHours(1);

    /**
     * Item count above which the least recently used items are evicted.
     */
    public static final long DEFAULT_MAXIMUM_SIZE = 10_000L;

    private final boolean enabled;
    private final Duration ttl;
    private final Ticker ticker;
    private final Cache<String, Item> cache;

    public MemoryCache() {
        this(DEFAULT_TTL);
    }

    /**
     * Creates a cache with the given default time to live.
     *
     * @param ttl default time to live; {@link Duration#ZERO} for no expiry
     * @throws IllegalArgumentException if {@code ttl} is negative
     */
    public MemoryCache(Duration ttl) {
        this(ttl, DEFAULT_MAXIMUM_SIZE);
    }

    /**
     * Creates a cache with the given default time to live and size bound.
     *
     * @param ttl default time to live; {@link Duration#ZERO} for no expiry
     * @param maximumSize number of items kept before eviction
     * @throws IllegalArgumentException if {@code ttl} or {@code maximumSize} is negative
     */
    public MemoryCache(Duration ttl, long maximumSize) {
        this(true, ttl, maximumSize, Ticker.systemTicker());
    }

    MemoryCache(boolean enabled, Duration ttl, long maximumSize, Ticker ticker) {
        this.enabled = enabled;
        this.ttl = checkTtl(ttl);
        Preconditions.checkArgument(maximumSize >= 0, "maximumSize must not be negative: %s",
                maximumSize);
        this.ticker = Preconditions.checkNotNull(ticker, "ticker must not be null");
        this.cache = CacheBuilder.newBuilder().maximumSize(maximumSize).ticker(ticker).build();
    }

    /**
     * Returns a cache that never holds anything.
     *
     * @return disabled cache
     */
    public static MemoryCache disabled() {
        return new MemoryCache(false, DEFAULT_TTL, 0L, Ticker.systemTicker());
    }

    public boolean isEnabled() {
        return enabled;
    }

    public boolean addItem(String key, Object value) {
        return addItem(key, value, ttl);
    }

    /**
     * Adds an item unless the key already holds a live item.
     *
     * @param key item key
     * @param value item value
     * @param itemTtl time to live of this item; {@link Duration#ZERO} for no expiry
     * @return {@code true} if the item was added, {@code false} if the key was taken or the cache is
     *         disabled
     * @throws IllegalArgumentException if the key or value is {@code null}, or the time to live is
     *         negative
     */
    public boolean addItem(String key, Object value, Duration itemTtl) {
        Item fresh = newItem(key, value, itemTtl);
        if (!enabled) {
            return false;
        }
        long now = ticker.read();
        Item held = cache.asMap().compute(key,
                (k, current) -> current == null || current.isExpired(now) ? fresh : current);
        return held == fresh;
    }

    public boolean storeItem(String key, Object value) {
        return storeItem(key, value, ttl);
    }

    /**
     * Stores an item, replacing whatever the key held.
     *
     * @param key item key
     * @param value item value
     * @param itemTtl time to live of this item; {@link Duration#ZERO} for no expiry
     * @return {@code true} if stored, {@code false} if the cache is disabled
     * @throws IllegalArgumentException if the key or value is {@code null}, or the time to live is
     *         negative
     */
    public boolean storeItem(String key, Object value, Duration itemTtl) {
        Item fresh = newItem(key, value, itemTtl);
        if (!enabled) {
            return false;
        }
        cache.put(key, fresh);
        return true;
    }

    /**
     * Removes an item. Nothing happens if the key is not cached.
     *
     * @param key item key
     * @throws IllegalArgumentException if the key is {@code null}
     */
    public void removeItem(String key) {
        checkKey(key);
        cache.invalidate(key);
    }

    /**
     * Returns a live item.
     *
     * @param key item key
     * @return cached value; {@code null} if missing, expired or the cache is disabled
     * @throws IllegalArgumentException if the key is {@code null}
     */
    public Object getItem(String key) {
        checkKey(key);
        Item item = cache.getIfPresent(key);
        if (item == null) {
            return null;
        }
        if (item.isExpired(ticker.read())) {
            cache.asMap().remove(key, item);
            return null;
        }
        return item.value;
    }

    /**
     * Returns a live item of the given type.
     *
     * @param <T> expected type
     * @param key item key
     * @param type expected type
     * @return cached value; {@code null} if missing, expired or of another type
     * @throws IllegalArgumentException if the key is {@code null}
     */
    public <T> T getItem(String key, Class<T> type) {
        Object value = getItem(key);
        return type.isInstance(value) ? type.cast(value) : null;
    }

    /**
     * Removes every item.
     */
    public void invalidate() {
        cache.invalidateAll();
        log.debug("Memory cache invalidated.");
    }

    private Item newItem(String key, Object value, Duration itemTtl) {
        checkKey(key);
        Preconditions.checkArgument(value != null, "Value must not be null");
        Duration life = checkTtl(itemTtl);
        long expiresAt = life.isZero() ? Long.MAX_VALUE
                : LongMath.saturatedAdd(ticker.read(), toNanosSaturated(life));
        return new Item(value, expiresAt);
    }

    private static void checkKey(String key) {
        Preconditions.checkArgument(key != null, "Key must be a string");
    }

    private static Duration checkTtl(Duration ttl) {
        Preconditions.checkArgument(ttl != null && !ttl.isNegative(),
                "ttl must not be negative: %s", ttl);
        return ttl;
    }

    private static long toNanosSaturated(Duration duration) {
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    private static final class Item {

        private final Object value;
        // Ticker reading after which the item is gone
        private final long expiresAt;

        private Item(Object value, long expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }

        private boolean isExpired(long now) {
            return now >= expiresAt;
        }
    }
}
