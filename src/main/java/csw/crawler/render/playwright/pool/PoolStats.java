package csw.crawler.render.playwright.pool;

/**
 * Point-in-time view of the session pool.
 *
 * @param created   sessions started since the pool was created, replacements included
 * @param destroyed sessions terminated since the pool was created
 */
public record PoolStats(
        int poolSize,
        int active,
        int idle,
        int waiters,
        long created,
        long destroyed,
        boolean closed
) {
}
