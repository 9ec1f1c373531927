package csw.crawler.render.playwright.pool;

import csw.crawler.render.common.exception.BrowserPoolException;
import csw.crawler.render.common.exception.PoolClosedException;
import csw.crawler.render.common.exception.PoolDegradedException;
import csw.crawler.render.common.exception.PoolExhaustedException;
import csw.crawler.render.common.exception.ProvisioningException;
import csw.crawler.render.playwright.BrowserSession;
import csw.crawler.render.playwright.BrowserSessionFactory;
import csw.crawler.render.playwright.PoolConfig;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.pool2.BasePooledObjectFactory;
import org.apache.commons.pool2.PooledObject;
import org.apache.commons.pool2.impl.DefaultPooledObject;
import org.apache.commons.pool2.impl.GenericObjectPool;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.NoSuchElementException;
import java.util.function.Function;

/**
 * Fixed-size pool of browser sessions. Each checked-out session belongs to exactly one caller until it is
 * handed back with {@link #release(BrowserSession)} or, after a failure, {@link #replace(BrowserSession)}.
 */
@Slf4j
@Component
public class BrowserSessionPool {

    @Getter
    private final PoolConfig config;
    private final BrowserSessionFactory sessionFactory;
    private volatile GenericObjectPool<BrowserSession> sessionPool;

    public BrowserSessionPool(PoolConfig config, BrowserSessionFactory sessionFactory) {
        this.config = config;
        this.sessionFactory = sessionFactory;
    }

    /**
     * Starts all {@code poolSize} sessions. Either the whole pool comes up or none of it stays running.
     *
     * @throws ProvisioningException if any session cannot be created
     */
    @PostConstruct
    public synchronized void initialize() {
        if (sessionPool != null) {
            throw new IllegalStateException("Browser session pool is already initialized");
        }
        log.info("Initializing browser session pool with size={}, kind={}, mode={}",
                config.getPoolSize(), config.getBrowserKind(), config.getProvisioningMode());

        GenericObjectPool<BrowserSession> pool = createGenericPool();
        try {
            for (int i = 0; i < config.getPoolSize(); i++) {
                pool.addObject();
            }
        } catch (Exception e) {
            log.error("Failed to pre-initialize browser sessions, terminating {} already started", pool.getNumIdle(), e);
            pool.close();
            if (e instanceof ProvisioningException provisioningException) {
                throw provisioningException;
            }
            throw new ProvisioningException("Failed to initialize browser session pool", e);
        }
        sessionPool = pool;
        log.info("Successfully pre-initialized {} browser sessions", pool.getNumIdle());
    }

    GenericObjectPool<BrowserSession> createGenericPool() {
        return new GenericObjectPool<>(new BrowserSessionPooledObjectFactory(sessionFactory, config), poolConfig());
    }

    private GenericObjectPoolConfig<BrowserSession> poolConfig() {
        GenericObjectPoolConfig<BrowserSession> poolConfig = new GenericObjectPoolConfig<>();
        poolConfig.setMaxTotal(config.getPoolSize());
        poolConfig.setMaxIdle(config.getPoolSize());
        poolConfig.setMinIdle(config.getPoolSize());
        poolConfig.setBlockWhenExhausted(true);
        poolConfig.setMaxWait(config.getCheckoutTimeout());

        // a broken idle session is swapped for a fresh one before anyone gets it
        poolConfig.setTestOnBorrow(true);
        poolConfig.setTestOnReturn(false);

        if (config.isHealthSweepEnabled()) {
            poolConfig.setTimeBetweenEvictionRuns(config.getValidationInterval());
            poolConfig.setTestWhileIdle(true);
            poolConfig.setNumTestsPerEvictionRun(config.getPoolSize());
            // sessions never expire, the sweep only drops broken ones and refills to minIdle
            poolConfig.setMinEvictableIdleDuration(Duration.ofMillis(-1));
        }
        poolConfig.setJmxEnabled(false);
        return poolConfig;
    }

    public BrowserSession acquire() {
        return acquire(config.getCheckoutTimeout());
    }

    /**
     * Checks out a session, blocking for at most {@code timeout}.
     *
     * @throws PoolExhaustedException if no session became available in time
     * @throws PoolClosedException    if the pool has been shut down, before or while waiting
     */
    public BrowserSession acquire(Duration timeout) {
        GenericObjectPool<BrowserSession> pool = requirePool();
        if (pool.isClosed()) {
            throw new PoolClosedException();
        }
        long startTime = System.currentTimeMillis();
        try {
            BrowserSession session = pool.borrowObject(timeout);
            log.debug("Acquired browser session {} in {}ms. Active: {}, Idle: {}",
                    session.id(), System.currentTimeMillis() - startTime, pool.getNumActive(), pool.getNumIdle());
            return session;
        } catch (NoSuchElementException e) {
            if (pool.isClosed()) {
                throw new PoolClosedException(e);
            }
            throw new PoolExhaustedException(timeout, e);
        } catch (IllegalStateException e) {
            if (pool.isClosed()) {
                throw new PoolClosedException(e);
            }
            throw e;
        } catch (InterruptedException e) {
            // shutdown interrupts everyone still waiting for a session
            if (pool.isClosed()) {
                throw new PoolClosedException(e);
            }
            Thread.currentThread().interrupt();
            throw new BrowserPoolException("Interrupted while waiting for a browser session", e);
        } catch (BrowserPoolException e) {
            throw e;
        } catch (Exception e) {
            throw new BrowserPoolException("Failed to acquire a browser session", e);
        }
    }

    /**
     * Hands a healthy session back. After shutdown the session is terminated instead.
     */
    public void release(BrowserSession session) {
        if (session == null) {
            return;
        }
        GenericObjectPool<BrowserSession> pool = requirePool();
        pool.returnObject(session);
        log.debug("Released browser session {}. Active: {}, Idle: {}", session.id(), pool.getNumActive(), pool.getNumIdle());
    }

    /**
     * Terminates a session whose last operation failed and puts a freshly created one in its place.
     *
     * @throws PoolDegradedException if the replacement cannot be created
     */
    public void replace(BrowserSession session) {
        GenericObjectPool<BrowserSession> pool = requirePool();
        log.warn("Replacing browser session {}", session.id());
        try {
            // may already refill the pool itself when callers are waiting
            pool.invalidateObject(session);
        } catch (IllegalStateException e) {
            throw e;
        } catch (Exception e) {
            throw new PoolDegradedException("Terminated session " + session.id() + " but could not create its replacement", e);
        }

        if (pool.isClosed()) {
            log.info("Pool is shut down, session {} terminated without replacement", session.id());
            return;
        }
        try {
            pool.addObject();
        } catch (IllegalStateException e) {
            if (!pool.isClosed()) {
                throw e;
            }
            log.info("Pool shut down while replacing session {}", session.id());
        } catch (Exception e) {
            log.error("Browser session pool degraded. Active: {}, Idle: {}, Size: {}",
                    pool.getNumActive(), pool.getNumIdle(), config.getPoolSize(), e);
            throw new PoolDegradedException("Terminated session " + session.id() + " but could not create its replacement", e);
        }
        log.info("Replaced browser session {}. Active: {}, Idle: {}", session.id(), pool.getNumActive(), pool.getNumIdle());
    }

    /**
     * Borrows a session, applies the operation and returns the session. A session whose operation threw is
     * replaced, never reused; the operation's exception is rethrown.
     */
    public <R> R withSession(Function<BrowserSession, R> operation) {
        BrowserSession session = acquire();
        R result;
        try {
            result = operation.apply(session);
        } catch (RuntimeException e) {
            try {
                replace(session);
            } catch (RuntimeException replaceEx) {
                e.addSuppressed(replaceEx);
            }
            throw e;
        }
        release(session);
        return result;
    }

    /**
     * Terminates every idle session. Sessions still checked out are terminated when they come back.
     * Calling it again has no effect.
     */
    @PreDestroy
    public void shutdown() {
        GenericObjectPool<BrowserSession> pool = sessionPool;
        if (pool == null || pool.isClosed()) {
            return;
        }
        log.info("Shutting down browser session pool. Active: {}, Idle: {}, Waiting: {}",
                pool.getNumActive(), pool.getNumIdle(), pool.getNumWaiters());
        pool.close();
        log.info("Browser session pool closed, {} sessions still checked out", pool.getNumActive());
    }

    public boolean isClosed() {
        GenericObjectPool<BrowserSession> pool = sessionPool;
        return pool != null && pool.isClosed();
    }

    public PoolStats stats() {
        GenericObjectPool<BrowserSession> pool = sessionPool;
        if (pool == null) {
            return new PoolStats(config.getPoolSize(), 0, 0, 0, 0, 0, false);
        }
        return new PoolStats(
                config.getPoolSize(),
                pool.getNumActive(),
                pool.getNumIdle(),
                pool.getNumWaiters(),
                pool.getCreatedCount(),
                pool.getDestroyedCount(),
                pool.isClosed()
        );
    }

    private GenericObjectPool<BrowserSession> requirePool() {
        GenericObjectPool<BrowserSession> pool = sessionPool;
        if (pool == null) {
            throw new IllegalStateException("Browser session pool is not initialized");
        }
        return pool;
    }

    /**
     * Bridges commons-pool to the session factory
     */
    static class BrowserSessionPooledObjectFactory extends BasePooledObjectFactory<BrowserSession> {
        private final BrowserSessionFactory sessionFactory;
        private final PoolConfig config;

        BrowserSessionPooledObjectFactory(BrowserSessionFactory sessionFactory, PoolConfig config) {
            this.sessionFactory = sessionFactory;
            this.config = config;
        }

        @Override
        public BrowserSession create() {
            long startTime = System.currentTimeMillis();
            BrowserSession session = sessionFactory.create(config);
            log.debug("Created browser session {} in {}ms", session.id(), System.currentTimeMillis() - startTime);
            return session;
        }

        @Override
        public PooledObject<BrowserSession> wrap(BrowserSession session) {
            return new DefaultPooledObject<>(session);
        }

        @Override
        public boolean validateObject(PooledObject<BrowserSession> p) {
            BrowserSession session = p.getObject();
            try {
                return session.isHealthy();
            } catch (Exception ex) {
                log.warn("Validation of browser session {} failed", session.id(), ex);
                return false;
            }
        }

        @Override
        public void destroyObject(PooledObject<BrowserSession> p) {
            BrowserSession session = p.getObject();
            try {
                log.debug("Terminating browser session {}", session.id());
                session.terminate();
            } catch (Exception e) {
                log.error("Error terminating browser session {}", session.id(), e);
            }
        }
    }
}
