package com.aboutblank.config;

import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;

/**
 * Releases the sync executor and the database pool once the web server has
 * stopped taking requests.
 *
 * Lifecycle beans stop in descending phase order. The embedded server's
 * graceful shutdown runs in a phase just below Integer.MAX_VALUE, so phase 0
 * stops after in-flight requests have drained.
 */
@Component
@Slf4j
public class ConnectionPoolLifecycle implements SmartLifecycle {

    static final int PHASE = 0;

    private final DataSource dataSource;
    private final ThreadPoolTaskExecutor syncExecutor;

    private volatile boolean running;

    public ConnectionPoolLifecycle(DataSource dataSource,
                                   @Qualifier("syncExecutor") ThreadPoolTaskExecutor syncExecutor) {
        this.dataSource = dataSource;
        this.syncExecutor = syncExecutor;
    }

    @Override
    public void start() {
        running = true;
        log.info("Connection pool lifecycle started");
    }

    @Override
    public void stop() {
        log.info("Shutting down sync executor (active threads: {})", syncExecutor.getActiveCount());
        syncExecutor.shutdown();

        if (dataSource instanceof HikariDataSource) {
            HikariDataSource hikariDataSource = (HikariDataSource) dataSource;
            HikariPoolMXBean pool = hikariDataSource.getHikariPoolMXBean();
            if (pool != null) {
                log.info("Closing connection pool {}: active={}, idle={}, total={}",
                        hikariDataSource.getPoolName(), pool.getActiveConnections(),
                        pool.getIdleConnections(), pool.getTotalConnections());
            }
            hikariDataSource.close();
        }

        running = false;
        log.info("Connection pool closed");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return PHASE;
    }
}
