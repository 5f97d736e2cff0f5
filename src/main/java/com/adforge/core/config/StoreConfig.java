package com.adforge.core.config;

import com.adforge.core.job.InMemoryJobStore;
import com.adforge.core.job.JdbcJobStore;
import com.adforge.core.job.JobStore;
import com.adforge.core.store.InMemoryItemStore;
import com.adforge.core.store.ItemStore;
import com.adforge.core.store.JdbcItemStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * Item and job stores.
 * <p>
 * When a {@link DataSource} is available (the {@code postgres} profile), JDBC stores are
 * created and their tables ensured on startup. Otherwise in-memory stores are used, which
 * lose all state when the process exits.
 */
@Configuration
public class StoreConfig {

    private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

    @Bean
    public ItemStore itemStore(ObjectProvider<DataSource> dataSource, ObjectMapper objectMapper, Clock clock)
            throws Exception {
        DataSource ds = dataSource.getIfAvailable();
        if (ds == null) {
            log.info("No DataSource available; using in-memory item store (state will not persist across restarts)");
            return new InMemoryItemStore(clock);
        }
        log.info("Configuring JDBC item store");
        var store = new JdbcItemStore(ds, objectMapper, clock);
        store.createTables();
        return store;
    }

    @Bean
    public JobStore jobStore(ObjectProvider<DataSource> dataSource, ObjectMapper objectMapper, Clock clock)
            throws Exception {
        DataSource ds = dataSource.getIfAvailable();
        if (ds == null) {
            log.info("No DataSource available; using in-memory job store");
            return new InMemoryJobStore(clock);
        }
        log.info("Configuring JDBC job store");
        var store = new JdbcJobStore(ds, objectMapper, clock);
        store.createTables();
        return store;
    }
}
