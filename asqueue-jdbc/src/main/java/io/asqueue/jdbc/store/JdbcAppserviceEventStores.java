package io.asqueue.jdbc.store;

import io.asqueue.QueueConfig;
import io.asqueue.jdbc.QueueStoreException;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;

/**
 * Looks up the queue store for a database, by dialect name or by JDBC URL, and returns it
 * configured for a {@link QueueConfig}.
 *
 * <p>Stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/io.asqueue.jdbc.store.AbstractJdbcAppserviceEventStore}. Two
 * stores claiming the same name or URL prefix is a packaging error and fails class
 * initialization.
 *
 * <pre>{@code
 * QueueConfig config = QueueConfig.fromProperties(properties);
 * AbstractJdbcAppserviceEventStore store = JdbcAppserviceEventStores.detect(dataSource, config);
 * }</pre>
 */
public final class JdbcAppserviceEventStores {

    private static final List<AbstractJdbcAppserviceEventStore> STORES = ServiceLoader
            .load(AbstractJdbcAppserviceEventStore.class)
            .stream()
            .map(ServiceLoader.Provider::get)
            .toList();
    private static final Map<String, AbstractJdbcAppserviceEventStore> BY_NAME = indexByName(STORES);
    private static final Map<String, AbstractJdbcAppserviceEventStore> BY_PREFIX = indexByPrefix(STORES);

    private JdbcAppserviceEventStores() {
    }

    /**
     * Returns all registered stores, each with the default table and no query timeout.
     */
    public static List<AbstractJdbcAppserviceEventStore> all() {
        return STORES;
    }

    /**
     * Gets a store by dialect name (case-insensitive), with default settings.
     *
     * @throws IllegalArgumentException if no store is registered under that name
     */
    public static AbstractJdbcAppserviceEventStore get(String name) {
        Objects.requireNonNull(name, "name");
        AbstractJdbcAppserviceEventStore store = BY_NAME.get(name.toLowerCase(Locale.ROOT));
        if (store == null) {
            throw new IllegalArgumentException("Unknown queue store: " + name +
                    ". Available: " + BY_NAME.keySet());
        }
        return store;
    }

    /**
     * Gets a store by dialect name, configured with the table name and query timeout of
     * {@code config}.
     */
    public static AbstractJdbcAppserviceEventStore get(String name, QueueConfig config) {
        return configured(get(name), config);
    }

    /**
     * Auto-detects the store from a JDBC URL, with default settings.
     *
     * @throws IllegalArgumentException if no store matches
     */
    public static AbstractJdbcAppserviceEventStore detect(String jdbcUrl) {
        if (jdbcUrl == null || jdbcUrl.isEmpty()) {
            throw new IllegalArgumentException("JDBC URL cannot be null or empty");
        }
        String url = jdbcUrl.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, AbstractJdbcAppserviceEventStore> entry : BY_PREFIX.entrySet()) {
            if (url.startsWith(entry.getKey())) {
                return entry.getValue();
            }
        }
        throw new IllegalArgumentException("No queue store found for JDBC URL: " + jdbcUrl +
                ". Supported prefixes: " + BY_PREFIX.keySet());
    }

    /**
     * Auto-detects the store from a DataSource's JDBC URL, with default settings.
     *
     * @throws QueueStoreException if the URL cannot be read from the database
     * @throws IllegalArgumentException if no store matches
     */
    public static AbstractJdbcAppserviceEventStore detect(DataSource dataSource) {
        Objects.requireNonNull(dataSource, "dataSource");
        String url;
        try (Connection conn = dataSource.getConnection()) {
            url = conn.getMetaData().getURL();
        } catch (SQLException e) {
            throw QueueStoreException.translate("Failed to read JDBC URL for queue store detection", e);
        }
        return detect(url);
    }

    /**
     * Auto-detects the store from a DataSource and configures it with {@code config}.
     */
    public static AbstractJdbcAppserviceEventStore detect(DataSource dataSource, QueueConfig config) {
        Objects.requireNonNull(config, "config");
        return configured(detect(dataSource), config);
    }

    private static AbstractJdbcAppserviceEventStore configured(
            AbstractJdbcAppserviceEventStore store, QueueConfig config) {
        Objects.requireNonNull(config, "config").validate();
        if (store.tableName().equals(config.getTableName())
                && store.queryTimeoutSeconds() == config.getQueryTimeoutSeconds()) {
            return store;
        }
        return store.configure(config);
    }

    static Map<String, AbstractJdbcAppserviceEventStore> indexByName(
            List<AbstractJdbcAppserviceEventStore> stores) {
        Map<String, AbstractJdbcAppserviceEventStore> index = new LinkedHashMap<>();
        for (AbstractJdbcAppserviceEventStore store : stores) {
            register(index, store.name(), store, "name");
        }
        return Collections.unmodifiableMap(index);
    }

    static Map<String, AbstractJdbcAppserviceEventStore> indexByPrefix(
            List<AbstractJdbcAppserviceEventStore> stores) {
        Map<String, AbstractJdbcAppserviceEventStore> index = new LinkedHashMap<>();
        for (AbstractJdbcAppserviceEventStore store : stores) {
            for (String prefix : store.jdbcUrlPrefixes()) {
                register(index, prefix, store, "JDBC URL prefix");
            }
        }
        return Collections.unmodifiableMap(index);
    }

    private static void register(Map<String, AbstractJdbcAppserviceEventStore> index, String key,
            AbstractJdbcAppserviceEventStore store, String kind) {
        AbstractJdbcAppserviceEventStore existing = index.putIfAbsent(key.toLowerCase(Locale.ROOT), store);
        if (existing != null && existing.getClass() != store.getClass()) {
            throw new IllegalStateException("Queue stores " + existing.getClass().getName() + " and " +
                    store.getClass().getName() + " both claim " + kind + " '" + key + "'");
        }
    }
}
