package com.switchboard.tenancy.testing;

import com.switchboard.tenancy.store.StoreConnector;
import com.switchboard.tenancy.store.StoreSession;
import com.switchboard.tenancy.store.StoreSessionException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * In-memory physical stores with fault injection.
 * <p>
 * Each store is a set of tables holding rows as column maps. Sessions understand three statement
 * shapes, enough for tenant-scoped data tests:
 * <ul>
 *   <li>{@code INSERT INTO table (a, b) VALUES (?, ?)}</li>
 *   <li>{@code SELECT ... FROM table [WHERE column = ?]}</li>
 *   <li>{@code DELETE FROM table [WHERE column = ?]}</li>
 * </ul>
 * Anything else is rejected with {@link IllegalArgumentException}, the way a backend rejects bad SQL.
 */
public final class InMemoryStoreConnector implements StoreConnector {

    private static final Pattern INSERT =
            Pattern.compile("^\\s*INSERT\\s+INTO\\s+(\\w+)\\s*\\(([^)]*)\\).*", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern SELECT =
            Pattern.compile("^\\s*SELECT\\s+.+?\\s+FROM\\s+(\\w+)(?:\\s+WHERE\\s+(\\w+)\\s*=\\s*\\?)?.*",
                    Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern DELETE =
            Pattern.compile("^\\s*DELETE\\s+FROM\\s+(\\w+)(?:\\s+WHERE\\s+(\\w+)\\s*=\\s*\\?)?.*",
                    Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private final Map<String, Store> stores = new ConcurrentHashMap<>();
    private final Set<String> unreachable = ConcurrentHashMap.newKeySet();
    private final Set<String> broken = ConcurrentHashMap.newKeySet();
    private final Map<String, AtomicInteger> failingOpens = new ConcurrentHashMap<>();
    private final AtomicInteger opened = new AtomicInteger();
    private final AtomicInteger closed = new AtomicInteger();

    // ---- store management ----

    public InMemoryStoreConnector createStore(String storeName) {
        stores.putIfAbsent(storeName, new Store());
        return this;
    }

    public boolean dropStore(String storeName) {
        return stores.remove(storeName) != null;
    }

    public boolean hasStore(String storeName) {
        return stores.containsKey(storeName);
    }

    /** Rows of a table, bypassing sessions. */
    public List<Map<String, Object>> rows(String storeName, String table) {
        Store store = stores.get(storeName);
        return store == null ? List.of() : store.select(table.toLowerCase(Locale.ROOT), null, null);
    }

    // ---- fault injection ----

    /** The next {@code count} opens of the store fail. */
    public void failNextOpens(String storeName, int count) {
        failingOpens.put(storeName, new AtomicInteger(count));
    }

    /** Every open of the store fails until {@link #makeReachable} is called. */
    public void makeUnreachable(String storeName) {
        unreachable.add(storeName);
    }

    public void makeReachable(String storeName) {
        unreachable.remove(storeName);
        broken.remove(storeName);
    }

    /** Every statement on existing and future sessions of the store fails as an infrastructure error. */
    public void breakSessions(String storeName) {
        broken.add(storeName);
    }

    // ---- counters ----

    public int openedCount() {
        return opened.get();
    }

    public int closedCount() {
        return closed.get();
    }

    /** Sessions opened and not yet closed, pooled idle ones included. */
    public int liveSessions() {
        return opened.get() - closed.get();
    }

    @Override
    public StoreSession open(String storeName) {
        if (unreachable.contains(storeName)) {
            throw new StoreSessionException(storeName, "store '" + storeName + "' is unreachable");
        }
        AtomicInteger failing = failingOpens.get(storeName);
        if (failing != null && failing.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new StoreSessionException(storeName, "injected open failure for '" + storeName + "'");
        }
        if (!stores.containsKey(storeName)) {
            throw new StoreSessionException(storeName, "store '" + storeName + "' does not exist");
        }
        opened.incrementAndGet();
        return new Session(storeName);
    }

    private final class Session implements StoreSession {

        private final String storeName;
        private final AtomicBoolean closedFlag = new AtomicBoolean();

        Session(String storeName) {
            this.storeName = storeName;
        }

        @Override
        public String storeName() {
            return storeName;
        }

        @Override
        public List<Map<String, Object>> query(String sql, Object... args) {
            Store store = usableStore();
            Matcher m = SELECT.matcher(sql);
            if (!m.matches()) {
                throw new IllegalArgumentException("Unsupported query: " + sql);
            }
            String column = m.group(2);
            return store.select(m.group(1).toLowerCase(Locale.ROOT),
                    column == null ? null : column.toLowerCase(Locale.ROOT),
                    column == null ? null : args[0]);
        }

        @Override
        public int update(String sql, Object... args) {
            Store store = usableStore();
            Matcher insert = INSERT.matcher(sql);
            if (insert.matches()) {
                String[] columns = insert.group(2).split(",");
                if (columns.length != args.length) {
                    throw new IllegalArgumentException("Expected " + columns.length + " arguments: " + sql);
                }
                Map<String, Object> row = new LinkedHashMap<>();
                for (int i = 0; i < columns.length; i++) {
                    row.put(columns[i].trim().toLowerCase(Locale.ROOT), args[i]);
                }
                store.insert(insert.group(1).toLowerCase(Locale.ROOT), row);
                return 1;
            }
            Matcher delete = DELETE.matcher(sql);
            if (delete.matches()) {
                String column = delete.group(2);
                return store.delete(delete.group(1).toLowerCase(Locale.ROOT),
                        column == null ? null : column.toLowerCase(Locale.ROOT),
                        column == null ? null : args[0]);
            }
            throw new IllegalArgumentException("Unsupported statement: " + sql);
        }

        @Override
        public boolean isValid() {
            return !closedFlag.get() && !broken.contains(storeName) && stores.containsKey(storeName);
        }

        @Override
        public void close() {
            if (closedFlag.compareAndSet(false, true)) {
                closed.incrementAndGet();
            }
        }

        private Store usableStore() {
            if (closedFlag.get()) {
                throw new StoreSessionException(storeName, "session is closed");
            }
            if (broken.contains(storeName)) {
                throw new StoreSessionException(storeName, "connection to '" + storeName + "' lost");
            }
            Store store = stores.get(storeName);
            if (store == null) {
                throw new StoreSessionException(storeName, "store '" + storeName + "' does not exist");
            }
            return store;
        }
    }

    private static final class Store {

        private final Map<String, List<Map<String, Object>>> tables = new LinkedHashMap<>();

        synchronized void insert(String table, Map<String, Object> row) {
            tables.computeIfAbsent(table, t -> new ArrayList<>()).add(row);
        }

        synchronized List<Map<String, Object>> select(String table, String column, Object value) {
            List<Map<String, Object>> result = new ArrayList<>();
            for (Map<String, Object> row : tables.getOrDefault(table, List.of())) {
                if (column == null || matches(row.get(column), value)) {
                    result.add(new LinkedHashMap<>(row));
                }
            }
            return result;
        }

        synchronized int delete(String table, String column, Object value) {
            List<Map<String, Object>> rows = tables.get(table);
            if (rows == null) {
                return 0;
            }
            int before = rows.size();
            rows.removeIf(row -> column == null || matches(row.get(column), value));
            return before - rows.size();
        }

        private static boolean matches(Object stored, Object value) {
            return stored != null && value != null && String.valueOf(stored).equals(String.valueOf(value));
        }
    }
}
