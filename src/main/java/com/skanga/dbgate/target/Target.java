package com.skanga.dbgate.target;

/**
 * One logical database endpoint. Immutable; identity is {@link #name()}.
 *
 * @param name     logical name callers use (the database name, or host:port when none is configured)
 * @param host     server host
 * @param port     server port
 * @param user     login user
 * @param password login password, never printed
 * @param database database selected on every leased connection, may be empty
 * @param charset  connection character set, empty for the driver default
 * @param dialect  database flavour
 * @param url      explicit JDBC URL override, empty to derive it from host and port
 */
public record Target(String name, String host, int port, String user, String password,
                     String database, String charset, Dialect dialect, String url) {
    public Target {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Target name cannot be null or empty");
        }
        if (dialect == null) {
            throw new IllegalArgumentException("Target dialect cannot be null");
        }
        host = host == null ? "" : host;
        user = user == null ? "" : user;
        password = password == null ? "" : password;
        database = database == null ? "" : database;
        charset = charset == null ? "" : charset;
        url = url == null ? "" : url;
    }

    /**
     * JDBC URL the pool connects with. Does not name a database unless it comes from an explicit override.
     */
    public String jdbcUrl() {
        return url.isBlank() ? dialect.serverUrl(host, port) : url;
    }

    /**
     * Key of the pool this target borrows from. Targets on the same server with the same credentials share one.
     */
    public ServerKey serverKey() {
        return new ServerKey(dialect, jdbcUrl(), user, password, charset);
    }

    /**
     * Same endpoint, pointed at another database on that server.
     */
    public Target withDatabase(String otherDatabase) {
        return new Target(name, host, port, user, password, otherDatabase, charset, dialect, url);
    }

    /**
     * Human readable endpoint for logs and messages.
     */
    public String describe() {
        String location = url.isBlank() ? host + ":" + port : url;
        return database.isBlank() ? location : location + " (" + database + ")";
    }

    @Override
    public String toString() {
        return "Target[name=" + name + ", endpoint=" + describe() + ", user=" + user
                + ", password=" + (password.isEmpty() ? "" : "***") + ", charset=" + charset
                + ", dialect=" + dialect.typeName() + "]";
    }

    /**
     * Identity of one physical server/credential pair.
     */
    public record ServerKey(Dialect dialect, String jdbcUrl, String user, String password, String charset) {
        @Override
        public String toString() {
            return user + "@" + jdbcUrl + (charset.isEmpty() ? "" : " [" + charset + "]");
        }
    }
}
