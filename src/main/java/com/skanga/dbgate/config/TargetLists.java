package com.skanga.dbgate.config;

import java.util.List;

/**
 * Raw, still unparsed parallel target lists as read from configuration.
 * Index {@code i} of every list describes target {@code i}; reconciling lists of
 * different lengths is the job of {@link com.skanga.dbgate.target.TargetRegistry}.
 *
 * @param hosts     DB_HOSTS entries
 * @param ports     DB_PORTS entries (numeric text)
 * @param users     DB_USERS entries
 * @param passwords DB_PASSWORDS entries
 * @param names     DB_NAMES entries, also used as target names
 * @param charsets  DB_CHARSETS entries, blank for the driver default
 * @param urls      DB_URLS entries, blank unless a JDBC URL override is wanted
 * @param dbType    DB_TYPE, selects the dialect for every target
 */
public record TargetLists(List<String> hosts, List<String> ports, List<String> users, List<String> passwords,
                          List<String> names, List<String> charsets, List<String> urls, String dbType) {
    public TargetLists {
        hosts = List.copyOf(hosts);
        ports = List.copyOf(ports);
        users = List.copyOf(users);
        passwords = List.copyOf(passwords);
        names = List.copyOf(names);
        charsets = List.copyOf(charsets);
        urls = List.copyOf(urls);
        if (dbType == null || dbType.isBlank()) {
            dbType = "mariadb";
        }
    }

    /**
     * Convenience factory for a single target.
     */
    public static TargetLists single(String dbType, String host, int port, String user, String password,
                                     String database, String charset, String url) {
        return new TargetLists(List.of(host), List.of(String.valueOf(port)), List.of(nullToEmpty(user)),
                List.of(nullToEmpty(password)), List.of(nullToEmpty(database)), List.of(nullToEmpty(charset)),
                List.of(nullToEmpty(url)), dbType);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
