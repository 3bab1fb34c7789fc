package com.skanga.dbgate.target;

import com.skanga.dbgate.config.ResourceManager;
import com.skanga.dbgate.config.TargetLists;
import com.skanga.dbgate.error.UnknownTargetException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps logical database names to connection targets. Built once at startup and read-only afterwards,
 * so lookups need no locking.
 */
public class TargetRegistry {
    private static final Logger logger = LoggerFactory.getLogger(TargetRegistry.class);

    private final Map<String, Target> targetsByName;
    private final Target defaultTarget;

    /**
     * Creates a registry over already built targets. The first target is the default; later targets
     * reusing an earlier name are ignored.
     *
     * @param targets configured targets in configuration order
     * @throws IllegalArgumentException if no target is given
     */
    public TargetRegistry(List<Target> targets) {
        if (targets == null || targets.isEmpty()) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage("config.targets.empty"));
        }
        Map<String, Target> namedTargets = new LinkedHashMap<>();
        for (Target target : targets) {
            Target existing = namedTargets.putIfAbsent(target.name(), target);
            if (existing != null) {
                logger.warn("Duplicate database name '{}' in configuration, keeping {} and ignoring {}",
                        target.name(), existing.describe(), target.describe());
            }
        }
        this.targetsByName = Collections.unmodifiableMap(namedTargets);
        this.defaultTarget = targets.get(0);
    }

    /**
     * Builds the registry from the parallel configuration lists.
     * Hosts, users and passwords are always positional. Ports and charsets given once apply to every
     * target, as does any optional list left unset. When the remaining lists disagree in length they are
     * all cut to the shortest one and a warning is logged instead of failing startup.
     *
     * @param targetLists raw lists from configuration
     * @return the registry
     * @throws IllegalArgumentException if a port is not numeric or the database type is unknown
     */
    public static TargetRegistry fromConfig(TargetLists targetLists) {
        Dialect dialect = Dialect.fromType(targetLists.dbType());

        Map<String, List<String>> positionalLists = new LinkedHashMap<>();
        positionalLists.put("DB_HOSTS", targetLists.hosts());
        positionalLists.put("DB_USERS", targetLists.users());
        positionalLists.put("DB_PASSWORDS", targetLists.passwords());
        addIfPositional(positionalLists, "DB_PORTS", targetLists.ports(), true);
        addIfPositional(positionalLists, "DB_NAMES", targetLists.names(), false);
        addIfPositional(positionalLists, "DB_CHARSETS", targetLists.charsets(), true);
        addIfPositional(positionalLists, "DB_URLS", targetLists.urls(), false);

        int targetCount = positionalLists.values().stream().mapToInt(List::size).min().orElse(0);
        boolean lengthMismatch = positionalLists.values().stream().anyMatch(list -> list.size() != targetCount);
        if (lengthMismatch) {
            StringBuilder lengthSummary = new StringBuilder();
            positionalLists.forEach((listName, listValues) -> {
                if (lengthSummary.length() > 0) {
                    lengthSummary.append(", ");
                }
                lengthSummary.append(listName).append('=').append(listValues.size());
            });
            logger.warn(ResourceManager.getErrorMessage("config.targets.length.mismatch", lengthSummary, targetCount));
        }

        List<Target> targets = new ArrayList<>();
        for (int i = 0; i < targetCount; i++) {
            String host = valueAt(targetLists.hosts(), i);
            int port = parsePort(valueAt(targetLists.ports(), i));
            String database = valueAt(targetLists.names(), i);
            String url = valueAt(targetLists.urls(), i);
            String targetName;
            if (!database.isBlank()) {
                targetName = database;
            } else if (!host.isBlank()) {
                targetName = host + ":" + port;
            } else {
                targetName = url;
            }
            targets.add(new Target(targetName, host, port, valueAt(targetLists.users(), i),
                    valueAt(targetLists.passwords(), i), database, valueAt(targetLists.charsets(), i), dialect, url));
        }

        boolean credentialsMissing = targets.stream().anyMatch(t -> t.user().isBlank() || t.password().isBlank());
        if (credentialsMissing && dialect != Dialect.H2) {
            logger.warn(ResourceManager.getErrorMessage("config.credentials.missing"));
        }

        TargetRegistry targetRegistry = new TargetRegistry(targets);
        logger.info("Configured {} database target(s): {}", targetRegistry.names().size(), targetRegistry.names());
        return targetRegistry;
    }

    /**
     * Resolves a database name to its target.
     * A blank name selects the first configured target. With a single configured target, any other
     * name selects that server with the named database, so every database on it stays reachable.
     *
     * @param databaseName logical name, may be null or blank
     * @return the target to connect to
     * @throws UnknownTargetException if several targets are configured and none has this name
     */
    public Target resolve(String databaseName) throws UnknownTargetException {
        if (databaseName == null || databaseName.isBlank()) {
            return defaultTarget;
        }
        Target namedTarget = targetsByName.get(databaseName);
        if (namedTarget != null) {
            return namedTarget;
        }
        if (targetsByName.size() == 1) {
            logger.debug("Routing database '{}' to the single configured server {}", databaseName,
                    defaultTarget.describe());
            return defaultTarget.withDatabase(databaseName);
        }
        throw new UnknownTargetException(
                ResourceManager.getErrorMessage("target.unknown", databaseName, String.join(", ", names())),
                databaseName);
    }

    public Target defaultTarget() {
        return defaultTarget;
    }

    public List<Target> targets() {
        return List.copyOf(targetsByName.values());
    }

    public List<String> names() {
        return List.copyOf(targetsByName.keySet());
    }

    /**
     * One target per distinct server and credential pair, in configuration order.
     */
    public List<Target> serverTargets() {
        Map<Target.ServerKey, Target> targetsByServer = new LinkedHashMap<>();
        for (Target target : targetsByName.values()) {
            targetsByServer.putIfAbsent(target.serverKey(), target);
        }
        return List.copyOf(targetsByServer.values());
    }

    /**
     * Configured passwords, for masking driver messages before they leave the gateway.
     */
    public List<String> secrets() {
        List<String> secretValues = new ArrayList<>();
        for (Target target : targetsByName.values()) {
            if (!target.password().isBlank()) {
                secretValues.add(target.password());
            }
        }
        return secretValues;
    }

    private static void addIfPositional(Map<String, List<String>> positionalLists, String listName,
                                        List<String> listValues, boolean broadcastSingle) {
        boolean unset = listValues.size() == 1 && listValues.get(0).isBlank();
        boolean single = listValues.size() == 1;
        if (!unset && !(broadcastSingle && single)) {
            positionalLists.put(listName, listValues);
        }
    }

    private static String valueAt(List<String> listValues, int index) {
        if (listValues.isEmpty()) {
            return "";
        }
        return listValues.size() == 1 ? listValues.get(0) : listValues.get(index);
    }

    private static int parsePort(String portText) {
        if (portText.isBlank()) {
            return 3306;
        }
        try {
            return Integer.parseInt(portText);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    ResourceManager.getErrorMessage("config.parse.integer.failed", "DB_PORTS", portText), e);
        }
    }
}
