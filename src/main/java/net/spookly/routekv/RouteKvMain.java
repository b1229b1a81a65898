package net.spookly.routekv;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionException;

import ch.qos.logback.classic.Level;
import net.spookly.routekv.config.ConfigException;
import net.spookly.routekv.config.ConfigLoader;
import net.spookly.routekv.config.ConfigPrinter;
import net.spookly.routekv.config.ConfigWarnings;
import net.spookly.routekv.config.RouteKvConfig;
import net.spookly.routekv.kv.KvClients;
import net.spookly.routekv.kv.TxnResult;
import net.spookly.routekv.route.ProviderConfig;
import net.spookly.routekv.route.Route;
import net.spookly.routekv.route.RouteAuditLogger;
import net.spookly.routekv.route.RouteStore;
import net.spookly.routekv.route.RouteTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point for inspecting and editing the route table.
 */
public final class RouteKvMain {
    private static final Logger LOG = LoggerFactory.getLogger(RouteKvMain.class);
    private static final String DEFAULT_CONFIG = "config/routekv.yaml";

    private RouteKvMain() {
    }

    public static void main(String[] args) {
        int status;
        try {
            status = run(args);
        } catch (ConfigException e) {
            LOG.error(e.getMessage());
            status = 2;
        }
        if (status != 0) {
            System.exit(status);
        }
    }

    static int run(String[] args) {
        CliOptions options = parseArgs(args);
        RouteKvConfig config = ConfigLoader.load(options.configPath());
        applyLogLevel(config);
        for (String warning : ConfigWarnings.collect(config, options.configPath())) {
            LOG.warn("Config warning: {}", warning);
        }
        if (options.printEffectiveConfig()) {
            System.out.println(ConfigPrinter.toYaml(config));
            return 0;
        }
        if (options.printStaticConfig()) {
            System.out.println(ProviderConfig.toYaml(ProviderConfig.etcd(config)));
            return 0;
        }
        if (options.dryRun()) {
            System.out.println("Config OK (--dry-run).");
            return 0;
        }
        if (options.command().isEmpty()) {
            System.err.println(usage());
            return 1;
        }
        try (RouteStore store = RouteStore.fromConfig(config, KvClients.fromConfig(config), RouteAuditLogger.INSTANCE)) {
            return execute(new RouteTable(store), options.command());
        } catch (CompletionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            LOG.error("Command failed: {}", cause.getMessage(), cause);
            return 1;
        } catch (IllegalArgumentException e) {
            LOG.error("Invalid argument: {}", e.getMessage());
            return 1;
        }
    }

    private static int execute(RouteTable table, List<String> command) {
        String name = command.get(0);
        switch (name) {
            case "add": {
                requireArgs(command, 3);
                TxnResult result = table.addRoute(command.get(1), command.get(2), Map.of()).join();
                System.out.println("added " + command.get(1) + " -> " + command.get(2) + " " + result.response());
                return 0;
            }
            case "delete": {
                requireArgs(command, 2);
                TxnResult result = table.deleteRoute(command.get(1)).join();
                System.out.println(result.isNoop() ? "no such route: " + command.get(1) : "deleted " + command.get(1));
                return 0;
            }
            case "get": {
                requireArgs(command, 2);
                Optional<Route> route = table.getRoute(command.get(1)).join();
                if (route.isEmpty()) {
                    System.out.println("no such route: " + command.get(1));
                    return 1;
                }
                System.out.println(format(route.get()));
                return 0;
            }
            case "list": {
                for (Route route : table.getAllRoutes().join().values()) {
                    System.out.println(format(route));
                }
                return 0;
            }
            default:
                System.err.println("Unknown command: " + name);
                System.err.println(usage());
                return 1;
        }
    }

    private static void requireArgs(List<String> command, int count) {
        if (command.size() != count) {
            throw new ConfigException("Wrong number of arguments for " + command.get(0) + "\n" + usage());
        }
    }

    private static String format(Route route) {
        return route.routespec() + " -> " + route.target() + " " + route.data();
    }

    private static void applyLogLevel(RouteKvConfig config) {
        if (config.logging == null || config.logging.level == null) {
            return;
        }
        Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) root).setLevel(Level.toLevel(config.logging.level, Level.INFO));
        }
    }

    private static String usage() {
        return "usage: routekv [--config FILE] [--dry-run] [--print-effective-config] [--print-static-config]"
                + " [add ROUTESPEC TARGET | delete ROUTESPEC | get ROUTESPEC | list]";
    }

    static CliOptions parseArgs(String[] args) {
        Path configPath = Paths.get(DEFAULT_CONFIG);
        boolean dryRun = false;
        boolean printEffectiveConfig = false;
        boolean printStaticConfig = false;
        List<String> command = new ArrayList<>();
        if (args == null) {
            return new CliOptions(configPath, dryRun, printEffectiveConfig, printStaticConfig, command);
        }
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--config".equals(arg) || "-c".equals(arg)) {
                if (i + 1 < args.length) {
                    configPath = Paths.get(args[++i]);
                    continue;
                }
            }
            if ("--dry-run".equals(arg)) {
                dryRun = true;
                continue;
            }
            if ("--print-effective-config".equals(arg)) {
                printEffectiveConfig = true;
                continue;
            }
            if ("--print-static-config".equals(arg)) {
                printStaticConfig = true;
                continue;
            }
            command.add(arg);
        }
        return new CliOptions(configPath, dryRun, printEffectiveConfig, printStaticConfig, List.copyOf(command));
    }

    record CliOptions(Path configPath,
                      boolean dryRun,
                      boolean printEffectiveConfig,
                      boolean printStaticConfig,
                      List<String> command) {
    }
}
