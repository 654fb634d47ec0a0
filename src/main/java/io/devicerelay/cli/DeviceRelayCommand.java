package io.devicerelay.cli;

import io.devicerelay.config.DeviceRelayConfig;
import io.devicerelay.http.RelayApiServer;
import io.devicerelay.runtime.DeviceRelayRuntime;
import io.devicerelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

@Command(
        name = "devicerelay",
        mixinStandardHelpOptions = true,
        description = "Safety-graded command relay for paired devices",
        subcommands = {
                DeviceRelayCommand.InitCommand.class,
                DeviceRelayCommand.ServeCommand.class,
                DeviceRelayCommand.PairCodeCommand.class,
                DeviceRelayCommand.SendCommand.class,
                DeviceRelayCommand.ConfirmCommand.class,
                DeviceRelayCommand.RejectCommand.class,
                DeviceRelayCommand.CancelCommand.class,
                DeviceRelayCommand.ResultCommand.class,
                DeviceRelayCommand.LogCommand.class,
                DeviceRelayCommand.RecentCommand.class,
                DeviceRelayCommand.DevicesCommand.class,
                DeviceRelayCommand.CreditsCommand.class,
                DeviceRelayCommand.MaintenanceCommand.class
        }
)
public final class DeviceRelayCommand implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(DeviceRelayCommand.class);

    @Option(names = {"--root"}, description = "Data root directory", defaultValue = DeviceRelayConfig.DEFAULT_ROOT)
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | serve | pair-code | send | confirm | reject | cancel | result | log | recent | devices | credits | maintenance");
    }

    DeviceRelayRuntime runtime() {
        return DeviceRelayRuntime.open(DeviceRelayConfig.fromRoot(root));
    }

    @Command(name = "init", description = "Create the data root and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        DeviceRelayCommand parent;

        @Override
        public Integer call() {
            parent.runtime();
            System.out.println("Initialized device relay at: " + DeviceRelayConfig.fromRoot(parent.root).rootDir());
            return 0;
        }
    }

    @Command(name = "serve", description = "Serve the device API and run periodic maintenance")
    static final class ServeCommand implements Callable<Integer> {
        @ParentCommand
        DeviceRelayCommand parent;

        @Option(names = {"--host"}, defaultValue = "0.0.0.0", description = "Bind address")
        String host;

        @Option(names = {"--port"}, defaultValue = "8787", description = "Bind port")
        int port;

        @Option(names = {"--maintenance-interval-ms"}, defaultValue = "60000",
                description = "Interval between expiry and offline sweeps")
        long maintenanceIntervalMs;

        @Override
        public Integer call() throws Exception {
            DeviceRelayRuntime runtime = parent.runtime();
            RelayApiServer server = new RelayApiServer(runtime.delivery(), runtime.settings());
            int bound = server.start(host, port);
            ScheduledExecutorService maintenance = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "relay-maintenance");
                t.setDaemon(true);
                return t;
            });
            long interval = Math.max(1_000L, maintenanceIntervalMs);
            maintenance.scheduleWithFixedDelay(() -> {
                try {
                    runtime.runMaintenance();
                } catch (RuntimeException e) {
                    log.error("Maintenance sweep failed", e);
                }
            }, interval, interval, TimeUnit.MILLISECONDS);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                maintenance.shutdownNow();
                server.stop();
            }, "relay-shutdown"));
            System.out.println("Device relay API listening on http://" + host + ":" + bound + "/api/relay");
            Thread.currentThread().join();
            return 0;
        }
    }

    @Command(name = "pair-code", description = "Issue a one-time pairing code for a user")
    static final class PairCodeCommand implements Callable<Integer> {
        @ParentCommand
        DeviceRelayCommand parent;

        @Option(names = {"--user"}, required = true, description = "Operator user id")
        String userId;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().createPairingCode(userId)));
            return 0;
        }
    }

    @Command(name = "send", description = "Parse, grade and queue a command for a device")
    static final class SendCommand implements Callable<Integer> {
        @ParentCommand
        DeviceRelayCommand parent;

        @Option(names = {"--user"}, required = true, description = "Operator user id")
        String userId;

        @Option(names = {"--device"}, required = true, description = "Target device name")
        String deviceName;

        @Option(names = {"--priority"}, defaultValue = "0", description = "Higher runs first")
        int priority;

        @Parameters(arity = "1..*", paramLabel = "TEXT", description = "Command text")
        String[] text;

        @Override
        public Integer call() {
            DeviceRelayRuntime.SendOutcome out = parent.runtime()
                    .send(userId, deviceName, String.join(" ", text), priority);
            System.out.println(Jsons.toJson(out));
            return out.success() ? 0 : 1;
        }
    }

    @Command(name = "confirm", description = "Confirm a command awaiting confirmation")
    static final class ConfirmCommand implements Callable<Integer> {
        @ParentCommand
        DeviceRelayCommand parent;

        @Option(names = {"--user"}, required = true, description = "Operator user id")
        String userId;

        @Parameters(index = "0", paramLabel = "ID", description = "Command id or prefix (at least 4 characters)")
        String id;

        @Override
        public Integer call() {
            DeviceRelayRuntime.ActionOutcome out = parent.runtime().confirm(id, userId);
            System.out.println(Jsons.toJson(out));
            return out.success() ? 0 : 1;
        }
    }

    @Command(name = "reject", description = "Reject a command awaiting confirmation and refund it")
    static final class RejectCommand implements Callable<Integer> {
        @ParentCommand
        DeviceRelayCommand parent;

        @Option(names = {"--user"}, required = true, description = "Operator user id")
        String userId;

        @Parameters(index = "0", paramLabel = "ID", description = "Command id or prefix (at least 4 characters)")
        String id;

        @Override
        public Integer call() {
            DeviceRelayRuntime.ActionOutcome out = parent.runtime().reject(id, userId);
            System.out.println(Jsons.toJson(out));
            return out.success() ? 0 : 1;
        }
    }

    @Command(name = "cancel", description = "Cancel a queued command")
    static final class CancelCommand implements Callable<Integer> {
        @ParentCommand
        DeviceRelayCommand parent;

        @Option(names = {"--user"}, required = true, description = "Operator user id")
        String userId;

        @Parameters(index = "0", paramLabel = "ID", description = "Command id or prefix (at least 4 characters)")
        String id;

        @Override
        public Integer call() {
            DeviceRelayRuntime.ActionOutcome out = parent.runtime().cancel(id, userId);
            System.out.println(Jsons.toJson(out));
            return out.success() ? 0 : 1;
        }
    }

    @Command(name = "result", description = "Show a command's status and result")
    static final class ResultCommand implements Callable<Integer> {
        @ParentCommand
        DeviceRelayCommand parent;

        @Option(names = {"--user"}, required = true, description = "Operator user id")
        String userId;

        @Parameters(index = "0", paramLabel = "ID", description = "Command id or prefix")
        String id;

        @Override
        public Integer call() {
            Optional<DeviceRelayRuntime.CommandResultView> out = parent.runtime().getCommandResult(id, userId);
            if (out.isEmpty()) {
                System.out.println(Jsons.toJson(Map.of("error", "not_found", "id", id)));
                return 1;
            }
            System.out.println(Jsons.toJson(out.get()));
            return 0;
        }
    }

    @Command(name = "log", description = "Show a command's execution log")
    static final class LogCommand implements Callable<Integer> {
        @ParentCommand
        DeviceRelayCommand parent;

        @Option(names = {"--user"}, required = true, description = "Operator user id")
        String userId;

        @Option(names = {"--text"}, defaultValue = "false", description = "Print the chat-formatted text instead of JSON")
        boolean text;

        @Parameters(index = "0", paramLabel = "ID", description = "Command id or prefix")
        String id;

        @Override
        public Integer call() {
            Optional<DeviceRelayRuntime.ExecutionLogView> out = parent.runtime().getExecutionLog(id, userId);
            if (out.isEmpty()) {
                System.out.println(Jsons.toJson(Map.of("error", "not_found", "id", id)));
                return 1;
            }
            System.out.println(text ? out.get().text() : Jsons.toJson(out.get()));
            return 0;
        }
    }

    @Command(name = "recent", description = "List a user's most recent commands")
    static final class RecentCommand implements Callable<Integer> {
        @ParentCommand
        DeviceRelayCommand parent;

        @Option(names = {"--user"}, required = true, description = "Operator user id")
        String userId;

        @Option(names = {"--limit"}, defaultValue = "10", description = "Max rows")
        int limit;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().getRecentCommands(userId, limit)));
            return 0;
        }
    }

    @Command(name = "devices", description = "List or remove a user's paired devices")
    static final class DevicesCommand implements Callable<Integer> {
        @ParentCommand
        DeviceRelayCommand parent;

        @Option(names = {"--user"}, required = true, description = "Operator user id")
        String userId;

        @Option(names = {"--remove"}, description = "Remove the device with this name and cancel its queue")
        String remove;

        @Override
        public Integer call() {
            DeviceRelayRuntime runtime = parent.runtime();
            if (remove != null && !remove.isBlank()) {
                boolean removed = runtime.removeDevice(userId, remove);
                System.out.println(Jsons.toJson(Map.of("success", removed, "deviceName", remove)));
                return removed ? 0 : 1;
            }
            System.out.println(Jsons.toJson(runtime.listDevices(userId)));
            return 0;
        }
    }

    @Command(name = "credits", description = "Show or grant a user's credits")
    static final class CreditsCommand implements Callable<Integer> {
        @ParentCommand
        DeviceRelayCommand parent;

        @Option(names = {"--user"}, required = true, description = "Operator user id")
        String userId;

        @Option(names = {"--grant"}, defaultValue = "0", description = "Credits to add")
        int grant;

        @Override
        public Integer call() {
            DeviceRelayRuntime runtime = parent.runtime();
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("userId", userId);
            out.put("balance", grant > 0 ? runtime.grantCredits(userId, grant) : runtime.balance(userId));
            out.put("usage", runtime.usageStats(userId));
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "maintenance", description = "Expire overdue commands and mark silent devices offline")
    static final class MaintenanceCommand implements Callable<Integer> {
        @ParentCommand
        DeviceRelayCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().runMaintenance()));
            return 0;
        }
    }
}
