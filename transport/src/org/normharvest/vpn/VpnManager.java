package org.normharvest.vpn;

import org.jetbrains.annotations.Nullable;
import org.normharvest.http.EgressRotator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

import static java.lang.ProcessBuilder.Redirect.PIPE;

/**
 * Rotates the machine's egress IP by cycling OpenVPN client processes through a fixed set of configs.
 * <p>
 * Configs are kept in least-recently-used order: the head of {@link #connectionQueue()} is the next
 * connection to use and every successful connect moves that config to the tail. At most one managed
 * connection is up after {@link #changeVpnConnection()}.
 */
public class VpnManager implements EgressRotator, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(VpnManager.class);
    private static final List<String> OPENVPN_EXECUTABLES = List.of(
            "/usr/sbin/openvpn",
            "/usr/local/sbin/openvpn",
            "/opt/homebrew/sbin/openvpn",
            "C:\\Program Files\\OpenVPN\\bin\\openvpn.exe",
            "C:\\Program Files (x86)\\OpenVPN\\bin\\openvpn.exe");
    private static final Duration FORCED_KILL_TIMEOUT = Duration.ofSeconds(2);
    private static final Duration EARLY_EXIT_CHECK = Duration.ofSeconds(1);
    private static final Duration POLL_INTERVAL = Duration.ofMillis(500);

    private final String executable;
    private final Map<String, Path> configs = new LinkedHashMap<>();
    private final Map<String, Credentials> credentials;
    private final @Nullable Credentials defaultCredentials;
    private final Duration stabilityWindow;
    private final Duration killTimeout;
    private final Deque<String> queue = new ArrayDeque<>();
    private final Map<String, ProcessHandle> processes = new ConcurrentHashMap<>();
    private final Map<String, VpnState> states = new ConcurrentHashMap<>();
    private final AtomicLong generation = new AtomicLong();
    private volatile boolean lastRotationConnected;
    private final Path credentialDir = Path.of(System.getProperty("java.io.tmpdir"));

    public VpnManager(VpnConfig config) throws VpnException {
        this.executable = config.executable() != null ? checkExecutable(config.executable()) : findExecutable();
        this.credentials = Map.copyOf(config.credentials());
        this.defaultCredentials = config.defaultCredentials();
        this.stabilityWindow = config.stabilityWindow();
        this.killTimeout = config.killTimeout();

        for (String file : config.configFiles()) {
            Path path = Path.of(file).toAbsolutePath().normalize();
            if (!Files.isRegularFile(path)) {
                throw new VpnException("OpenVPN config file not found: " + path);
            }
            String name = configName(path);
            if (configs.putIfAbsent(name, path) != null) {
                throw new VpnException("Duplicate OpenVPN config name: " + name);
            }
            states.put(name, VpnState.IDLE);
        }
        if (configs.isEmpty()) {
            log.warn("No OpenVPN config files given, egress rotation will always fail");
        }

        List<String> names = new ArrayList<>(configs.keySet());
        if (config.queueOrder() == VpnConfig.QueueOrder.random) {
            Collections.shuffle(names);
        } else {
            Collections.sort(names);
        }
        queue.addAll(names);
        log.info("VPN manager ready with {} configs using {}", configs.size(), executable);
    }

    static String configName(Path path) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    private static String checkExecutable(String executable) throws VpnException {
        if (!Files.isExecutable(Path.of(executable))) {
            throw new VpnException("OpenVPN executable not found or not executable: " + executable);
        }
        return executable;
    }

    private static String findExecutable() throws VpnException {
        String pathEnv = System.getenv("PATH");
        if (pathEnv != null) {
            for (String dir : pathEnv.split(java.io.File.pathSeparator)) {
                if (dir.isEmpty()) continue;
                for (String name : List.of("openvpn", "openvpn.exe")) {
                    Path candidate = Path.of(dir, name);
                    if (Files.isExecutable(candidate)) return candidate.toString();
                }
            }
        }
        for (String candidate : OPENVPN_EXECUTABLES) {
            if (Files.isExecutable(Path.of(candidate))) return candidate;
        }
        throw new VpnException("Couldn't find the OpenVPN executable. Install OpenVPN or set vpn.executable");
    }

    /**
     * Switches egress: disconnects every managed connection and connects the least recently used config.
     *
     * @return true if the new connection came up
     */
    public synchronized boolean changeVpnConnection() {
        String next;
        synchronized (queue) {
            next = queue.peekFirst();
        }
        if (next == null) {
            log.error("No OpenVPN configs available to rotate to");
            return false;
        }
        log.info("Changing VPN connection to {}", next);
        disconnectAll();
        boolean connected = connect(next);
        lastRotationConnected = connected;
        generation.incrementAndGet();
        return connected;
    }

    @Override
    public boolean rotate() {
        return changeVpnConnection();
    }

    /**
     * Rotates unless another caller already did so after {@code seenGeneration} was read. Workers that hit
     * the same block page together then cause a single rotation.
     *
     * @return true if a new connection is in place, whoever made it
     */
    @Override
    public synchronized boolean rotate(long seenGeneration) {
        long current = generation.get();
        if (current != seenGeneration) {
            log.debug("Egress already rotated (generation {} -> {}), not rotating again", seenGeneration, current);
            return lastRotationConnected;
        }
        return changeVpnConnection();
    }

    @Override
    public long generation() {
        return generation.get();
    }

    /**
     * Starts the OpenVPN client for the named config, or adopts an already running client for it.
     *
     * @return true once the client has stayed alive through the stability window
     */
    public synchronized boolean connect(String name) {
        Path configPath = configs.get(name);
        if (configPath == null) {
            log.error("Unknown OpenVPN config: {}", name);
            return false;
        }

        Optional<ProcessHandle> existing = runningProcess(name);
        if (existing.isPresent()) {
            log.info("OpenVPN {} is already running (pid {})", name, existing.get().pid());
            processes.put(name, existing.get());
            states.put(name, VpnState.CONNECTED);
            markUsed(name);
            return true;
        }

        states.put(name, VpnState.CONNECTING);
        Path credentialFile = null;
        Process process = null;
        try {
            var command = new ArrayList<>(List.of(executable, "--config", configPath.toString()));
            Credentials creds = credentials.getOrDefault(name, defaultCredentials);
            if (creds != null) {
                credentialFile = writeCredentials(credentialDir, name, creds);
                command.add("--auth-user-pass");
                command.add(credentialFile.toString());
            }
            log.info("Connecting OpenVPN {}", name);
            process = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .redirectOutput(PIPE)
                    .start();
            pipeOutput(name, process);

            if (!awaitStable(process)) {
                log.error("OpenVPN {} exited during startup (exit code {})", name, process.exitValue());
                states.put(name, VpnState.IDLE);
                return false;
            }
            processes.put(name, process.toHandle());
            states.put(name, VpnState.CONNECTED);
            markUsed(name);
            log.info("OpenVPN {} connected (pid {})", name, process.pid());
            return true;
        } catch (IOException e) {
            log.error("Error starting OpenVPN {}", name, e);
            if (process != null) process.destroyForcibly();
            states.put(name, VpnState.IDLE);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (process != null) process.destroyForcibly();
            states.put(name, VpnState.IDLE);
            return false;
        } finally {
            if (credentialFile != null) {
                try {
                    Files.deleteIfExists(credentialFile);
                } catch (IOException e) {
                    log.warn("Couldn't delete credential file {}", credentialFile, e);
                }
            }
        }
    }

    private boolean awaitStable(Process process) throws InterruptedException {
        long deadline = System.nanoTime() + stabilityWindow.toNanos();
        long earlyCheck = Math.min(EARLY_EXIT_CHECK.toMillis(), stabilityWindow.toMillis());
        if (process.waitFor(earlyCheck, TimeUnit.MILLISECONDS)) return false;
        long poll = Math.min(POLL_INTERVAL.toMillis(), Math.max(1, stabilityWindow.toMillis()));
        while (System.nanoTime() < deadline) {
            if (process.waitFor(poll, TimeUnit.MILLISECONDS)) return false;
        }
        return process.isAlive();
    }

    static Path writeCredentials(Path directory, String name, Credentials creds) throws IOException {
        Path file = Files.createTempFile(directory, "ovpn_cred_" + name + "_", ".txt");
        try {
            try {
                Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-------"));
            } catch (UnsupportedOperationException e) {
                // not a POSIX filesystem
            }
            Files.writeString(file, creds.username() + "\n" + creds.password() + "\n", StandardCharsets.UTF_8);
            return file;
        } catch (IOException | RuntimeException e) {
            try {
                Files.deleteIfExists(file);
            } catch (IOException deleteFailure) {
                e.addSuppressed(deleteFailure);
            }
            throw e;
        }
    }

    private static void pipeOutput(String name, Process process) {
        var thread = new Thread(() -> {
            try (var reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                reader.lines().forEach(line -> log.debug("[{}] {}", name, line));
            } catch (IOException | java.io.UncheckedIOException e) {
                log.debug("OpenVPN {} output closed: {}", name, e.getMessage());
            }
        }, "OpenVPN-" + name);
        thread.setDaemon(true);
        thread.start();
    }

    /**
     * Stops the client for the named config. A config with no running client counts as disconnected.
     *
     * @return false if the client could not be stopped
     */
    public synchronized boolean disconnect(String name) {
        if (!configs.containsKey(name)) {
            log.error("Unknown OpenVPN config: {}", name);
            return false;
        }
        ProcessHandle handle = processes.remove(name);
        if (handle == null || !handle.isAlive()) {
            handle = findProcess(configs.get(name)).orElse(null);
        }
        if (handle == null) {
            states.put(name, VpnState.IDLE);
            return true;
        }

        states.put(name, VpnState.DISCONNECTING);
        log.info("Disconnecting OpenVPN {} (pid {})", name, handle.pid());
        try {
            handle.destroy();
            try {
                handle.onExit().get(killTimeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                log.warn("OpenVPN {} didn't exit within {}, killing it", name, killTimeout);
                handle.destroyForcibly();
                handle.onExit().get(FORCED_KILL_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
            }
            states.put(name, VpnState.IDLE);
            return true;
        } catch (TimeoutException | ExecutionException e) {
            log.error("Couldn't stop OpenVPN {} (pid {})", name, handle.pid(), e);
            processes.put(name, handle);
            states.put(name, VpnState.CONNECTED);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            processes.put(name, handle);
            states.put(name, VpnState.CONNECTED);
            return false;
        }
    }

    /**
     * Disconnects every managed config in name order.
     *
     * @return the outcome per config name
     */
    public synchronized Map<String, Boolean> disconnectAll() {
        var results = new TreeMap<String, Boolean>();
        for (String name : new TreeSet<>(configs.keySet())) {
            results.put(name, disconnect(name));
        }
        return results;
    }

    private Optional<ProcessHandle> runningProcess(String name) {
        ProcessHandle tracked = processes.get(name);
        if (tracked != null && tracked.isAlive()) return Optional.of(tracked);
        return findProcess(configs.get(name));
    }

    /**
     * Finds a live process started with {@code --config} pointing at the given file, including
     * clients this manager didn't start.
     */
    static Optional<ProcessHandle> findProcess(Path configPath) {
        String path = configPath.toString();
        String altPath = path.replace('\\', '/');
        long self = ProcessHandle.current().pid();
        return ProcessHandle.allProcesses()
                .filter(p -> p.pid() != self && p.isAlive())
                .filter(p -> {
                    String commandLine = commandLine(p);
                    return commandLine.contains("--config")
                           && (commandLine.contains(path) || commandLine.contains(altPath));
                })
                .findFirst();
    }

    private static String commandLine(ProcessHandle process) {
        var info = process.info();
        Optional<String> commandLine = info.commandLine();
        if (commandLine.isPresent()) return commandLine.get();
        return info.command().orElse("") + " " + String.join(" ", info.arguments().orElse(new String[0]));
    }

    private void markUsed(String name) {
        synchronized (queue) {
            queue.remove(name);
            queue.addLast(name);
        }
    }

    /**
     * Config names in rotation order, next to be used first.
     */
    public List<String> connectionQueue() {
        synchronized (queue) {
            return List.copyOf(queue);
        }
    }

    public VpnState state(String name) {
        return states.getOrDefault(name, VpnState.IDLE);
    }

    public Set<String> managedConfigs() {
        return Collections.unmodifiableSet(configs.keySet());
    }

    public boolean isConnected(String name) {
        return runningProcess(name).isPresent();
    }

    @Override
    public void close() {
        Map<String, Boolean> results = disconnectAll();
        results.forEach((name, ok) -> {
            if (!ok) log.warn("OpenVPN {} is still running", name);
        });
    }
}
