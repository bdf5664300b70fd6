package com.tictac.server;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.logging.Logger;

public final class ServerConfig {
    private static final Logger LOGGER = Logger.getLogger(ServerConfig.class.getName());

    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 5000;
    public static final int DEFAULT_MOVE_TIMEOUT_SECONDS = 30;
    public static final int DEFAULT_BUFFER_SIZE = 1024;
    public static final String DEFAULT_LOG_DIR = "out/logs";

    static final String ENV_HOST = "TICTAC_HOST";
    static final String ENV_PORT = "TICTAC_PORT";
    static final String ENV_MOVE_TIMEOUT = "TICTAC_MOVE_TIMEOUT_SECONDS";
    static final String ENV_BUFFER_SIZE = "TICTAC_BUFFER_SIZE";
    static final String ENV_WS_PORT = "TICTAC_WS_PORT";
    static final String ENV_LOG_DIR = "TICTAC_LOG_DIR";

    private final String host;
    private final int port;
    private final Duration moveTimeout;
    private final int bufferSize;
    private final Integer webSocketPort;
    private final Path logDir;

    public ServerConfig(String host, int port, Duration moveTimeout, int bufferSize, Integer webSocketPort, Path logDir) {
        this.host = host;
        this.port = port;
        this.moveTimeout = moveTimeout;
        this.bufferSize = bufferSize;
        this.webSocketPort = webSocketPort;
        this.logDir = logDir;
    }

    public static ServerConfig defaults() {
        return fromEnvironment(Map.of());
    }

    public static ServerConfig fromEnvironment(Map<String, String> env) {
        String host = resolveString(env, ENV_HOST, DEFAULT_HOST);
        int port = resolveInt(env, ENV_PORT, DEFAULT_PORT, 0, 65535);
        int timeoutSeconds = resolveInt(env, ENV_MOVE_TIMEOUT, DEFAULT_MOVE_TIMEOUT_SECONDS, 1, Integer.MAX_VALUE);
        int bufferSize = resolveInt(env, ENV_BUFFER_SIZE, DEFAULT_BUFFER_SIZE, 1, Integer.MAX_VALUE);
        Integer wsPort = null;
        if (!isBlank(env.get(ENV_WS_PORT))) {
            int resolved = resolveInt(env, ENV_WS_PORT, -1, 0, 65535);
            wsPort = resolved >= 0 ? resolved : null;
        }
        Path logDir = Path.of(resolveString(env, ENV_LOG_DIR, DEFAULT_LOG_DIR));
        return new ServerConfig(host, port, Duration.ofSeconds(timeoutSeconds), bufferSize, wsPort, logDir);
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public Duration getMoveTimeout() {
        return moveTimeout;
    }

    public int getBufferSize() {
        return bufferSize;
    }

    /**
     * @return WebSocket listen port, or {@code null} when WebSocket clients are not accepted
     */
    public Integer getWebSocketPort() {
        return webSocketPort;
    }

    public Path getLogDir() {
        return logDir;
    }

    @Override
    public String toString() {
        return String.format("host=%s port=%d moveTimeout=%ss bufferSize=%d wsPort=%s",
                host, port, moveTimeout.toSeconds(), bufferSize, webSocketPort);
    }

    private static String resolveString(Map<String, String> env, String key, String fallback) {
        String value = env.get(key);
        if (isBlank(value)) {
            return fallback;
        }
        return value.trim();
    }

    private static int resolveInt(Map<String, String> env, String key, int fallback, int min, int max) {
        String value = env.get(key);
        if (isBlank(value)) {
            return fallback;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed < min || parsed > max) {
                LOGGER.warning(() -> String.format("%s=%s is out of range, using %d", key, value, fallback));
                return fallback;
            }
            return parsed;
        } catch (NumberFormatException ex) {
            LOGGER.warning(() -> String.format("%s=%s is not a number, using %d", key, value, fallback));
            return fallback;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
