package org.normharvest.vpn;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.jetbrains.annotations.Nullable;
import org.normharvest.util.jackson.DurationDeserializer;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * VPN egress configuration.
 *
 * @param executable         OpenVPN client binary, found on the PATH when null
 * @param configFiles        .ovpn files to rotate through
 * @param defaultCredentials credentials for configs without an entry in {@code credentials}
 * @param credentials        per-config credentials keyed by config name (file name without extension)
 * @param queueOrder         initial rotation order
 * @param stabilityWindow    how long a new client process must stay alive to count as connected
 * @param killTimeout        how long to wait for a graceful exit before killing the client
 */
public record VpnConfig(
        @Nullable String executable,
        List<String> configFiles,
        @Nullable Credentials defaultCredentials,
        Map<String, Credentials> credentials,
        QueueOrder queueOrder,
        @JsonDeserialize(using = DurationDeserializer.class) Duration stabilityWindow,
        @JsonDeserialize(using = DurationDeserializer.class) Duration killTimeout
) {
    public enum QueueOrder {
        sorted, random
    }

    @JsonCreator
    public VpnConfig {
        if (configFiles == null) configFiles = List.of();
        if (credentials == null) credentials = Map.of();
        if (queueOrder == null) queueOrder = QueueOrder.random;
        if (stabilityWindow == null) stabilityWindow = Duration.ofSeconds(15);
        if (killTimeout == null) killTimeout = Duration.ofSeconds(5);
    }

    public VpnConfig() {
        this(null, null, null, null, null, null, null);
    }

    @JsonIgnore
    public boolean isConfigured() {
        return !configFiles.isEmpty();
    }
}
