package org.normharvest.vpn;

public enum VpnState {
    IDLE, CONNECTING, CONNECTED, DISCONNECTING
}
