package org.normharvest.vpn;

import java.io.IOException;

/**
 * The VPN manager cannot be set up: client executable missing or an invalid config list.
 */
public class VpnException extends IOException {
    public VpnException(String message) {
        super(message);
    }
}
