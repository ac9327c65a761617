package com.example.filedrop.access;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.NetworkInterface;
import java.net.SocketAddress;
import java.net.SocketException;
import java.net.UnknownHostException;

/**
 * Decides whether a connection comes from the machine running the hub:
 * loopback, or any address bound to one of its own interfaces. Only the
 * socket's peer address is consulted, never headers.
 */
public final class OwnerOrigin {

    private OwnerOrigin() {
    }

    public static boolean isOwner(SocketAddress remote) {
        if (remote instanceof InetSocketAddress a) {
            return isOwner(a.getAddress());
        }
        return false;
    }

    public static boolean isOwner(String ip) {
        if (ip == null || ip.isBlank()) return false;
        if (!isIpLiteral(ip)) return false;
        try {
            return isOwner(InetAddress.getByName(ip));
        } catch (UnknownHostException e) {
            return false;
        }
    }

    public static boolean isOwner(InetAddress address) {
        if (address == null) return false;
        if (address.isLoopbackAddress()) return true;
        try {
            return NetworkInterface.getByInetAddress(address) != null;
        } catch (SocketException e) {
            return false;
        }
    }

    // getByName on a hostname would hit DNS
    private static boolean isIpLiteral(String ip) {
        for (int i = 0; i < ip.length(); i++) {
            char c = ip.charAt(i);
            boolean ok = Character.digit(c, 16) >= 0 || c == '.' || c == ':' || c == '%';
            if (!ok) return false;
        }
        return true;
    }
}
