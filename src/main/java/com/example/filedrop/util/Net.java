package com.example.filedrop.util;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.NetworkInterface;
import java.net.SocketAddress;
import java.net.SocketException;
import java.util.Collections;

public final class Net {

    private Net() {
    }

    /**
     * Best private IPv4 address of this host: 192.168/16, then 10/8, then
     * 172.16/12. Falls back to 127.0.0.1.
     */
    public static String lanIp() {
        String best = null;
        int bestScore = 0;
        try {
            for (NetworkInterface nic : Collections.list(NetworkInterface.getNetworkInterfaces())) {
                if (!nic.isUp() || nic.isLoopback()) continue;
                for (InetAddress addr : Collections.list(nic.getInetAddresses())) {
                    if (!(addr instanceof Inet4Address)) continue;
                    String ip = addr.getHostAddress();
                    int score = scoreIp(ip);
                    if (score > bestScore) {
                        best = ip;
                        bestScore = score;
                    }
                }
            }
        } catch (SocketException e) {
            System.err.println("Cannot enumerate interfaces: " + e.getMessage());
        }
        return best != null ? best : "127.0.0.1";
    }

    static int scoreIp(String ip) {
        if (ip.startsWith("192.168.")) return 3;
        if (ip.startsWith("10.")) return 2;
        if (ip.startsWith("172.")) {
            String[] parts = ip.split("\\.");
            try {
                int second = Integer.parseInt(parts[1]);
                if (second >= 16 && second <= 31) return 1;
            } catch (NumberFormatException | ArrayIndexOutOfBoundsException e) {
                return 0;
            }
        }
        return 0;
    }

    public static String formatRemote(SocketAddress remote) {
        if (remote == null) return "unknown";
        if (remote instanceof InetSocketAddress a && a.getAddress() != null) {
            return a.getAddress().getHostAddress() + ":" + a.getPort();
        }
        return String.valueOf(remote);
    }
}
