package nl.nfi.djzxcvbn.common;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.InetAddress;

public final class HostUtils {

    public static long pid() {
        return ProcessHandle.current().pid();
    }

    public static String hostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (final IOException e) {
            // e.g. no resolvable local address inside containers, ask the OS instead
            return hostnameFromProcess();
        }
    }

    private static String hostnameFromProcess() {
        try {
            final Process hostname = Runtime.getRuntime().exec(new String[]{"hostname"});
            try (final BufferedReader output = new BufferedReader(new InputStreamReader(hostname.getInputStream()))) {
                final String name = output.readLine();
                return name == null ? "localhost-" + pid() : name;
            }
        } catch (final IOException e) {
            throw new UnsupportedOperationException("Could not determine hostname", e);
        }
    }
}
