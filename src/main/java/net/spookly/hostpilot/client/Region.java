package net.spookly.hostpilot.client;

import java.util.Arrays;
import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * Named deployment region: its default hosts and the region used in HMAC credential scopes.
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
@ToString
public final class Region {
    private final String name;
    private final List<String> hosts;
    private final String credentialRegion;

    public Region(String name, List<String> hosts, String credentialRegion) {
        this.name = name;
        this.hosts = hosts == null ? List.of() : List.copyOf(hosts);
        this.credentialRegion = credentialRegion;
    }

    public static Region of(String name, String credentialRegion, String... hosts) {
        return new Region(name, Arrays.asList(hosts), credentialRegion);
    }
}
