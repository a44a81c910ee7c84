package net.spookly.hostpilot.availability;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * Reachability score for one host, 1.0 meaning no observed failures.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public final class HostScore {
    private final String host;
    private final double score;
}
