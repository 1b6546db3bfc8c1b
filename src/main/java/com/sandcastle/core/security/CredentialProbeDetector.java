package com.sandcastle.core.security;

import com.sandcastle.core.error.SecurityViolationException;
import com.sandcastle.core.metrics.SandcastleMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Flags submitted code that tries to read withheld environment variables or
 * the environment of other processes. The sanitizer already keeps the values
 * out of the runtime; this only makes the attempt visible and, when
 * configured, refuses it.
 */
@Service
public class CredentialProbeDetector {

    private static final Logger log = LoggerFactory.getLogger(CredentialProbeDetector.class);

    private static final Pattern PROC_ENVIRON = Pattern.compile("/proc/[^\\s'\"]*/?environ");

    private final EnvironmentSanitizer sanitizer;
    private final SandcastleMetrics metrics;
    private final boolean block;

    public CredentialProbeDetector(EnvironmentSanitizer sanitizer, SandcastleMetrics metrics,
                                   SecurityProperties securityProperties) {
        this.sanitizer = sanitizer;
        this.metrics = metrics;
        this.block = securityProperties.isBlockCredentialProbes();
    }

    /**
     * Returns the withheld names the code references, sorted, followed by any
     * /proc environ read. Empty when clean.
     */
    public List<String> scan(String code) {
        var findings = new ArrayList<String>();
        String upper = code.toUpperCase(Locale.ROOT);
        for (String name : new TreeSet<>(sanitizer.deniedNames())) {
            if (upper.contains(name)) {
                findings.add(name);
            }
        }
        for (String prefix : EnvironmentSanitizer.DENIED_PREFIXES) {
            if (upper.contains(prefix) && findings.stream().noneMatch(f -> f.startsWith(prefix))) {
                findings.add(prefix + "*");
            }
        }
        if (PROC_ENVIRON.matcher(code).find()) {
            findings.add("/proc/*/environ");
        }
        return findings;
    }

    /**
     * Scans the code, records any finding, and throws when blocking is enabled.
     *
     * @throws SecurityViolationException if probes are blocked and the code contains one
     */
    public void inspect(String sessionId, String code) {
        List<String> findings = scan(code);
        if (findings.isEmpty()) {
            return;
        }
        log.warn("Session {} submitted code referencing withheld environment: {}", sessionId, findings);
        metrics.recordCredentialProbe(block);
        if (block) {
            throw new SecurityViolationException("Code references withheld environment: " + findings);
        }
    }
}
