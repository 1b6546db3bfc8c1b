package com.sandcastle.core.security;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Builds the environment handed to runtime processes.
 * <p>
 * {@link #sanitize(Map)} is a pure function: the same input always yields the
 * same output and nothing outside the argument is consulted. Denylisted names
 * are matched case-insensitively against the whole variable name, or against
 * the start of it for the prefix families. A name that merely contains a
 * denied name somewhere inside it is kept. Allowlisted names are matched
 * exactly and always survive.
 * <p>
 * The service's own configuration ({@code SANDCASTLE_*}, {@code SPRING_*})
 * is denied as a family: it carries the blob signing secret.
 */
@Service
public class EnvironmentSanitizer {

    static final List<String> DEFAULT_DENIED = List.of(
            "AWS_ACCESS_KEY_ID",
            "AWS_SECRET_ACCESS_KEY",
            "AWS_SESSION_TOKEN",
            "AWS_SECURITY_TOKEN",
            "AWS_LAMBDA_FUNCTION_NAME",
            "AWS_LAMBDA_FUNCTION_VERSION",
            "AWS_LAMBDA_LOG_GROUP_NAME",
            "AWS_LAMBDA_LOG_STREAM_NAME",
            "AWS_LAMBDA_FUNCTION_MEMORY_SIZE",
            "_AWS_XRAY_DAEMON_ADDRESS",
            "_AWS_XRAY_DAEMON_PORT",
            "_X_AMZN_TRACE_ID"
    );

    static final List<String> DENIED_PREFIXES = List.of(
            "AWS_LAMBDA_",
            "_AWS_XRAY_",
            "AWS_CONTAINER_CREDENTIALS_",
            "SANDCASTLE_",
            "SPRING_"
    );

    static final List<String> DEFAULT_ALLOWED = List.of(
            "PATH", "HOME", "LANG", "LANGUAGE", "LC_ALL", "LC_CTYPE", "TZ", "TMPDIR",
            "PYTHONPATH", "PYTHONHOME", "NODE_PATH", "MPLBACKEND",
            "LAMBDA_TASK_ROOT", "LAMBDA_RUNTIME_DIR"
    );

    private final Set<String> deniedUpper;
    private final Set<String> allowed;

    @Autowired
    public EnvironmentSanitizer(SecurityProperties securityProperties) {
        this(securityProperties.getExtraDeniedVariables(), securityProperties.getExtraAllowedVariables());
    }

    public EnvironmentSanitizer(Collection<String> extraDenied, Collection<String> extraAllowed) {
        var denied = new LinkedHashSet<String>();
        DEFAULT_DENIED.forEach(name -> denied.add(name.toUpperCase(Locale.ROOT)));
        extraDenied.forEach(name -> denied.add(name.toUpperCase(Locale.ROOT)));
        this.deniedUpper = Set.copyOf(denied);

        var allow = new LinkedHashSet<String>(DEFAULT_ALLOWED);
        allow.addAll(extraAllowed);
        this.allowed = Set.copyOf(allow);
    }

    /**
     * Returns a new map holding every allowlisted entry of {@code env} plus
     * every entry whose name is not denied. Iteration order is by name.
     */
    public Map<String, String> sanitize(Map<String, String> env) {
        var result = new TreeMap<String, String>();
        for (var entry : env.entrySet()) {
            String name = entry.getKey();
            if (allowed.contains(name) || !isDenied(name)) {
                result.put(name, entry.getValue());
            }
        }
        return result;
    }

    /**
     * Names from {@code env} that {@link #sanitize(Map)} would drop.
     */
    public Set<String> withheld(Map<String, String> env) {
        var names = new TreeSet<String>();
        for (String name : env.keySet()) {
            if (!allowed.contains(name) && isDenied(name)) {
                names.add(name);
            }
        }
        return names;
    }

    public boolean isDenied(String name) {
        String upper = name.toUpperCase(Locale.ROOT);
        if (deniedUpper.contains(upper)) {
            return true;
        }
        for (String prefix : DENIED_PREFIXES) {
            if (upper.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    Set<String> deniedNames() {
        return deniedUpper;
    }
}
