package com.sandcastle.session;

import com.fasterxml.jackson.core.type.TypeReference;
import com.sandcastle.core.error.ProcessCrashException;
import com.sandcastle.core.error.ValidationException;
import com.sandcastle.core.model.VariableDetail;
import com.sandcastle.core.model.VariableInfo;
import com.sandcastle.sandbox.DispatchResult;
import com.sandcastle.sandbox.ExecutionDispatcher;
import com.sandcastle.sandbox.RuntimeProtocol;
import com.sandcastle.sandbox.TimeoutClass;
import com.sandcastle.sandbox.TimeoutPolicy;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Reads the public globals of a session's runtime. Neither operation adds to
 * the execution history.
 */
@Service
public class VariableInspector {

    static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]{0,127}");

    private final SessionRegistry registry;
    private final ExecutionDispatcher dispatcher;
    private final TimeoutPolicy timeoutPolicy;

    public VariableInspector(SessionRegistry registry, ExecutionDispatcher dispatcher, TimeoutPolicy timeoutPolicy) {
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.timeoutPolicy = timeoutPolicy;
    }

    public List<VariableInfo> listVariables(String sessionId) {
        List<VariableInfo> variables = query(sessionId, RuntimeProtocol.Op.VARS, "",
                RuntimeProtocol.VARIABLES_MIME, new TypeReference<List<VariableInfo>>() {});
        return variables == null ? List.of() : variables;
    }

    /**
     * Describes one global in detail.
     *
     * @return empty when the runtime has no global of that name
     * @throws ValidationException if {@code name} is not an identifier
     */
    public Optional<VariableDetail> inspectVariable(String sessionId, String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new ValidationException("Invalid variable name: " + name);
        }
        Map<String, VariableDetail> reply = query(sessionId, RuntimeProtocol.Op.INSPECT, name,
                RuntimeProtocol.INSPECT_MIME, new TypeReference<Map<String, VariableDetail>>() {});
        return reply == null ? Optional.empty() : Optional.ofNullable(reply.get("variable"));
    }

    private <T> T query(String sessionId, RuntimeProtocol.Op op, String payload,
                        String mimeType, TypeReference<T> type) {
        return registry.withExclusive(sessionId, session -> {
            DispatchResult result = dispatcher.invoke(session.handle(), op, payload,
                    timeoutPolicy.resolve(TimeoutClass.AD_HOC, null));
            if (result.processLost()) {
                registry.markCrashed(session, result.failure());
                throw new ProcessCrashException("Runtime was lost while reading variables: " + result.failure());
            }
            return RuntimeProtocol.findStructured(
                    RuntimeProtocol.parseStdout(result.capture().stdout(), result.capture().unit()),
                    mimeType, type);
        });
    }
}
