package com.sandcastle.dispatch.api;

import com.sandcastle.core.error.ValidationException;
import com.sandcastle.core.model.ExecutionRecord;
import com.sandcastle.core.model.InstallResult;
import com.sandcastle.core.model.SessionInfo;
import com.sandcastle.core.model.VariableDetail;
import com.sandcastle.core.model.VariableInfo;
import com.sandcastle.session.PackageInstaller;
import com.sandcastle.session.Session;
import com.sandcastle.session.SessionRegistry;
import com.sandcastle.session.VariableInspector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for session lifecycle, execution and workspace operations.
 */
@RestController
@RequestMapping("/api/v1/sessions")
public class SessionController {

    private static final Logger log = LoggerFactory.getLogger(SessionController.class);

    private final SessionRegistry sessionRegistry;
    private final PackageInstaller packageInstaller;
    private final VariableInspector variableInspector;

    public SessionController(SessionRegistry sessionRegistry,
                             PackageInstaller packageInstaller,
                             VariableInspector variableInspector) {
        this.sessionRegistry = sessionRegistry;
        this.packageInstaller = packageInstaller;
        this.variableInspector = variableInspector;
    }

    /**
     * POST /api/v1/sessions: Start a session with its own runtime.
     */
    @PostMapping
    public ResponseEntity<Map<String, String>> createSession(
            @RequestBody(required = false) CreateSessionRequest request) {
        String sessionId = sessionRegistry.create(request != null ? request.name() : null);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("session_id", sessionId));
    }

    /**
     * GET /api/v1/sessions: All sessions, oldest first. Crashed sessions stay listed until closed.
     */
    @GetMapping
    public ResponseEntity<Map<String, List<SessionInfo>>> listSessions() {
        return ResponseEntity.ok(Map.of("sessions", sessionRegistry.list()));
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<SessionInfo> getSession(@PathVariable String sessionId) {
        return ResponseEntity.ok(sessionRegistry.get(sessionId).info());
    }

    /**
     * DELETE /api/v1/sessions/{id}: Terminate the runtime and discard the workspace.
     */
    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> closeSession(@PathVariable String sessionId) {
        sessionRegistry.close(sessionId);
        return ResponseEntity.noContent().build();
    }

    /**
     * POST /api/v1/sessions/{id}/restart: Replace the runtime, keeping files and history.
     */
    @PostMapping("/{sessionId}/restart")
    public ResponseEntity<SessionInfo> restartSession(@PathVariable String sessionId) {
        return ResponseEntity.ok(sessionRegistry.restart(sessionId));
    }

    /**
     * POST /api/v1/sessions/{id}/executions: Run code and wait for the result.
     * Timeouts and crashes are reported in the body, not as HTTP errors.
     */
    @PostMapping("/{sessionId}/executions")
    public ResponseEntity<ExecutionResponse> execute(@PathVariable String sessionId,
                                                     @RequestBody ExecuteRequest request) {
        if (request == null || request.code() == null) {
            throw new ValidationException("code is required");
        }
        boolean longRunning = request.longRunning() != null && request.longRunning();
        ExecutionRecord record = sessionRegistry.submit(sessionId, request.code(), request.timeoutMs(), longRunning);
        return ResponseEntity.ok(ExecutionResponse.from(record));
    }

    @GetMapping("/{sessionId}/executions")
    public ResponseEntity<Map<String, Object>> listExecutions(@PathVariable String sessionId) {
        Session session = sessionRegistry.get(sessionId);
        List<ExecutionResponse.Summary> executions = session.getExecutions().stream()
                .map(ExecutionResponse.Summary::from)
                .toList();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("session_id", sessionId);
        body.put("executions", executions);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/{sessionId}/executions/{index}")
    public ResponseEntity<?> getExecution(@PathVariable String sessionId, @PathVariable int index) {
        Session session = sessionRegistry.get(sessionId);
        return session.getExecution(index)
                .<ResponseEntity<?>>map(record -> ResponseEntity.ok(ExecutionResponse.from(record)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body(
                        ApiExceptionHandler.errorBody("execution_not_found",
                                "Session " + sessionId + " has no execution " + index)));
    }

    /**
     * POST /api/v1/sessions/{id}/packages: Install a package into the session.
     * Install failures come back as {@code success=false} with HTTP 200.
     */
    @PostMapping("/{sessionId}/packages")
    public ResponseEntity<InstallResult> installPackage(@PathVariable String sessionId,
                                                        @RequestBody InstallRequest request) {
        if (request == null || request.packageName() == null || request.packageName().isBlank()) {
            throw new ValidationException("package_name is required");
        }
        return ResponseEntity.ok(packageInstaller.installPackage(sessionId, request.packageName(), request.timeoutMs()));
    }

    @PostMapping("/{sessionId}/files")
    public ResponseEntity<Map<String, String>> uploadFile(@PathVariable String sessionId,
                                                          @RequestBody UploadRequest request) {
        if (request == null) {
            throw new ValidationException("request body is required");
        }
        String path = sessionRegistry.uploadFile(sessionId, request.filename(), request.contentBase64());
        log.debug("Session {} received file {}", sessionId, path);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("path", path));
    }

    @GetMapping("/{sessionId}/variables")
    public ResponseEntity<Map<String, List<VariableInfo>>> listVariables(@PathVariable String sessionId) {
        return ResponseEntity.ok(Map.of("variables", variableInspector.listVariables(sessionId)));
    }

    @GetMapping("/{sessionId}/variables/{name}")
    public ResponseEntity<?> inspectVariable(@PathVariable String sessionId, @PathVariable String name) {
        return variableInspector.inspectVariable(sessionId, name)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body(
                        ApiExceptionHandler.errorBody("variable_not_found",
                                "Session " + sessionId + " has no variable " + name)));
    }
}
