package com.nzila.api.action;

import com.nzila.api.proposal.FieldViolation;
import com.nzila.api.proposal.ProposalValidationException;
import com.nzila.api.registry.UnknownActionTypeException;
import com.nzila.core.domain.Action;
import com.nzila.core.domain.ActionRun;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * REST API for the action lifecycle.
 */
@RestController
@RequestMapping("/api/v1/actions")
public class ActionController {

    private static final Logger log = LoggerFactory.getLogger(ActionController.class);

    private final ActionEngine actionEngine;

    public ActionController(ActionEngine actionEngine) {
        this.actionEngine = actionEngine;
    }

    /**
     * Propose an action.
     * POST /api/v1/actions/{actionType}
     */
    @PostMapping("/{actionType}")
    public ResponseEntity<Action> propose(
            @PathVariable String actionType,
            @RequestBody Map<String, Object> payload) {
        Action action = actionEngine.proposeAction(actionType, payload);
        return ResponseEntity.status(HttpStatus.CREATED).body(action);
    }

    /**
     * Propose and immediately execute an auto-approved action.
     * POST /api/v1/actions/{actionType}/run
     */
    @PostMapping("/{actionType}/run")
    public ResponseEntity<ActionRun> proposeAndExecute(
            @PathVariable String actionType,
            @RequestBody Map<String, Object> payload) {
        return ResponseEntity.ok(actionEngine.proposeAndExecute(actionType, payload));
    }

    @GetMapping("/{id}")
    public ResponseEntity<Action> getAction(@PathVariable UUID id) {
        return ResponseEntity.ok(actionEngine.getAction(id));
    }

    /**
     * Approve or reject an action awaiting approval.
     * POST /api/v1/actions/{id}/decision
     */
    @PostMapping("/{id}/decision")
    public ResponseEntity<Action> decide(
            @PathVariable UUID id,
            @RequestHeader("X-Actor-ID") String actorId,
            @RequestHeader(value = "X-Actor-Roles", defaultValue = "") String actorRoles,
            @Valid @RequestBody DecisionRequest request) {
        ApproverIdentity approver = new ApproverIdentity(actorId, parseRoles(actorRoles));
        return ResponseEntity.ok(actionEngine.approveAction(id, approver, request.decision(), request.reason()));
    }

    /**
     * Execute an approved action.
     * POST /api/v1/actions/{id}/execute
     */
    @PostMapping("/{id}/execute")
    public ResponseEntity<ActionRun> execute(
            @PathVariable UUID id,
            @RequestHeader("X-Actor-ID") String actorId) {
        return ResponseEntity.ok(actionEngine.executeAction(id, actorId));
    }

    /**
     * Re-open a failed action for another attempt.
     * POST /api/v1/actions/{id}/retry
     */
    @PostMapping("/{id}/retry")
    public ResponseEntity<Action> retry(
            @PathVariable UUID id,
            @RequestHeader("X-Actor-ID") String actorId) {
        return ResponseEntity.ok(actionEngine.retryAction(id, actorId));
    }

    private static Set<String> parseRoles(String header) {
        return Arrays.stream(header.split(","))
                .map(String::trim)
                .filter(role -> !role.isEmpty())
                .collect(Collectors.toSet());
    }

    // Request DTOs
    public record DecisionRequest(@NotNull ApprovalDecision decision, String reason) {}

    // Exception handlers
    @ExceptionHandler(ProposalValidationException.class)
    public ResponseEntity<ValidationErrorResponse> handleInvalidProposal(ProposalValidationException e) {
        return ResponseEntity.badRequest()
                .body(new ValidationErrorResponse("INVALID_PROPOSAL", e.getMessage(), e.getViolations()));
    }

    @ExceptionHandler(UnknownActionTypeException.class)
    public ResponseEntity<ErrorResponse> handleUnknownType(UnknownActionTypeException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("UNKNOWN_ACTION_TYPE", e.getMessage()));
    }

    @ExceptionHandler(ActionNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ActionNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("ACTION_NOT_FOUND", e.getMessage()));
    }

    @ExceptionHandler(ActionStateConflictException.class)
    public ResponseEntity<ErrorResponse> handleConflict(ActionStateConflictException e) {
        log.info("State conflict on action {}: {}", e.getActionId(), e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ErrorResponse("STATE_CONFLICT", e.getMessage()));
    }

    @ExceptionHandler(ApproverNotAuthorizedException.class)
    public ResponseEntity<ErrorResponse> handleNotAuthorized(ApproverNotAuthorizedException e) {
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(new ErrorResponse("APPROVER_NOT_AUTHORIZED", e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(new ErrorResponse("BAD_REQUEST", e.getMessage()));
    }

    public record ErrorResponse(String code, String message) {}

    public record ValidationErrorResponse(String code, String message, List<FieldViolation> violations) {}
}
