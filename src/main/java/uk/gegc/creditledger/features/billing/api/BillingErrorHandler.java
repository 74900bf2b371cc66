package uk.gegc.creditledger.features.billing.api;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import uk.gegc.creditledger.features.billing.domain.exception.GatewayUnavailableException;
import uk.gegc.creditledger.features.billing.domain.exception.IdempotencyConflictException;
import uk.gegc.creditledger.features.billing.domain.exception.InsufficientFundsException;
import uk.gegc.creditledger.features.billing.domain.exception.InvalidCycleException;
import uk.gegc.creditledger.features.billing.domain.exception.NotAnUpgradeException;
import uk.gegc.creditledger.features.billing.domain.exception.SessionExpiredException;
import uk.gegc.creditledger.features.billing.domain.exception.SessionMismatchException;
import uk.gegc.creditledger.features.billing.domain.exception.SessionNotFoundException;
import uk.gegc.creditledger.features.billing.domain.exception.TerminalGatewayException;
import uk.gegc.creditledger.features.billing.domain.exception.UnknownTierException;
import uk.gegc.creditledger.features.billing.domain.exception.WalletFrozenException;
import uk.gegc.creditledger.features.billing.domain.exception.WebhookInvalidSignatureException;
import uk.gegc.creditledger.shared.api.problem.ErrorTypes;
import uk.gegc.creditledger.shared.api.problem.ProblemDetailBuilder;

import java.util.HashMap;
import java.util.Map;

/**
 * Maps billing exceptions to RFC 7807 Problem Detail responses.
 */
@Slf4j
@RestControllerAdvice(basePackages = "uk.gegc.creditledger.features.billing.api")
public class BillingErrorHandler {

    static final String GATEWAY_RETRY_AFTER_SECONDS = "30";

    @ExceptionHandler(InsufficientFundsException.class)
    public ResponseEntity<ProblemDetail> handleInsufficientFunds(InsufficientFundsException ex, HttpServletRequest request) {
        log.warn("Insufficient funds: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.CONFLICT,
                ErrorTypes.INSUFFICIENT_FUNDS,
                "Insufficient Funds",
                ex.getMessage(),
                request
        );
        problem.setProperty("requestedAmount", ex.getRequestedAmount());
        problem.setProperty("availableBalance", ex.getAvailableBalance());
        problem.setProperty("shortfall", ex.getShortfall());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
    }

    @ExceptionHandler(WalletFrozenException.class)
    public ResponseEntity<ProblemDetail> handleWalletFrozen(WalletFrozenException ex, HttpServletRequest request) {
        log.warn("Wallet frozen: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.FORBIDDEN,
                ErrorTypes.WALLET_FROZEN,
                "Wallet Frozen",
                ex.getMessage(),
                request
        );
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(problem);
    }

    @ExceptionHandler(IdempotencyConflictException.class)
    public ResponseEntity<ProblemDetail> handleIdempotencyConflict(IdempotencyConflictException ex, HttpServletRequest request) {
        log.warn("Idempotency conflict: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.CONFLICT,
                ErrorTypes.IDEMPOTENCY_CONFLICT,
                "Idempotency Conflict",
                ex.getMessage(),
                request
        );
        return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
    }

    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<ProblemDetail> handleOptimisticLock(ObjectOptimisticLockingFailureException ex, HttpServletRequest request) {
        log.warn("Concurrent modification: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.CONFLICT,
                ErrorTypes.OPTIMISTIC_LOCK_CONFLICT,
                "Concurrent Modification",
                "The resource was modified concurrently, please retry",
                request
        );
        return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
    }

    @ExceptionHandler(NotAnUpgradeException.class)
    public ResponseEntity<ProblemDetail> handleNotAnUpgrade(NotAnUpgradeException ex, HttpServletRequest request) {
        log.info("Rejected tier change: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.NOT_AN_UPGRADE,
                "Not An Upgrade",
                ex.getMessage(),
                request
        );
        problem.setProperty("currentTier", ex.getCurrentTier());
        problem.setProperty("targetTier", ex.getTargetTier());
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(InvalidCycleException.class)
    public ResponseEntity<ProblemDetail> handleInvalidCycle(InvalidCycleException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.INVALID_CYCLE,
                "Invalid Billing Cycle",
                ex.getMessage(),
                request
        );
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(UnknownTierException.class)
    public ResponseEntity<ProblemDetail> handleUnknownTier(UnknownTierException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.UNKNOWN_TIER,
                "Unknown Tier",
                ex.getMessage(),
                request
        );
        problem.setProperty("level", ex.getLevel());
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleSessionNotFound(SessionNotFoundException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.NOT_FOUND,
                ErrorTypes.SESSION_NOT_FOUND,
                "Payment Session Not Found",
                ex.getMessage(),
                request
        );
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(problem);
    }

    @ExceptionHandler(SessionMismatchException.class)
    public ResponseEntity<ProblemDetail> handleSessionMismatch(SessionMismatchException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.SESSION_MISMATCH,
                "Payment Session Mismatch",
                ex.getMessage(),
                request
        );
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(SessionExpiredException.class)
    public ResponseEntity<ProblemDetail> handleSessionExpired(SessionExpiredException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.GONE,
                ErrorTypes.SESSION_EXPIRED,
                "Payment Session Expired",
                "Payment session expired; start a new purchase",
                request
        );
        problem.setProperty("invoiceId", ex.getInvoiceId());
        return ResponseEntity.status(HttpStatus.GONE).body(problem);
    }

    @ExceptionHandler(GatewayUnavailableException.class)
    public ResponseEntity<ProblemDetail> handleGatewayUnavailable(GatewayUnavailableException ex, HttpServletRequest request) {
        log.error("Payment gateway unavailable: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.SERVICE_UNAVAILABLE,
                ErrorTypes.GATEWAY_UNAVAILABLE,
                "Payment Gateway Unavailable",
                "Payment gateway unavailable, please try again later",
                request
        );
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .header("Retry-After", GATEWAY_RETRY_AFTER_SECONDS)
                .body(problem);
    }

    @ExceptionHandler(TerminalGatewayException.class)
    public ResponseEntity<ProblemDetail> handleGatewayError(TerminalGatewayException ex, HttpServletRequest request) {
        log.error("Payment gateway rejected request: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_GATEWAY,
                ErrorTypes.GATEWAY_ERROR,
                "Payment Processing Error",
                "Payment processing error",
                request
        );
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(problem);
    }

    @ExceptionHandler(WebhookInvalidSignatureException.class)
    public ResponseEntity<ProblemDetail> handleInvalidSignature(WebhookInvalidSignatureException ex, HttpServletRequest request) {
        log.warn("Invalid Stripe webhook signature: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.UNAUTHORIZED,
                ErrorTypes.WEBHOOK_INVALID_SIGNATURE,
                "Invalid Webhook Signature",
                ex.getMessage(),
                request
        );
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(problem);
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ProblemDetail> handleAccessDenied(AccessDeniedException ex, HttpServletRequest request) {
        log.warn("Access denied: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.FORBIDDEN,
                ErrorTypes.ACCESS_DENIED,
                "Access Denied",
                "You do not have permission to access this resource",
                request
        );
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(problem);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemDetail> handleValidationErrors(MethodArgumentNotValidException ex, HttpServletRequest request) {
        log.warn("Validation errors: {}", ex.getMessage());
        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError fieldError ? fieldError.getField() : error.getObjectName();
            errors.put(fieldName, error.getDefaultMessage());
        });
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.VALIDATION_FAILED,
                "Validation Failed",
                "Validation failed for one or more fields",
                request
        );
        problem.setProperty("errors", errors);
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ProblemDetail> handleConstraintViolation(ConstraintViolationException ex, HttpServletRequest request) {
        log.warn("Constraint violation: {}", ex.getMessage());
        Map<String, String> errors = new HashMap<>();
        ex.getConstraintViolations().forEach(violation ->
                errors.put(violation.getPropertyPath().toString(), violation.getMessage()));
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.VALIDATION_FAILED,
                "Validation Failed",
                "Validation failed for one or more parameters",
                request
        );
        problem.setProperty("errors", errors);
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ProblemDetail> handleTypeMismatch(MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        log.warn("Type mismatch error: {}", ex.getMessage());
        String param = ex.getName();
        Class<?> type = ex.getRequiredType();
        String requiredType = type != null ? type.getSimpleName() : "unknown";
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.TYPE_MISMATCH,
                "Type Mismatch Error",
                "Invalid value for parameter '" + param + "'. Expected type: " + requiredType + ".",
                request
        );
        problem.setProperty("parameter", param);
        problem.setProperty("expectedType", requiredType);
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ProblemDetail> handleMissingParameter(MissingServletRequestParameterException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.INVALID_ARGUMENT,
                "Missing Parameter",
                ex.getMessage(),
                request
        );
        problem.setProperty("parameter", ex.getParameterName());
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ProblemDetail> handleIllegalArgument(IllegalArgumentException ex, HttpServletRequest request) {
        log.warn("Illegal argument: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.INVALID_ARGUMENT,
                "Invalid Argument",
                ex.getMessage(),
                request
        );
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ProblemDetail> handleHttpMessageNotReadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
        log.warn("Invalid request body: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.MALFORMED_JSON,
                "Invalid Request Body",
                "Invalid request body",
                request
        );
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleGenericException(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error in billing API: {}", ex.getMessage(), ex);
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.INTERNAL_SERVER_ERROR,
                ErrorTypes.INTERNAL_SERVER_ERROR,
                "Internal Error",
                "An unexpected error occurred",
                request
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
    }
}
