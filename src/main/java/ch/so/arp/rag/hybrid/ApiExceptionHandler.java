package ch.so.arp.rag.hybrid;

import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import ch.so.arp.rag.hybrid.store.StoreUnavailableException;
import jakarta.servlet.http.HttpServletRequest;

/**
 * Maps pipeline failures to HTTP status codes: store problems to 503,
 * embedding and generation problems to 502, admission rejections to 429 and
 * invalid input to 400.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(PipelineStageException.class)
    public ResponseEntity<ApiError> handleStageFailure(PipelineStageException ex, HttpServletRequest request) {
        HttpStatus status = ex.getCause() instanceof StoreUnavailableException ? HttpStatus.SERVICE_UNAVAILABLE
                : HttpStatus.BAD_GATEWAY;
        return respond(status, errorName(ex.getCause()), ex.getStage().spanName(), ex.getMessage(), request);
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<ApiError> handleStore(StoreUnavailableException ex, HttpServletRequest request) {
        LOGGER.error("Store unavailable: {}", ex.getMessage(), ex);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, errorName(ex), null, "Vector store is unavailable.", request);
    }

    @ExceptionHandler({ EmbeddingUnavailableException.class, GenerationUnavailableException.class })
    public ResponseEntity<ApiError> handleUpstream(RuntimeException ex, HttpServletRequest request) {
        LOGGER.error("Upstream dependency failed: {}", ex.getMessage(), ex);
        return respond(HttpStatus.BAD_GATEWAY, errorName(ex), null, ex.getMessage(), request);
    }

    @ExceptionHandler(RateLimitedException.class)
    public ResponseEntity<ApiError> handleRateLimited(RateLimitedException ex, HttpServletRequest request) {
        return respond(HttpStatus.TOO_MANY_REQUESTS, "RateLimited", null, ex.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleInvalid(MethodArgumentNotValidException ex, HttpServletRequest request) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return respond(HttpStatus.BAD_REQUEST, "InvalidRequest", null, message, request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "InvalidRequest", null, ex.getMessage(), request);
    }

    private ResponseEntity<ApiError> respond(HttpStatus status, String error, String stage, String message,
            HttpServletRequest request) {
        Object context = request.getAttribute(RequestContext.class.getName());
        String requestId = context instanceof RequestContext requestContext ? requestContext.requestId() : null;
        return ResponseEntity.status(status).body(new ApiError(error, stage, message, requestId));
    }

    private static String errorName(Throwable ex) {
        return ex.getClass().getSimpleName().replace("Exception", "");
    }
}
