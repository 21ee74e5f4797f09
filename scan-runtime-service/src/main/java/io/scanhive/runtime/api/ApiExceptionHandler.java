package io.scanhive.runtime.api;

import io.scanhive.docker.DockerDaemonUnavailableException;
import io.scanhive.runtime.domain.ScanNotFoundException;
import io.scanhive.runtime.domain.ServiceUnhealthyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ServiceUnhealthyException.class)
    ResponseEntity<ErrorResponse> serviceUnhealthy(ServiceUnhealthyException e) {
        log.warn("[REST] scan {} aborted: {}", e.scanId(), e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ErrorResponse(e.getMessage(), e.scanId(), e.failure().kind().name()));
    }

    @ExceptionHandler(DockerDaemonUnavailableException.class)
    ResponseEntity<ErrorResponse> dockerUnavailable(DockerDaemonUnavailableException e) {
        log.warn("[REST] docker unavailable during {}: {}", e.action(), e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ErrorResponse.of(e.getMessage()));
    }

    @ExceptionHandler(ScanNotFoundException.class)
    ResponseEntity<ErrorResponse> scanNotFound(ScanNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(new ErrorResponse(e.getMessage(), e.scanId(), null));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    ResponseEntity<ErrorResponse> invalidRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(ErrorResponse.of(e.getMessage()));
    }
}
