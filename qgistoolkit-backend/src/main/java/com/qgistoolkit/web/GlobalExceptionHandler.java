package com.qgistoolkit.web;

import com.qgistoolkit.api.ErrorResponse;
import com.qgistoolkit.profile.ProfileNotFoundException;
import com.qgistoolkit.project.NoMatchingLayersException;
import com.qgistoolkit.project.ProjectDocumentException;
import com.qgistoolkit.project.ProjectNotFoundException;
import com.qgistoolkit.project.ProjectParseException;
import com.qgistoolkit.project.ProjectWriteException;
import com.qgistoolkit.project.ReassemblyException;
import com.qgistoolkit.project.UnsupportedProjectFormatException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));

        ErrorResponse error = ErrorResponse.builder()
                .code("VALIDATION_FAILED")
                .message("Input validation failed")
                .details(details)
                .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex) {
        ErrorResponse error = ErrorResponse.builder()
                .code("INVALID_REQUEST")
                .message("Request could not be read")
                .details(ex.getMessage())
                .build();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(ProjectNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleProjectNotFound(ProjectNotFoundException ex) {
        return projectError(HttpStatus.NOT_FOUND, "PROJECT_NOT_FOUND", ex, null);
    }

    @ExceptionHandler(UnsupportedProjectFormatException.class)
    public ResponseEntity<ErrorResponse> handleUnsupportedFormat(UnsupportedProjectFormatException ex) {
        return projectError(HttpStatus.BAD_REQUEST, "UNSUPPORTED_FORMAT", ex, null);
    }

    @ExceptionHandler(ProjectParseException.class)
    public ResponseEntity<ErrorResponse> handleParseError(ProjectParseException ex) {
        String details = ex.getLineNumber() > 0
                ? "line " + ex.getLineNumber() + ", column " + ex.getColumnNumber()
                : null;
        return projectError(HttpStatus.UNPROCESSABLE_ENTITY, "PARSE_ERROR", ex, details);
    }

    @ExceptionHandler(NoMatchingLayersException.class)
    public ResponseEntity<ErrorResponse> handleNoMatch(NoMatchingLayersException ex) {
        String details = ex.getFailures().isEmpty() ? null : String.join("; ", ex.getFailures());
        return projectError(HttpStatus.NOT_FOUND, "NO_MATCHING_LAYERS", ex, details);
    }

    @ExceptionHandler(ReassemblyException.class)
    public ResponseEntity<ErrorResponse> handleReassembly(ReassemblyException ex) {
        log.error("Reassembly failed for {}", ex.getProject(), ex);
        return projectError(HttpStatus.INTERNAL_SERVER_ERROR, "REASSEMBLY_FAILED", ex, null);
    }

    @ExceptionHandler(ProjectWriteException.class)
    public ResponseEntity<ErrorResponse> handleWriteError(ProjectWriteException ex) {
        log.error("Could not write {}", ex.getProject(), ex);
        return projectError(HttpStatus.INTERNAL_SERVER_ERROR, "WRITE_FAILED", ex, null);
    }

    @ExceptionHandler(ProfileNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleProfileNotFound(ProfileNotFoundException ex) {
        ErrorResponse error = ErrorResponse.builder()
                .code("PROFILE_NOT_FOUND")
                .message(ex.getMessage())
                .build();
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(IllegalArgumentException ex) {
        ErrorResponse error = ErrorResponse.builder()
                .code("INVALID_ARGUMENT")
                .message(ex.getMessage())
                .build();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleAllExceptions(Exception ex) {
        log.error("Unhandled exception occurred", ex);

        ErrorResponse error = ErrorResponse.builder()
                .code("INTERNAL_SERVER_ERROR")
                .message("An unexpected error occurred")
                .details(ex.getMessage())
                .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    private ResponseEntity<ErrorResponse> projectError(HttpStatus status, String code, ProjectDocumentException ex,
                                                       String details) {
        ErrorResponse error = ErrorResponse.builder()
                .code(code)
                .message(ex.getMessage())
                .details(details)
                .project(ex.getProject() != null ? ex.getProject().toString() : null)
                .layerId(ex.getLayerId())
                .build();
        return ResponseEntity.status(status).body(error);
    }
}
