package com.levstrat.config;

import com.levstrat.exception.ErrorKind;
import com.levstrat.exception.StrategyException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;

@Slf4j
@RestControllerAdvice
public class StrategyExceptionHandler {

    @ExceptionHandler(StrategyException.class)
    public ProblemDetail handleStrategyException(StrategyException exception) {
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(statusOf(exception.getKind()), exception.getMessage());
        problemDetail.setProperty("code", exception.getCode());
        problemDetail.setProperty("kind", exception.getKind().name());
        return problemDetail;
    }

    /** Malformed addresses and similar argument errors. */
    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException exception) {
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, exception.getMessage());
        problemDetail.setProperty("code", "InvalidArgument");
        return problemDetail;
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ProblemDetail handleMissingHeader(MissingRequestHeaderException exception) {
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST,
                "Missing header " + exception.getHeaderName());
        problemDetail.setProperty("code", "MissingHeader");
        return problemDetail;
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidationException(MethodArgumentNotValidException exception) {
        List<String> details = exception.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(e -> e.getField() + " " + e.getDefaultMessage())
                .toList();

        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, "Request validation failed");
        problemDetail.setProperty("code", "RequestValidation");
        problemDetail.setProperty("details", details);
        return problemDetail;
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleUnexpectedException(Exception exception) {
        log.error("[api] unexpected error", exception);
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(HttpStatus.INTERNAL_SERVER_ERROR, "Unexpected server error");
        problemDetail.setProperty("code", "InternalError");
        return problemDetail;
    }

    static HttpStatus statusOf(ErrorKind kind) {
        return switch (kind) {
            case AUTHORIZATION -> HttpStatus.FORBIDDEN;
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case SLIPPAGE, PROPORTIONALITY -> HttpStatus.UNPROCESSABLE_ENTITY;
            case EXTERNAL_CALL, ORACLE -> HttpStatus.BAD_GATEWAY;
        };
    }
}
