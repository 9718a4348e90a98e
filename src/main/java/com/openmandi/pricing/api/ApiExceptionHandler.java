package com.openmandi.pricing.api;

import com.openmandi.pricing.api.model.ErrorResponse;
import com.openmandi.pricing.core.InvalidInputException;
import com.openmandi.pricing.core.NoComparableDataException;
import com.openmandi.pricing.infra.MarketDataUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(NoComparableDataException.class)
    public ResponseEntity<ErrorResponse> noComparableData(NoComparableDataException e) {
        log.info("No comparable data: {}", e.getMessage());
        return error(HttpStatus.NOT_FOUND, e.getCode(), e.getMessage());
    }

    @ExceptionHandler(InvalidInputException.class)
    public ResponseEntity<ErrorResponse> invalidInput(InvalidInputException e) {
        return error(HttpStatus.BAD_REQUEST, e.getCode(), e.getMessage());
    }

    @ExceptionHandler({HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> malformedRequest(Exception e) {
        return error(HttpStatus.BAD_REQUEST, "INVALID_INPUT", "malformed request: " + e.getMessage());
    }

    @ExceptionHandler(MarketDataUnavailableException.class)
    public ResponseEntity<ErrorResponse> marketDataUnavailable(MarketDataUnavailableException e) {
        log.error("Market data unavailable", e);
        return error(HttpStatus.SERVICE_UNAVAILABLE, e.getCode(), e.getMessage());
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(code, message));
    }
}
