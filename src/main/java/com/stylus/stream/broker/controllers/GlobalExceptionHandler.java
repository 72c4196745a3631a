package com.stylus.stream.broker.controllers;

import com.stylus.stream.broker.exceptions.*;
import com.stylus.stream.broker.model.ExceptionResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;

import java.util.Map;

import static com.stylus.stream.broker.conf.CommonConfig.DEFAULT_OBJECT_MAPPER;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler({IllegalArgumentException.class, InvalidChannelException.class, HttpMessageNotReadableException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ExceptionResponse handleBadRequest(Exception e, WebRequest request) {
        return handleClientException(e, request);
    }

    @ExceptionHandler({SessionNotFoundException.class, QueueTicketNotFoundException.class})
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public ExceptionResponse handleNotFound(BrokerException e, WebRequest request) {
        return handleClientException(e, request);
    }

    @ExceptionHandler(SessionOwnershipException.class)
    @ResponseStatus(HttpStatus.FORBIDDEN)
    public ExceptionResponse handleOwnership(SessionOwnershipException e, WebRequest request) {
        return handleClientException(e, request);
    }

    @ExceptionHandler(NoCapacityConfiguredException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public ExceptionResponse handleNoCapacity(NoCapacityConfiguredException e, WebRequest request) {
        return handleClientException(e, request);
    }

    @ExceptionHandler({ResourceFailedException.class, StreamUnavailableException.class, LockAcquiringFail.class})
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public ExceptionResponse handleUnavailable(Exception e, WebRequest request) {
        log.warn("service unavailable for request: {}: {}", request.getDescription(false), e.getMessage());
        return new ExceptionResponse(e.getMessage(), request.getDescription(false), e.getClass().getName(), true);
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public ExceptionResponse handleServerException(Exception e, WebRequest request) {
        String description = request.getDescription(false);
        Map<String, String[]> parameterMap = request.getParameterMap();
        log.error("controller exception for request: {}, params: {}", description, serialize(parameterMap), e);
        return new ExceptionResponse(e.getMessage(), description, e.getClass().getName(), false);
    }

    private ExceptionResponse handleClientException(Exception e, WebRequest request) {
        String description = request.getDescription(false);
        log.warn("rejected request: {}: {}", description, e.getMessage());
        boolean retryable = e instanceof BrokerException && ((BrokerException) e).isRetryable();
        return new ExceptionResponse(e.getMessage(), description, e.getClass().getName(), retryable);
    }

    private String serialize(Object object) {
        try {
            return DEFAULT_OBJECT_MAPPER.writeValueAsString(object);
        } catch (Exception e) {
            log.warn("Can't serialize request parameters", e);
            return null;
        }
    }
}
