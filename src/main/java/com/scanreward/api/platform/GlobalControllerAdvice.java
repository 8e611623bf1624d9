package com.scanreward.api.platform;

import com.scanreward.api.token.exceptions.EntropySourceUnavailableException;
import jakarta.validation.ConstraintViolationException;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.TypeMismatchException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.validation.BindException;
import org.springframework.web.HttpMediaTypeNotAcceptableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.ServletRequestBindingException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.NoHandlerFoundException;


/**
 * Maps errors that escape the controllers to bare status responses. Domain outcomes such as an
 * expired token are mapped by the controllers themselves and never reach this advice.
 */
@RestControllerAdvice
@Slf4j
public class GlobalControllerAdvice {

    @ExceptionHandler(Throwable.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    void handleUnexpectedFailure(@NonNull final Throwable e) {
        log.error("unhandled failure while serving the request", e);
    }

    @ExceptionHandler(EntropySourceUnavailableException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    void handleEntropySourceUnavailable(@NonNull final EntropySourceUnavailableException e) {
        log.error("secure random source is unavailable, refusing to issue tokens", e);
    }

    /**
     * Store failures that escape a transaction boundary, e.g. when a connection can't be acquired
     * before the transaction starts. Clients may retry these requests.
     */
    @ExceptionHandler({
        TransientDataAccessException.class,
        RecoverableDataAccessException.class,
        CannotCreateTransactionException.class,
        TransactionTimedOutException.class
    })
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    void handleTransientStoreFailure(@NonNull final Exception e) {
        log.warn("token store is temporarily unavailable", e);
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    @ResponseStatus(HttpStatus.UNSUPPORTED_MEDIA_TYPE)
    void handleUnsupportedContentType(@NonNull final HttpMediaTypeNotSupportedException e) {
        log.trace("rejected request body content type {}", e.getContentType());
    }

    @ExceptionHandler(HttpMediaTypeNotAcceptableException.class)
    @ResponseStatus(HttpStatus.NOT_ACCEPTABLE)
    void handleUnacceptableResponseType(@NonNull final HttpMediaTypeNotAcceptableException e) {
        log.trace("client accepts none of {}", e.getSupportedMediaTypes());
    }

    /**
     * Redemption only accepts {@code POST}. A scanner that follows the QR url with a {@code GET}
     * ends up here.
     */
    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    @ResponseStatus(HttpStatus.METHOD_NOT_ALLOWED)
    void handleMethodNotAllowed(@NonNull final HttpRequestMethodNotSupportedException e) {
        log.trace("rejected http method {}", e.getMethod());
    }

    @ExceptionHandler(NoHandlerFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    void handleUnknownRoute(@NonNull final NoHandlerFoundException e) {
        log.trace("no route for {} {}", e.getHttpMethod(), e.getRequestURL());
    }

    // malformed json, failed bean validation and bad path variables.
    @ExceptionHandler({
        HttpMessageNotReadableException.class,
        MethodArgumentNotValidException.class,
        ConstraintViolationException.class,
        BindException.class,
        TypeMismatchException.class,
        MissingServletRequestParameterException.class,
        MissingRequestHeaderException.class,
        ServletRequestBindingException.class
    })
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    void handleInvalidRequest(@NonNull final Exception e) {
        log.trace("invalid request", e);
    }
}
