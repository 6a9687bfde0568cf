package de.leidenheit.ate.demo.controller;

import de.leidenheit.ate.demo.model.MessageDto;
import de.leidenheit.ate.demo.service.exception.AuthorizationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(AuthorizationException.class)
    public ResponseEntity<MessageDto> handleAuthorization(final AuthorizationException e) {
        log.debug("Request rejected: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(MessageDto.of(false, e.getMessage()));
    }
}
