package com.herzen.bel.api;

import com.herzen.bel.parser.ParserDtos.ParseError;
import com.herzen.bel.parser.error.BelSyntaxException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class BelExceptionHandler {
    @ExceptionHandler(BelSyntaxException.class)
    public ResponseEntity<ParseError> syntaxError(BelSyntaxException e) {
        return ResponseEntity.badRequest().body(ParseError.from(e, 1));
    }
}
