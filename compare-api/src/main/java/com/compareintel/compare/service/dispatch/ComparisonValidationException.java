package com.compareintel.compare.service.dispatch;

import com.compareintel.compare.service.ComparisonException;
import org.springframework.http.HttpStatus;

public class ComparisonValidationException extends ComparisonException {

    public ComparisonValidationException(String message) {
        super(HttpStatus.BAD_REQUEST, message);
    }
}
