package com.compareintel.compare.service.aggregation;

import com.compareintel.compare.service.ComparisonException;
import org.springframework.http.HttpStatus;

/**
 * The dispatcher delivered a result set that does not match the requested models.
 */
public class AggregationException extends ComparisonException {

    public AggregationException(String message) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, message);
    }
}
