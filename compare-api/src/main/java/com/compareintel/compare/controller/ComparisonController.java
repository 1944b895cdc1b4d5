package com.compareintel.compare.controller;

import com.compareintel.compare.model.ComparisonRequest;
import com.compareintel.compare.model.ComparisonResponse;
import com.compareintel.compare.service.dispatch.RequestDispatcher;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/compare")
public class ComparisonController {

    private final RequestDispatcher dispatcher;

    public ComparisonController(RequestDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ComparisonResponse> compare(@Valid @RequestBody ComparisonRequest request) {
        return dispatcher.dispatch(request);
    }
}
