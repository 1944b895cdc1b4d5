package com.compareintel.compare.client;

import com.compareintel.compare.model.ComparisonRequest;
import com.compareintel.compare.model.ComparisonResponse;
import com.compareintel.compare.model.ModelCatalogResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Reactive client for the comparison API.
 */
public class CompareApiClient {

    private final WebClient webClient;

    public CompareApiClient(WebClient webClient) {
        this.webClient = webClient;
    }

    public static CompareApiClient create(String baseUrl, String bearerToken) {
        WebClient.Builder builder = WebClient.builder()
                .baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
        if (bearerToken != null && !bearerToken.isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + bearerToken);
        }
        return new CompareApiClient(builder.build());
    }

    public Mono<ComparisonResponse> compare(String prompt, List<String> modelIds) {
        return compare(new ComparisonRequest(prompt, modelIds));
    }

    public Mono<ComparisonResponse> compare(ComparisonRequest request) {
        return webClient.post()
                .uri("/api/compare")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::rejection)
                .bodyToMono(ComparisonResponse.class);
    }

    public Mono<ModelCatalogResponse> models() {
        return webClient.get()
                .uri("/api/models")
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::rejection)
                .bodyToMono(ModelCatalogResponse.class);
    }

    private Mono<? extends Throwable> rejection(ClientResponse response) {
        int status = response.statusCode().value();
        return response.bodyToMono(ErrorBody.class)
                .map(body -> body.error() == null ? "HTTP " + status : body.error())
                .onErrorReturn("HTTP " + status)
                .defaultIfEmpty("HTTP " + status)
                .map(message -> new ComparisonRejectedException(status, message));
    }

    record ErrorBody(String error) {
    }
}
