package com.purchasingpower.testgen.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.purchasingpower.testgen.exception.BackendConnectionException;
import com.purchasingpower.testgen.exception.BackendHttpException;
import com.purchasingpower.testgen.exception.BackendTimeoutException;
import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.Exceptions;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Shared HTTP plumbing for JSON backends.
 *
 * <p>Translates transport failures into the typed backend exceptions:
 * non-2xx replies become {@link BackendHttpException}, timeouts
 * {@link BackendTimeoutException} and anything else on the request side
 * {@link BackendConnectionException}.
 */
@Slf4j
public abstract class AbstractHttpBackend implements GenerationBackend {

    private static final int CONNECT_TIMEOUT_MS = 10_000;

    protected final WebClient webClient;
    protected final String model;
    private final Duration timeout;

    protected AbstractHttpBackend(WebClient.Builder webClientBuilder, String baseUrl, String apiKey,
                                  String model, Duration timeout) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MS)
                .responseTimeout(timeout);

        this.webClient = webClientBuilder.clone()
                .baseUrl(baseUrl)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
        this.model = model;
        this.timeout = timeout;
    }

    @Override
    public String getModel() {
        return model;
    }

    /**
     * POSTs {@code body} and returns the parsed JSON reply.
     */
    protected JsonNode postJson(String uri, Map<String, Object> body) {
        long start = System.currentTimeMillis();
        try {
            JsonNode response = webClient.post()
                    .uri(uri)
                    .bodyValue(body)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, clientResponse -> clientResponse.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(text -> new BackendHttpException(clientResponse.statusCode().value(), text, null)))
                    .bodyToMono(JsonNode.class)
                    .timeout(timeout.plusSeconds(5))
                    .block();
            log.debug("🟢 [{}] reply in {} ms", getProviderName(), System.currentTimeMillis() - start);
            if (response == null) {
                throw new BackendConnectionException(getProviderName() + " returned an empty body");
            }
            return response;
        } catch (RuntimeException e) {
            throw translate(Exceptions.unwrap(e));
        }
    }

    private RuntimeException translate(Throwable error) {
        if (error instanceof BackendHttpException
                || error instanceof BackendConnectionException
                || error instanceof BackendTimeoutException) {
            return (RuntimeException) error;
        }
        if (error instanceof TimeoutException) {
            return new BackendTimeoutException(getProviderName() + " did not answer within " + timeout, error);
        }
        if (error instanceof WebClientRequestException request) {
            if (request.getCause() instanceof io.netty.handler.timeout.TimeoutException) {
                return new BackendTimeoutException(getProviderName() + " read timed out", request);
            }
            return new BackendConnectionException(
                    "Cannot reach " + getProviderName() + ": " + request.getMessage(), request);
        }
        if (error instanceof RuntimeException runtime) {
            return runtime;
        }
        return new BackendConnectionException(error.getMessage(), error);
    }
}
