package com.jalarm.support;

import org.springframework.http.HttpStatus;
import org.springframework.http.codec.HttpMessageWriter;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.mock.http.client.reactive.MockClientHttpRequest;
import org.springframework.web.reactive.function.BodyInserter;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import reactor.core.publisher.Mono;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * WebClient exchange stub: answers queued responses in order and keeps every request
 * with its serialized body.
 */
public class CapturingExchangeFunction implements ExchangeFunction {

    public record CapturedRequest(ClientRequest request, String body) {
        public String url() { return request.url().toString(); }
        public String header(String name) { return request.headers().getFirst(name); }
    }

    private final Deque<Mono<ClientResponse>> responses = new ArrayDeque<>();
    private final List<CapturedRequest> requests = new ArrayList<>();

    public CapturingExchangeFunction respond(HttpStatus status, String body) {
        responses.add(Mono.just(ClientResponse.create(status)
                .header("Content-Type", "application/json")
                .body(body)
                .build()));
        return this;
    }

    public CapturingExchangeFunction fail(Throwable error) {
        responses.add(Mono.error(error));
        return this;
    }

    public List<CapturedRequest> requests() {
        return requests;
    }

    @Override
    public Mono<ClientResponse> exchange(ClientRequest request) {
        requests.add(new CapturedRequest(request, bodyOf(request)));
        Mono<ClientResponse> next = responses.poll();
        return next != null ? next : Mono.error(new IllegalStateException("No response queued for " + request.url()));
    }

    private static String bodyOf(ClientRequest request) {
        MockClientHttpRequest mock = new MockClientHttpRequest(request.method(), request.url());
        request.body().insert(mock, new BodyInserter.Context() {
            @Override
            public List<HttpMessageWriter<?>> messageWriters() {
                return ExchangeStrategies.withDefaults().messageWriters();
            }

            @Override
            public Optional<ServerHttpRequest> serverRequest() {
                return Optional.empty();
            }

            @Override
            public Map<String, Object> hints() {
                return Map.of();
            }
        }).block();
        return mock.getBodyAsString().block();
    }
}
