package com.cardtally.bot.sender;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class WebhookReplySinkTest {

    private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();

    private WebClient clientReturning(Mono<ClientResponse> response) {
        return WebClient.builder()
            .baseUrl("http://bot.test/bot123")
            .exchangeFunction(request -> {
                requests.add(request);
                return response;
            })
            .build();
    }

    @Test
    @DisplayName("enabled sink posts to sendMessage")
    void posts() {
        WebhookReplySink sink = new WebhookReplySink(
            clientReturning(Mono.just(ClientResponse.create(HttpStatus.OK).build())), true);

        sink.reply("-100", "hello");

        assertEquals(1, requests.size());
        assertEquals(HttpMethod.POST, requests.get(0).method());
        assertEquals("http://bot.test/bot123/sendMessage", requests.get(0).url().toString());
    }

    @Test
    @DisplayName("transport failure is logged, not thrown, and not retried")
    void failureSwallowedByCallback() {
        WebhookReplySink sink = new WebhookReplySink(
            clientReturning(Mono.error(new IllegalStateException("connection refused"))), true);

        assertDoesNotThrow(() -> sink.reply("-100", "hello"));
        assertEquals(1, requests.size());
    }

    @Test
    @DisplayName("error status is treated as a failed delivery")
    void errorStatus() {
        WebhookReplySink sink = new WebhookReplySink(
            clientReturning(Mono.just(ClientResponse.create(HttpStatus.BAD_GATEWAY).build())), true);

        assertDoesNotThrow(() -> sink.reply("-100", "hello"));
        assertEquals(1, requests.size());
    }

    @Test
    @DisplayName("disabled sink makes no call")
    void disabled() {
        WebhookReplySink sink = new WebhookReplySink(
            clientReturning(Mono.just(ClientResponse.create(HttpStatus.OK).build())), false);

        sink.reply("-100", "hello");

        assertTrue(requests.isEmpty());
    }
}
