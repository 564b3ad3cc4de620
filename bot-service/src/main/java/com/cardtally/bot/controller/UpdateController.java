package com.cardtally.bot.controller;

import com.cardtally.bot.service.ChannelCommandService;
import com.cardtally.common.event.InboundEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Entry point for message deliveries pushed by the transport.
 */
@RestController
@RequestMapping("/api/v1")
public class UpdateController {

    private static final Logger log = LoggerFactory.getLogger(UpdateController.class);

    private final ChannelCommandService commandService;

    public UpdateController(ChannelCommandService commandService) {
        this.commandService = commandService;
    }

    @PostMapping("/updates")
    public Mono<ResponseEntity<Void>> update(@RequestBody InboundEvent event) {
        if (event.channel() == null || event.channel().isBlank() || event.eventId() == null) {
            return Mono.just(ResponseEntity.badRequest().<Void>build());
        }
        return Mono.fromCallable(() -> commandService.ingest(event))
            .subscribeOn(Schedulers.boundedElastic())
            .map(r -> ResponseEntity.status(HttpStatus.ACCEPTED).<Void>build())
            .doOnError(e -> log.error("Update endpoint error. channel={} eventId={}",
                                      event.channel(), event.eventId(), e));
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<String>> health() {
        return Mono.just(ResponseEntity.ok("OK"));
    }
}
