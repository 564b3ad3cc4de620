package com.cardtally.bot.controller;

import com.cardtally.bot.service.ChannelCommandService;
import com.cardtally.bot.service.CommandResult;
import com.cardtally.common.model.TallySnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Channel-scoped commands: reset, auto-report configuration, help texts and counter
 * inspection.
 */
@RestController
@RequestMapping("/api/v1/channels/{channel}")
public class ChannelCommandController {

    private static final Logger log = LoggerFactory.getLogger(ChannelCommandController.class);

    private final ChannelCommandService commandService;

    public ChannelCommandController(ChannelCommandService commandService) {
        this.commandService = commandService;
    }

    @PostMapping("/reset")
    public Mono<ResponseEntity<CommandResult>> reset(@PathVariable String channel) {
        log.info("Reset requested. channel={}", channel);
        return Mono.fromCallable(() -> commandService.reset(channel))
            .subscribeOn(Schedulers.boundedElastic())
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Reset endpoint error. channel={}", channel, e));
    }

    @PostMapping("/auto-report")
    public Mono<ResponseEntity<CommandResult>> configureAutoReport(
            @PathVariable String channel,
            @RequestParam(value = "minutes", required = false) String minutes) {
        log.info("Auto-report configuration requested. channel={} minutes={}", channel, minutes);
        return Mono.fromCallable(() -> commandService.configureAutoReport(channel, minutes))
            .subscribeOn(Schedulers.boundedElastic())
            .map(ChannelCommandController::toResponse)
            .doOnError(e -> log.error("Auto-report endpoint error. channel={}", channel, e));
    }

    @DeleteMapping("/auto-report")
    public Mono<ResponseEntity<CommandResult>> cancelAutoReport(@PathVariable String channel) {
        return Mono.fromCallable(() -> commandService.cancelAutoReport(channel))
            .subscribeOn(Schedulers.boundedElastic())
            .map(ResponseEntity::ok);
    }

    @GetMapping("/counters")
    public Mono<ResponseEntity<TallySnapshot>> counters(@PathVariable String channel) {
        return Mono.fromCallable(() -> commandService.counters(channel))
            .subscribeOn(Schedulers.boundedElastic())
            .map(ResponseEntity::ok);
    }

    @PostMapping("/start")
    public Mono<ResponseEntity<CommandResult>> start(@PathVariable String channel) {
        return Mono.fromCallable(() -> commandService.start(channel))
            .subscribeOn(Schedulers.boundedElastic())
            .map(ResponseEntity::ok);
    }

    @PostMapping("/joined")
    public Mono<ResponseEntity<CommandResult>> joined(@PathVariable String channel) {
        return Mono.fromCallable(() -> commandService.joined(channel))
            .subscribeOn(Schedulers.boundedElastic())
            .map(ResponseEntity::ok);
    }

    private static ResponseEntity<CommandResult> toResponse(CommandResult result) {
        return result.accepted()
            ? ResponseEntity.ok(result)
            : ResponseEntity.badRequest().body(result);
    }
}
