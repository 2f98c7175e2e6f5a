package com.tvlradar.api.controller;

import com.tvlradar.api.dto.ErrorBody;
import com.tvlradar.api.dto.TvlResponse;
import com.tvlradar.tvl.TvlService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * GET /tvl. Runs one TVL computation at the given block (latest when omitted). The run blocks on RPC round-trips,
 * so it is moved off the event loop.
 */
@RestController
@RequestMapping("/api/v1/tvl")
@RequiredArgsConstructor
public class TvlController {

    private final TvlService tvlService;

    @GetMapping
    public Mono<ResponseEntity<?>> getTvl(
            @RequestParam(required = false) Long block,
            @RequestParam(required = false) Long timestamp
    ) {
        if (block != null && block < 0) {
            return Mono.just(ResponseEntity.badRequest()
                    .body(ErrorBody.of("INVALID_REQUEST", "block must be a non-negative block number")));
        }
        if (timestamp != null && timestamp < 0) {
            return Mono.just(ResponseEntity.badRequest()
                    .body(ErrorBody.of("INVALID_REQUEST", "timestamp must be a non-negative unix time")));
        }
        return Mono.fromCallable(() -> tvlService.run(timestamp, block))
                .subscribeOn(Schedulers.boundedElastic())
                .<ResponseEntity<?>>map(report -> ResponseEntity.ok(TvlResponse.from(report)));
    }
}
