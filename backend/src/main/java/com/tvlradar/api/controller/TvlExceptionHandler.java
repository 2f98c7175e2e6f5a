package com.tvlradar.api.controller;

import com.tvlradar.adapter.RpcException;
import com.tvlradar.api.dto.ErrorBody;
import com.tvlradar.tvl.discovery.FatalDiscoveryException;
import com.tvlradar.tvl.token.TokenListUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

/**
 * Maps TVL failures to ErrorBody. Upstream failures (node, factory, token list) are 502; malformed query
 * parameters are 400.
 */
@RestControllerAdvice
@Slf4j
public class TvlExceptionHandler {

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorBody> handleInput(ServerWebInputException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", ex.getReason()));
    }

    @ExceptionHandler(FatalDiscoveryException.class)
    public ResponseEntity<ErrorBody> handleDiscovery(FatalDiscoveryException ex) {
        log.warn("TVL discovery failed: {}", ex.getMessage());
        return badGateway("DISCOVERY_FAILED", ex.getMessage());
    }

    @ExceptionHandler(RpcException.class)
    public ResponseEntity<ErrorBody> handleRpc(RpcException ex) {
        log.warn("TVL run failed on RPC: {}", ex.getMessage());
        return badGateway("RPC_FAILED", ex.getMessage());
    }

    @ExceptionHandler(TokenListUnavailableException.class)
    public ResponseEntity<ErrorBody> handleTokenList(TokenListUnavailableException ex) {
        log.warn("Supported-token list unavailable: {}", ex.getMessage());
        return badGateway("TOKEN_LIST_UNAVAILABLE", ex.getMessage());
    }

    private static ResponseEntity<ErrorBody> badGateway(String error, String message) {
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(ErrorBody.of(error, message));
    }
}
