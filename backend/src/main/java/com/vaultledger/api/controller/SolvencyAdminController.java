package com.vaultledger.api.controller;

import com.vaultledger.api.dto.AssetResponse;
import com.vaultledger.api.dto.AssetRevalueRequest;
import com.vaultledger.api.dto.ChainEventResponse;
import com.vaultledger.api.dto.HealthResponse;
import com.vaultledger.api.dto.LiquidateRequest;
import com.vaultledger.api.dto.PositionResponse;
import com.vaultledger.api.dto.RevalueRequest;
import com.vaultledger.asset.CollateralAssetService;
import com.vaultledger.auth.CallerIdentityResolver;
import com.vaultledger.common.Addresses;
import com.vaultledger.common.Amounts;
import com.vaultledger.domain.Position;
import com.vaultledger.domain.PositionStatus;
import com.vaultledger.ledger.LoanOperations;
import com.vaultledger.ledger.PositionCommandService;
import com.vaultledger.ledger.PositionLedger;
import com.vaultledger.monitor.HealthScanService;
import com.vaultledger.monitor.ScanSummary;
import com.vaultledger.reconcile.DeadLetterService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * Operator endpoints: monitoring, liquidation, revaluation, chain resync and dead-letter handling. ADMIN only.
 */
@RestController
@RequestMapping("/solvency/admin")
@RequiredArgsConstructor
public class SolvencyAdminController {

    private final CallerIdentityResolver callerIdentityResolver;
    private final PositionLedger positionLedger;
    private final LoanOperations loanOperations;
    private final PositionCommandService positionCommandService;
    private final HealthScanService healthScanService;
    private final CollateralAssetService collateralAssetService;
    private final DeadLetterService deadLetterService;

    @GetMapping("/positions")
    public Mono<List<PositionResponse>> positions(@RequestHeader HttpHeaders headers,
                                                  @RequestParam(required = false) PositionStatus status) {
        callerIdentityResolver.requireAdmin(headers);
        return blocking(() -> describe(status != null
                ? positionLedger.getPositionsByStatus(status)
                : positionLedger.getAllPositions()));
    }

    @GetMapping("/liquidatable")
    public Mono<List<PositionResponse>> liquidatable(@RequestHeader HttpHeaders headers) {
        callerIdentityResolver.requireAdmin(headers);
        return blocking(() -> describe(positionLedger.getLiquidatablePositions()));
    }

    @GetMapping("/warnings")
    public Mono<List<PositionResponse>> warnings(@RequestHeader HttpHeaders headers) {
        callerIdentityResolver.requireAdmin(headers);
        return blocking(() -> describe(positionLedger.getWarningPositions()));
    }

    @PostMapping("/position/{positionId}/liquidate")
    public Mono<ResponseEntity<PositionResponse>> liquidate(@RequestHeader HttpHeaders headers,
                                                            @PathVariable long positionId,
                                                            @RequestBody @Valid LiquidateRequest request) {
        callerIdentityResolver.requireAdmin(headers);
        return loanOperations.liquidate(positionId, request.marketplaceListingId())
                .flatMap(p -> blocking(() -> describe(p)))
                .map(ResponseEntity::ok);
    }

    @PostMapping("/position/{positionId}/revalue")
    public Mono<HealthResponse> revalue(@RequestHeader HttpHeaders headers,
                                        @PathVariable long positionId,
                                        @RequestBody @Valid RevalueRequest request) {
        callerIdentityResolver.requireAdmin(headers);
        return blocking(() -> HealthResponse.from(healthScanService.revaluePosition(positionId,
                Amounts.parsePositive("valuationUsd", request.valuationUsd()))));
    }

    @PostMapping("/position/{positionId}/sync")
    public Mono<PositionResponse> sync(@RequestHeader HttpHeaders headers, @PathVariable long positionId) {
        callerIdentityResolver.requireAdmin(headers);
        return positionCommandService.syncFromChain(positionId)
                .flatMap(p -> blocking(() -> describe(p)));
    }

    @GetMapping("/assets")
    public Mono<List<AssetResponse>> assets(@RequestHeader HttpHeaders headers) {
        callerIdentityResolver.requireAdmin(headers);
        return blocking(() -> collateralAssetService.listAssets().stream().map(AssetResponse::from).toList());
    }

    @PostMapping("/assets/{tokenAddress}/revalue")
    public Mono<ScanSummary> revalueAsset(@RequestHeader HttpHeaders headers,
                                          @PathVariable String tokenAddress,
                                          @RequestBody @Valid AssetRevalueRequest request) {
        callerIdentityResolver.requireAdmin(headers);
        String token = Addresses.normalize("tokenAddress", tokenAddress);
        return blocking(() -> healthScanService.revalueByToken(token,
                Amounts.parsePositive("unitPriceUsd", request.unitPriceUsd())));
    }

    @PostMapping("/health-scan")
    public Mono<ScanSummary> healthScan(@RequestHeader HttpHeaders headers) {
        callerIdentityResolver.requireAdmin(headers);
        return Mono.fromFuture(healthScanService::rescanActiveAsync);
    }

    @GetMapping("/events/dead")
    public Mono<List<ChainEventResponse>> deadEvents(@RequestHeader HttpHeaders headers) {
        callerIdentityResolver.requireAdmin(headers);
        return blocking(() -> deadLetterService.listDead().stream().map(ChainEventResponse::from).toList());
    }

    @PostMapping("/events/{eventKey}/retry")
    public Mono<ChainEventResponse> retryEvent(@RequestHeader HttpHeaders headers, @PathVariable String eventKey) {
        callerIdentityResolver.requireAdmin(headers);
        return blocking(() -> ChainEventResponse.from(deadLetterService.retry(eventKey)));
    }

    private PositionResponse describe(Position position) {
        return PositionResponse.from(position, positionLedger.healthOf(position));
    }

    private List<PositionResponse> describe(List<Position> positions) {
        return positions.stream().map(this::describe).toList();
    }

    private static <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }
}
