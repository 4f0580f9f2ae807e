package com.vaultledger.api.controller;

import com.vaultledger.api.dto.CreatePartnerRequest;
import com.vaultledger.api.dto.PartnerApiLogResponse;
import com.vaultledger.api.dto.PartnerLimitsRequest;
import com.vaultledger.api.dto.PartnerResponse;
import com.vaultledger.api.dto.PartnerStatsResponse;
import com.vaultledger.api.dto.PartnerStatusRequest;
import com.vaultledger.auth.CallerIdentityResolver;
import com.vaultledger.common.Amounts;
import com.vaultledger.partner.IssuedKey;
import com.vaultledger.partner.NewPartner;
import com.vaultledger.partner.PartnerApiLogService;
import com.vaultledger.partner.PartnerService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * Partner onboarding and key management. ADMIN only. Plaintext keys appear only in create and regenerate responses.
 */
@RestController
@RequestMapping("/partners/admin")
@RequiredArgsConstructor
public class PartnerAdminController {

    private final CallerIdentityResolver callerIdentityResolver;
    private final PartnerService partnerService;
    private final PartnerApiLogService partnerApiLogService;

    @PostMapping
    public Mono<ResponseEntity<PartnerResponse>> create(@RequestHeader HttpHeaders headers,
                                                        @RequestBody @Valid CreatePartnerRequest request) {
        callerIdentityResolver.requireAdmin(headers);
        NewPartner newPartner = new NewPartner(
                request.name(),
                request.prefix(),
                request.tier(),
                Amounts.parsePositive("dailyBorrowLimit", request.dailyBorrowLimit()),
                Amounts.parsePositive("totalBorrowLimit", request.totalBorrowLimit()),
                request.platformFeeBps(),
                request.settlementAddress());
        return blocking(() -> issued(partnerService.createPartner(newPartner)))
                .map(body -> ResponseEntity.status(HttpStatus.CREATED).body(body));
    }

    @GetMapping
    public Mono<List<PartnerResponse>> list(@RequestHeader HttpHeaders headers) {
        callerIdentityResolver.requireAdmin(headers);
        return blocking(() -> partnerService.listPartners().stream().map(PartnerResponse::from).toList());
    }

    @GetMapping("/{partnerId}/stats")
    public Mono<PartnerStatsResponse> stats(@RequestHeader HttpHeaders headers, @PathVariable String partnerId) {
        callerIdentityResolver.requireAdmin(headers);
        return blocking(() -> PartnerStatsResponse.from(partnerService.stats(partnerId)));
    }

    @GetMapping("/{partnerId}/api-logs")
    public Mono<List<PartnerApiLogResponse>> apiLogs(@RequestHeader HttpHeaders headers, @PathVariable String partnerId) {
        callerIdentityResolver.requireAdmin(headers);
        return blocking(() -> partnerApiLogService.recent(partnerId).stream().map(PartnerApiLogResponse::from).toList());
    }

    @PostMapping("/{partnerId}/regenerate-key")
    public Mono<PartnerResponse> regenerateKey(@RequestHeader HttpHeaders headers, @PathVariable String partnerId) {
        callerIdentityResolver.requireAdmin(headers);
        return blocking(() -> issued(partnerService.regenerateKey(partnerId)));
    }

    @PostMapping("/{partnerId}/status")
    public Mono<PartnerResponse> status(@RequestHeader HttpHeaders headers,
                                        @PathVariable String partnerId,
                                        @RequestBody @Valid PartnerStatusRequest request) {
        callerIdentityResolver.requireAdmin(headers);
        return blocking(() -> PartnerResponse.from(partnerService.updateStatus(partnerId, request.status())));
    }

    @PostMapping("/{partnerId}/limits")
    public Mono<PartnerResponse> limits(@RequestHeader HttpHeaders headers,
                                        @PathVariable String partnerId,
                                        @RequestBody @Valid PartnerLimitsRequest request) {
        callerIdentityResolver.requireAdmin(headers);
        return blocking(() -> PartnerResponse.from(partnerService.updateLimits(partnerId,
                request.dailyBorrowLimit() != null ? Amounts.parsePositive("dailyBorrowLimit", request.dailyBorrowLimit()) : null,
                request.totalBorrowLimit() != null ? Amounts.parsePositive("totalBorrowLimit", request.totalBorrowLimit()) : null)));
    }

    private static PartnerResponse issued(IssuedKey issued) {
        return PartnerResponse.from(issued.partner(), issued.apiKey());
    }

    private static <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }
}
