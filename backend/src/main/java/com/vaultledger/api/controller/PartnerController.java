package com.vaultledger.api.controller;

import com.vaultledger.api.dto.PartnerBorrowRequest;
import com.vaultledger.api.dto.PartnerLoanResponse;
import com.vaultledger.api.dto.PartnerRepayRequest;
import com.vaultledger.api.dto.PartnerStatsResponse;
import com.vaultledger.api.dto.RepayWithTransferRequest;
import com.vaultledger.common.Amounts;
import com.vaultledger.common.VaultLedgerException;
import com.vaultledger.domain.Partner;
import com.vaultledger.domain.PartnerLoanStatus;
import com.vaultledger.partner.PartnerApiCall;
import com.vaultledger.partner.PartnerApiLogService;
import com.vaultledger.partner.PartnerAuthenticator;
import com.vaultledger.partner.PartnerBorrowCommand;
import com.vaultledger.partner.PartnerLoanGateway;
import com.vaultledger.partner.TransferRepaymentCommand;
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
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Partner lending API, authenticated by {@code Authorization: Bearer pk_...}. Every authenticated call leaves an
 * entry in the partner API log.
 */
@RestController
@RequestMapping("/partners")
@RequiredArgsConstructor
public class PartnerController {

    private final PartnerAuthenticator partnerAuthenticator;
    private final PartnerLoanGateway partnerLoanGateway;
    private final PartnerApiLogService partnerApiLogService;

    @PostMapping("/borrow")
    public Mono<ResponseEntity<PartnerLoanResponse>> borrow(
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestBody @Valid PartnerBorrowRequest request) {
        return audited(authorization, "POST", "/partners/borrow", request.partnerLoanId(), request.userWallet(),
                HttpStatus.CREATED,
                partner -> partnerLoanGateway.borrow(partner, new PartnerBorrowCommand(
                        request.partnerLoanId(),
                        request.userWallet(),
                        Amounts.parsePositive("amount", request.amount()),
                        request.loanDurationSeconds(),
                        request.numberOfInstallments())))
                .map(loan -> ResponseEntity.status(HttpStatus.CREATED).body(PartnerLoanResponse.from(loan)));
    }

    @PostMapping("/repay")
    public Mono<PartnerLoanResponse> repay(
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestBody @Valid PartnerRepayRequest request) {
        return audited(authorization, "POST", "/partners/repay", request.partnerLoanId(), null, HttpStatus.OK,
                partner -> partnerLoanGateway.repay(partner, request.partnerLoanId(),
                        Amounts.parsePositive("repaymentAmount", request.repaymentAmount())))
                .map(PartnerLoanResponse::from);
    }

    @PostMapping("/repay-with-transfer")
    public Mono<PartnerLoanResponse> repayWithTransfer(
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestBody @Valid RepayWithTransferRequest request) {
        return audited(authorization, "POST", "/partners/repay-with-transfer", request.partnerLoanId(),
                request.userWallet(), HttpStatus.OK,
                partner -> partnerLoanGateway.repayWithTransfer(partner, new TransferRepaymentCommand(
                        request.partnerLoanId(),
                        request.userWallet(),
                        Amounts.parsePositive("repaymentAmount", request.repaymentAmount()),
                        request.transferTxHash())))
                .map(PartnerLoanResponse::from);
    }

    @GetMapping("/loans/{partnerLoanId}")
    public Mono<PartnerLoanResponse> loan(
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable String partnerLoanId) {
        return audited(authorization, "GET", "/partners/loans/" + partnerLoanId, partnerLoanId, null, HttpStatus.OK,
                partner -> blocking(() -> PartnerLoanResponse.from(partnerLoanGateway.getLoan(partner, partnerLoanId))));
    }

    @GetMapping("/loans")
    public Mono<List<PartnerLoanResponse>> loans(
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestParam(required = false) String userWallet,
            @RequestParam(required = false) PartnerLoanStatus status) {
        return audited(authorization, "GET", "/partners/loans", null, userWallet, HttpStatus.OK,
                partner -> blocking(() -> partnerLoanGateway.listLoans(partner, userWallet, status).stream()
                        .map(PartnerLoanResponse::from)
                        .toList()));
    }

    @GetMapping("/stats")
    public Mono<PartnerStatsResponse> stats(
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        return audited(authorization, "GET", "/partners/stats", null, null, HttpStatus.OK,
                partner -> blocking(() -> PartnerStatsResponse.from(partnerLoanGateway.stats(partner))));
    }

    /**
     * Runs an authenticated call and writes its audit entry, success or failure. Calls that fail authentication
     * have no partner to attribute them to and are not recorded.
     */
    private <T> Mono<T> audited(String authorization, String method, String endpoint, String partnerLoanId,
                                String userWallet, HttpStatus successStatus, Function<Partner, Mono<T>> call) {
        return authenticate(authorization).flatMap(partner -> {
            long started = System.nanoTime();
            return Mono.defer(() -> call.apply(partner))
                    .flatMap(result -> partnerApiLogService.record(partner, new PartnerApiCall(method, endpoint,
                                    successStatus.value(), elapsedMs(started), null, null, partnerLoanId, userWallet))
                            .thenReturn(result))
                    .onErrorResume(e -> partnerApiLogService.record(partner, failure(method, endpoint, e,
                                    elapsedMs(started), partnerLoanId, userWallet))
                            .then(Mono.<T>error(e)));
        });
    }

    private static PartnerApiCall failure(String method, String endpoint, Throwable e, long elapsedMs,
                                          String partnerLoanId, String userWallet) {
        if (e instanceof VaultLedgerException known) {
            return new PartnerApiCall(method, endpoint, ApiExceptionHandler.statusOf(known).value(), elapsedMs,
                    known.getErrorCode(), known.getMessage(), partnerLoanId, userWallet);
        }
        return new PartnerApiCall(method, endpoint, HttpStatus.INTERNAL_SERVER_ERROR.value(), elapsedMs,
                "INTERNAL_ERROR", e.getClass().getSimpleName(), partnerLoanId, userWallet);
    }

    private static long elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000L;
    }

    private Mono<Partner> authenticate(String authorization) {
        return blocking(() -> partnerAuthenticator.authenticate(authorization));
    }

    private static <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }
}
