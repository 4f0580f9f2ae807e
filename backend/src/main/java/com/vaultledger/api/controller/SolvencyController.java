package com.vaultledger.api.controller;

import com.vaultledger.api.dto.BorrowRequest;
import com.vaultledger.api.dto.DepositRequest;
import com.vaultledger.api.dto.PositionAmountRequest;
import com.vaultledger.api.dto.PositionResponse;
import com.vaultledger.api.dto.ScheduleResponse;
import com.vaultledger.auth.CallerIdentity;
import com.vaultledger.auth.CallerIdentityResolver;
import com.vaultledger.common.Amounts;
import com.vaultledger.common.AuthorizationException;
import com.vaultledger.domain.Position;
import com.vaultledger.ledger.DepositCommand;
import com.vaultledger.ledger.LoanOperations;
import com.vaultledger.ledger.PositionLedger;
import com.vaultledger.schedule.RepaymentScheduler;
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
 * User position endpoints. The caller is the position owner; admins may read any position.
 */
@RestController
@RequestMapping("/solvency")
@RequiredArgsConstructor
public class SolvencyController {

    private final CallerIdentityResolver callerIdentityResolver;
    private final LoanOperations loanOperations;
    private final PositionLedger positionLedger;
    private final RepaymentScheduler repaymentScheduler;

    @PostMapping("/deposit")
    public Mono<ResponseEntity<PositionResponse>> deposit(@RequestHeader HttpHeaders headers,
                                                          @RequestBody @Valid DepositRequest request) {
        CallerIdentity caller = callerIdentityResolver.resolve(headers);
        DepositCommand command = new DepositCommand(
                caller.address(),
                request.collateralToken(),
                Amounts.parsePositive("collateralAmount", request.collateralAmount()),
                Amounts.parsePositive("valuationUsd", request.valuationUsd()),
                request.collateralClass());
        return loanOperations.deposit(command)
                .flatMap(this::toResponse)
                .map(body -> ResponseEntity.status(HttpStatus.CREATED).body(body));
    }

    @PostMapping("/borrow")
    public Mono<ResponseEntity<PositionResponse>> borrow(@RequestHeader HttpHeaders headers,
                                                         @RequestBody @Valid BorrowRequest request) {
        CallerIdentity caller = callerIdentityResolver.resolve(headers);
        return loanOperations.borrow(caller.address(), request.positionId(),
                        Amounts.parsePositive("amount", request.amount()),
                        request.loanDurationSeconds(), request.numberOfInstallments())
                .flatMap(this::toResponse)
                .map(ResponseEntity::ok);
    }

    @PostMapping("/repay")
    public Mono<ResponseEntity<PositionResponse>> repay(@RequestHeader HttpHeaders headers,
                                                        @RequestBody @Valid PositionAmountRequest request) {
        CallerIdentity caller = callerIdentityResolver.resolve(headers);
        return loanOperations.repay(caller.address(), request.positionId(), Amounts.parsePositive("amount", request.amount()))
                .flatMap(this::toResponse)
                .map(ResponseEntity::ok);
    }

    @PostMapping("/withdraw")
    public Mono<ResponseEntity<PositionResponse>> withdraw(@RequestHeader HttpHeaders headers,
                                                           @RequestBody @Valid PositionAmountRequest request) {
        CallerIdentity caller = callerIdentityResolver.resolve(headers);
        return loanOperations.withdraw(caller.address(), request.positionId(), Amounts.parsePositive("amount", request.amount()))
                .flatMap(this::toResponse)
                .map(ResponseEntity::ok);
    }

    @GetMapping("/positions/my")
    public Mono<List<PositionResponse>> myPositions(@RequestHeader HttpHeaders headers) {
        CallerIdentity caller = callerIdentityResolver.resolve(headers);
        return blocking(() -> positionLedger.getUserPositions(caller.address()).stream().map(this::describe).toList());
    }

    @GetMapping("/positions/my/active")
    public Mono<List<PositionResponse>> myActivePositions(@RequestHeader HttpHeaders headers) {
        CallerIdentity caller = callerIdentityResolver.resolve(headers);
        return blocking(() -> positionLedger.getActivePositions(caller.address()).stream().map(this::describe).toList());
    }

    @GetMapping("/position/{positionId}")
    public Mono<PositionResponse> position(@RequestHeader HttpHeaders headers, @PathVariable long positionId) {
        CallerIdentity caller = callerIdentityResolver.resolve(headers);
        return blocking(() -> describe(readable(caller, positionLedger.getPosition(positionId))));
    }

    @GetMapping("/position/{positionId}/schedule")
    public Mono<ScheduleResponse> schedule(@RequestHeader HttpHeaders headers, @PathVariable long positionId) {
        CallerIdentity caller = callerIdentityResolver.resolve(headers);
        return blocking(() -> ScheduleResponse.from(
                repaymentScheduler.view(readable(caller, positionLedger.getPosition(positionId)))));
    }

    private static Position readable(CallerIdentity caller, Position position) {
        if (!caller.isAdmin() && !caller.address().equalsIgnoreCase(position.getOwner())) {
            throw AuthorizationException.forbidden("Position " + position.getPositionId() + " does not belong to " + caller.address());
        }
        return position;
    }

    private Mono<PositionResponse> toResponse(Position position) {
        return blocking(() -> describe(position));
    }

    private PositionResponse describe(Position position) {
        return PositionResponse.from(position, positionLedger.healthOf(position));
    }

    private static <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }
}
