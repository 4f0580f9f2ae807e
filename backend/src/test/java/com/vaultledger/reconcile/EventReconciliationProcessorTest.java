package com.vaultledger.reconcile;

import com.vaultledger.asset.CollateralAssetService;
import com.vaultledger.common.RetryPolicy;
import com.vaultledger.domain.AppliedEvent;
import com.vaultledger.domain.AppliedEventRepository;
import com.vaultledger.domain.ChainEvent;
import com.vaultledger.domain.ChainEventRepository;
import com.vaultledger.domain.ChainEventStatus;
import com.vaultledger.domain.CollateralClass;
import com.vaultledger.domain.Position;
import com.vaultledger.domain.PositionStatus;
import com.vaultledger.domain.VaultEventType;
import com.vaultledger.ledger.NewPosition;
import com.vaultledger.ledger.PositionLedger;
import com.vaultledger.ledger.TxRef;
import com.vaultledger.schedule.RepaymentScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EventReconciliationProcessorTest {

    private static final String USER = "0x1111111111111111111111111111111111111111";
    private static final String TOKEN = "0x00000000000000000000000000000000000000f1";
    private static final String TX_CREATE = "0x" + "1".repeat(64);
    private static final String TX_BORROW = "0x" + "2".repeat(64);

    @Mock
    ChainEventRepository chainEventRepository;
    @Mock
    AppliedEventRepository appliedEventRepository;
    @Mock
    PositionLedger positionLedger;
    @Mock
    RepaymentScheduler repaymentScheduler;
    @Mock
    CollateralAssetService collateralAssetService;
    @Mock
    VaultLogDecoder decoder;

    private EventReconciliationProcessor processor;

    @BeforeEach
    void setUp() {
        processor = new EventReconciliationProcessor(chainEventRepository, appliedEventRepository, positionLedger,
                repaymentScheduler, collateralAssetService, decoder, new ReconcileProperties(),
                new RetryPolicy(10L, 0.0, 3, 100L), Runnable::run);
        lenient().when(chainEventRepository.save(any(ChainEvent.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    private static ChainEvent event(VaultEventType type, String orderingKey, Long positionId, String txHash,
                                    long block, int logIndex, Map<String, String> args) {
        ChainEvent event = new ChainEvent();
        event.setEventKey(ChainEvent.keyOf(txHash, logIndex));
        event.setType(type);
        event.setOrderingKey(orderingKey);
        event.setPositionId(positionId);
        event.setContractAddress(TOKEN);
        event.setTxHash(txHash);
        event.setBlockNumber(block);
        event.setLogIndex(logIndex);
        event.setPayload(new HashMap<>(args));
        event.setStatus(ChainEventStatus.PENDING);
        return event;
    }

    private static ChainEvent created(long positionId) {
        return event(VaultEventType.POSITION_CREATED, "position:" + positionId, positionId, TX_CREATE, 10, 0, Map.of(
                "user", USER, "collateralToken", TOKEN, "collateralAmount", "1000", "tokenValueUSD", "10000000000",
                "tokenType", "0"));
    }

    private static ChainEvent borrowed(long positionId) {
        return event(VaultEventType.USDC_BORROWED, "position:" + positionId, positionId, TX_BORROW, 11, 1,
                Map.of("amount", "7000000000", "totalDebt", "7000000000"));
    }

    private static ChainEvent plan(long positionId) {
        return event(VaultEventType.REPAYMENT_PLAN_CREATED, "position:" + positionId, positionId, TX_BORROW, 11, 2,
                Map.of("loanDuration", "2592000", "numberOfInstallments", "1", "installmentInterval", "2592000"));
    }

    private static ChainEvent transfer(String txHash, int logIndex) {
        return event(VaultEventType.TRANSFER, "token:" + TOKEN, null, txHash, 12, logIndex,
                Map.of("from", USER, "to", "0x00000000000000000000000000000000000000aa", "value", "25"));
    }

    @Test
    @DisplayName("events of one position apply in chain order regardless of queue order")
    void appliesInChainOrder() {
        ChainEvent borrow = borrowed(1);
        ChainEvent create = created(1);
        when(chainEventRepository.findDue(any(), anyInt())).thenReturn(List.of(borrow, create));
        when(chainEventRepository.findFirstByTxHashAndType(TX_BORROW, VaultEventType.REPAYMENT_PLAN_CREATED))
                .thenReturn(Optional.of(plan(1)));

        int applied = processor.processDue();

        assertThat(applied).isEqualTo(2);
        InOrder order = inOrder(positionLedger);
        order.verify(positionLedger).createPosition(eq(new NewPosition(1L, USER, TOKEN, CollateralClass.CLASS_A,
                BigInteger.valueOf(1000), BigInteger.valueOf(10_000_000_000L))), eq(TxRef.confirmed(TX_CREATE, 10L)));
        order.verify(positionLedger).recordChainBorrow(1L, BigInteger.valueOf(7_000_000_000L), 2_592_000L, 1,
                TxRef.confirmed(TX_BORROW, 11L));
        order.verify(positionLedger).applyChainTotals(1L, BigInteger.valueOf(7_000_000_000L), null);
        assertThat(borrow.getStatus()).isEqualTo(ChainEventStatus.APPLIED);
        assertThat(create.getStatus()).isEqualTo(ChainEventStatus.APPLIED);
    }

    @Test
    @DisplayName("a failure schedules a retry and holds back the rest of the group")
    void failureStopsGroup() {
        ChainEvent create = created(1);
        ChainEvent borrow = borrowed(1);
        when(chainEventRepository.findDue(any(), anyInt())).thenReturn(List.of(create, borrow));
        when(positionLedger.createPosition(any(), any())).thenThrow(new IllegalStateException("mongo unavailable"));

        int applied = processor.processDue();

        assertThat(applied).isZero();
        assertThat(create.getStatus()).isEqualTo(ChainEventStatus.RETRY);
        assertThat(create.getAttempts()).isEqualTo(1);
        assertThat(create.getNextAttemptAt()).isAfter(Instant.now().minusSeconds(1));
        assertThat(create.getLastError()).contains("mongo unavailable");
        assertThat(borrow.getStatus()).isEqualTo(ChainEventStatus.PENDING);
        verify(positionLedger, never()).recordChainBorrow(anyLong(), any(), anyLong(), anyInt(), any());
    }

    @Test
    @DisplayName("a borrow waits for its repayment plan log")
    void borrowWithoutPlanRetries() {
        ChainEvent borrow = borrowed(1);
        when(chainEventRepository.findDue(any(), anyInt())).thenReturn(List.of(borrow));
        when(chainEventRepository.findFirstByTxHashAndType(TX_BORROW, VaultEventType.REPAYMENT_PLAN_CREATED))
                .thenReturn(Optional.empty());

        processor.processDue();

        assertThat(borrow.getStatus()).isEqualTo(ChainEventStatus.RETRY);
        assertThat(borrow.getLastError()).contains("not ingested yet");
    }

    @Test
    @DisplayName("the last allowed attempt dead-letters the event")
    void deadLetter() {
        ChainEvent create = created(1);
        create.setAttempts(2);
        create.setStatus(ChainEventStatus.RETRY);
        when(chainEventRepository.findDue(any(), anyInt())).thenReturn(List.of(create));
        when(positionLedger.createPosition(any(), any())).thenThrow(new IllegalArgumentException("bad payload"));

        processor.processDue();

        assertThat(create.getStatus()).isEqualTo(ChainEventStatus.DEAD);
        assertThat(create.getAttempts()).isEqualTo(3);
        assertThat(create.getNextAttemptAt()).isNull();
    }

    @Test
    @DisplayName("a group behind an unapplied earlier event does not run")
    void blockedGroup() {
        ChainEvent borrow = borrowed(1);
        ChainEvent earlier = created(1);
        earlier.setStatus(ChainEventStatus.DEAD);
        when(chainEventRepository.findDue(any(), anyInt())).thenReturn(List.of(borrow));
        when(chainEventRepository.findBlockedBefore("position:1", 11L, 1)).thenReturn(List.of(earlier));

        assertThat(processor.processDue()).isZero();
        verifyNoInteractions(positionLedger);
        assertThat(borrow.getStatus()).isEqualTo(ChainEventStatus.PENDING);
    }

    @Test
    @DisplayName("a transfer already applied is acknowledged without touching balances")
    void transferDedupe() {
        ChainEvent event = transfer("0x" + "3".repeat(64), 0);
        when(chainEventRepository.findDue(any(), anyInt())).thenReturn(List.of(event));
        when(appliedEventRepository.existsById(event.getEventKey())).thenReturn(true);

        assertThat(processor.processDue()).isZero();
        assertThat(event.getStatus()).isEqualTo(ChainEventStatus.APPLIED);
        verifyNoInteractions(collateralAssetService);
    }

    @Test
    @DisplayName("a failed balance update schedules a retry without marking the transfer applied")
    void transferFailureRetries() {
        ChainEvent event = transfer("0x" + "4".repeat(64), 3);
        when(chainEventRepository.findDue(any(), anyInt())).thenReturn(List.of(event));
        doThrow(new IllegalStateException("write conflict")).when(collateralAssetService)
                .applyTransfer(anyString(), anyString(), anyString(), anyString(), any(), anyLong());

        processor.processDue();

        verify(appliedEventRepository, never()).insert(any(AppliedEvent.class));
        assertThat(event.getStatus()).isEqualTo(ChainEventStatus.RETRY);
    }

    @Test
    @DisplayName("an unseen repayment is capped at the remaining obligation and the chain debt recorded")
    void repaymentCapped() {
        ChainEvent repaid = event(VaultEventType.LOAN_REPAID, "position:1", 1L, "0x" + "5".repeat(64), 13, 0,
                Map.of("amountPaid", "800", "principal", "700", "interest", "100", "remainingDebt", "0"));
        Position position = new Position();
        position.setPositionId(1L);
        position.setStatus(PositionStatus.ACTIVE);
        when(chainEventRepository.findDue(any(), anyInt())).thenReturn(List.of(repaid));
        when(positionLedger.getPosition(1L)).thenReturn(position);
        when(repaymentScheduler.remainingObligation(position.getInstallments())).thenReturn(BigInteger.valueOf(750));

        processor.processDue();

        verify(positionLedger).recordRepayment(1L, BigInteger.valueOf(750), TxRef.confirmed("0x" + "5".repeat(64), 13L));
        verify(positionLedger).applyChainTotals(1L, BigInteger.ZERO, null);
    }

    @Test
    @DisplayName("a requeued undecoded log is decoded again and applied as the event it really is")
    void undecodedRequeueAppliesDecodedEvent() {
        ChainEvent raw = event(VaultEventType.UNDECODED, "token:" + TOKEN, null, "0x" + "6".repeat(64), 14, 1,
                Map.of("rawTopics", "", "rawData", "0x"));
        ChainEvent decoded = transfer("0x" + "6".repeat(64), 1);
        when(chainEventRepository.findDue(any(), anyInt())).thenReturn(List.of(raw));
        when(decoder.redecode(raw)).thenReturn(Optional.of(decoded));

        assertThat(processor.processDue()).isEqualTo(1);

        verify(collateralAssetService).applyTransfer(eq(raw.getEventKey()), eq(TOKEN), eq(USER),
                eq("0x00000000000000000000000000000000000000aa"), eq(BigInteger.valueOf(25)), eq(14L));
        assertThat(raw.getType()).isEqualTo(VaultEventType.TRANSFER);
        assertThat(raw.getStatus()).isEqualTo(ChainEventStatus.APPLIED);
    }
}
