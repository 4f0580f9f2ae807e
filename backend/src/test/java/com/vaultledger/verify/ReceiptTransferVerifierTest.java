package com.vaultledger.verify;

import com.vaultledger.chain.FakeChainClient;
import com.vaultledger.chain.LogEntry;
import com.vaultledger.chain.RpcException;
import com.vaultledger.chain.VaultContract;
import com.vaultledger.chain.config.ChainProperties;
import com.vaultledger.common.ChainSubmissionException;
import com.vaultledger.common.OnChainVerificationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReceiptTransferVerifierTest {

    private static final String TX = "0x" + "ab".repeat(32);
    private static final String TOKEN = "0x00000000000000000000000000000000000000cc";
    private static final String USER = "0x1111111111111111111111111111111111111111";
    private static final String SETTLEMENT = "0x2222222222222222222222222222222222222222";
    private static final BigInteger EXPECTED = BigInteger.valueOf(100_000_000L);
    private static final Duration WAIT = Duration.ofSeconds(5);

    private FakeChainClient chain;
    private ChainProperties properties;
    private ReceiptTransferVerifier verifier;

    @BeforeEach
    void setUp() {
        chain = new FakeChainClient();
        properties = new ChainProperties();
        verifier = new ReceiptTransferVerifier(chain, properties);
    }

    private static LogEntry transfer(String token, String from, String to, BigInteger amount, int logIndex) {
        return new LogEntry(token,
                List.of(VaultContract.TRANSFER_TOPIC, FakeChainClient.word(from), FakeChainClient.word(to)),
                FakeChainClient.word(amount), 90, TX, logIndex, false);
    }

    private void seed(boolean successful, LogEntry... logs) {
        chain.receipts.put(TX, FakeChainClient.receipt(TX, 90, successful, List.of(logs)));
    }

    @Test
    @DisplayName("an exact transfer from the user to the settlement address is verified")
    void exactMatch() {
        seed(true, transfer(TOKEN, USER, SETTLEMENT, EXPECTED, 3));

        VerifiedTransfer verified = verifier.verifyTransfer(TX, USER, SETTLEMENT, EXPECTED, TOKEN).block(WAIT);

        assertThat(verified).isNotNull();
        assertThat(verified.amount()).isEqualTo(EXPECTED);
        assertThat(verified.blockNumber()).isEqualTo(90L);
        assertThat(verified.logIndex()).isEqualTo(3);
        assertThat(verified.sender()).isEqualTo(USER);
    }

    @Test
    @DisplayName("a smaller transfer is rejected with the expected and actual amounts")
    void amountMismatch() {
        seed(true, transfer(TOKEN, USER, SETTLEMENT, BigInteger.valueOf(50_000_000L), 0));

        assertThatThrownBy(() -> verifier.verifyTransfer(TX, USER, SETTLEMENT, EXPECTED, TOKEN).block(WAIT))
                .isInstanceOf(OnChainVerificationException.class)
                .hasMessage("Transfer amount mismatch. Expected: 100000000, Got: 50000000");
    }

    @Test
    @DisplayName("a larger transfer is also a mismatch")
    void overpaymentMismatch() {
        seed(true, transfer(TOKEN, USER, SETTLEMENT, EXPECTED.add(BigInteger.ONE), 0));

        assertThatThrownBy(() -> verifier.verifyTransfer(TX, USER, SETTLEMENT, EXPECTED, TOKEN).block(WAIT))
                .isInstanceOf(OnChainVerificationException.class)
                .extracting(e -> ((OnChainVerificationException) e).getErrorCode())
                .isEqualTo(OnChainVerificationException.AMOUNT_MISMATCH);
    }

    @Test
    @DisplayName("a transfer from another wallet or of another token does not count")
    void wrongPartiesOrToken() {
        seed(true,
                transfer(TOKEN, "0x3333333333333333333333333333333333333333", SETTLEMENT, EXPECTED, 0),
                transfer("0x00000000000000000000000000000000000000ff", USER, SETTLEMENT, EXPECTED, 1));

        assertThatThrownBy(() -> verifier.verifyTransfer(TX, USER, SETTLEMENT, EXPECTED, TOKEN).block(WAIT))
                .isInstanceOf(OnChainVerificationException.class)
                .extracting(e -> ((OnChainVerificationException) e).getErrorCode())
                .isEqualTo(OnChainVerificationException.TRANSFER_NOT_FOUND);
    }

    @Test
    @DisplayName("unknown and reverted transactions are rejected")
    void missingOrReverted() {
        assertThatThrownBy(() -> verifier.verifyTransfer(TX, USER, SETTLEMENT, EXPECTED, TOKEN).block(WAIT))
                .extracting(e -> ((OnChainVerificationException) e).getErrorCode())
                .isEqualTo(OnChainVerificationException.TX_NOT_FOUND);

        seed(false, transfer(TOKEN, USER, SETTLEMENT, EXPECTED, 0));
        assertThatThrownBy(() -> verifier.verifyTransfer(TX, USER, SETTLEMENT, EXPECTED, TOKEN).block(WAIT))
                .extracting(e -> ((OnChainVerificationException) e).getErrorCode())
                .isEqualTo(OnChainVerificationException.TX_REVERTED);
    }

    @Test
    @DisplayName("a transfer shallower than the required confirmations is not yet accepted")
    void confirmationDepth() {
        properties.setConfirmations(12);
        seed(true, transfer(TOKEN, USER, SETTLEMENT, EXPECTED, 0));
        chain.head.set(95);

        assertThatThrownBy(() -> verifier.verifyTransfer(TX, USER, SETTLEMENT, EXPECTED, TOKEN).block(WAIT))
                .extracting(e -> ((OnChainVerificationException) e).getErrorCode())
                .isEqualTo(OnChainVerificationException.TX_NOT_CONFIRMED);

        chain.head.set(101);
        assertThat(verifier.verifyTransfer(TX, USER, SETTLEMENT, EXPECTED, TOKEN).block(WAIT)).isNotNull();
    }

    @Test
    @DisplayName("RPC failures surface as retryable chain errors")
    void rpcFailure() {
        chain.failReads(new RpcException("HTTP 503"));

        assertThatThrownBy(() -> verifier.verifyTransfer(TX, USER, SETTLEMENT, EXPECTED, TOKEN).block(WAIT))
                .isInstanceOf(ChainSubmissionException.class)
                .satisfies(e -> assertThat(((ChainSubmissionException) e).isRetryable()).isTrue());
    }
}
