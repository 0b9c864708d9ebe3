package decentralabs.settlement.service.settlement;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.math.BigInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.Hash;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameter;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.Request;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.core.methods.response.EthChainId;
import org.web3j.protocol.core.methods.response.EthGetTransactionCount;
import org.web3j.protocol.core.methods.response.EthGetTransactionReceipt;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.utils.Numeric;

import decentralabs.settlement.config.TargetChainProperties;
import decentralabs.settlement.exception.SettlementFailedException;
import decentralabs.settlement.exception.SettlementFailureReason;

@ExtendWith(MockitoExtension.class)
class Web3jTargetChainGatewayTest {

    private static final Credentials CREDENTIALS =
        Credentials.create("0x4c0883a69102937d6231471b5dbb6204fe5129617082792ae468d01a3f362318");
    private static final String RECIPIENT = "0x833589fCD6eDb6E08f4c7C32D4f71b54bdA02913";
    private static final String BASE_SEPOLIA_CHAIN_ID = "0x14a34";

    @Mock
    private TargetChainRpcProvider rpcProvider;

    @Mock
    private Web3j web3j;

    private Web3jTargetChainGateway gateway;

    @BeforeEach
    void setUp() {
        gateway = new Web3jTargetChainGateway(rpcProvider, new TargetChainProperties());
    }

    @SuppressWarnings("unchecked")
    private static <T extends Response<?>> Request<?, T> request(T response) throws IOException {
        Request<?, T> request = mock(Request.class);
        when(request.send()).thenReturn(response);
        return request;
    }

    private static <T extends Response<?>> T withError(T response, String message) {
        response.setError(new Response.Error(-32000, message));
        return response;
    }

    private void stubChainId(String chainIdHex) throws IOException {
        EthChainId chainId = new EthChainId();
        chainId.setResult(chainIdHex);
        doReturn(request(chainId)).when(web3j).ethChainId();
    }

    private void stubPendingCount(long count) throws IOException {
        EthGetTransactionCount response = new EthGetTransactionCount();
        response.setResult(Numeric.encodeQuantity(BigInteger.valueOf(count)));
        doReturn(request(response)).when(web3j)
            .ethGetTransactionCount(CREDENTIALS.getAddress(), DefaultBlockParameterName.PENDING);
    }

    @Nested
    @DisplayName("tokenBalance")
    class TokenBalanceTests {

        @Test
        @DisplayName("Should decode the balanceOf result")
        void shouldDecodeBalance() throws Exception {
            when(rpcProvider.web3j()).thenReturn(web3j);
            EthCall call = new EthCall();
            call.setResult(Numeric.toHexStringWithPrefixZeroPadded(BigInteger.valueOf(1_250_000), 64));
            doReturn(request(call)).when(web3j).ethCall(any(Transaction.class), any(DefaultBlockParameter.class));

            assertThat(gateway.tokenBalance(CREDENTIALS.getAddress())).isEqualTo(BigInteger.valueOf(1_250_000));
        }

        @Test
        @DisplayName("Should raise IOException for an RPC error")
        void shouldRaiseOnRpcError() throws Exception {
            when(rpcProvider.web3j()).thenReturn(web3j);
            doReturn(request(withError(new EthCall(), "execution reverted"))).when(web3j)
                .ethCall(any(Transaction.class), any(DefaultBlockParameter.class));

            assertThatThrownBy(() -> gateway.tokenBalance(CREDENTIALS.getAddress()))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("execution reverted");
        }

        @Test
        @DisplayName("Should raise IOException when no endpoint answers")
        void shouldRaiseWhenAllEndpointsFail() {
            when(rpcProvider.web3j()).thenThrow(new IllegalStateException("All 1 target chain RPC endpoints failed"));

            assertThatThrownBy(() -> gateway.tokenBalance(CREDENTIALS.getAddress()))
                .isInstanceOf(IOException.class);
        }
    }

    @Nested
    @DisplayName("prepareTransfer and broadcast")
    class TransferTests {

        @Test
        @DisplayName("Should sign locally and derive the hash from the signed payload")
        void shouldSignTransfer() throws Exception {
            when(rpcProvider.web3j()).thenReturn(web3j);
            stubChainId(BASE_SEPOLIA_CHAIN_ID);
            stubPendingCount(5);

            PreparedTransfer transfer = gateway.prepareTransfer(CREDENTIALS, RECIPIENT, BigInteger.valueOf(50_000));

            assertThat(transfer.nonce()).isEqualTo(BigInteger.valueOf(5));
            assertThat(transfer.txHash()).isEqualTo(Hash.sha3(transfer.signedTransaction()));
            assertThat(transfer.txHash()).matches("0x[0-9a-f]{64}");
        }

        @Test
        @DisplayName("Should not reuse a nonce the pool has not caught up with")
        void shouldAdvanceNonceAfterBroadcast() throws Exception {
            when(rpcProvider.web3j()).thenReturn(web3j);
            stubChainId(BASE_SEPOLIA_CHAIN_ID);
            stubPendingCount(5);
            PreparedTransfer first = gateway.prepareTransfer(CREDENTIALS, RECIPIENT, BigInteger.ONE);
            EthSendTransaction accepted = new EthSendTransaction();
            accepted.setResult(first.txHash());
            doReturn(request(accepted)).when(web3j).ethSendRawTransaction(first.signedTransaction());
            gateway.broadcast(first);

            PreparedTransfer second = gateway.prepareTransfer(CREDENTIALS, RECIPIENT, BigInteger.ONE);

            assertThat(second.nonce()).isEqualTo(BigInteger.valueOf(6));
            verify(web3j, times(1)).ethChainId();
        }

        @Test
        @DisplayName("Should refuse to sign for an endpoint on another chain")
        void shouldRejectChainMismatch() throws Exception {
            when(rpcProvider.web3j()).thenReturn(web3j);
            stubChainId("0x2105");

            assertThatThrownBy(() -> gateway.prepareTransfer(CREDENTIALS, RECIPIENT, BigInteger.ONE))
                .isInstanceOf(SettlementFailedException.class)
                .satisfies(e -> assertThat(((SettlementFailedException) e).getReason())
                    .isEqualTo(SettlementFailureReason.CONFIGURATION));
        }

        @Test
        @DisplayName("Should map a node rejection to SUBMISSION_REJECTED")
        void shouldMapRejectedBroadcast() throws Exception {
            when(rpcProvider.web3j()).thenReturn(web3j);
            doReturn(request(withError(new EthSendTransaction(), "nonce too low"))).when(web3j)
                .ethSendRawTransaction(anyString());
            PreparedTransfer transfer = new PreparedTransfer("0x" + "ab".repeat(32), "0xdeadbeef", BigInteger.ONE);

            assertThatThrownBy(() -> gateway.broadcast(transfer))
                .isInstanceOf(SettlementFailedException.class)
                .satisfies(e -> {
                    SettlementFailedException failure = (SettlementFailedException) e;
                    assertThat(failure.getReason()).isEqualTo(SettlementFailureReason.SUBMISSION_REJECTED);
                    assertThat(failure.getTxRef()).isNull();
                });
        }
    }

    @Nested
    @DisplayName("findReceipt")
    class ReceiptTests {

        @Test
        void returnsReceiptWhenMined() throws Exception {
            when(rpcProvider.web3j()).thenReturn(web3j);
            TransactionReceipt receipt = new TransactionReceipt();
            receipt.setStatus("0x1");
            EthGetTransactionReceipt response = new EthGetTransactionReceipt();
            response.setResult(receipt);
            doReturn(request(response)).when(web3j).ethGetTransactionReceipt(eq("0xabc"));

            assertThat(gateway.findReceipt("0xabc")).contains(receipt);
        }

        @Test
        void returnsEmptyWhileUnmined() throws Exception {
            when(rpcProvider.web3j()).thenReturn(web3j);
            doReturn(request(new EthGetTransactionReceipt())).when(web3j).ethGetTransactionReceipt("0xabc");

            assertThat(gateway.findReceipt("0xabc")).isEmpty();
        }
    }
}
