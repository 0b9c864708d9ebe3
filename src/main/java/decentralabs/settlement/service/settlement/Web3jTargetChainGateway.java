package decentralabs.settlement.service.settlement;

import java.io.IOException;
import java.math.BigInteger;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import org.springframework.stereotype.Component;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.Hash;
import org.web3j.crypto.RawTransaction;
import org.web3j.crypto.TransactionEncoder;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
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
import decentralabs.settlement.util.LogSanitizer;
import lombok.extern.slf4j.Slf4j;

/**
 * ERC-20 calls against the configured token contract. Transfers are legacy transactions signed
 * locally with the configured chain id; the nonce is the larger of the PENDING pool count and
 * the last nonce this process broadcast.
 */
@Component
@Slf4j
public class Web3jTargetChainGateway implements TargetChainGateway {

    private final TargetChainRpcProvider rpcProvider;
    private final String tokenAddress;
    private final long chainId;
    private final BigInteger gasLimit;
    private final BigInteger gasPriceWei;
    private final AtomicReference<BigInteger> lastBroadcastNonce = new AtomicReference<>();
    private volatile boolean chainIdVerified;

    public Web3jTargetChainGateway(TargetChainRpcProvider rpcProvider, TargetChainProperties properties) {
        this.rpcProvider = rpcProvider;
        this.tokenAddress = properties.resolveTokenAddress();
        this.chainId = properties.resolveNetwork().getChainId();
        this.gasLimit = properties.getGasLimit();
        this.gasPriceWei = properties.gasPriceWei();
    }

    @Override
    public BigInteger tokenBalance(String owner) throws IOException {
        Function function = new Function(
            "balanceOf",
            List.of(new Address(owner)),
            Collections.singletonList(new TypeReference<Uint256>() {})
        );
        EthCall response = web3j().ethCall(
            Transaction.createEthCallTransaction(owner, tokenAddress, FunctionEncoder.encode(function)),
            DefaultBlockParameterName.LATEST
        ).send();
        if (response.hasError()) {
            throw new IOException("balanceOf failed: " + response.getError().getMessage());
        }
        @SuppressWarnings("rawtypes")
        List<Type> decoded = FunctionReturnDecoder.decode(response.getValue(), function.getOutputParameters());
        if (decoded.isEmpty()) {
            throw new IOException("balanceOf returned no data from token " + tokenAddress);
        }
        return (BigInteger) decoded.get(0).getValue();
    }

    @Override
    public PreparedTransfer prepareTransfer(Credentials credentials, String recipient, BigInteger units)
        throws IOException {
        Web3j web3j = web3j();
        verifyChainId(web3j);

        Function transfer = new Function(
            "transfer",
            List.of(new Address(recipient), new Uint256(units)),
            Collections.emptyList()
        );
        BigInteger nonce = nextNonce(web3j, credentials.getAddress());
        RawTransaction rawTransaction = RawTransaction.createTransaction(
            nonce, gasPriceWei, gasLimit, tokenAddress, FunctionEncoder.encode(transfer)
        );
        String signed = Numeric.toHexString(TransactionEncoder.signMessage(rawTransaction, chainId, credentials));
        return new PreparedTransfer(Hash.sha3(signed), signed, nonce);
    }

    @Override
    public void broadcast(PreparedTransfer transfer) throws IOException {
        EthSendTransaction response = web3j().ethSendRawTransaction(transfer.signedTransaction()).send();
        if (response.hasError()) {
            String message = LogSanitizer.sanitize(response.getError().getMessage());
            log.warn("Node rejected transfer {} (nonce {}): {}", transfer.txHash(), transfer.nonce(), message);
            throw new SettlementFailedException(
                SettlementFailureReason.SUBMISSION_REJECTED,
                "Transfer rejected by node: " + message
            );
        }
        lastBroadcastNonce.accumulateAndGet(transfer.nonce(), (current, sent) -> current == null ? sent : current.max(sent));
    }

    @Override
    public Optional<TransactionReceipt> findReceipt(String txHash) throws IOException {
        EthGetTransactionReceipt response = web3j().ethGetTransactionReceipt(txHash).send();
        if (response.hasError()) {
            throw new IOException("eth_getTransactionReceipt failed: " + response.getError().getMessage());
        }
        return response.getTransactionReceipt();
    }

    private BigInteger nextNonce(Web3j web3j, String address) throws IOException {
        EthGetTransactionCount count = web3j.ethGetTransactionCount(address, DefaultBlockParameterName.PENDING).send();
        if (count.hasError()) {
            throw new IOException("eth_getTransactionCount failed: " + count.getError().getMessage());
        }
        BigInteger pending = count.getTransactionCount();
        BigInteger last = lastBroadcastNonce.get();
        if (last != null && last.compareTo(pending) >= 0) {
            return last.add(BigInteger.ONE);
        }
        return pending;
    }

    private void verifyChainId(Web3j web3j) throws IOException {
        if (chainIdVerified) {
            return;
        }
        EthChainId response = web3j.ethChainId().send();
        if (response.hasError() || response.getChainId() == null) {
            throw new IOException("eth_chainId failed");
        }
        if (response.getChainId().longValue() != chainId) {
            throw new SettlementFailedException(
                SettlementFailureReason.CONFIGURATION,
                "RPC endpoint serves chain " + response.getChainId() + ", expected " + chainId
            );
        }
        chainIdVerified = true;
    }

    private Web3j web3j() throws IOException {
        try {
            return rpcProvider.web3j();
        } catch (IllegalStateException e) {
            throw new IOException(e.getMessage(), e);
        }
    }
}
