package decentralabs.settlement.service.settlement;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.springframework.stereotype.Component;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

import decentralabs.settlement.config.TargetChainProperties;
import decentralabs.settlement.util.LogSanitizer;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;

/**
 * Web3j connections to the target chain with fallback across the configured RPC endpoints.
 * The last endpoint that answered is tried first.
 */
@Component
@Slf4j
public class TargetChainRpcProvider {

    private final List<String> rpcUrls;
    private final OkHttpClient httpClient;
    private final Map<Integer, Web3j> web3jInstances = new ConcurrentHashMap<>();
    private final AtomicInteger currentRpcIndex = new AtomicInteger();

    public TargetChainRpcProvider(TargetChainProperties properties) {
        this.rpcUrls = properties.resolveRpcUrls();
        this.httpClient = new OkHttpClient.Builder()
            .connectionPool(new ConnectionPool(10, 5, TimeUnit.MINUTES))
            .connectTimeout(30, TimeUnit.SECONDS)
            .readTimeout(30, TimeUnit.SECONDS)
            .writeTimeout(30, TimeUnit.SECONDS)
            .build();
        log.info("Target chain {} using {} RPC endpoint(s)", properties.getNetwork(), rpcUrls.size());
    }

    /**
     * Returns a connection whose endpoint answered {@code eth_blockNumber}.
     *
     * @throws IllegalStateException when every endpoint failed
     */
    public Web3j web3j() {
        int startIndex = currentRpcIndex.get();
        for (int i = 0; i < rpcUrls.size(); i++) {
            int index = (startIndex + i) % rpcUrls.size();
            Web3j web3j = web3jInstances.computeIfAbsent(index, this::connect);
            try {
                web3j.ethBlockNumber().send();
                if (index != startIndex) {
                    log.info("Switched to fallback RPC endpoint [{}]", index);
                    currentRpcIndex.set(index);
                }
                return web3j;
            } catch (Exception e) {
                log.warn("RPC endpoint [{}] failed: {} - trying next", index, LogSanitizer.sanitize(e.getMessage()));
                web3jInstances.remove(index);
                web3j.shutdown();
            }
        }
        throw new IllegalStateException("All " + rpcUrls.size() + " target chain RPC endpoints failed");
    }

    Web3j connect(int index) {
        log.debug("Creating Web3j instance for RPC endpoint [{}]", index);
        return Web3j.build(new HttpService(rpcUrls.get(index), httpClient));
    }

    @PreDestroy
    public void shutdown() {
        web3jInstances.values().forEach(Web3j::shutdown);
        web3jInstances.clear();
    }
}
