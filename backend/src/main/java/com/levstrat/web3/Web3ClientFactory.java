// com.levstrat.web3.Web3ClientFactory.java
package com.levstrat.web3;

import com.levstrat.config.AppProps;
import com.levstrat.web3.exception.RetryableRpcException;
import lombok.extern.slf4j.Slf4j;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Builds and manages multiple Web3j clients per network and fails over
 * between RPC endpoints on rate-limit or IO errors.
 */
@Slf4j
public class Web3ClientFactory {

    private final AppProps props;
    private final Function<String, Web3j> connector;

    public Web3ClientFactory(AppProps props) {
        this(props, url -> Web3j.build(new HttpService(url)));
    }

    /** @param connector builds a client for an RPC url (replaceable in tests) */
    public Web3ClientFactory(AppProps props, Function<String, Web3j> connector) {
        this.props = props;
        this.connector = connector;
    }

    /**
     * Endpoint state with simple penalty window (circuit half-open).
     */
    private static class Endpoint {
        final String url;
        final Web3j web3j;
        volatile Instant penaltyUntil = Instant.EPOCH;

        Endpoint(String url, Web3j web3j) {
            this.url = url;
            this.web3j = web3j;
        }

        boolean isAvailable() {
            return Instant.now().isAfter(penaltyUntil);
        }

        void penalize(Duration d) {
            penaltyUntil = Instant.now().plus(d);
        }
    }

    /** Network -> endpoints ring */
    private final Map<String, List<Endpoint>> endpointsByNet = new ConcurrentHashMap<>();
    /** Network -> round-robin index */
    private final Map<String, Integer> rrIndex = new ConcurrentHashMap<>();

    /**
     * Execute a read against Web3j with RPC failover.
     *
     * @param network network key (e.g. "mainnet")
     * @param fn      call to execute; MUST throw RetryableRpcException for rate-limit / transport failures
     * @param <T>     return type
     */
    public <T> T executeWithFailover(String network, Function<Web3j, T> fn) {
        List<Endpoint> ring = getOrInit(network);
        if (ring.isEmpty()) throw new IllegalStateException("No RPC URLs configured for network: " + network);

        AppProps.Failover cfg = props.require(network).getFailover();
        final int total = ring.size();
        int start = rrIndex.compute(network, (k, v) -> v == null ? 0 : (v + 1) % total);
        int tried = 0;

        Throwable last = null;

        while (tried < total) {
            int idx = (start + tried) % total;
            Endpoint ep = ring.get(idx);

            if (!ep.isAvailable()) {
                tried++;
                continue;
            }

            try {
                T out = fn.apply(ep.web3j);
                rrIndex.put(network, idx);
                return out;
            } catch (RetryableRpcException ex) {
                last = ex;
                log.warn("[web3 failover] Retryable on {}: {}", ep.url, ex.getMessage());
                ep.penalize(cfg.getPenalty());
            } catch (RuntimeException ex) {
                String msg = ex.getMessage() == null ? "" : ex.getMessage().toLowerCase(Locale.ROOT);
                if (isRetryableTransport(msg)) {
                    last = ex;
                    log.warn("[web3 failover] Transport retryable on {}: {}", ep.url, ex.toString());
                    ep.penalize(cfg.getPenalty());
                } else {
                    // e.g. contract revert: another endpoint will answer the same
                    log.error("[web3 failover] Non-retryable on {}: {}", ep.url, ex.toString());
                    throw ex;
                }
            }

            tried++;
            if (tried < total) sleepBackoff(cfg, tried);
        }

        if (last instanceof RuntimeException re) throw re;
        throw new IllegalStateException("All RPC endpoints failed for network=" + network, last);
    }

    private void sleepBackoff(AppProps.Failover cfg, int attempt) {
        long pow = Math.min(attempt, 4);
        long delay = Math.min(cfg.getBaseBackoff().toMillis() * (1L << pow), cfg.getMaxBackoff().toMillis());
        if (delay <= 0) return;
        try {
            Thread.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted during RPC failover backoff", ie);
        }
    }

    /** Heuristics for public RPCs. */
    static boolean isRetryableTransport(String msg) {
        if (msg.isEmpty()) return true;
        return msg.contains("429") ||
                msg.contains("rate limit") ||
                msg.contains("over rate") ||
                msg.contains("1015") ||
                msg.contains("too many requests") ||
                msg.contains("timeout") ||
                msg.contains("connection") ||
                msg.contains("refused") ||
                msg.contains("unexpected end of stream");
    }

    private List<Endpoint> getOrInit(String network) {
        return endpointsByNet.computeIfAbsent(network, net -> {
            var urls = props.require(net).getRpcUrls();
            if (urls == null || urls.isEmpty()) return List.of();
            List<Endpoint> list = new ArrayList<>(urls.size());
            for (String u : urls) list.add(new Endpoint(u, connector.apply(u)));
            log.info("Initialized {} RPC endpoints for {}: {}", list.size(), net, urls);
            return list;
        });
    }
}
