package com.levstrat.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "app")
@Data
public class AppProps {
    private Map<String, Network> network;
    private Oracle oracle = new Oracle();
    /** Keyed by token address. */
    private Map<String, Token> tokens = new LinkedHashMap<>();
    private Strategy strategy = new Strategy();
    private Sandbox sandbox = new Sandbox();
    private Valuation valuation = new Valuation();

    public Network require(String networkName) {
        Network n = (network != null) ? network.get(networkName) : null;
        if (n == null) throw new IllegalArgumentException("Unknown network: " + networkName);
        return n;
    }

    @Data
    public static class Network {
        private List<String> rpcUrls;
        private String chainId;
        private Failover failover = new Failover();
    }

    @Data
    public static class Failover {
        private Duration penalty = Duration.ofSeconds(20);
        private Duration baseBackoff = Duration.ofMillis(400);
        private Duration maxBackoff = Duration.ofSeconds(5);
    }

    @Data
    public static class Oracle {
        private String network;
        private Duration maxStaleness = Duration.ofHours(24);
        private String pendleOracle;
        private int pendleTwapSeconds = 900;
        /** token address -> Chainlink-style feed address */
        private Map<String, String> feeds = new LinkedHashMap<>();
        /** PT token address -> market config */
        private Map<String, PtToken> ptTokens = new LinkedHashMap<>();
    }

    @Data
    public static class PtToken {
        private String market;
        private boolean useSyRate;
        private String underlying;
    }

    @Data
    public static class Token {
        private String symbol;
        private int decimals = 18;
    }

    @Data
    public static class Strategy {
        private String address;
        private String parent;
        private String baseAsset;
        private String collateralAsset;
        private String debtAsset;
        private List<String> extraTrackedTokens = new ArrayList<>();
    }

    @Data
    public static class Sandbox {
        private String lendingPool;
        private List<Router> routers = new ArrayList<>();
        private List<Seed> seed = new ArrayList<>();
    }

    @Data
    public static class Router {
        private int id;
        private String address;
    }

    @Data
    public static class Seed {
        private String token;
        private String holder;
        private BigInteger amount = BigInteger.ZERO;
    }

    @Data
    public static class Valuation {
        private String cron = "0 0/10 * * * ?";
    }
}
