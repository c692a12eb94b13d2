package com.levstrat.swap;

import com.levstrat.exception.ValidationException;
import com.levstrat.util.AddressUtil;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/** Routers the strategy may call, keyed by the small integer id carried in SWAP payloads. */
@Slf4j
public class RouterRegistry {

    private final Map<Integer, SwapRouter> routers = new ConcurrentHashMap<>();

    public void register(int id, SwapRouter router) {
        if (id < 0 || id > 255) throw new ValidationException(ValidationException.INVALID_ROUTER, "router id out of range: " + id);
        if (router == null || AddressUtil.isZero(router.address())) {
            throw new ValidationException(ValidationException.INVALID_ROUTER, "router " + id + " has no address");
        }
        routers.put(id, router);
        log.info("[routers] id={} -> {}", id, router.address());
    }

    public SwapRouter require(int id) {
        SwapRouter r = routers.get(id);
        if (r == null) throw new ValidationException(ValidationException.INVALID_ROUTER, "router " + id + " is not configured");
        return r;
    }

    public Optional<SwapRouter> find(int id) {
        return Optional.ofNullable(routers.get(id));
    }

    public Set<Integer> ids() {
        return new TreeSet<>(routers.keySet());
    }
}
