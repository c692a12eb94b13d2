package com.levstrat.swap;

/**
 * External exchange contract. The router is trusted with nothing: it may pull at most the
 * allowance it was granted and whatever it sends back is measured, not believed.
 */
public interface SwapRouter {

    String address();

    /**
     * Invoked by {@code caller} with an opaque, operator-built payload.
     * Throwing aborts the swap; the message is forwarded as the failure reason.
     */
    void execute(String caller, byte[] payload);
}
