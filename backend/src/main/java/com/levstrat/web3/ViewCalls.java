package com.levstrat.web3;

import com.levstrat.web3.exception.RetryableRpcException;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;

import java.io.IOException;
import java.util.List;
import java.util.Locale;

/**
 * eth_call helper for view functions. Rate-limit and IO problems surface as
 * {@link RetryableRpcException} so the factory can switch endpoint; reverts do not.
 */
final class ViewCalls {
    private ViewCalls() {}

    @SuppressWarnings("rawtypes")
    static List<Type> call(Web3j web3, String to, Function fn) {
        EthCall call;
        try {
            call = web3.ethCall(
                    Transaction.createEthCallTransaction(null, to, FunctionEncoder.encode(fn)),
                    DefaultBlockParameterName.LATEST).send();
        } catch (IOException e) {
            throw new RetryableRpcException("transport error on " + fn.getName() + "@" + to + ": " + e.getMessage(), e);
        }

        if (call.hasError()) {
            String err = call.getError().getMessage();
            if (isRateLimited(err)) {
                throw new RetryableRpcException("rate-limited on " + fn.getName() + ": " + err);
            }
            throw new IllegalStateException(fn.getName() + "@" + to + " failed: " + err);
        }
        if (call.isReverted()) {
            throw new IllegalStateException(fn.getName() + "@" + to + " reverted: " + call.getRevertReason());
        }

        List<Type> out = FunctionReturnDecoder.decode(call.getValue(), fn.getOutputParameters());
        if (out.size() != fn.getOutputParameters().size()) {
            throw new IllegalStateException(fn.getName() + "@" + to + " returned undecodable data: " + call.getValue());
        }
        return out;
    }

    /**
     * Heuristics to detect RPC rate-limit responses (public RPCs vary in messages).
     */
    static boolean isRateLimited(String msg) {
        if (msg == null) return false;
        String m = msg.toLowerCase(Locale.ROOT);
        return m.contains("429") ||
                m.contains("rate limit") ||
                m.contains("over rate") ||
                m.contains("1015") ||
                m.contains("too many requests");
    }
}
