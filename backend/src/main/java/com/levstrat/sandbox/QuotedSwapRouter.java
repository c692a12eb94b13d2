package com.levstrat.sandbox;

import com.levstrat.exception.ExternalCallException;
import com.levstrat.ledger.TokenLedger;
import com.levstrat.swap.SwapRouter;
import com.levstrat.util.AddressUtil;
import lombok.extern.slf4j.Slf4j;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Sandbox router that fills exactly the quote carried in its payload,
 * {@code abi.encode(address tokenIn, uint256 amountIn, address tokenOut, uint256 amountOut)}:
 * pulls {@code amountIn} from the caller through its allowance and pays {@code amountOut}
 * from its own inventory on the ledger.
 */
@Slf4j
public class QuotedSwapRouter implements SwapRouter {

    private static final Function QUOTE = new Function("quote", Collections.emptyList(), Arrays.asList(
            new TypeReference<Address>() {},
            new TypeReference<Uint256>() {},
            new TypeReference<Address>() {},
            new TypeReference<Uint256>() {}));

    private final String address;
    private final TokenLedger ledger;

    public QuotedSwapRouter(String address, TokenLedger ledger) {
        this.address = AddressUtil.normalize(address);
        this.ledger = ledger;
    }

    public static byte[] quote(String tokenIn, BigInteger amountIn, String tokenOut, BigInteger amountOut) {
        return Numeric.hexStringToByteArray(FunctionEncoder.encodeConstructor(Arrays.asList(
                new Address(tokenIn), new Uint256(amountIn), new Address(tokenOut), new Uint256(amountOut))));
    }

    @Override
    public String address() {
        return address;
    }

    @Override
    @SuppressWarnings("rawtypes")
    public void execute(String caller, byte[] payload) {
        if (payload == null || payload.length == 0) {
            throw new ExternalCallException(ExternalCallException.SWAP_FAILED, "empty router payload");
        }
        List<Type> q = FunctionReturnDecoder.decode(Numeric.toHexString(payload), QUOTE.getOutputParameters());
        if (q.size() != 4) {
            throw new ExternalCallException(ExternalCallException.SWAP_FAILED, "router payload is not a quote");
        }
        String tokenIn = ((Address) q.get(0)).getValue();
        BigInteger amountIn = (BigInteger) q.get(1).getValue();
        String tokenOut = ((Address) q.get(2)).getValue();
        BigInteger amountOut = (BigInteger) q.get(3).getValue();

        ledger.transferFrom(tokenIn, address, caller, address, amountIn);
        if (amountOut.signum() > 0) ledger.transfer(tokenOut, address, caller, amountOut);
        log.debug("[router {}] filled {} {} -> {} {}", address, amountIn, tokenIn, amountOut, tokenOut);
    }
}
