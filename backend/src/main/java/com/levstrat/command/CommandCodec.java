package com.levstrat.command;

import com.levstrat.exception.StrategyException;
import com.levstrat.exception.ValidationException;
import com.levstrat.util.AddressUtil;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.DynamicBytes;
import org.web3j.abi.datatypes.DynamicStruct;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint8;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * ABI codec for operator plans: {@code abi.encode(tuple(uint8 cmdType, bytes data)[])}.
 *
 * Payloads:
 *  - SUPPLY / WITHDRAW / BORROW / REPAY: {@code (address asset, uint256 amount)}
 *  - SWAP: {@code (uint8 router, address tokenIn, uint256 amountIn, address tokenOut,
 *    uint256 minAmountOut, uint256 maxOracleSlippageBps, bytes routerPayload)}
 */
public class CommandCodec {

    /** Outer tuple element. */
    public static class RawCommand extends DynamicStruct {
        public BigInteger cmdType;
        public byte[] data;

        public RawCommand(BigInteger cmdType, byte[] data) {
            super(new Uint8(cmdType), new DynamicBytes(data));
            this.cmdType = cmdType;
            this.data = data;
        }

        public RawCommand(Uint8 cmdType, DynamicBytes data) {
            super(cmdType, data);
            this.cmdType = cmdType.getValue();
            this.data = data.getValue();
        }
    }

    private static final Function PLAN = new Function("plan", Collections.emptyList(),
            Collections.singletonList(new TypeReference<DynamicArray<RawCommand>>() {}));

    private static final Function ASSET_AMOUNT = new Function("assetAmount", Collections.emptyList(), Arrays.asList(
            new TypeReference<Address>() {},
            new TypeReference<Uint256>() {}));

    private static final Pattern HEX = Pattern.compile("(?:[0-9a-fA-F]{2})*");

    private static final Function SWAP = new Function("swap", Collections.emptyList(), Arrays.asList(
            new TypeReference<Uint8>() {},
            new TypeReference<Address>() {},
            new TypeReference<Uint256>() {},
            new TypeReference<Address>() {},
            new TypeReference<Uint256>() {},
            new TypeReference<Uint256>() {},
            new TypeReference<DynamicBytes>() {}));

    // ---------------------------- Decoding ----------------------------

    /** Accepts {@code 0x}-prefixed hex; null, empty or {@code 0x} means "no commands". */
    public List<Command> decode(String hex) {
        if (hex == null || hex.isBlank() || "0x".equalsIgnoreCase(hex.trim())) return List.of();
        String clean = Numeric.cleanHexPrefix(hex.trim());
        if (!HEX.matcher(clean).matches()) {
            throw new ValidationException(ValidationException.MALFORMED_COMMAND, "commands are not valid hex");
        }
        return decode(Numeric.hexStringToByteArray(clean));
    }

    @SuppressWarnings({"rawtypes", "unchecked"})
    public List<Command> decode(byte[] encoded) {
        if (encoded == null || encoded.length == 0) return List.of();

        List<RawCommand> raws;
        try {
            List<Type> out = FunctionReturnDecoder.decode(Numeric.toHexString(encoded), PLAN.getOutputParameters());
            if (out.size() != 1) {
                throw new ValidationException(ValidationException.MALFORMED_COMMAND, "command list is not decodable");
            }
            raws = ((DynamicArray<RawCommand>) out.get(0)).getValue();
        } catch (StrategyException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ValidationException(ValidationException.MALFORMED_COMMAND, "command list is not decodable: " + e.getMessage(), e);
        }

        List<Command> commands = new ArrayList<>(raws.size());
        for (int i = 0; i < raws.size(); i++) {
            RawCommand raw = raws.get(i);
            int tag = raw.cmdType.bitLength() > 31 ? Integer.MAX_VALUE : raw.cmdType.intValue();
            commands.add(decodePayload(CommandType.fromTag(tag), raw.data, i));
        }
        return commands;
    }

    @SuppressWarnings("rawtypes")
    Command decodePayload(CommandType type, byte[] data, int index) {
        try {
            if (type == CommandType.SWAP) {
                List<Type> p = decodeExact(data, SWAP, index);
                return new Command.Swap(
                        ((BigInteger) p.get(0).getValue()).intValueExact(),
                        AddressUtil.normalize(((Address) p.get(1)).getValue()),
                        (BigInteger) p.get(2).getValue(),
                        AddressUtil.normalize(((Address) p.get(3)).getValue()),
                        (BigInteger) p.get(4).getValue(),
                        saturatedInt((BigInteger) p.get(5).getValue()),
                        ((DynamicBytes) p.get(6)).getValue());
            }

            List<Type> p = decodeExact(data, ASSET_AMOUNT, index);
            String asset = AddressUtil.normalize(((Address) p.get(0)).getValue());
            BigInteger amount = (BigInteger) p.get(1).getValue();
            switch (type) {
                case SUPPLY:
                    return new Command.Supply(asset, amount);
                case WITHDRAW:
                    return new Command.Withdraw(asset, amount);
                case BORROW:
                    return new Command.Borrow(asset, amount);
                case REPAY:
                    return new Command.Repay(asset, amount);
                default:
                    throw new ValidationException(ValidationException.UNKNOWN_COMMAND, "unknown command " + type);
            }
        } catch (StrategyException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ValidationException(ValidationException.MALFORMED_COMMAND,
                    "command #" + index + " (" + type + ") has a malformed payload: " + e.getMessage(), e);
        }
    }

    @SuppressWarnings("rawtypes")
    private static List<Type> decodeExact(byte[] data, Function layout, int index) {
        if (data == null || data.length == 0) {
            throw new ValidationException(ValidationException.MALFORMED_COMMAND, "command #" + index + " has an empty payload");
        }
        List<Type> out = FunctionReturnDecoder.decode(Numeric.toHexString(data), layout.getOutputParameters());
        if (out.size() != layout.getOutputParameters().size()) {
            throw new ValidationException(ValidationException.MALFORMED_COMMAND, "command #" + index + " payload is truncated");
        }
        return out;
    }

    private static int saturatedInt(BigInteger v) {
        return v.bitLength() > 31 ? Integer.MAX_VALUE : v.intValue();
    }

    // ---------------------------- Encoding ----------------------------

    public byte[] encode(List<Command> commands) {
        List<RawCommand> raws = new ArrayList<>(commands.size());
        for (Command c : commands) {
            raws.add(new RawCommand(BigInteger.valueOf(c.type().tag()), encodePayload(c)));
        }
        String hex = FunctionEncoder.encodeConstructor(
                Collections.singletonList(new DynamicArray<>(RawCommand.class, raws)));
        return Numeric.hexStringToByteArray(hex);
    }

    public String encodeHex(List<Command> commands) {
        return Numeric.toHexString(encode(commands));
    }

    @SuppressWarnings("rawtypes")
    public byte[] encodePayload(Command command) {
        List<Type> params;
        if (command instanceof Command.Swap s) {
            params = Arrays.asList(
                    new Uint8(s.router()),
                    new Address(s.tokenIn()),
                    new Uint256(s.amountIn()),
                    new Address(s.tokenOut()),
                    new Uint256(s.minAmountOut()),
                    new Uint256(s.maxOracleSlippageBps()),
                    new DynamicBytes(s.routerPayload()));
        } else if (command instanceof Command.Supply c) {
            params = assetAmount(c.asset(), c.amount());
        } else if (command instanceof Command.Withdraw c) {
            params = assetAmount(c.asset(), c.amount());
        } else if (command instanceof Command.Borrow c) {
            params = assetAmount(c.asset(), c.amount());
        } else if (command instanceof Command.Repay c) {
            params = assetAmount(c.asset(), c.amount());
        } else {
            throw new ValidationException(ValidationException.UNKNOWN_COMMAND, "unknown command " + command);
        }
        return Numeric.hexStringToByteArray(FunctionEncoder.encodeConstructor(params));
    }

    /** Raw outer encoding with an arbitrary tag; lets callers build plans the decoder must reject. */
    public byte[] encodeRaw(List<RawCommand> raws) {
        return Numeric.hexStringToByteArray(FunctionEncoder.encodeConstructor(
                Collections.singletonList(new DynamicArray<>(RawCommand.class, raws))));
    }

    @SuppressWarnings("rawtypes")
    private static List<Type> assetAmount(String asset, BigInteger amount) {
        return Arrays.asList(new Address(asset), new Uint256(amount));
    }
}
