package com.tvlradar.adapter.evm;

import com.tvlradar.adapter.RpcException;

import java.math.BigInteger;
import java.util.List;
import java.util.Locale;

/**
 * Read-only contract functions used for TVL discovery, with their 4-byte selectors and ABI word codecs.
 * Arguments are encoded as 32-byte words; return data is a single 32-byte word.
 */
public enum ContractFunction {

    ALL_PAIRS_LENGTH("allPairsLength()", "0x574f2ba3", List.of(), AbiType.UINT256),
    ALL_PAIRS("allPairs(uint256)", "0x1e3dd18b", List.of(AbiType.UINT256), AbiType.ADDRESS),
    TOKEN0("token0()", "0x0dfe1681", List.of(), AbiType.ADDRESS),
    TOKEN1("token1()", "0xd21220a7", List.of(), AbiType.ADDRESS),
    BALANCE_OF("balanceOf(address)", "0x70a08231", List.of(AbiType.ADDRESS), AbiType.UINT256);

    private static final int WORD_HEX_LENGTH = 64;
    private static final int ADDRESS_HEX_LENGTH = 40;

    private final String signature;
    private final String selector;
    private final List<AbiType> inputs;
    private final AbiType output;

    ContractFunction(String signature, String selector, List<AbiType> inputs, AbiType output) {
        this.signature = signature;
        this.selector = selector;
        this.inputs = inputs;
        this.output = output;
    }

    public String signature() {
        return signature;
    }

    /**
     * Call data: selector followed by one word per argument.
     *
     * @throws IllegalArgumentException when the argument count or an argument value does not fit the signature
     */
    public String encode(List<Object> args) {
        List<Object> values = args == null ? List.of() : args;
        if (values.size() != inputs.size()) {
            throw new IllegalArgumentException(signature + " expects " + inputs.size() + " argument(s), got " + values.size());
        }
        StringBuilder data = new StringBuilder(selector);
        for (int i = 0; i < inputs.size(); i++) {
            data.append(inputs.get(i).encodeWord(values.get(i)));
        }
        return data.toString();
    }

    /**
     * Decodes the first return word. Empty return data ({@code "0x"}) decodes to null.
     */
    public Object decode(String returnData) {
        if (returnData == null) {
            return null;
        }
        String hex = strip0x(returnData);
        if (hex.isEmpty()) {
            return null;
        }
        if (hex.length() < WORD_HEX_LENGTH) {
            throw new RpcException(signature + " returned " + hex.length() / 2 + " bytes, expected 32");
        }
        return output.decodeWord(hex.substring(0, WORD_HEX_LENGTH));
    }

    static String strip0x(String hex) {
        return hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
    }

    enum AbiType {
        UINT256 {
            @Override
            String encodeWord(Object value) {
                BigInteger number = toBigInteger(value);
                if (number.signum() < 0) {
                    throw new IllegalArgumentException("uint256 cannot be negative: " + number);
                }
                return leftPad(number.toString(16));
            }

            @Override
            Object decodeWord(String word) {
                return new BigInteger(word, 16);
            }
        },
        ADDRESS {
            @Override
            String encodeWord(Object value) {
                String hex = strip0x(String.valueOf(value)).toLowerCase(Locale.ROOT);
                if (hex.length() != ADDRESS_HEX_LENGTH) {
                    throw new IllegalArgumentException("Not a 20-byte address: " + value);
                }
                return leftPad(hex);
            }

            @Override
            Object decodeWord(String word) {
                return "0x" + word.substring(WORD_HEX_LENGTH - ADDRESS_HEX_LENGTH).toLowerCase(Locale.ROOT);
            }
        };

        abstract String encodeWord(Object value);

        abstract Object decodeWord(String word);

        private static String leftPad(String hex) {
            return "0".repeat(WORD_HEX_LENGTH - hex.length()) + hex;
        }

        private static BigInteger toBigInteger(Object value) {
            if (value instanceof BigInteger number) {
                return number;
            }
            if (value instanceof Number number) {
                return BigInteger.valueOf(number.longValue());
            }
            return new BigInteger(String.valueOf(value));
        }
    }
}
