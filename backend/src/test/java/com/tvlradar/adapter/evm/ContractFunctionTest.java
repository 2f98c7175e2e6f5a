package com.tvlradar.adapter.evm;

import com.tvlradar.adapter.RpcException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContractFunctionTest {

    private static final String PAIR = "0x6e7a5fafcec6bb1e78bae2a1f0b612012bf14827";

    @Test
    @DisplayName("no-arg functions encode to their selector")
    void encodesSelectorOnly() {
        assertThat(ContractFunction.ALL_PAIRS_LENGTH.encode(List.of())).isEqualTo("0x574f2ba3");
        assertThat(ContractFunction.TOKEN0.encode(null)).isEqualTo("0x0dfe1681");
        assertThat(ContractFunction.TOKEN1.encode(List.of())).isEqualTo("0xd21220a7");
    }

    @Test
    @DisplayName("allPairs(uint256) pads the index to one word")
    void encodesUint() {
        String data = ContractFunction.ALL_PAIRS.encode(List.of(BigInteger.valueOf(255)));
        assertThat(data).isEqualTo("0x1e3dd18b" + "0".repeat(62) + "ff");
    }

    @Test
    @DisplayName("balanceOf(address) left-pads the address")
    void encodesAddress() {
        String data = ContractFunction.BALANCE_OF.encode(List.of(PAIR.toUpperCase().replace("0X", "0x")));
        assertThat(data).isEqualTo("0x70a08231" + "0".repeat(24) + PAIR.substring(2));
    }

    @Test
    @DisplayName("argument count and malformed addresses are rejected")
    void rejectsBadArguments() {
        assertThatThrownBy(() -> ContractFunction.BALANCE_OF.encode(List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("expects 1");
        assertThatThrownBy(() -> ContractFunction.BALANCE_OF.encode(List.of("0x1234")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ContractFunction.ALL_PAIRS.encode(List.of(BigInteger.valueOf(-1))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("decodes uint256 and address words")
    void decodesWords() {
        String uintWord = "0x" + "0".repeat(60) + "0bb8";
        assertThat(ContractFunction.ALL_PAIRS_LENGTH.decode(uintWord)).isEqualTo(BigInteger.valueOf(3000));

        String addressWord = "0x" + "0".repeat(24) + "6E7A5FAFCEC6BB1E78BAE2A1F0B612012BF14827";
        assertThat(ContractFunction.TOKEN0.decode(addressWord)).isEqualTo(PAIR);
    }

    @Test
    @DisplayName("empty return data decodes to null, short data is an RPC error")
    void decodeEdgeCases() {
        assertThat(ContractFunction.BALANCE_OF.decode("0x")).isNull();
        assertThat(ContractFunction.BALANCE_OF.decode(null)).isNull();
        assertThatThrownBy(() -> ContractFunction.BALANCE_OF.decode("0x1234"))
                .isInstanceOf(RpcException.class);
    }
}
