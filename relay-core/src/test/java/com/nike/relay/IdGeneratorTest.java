package com.nike.relay;

import com.tngtech.java.junit.dataprovider.DataProvider;
import com.tngtech.java.junit.dataprovider.DataProviderRunner;

import org.junit.Test;
import org.junit.runner.RunWith;

import java.security.SecureRandom;
import java.util.HashSet;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the functionality of {@link IdGenerator}.
 */
@RunWith(DataProviderRunner.class)
public class IdGeneratorTest {

    @Test
    public void generateId_returns_16_lowercase_hex_characters() {
        // given
        Set<String> ids = new HashSet<>();

        // when
        for (int i = 0; i < 1000; i++) {
            ids.add(IdGenerator.generateId());
        }

        // then
        assertThat(ids).hasSize(1000);
        assertThat(ids).allMatch(id -> id.matches("[0-9a-f]{16}"));
    }

    @DataProvider(value = {
        "0      |   0000000000000000",
        "1      |   0000000000000001",
        "-1     |   ffffffffffffffff",
        "255    |   00000000000000ff"
    }, splitBy = "\\|")
    @Test
    public void longToUnsignedLowerHexString_zero_pads_and_treats_values_as_unsigned(long value, String expected) {
        // expect
        assertThat(IdGenerator.longToUnsignedLowerHexString(value)).isEqualTo(expected);
    }

    @Test
    public void getRandomInstance_falls_back_to_plain_random_for_unknown_algorithms() {
        // when
        Random result = IdGenerator.getRandomInstance("no-such-algorithm");

        // then
        assertThat(result).isNotInstanceOf(SecureRandom.class);
        assertThat(IdGenerator.getRandomInstance("SHA1PRNG")).isInstanceOf(SecureRandom.class);
    }
}
