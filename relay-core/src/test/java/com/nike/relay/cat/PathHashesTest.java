package com.nike.relay.cat;

import com.tngtech.java.junit.dataprovider.DataProvider;
import com.tngtech.java.junit.dataprovider.DataProviderRunner;

import org.junit.Test;
import org.junit.runner.RunWith;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the functionality of {@link PathHashes}.
 */
@RunWith(DataProviderRunner.class)
public class PathHashesTest {

    @DataProvider(value = {
        "app    |   WebTransaction/Uri/foo  |   null        |   e40b02aa",
        "app    |   WebTransaction/Uri/foo  |   12345678    |   c063ae5a",
        "app    |   WebTransaction/Uri/foo  |   80000001    |   e40b02a9",
        "app    |   WebTransaction/Uri/foo  |   nothex      |   e40b02aa"
    }, splitBy = "\\|")
    @Test
    public void calculatePathHash_combines_the_rotated_referring_hash_with_the_md5_of_app_and_path(
        String appName, String pathName, String referringPathHash, String expected
    ) {
        // when
        String result = PathHashes.calculatePathHash(appName, pathName, referringPathHash);

        // then
        assertThat(result).isEqualTo(expected);
    }

    @Test
    public void calculatePathHash_is_always_eight_lowercase_hex_characters() {
        // when
        String result = PathHashes.calculatePathHash("some app", "OtherTransaction/Job/x", "ffffffff");

        // then
        assertThat(result).matches("[0-9a-f]{8}");
    }

    @Test
    public void calculatePathHash_treats_a_null_app_name_as_the_text_null() {
        // expect
        assertThat(PathHashes.calculatePathHash(null, "WebTransaction/Uri/foo", null)).isEqualTo("8d95055c");
    }

    @DataProvider(value = {
        "null       |   0",
        "           |   0",
        "00000001   |   1",
        "ffffffff   |   -1",
        "zz         |   0"
    }, splitBy = "\\|")
    @Test
    public void parseHash_returns_the_32_bit_value_or_zero(String hash, int expected) {
        // expect
        assertThat(PathHashes.parseHash(hash)).isEqualTo(expected);
    }
}
