package decentralabs.settlement.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("RecipientAddressValidator Tests")
class RecipientAddressValidatorTest {

    private static final String LOWER = "0x833589fcd6edb6e08f4c7c32d4f71b54bda02913";
    private static final String CHECKSUMMED = "0x833589fCD6eDb6E08f4c7C32D4f71b54bdA02913";

    @Test
    @DisplayName("Should accept single-case and correctly checksummed addresses")
    void shouldAcceptValidAddresses() {
        assertTrue(RecipientAddressValidator.isValid(LOWER));
        assertTrue(RecipientAddressValidator.isValid("0x" + LOWER.substring(2).toUpperCase()));
        assertTrue(RecipientAddressValidator.isValid(CHECKSUMMED));
    }

    @Test
    @DisplayName("Should reject a mixed-case address with a wrong checksum")
    void shouldRejectBadChecksum() {
        assertFalse(RecipientAddressValidator.isValid("0x833589FCD6eDb6E08f4c7C32D4f71b54bdA02913"));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {
        "833589fcd6edb6e08f4c7c32d4f71b54bda02913",
        "0x833589fcd6edb6e08f4c7c32d4f71b54bda0291",
        "0x833589fcd6edb6e08f4c7c32d4f71b54bda029133",
        "0xZZ3589fcd6edb6e08f4c7c32d4f71b54bda02913",
        "7xKXtg2CW87d97TXJSDpbD5jBkheTqA83TZRuJosgAsU"
    })
    void shouldRejectMalformedAddresses(String address) {
        assertFalse(RecipientAddressValidator.isValid(address));
    }

    @Test
    @DisplayName("Should normalize to the EIP-55 form")
    void shouldChecksum() {
        assertEquals(CHECKSUMMED, RecipientAddressValidator.toChecksumAddress(LOWER));
        assertThrows(IllegalArgumentException.class, () -> RecipientAddressValidator.toChecksumAddress("0x1234"));
    }
}
