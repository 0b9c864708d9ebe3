package decentralabs.settlement.util;

import java.util.Locale;
import java.util.regex.Pattern;

import org.web3j.crypto.Keys;

/**
 * EVM recipient addresses. Single-case addresses carry no checksum and are accepted as is;
 * mixed-case ones must match their EIP-55 checksum.
 */
public final class RecipientAddressValidator {

    private static final Pattern ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    private RecipientAddressValidator() {
    }

    public static boolean isValid(String address) {
        if (address == null || !ADDRESS.matcher(address).matches()) {
            return false;
        }
        String body = address.substring(2);
        if (body.equals(body.toLowerCase(Locale.ROOT)) || body.equals(body.toUpperCase(Locale.ROOT))) {
            return true;
        }
        return Keys.toChecksumAddress(address).equals(address);
    }

    /**
     * @throws IllegalArgumentException if the address is not valid
     */
    public static String toChecksumAddress(String address) {
        if (!isValid(address)) {
            throw new IllegalArgumentException("Invalid EVM address: " + LogSanitizer.sanitize(address));
        }
        return Keys.toChecksumAddress(address);
    }
}
