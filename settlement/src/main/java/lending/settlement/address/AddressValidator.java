package lending.settlement.address;

import lending.settlement.network.ChainFamily;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.web3j.crypto.Keys;
import org.web3j.crypto.WalletUtils;

import java.util.Locale;
import java.util.regex.Pattern;

@Component
@Slf4j
public class AddressValidator {

    private static final Pattern EVM_ADDRESS_PATTERN = Pattern.compile("^0x[a-fA-F0-9]{40}$");
    private static final Pattern SOLANA_ADDRESS_PATTERN = Pattern.compile("^[1-9A-HJ-NP-Za-km-z]{32,44}$");
    private static final Pattern BITCOIN_ADDRESS_PATTERN =
            Pattern.compile("^([13][a-km-zA-HJ-NP-Z1-9]{25,34}|bc1[a-z0-9]{39,59})$");

    public AddressValidation validate(String address, String blockchainKey) {
        if (address == null || address.isBlank()) {
            return AddressValidation.invalid("Address is empty");
        }
        AddressValidation result = switch (ChainFamily.fromBlockchainKey(blockchainKey)) {
            case EVM -> validateEvm(address);
            case SOLANA -> SOLANA_ADDRESS_PATTERN.matcher(address).matches()
                    ? AddressValidation.ok()
                    : AddressValidation.invalid("Invalid Solana address format");
            case BITCOIN -> BITCOIN_ADDRESS_PATTERN.matcher(address).matches()
                    ? AddressValidation.ok()
                    : AddressValidation.invalid("Invalid Bitcoin address format");
            case UNKNOWN -> AddressValidation.invalid("Address validation not implemented for blockchain " + blockchainKey);
        };
        if (!result.valid()) {
            log.info("event=address_validator.rejected blockchainKey={} reason={}", blockchainKey, result.reason());
        }
        return result;
    }

    // EIP-55: an all-lower or all-upper address carries no checksum; mixed case must match it exactly.
    private AddressValidation validateEvm(String address) {
        if (!EVM_ADDRESS_PATTERN.matcher(address).matches() || !WalletUtils.isValidAddress(address)) {
            return AddressValidation.invalid("Invalid EVM address format");
        }
        String hex = address.substring(2);
        boolean mixedCase = !hex.equals(hex.toLowerCase(Locale.ROOT)) && !hex.equals(hex.toUpperCase(Locale.ROOT));
        if (mixedCase && !Keys.toChecksumAddress(address).equals(address)) {
            return AddressValidation.invalid("Invalid EVM address checksum");
        }
        return AddressValidation.ok();
    }
}
