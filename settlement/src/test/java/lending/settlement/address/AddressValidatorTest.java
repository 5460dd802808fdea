package lending.settlement.address;

import lending.settlement.network.BlockchainKeys;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AddressValidatorTest {

    private final AddressValidator validator = new AddressValidator();

    @Test
    void evm_acceptsChecksummedAndSingleCaseAddresses() {
        assertThat(validator.validate("0x5aAeb6053F3E94C9b9A09f33669435E7Ef1BeAed", BlockchainKeys.ETHEREUM_MAINNET).valid()).isTrue();
        assertThat(validator.validate("0x5aaeb6053f3e94c9b9a09f33669435e7ef1beaed", BlockchainKeys.BSC_MAINNET).valid()).isTrue();
    }

    @Test
    void evm_rejectsBadChecksum() {
        AddressValidation result = validator.validate("0x5AAeb6053F3E94C9b9A09f33669435E7Ef1BeAed", BlockchainKeys.ETHEREUM_MAINNET);

        assertThat(result.valid()).isFalse();
        assertThat(result.reason()).isEqualTo("Invalid EVM address checksum");
    }

    @Test
    void evm_rejectsMalformedAddress() {
        assertThat(validator.validate("0x1234", BlockchainKeys.ETHEREUM_MAINNET).reason()).isEqualTo("Invalid EVM address format");
        assertThat(validator.validate("5aAeb6053F3E94C9b9A09f33669435E7Ef1BeAed", BlockchainKeys.ETHEREUM_MAINNET).valid()).isFalse();
    }

    @Test
    void bitcoin_acceptsLegacyScriptAndBech32() {
        assertThat(validator.validate("1BvBMSEYstWetqTFn5Au4m4GFg7xJaNVN2", BlockchainKeys.BITCOIN_MAINNET).valid()).isTrue();
        assertThat(validator.validate("3J98t1WpEZ73CNmQviecrnyiWrnqRhWNLy", BlockchainKeys.BITCOIN_MAINNET).valid()).isTrue();
        assertThat(validator.validate("bc1qar0srrr7xfkvy5l643lydnw9re59gtzzwf5mdq", BlockchainKeys.BITCOIN_MAINNET).valid()).isTrue();
    }

    @Test
    void bitcoin_rejectsEvmAddress() {
        AddressValidation result = validator.validate("0x5aAeb6053F3E94C9b9A09f33669435E7Ef1BeAed", BlockchainKeys.BITCOIN_MAINNET);

        assertThat(result.valid()).isFalse();
        assertThat(result.reason()).isEqualTo("Invalid Bitcoin address format");
    }

    @Test
    void solana_acceptsBase58AndRejectsForbiddenCharacters() {
        assertThat(validator.validate("4Nd1mBQtrMJVYVfKf2PJy9NZUZdTAsp7D4xWLs4gDB4T", BlockchainKeys.SOLANA_MAINNET).valid()).isTrue();
        assertThat(validator.validate("0Nd1mBQtrMJVYVfKf2PJy9NZUZdTAsp7D4xWLs4gDB4T", BlockchainKeys.SOLANA_MAINNET).reason())
                .isEqualTo("Invalid Solana address format");
        assertThat(validator.validate("4Nd1mBQtrMJVYVfKf2PJy9NZ", BlockchainKeys.SOLANA_MAINNET).valid()).isFalse();
    }

    @Test
    void unknownFamily_isRejected() {
        AddressValidation result = validator.validate("anything", "cosmos:cosmoshub-4");

        assertThat(result.valid()).isFalse();
        assertThat(result.reason()).isEqualTo("Address validation not implemented for blockchain cosmos:cosmoshub-4");
    }

    @Test
    void emptyAddress_isRejected() {
        assertThat(validator.validate(" ", BlockchainKeys.ETHEREUM_MAINNET).reason()).isEqualTo("Address is empty");
    }
}
