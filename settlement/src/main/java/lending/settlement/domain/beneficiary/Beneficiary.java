package lending.settlement.domain.beneficiary;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "beneficiaries", indexes = {
        @Index(name = "idx_beneficiary_user", columnList = "userId")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class Beneficiary {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, updatable = false, length = 64)
    private String userId;

    @Column(nullable = false, updatable = false, length = 64)
    private String blockchainKey;

    @Column(nullable = false, updatable = false, length = 128)
    private String tokenId;

    @Column(nullable = false, updatable = false, length = 128)
    private String address;

    @Column(length = 128)
    private String label;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    public static Beneficiary of(String userId, String blockchainKey, String tokenId, String address, String label) {
        return Beneficiary.builder()
                .userId(userId)
                .blockchainKey(blockchainKey)
                .tokenId(tokenId)
                .address(address)
                .label(label)
                .createdAt(Instant.now())
                .build();
    }

    public boolean isOwnedBy(String userId) {
        return this.userId.equals(userId);
    }

    public boolean matchesCurrency(String blockchainKey, String tokenId) {
        return this.blockchainKey.equals(blockchainKey) && this.tokenId.equals(tokenId);
    }
}
