package com.ledgerengine.authorization;

import com.ledgerengine.ledger.LedgerTransaction;
import com.ledgerengine.ledger.TransactionType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to credit or debit a single account.
 *
 * The account holder id is the verified identity supplied by the caller's
 * authentication layer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransactionRequest {

    @NotBlank(message = "is required")
    private String accountHolderId;

    @NotBlank(message = "is required")
    private String accountId;

    @NotNull(message = "is required")
    private TransactionType type;

    /**
     * Amount in minor currency units.
     */
    @NotNull(message = "is required")
    @Positive(message = "must be positive")
    private Long amountCents;

    @Size(max = LedgerTransaction.MAX_DESCRIPTION_LENGTH)
    private String description;

    /**
     * Optional debit card the purchase was made with. Debits only.
     */
    private String cardId;
}
