package com.ledgerengine.transfer;

import com.ledgerengine.ledger.LedgerTransaction;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to move money from one account to another.
 *
 * The source must belong to {@code accountHolderId}; the destination may belong to anyone.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransferRequest {

    @NotBlank(message = "is required")
    private String accountHolderId;

    @NotBlank(message = "is required")
    private String fromAccountId;

    @NotBlank(message = "is required")
    private String toAccountId;

    /**
     * Amount in minor currency units.
     */
    @NotNull(message = "is required")
    @Positive(message = "must be positive")
    private Long amountCents;

    @Size(max = LedgerTransaction.MAX_DESCRIPTION_LENGTH)
    private String description;
}
