package com.ledgerengine.transfer;

import com.ledgerengine.accounts.Account;
import com.ledgerengine.accounts.AccountService;
import com.ledgerengine.accounts.AccountType;
import com.ledgerengine.authorization.TransactionAuthorizer;
import com.ledgerengine.authorization.TransactionRequest;
import com.ledgerengine.ledger.BalanceCheck;
import com.ledgerengine.ledger.BalanceEvaluator;
import com.ledgerengine.ledger.LedgerService;
import com.ledgerengine.ledger.LedgerStore;
import com.ledgerengine.ledger.LedgerTransaction;
import com.ledgerengine.ledger.TransactionType;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doCallRealMethod;

/**
 * A store failure after the first transfer leg must undo the whole transfer.
 */
@SpringBootTest
@ActiveProfiles("test")
class TransferAtomicityTest {

    @SpyBean
    private LedgerStore ledgerStore;

    @Autowired
    private TransferCoordinator transferCoordinator;

    @Autowired
    private TransactionAuthorizer authorizer;

    @Autowired
    private AccountService accountService;

    @Autowired
    private BalanceEvaluator balanceEvaluator;

    @Autowired
    private LedgerService ledgerService;

    @Test
    void testFailureBetweenLegsLeavesNoOrphanLeg() {
        String holderId = "holder-" + UUID.randomUUID();
        String otherHolderId = "holder-" + UUID.randomUUID();
        Account source = accountService.openAccount(holderId, AccountType.CHECKING);
        Account destination = accountService.openAccount(otherHolderId, AccountType.CHECKING);
        authorizer.authorize(TransactionRequest.builder()
            .accountHolderId(holderId)
            .accountId(source.getAccountId())
            .type(TransactionType.CREDIT)
            .amountCents(10_000L)
            .build());

        // Debit leg is written, credit leg fails
        doCallRealMethod()
            .doThrow(new DataAccessResourceFailureException("Simulated store failure"))
            .when(ledgerStore).append(argThat(txn -> txn != null && txn.getTransferPairId() != null));

        TransferRequest request = TransferRequest.builder()
            .accountHolderId(holderId)
            .fromAccountId(source.getAccountId())
            .toAccountId(destination.getAccountId())
            .amountCents(4_000L)
            .build();
        assertThrows(DataAccessResourceFailureException.class, () -> transferCoordinator.transfer(request));

        List<LedgerTransaction> sourceHistory = ledgerService.getAccountTransactions(holderId,
            source.getAccountId(), null, null, 0, 10);
        assertEquals(1, sourceHistory.size());
        assertEquals(TransactionType.CREDIT, sourceHistory.get(0).getType());
        assertTrue(ledgerService.getAccountTransactions(otherHolderId, destination.getAccountId(),
            null, null, 0, 10).isEmpty());

        BalanceCheck sourceCheck = balanceEvaluator.checkIntegrity(source.getAccountId());
        assertEquals(10_000L, sourceCheck.getComputedBalanceCents());
        assertTrue(sourceCheck.isMatch());
        BalanceCheck destinationCheck = balanceEvaluator.checkIntegrity(destination.getAccountId());
        assertEquals(0L, destinationCheck.getCachedBalanceCents());
        assertTrue(destinationCheck.isMatch());
    }
}
