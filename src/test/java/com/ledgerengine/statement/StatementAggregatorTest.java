package com.ledgerengine.statement;

import com.ledgerengine.accounts.Account;
import com.ledgerengine.accounts.AccountService;
import com.ledgerengine.accounts.AccountType;
import com.ledgerengine.authorization.TransactionAuthorizer;
import com.ledgerengine.authorization.TransactionRequest;
import com.ledgerengine.common.exception.AccountNotFoundException;
import com.ledgerengine.common.exception.LedgerValidationException;
import com.ledgerengine.common.exception.UnauthorizedAccessException;
import com.ledgerengine.ledger.LedgerTransaction;
import com.ledgerengine.ledger.TransactionStatus;
import com.ledgerengine.ledger.TransactionType;
import com.ledgerengine.support.AdjustableClock;
import com.ledgerengine.support.ClockTestConfig;
import com.ledgerengine.transfer.TransferCoordinator;
import com.ledgerengine.transfer.TransferRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for monthly statements.
 *
 * The clock is pinned so each transaction lands in a known month (UTC).
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(ClockTestConfig.class)
class StatementAggregatorTest {

    @Autowired
    private StatementAggregator statementAggregator;

    @Autowired
    private TransactionAuthorizer authorizer;

    @Autowired
    private TransferCoordinator transferCoordinator;

    @Autowired
    private AccountService accountService;

    @Autowired
    private AdjustableClock clock;

    private String holderId;
    private Account account;

    @BeforeEach
    void setUp() {
        clock.set("2026-01-02T09:00:00Z");
        holderId = "holder-" + UUID.randomUUID();
        account = accountService.openAccount(holderId, AccountType.CHECKING);

        at("2026-01-15T10:00:00Z", TransactionType.CREDIT, 10_000L);
        at("2026-01-20T10:00:00Z", TransactionType.DEBIT, 2_000L);
        at("2026-02-03T08:30:00Z", TransactionType.CREDIT, 5_000L);
        at("2026-02-10T12:00:00Z", TransactionType.DEBIT, 50_000L);
        at("2026-02-14T18:45:00Z", TransactionType.DEBIT, 1_500L);
        at("2026-02-28T23:59:59Z", TransactionType.CREDIT, 100L);
        at("2026-03-01T00:00:00Z", TransactionType.DEBIT, 300L);
    }

    @Test
    void testFirstMonthOpensAtZero() {
        StatementView statement = statementAggregator.statement(holderId, account.getAccountId(), 2026, 1);

        assertEquals(0L, statement.getOpeningBalanceCents());
        assertEquals(10_000L, statement.getTotalCreditsCents());
        assertEquals(2_000L, statement.getTotalDebitsCents());
        assertEquals(8_000L, statement.getClosingBalanceCents());
        assertEquals(2, statement.getTransactionCount());
    }

    @Test
    void testTotalsExcludeDeclinedButListingKeepsThem() {
        StatementView statement = statementAggregator.statement(holderId, account.getAccountId(), 2026, 2);

        assertEquals(account.getAccountId(), statement.getAccountId());
        assertEquals(2026, statement.getYear());
        assertEquals(2, statement.getMonth());
        assertEquals(8_000L, statement.getOpeningBalanceCents());
        assertEquals(5_100L, statement.getTotalCreditsCents());
        assertEquals(1_500L, statement.getTotalDebitsCents());
        assertEquals(11_600L, statement.getClosingBalanceCents());

        List<LedgerTransaction> transactions = statement.getTransactions();
        assertEquals(4, transactions.size());
        assertEquals(1, transactions.stream().filter(t -> t.getStatus() == TransactionStatus.DECLINED).count());
        assertEquals(50_000L, transactions.get(1).getAmountCents());
        for (int i = 1; i < transactions.size(); i++) {
            assertFalse(transactions.get(i).getCreatedAt().isBefore(transactions.get(i - 1).getCreatedAt()));
        }
    }

    @Test
    void testMonthBoundaryIsExclusiveOfNextMonthStart() {
        StatementView february = statementAggregator.statement(holderId, account.getAccountId(), 2026, 2);
        StatementView march = statementAggregator.statement(holderId, account.getAccountId(), 2026, 3);

        assertTrue(february.getTransactions().stream().noneMatch(t -> t.getAmountCents() == 300L));
        assertEquals(1, march.getTransactionCount());
        assertEquals(february.getClosingBalanceCents(), march.getOpeningBalanceCents());
        assertEquals(11_300L, march.getClosingBalanceCents());
    }

    @Test
    void testQuietMonthCarriesBalanceForward() {
        StatementView statement = statementAggregator.statement(holderId, account.getAccountId(), 2026, 6);

        assertEquals(11_300L, statement.getOpeningBalanceCents());
        assertEquals(11_300L, statement.getClosingBalanceCents());
        assertEquals(0L, statement.getTotalCreditsCents());
        assertEquals(0L, statement.getTotalDebitsCents());
        assertTrue(statement.getTransactions().isEmpty());
    }

    @Test
    void testTransferLegsCountOnTheirOwnSide() {
        String otherHolderId = "holder-" + UUID.randomUUID();
        Account other = accountService.openAccount(otherHolderId, AccountType.SAVINGS);
        clock.set("2026-04-05T10:00:00Z");
        transferCoordinator.transfer(TransferRequest.builder()
            .accountHolderId(holderId)
            .fromAccountId(account.getAccountId())
            .toAccountId(other.getAccountId())
            .amountCents(1_300L)
            .build());

        StatementView sent = statementAggregator.statement(holderId, account.getAccountId(), 2026, 4);
        StatementView received = statementAggregator.statement(otherHolderId, other.getAccountId(), 2026, 4);

        assertEquals(1_300L, sent.getTotalDebitsCents());
        assertEquals(0L, sent.getTotalCreditsCents());
        assertEquals(1, sent.getTransactionCount());
        assertEquals(1_300L, received.getTotalCreditsCents());
        assertEquals(0L, received.getTotalDebitsCents());
        assertEquals(1_300L, received.getClosingBalanceCents());
    }

    @Test
    void testInvalidPeriodRejected() {
        String accountId = account.getAccountId();

        assertThrows(LedgerValidationException.class, () -> statementAggregator.statement(holderId, accountId, 2026, 13));
        assertThrows(LedgerValidationException.class, () -> statementAggregator.statement(holderId, accountId, 2026, 0));
        assertThrows(LedgerValidationException.class, () -> statementAggregator.statement(holderId, accountId, null, 5));
        assertThrows(LedgerValidationException.class, () -> statementAggregator.statement(holderId, accountId, 2026, null));
        assertThrows(LedgerValidationException.class, () -> statementAggregator.statement(holderId, accountId, 0, 5));
    }

    @Test
    void testStatementScopedToHolder() {
        assertThrows(UnauthorizedAccessException.class,
            () -> statementAggregator.statement("someone-else", account.getAccountId(), 2026, 2));
        assertThrows(AccountNotFoundException.class,
            () -> statementAggregator.statement(holderId, UUID.randomUUID().toString(), 2026, 2));
    }

    private void at(String instant, TransactionType type, long amountCents) {
        clock.set(instant);
        authorizer.authorize(TransactionRequest.builder()
            .accountHolderId(holderId)
            .accountId(account.getAccountId())
            .type(type)
            .amountCents(amountCents)
            .build());
    }
}
