package com.ledgerengine.statement;

import com.ledgerengine.accounts.AccountService;
import com.ledgerengine.common.exception.LedgerValidationException;
import com.ledgerengine.ledger.BalanceEvaluator;
import com.ledgerengine.ledger.LedgerTransaction;
import com.ledgerengine.ledger.LedgerTransactionRepository;
import com.ledgerengine.ledger.TransactionType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneId;
import java.util.List;

/**
 * Builds monthly statements from the transaction history.
 *
 * opening = approved balance strictly before the first instant of the month
 * closing = opening + approved credits - approved debits within the month
 *
 * Month boundaries are taken in the configured statement zone.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StatementAggregator {

    private final AccountService accountService;
    private final BalanceEvaluator balanceEvaluator;
    private final LedgerTransactionRepository transactionRepository;

    @Value("${ledger-engine.statement.zone:UTC}")
    private ZoneId statementZone;

    @Transactional(readOnly = true)
    public StatementView statement(String accountHolderId, String accountId, Integer year, Integer month) {
        YearMonth period = validatePeriod(year, month);
        accountService.getAccount(accountId, accountHolderId);

        Instant periodStart = period.atDay(1).atStartOfDay(statementZone).toInstant();
        Instant periodEnd = period.plusMonths(1).atDay(1).atStartOfDay(statementZone).toInstant();

        long opening = balanceEvaluator.computeBalanceBefore(accountId, periodStart);
        List<LedgerTransaction> transactions =
            transactionRepository.findAccountHistoryBetween(accountId, periodStart, periodEnd);

        long credits = 0L;
        long debits = 0L;
        for (LedgerTransaction txn : transactions) {
            if (!txn.isApproved()) {
                continue;
            }
            if (txn.getType() == TransactionType.CREDIT && accountId.equals(txn.getToAccountId())) {
                credits += txn.getAmountCents();
            } else if (txn.getType() == TransactionType.DEBIT && accountId.equals(txn.getFromAccountId())) {
                debits += txn.getAmountCents();
            }
        }

        log.debug("Statement {} for account {}: {} transactions", period, accountId, transactions.size());

        return StatementView.builder()
            .accountId(accountId)
            .year(period.getYear())
            .month(period.getMonthValue())
            .openingBalanceCents(opening)
            .closingBalanceCents(opening + credits - debits)
            .totalCreditsCents(credits)
            .totalDebitsCents(debits)
            .transactions(List.copyOf(transactions))
            .build();
    }

    private static YearMonth validatePeriod(Integer year, Integer month) {
        if (year == null || month == null) {
            throw new LedgerValidationException("Statement year and month are required");
        }
        if (month < 1 || month > 12) {
            throw new LedgerValidationException("Statement month must be between 1 and 12, got " + month);
        }
        if (year < 1 || year > 9999) {
            throw new LedgerValidationException("Statement year must be between 1 and 9999, got " + year);
        }
        return YearMonth.of(year, month);
    }
}
