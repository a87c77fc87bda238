package app.taxguide.ask.entitlement.service;

import app.taxguide.ask.support.PostgresIntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
class CreditLedgerServiceTest extends PostgresIntegrationTest {

    @Autowired
    private CreditLedgerService creditLedgerService;

    @Test
    void concurrentDebitsNeverExceedBalance() throws Exception {
        UUID accountId = UUID.randomUUID();
        creditLedgerService.grant(accountId, 5);

        int attempts = 20;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < attempts; i++) {
                Callable<Boolean> debit = () -> {
                    start.await();
                    return creditLedgerService.tryDebit(accountId, 1);
                };
                results.add(pool.submit(debit));
            }
            start.countDown();

            int succeeded = 0;
            for (Future<Boolean> result : results) {
                if (result.get()) {
                    succeeded++;
                }
            }
            assertThat(succeeded).isEqualTo(5);
            assertThat(creditLedgerService.balance(accountId)).isZero();
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void debitLargerThanBalanceLeavesBalanceUnchanged() {
        UUID accountId = UUID.randomUUID();
        creditLedgerService.grant(accountId, 1);

        assertThat(creditLedgerService.tryDebit(accountId, 2)).isFalse();
        assertThat(creditLedgerService.balance(accountId)).isEqualTo(1);
    }

    @Test
    void refundRestoresReservation() {
        UUID accountId = UUID.randomUUID();
        creditLedgerService.grant(accountId, 3);

        assertThat(creditLedgerService.tryDebit(accountId, 1)).isTrue();
        creditLedgerService.refund(accountId, 1);

        assertThat(creditLedgerService.balance(accountId)).isEqualTo(3);
    }

    @Test
    void grantOverwritesInsteadOfAccumulating() {
        UUID accountId = UUID.randomUUID();
        creditLedgerService.grant(accountId, 5);
        creditLedgerService.tryDebit(accountId, 2);

        creditLedgerService.grant(accountId, 100);

        assertThat(creditLedgerService.balance(accountId)).isEqualTo(100);
    }

    @Test
    void accountWithoutBalanceCannotDebitOrRefund() {
        UUID accountId = UUID.randomUUID();

        assertThat(creditLedgerService.balance(accountId)).isZero();
        assertThat(creditLedgerService.tryDebit(accountId, 1)).isFalse();
        assertThatThrownBy(() -> creditLedgerService.refund(accountId, 1))
                .isInstanceOf(IllegalStateException.class);
    }
}
