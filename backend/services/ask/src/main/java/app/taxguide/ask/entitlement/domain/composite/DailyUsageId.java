package app.taxguide.ask.entitlement.domain.composite;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.Objects;
import java.util.UUID;

public class DailyUsageId implements Serializable {
    private UUID accountId;
    private LocalDate usageDay;

    public DailyUsageId() {
    }

    public DailyUsageId(UUID accountId, LocalDate usageDay) {
        this.accountId = accountId;
        this.usageDay = usageDay;
    }

    public UUID getAccountId() {
        return accountId;
    }

    public LocalDate getUsageDay() {
        return usageDay;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        DailyUsageId that = (DailyUsageId) o;
        return Objects.equals(accountId, that.accountId) && Objects.equals(usageDay, that.usageDay);
    }

    @Override
    public int hashCode() {
        return Objects.hash(accountId, usageDay);
    }
}
