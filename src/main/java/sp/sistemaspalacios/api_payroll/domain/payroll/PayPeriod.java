package sp.sistemaspalacios.api_payroll.domain.payroll;

import java.time.LocalDate;

public record PayPeriod(LocalDate startDate, LocalDate endDate) {

    public boolean contains(LocalDate date) {
        return date != null && !date.isBefore(startDate) && !date.isAfter(endDate);
    }
}
