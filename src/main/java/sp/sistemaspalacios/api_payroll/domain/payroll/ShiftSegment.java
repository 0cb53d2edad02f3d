package sp.sistemaspalacios.api_payroll.domain.payroll;

import java.math.BigDecimal;
import java.time.LocalDate;

/** Porción de un turno que cae dentro de un solo día calendario. */
public record ShiftSegment(ShiftRecord record,
                           LocalDate date,
                           BigDecimal hours,
                           boolean statutory,
                           int order) {

    public static ShiftSegment whole(ShiftRecord record, boolean statutory) {
        return new ShiftSegment(record, record.transactionDate(), record.duration(), statutory, 0);
    }
}
