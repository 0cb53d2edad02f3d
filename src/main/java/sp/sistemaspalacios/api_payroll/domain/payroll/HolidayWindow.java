package sp.sistemaspalacios.api_payroll.domain.payroll;

import java.time.LocalDate;

/** Festivo configurado con su ventana de referencia (inclusiva) para el cálculo de PHP. */
public record HolidayWindow(LocalDate holidayDate, LocalDate lookbackStart, LocalDate lookbackEnd) {

    public boolean inLookback(LocalDate date) {
        return date != null && !date.isBefore(lookbackStart) && !date.isAfter(lookbackEnd);
    }
}
