package sp.sistemaspalacios.api_payroll.domain.payroll;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Copia privada y normalizada de un registro de asistencia.
 * {@code sequence} conserva la posición original para desempatar el orden cronológico.
 */
public record ShiftRecord(int sequence,
                          String employee,
                          LocalDate transactionDate,
                          String startTime,
                          String endTime,
                          BigDecimal duration,
                          String payrollItem,
                          String notes,
                          Classification classification) {

    /** Registros sin duración (o con cero) no participan en ningún cálculo. */
    public boolean hasHours() {
        return duration != null && duration.signum() > 0;
    }
}
