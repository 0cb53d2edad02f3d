package sp.sistemaspalacios.api_payroll.dto.payroll;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import sp.sistemaspalacios.api_payroll.domain.payroll.Classification;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShiftRecordDTO {
    private String employee;
    private LocalDate transactionDate;
    private String startTime;       // "HH:mm" o "hh:mm AM/PM", opcional
    private String endTime;
    private BigDecimal duration;    // horas
    private String payrollItem;     // p.ej. "21.75 Rate", "Regular"
    private String notes;           // p.ej. "Vacation 6%"
    private Classification classification; // opcional; si falta se deriva del payrollItem
}
