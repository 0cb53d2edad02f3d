package sp.sistemaspalacios.api_payroll.dto.payroll;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PayrollStatsDTO {
    private int employeesProcessed;
    private int inputRows;
    private int participatingRows;
    private int outputLines;
    private BigDecimal reductionPercent;
    private BigDecimal totalRegularHours;
    private BigDecimal totalOvertimeHours;
    private BigDecimal totalStatutoryHours;
    private BigDecimal totalEntitlementHours;
}
