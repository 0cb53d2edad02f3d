package sp.sistemaspalacios.api_payroll.dto.payroll;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PayPeriodDTO {
    private LocalDate startDate;
    private LocalDate endDate;
}
