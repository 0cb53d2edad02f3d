package sp.sistemaspalacios.api_payroll.dto.payroll;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PayrollRunRequest {
    private PayPeriodDTO payPeriod;
    private List<ShiftRecordDTO> records;
    private List<TimeDetailDTO> timeDetails;
    // Si viene vacío se usan los festivos guardados dentro del período
    private List<StatutoryHolidayConfigDTO> holidays;
}
