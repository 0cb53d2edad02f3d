package sp.sistemaspalacios.api_payroll.dto.payroll;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PayrollRunResponse {
    private List<OutputLineDTO> lines;
    private PayrollStatsDTO stats;
}
