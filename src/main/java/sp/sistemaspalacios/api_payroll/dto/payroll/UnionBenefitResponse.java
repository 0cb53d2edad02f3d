package sp.sistemaspalacios.api_payroll.dto.payroll;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UnionBenefitResponse {
    private LocalDate week1End;
    private List<UnionBenefitLineDTO> lines;
    private BigDecimal totalPayableHours;
    private BigDecimal totalCost;
}
