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
public class UnionBenefitLineDTO {
    private String employee;
    private BigDecimal week1Hours;
    private BigDecimal week1Payable;
    private BigDecimal week2Hours;
    private BigDecimal week2Payable;
    private BigDecimal totalPayable;
    private BigDecimal totalCost;
}
