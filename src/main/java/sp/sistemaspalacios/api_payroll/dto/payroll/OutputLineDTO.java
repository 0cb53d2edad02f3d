package sp.sistemaspalacios.api_payroll.dto.payroll;

import com.fasterxml.jackson.annotation.JsonProperty;
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
public class OutputLineDTO {
    private String employee;
    private LocalDate transactionDate;
    private String customer;
    private String serviceItem;
    private String payrollItem;
    private BigDecimal duration;
    @JsonProperty("class")
    private String lineClass;
    private String billable;
    private String notes;
    private Classification classification;
}
