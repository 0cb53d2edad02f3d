package sp.sistemaspalacios.api_payroll.dto.payroll;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatutoryHolidayConfigDTO {
    private Long id;
    private LocalDate holidayDate;
    private LocalDate lookbackStart;
    private LocalDate lookbackEnd;
    private String description;
}
