package sp.sistemaspalacios.api_payroll.dto.configuration;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class GeneralConfigurationDTO {
    private String value;
}
