package sp.sistemaspalacios.api_payroll;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ApiPayrollApplication {

    public static void main(String[] args) {
        SpringApplication.run(ApiPayrollApplication.class, args);
    }
}
