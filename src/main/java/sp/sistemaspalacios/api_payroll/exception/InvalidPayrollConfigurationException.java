package sp.sistemaspalacios.api_payroll.exception;

public class InvalidPayrollConfigurationException extends RuntimeException {

    public InvalidPayrollConfigurationException(String message) {
        super(message);
    }
}
