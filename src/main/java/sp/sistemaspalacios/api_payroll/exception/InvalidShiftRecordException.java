package sp.sistemaspalacios.api_payroll.exception;

/**
 * Registro de entrada sin un campo obligatorio (empleado o fecha).
 * Aborta la corrida completa: el normalizador debió entregarlo completo.
 */
public class InvalidShiftRecordException extends RuntimeException {

    private final int recordIndex;

    public InvalidShiftRecordException(int recordIndex, String message) {
        super("Registro #" + recordIndex + ": " + message);
        this.recordIndex = recordIndex;
    }

    public int getRecordIndex() {
        return recordIndex;
    }
}
