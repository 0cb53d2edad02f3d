package sp.sistemaspalacios.api_payroll.domain.payroll;

/**
 * Clasificación de una línea de horas. Se asigna una sola vez al normalizar el registro.
 * Las líneas OVERTIME, STATUTORY y ENTITLEMENT ya vienen terminadas y no se reprocesan.
 */
public enum Classification {
    UNCLASSIFIED,
    REGULAR,
    OVERTIME,
    STATUTORY,
    ENTITLEMENT;

    public boolean isFinished() {
        return this == OVERTIME || this == STATUTORY || this == ENTITLEMENT;
    }
}
