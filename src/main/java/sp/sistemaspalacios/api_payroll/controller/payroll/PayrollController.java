package sp.sistemaspalacios.api_payroll.controller.payroll;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import sp.sistemaspalacios.api_payroll.dto.payroll.PayrollRunRequest;
import sp.sistemaspalacios.api_payroll.dto.payroll.PayrollRunResponse;
import sp.sistemaspalacios.api_payroll.dto.payroll.UnionBenefitRequest;
import sp.sistemaspalacios.api_payroll.dto.payroll.UnionBenefitResponse;
import sp.sistemaspalacios.api_payroll.service.payroll.core.PayrollProcessingService;

@RestController
@RequestMapping("/api/payroll")
@RequiredArgsConstructor
public class PayrollController {

    private final PayrollProcessingService payrollProcessingService;

    /**
     * Clasifica y consolida los registros de un período quincenal
     * POST /api/payroll/process
     */
    @PostMapping("/process")
    public ResponseEntity<PayrollRunResponse> process(@RequestBody PayrollRunRequest request) {
        return ResponseEntity.ok(payrollProcessingService.process(request));
    }

    /**
     * Reporte de aporte sindical (tope semanal de 44 h)
     * POST /api/payroll/union-benefits
     */
    @PostMapping("/union-benefits")
    public ResponseEntity<UnionBenefitResponse> unionBenefits(@RequestBody UnionBenefitRequest request) {
        return ResponseEntity.ok(payrollProcessingService.calculateUnionBenefits(request));
    }
}
