package sp.sistemaspalacios.api_payroll.service.payroll.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import sp.sistemaspalacios.api_payroll.domain.payroll.Classification;
import sp.sistemaspalacios.api_payroll.domain.payroll.HolidayWindow;
import sp.sistemaspalacios.api_payroll.dto.payroll.*;
import sp.sistemaspalacios.api_payroll.exception.InvalidPayrollConfigurationException;
import sp.sistemaspalacios.api_payroll.exception.InvalidShiftRecordException;
import sp.sistemaspalacios.api_payroll.service.boundaries.generalConfiguration.GeneralConfigurationService;
import sp.sistemaspalacios.api_payroll.service.boundaries.holiday.StatutoryHolidayService;
import sp.sistemaspalacios.api_payroll.service.common.TimeService;
import sp.sistemaspalacios.api_payroll.service.payroll.holiday.HolidayEntitlementService;
import sp.sistemaspalacios.api_payroll.service.payroll.output.PayrollOutputService;
import sp.sistemaspalacios.api_payroll.service.payroll.overtime.OvertimeAllocationService;
import sp.sistemaspalacios.api_payroll.service.payroll.rate.RateCodeService;
import sp.sistemaspalacios.api_payroll.service.payroll.time.ShiftSegmentationService;
import sp.sistemaspalacios.api_payroll.service.payroll.union.UnionBenefitService;
import sp.sistemaspalacios.api_payroll.service.payroll.vacation.VacationPercentService;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class PayrollProcessingServiceTest {

    private static final LocalDate PERIOD_START = LocalDate.of(2025, 6, 23);
    private static final LocalDate PERIOD_END = LocalDate.of(2025, 7, 6);
    private static final LocalDate CANADA_DAY = LocalDate.of(2025, 7, 1);

    @Mock
    StatutoryHolidayService statutoryHolidayService;

    @Mock
    GeneralConfigurationService configService;

    private PayrollProcessingService service;

    @BeforeEach
    void setup() {
        RateCodeService rateCodeService = new RateCodeService();
        service = new PayrollProcessingService(
                rateCodeService,
                new ShiftSegmentationService(new TimeService()),
                new OvertimeAllocationService(rateCodeService),
                new HolidayEntitlementService(rateCodeService, new VacationPercentService()),
                new UnionBenefitService(),
                new PayrollOutputService(configService),
                statutoryHolidayService);

        when(configService.getValueOrDefault(GeneralConfigurationService.OUTPUT_CUSTOMER)).thenReturn("STAR TOTAL");
        when(configService.getValueOrDefault(GeneralConfigurationService.OUTPUT_SERVICE_ITEM)).thenReturn("Labor");
        when(statutoryHolidayService.findWindowsWithin(any(), any())).thenReturn(List.of());
    }

    private static ShiftRecordDTO shift(String employee, LocalDate date, String hours, String code) {
        return ShiftRecordDTO.builder()
                .employee(employee)
                .transactionDate(date)
                .duration(hours == null ? null : new BigDecimal(hours))
                .payrollItem(code)
                .build();
    }

    private static PayrollRunRequest request(List<ShiftRecordDTO> records, List<StatutoryHolidayConfigDTO> holidays) {
        return PayrollRunRequest.builder()
                .payPeriod(new PayPeriodDTO(PERIOD_START, PERIOD_END))
                .records(records)
                .holidays(holidays)
                .build();
    }

    private static StatutoryHolidayConfigDTO canadaDay() {
        return StatutoryHolidayConfigDTO.builder()
                .holidayDate(CANADA_DAY)
                .lookbackStart(LocalDate.of(2025, 6, 2))
                .lookbackEnd(LocalDate.of(2025, 6, 30))
                .build();
    }

    private List<ShiftRecordDTO> multiRateFortnight() {
        return new ArrayList<>(List.of(
                shift("Ana", PERIOD_START, "59", "23.50 Rate"),
                shift("Ana", PERIOD_START.plusDays(3), "12.5", "18 Rate"),
                shift("Ana", PERIOD_START.plusDays(5), "16.5", "23.50 Rate"),
                shift("Ana", PERIOD_START.plusDays(8), "7.5", "23.50 Rate"),
                shift("Ana", PERIOD_START.plusDays(10), "12", "18 Rate")));
    }

    @Test
    void multiRateFortnightIsSplitAtEightyEight() {
        PayrollRunResponse response = service.process(request(multiRateFortnight(), null));

        assertThat(response.getLines())
                .extracting(OutputLineDTO::getPayrollItem, OutputLineDTO::getDuration)
                .containsExactly(
                        tuple("18 Rate", new BigDecimal("12.50")),
                        tuple("18 Rate OT/ STAT", new BigDecimal("12.00")),
                        tuple("23.50 Rate", new BigDecimal("75.50")),
                        tuple("23.50 Rate OT/ STAT", new BigDecimal("7.50")));
        assertThat(response.getLines()).allMatch(line -> line.getTransactionDate().equals(PERIOD_START));

        PayrollStatsDTO stats = response.getStats();
        assertThat(stats.getEmployeesProcessed()).isEqualTo(1);
        assertThat(stats.getInputRows()).isEqualTo(5);
        assertThat(stats.getOutputLines()).isEqualTo(4);
        assertThat(stats.getReductionPercent()).isEqualByComparingTo("20");
        assertThat(stats.getTotalRegularHours()).isEqualByComparingTo("88");
        assertThat(stats.getTotalOvertimeHours()).isEqualByComparingTo("19.5");
    }

    @Test
    void shuffledInputGivesSameLines() {
        List<ShiftRecordDTO> shuffled = multiRateFortnight();
        Collections.reverse(shuffled);

        assertThat(service.process(request(shuffled, null)).getLines())
                .isEqualTo(service.process(request(multiRateFortnight(), null)).getLines());
    }

    @Test
    void callerRecordsAreNotModified() {
        List<ShiftRecordDTO> records = multiRateFortnight();
        ShiftRecordDTO original = ShiftRecordDTO.builder()
                .employee("Ana").transactionDate(PERIOD_START).duration(new BigDecimal("59")).payrollItem("23.50 Rate")
                .build();

        service.process(request(records, null));

        assertThat(records.get(0)).isEqualTo(original);
    }

    @Test
    void overnightShiftIntoHolidayGetsStatutoryAndEntitlement() {
        ShiftRecordDTO overnight = shift("Ana", LocalDate.of(2025, 6, 30), "8", "21.75 Rate");
        overnight.setStartTime("20:00");
        overnight.setEndTime("04:00");
        ShiftRecordDTO lookbackOnly = shift("Ana", LocalDate.of(2025, 6, 10), "8", "21.75 Rate");

        PayrollRunResponse response = service.process(request(List.of(overnight, lookbackOnly), List.of(canadaDay())));

        // Ventana: 16 h x 21.75 = 348; x 1.04 / 20 / 30 = 0.6032
        assertThat(response.getLines())
                .extracting(OutputLineDTO::getPayrollItem, OutputLineDTO::getDuration,
                        OutputLineDTO::getTransactionDate, OutputLineDTO::getClassification)
                .containsExactly(
                        tuple("21.75 Rate", new BigDecimal("4.00"), LocalDate.of(2025, 6, 30), Classification.REGULAR),
                        tuple("21.75 Rate OT/STAT", new BigDecimal("4.00"), LocalDate.of(2025, 6, 30), Classification.STATUTORY),
                        tuple("PHP (Holiday)", new BigDecimal("0.60"), CANADA_DAY, Classification.ENTITLEMENT));

        PayrollStatsDTO stats = response.getStats();
        assertThat(stats.getParticipatingRows()).isEqualTo(1);
        assertThat(stats.getTotalStatutoryHours()).isEqualByComparingTo("4");
        assertThat(stats.getTotalEntitlementHours()).isEqualByComparingTo("0.60");
        verify(statutoryHolidayService, never()).findWindowsWithin(any(), any());
    }

    @Test
    void timeDetailFeedIsUsedWhenRecordHasNoTimes() {
        ShiftRecordDTO overnight = shift("Ana", LocalDate.of(2025, 6, 30), "8", "Regular");
        PayrollRunRequest request = request(List.of(overnight), List.of(canadaDay()));
        request.setTimeDetails(List.of(TimeDetailDTO.builder()
                .employee("Ana").date(LocalDate.of(2025, 6, 30)).startTime("8:00 PM").endTime("4:00 AM")
                .build()));

        List<OutputLineDTO> lines = service.process(request).getLines();

        assertThat(lines).extracting(OutputLineDTO::getPayrollItem, OutputLineDTO::getDuration)
                .contains(tuple("Regular", new BigDecimal("4.00")),
                        tuple("Hourly Overtime /STAT", new BigDecimal("4.00")));
    }

    @Test
    void rerunOnFinishedOutputLeavesTaggedLinesUnchanged() {
        ShiftRecordDTO overnight = shift("Ana", LocalDate.of(2025, 6, 30), "8", "21.75 Rate");
        overnight.setStartTime("20:00");
        overnight.setEndTime("04:00");
        List<OutputLineDTO> firstRun = service.process(
                request(List.of(overnight, shift("Ana", LocalDate.of(2025, 6, 10), "8", "21.75 Rate")),
                        List.of(canadaDay()))).getLines();

        List<ShiftRecordDTO> fedBack = firstRun.stream()
                .map(line -> shift(line.getEmployee(), line.getTransactionDate(),
                        line.getDuration().toPlainString(), line.getPayrollItem()))
                .collect(Collectors.toList());
        List<OutputLineDTO> secondRun = service.process(request(fedBack, List.of(canadaDay()))).getLines();

        assertThat(secondRun)
                .extracting(OutputLineDTO::getPayrollItem, OutputLineDTO::getDuration, OutputLineDTO::getTransactionDate)
                .containsExactlyElementsOf(firstRun.stream()
                        .map(l -> tuple(l.getPayrollItem(), l.getDuration(), l.getTransactionDate()))
                        .collect(Collectors.toList()));
    }

    @Test
    void zeroDurationRowsAreIgnoredEverywhere() {
        List<ShiftRecordDTO> records = List.of(
                shift("Ana", PERIOD_START, "8", "Regular"),
                shift("Ben", PERIOD_START, "0", "Regular"),
                shift("Cy", PERIOD_START, null, "Regular"));

        PayrollRunResponse response = service.process(request(records, null));

        assertThat(response.getLines()).extracting(OutputLineDTO::getEmployee).containsExactly("Ana");
        assertThat(response.getStats().getEmployeesProcessed()).isEqualTo(1);
        assertThat(response.getStats().getParticipatingRows()).isEqualTo(1);
        assertThat(response.getStats().getInputRows()).isEqualTo(3);
        assertThat(response.getStats().getReductionPercent()).isEqualByComparingTo("66.67");
    }

    @Test
    void rowsOutsidePeriodDoNotParticipate() {
        List<ShiftRecordDTO> records = List.of(
                shift("Ana", PERIOD_START.minusDays(1), "80", "Regular"),
                shift("Ana", PERIOD_START, "10", "Regular"));

        List<OutputLineDTO> lines = service.process(request(records, null)).getLines();

        assertThat(lines).hasSize(1);
        assertThat(lines.get(0).getDuration()).isEqualByComparingTo("10");
    }

    @Test
    void reductionIsMeasuredAgainstAllInputRows() {
        List<ShiftRecordDTO> records = List.of(
                shift("Ana", PERIOD_START.minusDays(1), "8", "Regular"),
                shift("Ana", PERIOD_START, "8", "Regular"),
                shift("Ana", PERIOD_START.plusDays(1), "8", "Regular"),
                shift("Ana", PERIOD_START.plusDays(2), "0", "Regular"));

        PayrollStatsDTO stats = service.process(request(records, null)).getStats();

        // 1 línea de 4 filas de entrada
        assertThat(stats.getParticipatingRows()).isEqualTo(2);
        assertThat(stats.getOutputLines()).isEqualTo(1);
        assertThat(stats.getReductionPercent()).isEqualByComparingTo("75.00");
    }

    @Test
    void employeeWithOnlyLookbackHoursStillGetsEntitlementLine() {
        List<ShiftRecordDTO> records = List.of(
                shift("Ana", LocalDate.of(2025, 6, 10), "80", "20 Rate"),
                shift("Ana", LocalDate.of(2025, 6, 24), "8", "20 Rate"),
                shift("Bob", LocalDate.of(2025, 6, 10), "80", "20 Rate"));

        PayrollRunResponse response = service.process(request(records, List.of(canadaDay())));

        // Bob: 80 h x 20 = 1600; x 1.04 / 20 / 30 = 2.7733
        assertThat(response.getLines())
                .extracting(OutputLineDTO::getEmployee, OutputLineDTO::getPayrollItem,
                        OutputLineDTO::getDuration, OutputLineDTO::getTransactionDate)
                .containsExactly(
                        tuple("Ana", "20 Rate", new BigDecimal("8.00"), LocalDate.of(2025, 6, 24)),
                        tuple("Ana", "PHP (Holiday)", new BigDecimal("3.05"), CANADA_DAY),
                        tuple("Bob", "PHP (Holiday)", new BigDecimal("2.77"), CANADA_DAY));

        PayrollStatsDTO stats = response.getStats();
        assertThat(stats.getEmployeesProcessed()).isEqualTo(2);
        assertThat(stats.getParticipatingRows()).isEqualTo(1);
        assertThat(stats.getTotalEntitlementHours()).isEqualByComparingTo("5.82");
    }

    @Test
    void employeeWithOnlyOutOfPeriodHoursAndNoHolidaysIsSkipped() {
        List<ShiftRecordDTO> records = List.of(
                shift("Ana", PERIOD_START, "8", "Regular"),
                shift("Bob", PERIOD_START.minusDays(3), "8", "Regular"));

        PayrollRunResponse response = service.process(request(records, null));

        assertThat(response.getLines()).extracting(OutputLineDTO::getEmployee).containsExactly("Ana");
        assertThat(response.getStats().getEmployeesProcessed()).isEqualTo(1);
    }

    @Test
    void sharedTimeDetailIsNotAppliedToSeveralRecordsOfSameDay() {
        LocalDate day = LocalDate.of(2025, 6, 24);
        PayrollRunRequest request = request(List.of(
                shift("Cy", day, "4", "18 Rate"),
                shift("Cy", day, "4", "20 Rate")), null);
        request.setTimeDetails(List.of(TimeDetailDTO.builder()
                .employee("Cy").date(day).startTime("08:00").endTime("16:00")
                .build()));

        PayrollRunResponse response = service.process(request);

        assertThat(response.getLines())
                .extracting(OutputLineDTO::getPayrollItem, OutputLineDTO::getDuration)
                .containsExactly(
                        tuple("18 Rate", new BigDecimal("4.00")),
                        tuple("20 Rate", new BigDecimal("4.00")));
        assertThat(response.getStats().getTotalRegularHours()).isEqualByComparingTo("8");
    }

    @Test
    void timeDetailStillAppliesWhenRecordWithOwnTimesSharesTheDay() {
        LocalDate day = LocalDate.of(2025, 6, 24);
        ShiftRecordDTO timed = shift("Cy", day, "4", "18 Rate");
        timed.setStartTime("06:00");
        timed.setEndTime("10:00");
        PayrollRunRequest request = request(List.of(timed, shift("Cy", day, "6", "20 Rate")), null);
        request.setTimeDetails(List.of(TimeDetailDTO.builder()
                .employee("Cy").date(day).startTime("12:00").endTime("18:00")
                .build()));

        assertThat(service.process(request).getLines())
                .extracting(OutputLineDTO::getPayrollItem, OutputLineDTO::getDuration)
                .containsExactly(
                        tuple("18 Rate", new BigDecimal("4.00")),
                        tuple("20 Rate", new BigDecimal("6.00")));
    }

    @Test
    void storedHolidaysAreUsedWhenRequestHasNone() {
        when(statutoryHolidayService.findWindowsWithin(PERIOD_START, PERIOD_END))
                .thenReturn(List.of(new HolidayWindow(CANADA_DAY, LocalDate.of(2025, 6, 2), LocalDate.of(2025, 6, 30))));

        List<OutputLineDTO> lines = service.process(
                request(List.of(shift("Ana", CANADA_DAY, "8", "18 Rate")), List.of())).getLines();

        assertThat(lines).extracting(OutputLineDTO::getPayrollItem).containsExactly("18 Rate OT/ STAT");
    }

    @Test
    void missingEmployeeAbortsRunWithRecordIndex() {
        List<ShiftRecordDTO> records = List.of(
                shift("Ana", PERIOD_START, "8", "Regular"),
                shift(" ", PERIOD_START, "8", "Regular"));

        assertThatThrownBy(() -> service.process(request(records, null)))
                .isInstanceOf(InvalidShiftRecordException.class)
                .hasMessageContaining("#1");
    }

    @Test
    void missingDateAbortsRun() {
        assertThatThrownBy(() -> service.process(request(List.of(shift("Ana", null, "8", "Regular")), null)))
                .isInstanceOf(InvalidShiftRecordException.class)
                .hasFieldOrPropertyWithValue("recordIndex", 0);
    }

    @Test
    void holidaysOutsidePeriodAreRejected() {
        StatutoryHolidayConfigDTO victoriaDay = StatutoryHolidayConfigDTO.builder()
                .holidayDate(LocalDate.of(2025, 5, 19))
                .lookbackStart(LocalDate.of(2025, 4, 21))
                .lookbackEnd(LocalDate.of(2025, 5, 18))
                .build();

        assertThatThrownBy(() -> service.process(request(List.of(shift("Ana", PERIOD_START, "8", "Regular")),
                List.of(victoriaDay))))
                .isInstanceOf(InvalidPayrollConfigurationException.class);
    }

    @Test
    void invertedPayPeriodIsRejected() {
        PayrollRunRequest request = request(List.of(), null);
        request.setPayPeriod(new PayPeriodDTO(PERIOD_END, PERIOD_START));

        assertThatThrownBy(() -> service.process(request)).isInstanceOf(InvalidPayrollConfigurationException.class);
    }

    @Test
    void unionBenefitsAreReportedWithTotals() {
        List<ShiftRecordDTO> records = new ArrayList<>();
        for (int day = 0; day < 5; day++) records.add(shift("Ana", PERIOD_START.plusDays(day), "10", "18 Rate"));
        for (int day = 7; day < 10; day++) records.add(shift("Ana", PERIOD_START.plusDays(day), "10", "18 Rate"));
        records.add(shift("Ben", PERIOD_START.plusDays(8), "6", "Regular"));

        UnionBenefitResponse response = service.calculateUnionBenefits(new UnionBenefitRequest(records));

        assertThat(response.getWeek1End()).isEqualTo(PERIOD_START.plusDays(6));
        assertThat(response.getLines()).hasSize(2);
        assertThat(response.getTotalPayableHours()).isEqualByComparingTo("80");
        assertThat(response.getTotalCost()).isEqualByComparingTo("64.00");
    }

    @Test
    void unionBenefitsFailOnMissingEmployee() {
        assertThatThrownBy(() -> service.calculateUnionBenefits(
                new UnionBenefitRequest(List.of(shift(null, PERIOD_START, "8", "Regular")))))
                .isInstanceOf(InvalidShiftRecordException.class);
        verify(configService, never()).getValueOrDefault(anyString());
    }
}
