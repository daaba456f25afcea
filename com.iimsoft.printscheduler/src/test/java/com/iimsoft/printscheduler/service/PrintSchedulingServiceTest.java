package com.iimsoft.printscheduler.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import static com.iimsoft.printscheduler.TestFixtures.core;
import static com.iimsoft.printscheduler.TestFixtures.coreJob;
import static com.iimsoft.printscheduler.TestFixtures.fastParameters;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.iimsoft.printscheduler.api.dto.ScheduleRequest;
import com.iimsoft.printscheduler.api.dto.ScheduleResponse;
import com.iimsoft.printscheduler.config.SchedulingParameters;
import com.iimsoft.printscheduler.config.SolverEngine;
import com.iimsoft.printscheduler.domain.PrintJob;
import com.iimsoft.printscheduler.domain.ScheduledJob;
import com.iimsoft.printscheduler.exception.SchedulingConfigurationException;
import com.iimsoft.printscheduler.solver.ConstraintSolver;
import com.iimsoft.printscheduler.solver.cpsat.CpSatConstraintSolver;
import com.iimsoft.printscheduler.solver.optaplanner.OptaPlannerConstraintSolver;

class PrintSchedulingServiceTest {

    private final List<SolverEngine> requestedEngines = new ArrayList<>();
    private PrintSchedulingService service;

    @BeforeEach
    void setUp() {
        ConstraintSolver solver = mock(ConstraintSolver.class);
        when(solver.getName()).thenReturn("serial");
        when(solver.solve(any(), any())).thenAnswer(inv -> MultiBatchOrchestratorTest.serialize(inv.getArgument(0)));
        service = new PrintSchedulingService(parameters -> {
            requestedEngines.add(parameters.getSolverEngine());
            return solver;
        });
    }

    @Test
    void mapsRequestToResponseWithIsoTimes() {
        ScheduleRequest request = request();
        request.parameters = new SchedulingParameters();
        request.parameters.setScheduleStartDate("2025-07-28");
        request.parameters.setSolverEngine(SolverEngine.CP_SAT);

        ScheduleResponse response = service.solve(request);

        assertEquals(List.of(SolverEngine.CP_SAT), requestedEngines);
        assertEquals("2025-07-28", response.scheduleStartDate);
        assertEquals(1, response.scheduled.size());
        ScheduleResponse.ScheduledJobResult knob = response.scheduled.get(0);
        assertEquals(101L, knob.jobId);
        assertEquals("Core 001", knob.printerName);
        assertEquals("2", knob.rack);
        assertEquals(480L, knob.startMinute);
        assertEquals("2025-07-28T08:00", knob.startDateTime);
        assertEquals("2025-07-28T08:30", knob.endDateTime);
        assertEquals(24, knob.alphaQuantityOnPlate);

        assertEquals(1, response.unscheduled.size());
        ScheduleResponse.UnscheduledJobResult washer = response.unscheduled.get(0);
        assertEquals(102L, washer.jobId);
        assertEquals("UNROUTABLE", washer.reason);
        assertNull(washer.batchNumber);
        assertEquals("ABS", washer.material);
        assertEquals("FDM", washer.technology);
        assertEquals("Core One", washer.machineModel);
        assertEquals(40, washer.durationMinutes);
        assertEquals(12, washer.alphaQuantityOnPlate);

        assertEquals(1, response.batches.size());
        assertEquals("SOLVED", response.batches.get(0).state);
        assertEquals(0L, response.batches.get(0).offsetMinutes);
        assertEquals(510L, response.makespanMinutes);
    }

    @Test
    void missingParametersFallBackToDefaults() {
        ScheduleResponse response = service.solve(request());

        assertEquals(List.of(SolverEngine.OPTAPLANNER), requestedEngines);
        assertEquals(1, response.scheduled.size());
    }

    @Test
    void invalidParametersFailBeforeSolving() {
        ScheduleRequest request = request();
        request.parameters = new SchedulingParameters();
        request.parameters.setShiftStartHour(25);

        assertThrows(SchedulingConfigurationException.class, () -> service.solve(request));
        assertEquals(List.of(), requestedEngines);
    }

    @Test
    void requestWithoutPrintersIsRejected() {
        ScheduleRequest request = request();
        request.printers = List.of();

        assertThrows(SchedulingConfigurationException.class, () -> service.solve(request));
    }

    @Test
    void invalidJobIsReportedAsConfigurationError() {
        ScheduleRequest request = request();
        request.jobs.get(0).durationMinutes = 0;

        assertThrows(SchedulingConfigurationException.class, () -> service.solve(request));
    }

    @Test
    void enginesAreCreatedFromParameters() {
        SchedulingParameters parameters = new SchedulingParameters();
        assertInstanceOf(OptaPlannerConstraintSolver.class, PrintSchedulingService.createSolver(parameters));

        parameters.setSolverEngine(SolverEngine.CP_SAT);
        parameters.setCpSatWorkers(2);
        ConstraintSolver cpSat = PrintSchedulingService.createSolver(parameters);
        assertInstanceOf(CpSatConstraintSolver.class, cpSat);
        assertEquals(2, ((CpSatConstraintSolver) cpSat).getNumWorkers());
    }

    @Test
    void defaultEngineSchedulesThreeJobsOnOnePrinter() {
        List<PrintJob> jobs = List.of(
                coreJob(1, "Bracket", "PETG", 30),
                coreJob(2, "Bracket", "PETG", 30),
                coreJob(3, "Bracket", "PETG", 30));

        ScheduleResult result = new PrintSchedulingService()
                .schedule(jobs, List.of(core(1, "PETG", "2")), fastParameters());

        assertEquals(List.of(), result.getUnscheduledJobs());
        assertEquals(3, result.getScheduledJobs().size());
        List<ScheduledJob> scheduled = new ArrayList<>(result.getScheduledJobs());
        scheduled.sort(Comparator.comparingLong(ScheduledJob::getStart));
        for (int i = 0; i < scheduled.size(); i++) {
            ScheduledJob job = scheduled.get(i);
            assertEquals(1L, job.getPrinter().getId());
            assertTrue(job.getStart() >= 480);
            if (i > 0) {
                assertTrue(job.getStart() >= scheduled.get(i - 1).getEnd(), "jobs overlap: " + scheduled);
            }
        }
        assertEquals(BatchState.SOLVED, result.getBatchReports().get(0).getState());
    }

    private static ScheduleRequest request() {
        ScheduleRequest request = new ScheduleRequest();

        ScheduleRequest.PrinterDto printer = new ScheduleRequest.PrinterDto();
        printer.id = 5;
        printer.name = "Core 001";
        printer.material = "PETG";
        printer.technology = "FDM";
        printer.machineModel = "Core One";
        printer.rack = "2";
        request.printers = List.of(printer);

        ScheduleRequest.JobDto knob = new ScheduleRequest.JobDto();
        knob.id = 101;
        knob.title = "Knob";
        knob.material = "PETG";
        knob.technology = "FDM";
        knob.machineModel = "Core One";
        knob.durationMinutes = 30;
        knob.alphaQuantityOnPlate = 24;

        ScheduleRequest.JobDto washer = new ScheduleRequest.JobDto();
        washer.id = 102;
        washer.title = "Washer";
        washer.material = "ABS";
        washer.technology = "FDM";
        washer.machineModel = "Core One";
        washer.durationMinutes = 40;
        washer.alphaQuantityOnPlate = 12;

        request.jobs = new ArrayList<>(List.of(knob, washer));
        return request;
    }
}
