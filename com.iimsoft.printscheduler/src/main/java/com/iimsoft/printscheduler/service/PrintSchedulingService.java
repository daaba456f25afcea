package com.iimsoft.printscheduler.service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.iimsoft.printscheduler.api.dto.ScheduleRequest;
import com.iimsoft.printscheduler.api.dto.ScheduleResponse;
import com.iimsoft.printscheduler.batch.GreedyTitleBatchPartitioner;
import com.iimsoft.printscheduler.config.SchedulingParameters;
import com.iimsoft.printscheduler.domain.PrintJob;
import com.iimsoft.printscheduler.domain.Printer;
import com.iimsoft.printscheduler.domain.PrinterRoster;
import com.iimsoft.printscheduler.domain.ScheduledJob;
import com.iimsoft.printscheduler.domain.UnscheduledJob;
import com.iimsoft.printscheduler.exception.SchedulingConfigurationException;
import com.iimsoft.printscheduler.model.ObjectiveBreakdown;
import com.iimsoft.printscheduler.solver.ConstraintSolver;
import com.iimsoft.printscheduler.solver.cpsat.CpSatConstraintSolver;
import com.iimsoft.printscheduler.solver.optaplanner.OptaPlannerConstraintSolver;

/**
 * 对外入口：校验参数、构建打印机清单、选择求解引擎并运行多批次编排。
 */
public class PrintSchedulingService {

    private static final Logger LOGGER = LoggerFactory.getLogger(PrintSchedulingService.class);

    private final Function<SchedulingParameters, ConstraintSolver> solverFactory;

    public PrintSchedulingService() {
        this(PrintSchedulingService::createSolver);
    }

    public PrintSchedulingService(Function<SchedulingParameters, ConstraintSolver> solverFactory) {
        this.solverFactory = solverFactory;
    }

    public ScheduleResult schedule(List<PrintJob> jobs, List<Printer> printers, SchedulingParameters parameters) {
        Objects.requireNonNull(jobs, "jobs");
        SchedulingParameters params = (parameters == null ? new SchedulingParameters() : parameters).validate();
        PrinterRoster roster = new PrinterRoster(printers);

        ConstraintSolver solver = solverFactory.apply(params);
        LOGGER.info("Using {} with a budget of {} s per batch", solver.getName(), params.getSolveTimeLimitSeconds());
        MultiBatchOrchestrator orchestrator =
                new MultiBatchOrchestrator(roster, params, new GreedyTitleBatchPartitioner(), solver);
        return orchestrator.run(jobs);
    }

    public ScheduleResponse solve(ScheduleRequest request) {
        Objects.requireNonNull(request, "request");
        validateRequest(request);

        SchedulingParameters params = request.parameters == null ? new SchedulingParameters() : request.parameters;
        ScheduleResult result = schedule(toJobs(request.jobs), toPrinters(request.printers), params);
        return buildResponse(result, params.getScheduleEpoch());
    }

    public static ConstraintSolver createSolver(SchedulingParameters parameters) {
        switch (parameters.getSolverEngine()) {
            case CP_SAT:
                return new CpSatConstraintSolver(parameters.getCpSatWorkers());
            case OPTAPLANNER:
            default:
                return new OptaPlannerConstraintSolver();
        }
    }

    private static void validateRequest(ScheduleRequest request) {
        if (request.jobs == null) {
            throw new SchedulingConfigurationException("request.jobs 不能为空");
        }
        if (request.printers == null || request.printers.isEmpty()) {
            throw new SchedulingConfigurationException("request.printers 不能为空");
        }
    }

    private static List<PrintJob> toJobs(List<ScheduleRequest.JobDto> dtos) {
        List<PrintJob> jobs = new ArrayList<>();
        for (ScheduleRequest.JobDto j : dtos) {
            try {
                int quantity = j.alphaQuantityOnPlate == null ? 1 : j.alphaQuantityOnPlate;
                jobs.add(new PrintJob(j.id, j.title, j.material, j.technology, j.machineModel, j.durationMinutes, quantity));
            } catch (IllegalArgumentException | NullPointerException e) {
                throw new SchedulingConfigurationException("Invalid job " + j.id + ": " + e.getMessage());
            }
        }
        return jobs;
    }

    private static List<Printer> toPrinters(List<ScheduleRequest.PrinterDto> dtos) {
        List<Printer> printers = new ArrayList<>();
        for (ScheduleRequest.PrinterDto p : dtos) {
            try {
                printers.add(new Printer(p.id, p.name, p.material, p.technology, p.machineModel, p.rack));
            } catch (NullPointerException e) {
                throw new SchedulingConfigurationException("Invalid printer " + p.id + ": missing " + e.getMessage());
            }
        }
        return printers;
    }

    static ScheduleResponse buildResponse(ScheduleResult result, LocalDate epoch) {
        ScheduleResponse resp = new ScheduleResponse();
        resp.scheduleStartDate = epoch.toString();
        resp.makespanMinutes = result.getMakespan();
        LocalDateTime midnight = epoch.atStartOfDay();

        List<ScheduleResponse.ScheduledJobResult> scheduled = new ArrayList<>();
        for (ScheduledJob s : result.getScheduledJobs()) {
            ScheduleResponse.ScheduledJobResult r = new ScheduleResponse.ScheduledJobResult();
            PrintJob job = s.getJob();
            r.jobId = job.getId();
            r.title = job.getTitle();
            r.printerId = s.getPrinter().getId();
            r.printerName = s.getPrinter().getName();
            r.rack = s.getRack();
            r.batchNumber = s.getBatchNumber();
            r.startMinute = s.getStart();
            r.endMinute = s.getEnd();
            r.trueEndMinute = s.getTrueEnd();
            r.startDateTime = midnight.plusMinutes(s.getStart()).toString();
            r.endDateTime = midnight.plusMinutes(s.getEnd()).toString();
            r.material = job.getMaterial();
            r.technology = job.getTechnology();
            r.machineModel = job.getMachineModel();
            r.durationMinutes = job.getDurationMinutes();
            r.alphaQuantityOnPlate = job.getAlphaQuantityOnPlate();
            scheduled.add(r);
        }
        resp.scheduled = scheduled;

        List<ScheduleResponse.UnscheduledJobResult> unscheduled = new ArrayList<>();
        for (UnscheduledJob u : result.getUnscheduledJobs()) {
            ScheduleResponse.UnscheduledJobResult r = new ScheduleResponse.UnscheduledJobResult();
            r.jobId = u.getJob().getId();
            r.title = u.getJob().getTitle();
            r.reason = u.getReason().name();
            r.batchNumber = u.getBatchNumber();
            r.material = u.getJob().getMaterial();
            r.technology = u.getJob().getTechnology();
            r.machineModel = u.getJob().getMachineModel();
            r.durationMinutes = u.getJob().getDurationMinutes();
            r.alphaQuantityOnPlate = u.getJob().getAlphaQuantityOnPlate();
            unscheduled.add(r);
        }
        resp.unscheduled = unscheduled;

        List<ScheduleResponse.BatchResult> batches = new ArrayList<>();
        for (BatchReport b : result.getBatchReports()) {
            ScheduleResponse.BatchResult r = new ScheduleResponse.BatchResult();
            r.batchNumber = b.getBatchNumber();
            r.state = b.getState().name();
            r.jobCount = b.getJobCount();
            r.horizonMinutes = b.getHorizon();
            r.offsetMinutes = b.getOffsetMinutes();
            r.solveStatus = b.getSolveStatus() == null ? null : b.getSolveStatus().name();
            ObjectiveBreakdown o = b.getObjective();
            if (o != null) {
                r.makespan = o.getMakespan();
                r.proximityPenalty = o.getProximityPenalty();
                r.maxJobsPerPrinter = o.getMaxJobsPerPrinter();
                r.printersUsed = o.getPrintersUsed();
                r.objective = o.getWeightedTotal();
            }
            r.wallTimeMillis = b.getWallTime() == null ? null : b.getWallTime().toMillis();
            r.message = b.getMessage();
            batches.add(r);
        }
        resp.batches = batches;
        return resp;
    }
}
