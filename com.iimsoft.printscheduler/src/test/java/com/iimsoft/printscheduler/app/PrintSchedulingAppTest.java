package com.iimsoft.printscheduler.app;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.iimsoft.printscheduler.api.dto.ScheduleRequest;
import com.iimsoft.printscheduler.config.SolverEngine;

class PrintSchedulingAppTest {

    @Test
    void bundledExampleRequestIsReadable() throws Exception {
        ScheduleRequest request = PrintSchedulingApp.readExample(new ObjectMapper());

        assertEquals(11, request.printers.size());
        assertEquals(11, request.jobs.size());
        assertNotNull(request.parameters);
        assertEquals(SolverEngine.OPTAPLANNER, request.parameters.validate().getSolverEngine());
        assertEquals(10, request.parameters.getSolveTimeLimitSeconds());
    }
}
