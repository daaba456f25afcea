package com.iimsoft.printscheduler.api.dto;

import java.util.List;

import com.iimsoft.printscheduler.config.SchedulingParameters;

public class ScheduleRequest {

    public List<JobDto> jobs;
    public List<PrinterDto> printers;

    /** 可选：为空时全部使用默认参数 */
    public SchedulingParameters parameters;

    public static class JobDto {
        public long id;
        public String title;
        public String material;
        public String technology;
        public String machineModel;
        public int durationMinutes;
        /** 每板数量，缺省为 1 */
        public Integer alphaQuantityOnPlate;
    }

    public static class PrinterDto {
        public long id;
        public String name;
        public String material;
        public String technology;
        public String machineModel;
        public String rack;
    }
}
