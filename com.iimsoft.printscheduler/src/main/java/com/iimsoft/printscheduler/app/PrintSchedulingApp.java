package com.iimsoft.printscheduler.app;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.iimsoft.printscheduler.api.dto.ScheduleRequest;
import com.iimsoft.printscheduler.api.dto.ScheduleResponse;
import com.iimsoft.printscheduler.exception.SchedulingException;
import com.iimsoft.printscheduler.service.PrintSchedulingService;

/**
 * 统一入口：从 JSON 请求调用 PrintSchedulingService，结果以 JSON 输出到 stdout。
 *
 * 用法：
 * - 读取文件：mvn exec:java -Dexec.args=path/to/request.json
 * - 读取 stdin：mvn exec:java -Dexec.args=- < request.json
 * - 不带参数：使用内置的 example_request.json
 */
public class PrintSchedulingApp {

    private static final Logger LOGGER = LoggerFactory.getLogger(PrintSchedulingApp.class);

    static final String EXAMPLE_REQUEST = "/example_request.json";

    public static void main(String[] args) throws Exception {
        ObjectMapper mapper = new ObjectMapper();

        ScheduleRequest request;
        String input = args == null || args.length == 0 || args[0] == null ? "" : args[0].trim();
        if (input.isEmpty()) {
            LOGGER.info("No request given, using the bundled {}", EXAMPLE_REQUEST);
            request = readExample(mapper);
        } else if ("-".equals(input)) {
            try (InputStream in = System.in) {
                request = mapper.readValue(in, ScheduleRequest.class);
            }
        } else {
            Path path = Path.of(input);
            if (!Files.exists(path) || Files.isDirectory(path)) {
                System.err.println("请求文件不存在或是目录：" + path.toAbsolutePath());
                System.exit(2);
                return;
            }
            request = mapper.readValue(new File(path.toString()), ScheduleRequest.class);
        }

        ScheduleResponse response;
        try {
            response = new PrintSchedulingService().solve(request);
        } catch (SchedulingException e) {
            LOGGER.error("Scheduling failed: {}", e.getMessage());
            System.exit(1);
            return;
        }
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(response);
        System.out.println(json);
    }

    static ScheduleRequest readExample(ObjectMapper mapper) throws IOException {
        try (InputStream in = PrintSchedulingApp.class.getResourceAsStream(EXAMPLE_REQUEST)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + EXAMPLE_REQUEST);
            }
            return mapper.readValue(in, ScheduleRequest.class);
        }
    }
}
