package com.iimsoft.printscheduler.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.iimsoft.printscheduler.exception.SchedulingConfigurationException;

/**
 * 一次排程会话内只读的打印机清单。
 *
 * 机架按首次出现的顺序编成 0,1,2... 的整数编号，供需要整数变量的求解器使用。
 */
public class PrinterRoster {

    private final List<Printer> printers;
    private final Map<Long, Printer> printerById;
    private final Map<String, Integer> rackIdByRack;

    public PrinterRoster(List<Printer> printers) {
        if (printers == null || printers.isEmpty()) {
            throw new SchedulingConfigurationException("Printer roster must contain at least one printer");
        }
        Map<Long, Printer> byId = new LinkedHashMap<>();
        Map<String, Integer> rackIds = new LinkedHashMap<>();
        for (Printer printer : printers) {
            if (byId.put(printer.getId(), printer) != null) {
                throw new SchedulingConfigurationException("Duplicate printer id in roster: " + printer.getId());
            }
            rackIds.putIfAbsent(printer.getRack().strip(), rackIds.size());
        }
        this.printers = List.copyOf(printers);
        this.printerById = Collections.unmodifiableMap(byId);
        this.rackIdByRack = Collections.unmodifiableMap(rackIds);
    }

    public List<Printer> getPrinters() {
        return printers;
    }

    public int size() {
        return printers.size();
    }

    public Printer getPrinter(long printerId) {
        Printer printer = printerById.get(printerId);
        if (printer == null) {
            throw new IllegalArgumentException("Unknown printer id: " + printerId);
        }
        return printer;
    }

    public List<Printer> compatiblePrinters(PrintJob job) {
        List<Printer> compatible = new ArrayList<>();
        for (Printer printer : printers) {
            if (printer.supports(job)) {
                compatible.add(printer);
            }
        }
        return compatible;
    }

    public boolean isRoutable(PrintJob job) {
        return printers.stream().anyMatch(p -> p.supports(job));
    }

    public int rackIdOf(Printer printer) {
        return rackIdByRack.get(printer.getRack().strip());
    }

    public List<Integer> getRackIds() {
        return new ArrayList<>(rackIdByRack.values());
    }

    /** 每个 (材料, 工艺) 组合可用的打印机数量；键为规范化后的组合。 */
    public Map<MaterialTechnology, Long> countByPairing() {
        return printers.stream()
                .collect(Collectors.groupingBy(p -> MaterialTechnology.of(p.getMaterial(), p.getTechnology()),
                        Collectors.counting()));
    }
}
