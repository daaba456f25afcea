package com.iimsoft.printscheduler.domain;

import java.util.Locale;
import java.util.Objects;

import org.optaplanner.core.api.domain.lookup.PlanningId;

/**
 * 打印机（资源）：固定的材料/工艺/机型能力，以及所在机架。
 */
public class Printer {

    @PlanningId
    private final Long id;
    private final String name;
    private final String material;
    private final String technology;
    private final String machineModel;
    private final String rack;

    public Printer(long id, String name, String material, String technology, String machineModel, String rack) {
        this.id = id;
        this.name = name == null ? "Printer " + id : name;
        this.material = Objects.requireNonNull(material, "material");
        this.technology = Objects.requireNonNull(technology, "technology");
        this.machineModel = Objects.requireNonNull(machineModel, "machineModel");
        this.rack = Objects.requireNonNull(rack, "rack");
    }

    /**
     * 材料、工艺、机型三者都一致（去空白、忽略大小写）才算兼容。
     */
    public boolean supports(PrintJob job) {
        return sameCapability(material, job.getMaterial())
                && sameCapability(technology, job.getTechnology())
                && sameCapability(machineModel, job.getMachineModel());
    }

    /** 是否支持某个 (材料, 工艺) 组合，忽略机型；用于时间窗估算。 */
    public boolean supportsPairing(String material, String technology) {
        return sameCapability(this.material, material) && sameCapability(this.technology, technology);
    }

    public static String normalize(String capability) {
        return capability == null ? "" : capability.strip().toUpperCase(Locale.ROOT);
    }

    private static boolean sameCapability(String a, String b) {
        return normalize(a).equals(normalize(b));
    }

    public Long getId() { return id; }
    public String getName() { return name; }
    public String getMaterial() { return material; }
    public String getTechnology() { return technology; }
    public String getMachineModel() { return machineModel; }
    public String getRack() { return rack; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Printer)) return false;
        return id.equals(((Printer) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return name + "#" + id + "(" + technology + " " + material + ", rack " + rack + ")";
    }
}
