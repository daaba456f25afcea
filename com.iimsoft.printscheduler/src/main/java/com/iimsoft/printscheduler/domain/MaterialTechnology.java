package com.iimsoft.printscheduler.domain;

import lombok.Data;

/**
 * (材料, 工艺) 组合，作为时间窗估算的分组键。构造时做规范化。
 */
@Data
public class MaterialTechnology {

    private final String material;
    private final String technology;

    public static MaterialTechnology of(String material, String technology) {
        return new MaterialTechnology(Printer.normalize(material), Printer.normalize(technology));
    }

    @Override
    public String toString() {
        return technology + "/" + material;
    }
}
