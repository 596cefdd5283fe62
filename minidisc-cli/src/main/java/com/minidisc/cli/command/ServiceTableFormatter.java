/**
 * 服务列表表格输出
 *
 * @date 2026/10/17
 */
package com.minidisc.cli.command;

import com.minidisc.common.model.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 每个服务一行：名称、地址、标签，列之间至少 3 个空格对齐
 */
public final class ServiceTableFormatter {

    private static final int PADDING = 3;

    private ServiceTableFormatter() {
    }

    public static String format(List<Service> services) {
        List<String[]> rows = new ArrayList<>(services.size());
        int[] widths = new int[3];
        for (Service service : services) {
            String[] row = {
                "* " + service.getName(),
                service.getAddrPort().toString(),
                formatLabels(service.getLabels())
            };
            for (int i = 0; i < row.length; i++) {
                widths[i] = Math.max(widths[i], row[i].length());
            }
            rows.add(row);
        }

        StringBuilder sb = new StringBuilder();
        for (String[] row : rows) {
            for (int i = 0; i < row.length - 1; i++) {
                sb.append(row[i]);
                sb.append(" ".repeat(widths[i] - row[i].length() + PADDING));
            }
            sb.append(row[row.length - 1]).append('\n');
        }
        return sb.toString();
    }

    /**
     * 标签按 key=value 排序输出，例如 { env=prod, zone=a }，没有标签时输出 {}
     */
    public static String formatLabels(Map<String, String> labels) {
        if (labels.isEmpty()) {
            return "{}";
        }
        return labels.entrySet().stream()
            .map(e -> e.getKey() + "=" + e.getValue())
            .sorted()
            .collect(Collectors.joining(", ", "{ ", " }"));
    }
}
