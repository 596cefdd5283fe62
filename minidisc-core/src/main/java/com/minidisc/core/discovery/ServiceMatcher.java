package com.minidisc.core.discovery;

import com.minidisc.common.model.Service;

import java.util.Map;

/**
 * 名称与标签匹配
 * 只比较请求中的标签：env=prod 匹配 [env=prod] 和 [env=prod, foo=bar]，不匹配 [env=staging]
 */
public final class ServiceMatcher {

    private ServiceMatcher() {
    }

    public static boolean matches(Service service, String name, Map<String, String> labelFilter) {
        if (!service.getName().equals(name)) {
            return false;
        }
        if (labelFilter == null) {
            return true;
        }
        Map<String, String> labels = service.getLabels();
        for (Map.Entry<String, String> required : labelFilter.entrySet()) {
            String actual = labels.get(required.getKey());
            if (actual == null || !actual.equals(required.getValue())) {
                return false;
            }
        }
        return true;
    }
}
