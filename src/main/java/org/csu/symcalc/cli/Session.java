package org.csu.symcalc.cli;

import lombok.Getter;
import lombok.Setter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一次交互会话的状态: 用户用 set 命令绑定的变量值。
 * 只在 shell 线程中使用。
 */
public class Session {

    private final Map<String, Double> variables = new LinkedHashMap<>();

    @Getter
    @Setter
    private boolean debug;

    public void setVariable(String name, double value) {
        variables.put(name, value);
    }

    public Map<String, Double> getVariables() {
        return Collections.unmodifiableMap(variables);
    }

    public void clearVariables() {
        variables.clear();
    }
}
