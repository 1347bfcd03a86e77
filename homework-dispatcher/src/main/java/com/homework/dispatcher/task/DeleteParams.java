package com.homework.dispatcher.task;

import lombok.Value;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * 删除作业的参数：待删除的作业代号集合。
 */
@Value
public class DeleteParams implements TaskParams {

    Set<String> codes;

    public DeleteParams(Collection<String> codes) {
        Set<String> copy = new LinkedHashSet<>();
        if (codes != null) {
            codes.stream().filter(Objects::nonNull).forEach(copy::add);
        }
        this.codes = Collections.unmodifiableSet(copy);
    }
}
