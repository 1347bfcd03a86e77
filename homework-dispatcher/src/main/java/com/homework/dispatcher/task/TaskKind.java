package com.homework.dispatcher.task;

/**
 * 任务类型，封闭集合。每种类型由一个 {@code TaskHandler} 处理，并规定其参数类型。
 */
public enum TaskKind {

    LOAD("load", NoParams.class),
    SAVE("save", NoParams.class),
    ADD("add", AddHomeworkParams.class),
    REFRESH("refresh", NoParams.class),
    UPDATE_DERIVED_VIEWS("updateDerivedViews", NoParams.class),
    QUERY("query", QueryParams.class),
    DELETE("delete", DeleteParams.class),
    CLEAR_ALL("clearAll", NoParams.class),
    MARK_COMPLETED("markCompleted", MarkCompletedParams.class);

    private final String value;
    private final Class<? extends TaskParams> paramsType;

    TaskKind(String value, Class<? extends TaskParams> paramsType) {
        this.value = value;
        this.paramsType = paramsType;
    }

    public String getValue() {
        return value;
    }

    public Class<? extends TaskParams> getParamsType() {
        return paramsType;
    }

    public boolean accepts(TaskParams params) {
        return paramsType.isInstance(params);
    }
}
