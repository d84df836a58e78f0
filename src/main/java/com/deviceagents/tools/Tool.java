package com.deviceagents.tools;

import com.alibaba.fastjson2.JSONObject;

/**
 * 设备自动化工具
 * <p>
 * 每个工具接收 JSON 参数，返回 JSON 文本结果（至少包含 success 字段，失败时带 error）。
 * 执行过程中的进度提示通过 {@link ToolContext} 发出。
 * </p>
 */
public interface Tool {
    String getName();

    String getDescription();

    /** JSON Schema of the arguments object, advertised by tools/list. */
    default JSONObject getInputSchema() {
        return ToolSchema.object().build();
    }

    String execute(JSONObject params, ToolContext context);
}
