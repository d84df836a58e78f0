package com.deviceagents.tools.context;

import com.deviceagents.tools.ToolContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * 控制台上下文。stdout 留给 JSON-RPC 响应，所以进度消息只写日志。
 */
public class ConsoleToolContext implements ToolContext {
    private static final Logger logger = LogManager.getLogger(ConsoleToolContext.class);

    @Override
    public void sendText(String content) {
        logger.info("[Tool] {}", content);
    }
}
