package com.deviceagents.tools;

/**
 * 工具执行时的消息出口，用于向调用方反馈进度。
 */
public interface ToolContext {
    void sendText(String content);
}
