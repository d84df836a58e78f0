package com.deviceagents.server;

import com.deviceagents.android.AppiumDeviceBridge;
import com.deviceagents.config.AppConfig;
import com.deviceagents.device.DeviceSession;
import com.deviceagents.tools.ToolContext;
import com.deviceagents.tools.ToolManager;
import com.deviceagents.tools.context.ConsoleToolContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Scanner;

/**
 * stdio 上的 JSON-RPC 服务入口
 * <p>
 * 每行一个请求：以 "{" 开头的行按 JSON-RPC 处理，响应写回 stdout；
 * 其余行按 "tool_name key=value" 形式的直接命令执行，结果经 ToolContext 输出到日志。
 * 输入 exit 或 stdin 关闭时退出并释放设备会话。
 * </p>
 */
public class DeviceAgentServer {
    private static final Logger logger = LogManager.getLogger(DeviceAgentServer.class);

    private final JsonRpcHandler handler;
    private final ToolContext context;

    public DeviceAgentServer(ToolContext context) {
        this.context = context;
        this.handler = new JsonRpcHandler(context);
    }

    /**
     * Reads requests until end of input or an exit line.
     */
    public void serve(InputStream in, PrintStream out) {
        Scanner scanner = new Scanner(in, StandardCharsets.UTF_8);
        while (scanner.hasNextLine()) {
            String line = scanner.nextLine().trim();
            if (line.isEmpty()) {
                continue;
            }
            if ("exit".equalsIgnoreCase(line)) {
                logger.info("Exit requested");
                break;
            }
            if (line.startsWith("{")) {
                String response = handler.handle(line);
                if (response != null) {
                    out.println(response);
                    out.flush();
                }
            } else if (!ToolManager.tryExecuteDirectCommand(line, context)) {
                logger.warn("Ignored input, expected JSON-RPC or 'tool key=value': {}", line);
            }
        }
    }

    public static void main(String[] args) throws Exception {
        AppConfig config = AppConfig.getInstance();
        AppiumDeviceBridge bridge = AppiumDeviceBridge.connect(config);
        DeviceSession session = new DeviceSession(bridge, bridge, bridge);
        Runtime.getRuntime().addShutdownHook(new Thread(session::close));

        ToolManager.registerTools(session);
        logger.info("deviceAgents ready on device {}", bridge.getSerial());

        try {
            new DeviceAgentServer(new ConsoleToolContext()).serve(System.in, System.out);
        } finally {
            session.close();
        }
    }
}
