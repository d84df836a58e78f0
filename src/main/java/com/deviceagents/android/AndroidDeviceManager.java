package com.deviceagents.android;

import com.deviceagents.config.AppConfig;
import com.deviceagents.device.LaunchableApp;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * adb 命令封装：设备发现、启动器应用枚举、安装检查、启动与深链接。
 * <p>
 * 输出解析放在静态方法里，便于脱离设备测试。
 * </p>
 */
public class AndroidDeviceManager {
    private static final Logger logger = LogManager.getLogger(AndroidDeviceManager.class);

    static final String LAUNCHER_QUERY =
            "cmd package query-activities --brief -a android.intent.action.MAIN -c android.intent.category.LAUNCHER";
    static final String LIST_PACKAGES = "pm list packages -3";

    private static final List<String> GENERIC_SEGMENTS = Arrays.asList(
            "com", "org", "net", "android", "app", "apps", "mobile", "google", "client");

    private final String adbPath;

    public AndroidDeviceManager() {
        this(AppConfig.getInstance().getAdbPath());
    }

    public AndroidDeviceManager(String adbPath) {
        this.adbPath = adbPath;
    }

    public List<String> getDevices() throws IOException {
        return parseDevices(run(Arrays.asList(adbPath, "devices")));
    }

    public String executeShell(String serial, String command) throws IOException {
        List<String> cmd = new ArrayList<>();
        cmd.add(adbPath);
        if (serial != null && !serial.isEmpty()) {
            cmd.add("-s");
            cmd.add(serial);
        }
        cmd.add("shell");
        // "am", "pm", "cmd" and "monkey" arguments never contain spaces; URIs arrive percent-encoded
        cmd.addAll(Arrays.asList(command.trim().split("\\s+")));
        return run(cmd);
    }

    /**
     * Launcher apps sorted by label. Labels are derived from package names because adb
     * cannot read application labels without extra tooling.
     */
    public List<LaunchableApp> listLaunchableApps(String serial) throws IOException {
        List<String> packages = parseLauncherPackages(executeShell(serial, LAUNCHER_QUERY));
        if (packages.isEmpty()) {
            logger.debug("Launcher query returned nothing, falling back to package list");
            packages = parsePackageList(executeShell(serial, LIST_PACKAGES));
        }
        Map<String, LaunchableApp> byPackage = new LinkedHashMap<>();
        for (String pkg : packages) {
            byPackage.putIfAbsent(pkg, new LaunchableApp(pkg, labelFromPackage(pkg)));
        }
        List<LaunchableApp> apps = new ArrayList<>(byPackage.values());
        apps.sort(Comparator.comparing(app -> app.getAppName().toLowerCase(Locale.ROOT)));
        return apps;
    }

    public boolean isInstalled(String serial, String packageName) throws IOException {
        return executeShell(serial, "pm path " + packageName).trim().startsWith("package:");
    }

    public boolean launch(String serial, String packageName) throws IOException {
        String output = executeShell(serial, "monkey -p " + packageName + " -c android.intent.category.LAUNCHER 1");
        return isMonkeySuccess(output);
    }

    public boolean openUri(String serial, String uri, String packageName) throws IOException {
        return isAmStartSuccess(executeShell(serial, viewIntentCommand(uri, packageName)));
    }

    /** The URI is single-quoted for the device shell; quotes inside it are percent-encoded. */
    static String viewIntentCommand(String uri, String packageName) {
        return "am start -W -a android.intent.action.VIEW -d '" + uri.replace("'", "%27") + "' -p " + packageName;
    }

    static boolean isAmStartSuccess(String output) {
        return output.contains("Starting:") && !output.contains("Error:");
    }

    static List<String> parseDevices(String output) {
        List<String> devices = new ArrayList<>();
        for (String raw : output.split("\\R")) {
            String line = raw.trim();
            if (line.startsWith("List of devices") || line.isEmpty()) {
                continue;
            }
            String[] parts = line.split("\\s+");
            if (parts.length >= 2 && "device".equals(parts[1])) {
                devices.add(parts[0]);
            }
        }
        return devices;
    }

    /** Parses {@code package/activity} lines of the brief activity query. */
    static List<String> parseLauncherPackages(String output) {
        List<String> packages = new ArrayList<>();
        for (String raw : output.split("\\R")) {
            String line = raw.trim();
            int slash = line.indexOf('/');
            if (slash <= 0 || line.contains(" ")) {
                continue;
            }
            String pkg = line.substring(0, slash);
            if (!packages.contains(pkg)) {
                packages.add(pkg);
            }
        }
        return packages;
    }

    static List<String> parsePackageList(String output) {
        List<String> packages = new ArrayList<>();
        for (String raw : output.split("\\R")) {
            String line = raw.trim();
            if (line.startsWith("package:")) {
                packages.add(line.substring("package:".length()).trim());
            }
        }
        return packages;
    }

    static boolean isMonkeySuccess(String output) {
        return output.contains("Events injected: 1") && !output.contains("No activities found");
    }

    /**
     * Best readable segment of a package name, capitalised: {@code com.google.android.youtube}
     * becomes "Youtube", {@code com.whatsapp.w4b} becomes "Whatsapp W4b".
     */
    static String labelFromPackage(String packageName) {
        String[] segments = packageName.split("\\.");
        List<String> meaningful = new ArrayList<>();
        for (String segment : segments) {
            if (!segment.isEmpty() && !GENERIC_SEGMENTS.contains(segment.toLowerCase(Locale.ROOT))) {
                meaningful.add(segment);
            }
        }
        if (meaningful.isEmpty()) {
            return packageName;
        }
        // keep at most the first two meaningful segments
        StringBuilder label = new StringBuilder();
        for (int i = 0; i < meaningful.size() && i < 2; i++) {
            if (i > 0) label.append(' ');
            String s = meaningful.get(i);
            label.append(Character.toUpperCase(s.charAt(0))).append(s.substring(1));
        }
        return label.toString();
    }

    private String run(List<String> cmd) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(cmd);
        pb.redirectErrorStream(true);
        Process process = pb.start();

        StringBuilder output = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                output.append(line).append("\n");
            }
        }
        return output.toString();
    }
}
