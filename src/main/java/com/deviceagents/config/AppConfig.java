package com.deviceagents.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

public class AppConfig {
    private static final Logger logger = LogManager.getLogger(AppConfig.class);
    private static final AppConfig INSTANCE = new AppConfig();
    private final Properties properties = new Properties();

    // Configuration Keys
    public static final String KEY_APPIUM_SERVER_URL = "appium.server.url";
    public static final String KEY_DEVICE_SERIAL = "device.serial";
    public static final String KEY_ADB_PATH = "adb.path";
    public static final String KEY_SNAPSHOT_MAX_NODES = "snapshot.max.nodes";
    public static final String KEY_FOREGROUND_TIMEOUT_MS = "foreground.timeout.ms";
    public static final String KEY_FOREGROUND_POLL_MS = "foreground.poll.ms";
    public static final String KEY_GESTURE_TIMEOUT_MS = "gesture.timeout.ms";

    // Default Values
    public static final String DEFAULT_APPIUM_SERVER_URL = "http://127.0.0.1:4723";
    public static final String DEFAULT_ADB_PATH = "adb";
    public static final int DEFAULT_SNAPSHOT_MAX_NODES = 120;
    public static final long DEFAULT_FOREGROUND_TIMEOUT_MS = 10_000L;
    public static final long DEFAULT_FOREGROUND_POLL_MS = 280L;
    public static final long DEFAULT_GESTURE_TIMEOUT_MS = 3_000L;

    private AppConfig() {
        loadProperties();
    }

    public static AppConfig getInstance() {
        return INSTANCE;
    }

    private void loadProperties() {
        try (InputStream input = AppConfig.class.getClassLoader().getResourceAsStream("device-agents.cfg")) {
            if (input == null) {
                logger.warn("Unable to find device-agents.cfg, using defaults");
                return;
            }
            properties.load(input);
        } catch (IOException ex) {
            logger.error("Error loading configuration: {}", ex.getMessage(), ex);
        }
    }

    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public String getAppiumServerUrl() {
        return getProperty(KEY_APPIUM_SERVER_URL, DEFAULT_APPIUM_SERVER_URL);
    }

    public String getDeviceSerial() {
        String serial = getProperty(KEY_DEVICE_SERIAL);
        return serial == null || serial.trim().isEmpty() ? null : serial.trim();
    }

    public String getAdbPath() {
        return getProperty(KEY_ADB_PATH, DEFAULT_ADB_PATH);
    }

    public int getSnapshotMaxNodes() {
        return (int) getLong(KEY_SNAPSHOT_MAX_NODES, DEFAULT_SNAPSHOT_MAX_NODES);
    }

    public long getForegroundTimeoutMs() {
        return getLong(KEY_FOREGROUND_TIMEOUT_MS, DEFAULT_FOREGROUND_TIMEOUT_MS);
    }

    public long getForegroundPollMs() {
        return getLong(KEY_FOREGROUND_POLL_MS, DEFAULT_FOREGROUND_POLL_MS);
    }

    public long getGestureTimeoutMs() {
        return getLong(KEY_GESTURE_TIMEOUT_MS, DEFAULT_GESTURE_TIMEOUT_MS);
    }

    private long getLong(String key, long defaultValue) {
        String value = getProperty(key);
        if (value != null && !value.trim().isEmpty()) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid {} format, using default: {}", key, defaultValue);
            }
        }
        return defaultValue;
    }
}
