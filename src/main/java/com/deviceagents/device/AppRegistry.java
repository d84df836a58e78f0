package com.deviceagents.device;

import java.util.List;

public interface AppRegistry {

    /** Enumerated fresh on every call. */
    List<LaunchableApp> listLaunchableApps();

    boolean isInstalled(String packageName);

    boolean launch(String packageName);
}
