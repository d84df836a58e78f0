package com.deviceagents.screen;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A recorded observation of screen state at a named step of a flow.
 */
public final class ScreenCheckpoint {

    private final String step;
    private final String expectedPackage;
    private final String actualPackage;
    private final boolean matchedExpectedPackage;
    private final List<String> highlights;

    public ScreenCheckpoint(String step, String expectedPackage, String actualPackage, List<String> highlights) {
        this.step = step;
        this.expectedPackage = expectedPackage == null ? "" : expectedPackage;
        this.actualPackage = actualPackage == null ? "" : actualPackage;
        this.matchedExpectedPackage = !this.actualPackage.isEmpty() && this.actualPackage.equals(this.expectedPackage);
        this.highlights = Collections.unmodifiableList(new ArrayList<>(highlights));
    }

    public String getStep() {
        return step;
    }

    public String getExpectedPackage() {
        return expectedPackage;
    }

    public String getActualPackage() {
        return actualPackage;
    }

    public boolean isMatchedExpectedPackage() {
        return matchedExpectedPackage;
    }

    public List<String> getHighlights() {
        return highlights;
    }

    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("step", step);
        json.put("expected_package", expectedPackage);
        json.put("actual_package", actualPackage);
        json.put("matched_expected_package", matchedExpectedPackage);
        json.put("highlights", new JSONArray(highlights));
        return json;
    }

    public static JSONArray toJsonArray(List<ScreenCheckpoint> checkpoints) {
        JSONArray array = new JSONArray();
        for (ScreenCheckpoint checkpoint : checkpoints) {
            array.add(checkpoint.toJson());
        }
        return array;
    }
}
