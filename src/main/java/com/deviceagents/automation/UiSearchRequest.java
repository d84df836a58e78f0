package com.deviceagents.automation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable parameters of one in-app search. Built with {@link #builder(String, String)}.
 */
public final class UiSearchRequest {

    private final String query;
    private final String expectedPackage;
    private final List<String> searchTriggerHints;
    private final List<String> searchInputIdHints;
    private final List<String> dismissHints;
    private final List<String> submitHints;
    private final boolean closePopups;
    private final boolean submitSearch;
    private final long settleDelayMs;
    private final long pollDelayMs;
    private final int maxAttempts;

    private UiSearchRequest(Builder builder) {
        this.query = builder.query;
        this.expectedPackage = builder.expectedPackage;
        this.searchTriggerHints = copy(builder.searchTriggerHints);
        this.searchInputIdHints = copy(builder.searchInputIdHints);
        this.dismissHints = copy(builder.dismissHints);
        this.submitHints = copy(builder.submitHints);
        this.closePopups = builder.closePopups;
        this.submitSearch = builder.submitSearch;
        this.settleDelayMs = builder.settleDelayMs;
        this.pollDelayMs = builder.pollDelayMs;
        this.maxAttempts = builder.maxAttempts;
    }

    private static List<String> copy(List<String> values) {
        return Collections.unmodifiableList(new ArrayList<>(values));
    }

    public static Builder builder(String query, String expectedPackage) {
        return new Builder(query, expectedPackage);
    }

    public String getQuery() {
        return query;
    }

    public String getExpectedPackage() {
        return expectedPackage;
    }

    public List<String> getSearchTriggerHints() {
        return searchTriggerHints;
    }

    public List<String> getSearchInputIdHints() {
        return searchInputIdHints;
    }

    public List<String> getDismissHints() {
        return dismissHints;
    }

    public List<String> getSubmitHints() {
        return submitHints;
    }

    public boolean isClosePopups() {
        return closePopups;
    }

    public boolean isSubmitSearch() {
        return submitSearch;
    }

    public long getSettleDelayMs() {
        return settleDelayMs;
    }

    public long getPollDelayMs() {
        return pollDelayMs;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public static final class Builder {
        private final String query;
        private final String expectedPackage;
        private List<String> searchTriggerHints = UiSearchDefaults.TRIGGER_HINTS;
        private List<String> searchInputIdHints = UiSearchDefaults.INPUT_ID_HINTS;
        private List<String> dismissHints = UiSearchDefaults.DISMISS_HINTS;
        private List<String> submitHints = UiSearchDefaults.SUBMIT_HINTS;
        private boolean closePopups;
        private boolean submitSearch;
        private long settleDelayMs = UiSearchDefaults.SETTLE_DELAY_MS;
        private long pollDelayMs = UiSearchDefaults.POLL_DELAY_MS;
        private int maxAttempts = UiSearchDefaults.MAX_ATTEMPTS;

        private Builder(String query, String expectedPackage) {
            this.query = query == null ? "" : query;
            this.expectedPackage = expectedPackage == null ? "" : expectedPackage;
        }

        public Builder searchTriggerHints(List<String> hints) {
            if (hints != null && !hints.isEmpty()) this.searchTriggerHints = hints;
            return this;
        }

        public Builder searchInputIdHints(List<String> hints) {
            if (hints != null && !hints.isEmpty()) this.searchInputIdHints = hints;
            return this;
        }

        public Builder dismissHints(List<String> hints) {
            if (hints != null && !hints.isEmpty()) this.dismissHints = hints;
            return this;
        }

        public Builder submitHints(List<String> hints) {
            if (hints != null && !hints.isEmpty()) this.submitHints = hints;
            return this;
        }

        public Builder closePopups(boolean closePopups) {
            this.closePopups = closePopups;
            return this;
        }

        public Builder submitSearch(boolean submitSearch) {
            this.submitSearch = submitSearch;
            return this;
        }

        public Builder settleDelayMs(long settleDelayMs) {
            this.settleDelayMs = settleDelayMs;
            return this;
        }

        public Builder pollDelayMs(long pollDelayMs) {
            this.pollDelayMs = pollDelayMs;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public UiSearchRequest build() {
            return new UiSearchRequest(this);
        }
    }
}
