package io.github.koszti.bigq.bigquery;

import java.util.Locale;

public enum JobState
{
    RUNNING,
    DONE;

    /**
     * BigQuery reports PENDING, RUNNING or DONE; anything but DONE is still running.
     */
    public static JobState fromApi(String state) {
        if (state != null && "DONE".equals(state.toUpperCase(Locale.ROOT))) {
            return DONE;
        }
        return RUNNING;
    }
}
