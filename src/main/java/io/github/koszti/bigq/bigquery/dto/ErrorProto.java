package io.github.koszti.bigq.bigquery.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ErrorProto
{
    private String reason;
    private String location;
    private String message;

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    /**
     * Message to surface to callers; falls back to the reason when BigQuery sent no message.
     */
    public String describe() {
        if (message != null && !message.isBlank()) {
            return message;
        }
        if (reason != null && !reason.isBlank()) {
            return reason;
        }
        return "(no error message)";
    }
}
