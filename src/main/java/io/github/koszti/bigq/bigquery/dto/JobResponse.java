package io.github.koszti.bigq.bigquery.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Minimal view of BigQuery's job resource as returned by {@code jobs.get}.
 * Only the status is read.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class JobResponse
{
    private String id;
    private Status status;

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public Status getStatus() {
        return status;
    }

    public void setStatus(Status status) {
        this.status = status;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Status {
        private String state; // PENDING, RUNNING, DONE
        private ErrorProto errorResult;
        private List<ErrorProto> errors;

        public String getState() {
            return state;
        }

        public void setState(String state) {
            this.state = state;
        }

        public ErrorProto getErrorResult() {
            return errorResult;
        }

        public void setErrorResult(ErrorProto errorResult) {
            this.errorResult = errorResult;
        }

        public List<ErrorProto> getErrors() {
            return errors;
        }

        public void setErrors(List<ErrorProto> errors) {
            this.errors = errors;
        }
    }
}
