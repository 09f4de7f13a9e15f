package io.github.koszti.bigq.query;

/**
 * Project the queries run in and the dataset unqualified table names resolve against.
 * Validated by {@link QueryService} when the service is built.
 */
public record ServiceConfig(String projectId, String datasetId) {}
