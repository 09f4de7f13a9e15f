package io.github.koszti.bigq.config;

import io.github.koszti.bigq.bigquery.BigQueryBackend;
import io.github.koszti.bigq.bigquery.ClientOptions;
import io.github.koszti.bigq.query.JobPoller;
import io.github.koszti.bigq.query.QueryService;
import io.github.koszti.bigq.query.ServiceConfig;
import io.github.koszti.bigq.query.exception.ClientInitException;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

import java.io.IOException;

@Configuration
public class BigQueryClientConfig
{
    @Bean
    public ClientOptions bigQueryClientOptions(RestClient.Builder builder, BigqProperties props) {
        return ClientOptions.newBuilder()
                .baseUrl(props.getBaseUrl())
                .credentialsFile(props.getCredentialsFile())
                .applicationDefaultCredentials(props.isApplicationDefaultCredentials())
                .useLegacySql(props.getUseLegacySql())
                .connectTimeout(props.getConnectTimeout())
                .readTimeout(props.getReadTimeout())
                .restClientBuilder(builder)
                .build();
    }

    /**
     * One backend shared by the service and anything else that needs raw BigQuery access.
     */
    @Bean
    public BigQueryBackend bigQueryBackend(ClientOptions options) {
        try {
            return options.createBackend();
        } catch (IOException e) {
            throw new ClientInitException("Unable to create BigQuery client for " + options.getBaseUrl(), e);
        }
    }

    @Bean
    public QueryService queryService(BigQueryBackend backend, BigqProperties props) {
        ServiceConfig config = new ServiceConfig(props.getProjectId(), props.getDatasetId());
        JobPoller poller = new JobPoller(backend, props.getPollInterval(), JobPoller.Sleeper.THREAD);
        return new QueryService(backend, config, poller);
    }
}
