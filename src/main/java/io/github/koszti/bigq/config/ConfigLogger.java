package io.github.koszti.bigq.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

@Component
public class ConfigLogger
        implements CommandLineRunner
{
    private static final Logger log = LoggerFactory.getLogger(ConfigLogger.class);

    private final BigqProperties props;

    public ConfigLogger(BigqProperties props) {
        this.props = props;
    }

    @Override
    public void run(String... args)
    {
        log.info("BigQuery base URL   : {}", props.getBaseUrl());
        log.info("Project / dataset   : {} / {}", props.getProjectId(), props.getDatasetId());
        log.info("Credentials         : {}", describeCredentials());
        log.info("Legacy SQL          : {}", props.getUseLegacySql() == null ? "(server default)" : props.getUseLegacySql());
        log.info("Poll interval       : {}", props.getPollInterval());
        log.info("Connect/read timeout: {} / {}", props.getConnectTimeout(), props.getReadTimeout());
    }

    private String describeCredentials() {
        if (props.getCredentialsFile() != null) {
            return "key file " + props.getCredentialsFile();
        }
        return props.isApplicationDefaultCredentials() ? "application default" : "none";
    }
}
