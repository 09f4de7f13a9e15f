package io.github.koszti.bigq.query;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "bigq", name = "smoke-test", havingValue = "true")
public class QuerySmokeTestRunner
        implements CommandLineRunner
{
    private static final Logger log = LoggerFactory.getLogger(QuerySmokeTestRunner.class);

    private final QueryService queryService;

    public QuerySmokeTestRunner(QueryService queryService) {
        this.queryService = queryService;
    }

    @Override
    public void run(String... args) {
        try {
            QueryCursor cursor = queryService.query("SELECT 1");
            int rows = 0;
            while (cursor.hasNext()) {
                cursor.next();
                rows++;
            }
            log.info("BigQuery smoke test OK. jobId={}, rows={}", cursor.getJobId(), rows);
        } catch (Exception e) {
            log.warn("BigQuery smoke test failed (check project, dataset and credentials): {}", e.toString());
        }
    }
}
