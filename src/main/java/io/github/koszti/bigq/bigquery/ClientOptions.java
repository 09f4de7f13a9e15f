package io.github.koszti.bigq.bigquery;

import com.google.auth.oauth2.GoogleCredentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * How to reach BigQuery: endpoint, credentials and HTTP timeouts.
 * {@link #createBackend()} builds a {@link RestBigQueryBackend} from them.
 * <p>
 * Credentials are picked in this order: explicit {@link GoogleCredentials}, a service account key
 * file, application default credentials. With none of them set requests go out unauthenticated,
 * which is what local emulators expect.
 */
public final class ClientOptions implements BackendFactory
{
    private static final Logger log = LoggerFactory.getLogger(ClientOptions.class);

    public static final String DEFAULT_BASE_URL = "https://bigquery.googleapis.com/bigquery/v2";
    public static final String BIGQUERY_SCOPE = "https://www.googleapis.com/auth/bigquery";

    private final String baseUrl;
    private final GoogleCredentials credentials;
    private final Path credentialsFile;
    private final boolean applicationDefaultCredentials;
    private final Boolean useLegacySql;
    private final Duration connectTimeout;
    private final Duration readTimeout;
    private final RestClient.Builder restClientBuilder;

    private ClientOptions(Builder b) {
        this.baseUrl = Objects.requireNonNull(b.baseUrl, "baseUrl must not be null");
        this.credentials = b.credentials;
        this.credentialsFile = b.credentialsFile;
        this.applicationDefaultCredentials = b.applicationDefaultCredentials;
        this.useLegacySql = b.useLegacySql;
        this.connectTimeout = Objects.requireNonNull(b.connectTimeout, "connectTimeout must not be null");
        this.readTimeout = Objects.requireNonNull(b.readTimeout, "readTimeout must not be null");
        this.restClientBuilder = b.restClientBuilder;
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    @Override
    public BigQueryBackend createBackend() throws IOException {
        HttpClient httpClient = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(connectTimeout)
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(readTimeout);

        RestClient.Builder builder = restClientBuilder != null ? restClientBuilder.clone() : RestClient.builder();
        builder.baseUrl(baseUrl).requestFactory(requestFactory);

        GoogleCredentials resolved = resolveCredentials();
        if (resolved != null) {
            builder.requestInterceptor(new GoogleCredentialsInterceptor(resolved));
        } else {
            log.warn("BigQuery client for {} has no credentials, requests are sent unauthenticated", baseUrl);
        }

        return new RestBigQueryBackend(builder.build(), baseUrl, useLegacySql);
    }

    GoogleCredentials resolveCredentials() throws IOException {
        if (credentials != null) {
            log.debug("BigQuery client using provided credentials");
            return credentials;
        }
        if (credentialsFile != null) {
            log.debug("BigQuery client using service account key {}", credentialsFile);
            try (InputStream in = Files.newInputStream(credentialsFile)) {
                return GoogleCredentials.fromStream(in).createScoped(BIGQUERY_SCOPE);
            }
        }
        if (applicationDefaultCredentials) {
            log.debug("BigQuery client using application default credentials");
            return GoogleCredentials.getApplicationDefault().createScoped(BIGQUERY_SCOPE);
        }
        return null;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public Path getCredentialsFile() {
        return credentialsFile;
    }

    public boolean isApplicationDefaultCredentials() {
        return applicationDefaultCredentials;
    }

    public Boolean getUseLegacySql() {
        return useLegacySql;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }

    public static final class Builder {
        private String baseUrl = DEFAULT_BASE_URL;
        private GoogleCredentials credentials;
        private Path credentialsFile;
        private boolean applicationDefaultCredentials;
        private Boolean useLegacySql;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofMinutes(1);
        private RestClient.Builder restClientBuilder;

        private Builder() {
        }

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder credentials(GoogleCredentials credentials) {
            this.credentials = credentials;
            return this;
        }

        public Builder credentialsFile(Path credentialsFile) {
            this.credentialsFile = credentialsFile;
            return this;
        }

        public Builder applicationDefaultCredentials(boolean applicationDefaultCredentials) {
            this.applicationDefaultCredentials = applicationDefaultCredentials;
            return this;
        }

        /**
         * Null leaves the SQL dialect to BigQuery's default.
         */
        public Builder useLegacySql(Boolean useLegacySql) {
            this.useLegacySql = useLegacySql;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder readTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
            return this;
        }

        /**
         * Builder to start from, e.g. Spring Boot's auto-configured one. Each backend gets its own copy;
         * this builder is left untouched. Defaults to {@link RestClient#builder()}.
         */
        public Builder restClientBuilder(RestClient.Builder restClientBuilder) {
            this.restClientBuilder = restClientBuilder;
            return this;
        }

        public ClientOptions build() {
            return new ClientOptions(this);
        }
    }
}
